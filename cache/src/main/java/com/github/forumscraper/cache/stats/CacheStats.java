/*
 * Copyright 2026 Forum Scraper Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.forumscraper.cache.stats;

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.Objects;

import org.checkerframework.checker.index.qual.NonNegative;
import org.jspecify.annotations.Nullable;

import com.github.forumscraper.cache.Cache;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;

/**
 * Statistics about the performance and contents of a {@link Cache}.
 * <p>
 * Cache statistics are incremented according to the following rules:
 * <ul>
 *   <li>When a lookup encounters a live entry {@code hitCount} is incremented.
 *   <li>When a lookup finds no entry, or an entry whose time-to-live has passed, {@code missCount}
 *       is incremented.
 *   <li>When a memoized function or a warm-up task computes a value, {@code loadSuccessCount} or
 *       {@code loadFailureCount} is incremented and the time spent is added to
 *       {@code totalLoadTime}.
 *   <li>When an entry expires, is evicted by a capacity ceiling, or is removed by a dependency or
 *       pattern invalidation, {@code evictionCount} is incremented and its estimated size is added
 *       to {@code evictionSize}.
 *   <li>No stats are modified when an entry is deleted, replaced, or the cache is cleared.
 * </ul>
 * <p>
 * The {@code entryCount}, {@code totalSize} and {@code topKeys} figures are not counters; they
 * describe the cache's contents at the time the snapshot was taken.
 * <p>
 * This is a <em>value-based</em> class; use of identity-sensitive operations on instances of
 * {@code CacheStats} may have unpredictable results and should be avoided.
 */
@Immutable
public final class CacheStats {
  private static final CacheStats EMPTY_STATS = CacheStats.of(0L, 0L, 0L, 0L, 0L, 0L, 0L);

  private final long hitCount;
  private final long missCount;
  private final long loadSuccessCount;
  private final long loadFailureCount;
  private final long totalLoadTime;
  private final long evictionCount;
  private final long evictionSize;
  private final long entryCount;
  private final long totalSize;
  private final ImmutableList<KeyHits> topKeys;

  @SuppressWarnings("PMD.ExcessiveParameterList")
  private CacheStats(@NonNegative long hitCount, @NonNegative long missCount,
      @NonNegative long loadSuccessCount, @NonNegative long loadFailureCount,
      @NonNegative long totalLoadTime, @NonNegative long evictionCount,
      @NonNegative long evictionSize, @NonNegative long entryCount,
      @NonNegative long totalSize, ImmutableList<KeyHits> topKeys) {
    if ((hitCount < 0) || (missCount < 0) || (loadSuccessCount < 0) || (loadFailureCount < 0)
        || (totalLoadTime < 0) || (evictionCount < 0) || (evictionSize < 0)
        || (entryCount < 0) || (totalSize < 0)) {
      throw new IllegalArgumentException();
    }
    this.hitCount = hitCount;
    this.missCount = missCount;
    this.loadSuccessCount = loadSuccessCount;
    this.loadFailureCount = loadFailureCount;
    this.totalLoadTime = totalLoadTime;
    this.evictionCount = evictionCount;
    this.evictionSize = evictionSize;
    this.entryCount = entryCount;
    this.totalSize = totalSize;
    this.topKeys = requireNonNull(topKeys);
  }

  /**
   * Returns a {@code CacheStats} representing the specified counters and an empty cache.
   *
   * @param hitCount the number of cache hits
   * @param missCount the number of cache misses
   * @param loadSuccessCount the number of successful computations
   * @param loadFailureCount the number of failed computations
   * @param totalLoadTime the total computation time (success and failure)
   * @param evictionCount the number of entries evicted from the cache
   * @param evictionSize the sum of the estimated sizes of the evicted entries
   * @return a {@code CacheStats} representing the specified statistics
   */
  public static CacheStats of(@NonNegative long hitCount, @NonNegative long missCount,
      @NonNegative long loadSuccessCount, @NonNegative long loadFailureCount,
      @NonNegative long totalLoadTime, @NonNegative long evictionCount,
      @NonNegative long evictionSize) {
    return new CacheStats(hitCount, missCount, loadSuccessCount, loadFailureCount,
        totalLoadTime, evictionCount, evictionSize, 0L, 0L, ImmutableList.of());
  }

  /**
   * Returns a statistics instance where no cache events have been recorded.
   *
   * @return an empty statistics instance
   */
  public static CacheStats empty() {
    return EMPTY_STATS;
  }

  /**
   * Returns a copy of these counters describing a cache with the given contents.
   *
   * @param entryCount the number of live entries
   * @param totalSize the sum of the estimated sizes of the live entries
   * @param topKeys the most frequently hit keys, in descending order of hits
   * @return a statistics instance with the given contents
   */
  public CacheStats withContents(@NonNegative long entryCount,
      @NonNegative long totalSize, List<KeyHits> topKeys) {
    return new CacheStats(hitCount, missCount, loadSuccessCount, loadFailureCount, totalLoadTime,
        evictionCount, evictionSize, entryCount, totalSize, ImmutableList.copyOf(topKeys));
  }

  /**
   * Returns the number of times {@link Cache} lookup methods have returned either a cached or
   * uncached value. This is defined as {@code hitCount + missCount}.
   *
   * @return the {@code hitCount + missCount}
   */
  public @NonNegative long requestCount() {
    return saturatedAdd(hitCount, missCount);
  }

  /**
   * Returns the number of times {@link Cache} lookup methods have returned a cached value.
   *
   * @return the number of times {@link Cache} lookup methods have returned a cached value
   */
  public @NonNegative long hitCount() {
    return hitCount;
  }

  /**
   * Returns the ratio of cache requests which were hits. This is defined as
   * {@code hitCount / requestCount}, or {@code 0.0} when {@code requestCount == 0}.
   *
   * @return the ratio of cache requests which were hits
   */
  public @NonNegative double hitRate() {
    long requestCount = requestCount();
    return (requestCount == 0) ? 0.0 : (double) hitCount / requestCount;
  }

  /**
   * Returns the number of times {@link Cache} lookup methods found no live entry.
   *
   * @return the number of times {@link Cache} lookup methods have returned an absent value
   */
  public @NonNegative long missCount() {
    return missCount;
  }

  /**
   * Returns the ratio of cache requests which were misses. This is defined as
   * {@code missCount / requestCount}, or {@code 0.0} when {@code requestCount == 0}.
   *
   * @return the ratio of cache requests which were misses
   */
  public @NonNegative double missRate() {
    long requestCount = requestCount();
    return (requestCount == 0) ? 0.0 : (double) missCount / requestCount;
  }

  /**
   * Returns the total number of computations performed on behalf of the cache. This is defined as
   * {@code loadSuccessCount + loadFailureCount}.
   *
   * @return the {@code loadSuccessCount + loadFailureCount}
   */
  public @NonNegative long loadCount() {
    return saturatedAdd(loadSuccessCount, loadFailureCount);
  }

  /**
   * Returns the number of computations that completed successfully.
   *
   * @return the number of computations that completed successfully
   */
  public @NonNegative long loadSuccessCount() {
    return loadSuccessCount;
  }

  /**
   * Returns the number of computations that failed.
   *
   * @return the number of computations that failed
   */
  public @NonNegative long loadFailureCount() {
    return loadFailureCount;
  }

  /**
   * Returns the ratio of computations which failed. This is defined as
   * {@code loadFailureCount / loadCount}, or {@code 0.0} when {@code loadCount == 0}.
   *
   * @return the ratio of computations which failed
   */
  public @NonNegative double loadFailureRate() {
    long totalLoadCount = saturatedAdd(loadSuccessCount, loadFailureCount);
    return (totalLoadCount == 0) ? 0.0 : (double) loadFailureCount / totalLoadCount;
  }

  /**
   * Returns the total number of nanoseconds spent computing values.
   *
   * @return the total number of nanoseconds spent computing values
   */
  public @NonNegative long totalLoadTime() {
    return totalLoadTime;
  }

  /**
   * Returns the average number of nanoseconds spent computing a value. This is defined as
   * {@code totalLoadTime / loadCount}, or {@code 0.0} when {@code loadCount == 0}.
   *
   * @return the average time spent computing a value
   */
  public @NonNegative double averageLoadPenalty() {
    long totalLoadCount = saturatedAdd(loadSuccessCount, loadFailureCount);
    return (totalLoadCount == 0) ? 0.0 : (double) totalLoadTime / totalLoadCount;
  }

  /**
   * Returns the number of entries removed by the cache itself: expirations, capacity evictions and
   * group invalidations.
   *
   * @return the number of evictions
   */
  public @NonNegative long evictionCount() {
    return evictionCount;
  }

  /**
   * Returns the sum of the estimated sizes of the evicted entries.
   *
   * @return the sum of the estimated sizes of the evicted entries
   */
  public @NonNegative long evictionSize() {
    return evictionSize;
  }

  /**
   * Returns the number of live entries when the snapshot was taken.
   *
   * @return the number of entries
   */
  public @NonNegative long entryCount() {
    return entryCount;
  }

  /**
   * Returns the sum of the estimated sizes, in bytes, of the entries when the snapshot was taken.
   *
   * @return the total estimated size of the cache
   */
  public @NonNegative long totalSize() {
    return totalSize;
  }

  /**
   * Returns the average estimated entry size. This is defined as {@code totalSize / entryCount},
   * or {@code 0.0} when the cache is empty.
   *
   * @return the average estimated entry size
   */
  public @NonNegative double averageEntrySize() {
    return (entryCount == 0) ? 0.0 : (double) totalSize / entryCount;
  }

  /**
   * Returns the most frequently hit keys, in descending order of hits.
   *
   * @return the hottest keys
   */
  public ImmutableList<KeyHits> topKeys() {
    return topKeys;
  }

  /**
   * Returns a new {@code CacheStats} representing the difference between the counters of this
   * instance and {@code other}. Negative values, which aren't supported by {@code CacheStats}, will
   * be rounded up to zero. The contents are taken from this instance.
   *
   * @param other the statistics to subtract with
   * @return the difference between this instance and {@code other}
   */
  public CacheStats minus(CacheStats other) {
    return new CacheStats(
        Math.max(0L, saturatedSubtract(hitCount, other.hitCount)),
        Math.max(0L, saturatedSubtract(missCount, other.missCount)),
        Math.max(0L, saturatedSubtract(loadSuccessCount, other.loadSuccessCount)),
        Math.max(0L, saturatedSubtract(loadFailureCount, other.loadFailureCount)),
        Math.max(0L, saturatedSubtract(totalLoadTime, other.totalLoadTime)),
        Math.max(0L, saturatedSubtract(evictionCount, other.evictionCount)),
        Math.max(0L, saturatedSubtract(evictionSize, other.evictionSize)),
        entryCount, totalSize, topKeys);
  }

  /**
   * Returns the difference of {@code a} and {@code b} unless it would overflow or underflow in
   * which case {@code Long.MAX_VALUE} or {@code Long.MIN_VALUE} is returned, respectively.
   */
  @SuppressWarnings("ShortCircuitBoolean")
  private static long saturatedSubtract(long a, long b) {
    long naiveDifference = a - b;
    if ((a ^ b) >= 0 | (a ^ naiveDifference) >= 0) {
      return naiveDifference;
    }
    return Long.MAX_VALUE + ((naiveDifference >>> (Long.SIZE - 1)) ^ 1);
  }

  /**
   * Returns the sum of {@code a} and {@code b} unless it would overflow or underflow in which case
   * {@code Long.MAX_VALUE} or {@code Long.MIN_VALUE} is returned, respectively.
   */
  @SuppressWarnings("ShortCircuitBoolean")
  private static long saturatedAdd(long a, long b) {
    long naiveSum = a + b;
    if ((a ^ b) < 0 | (a ^ naiveSum) >= 0) {
      return naiveSum;
    }
    return Long.MAX_VALUE + ((naiveSum >>> (Long.SIZE - 1)) ^ 1);
  }

  @Override
  public int hashCode() {
    return Objects.hash(hitCount, missCount, loadSuccessCount, loadFailureCount,
        totalLoadTime, evictionCount, evictionSize, entryCount, totalSize, topKeys);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (o == this) {
      return true;
    } else if (!(o instanceof CacheStats)) {
      return false;
    }
    CacheStats other = (CacheStats) o;
    return hitCount == other.hitCount
        && missCount == other.missCount
        && loadSuccessCount == other.loadSuccessCount
        && loadFailureCount == other.loadFailureCount
        && totalLoadTime == other.totalLoadTime
        && evictionCount == other.evictionCount
        && evictionSize == other.evictionSize
        && entryCount == other.entryCount
        && totalSize == other.totalSize
        && topKeys.equals(other.topKeys);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{'
        + "hitCount=" + hitCount + ", "
        + "missCount=" + missCount + ", "
        + "loadSuccessCount=" + loadSuccessCount + ", "
        + "loadFailureCount=" + loadFailureCount + ", "
        + "totalLoadTime=" + totalLoadTime + ", "
        + "evictionCount=" + evictionCount + ", "
        + "evictionSize=" + evictionSize + ", "
        + "entryCount=" + entryCount + ", "
        + "totalSize=" + totalSize + ", "
        + "topKeys=" + topKeys
        + '}';
  }
}
