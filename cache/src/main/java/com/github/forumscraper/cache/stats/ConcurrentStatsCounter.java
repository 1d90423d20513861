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

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

import com.github.forumscraper.cache.RemovalCause;

/**
 * A thread-safe {@link StatsCounter} backed by striped counters. Evictions are tallied per
 * {@link RemovalCause}, so the sweeper's expirations can be told apart from capacity evictions and
 * dependency or pattern invalidations.
 */
public final class ConcurrentStatsCounter implements StatsCounter {
  private final LongAdder hits = new LongAdder();
  private final LongAdder misses = new LongAdder();
  private final LongAdder loadSuccesses = new LongAdder();
  private final LongAdder loadFailures = new LongAdder();
  private final LongAdder loadNanos = new LongAdder();
  private final LongAdder evictedBytes = new LongAdder();
  private final Map<RemovalCause, LongAdder> evictions;

  public ConcurrentStatsCounter() {
    evictions = new EnumMap<>(RemovalCause.class);
    for (RemovalCause cause : RemovalCause.values()) {
      if (cause.wasEvicted()) {
        evictions.put(cause, new LongAdder());
      }
    }
  }

  @Override
  public void recordHits(int count) {
    hits.add(count);
  }

  @Override
  public void recordMisses(int count) {
    misses.add(count);
  }

  @Override
  public void recordLoadSuccess(long loadTime) {
    loadSuccesses.increment();
    loadNanos.add(loadTime);
  }

  @Override
  public void recordLoadFailure(long loadTime) {
    loadFailures.increment();
    loadNanos.add(loadTime);
  }

  /** Records an eviction. Removals made by the caller, such as a delete, are not counted. */
  @Override
  public void recordEviction(long sizeBytes, RemovalCause cause) {
    LongAdder counter = evictions.get(requireNonNull(cause));
    if (counter != null) {
      counter.increment();
      evictedBytes.add(sizeBytes);
    }
  }

  /**
   * Returns the number of entries the cache evicted for the given reason.
   *
   * @param cause the reason for the evictions
   * @return the number of evictions, or zero if the cause is not an eviction
   */
  public long evictionCount(RemovalCause cause) {
    LongAdder counter = evictions.get(requireNonNull(cause));
    return (counter == null) ? 0L : saturated(counter.sum());
  }

  @Override
  public CacheStats snapshot() {
    long evictionCount = 0L;
    for (LongAdder counter : evictions.values()) {
      evictionCount = saturatedAdd(evictionCount, counter.sum());
    }
    return CacheStats.of(saturated(hits.sum()), saturated(misses.sum()),
        saturated(loadSuccesses.sum()), saturated(loadFailures.sum()),
        saturated(loadNanos.sum()), evictionCount, saturated(evictedBytes.sum()));
  }

  /** An overflowed adder reads as negative. */
  private static long saturated(long value) {
    return (value < 0) ? Long.MAX_VALUE : value;
  }

  private static long saturatedAdd(long total, long value) {
    long sum = total + saturated(value);
    return (sum < 0) ? Long.MAX_VALUE : sum;
  }

  @Override
  public String toString() {
    return snapshot().toString();
  }
}
