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

import org.checkerframework.checker.index.qual.NonNegative;

import com.github.forumscraper.cache.Cache;
import com.github.forumscraper.cache.RemovalCause;

/**
 * Accumulates statistics during the operation of a {@link Cache} for presentation by
 * {@link Cache#stats}. The counters are updated synchronously by the cache's read and write paths,
 * so an implementation must be cheap and thread-safe.
 */
public interface StatsCounter {

  /**
   * Records cache hits. This should be called when a cache request returns a cached value.
   *
   * @param count the number of hits to record
   */
  void recordHits(@NonNegative int count);

  /**
   * Records cache misses. This should be called when a cache request finds no live entry, including
   * when the entry was present but had already expired.
   *
   * @param count the number of misses to record
   */
  void recordMisses(@NonNegative int count);

  /**
   * Records the successful computation of a value by a memoized function or a warm-up task.
   *
   * @param loadTime the number of nanoseconds spent computing the new value
   */
  void recordLoadSuccess(@NonNegative long loadTime);

  /**
   * Records the failed computation of a value by a memoized function or a warm-up task.
   *
   * @param loadTime the number of nanoseconds spent before the computation failed
   */
  void recordLoadFailure(@NonNegative long loadTime);

  /**
   * Records the eviction of an entry from the cache. This should only been called when an entry is
   * removed by the cache itself (expiration, a capacity ceiling or a group invalidation), and not as
   * a result of a manual {@link Cache#delete}.
   *
   * @param sizeBytes the estimated size of the evicted entry
   * @param cause the reason for which the entry was removed
   */
  void recordEviction(@NonNegative long sizeBytes, RemovalCause cause);

  /**
   * Returns a snapshot of this counter's values. The entry count, total size and top keys of the
   * returned instance are zero or empty; the cache fills them in from its current contents.
   *
   * @return a snapshot of this counter's values
   */
  CacheStats snapshot();

  /**
   * Returns an accumulator that does not record any cache events.
   *
   * @return an accumulator that does not record metrics
   */
  static StatsCounter disabledStatsCounter() {
    return DisabledStatsCounter.INSTANCE;
  }

  /**
   * Returns an accumulator that suppresses and logs any exception thrown by the delegate
   * {@code statsCounter}.
   *
   * @param statsCounter the accumulator to delegate to
   * @return an accumulator that suppresses and logs any exception thrown by the delegate
   */
  static StatsCounter guardedStatsCounter(StatsCounter statsCounter) {
    return (statsCounter instanceof GuardedStatsCounter)
        ? statsCounter
        : new GuardedStatsCounter(statsCounter);
  }
}
