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

import static com.github.forumscraper.testing.LoggingEvents.logEvents;
import static com.google.common.truth.Truth.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;
import static org.slf4j.event.Level.WARN;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import com.github.forumscraper.cache.RemovalCause;
import com.github.forumscraper.testing.ConcurrentTestHarness;
import com.github.forumscraper.testing.LoggingEvents;

public final class StatsCounterTest {

  @BeforeEach
  public void reset() {
    LoggingEvents.clearLogEvents();
  }

  @Test
  public void disabled() {
    var counter = StatsCounter.disabledStatsCounter();
    counter.recordHits(1);
    counter.recordMisses(1);
    counter.recordEviction(1, RemovalCause.SIZE);
    counter.recordLoadSuccess(1);
    counter.recordLoadFailure(1);
    assertThat(counter.snapshot()).isEqualTo(CacheStats.empty());
    assertThat(counter.toString()).isEqualTo(CacheStats.empty().toString());
  }

  @Test
  public void enabled() {
    var counter = new ConcurrentStatsCounter();
    counter.recordHits(1);
    counter.recordMisses(1);
    counter.recordEviction(10, RemovalCause.EXPIRED);
    counter.recordLoadSuccess(1);
    counter.recordLoadFailure(1);
    var expected = CacheStats.of(1, 1, 1, 1, 2, 1, 10);
    assertThat(counter.snapshot()).isEqualTo(expected);
    assertThat(counter.toString()).isEqualTo(expected.toString());
  }

  @Test
  public void enabled_evictionsByCause() {
    var counter = new ConcurrentStatsCounter();
    counter.recordEviction(10, RemovalCause.EXPIRED);
    counter.recordEviction(20, RemovalCause.EXPIRED);
    counter.recordEviction(5, RemovalCause.SIZE);
    counter.recordEviction(7, RemovalCause.INVALIDATED);
    counter.recordEviction(100, RemovalCause.EXPLICIT);
    counter.recordEviction(100, RemovalCause.REPLACED);

    assertThat(counter.evictionCount(RemovalCause.EXPIRED)).isEqualTo(2);
    assertThat(counter.evictionCount(RemovalCause.SIZE)).isEqualTo(1);
    assertThat(counter.evictionCount(RemovalCause.INVALIDATED)).isEqualTo(1);
    assertThat(counter.evictionCount(RemovalCause.EXPLICIT)).isEqualTo(0);
    assertThat(counter.snapshot().evictionCount()).isEqualTo(4);
    assertThat(counter.snapshot().evictionSize()).isEqualTo(42);
  }

  @Test
  public void concurrent() {
    var counter = new ConcurrentStatsCounter();
    ConcurrentTestHarness.timeTasks(5, () -> {
      counter.recordHits(1);
      counter.recordMisses(1);
      counter.recordEviction(10, RemovalCause.INVALIDATED);
      counter.recordLoadSuccess(1);
      counter.recordLoadFailure(1);
    });
    assertThat(counter.snapshot()).isEqualTo(CacheStats.of(5, 5, 5, 5, 10, 5, 50));
  }

  @Test
  public void guarded_sameInstance() {
    var counter = StatsCounter.guardedStatsCounter(new ConcurrentStatsCounter());
    assertThat(StatsCounter.guardedStatsCounter(counter)).isSameInstanceAs(counter);
  }

  @Test
  public void guarded_exception() {
    var statsCounter = Mockito.mock(StatsCounter.class);
    when(statsCounter.snapshot()).thenThrow(new NullPointerException());
    doThrow(NullPointerException.class).when(statsCounter).recordHits(anyInt());
    doThrow(NullPointerException.class).when(statsCounter).recordMisses(anyInt());
    doThrow(NullPointerException.class).when(statsCounter).recordEviction(anyLong(), any());
    doThrow(NullPointerException.class).when(statsCounter).recordLoadSuccess(anyLong());
    doThrow(NullPointerException.class).when(statsCounter).recordLoadFailure(anyLong());

    var guarded = StatsCounter.guardedStatsCounter(statsCounter);
    guarded.recordHits(1);
    guarded.recordMisses(1);
    guarded.recordEviction(10, RemovalCause.SIZE);
    guarded.recordLoadSuccess(1);
    guarded.recordLoadFailure(1);
    assertThat(guarded.snapshot()).isEqualTo(CacheStats.empty());

    assertThat(logEvents()
        .withMessage("Exception thrown by stats counter")
        .withThrowable(NullPointerException.class)
        .withLevel(WARN))
        .hasSize(6);
  }
}
