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
package com.github.forumscraper.cache;

import static com.google.common.truth.Truth.assertThat;

import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.common.testing.FakeTicker;

public final class LifecycleTest {
  private RecordingRemovalListener<Object> listener;
  private Cache<Object> cache;

  @BeforeEach
  public void setUp() {
    listener = new RecordingRemovalListener<>();
    cache = CacheBuilder.newBuilder()
        .scheduler(Scheduler.disabledScheduler())
        .executor(Runnable::run)
        .ticker(new FakeTicker()::read)
        .removalListener(listener)
        .recordStats()
        .build();
  }

  @Test
  public void destroy_removesEverything() {
    cache.set("a", 1, Set.of("tag"));
    cache.set("b", 2);

    cache.destroy();

    assertThat(cache.isDestroyed()).isTrue();
    assertThat(cache.keys()).isEmpty();
    assertThat(cache.dependencies()).isEmpty();
    assertThat(cache.estimatedSize()).isEqualTo(0);
    assertThat(listener.keys(RemovalCause.EXPLICIT)).containsExactly("a", "b");
  }

  @Test
  public void destroy_idempotent() {
    cache.set("a", 1);
    cache.destroy();
    cache.destroy();

    assertThat(cache.isDestroyed()).isTrue();
    assertThat(listener.notifications).hasSize(1);
  }

  @Test
  public void destroy_ignoresOperations() {
    cache.destroy();
    var before = cache.stats();

    cache.set("a", 1);
    assertThat(cache.setIfAbsent("b", 2, null, Set.of())).isNull();
    assertThat(cache.getIfPresent("a")).isNull();
    assertThat(cache.containsKey("b")).isFalse();
    assertThat(cache.delete("a")).isFalse();
    assertThat(cache.invalidateByDependency("tag")).isEqualTo(0);
    assertThat(cache.invalidateByPattern(".*")).isEqualTo(0);
    assertThat(cache.cleanUp()).isEqualTo(0);

    assertThat(cache.estimatedSize()).isEqualTo(0);
    assertThat(cache.stats().requestCount()).isEqualTo(before.requestCount());
    assertThat(listener.notifications).isEmpty();
  }

  @Test
  public void destroy_memoizeComputes() {
    cache.destroy();
    var calls = new int[1];
    var function = cache.memoize((Integer x) -> {
      calls[0]++;
      return x + 1;
    });

    assertThat(function.apply(1)).isEqualTo(2);
    assertThat(function.apply(1)).isEqualTo(2);
    assertThat(calls[0]).isEqualTo(2);
  }

  @Test
  public void string() {
    cache.set("a", 1);
    assertThat(cache.toString()).contains("entries=1");
    cache.destroy();
    assertThat(cache.toString()).contains("destroyed=true");
  }
}
