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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public final class CacheStatsTest {

  @ParameterizedTest
  @CsvSource({
      "-1,  0,  0,  0,  0,  0,  0",
      " 0, -1,  0,  0,  0,  0,  0",
      " 0,  0, -1,  0,  0,  0,  0",
      " 0,  0,  0, -1,  0,  0,  0",
      " 0,  0,  0,  0, -1,  0,  0",
      " 0,  0,  0,  0,  0, -1,  0",
      " 0,  0,  0,  0,  0,  0, -1",
  })
  public void invalid(long hitCount, long missCount, long loadSuccessCount,
      long loadFailureCount, long totalLoadTime, long evictionCount, long evictionSize) {
    assertThrows(IllegalArgumentException.class, () -> CacheStats.of(hitCount, missCount,
        loadSuccessCount, loadFailureCount, totalLoadTime, evictionCount, evictionSize));
  }

  @Test
  public void empty() {
    var stats = CacheStats.of(0, 0, 0, 0, 0, 0, 0);
    assertThat(stats).isEqualTo(CacheStats.empty());
    assertThat(stats.requestCount()).isEqualTo(0);
    assertThat(stats.hitRate()).isEqualTo(0.0);
    assertThat(stats.missRate()).isEqualTo(0.0);
    assertThat(stats.loadFailureRate()).isEqualTo(0.0);
    assertThat(stats.averageLoadPenalty()).isEqualTo(0.0);
    assertThat(stats.averageEntrySize()).isEqualTo(0.0);
    assertThat(stats.topKeys()).isEmpty();
    assertThat(stats.hashCode()).isEqualTo(CacheStats.empty().hashCode());
    assertThat(stats.toString()).isEqualTo(CacheStats.empty().toString());
  }

  @Test
  public void populated() {
    var stats = CacheStats.of(11, 13, 17, 19, 23, 27, 54);
    assertThat(stats.requestCount()).isEqualTo(24);
    assertThat(stats.hitCount()).isEqualTo(11);
    assertThat(stats.hitRate()).isEqualTo(11.0 / 24);
    assertThat(stats.missCount()).isEqualTo(13);
    assertThat(stats.missRate()).isEqualTo(13.0 / 24);
    assertThat(stats.loadCount()).isEqualTo(36);
    assertThat(stats.loadFailureRate()).isEqualTo(19.0 / 36);
    assertThat(stats.averageLoadPenalty()).isEqualTo(23.0 / 36);
    assertThat(stats.evictionCount()).isEqualTo(27);
    assertThat(stats.evictionSize()).isEqualTo(54);
    assertThat(stats).isEqualTo(CacheStats.of(11, 13, 17, 19, 23, 27, 54));
    assertThat(stats).isNotEqualTo(CacheStats.empty());
  }

  @Test
  public void withContents() {
    var topKeys = List.of(new KeyHits("b", 5), new KeyHits("a", 2));
    var stats = CacheStats.of(7, 3, 0, 0, 0, 0, 0).withContents(4, 100, topKeys);

    assertThat(stats.entryCount()).isEqualTo(4);
    assertThat(stats.totalSize()).isEqualTo(100);
    assertThat(stats.averageEntrySize()).isEqualTo(25.0);
    assertThat(stats.topKeys()).containsExactlyElementsIn(topKeys).inOrder();
    assertThat(stats.hitCount()).isEqualTo(7);
    assertThat(stats).isNotEqualTo(CacheStats.of(7, 3, 0, 0, 0, 0, 0));
  }

  @Test
  public void withContents_negative() {
    var stats = CacheStats.empty();
    assertThrows(IllegalArgumentException.class, () -> stats.withContents(-1, 0, List.of()));
    assertThrows(IllegalArgumentException.class, () -> stats.withContents(0, -1, List.of()));
  }

  @Test
  public void minus() {
    var one = CacheStats.of(11, 13, 17, 19, 23, 27, 54);
    var two = CacheStats.of(53, 47, 43, 41, 37, 31, 62).withContents(2, 10, List.of());

    var diff = two.minus(one);
    assertThat(diff.hitCount()).isEqualTo(42);
    assertThat(diff.missCount()).isEqualTo(34);
    assertThat(diff.loadSuccessCount()).isEqualTo(26);
    assertThat(diff.loadFailureCount()).isEqualTo(22);
    assertThat(diff.totalLoadTime()).isEqualTo(14);
    assertThat(diff.evictionCount()).isEqualTo(4);
    assertThat(diff.evictionSize()).isEqualTo(8);
    assertThat(diff.entryCount()).isEqualTo(2);
    assertThat(diff.totalSize()).isEqualTo(10);
    assertThat(one.minus(two)).isEqualTo(CacheStats.empty());
  }

  @Test
  public void underflow() {
    var max = CacheStats.of(Long.MAX_VALUE, Long.MAX_VALUE, Long.MAX_VALUE,
        Long.MAX_VALUE, Long.MAX_VALUE, Long.MAX_VALUE, Long.MAX_VALUE);
    assertThat(CacheStats.empty().minus(max)).isEqualTo(CacheStats.empty());
    assertThat(max.loadCount()).isEqualTo(Long.MAX_VALUE);
  }

  @Test
  public void keyHits_negative() {
    assertThrows(IllegalArgumentException.class, () -> new KeyHits("a", -1));
    assertThrows(NullPointerException.class, () -> new KeyHits(null, 1));
  }
}
