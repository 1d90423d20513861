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

import org.checkerframework.checker.index.qual.NonNegative;

import com.google.errorprone.annotations.Immutable;

/**
 * The number of hits recorded against a single live cache key.
 *
 * @param key the cache key
 * @param hits the number of successful reads of the key since it was last stored
 */
@Immutable
public record KeyHits(String key, @NonNegative long hits) {

  public KeyHits {
    requireNonNull(key);
    if (hits < 0) {
      throw new IllegalArgumentException("hits cannot be negative: " + hits);
    }
  }
}
