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
/**
 * An in-process cache for expensive analytics computations. Entries expire after a time-to-live,
 * the least recently used are evicted beyond an entry count or estimated size ceiling, and groups
 * of entries can be invalidated through their dependency tags or by a key pattern.
 * <p>
 * Caches are created with {@link com.github.forumscraper.cache.CacheBuilder}, optionally from the
 * Typesafe Config backed {@link com.github.forumscraper.cache.CacheConfig}. Functions are wrapped
 * with {@link com.github.forumscraper.cache.Memoizer}, and keys for arbitrary parameters are
 * derived with {@link com.github.forumscraper.cache.CacheKeys}.
 */
@NullMarked
package com.github.forumscraper.cache;

import org.jspecify.annotations.NullMarked;
