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
package com.github.forumscraper.analytics;

import java.util.List;

import org.jspecify.annotations.Nullable;

/** Decides whether a computed analytics result may be cached. */
@FunctionalInterface
public interface CachePredicate {

  /**
   * Returns whether the result of the call may be cached.
   *
   * @param method the name of the service method, such as {@code getTrendingPosts}
   * @param args the arguments of the call
   * @param result the computed result
   */
  boolean shouldCache(String method, List<@Nullable Object> args, @Nullable Object result);

  /** Returns a predicate that caches every result. */
  static CachePredicate always() {
    return (method, args, result) -> true;
  }
}
