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

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.Callable;

import org.jspecify.annotations.Nullable;

import com.google.common.collect.ImmutableSet;

/**
 * A value to precompute and store when warming up a cache.
 *
 * @param key the key to store the value under
 * @param compute computes the value; it runs on the cache's executor
 * @param ttl the time-to-live of the entry, or {@code null} for the cache default
 * @param dependencies the entry's dependency tags
 * @param <V> the type of the value
 */
public record WarmUpTask<V>(String key, Callable<? extends V> compute,
    @Nullable Duration ttl, ImmutableSet<String> dependencies) {

  public WarmUpTask {
    requireNonNull(key);
    requireNonNull(compute);
    requireNonNull(dependencies);
  }

  /** Returns a task that stores the computed value with the default time-to-live and no tags. */
  public static <V> WarmUpTask<V> of(String key, Callable<? extends V> compute) {
    return new WarmUpTask<>(key, compute, /* ttl= */ null, ImmutableSet.of());
  }

  /** Returns a copy of this task with the given time-to-live. */
  public WarmUpTask<V> withTtl(Duration ttl) {
    return new WarmUpTask<>(key, compute, requireNonNull(ttl), dependencies);
  }

  /** Returns a copy of this task with the given dependency tags. */
  public WarmUpTask<V> withDependencies(Set<String> dependencies) {
    return new WarmUpTask<>(key, compute, ttl, ImmutableSet.copyOf(dependencies));
  }
}
