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

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.regex.Pattern;

import org.checkerframework.checker.index.qual.NonNegative;
import org.jspecify.annotations.Nullable;

import com.github.forumscraper.cache.stats.CacheStats;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;

/**
 * A semi-persistent mapping from string keys to values. Entries expire after a time-to-live, the
 * least recently used entries are evicted when the cache exceeds its entry count or estimated size
 * ceiling, and groups of entries can be invalidated through the dependency tags they were stored
 * with or by a pattern over their keys.
 * <p>
 * A single cache may hold values of unrelated types, in which case it is a {@code Cache<Object>}.
 * A {@code null} value may be stored; {@link #getEntry} tells a cached {@code null} apart from an
 * absent key.
 * <p>
 * Implementations of this interface are expected to be thread-safe, and can be safely accessed by
 * multiple concurrent threads. No user supplied computation runs while the cache's lock is held.
 *
 * @param <V> the type of mapped values
 */
public interface Cache<V> {

  /**
   * Returns the value associated with the {@code key} in this cache, or {@code null} if there is
   * no live entry for the key. A hit marks the entry as the most recently used; an expired entry
   * is removed and counted as a miss.
   *
   * @param key the key whose associated value is to be returned
   * @return the value, which may be a cached {@code null}, or {@code null} if absent
   * @throws NullPointerException if the specified key is null
   */
  @Nullable
  V getIfPresent(String key);

  /**
   * Returns a snapshot of the live entry for the {@code key}, or {@code null} if there is none.
   * This has the same recency and statistics effects as {@link #getIfPresent}.
   *
   * @param key the key whose entry is to be returned
   * @return a snapshot of the entry, or {@code null} if absent
   * @throws NullPointerException if the specified key is null
   */
  @Nullable
  CacheEntry<V> getEntry(String key);

  /**
   * Returns if the cache holds a live entry for the {@code key}. This does not affect recency or
   * the statistics.
   */
  boolean containsKey(String key);

  /**
   * Associates the {@code value} with the {@code key} using the default time-to-live and no
   * dependency tags. Any prior entry for the key is replaced.
   *
   * @param key the key with which the specified value is to be associated
   * @param value value to be associated with the specified key, which may be {@code null}
   * @throws NullPointerException if the specified key is null
   */
  void set(String key, @Nullable V value);

  /**
   * Associates the {@code value} with the {@code key} for the given time-to-live.
   *
   * @param key the key with which the specified value is to be associated
   * @param value value to be associated with the specified key
   * @param ttl the time-to-live; a zero or negative duration stores an already expired entry
   */
  void set(String key, @Nullable V value, Duration ttl);

  /**
   * Associates the {@code value} with the {@code key} using the default time-to-live and the
   * given dependency tags.
   */
  void set(String key, @Nullable V value, Set<String> dependencies);

  /**
   * Associates the {@code value} with the {@code key}. The entry's estimated size is computed,
   * the prior entry for the key (if any) is replaced and its tags are dropped from the dependency
   * index, and then the least recently used entries are evicted until the cache is within its
   * ceilings. The new entry is the most recently used one, so it survives unless it alone exceeds
   * the entry count ceiling.
   *
   * @param key the key with which the specified value is to be associated
   * @param value value to be associated with the specified key, which may be {@code null}
   * @param ttl the time-to-live, or {@code null} for the default
   * @param dependencies the entry's dependency tags
   * @throws NullPointerException if the key or dependencies are null
   */
  void set(String key, @Nullable V value, @Nullable Duration ttl, Set<String> dependencies);

  /**
   * Associates the {@code value} with the {@code key} unless a live entry is present. The check
   * and the insertion happen atomically, and count as a hit or a miss like {@link #getEntry}.
   *
   * @return a snapshot of the live entry that prevented the insertion, or {@code null} if the
   *         value was stored
   */
  @CanIgnoreReturnValue
  @Nullable
  CacheEntry<V> setIfAbsent(String key, @Nullable V value,
      @Nullable Duration ttl, Set<String> dependencies);

  /**
   * Discards the entry for the {@code key}. An entry that is still stored after its time-to-live
   * has passed is removed as {@link RemovalCause#EXPIRED}.
   *
   * @param key the key whose entry is to be removed
   * @return {@code true} if an entry was stored for the key
   */
  @CanIgnoreReturnValue
  boolean delete(String key);

  /**
   * Discards the entry for the {@code key} only if it currently holds the given value instance.
   *
   * @return {@code true} if the entry was removed
   */
  @CanIgnoreReturnValue
  boolean delete(String key, @Nullable Object expectedValue);

  /**
   * Discards all entries. The cumulative statistics counters are kept.
   */
  void clear();

  /**
   * Discards every entry that was stored with the dependency tag. This only visits the entries
   * carrying the tag.
   *
   * @param dependency the tag whose entries are to be removed
   * @return the number of entries removed
   */
  @CanIgnoreReturnValue
  int invalidateByDependency(String dependency);

  /**
   * Discards every entry whose key contains a match of the regular expression, following the
   * semantics of {@link java.util.regex.Matcher#find()}. This visits every entry.
   *
   * @param regex the regular expression
   * @return the number of entries removed
   * @throws java.util.regex.PatternSyntaxException if the expression is malformed
   */
  @CanIgnoreReturnValue
  int invalidateByPattern(String regex);

  /**
   * Discards every entry whose key contains a match of the pattern.
   *
   * @return the number of entries removed
   */
  @CanIgnoreReturnValue
  int invalidateByPattern(Pattern pattern);

  /** Returns the live keys, ordered from the least to the most recently used. */
  ImmutableList<String> keys();

  /**
   * Returns snapshots of the live entries, ordered from the least to the most recently used. This
   * does not affect recency or the statistics.
   */
  ImmutableList<CacheEntry<V>> entries();

  /** Returns the dependency tags that currently have at least one entry. */
  ImmutableSet<String> dependencies();

  /**
   * Returns the number of entries in this cache, which may include expired entries that have not
   * been removed yet.
   */
  @NonNegative
  long estimatedSize();

  /**
   * Returns a current snapshot of this cache's cumulative statistics together with its live entry
   * count, total estimated size and most frequently hit keys. When statistics are not recorded the
   * counters are zero and no keys are reported.
   */
  CacheStats stats();

  /**
   * Removes the expired entries now rather than waiting for the next periodic sweep.
   *
   * @return the number of entries removed
   */
  @CanIgnoreReturnValue
  int cleanUp();

  /**
   * Returns a function that memoizes {@code function} in this cache, keyed by its argument under
   * the function's class name, with the default time-to-live.
   */
  @CheckReturnValue
  default <A> Function<A, V> memoize(Function<? super A, ? extends V> function) {
    return Memoizer.memoize(this, function, MemoizeOptions.defaults());
  }

  /** Returns a function that memoizes {@code function} in this cache. */
  @CheckReturnValue
  default <A> Function<A, V> memoize(
      Function<? super A, ? extends V> function, MemoizeOptions options) {
    return Memoizer.memoize(this, function, options);
  }

  /** Returns a function that memoizes the two argument {@code function} in this cache. */
  @CheckReturnValue
  default <A, B> BiFunction<A, B, V> memoize(
      BiFunction<? super A, ? super B, ? extends V> function, MemoizeOptions options) {
    return Memoizer.memoize(this, function, options);
  }

  /**
   * Computes the values of the tasks concurrently on the cache's executor and stores each one that
   * succeeds. A failed task is logged and does not affect the others.
   *
   * @return a future that completes, normally, when every task has finished
   */
  @CanIgnoreReturnValue
  default CompletableFuture<Void> warmUp(Collection<? extends WarmUpTask<? extends V>> tasks) {
    return warmUp(tasks, (key, error) -> {});
  }

  /**
   * Computes the values of the tasks concurrently on the cache's executor and stores each one that
   * succeeds. A failed task is logged and reported to the {@code errorHandler} with its key.
   *
   * @return a future that completes, normally, when every task has finished
   */
  @CanIgnoreReturnValue
  CompletableFuture<Void> warmUp(Collection<? extends WarmUpTask<? extends V>> tasks,
      BiConsumer<String, Throwable> errorHandler);

  /**
   * Returns a JSON snapshot of the live entries, their remaining time-to-live and dependency tags,
   * and the current statistics. Asynchronous values that have not completed successfully are
   * omitted.
   */
  String serialize();

  /**
   * Restores the entries of a snapshot produced by {@link #serialize}, converting each value to
   * {@code valueType}. Malformed input is logged and leaves the cache unchanged.
   *
   * @return the keys that were restored, or an empty list if the snapshot was rejected
   */
  @CanIgnoreReturnValue
  List<String> deserialize(String json, Class<? extends V> valueType);

  /**
   * Stops the periodic sweep and discards all entries. Afterwards reads find nothing, writes are
   * ignored, and the sweep never runs again. Calling this more than once has no further effect.
   */
  void destroy();

  /** Returns whether {@link #destroy} has been called. */
  boolean isDestroyed();
}
