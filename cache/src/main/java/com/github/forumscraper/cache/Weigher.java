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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.util.concurrent.CompletableFuture;

import org.checkerframework.checker.index.qual.NonNegative;
import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Calculates the estimated size of cache entries, in bytes. The size is computed once when the
 * entry is stored and is used only for the cache's aggregate size ceiling.
 *
 * @param <V> the type of values
 */
@FunctionalInterface
public interface Weigher<V> {

  /**
   * Returns the estimated size, in bytes, of a cache entry. There is no unit for entry sizes other
   * than the one the ceiling is expressed in; the value is only compared against
   * {@link CacheBuilder#maximumSizeBytes}.
   *
   * @param key the key to weigh
   * @param value the value to weigh, which may be {@code null}
   * @return the size of the entry; must be non-negative
   */
  @NonNegative
  long weigh(String key, @Nullable V value);

  /**
   * Returns a weigher where an entry has a size of {@code 1}.
   *
   * @param <V> the type of values
   * @return a weigher where an entry has a size of {@code 1}
   */
  static <V> Weigher<V> singletonWeigher() {
    @SuppressWarnings("unchecked")
    var instance = (Weigher<V>) SingletonWeigher.INSTANCE;
    return instance;
  }

  /**
   * Returns a weigher that estimates the size of a value as the length of its UTF-8 encoded JSON
   * form. A pending {@link CompletableFuture} weighs nothing until it has a value; a completed one
   * is weighed by its result.
   *
   * @param <V> the type of values
   * @return a weigher based on the serialized size of the value
   */
  static <V> Weigher<V> jsonWeigher() {
    @SuppressWarnings("unchecked")
    var instance = (Weigher<V>) JsonWeigher.INSTANCE;
    return instance;
  }

  /**
   * Returns a weigher that enforces that the size is non-negative.
   *
   * @param delegate the weigher to weigh the entry with
   * @param <V> the type of values
   * @return a weigher that enforces that the size is non-negative
   */
  static <V> Weigher<V> boundedWeigher(Weigher<V> delegate) {
    return new BoundedWeigher<>(delegate);
  }
}

enum SingletonWeigher implements Weigher<Object> {
  INSTANCE;

  @Override public long weigh(String key, @Nullable Object value) {
    return 1;
  }
}

enum JsonWeigher implements Weigher<Object> {
  INSTANCE;

  final ObjectMapper mapper = CacheKeys.newObjectMapper();

  @Override
  public long weigh(String key, @Nullable Object value) {
    if (value instanceof CompletableFuture<?>) {
      var future = (CompletableFuture<?>) value;
      if (!future.isDone() || future.isCompletedExceptionally()) {
        return 0;
      }
      return weigh(key, future.join());
    }
    try {
      return mapper.writeValueAsBytes(value).length;
    } catch (JsonProcessingException e) {
      return String.valueOf(value).getBytes(UTF_8).length;
    }
  }
}

final class BoundedWeigher<V> implements Weigher<V> {
  final Weigher<V> delegate;

  BoundedWeigher(Weigher<V> delegate) {
    this.delegate = requireNonNull(delegate);
  }

  @Override
  public long weigh(String key, @Nullable V value) {
    long weight = delegate.weigh(key, value);
    CacheBuilder.requireArgument(weight >= 0, "negative size %s for key %s", weight, key);
    return weight;
  }
}
