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

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Wraps functions so that their results are stored in, and served from, a {@link Cache}.
 * <p>
 * A synchronous function is invoked outside of the cache's lock on a miss and its result is stored
 * once it returns; concurrent misses for the same key may each invoke it. An asynchronous function
 * is single-flight: the first miss claims the key with a pending future, and concurrent callers
 * for the same key receive that future instead of invoking the function again. A failure is never
 * cached. It propagates to the caller, and an asynchronous failure releases the key so that the
 * next call retries.
 */
public final class Memoizer {
  static final Logger logger = System.getLogger(Memoizer.class.getName());

  private Memoizer() {}

  /**
   * Returns a function that memoizes {@code function} in the cache.
   *
   * @param cache the cache to store the results in
   * @param function the function to memoize
   * @param options the key derivation, time-to-live and dependency tags of the results
   * @return the memoized function
   */
  public static <A, R> Function<A, R> memoize(Cache<? super R> cache,
      Function<? super A, ? extends R> function, MemoizeOptions options) {
    requireNonNull(cache);
    requireNonNull(function);
    requireNonNull(options);
    return arg -> {
      String key = options.keyFor(function, CacheKeys.arguments(arg));
      return load(cache, key, options, () -> function.apply(arg));
    };
  }

  /**
   * Returns a function that memoizes the two argument {@code function} in the cache.
   *
   * @param cache the cache to store the results in
   * @param function the function to memoize
   * @param options the key derivation, time-to-live and dependency tags of the results
   * @return the memoized function
   */
  public static <A, B, R> BiFunction<A, B, R> memoize(Cache<? super R> cache,
      BiFunction<? super A, ? super B, ? extends R> function, MemoizeOptions options) {
    requireNonNull(cache);
    requireNonNull(function);
    requireNonNull(options);
    return (a, b) -> {
      String key = options.keyFor(function, CacheKeys.arguments(a, b));
      return load(cache, key, options, () -> function.apply(a, b));
    };
  }

  /**
   * Returns a function that memoizes the asynchronous {@code function} in the cache. The cache
   * stores the pending future, so concurrent calls with the same arguments share one invocation.
   *
   * @param cache the cache to store the futures in
   * @param function the function to memoize
   * @param options the key derivation, time-to-live and dependency tags of the results
   * @return the memoized function
   */
  public static <A, R> Function<A, CompletableFuture<R>> memoizeAsync(
      Cache<? super CompletableFuture<R>> cache,
      Function<? super A, ? extends CompletableFuture<? extends R>> function,
      MemoizeOptions options) {
    requireNonNull(cache);
    requireNonNull(function);
    requireNonNull(options);
    return arg -> {
      String key = options.keyFor(function, CacheKeys.arguments(arg));
      return loadAsync(cache, key, options, () -> function.apply(arg));
    };
  }

  /**
   * Returns a function that memoizes the asynchronous two argument {@code function} in the cache.
   *
   * @param cache the cache to store the futures in
   * @param function the function to memoize
   * @param options the key derivation, time-to-live and dependency tags of the results
   * @return the memoized function
   */
  public static <A, B, R> BiFunction<A, B, CompletableFuture<R>> memoizeAsync(
      Cache<? super CompletableFuture<R>> cache,
      BiFunction<? super A, ? super B, ? extends CompletableFuture<? extends R>> function,
      MemoizeOptions options) {
    requireNonNull(cache);
    requireNonNull(function);
    requireNonNull(options);
    return (a, b) -> {
      String key = options.keyFor(function, CacheKeys.arguments(a, b));
      return loadAsync(cache, key, options, () -> function.apply(a, b));
    };
  }

  /** Returns the cached value, or computes and stores it on a miss. */
  @SuppressWarnings("unchecked")
  static <R> R load(Cache<? super R> cache, String key,
      MemoizeOptions options, Supplier<? extends R> supplier) {
    LocalCache<? super R> local = LocalCache.asLocalCache(cache);
    var entry = local.getEntry(key);
    if (entry != null) {
      return (R) entry.getValue();
    }

    long startTime = local.ticker.read();
    R value;
    try {
      value = supplier.get();
    } catch (RuntimeException | Error e) {
      local.statsCounter.recordLoadFailure(loadTime(local, startTime));
      throw e;
    }
    local.statsCounter.recordLoadSuccess(loadTime(local, startTime));
    local.set(key, value, options.ttl(), options.dependencies());
    return value;
  }

  /**
   * Returns the cached future, or claims the key with a proxy future that is completed by the
   * function's result. The function runs outside of the cache's lock.
   */
  @SuppressWarnings("unchecked")
  static <R> CompletableFuture<R> loadAsync(Cache<? super CompletableFuture<R>> cache,
      String key, MemoizeOptions options,
      Supplier<? extends CompletableFuture<? extends R>> supplier) {
    LocalCache<? super CompletableFuture<R>> local = LocalCache.asLocalCache(cache);
    var proxy = new CompletableFuture<R>();
    var existing = local.setIfAbsent(key, proxy, options.ttl(), options.dependencies());
    if (existing != null) {
      Object value = existing.getValue();
      return (value instanceof CompletableFuture<?>)
          ? (CompletableFuture<R>) value
          : CompletableFuture.completedFuture((R) value);
    }

    long startTime = local.ticker.read();
    CompletableFuture<? extends R> future;
    try {
      future = requireNonNull(supplier.get(), "memoized function returned a null future");
    } catch (RuntimeException | Error e) {
      local.statsCounter.recordLoadFailure(loadTime(local, startTime));
      local.delete(key, proxy);
      proxy.completeExceptionally(e);
      throw e;
    }
    future.whenComplete((value, error) -> {
      long loadTime = loadTime(local, startTime);
      if (error == null) {
        local.statsCounter.recordLoadSuccess(loadTime);
        proxy.complete(value);
        local.reweigh(key, proxy);
        return;
      }
      if (!(error instanceof CancellationException) && !(error instanceof TimeoutException)) {
        logger.log(Level.WARNING, "Exception thrown during asynchronous load of " + key, error);
      }
      local.statsCounter.recordLoadFailure(loadTime);
      local.delete(key, proxy);
      proxy.completeExceptionally(error);
    });
    return proxy;
  }

  static long loadTime(LocalCache<?> cache, long startTime) {
    return Math.max(0L, cache.ticker.read() - startTime);
  }
}
