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
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Supplier;

import org.checkerframework.checker.index.qual.NonNegative;
import org.jspecify.annotations.Nullable;

import com.github.forumscraper.cache.stats.ConcurrentStatsCounter;
import com.github.forumscraper.cache.stats.StatsCounter;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;

/**
 * A builder of {@link Cache} instances. Every setting is optional and may be configured at most
 * once; unset settings take the same defaults as the module's {@code reference.conf}, except that
 * statistics are not recorded unless requested.
 * <p>
 * Usage example:
 * <pre>{@code
 *   Cache<Object> cache = CacheBuilder.newBuilder()
 *       .defaultTtl(Duration.ofMinutes(10))
 *       .maximumEntries(1_000)
 *       .maximumSizeBytes(50 * 1024 * 1024)
 *       .recordStats()
 *       .build();
 * }</pre>
 *
 * @param <V> the most general value type this builder will create caches for
 */
public final class CacheBuilder<V> {
  static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
  static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofMinutes(1);
  static final long DEFAULT_MAXIMUM_ENTRIES = 1_000;
  static final long DEFAULT_MAXIMUM_SIZE = 100L * 1024 * 1024;
  static final int DEFAULT_TOP_KEYS = 10;
  static final int UNSET_INT = -1;

  @Nullable Duration defaultTtl;
  @Nullable Duration cleanupInterval;
  long maximumEntries = UNSET_INT;
  long maximumSizeBytes = UNSET_INT;
  int topKeys = UNSET_INT;

  @Nullable Supplier<StatsCounter> statsCounterSupplier;
  @Nullable RemovalListener<? super V> removalListener;
  @Nullable Weigher<? super V> weigher;
  @Nullable Scheduler scheduler;
  @Nullable Executor executor;
  @Nullable Ticker ticker;

  private CacheBuilder() {}

  /** Ensures that the argument expression is true. */
  static void requireArgument(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalArgumentException(String.format(template, args));
    }
  }

  /** Ensures that the argument expression is true. */
  static void requireArgument(boolean expression) {
    if (!expression) {
      throw new IllegalArgumentException();
    }
  }

  /** Ensures that the state expression is true. */
  static void requireState(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalStateException(String.format(template, args));
    }
  }

  /**
   * Constructs a new {@code CacheBuilder} instance with default settings: a five minute
   * time-to-live, at most 1,000 entries and 100 MiB, a sweep every minute, and no statistics.
   *
   * @return a new instance with default settings
   */
  @CheckReturnValue
  public static CacheBuilder<Object> newBuilder() {
    return new CacheBuilder<>();
  }

  /**
   * Constructs a new {@code CacheBuilder} instance with the settings of the {@link CacheConfig}.
   *
   * @param config the settings to apply
   * @return a new instance with the given settings
   * @throws IllegalArgumentException if a setting is out of range
   */
  @CheckReturnValue
  public static CacheBuilder<Object> from(CacheConfig config) {
    var builder = newBuilder()
        .defaultTtl(config.defaultTtl())
        .maximumEntries(config.maxEntries())
        .maximumSizeBytes(config.maxSizeBytes())
        .cleanupInterval(config.cleanupInterval())
        .topKeys(config.topKeys());
    if (config.enableMetrics()) {
      builder.recordStats();
    }
    return builder;
  }

  /**
   * Specifies the time-to-live of entries stored without an explicit one.
   *
   * @param duration the default time-to-live
   * @return this {@code CacheBuilder} instance (for chaining)
   * @throws IllegalArgumentException if {@code duration} is negative
   * @throws IllegalStateException if the default time-to-live was already set
   */
  @CanIgnoreReturnValue
  public CacheBuilder<V> defaultTtl(Duration duration) {
    requireState(defaultTtl == null, "default ttl was already set to %s", defaultTtl);
    requireArgument(!duration.isNegative(), "default ttl cannot be negative: %s", duration);
    this.defaultTtl = duration;
    return this;
  }

  Duration getDefaultTtl() {
    return (defaultTtl == null) ? DEFAULT_TTL : defaultTtl;
  }

  /**
   * Specifies the maximum number of entries the cache may contain. When a write exceeds it, the
   * least recently used entries are evicted. A maximum of zero evicts every entry as soon as it
   * is stored.
   *
   * @param maximumEntries the maximum entry count
   * @return this {@code CacheBuilder} instance (for chaining)
   * @throws IllegalArgumentException if {@code maximumEntries} is negative
   * @throws IllegalStateException if the maximum entry count was already set
   */
  @CanIgnoreReturnValue
  public CacheBuilder<V> maximumEntries(@NonNegative long maximumEntries) {
    requireState(this.maximumEntries == UNSET_INT,
        "maximum entries was already set to %s", this.maximumEntries);
    requireArgument(maximumEntries >= 0, "maximum entries must not be negative");
    this.maximumEntries = maximumEntries;
    return this;
  }

  long getMaximumEntries() {
    return (maximumEntries == UNSET_INT) ? DEFAULT_MAXIMUM_ENTRIES : maximumEntries;
  }

  /**
   * Specifies the maximum total estimated size, in bytes, of the cache's entries. When a write
   * exceeds it, the least recently used entries are evicted. An entry that is larger than the
   * maximum on its own is still kept after every other entry has been evicted.
   *
   * @param maximumSizeBytes the maximum total size
   * @return this {@code CacheBuilder} instance (for chaining)
   * @throws IllegalArgumentException if {@code maximumSizeBytes} is negative
   * @throws IllegalStateException if the maximum size was already set
   */
  @CanIgnoreReturnValue
  public CacheBuilder<V> maximumSizeBytes(@NonNegative long maximumSizeBytes) {
    requireState(this.maximumSizeBytes == UNSET_INT,
        "maximum size was already set to %s", this.maximumSizeBytes);
    requireArgument(maximumSizeBytes >= 0, "maximum size must not be negative");
    this.maximumSizeBytes = maximumSizeBytes;
    return this;
  }

  long getMaximumSizeBytes() {
    return (maximumSizeBytes == UNSET_INT) ? DEFAULT_MAXIMUM_SIZE : maximumSizeBytes;
  }

  /**
   * Specifies the period of the background sweep that removes expired entries. A zero or
   * negative period disables the sweep, leaving expired entries to be removed when read.
   *
   * @param interval the sweep period
   * @return this {@code CacheBuilder} instance (for chaining)
   * @throws IllegalStateException if the cleanup interval was already set
   */
  @CanIgnoreReturnValue
  public CacheBuilder<V> cleanupInterval(Duration interval) {
    requireState(cleanupInterval == null,
        "cleanup interval was already set to %s", cleanupInterval);
    this.cleanupInterval = requireNonNull(interval);
    return this;
  }

  Duration getCleanupInterval() {
    return (cleanupInterval == null) ? DEFAULT_CLEANUP_INTERVAL : cleanupInterval;
  }

  /**
   * Specifies how many of the most frequently hit keys {@link Cache#stats()} reports.
   *
   * @param topKeys the number of keys to report
   * @return this {@code CacheBuilder} instance (for chaining)
   * @throws IllegalArgumentException if {@code topKeys} is negative
   * @throws IllegalStateException if the number of top keys was already set
   */
  @CanIgnoreReturnValue
  public CacheBuilder<V> topKeys(@NonNegative int topKeys) {
    requireState(this.topKeys == UNSET_INT, "top keys was already set to %s", this.topKeys);
    requireArgument(topKeys >= 0, "top keys must not be negative");
    this.topKeys = topKeys;
    return this;
  }

  int getTopKeys() {
    return (topKeys == UNSET_INT) ? DEFAULT_TOP_KEYS : topKeys;
  }

  /**
   * Enables the accumulation of {@link com.github.forumscraper.cache.stats.CacheStats} during the
   * operation of the cache.
   *
   * @return this {@code CacheBuilder} instance (for chaining)
   */
  @CanIgnoreReturnValue
  public CacheBuilder<V> recordStats() {
    requireState(statsCounterSupplier == null, "Statistics recording was already set");
    statsCounterSupplier = ConcurrentStatsCounter::new;
    return this;
  }

  /**
   * Enables the accumulation of statistics into the {@link StatsCounter} supplied for each cache.
   *
   * @param statsCounterSupplier a supplier that returns a new {@link StatsCounter}
   * @return this {@code CacheBuilder} instance (for chaining)
   */
  @CanIgnoreReturnValue
  public CacheBuilder<V> recordStats(Supplier<? extends StatsCounter> statsCounterSupplier) {
    requireState(this.statsCounterSupplier == null, "Statistics recording was already set");
    requireNonNull(statsCounterSupplier);
    this.statsCounterSupplier = () -> StatsCounter.guardedStatsCounter(statsCounterSupplier.get());
    return this;
  }

  boolean isRecordingStats() {
    return (statsCounterSupplier != null);
  }

  StatsCounter getStatsCounter() {
    return (statsCounterSupplier == null)
        ? StatsCounter.disabledStatsCounter()
        : statsCounterSupplier.get();
  }

  /**
   * Specifies a nanosecond-precision time source for use in determining when entries expire and
   * for measuring load times. By default, {@link System#nanoTime} is used.
   *
   * @param ticker a nanosecond-precision time source
   * @return this {@code CacheBuilder} instance (for chaining)
   * @throws IllegalStateException if a ticker was already set
   */
  @CanIgnoreReturnValue
  public CacheBuilder<V> ticker(Ticker ticker) {
    requireState(this.ticker == null, "Ticker was already set to %s", this.ticker);
    this.ticker = requireNonNull(ticker);
    return this;
  }

  Ticker getTicker() {
    return (ticker == null) ? Ticker.systemTicker() : ticker;
  }

  /**
   * Specifies the executor to use when running removal notifications and warm-up tasks. By
   * default {@link ForkJoinPool#commonPool()} is used.
   *
   * @param executor the executor to use for asynchronous work
   * @return this {@code CacheBuilder} instance (for chaining)
   * @throws IllegalStateException if an executor was already set
   */
  @CanIgnoreReturnValue
  public CacheBuilder<V> executor(Executor executor) {
    requireState(this.executor == null, "executor was already set to %s", this.executor);
    this.executor = requireNonNull(executor);
    return this;
  }

  Executor getExecutor() {
    return (executor == null) ? ForkJoinPool.commonPool() : executor;
  }

  /**
   * Specifies the scheduler that delays each periodic sweep. By default the sweep is delayed with
   * {@link Scheduler#systemScheduler()}.
   *
   * @param scheduler the scheduler that runs the sweep after a delay
   * @return this {@code CacheBuilder} instance (for chaining)
   * @throws IllegalStateException if a scheduler was already set
   */
  @CanIgnoreReturnValue
  public CacheBuilder<V> scheduler(Scheduler scheduler) {
    requireState(this.scheduler == null, "scheduler was already set to %s", this.scheduler);
    this.scheduler = requireNonNull(scheduler);
    return this;
  }

  Scheduler getScheduler() {
    return (scheduler == null) ? Scheduler.systemScheduler() : scheduler;
  }

  /**
   * Specifies the weigher that estimates the size of each entry. By default an entry's size is the
   * length of its value's UTF-8 encoded JSON form.
   *
   * @param weigher the weigher to use in calculating the size of entries
   * @param <V1> the value type of the weigher
   * @return the cache builder reference that should be used instead of {@code this} for any
   *         remaining configuration and cache building
   * @throws IllegalStateException if a weigher was already set
   */
  @CanIgnoreReturnValue
  public <V1 extends V> CacheBuilder<V1> weigher(Weigher<? super V1> weigher) {
    requireState(this.weigher == null, "weigher was already set to %s", this.weigher);
    @SuppressWarnings("unchecked")
    var self = (CacheBuilder<V1>) this;
    self.weigher = requireNonNull(weigher);
    return self;
  }

  @SuppressWarnings("unchecked")
  <V1 extends V> Weigher<V1> getWeigher() {
    return (weigher == null)
        ? Weigher.jsonWeigher()
        : Weigher.boundedWeigher((Weigher<V1>) weigher);
  }

  /**
   * Specifies a listener instance that caches should notify each time an entry is removed for any
   * {@linkplain RemovalCause reason}. The listener is invoked on the configured executor after the
   * cache's lock has been released. Any exception thrown by the listener is logged and swallowed.
   *
   * @param removalListener a listener instance that caches should notify
   * @param <V1> the value type of the listener
   * @return the cache builder reference that should be used instead of {@code this} for any
   *         remaining configuration and cache building
   * @throws IllegalStateException if a removal listener was already set
   */
  @CanIgnoreReturnValue
  public <V1 extends V> CacheBuilder<V1> removalListener(
      RemovalListener<? super V1> removalListener) {
    requireState(this.removalListener == null,
        "removal listener was already set to %s", this.removalListener);
    @SuppressWarnings("unchecked")
    var self = (CacheBuilder<V1>) this;
    self.removalListener = requireNonNull(removalListener);
    return self;
  }

  @SuppressWarnings("unchecked")
  <V1 extends V> @Nullable RemovalListener<V1> getRemovalListener() {
    return (RemovalListener<V1>) removalListener;
  }

  /**
   * Builds a cache which does not automatically load values. The cache's periodic sweep starts
   * immediately and runs until {@link Cache#destroy()} is called.
   *
   * @param <V1> the value type of the cache
   * @return a cache having the requested features
   */
  @CheckReturnValue
  public <V1 extends V> Cache<V1> build() {
    return new LocalCache<V1>(this);
  }

  /**
   * Returns a string representation for this CacheBuilder instance. The exact form of the returned
   * string is not specified.
   */
  @Override
  public String toString() {
    var s = new StringBuilder(getClass().getSimpleName()).append('{');
    int baseLength = s.length();
    if (defaultTtl != null) {
      s.append("defaultTtl=").append(defaultTtl.toNanos()).append("ns, ");
    }
    if (maximumEntries != UNSET_INT) {
      s.append("maximumEntries=").append(maximumEntries).append(", ");
    }
    if (maximumSizeBytes != UNSET_INT) {
      s.append("maximumSizeBytes=").append(maximumSizeBytes).append(", ");
    }
    if (cleanupInterval != null) {
      s.append("cleanupInterval=").append(cleanupInterval.toNanos()).append("ns, ");
    }
    if (topKeys != UNSET_INT) {
      s.append("topKeys=").append(topKeys).append(", ");
    }
    if (statsCounterSupplier != null) {
      s.append("recordStats, ");
    }
    if (weigher != null) {
      s.append("weigher, ");
    }
    if (removalListener != null) {
      s.append("removalListener, ");
    }
    if (s.length() > baseLength) {
      s.setLength(s.length() - 2);
    }
    return s.append('}').toString();
  }
}
