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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.regex.Pattern;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.forumscraper.cache.Cache;
import com.github.forumscraper.cache.CacheBuilder;
import com.github.forumscraper.cache.CacheEntry;
import com.github.forumscraper.cache.CacheKeys;
import com.github.forumscraper.cache.MemoizeOptions;
import com.github.forumscraper.cache.Memoizer;
import com.github.forumscraper.cache.WarmUpTask;
import com.github.forumscraper.cache.stats.CacheStats;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;

/**
 * Serves analytics queries from a cache, computing them with an {@link AnalyticsSource} only on a
 * miss. Every result is tagged with the {@link CacheDependency dependencies} it derives from, so
 * that scraping new data for one platform discards only that platform's results:
 * <pre>{@code
 *   var analytics = CachedAnalyticsService.newBuilder(source)
 *       .settings(AnalyticsCacheSettings.load())
 *       .build();
 *   PlatformStats stats = analytics.getPlatformStats(Platform.REDDIT, null);
 *
 *   // after a scrape of Reddit completes
 *   analytics.invalidatePlatform(Platform.REDDIT);
 * }</pre>
 * Results are keyed by the method name followed by the digest of the arguments, as derived by
 * {@link CacheKeys#generateKey}. Time series queries are asynchronous and single-flight:
 * concurrent requests for the same series share one computation.
 * <p>
 * This class is thread-safe.
 */
public final class CachedAnalyticsService {
  static final Logger logger = System.getLogger(CachedAnalyticsService.class.getName());

  public static final String PLATFORM_STATS = "getPlatformStats";
  public static final String ENGAGEMENT_STATS = "getEngagementStats";
  public static final String TIME_SERIES_DATA = "getTimeSeriesData";
  public static final String TRENDING_POSTS = "getTrendingPosts";

  static final List<@Nullable Platform> WARM_UP_PLATFORMS =
      Arrays.asList(null, Platform.REDDIT, Platform.HACKERNEWS);

  final AnalyticsSource source;
  final AnalyticsCacheSettings settings;
  final ImmutableSet<String> excludedMethods;
  final CachePredicate shouldCache;
  final Cache<Object> cache;
  final ObjectMapper mapper;

  volatile CacheStats baseline;

  CachedAnalyticsService(Builder builder) {
    this.source = builder.source;
    this.settings = builder.getSettings();
    this.excludedMethods = settings.excludedMethods();
    this.shouldCache = builder.getShouldCache();
    this.cache = builder.getCache(settings);
    this.mapper = CacheKeys.newObjectMapper();
    this.baseline = CacheStats.empty();
  }

  /**
   * Returns a builder of a service that computes its results with the {@code source}.
   *
   * @param source the uncached analytics computations
   * @return a new builder with the settings of {@link AnalyticsCacheSettings#load()}
   */
  @CheckReturnValue
  public static Builder newBuilder(AnalyticsSource source) {
    return new Builder(source);
  }

  /* --------------- Queries --------------- */

  /**
   * Returns the totals of a platform's content. When failures are configured to be cached, a
   * failed computation is rethrown to every caller until it expires.
   *
   * @param platform the platform, or {@code null} for every platform combined
   * @param range the period to restrict the totals to, or {@code null} for all time
   * @return the statistics, or {@code null} if nothing has been scraped
   */
  public @Nullable PlatformStats getPlatformStats(
      @Nullable Platform platform, @Nullable DateRange range) {
    var dependencies = ImmutableSet.of(
        CacheDependency.DATA.tag(), CacheDependency.forPlatform(platform));
    return (PlatformStats) load(PLATFORM_STATS, platform, range,
        dependencies, source::getPlatformStats);
  }

  /** Returns the engagement rates of the posts scraped in the last {@code days}. */
  public EngagementStats getEngagementStats(@Nullable Platform platform, int days) {
    checkArgument(days > 0, "days must be positive: %s", days);
    var dependencies = ImmutableSet.of(CacheDependency.DATA.tag(),
        CacheDependency.TIME_RANGE.tag(), CacheDependency.forPlatform(platform));
    return (EngagementStats) requireNonNull(load(ENGAGEMENT_STATS, platform, days,
        dependencies, source::getEngagementStats));
  }

  /**
   * Returns the daily activity counts within the range. Concurrent calls for the same series
   * share a single computation, and a failed computation is not cached.
   */
  public CompletableFuture<List<TimeSeriesPoint>> getTimeSeriesData(
      @Nullable Platform platform, DateRange range) {
    requireNonNull(range);
    if (excludedMethods.contains(TIME_SERIES_DATA)) {
      return source.getTimeSeriesData(platform, range);
    }
    String key = keyFor(TIME_SERIES_DATA, platform, range);
    var options = options(TIME_SERIES_DATA, ImmutableSet.of(CacheDependency.DATA.tag(),
        CacheDependency.TIME_RANGE.tag(), CacheDependency.forPlatform(platform)));
    var computed = new boolean[1];
    BiFunction<@Nullable Platform, DateRange, CompletableFuture<List<TimeSeriesPoint>>> loader =
        (p, r) -> {
          computed[0] = true;
          return source.getTimeSeriesData(p, r);
        };
    var future = Memoizer.memoizeAsync(cache, loader, options).apply(platform, range);
    if (!computed[0]) {
      return future;
    }
    // The key may have been invalidated and claimed by a newer load
    return future.thenApply(points -> {
      if (!shouldCache.shouldCache(TIME_SERIES_DATA, Arrays.asList(platform, range), points)) {
        cache.delete(key, future);
      }
      return points;
    });
  }

  /** Returns the hottest posts across every platform, most trending first. */
  public List<TrendingPost> getTrendingPosts(int limit) {
    return getTrendingPosts(limit, /* platform= */ null);
  }

  /** Returns the hottest posts, most trending first. */
  @SuppressWarnings("unchecked")
  public List<TrendingPost> getTrendingPosts(int limit, @Nullable Platform platform) {
    checkArgument(limit > 0, "limit must be positive: %s", limit);
    var dependencies = ImmutableSet.of(
        CacheDependency.DATA.tag(), CacheDependency.forPlatform(platform));
    BiFunction<Integer, @Nullable Platform, List<TrendingPost>> loader =
        (l, p) -> ImmutableList.copyOf(source.getTrendingPosts(l, p));
    return (List<TrendingPost>) requireNonNull(
        load(TRENDING_POSTS, limit, platform, dependencies, loader));
  }

  /**
   * Returns the cached result of the method's call, or computes and caches it. A result that the
   * {@link CachePredicate} rejects is returned without being kept.
   */
  private <A, B> @Nullable Object load(String method, @Nullable A first, @Nullable B second,
      Set<String> dependencies, BiFunction<? super A, ? super B, ?> loader) {
    if (excludedMethods.contains(method)) {
      return loader.apply(first, second);
    }
    String key = keyFor(method, first, second);
    var computed = new boolean[1];
    BiFunction<A, B, @Nullable Object> compute = (a, b) -> {
      computed[0] = true;
      return loader.apply(a, b);
    };

    @Nullable Object result;
    try {
      result = Memoizer.memoize(cache, compute, options(method, dependencies)).apply(first, second);
    } catch (RuntimeException e) {
      if (settings.cacheErrors()) {
        cache.set(key, e, settings.errorTtl(), Set.of(CacheDependency.DATA.tag()));
      }
      throw e;
    }
    if (result instanceof RuntimeException) {
      throw (RuntimeException) result;
    }
    if (computed[0] && !shouldCache.shouldCache(method, Arrays.asList(first, second), result)) {
      cache.delete(key, result);
    }
    return result;
  }

  MemoizeOptions options(String method, Set<String> dependencies) {
    return MemoizeOptions.newBuilder()
        .namespace(method)
        .ttl(settings.ttlFor(method))
        .dependencies(dependencies)
        .build();
  }

  /** Returns the key of the method's call with the given arguments. */
  static String keyFor(String method, @Nullable Object first, @Nullable Object second) {
    return CacheKeys.generateKey(method, Arrays.asList(first, second));
  }

  /* --------------- Invalidation --------------- */

  /**
   * Discards every result tagged with the dependency.
   *
   * @return the number of results discarded
   */
  @CanIgnoreReturnValue
  public int invalidateCache(String dependency) {
    return cache.invalidateByDependency(dependency);
  }

  /** Discards every result tagged with the dependency. */
  @CanIgnoreReturnValue
  public int invalidateCache(CacheDependency dependency) {
    return invalidateCache(dependency.tag());
  }

  /** Discards every result computed from the platform's data. */
  @CanIgnoreReturnValue
  public int invalidatePlatform(Platform platform) {
    return invalidateCache(platform.tag());
  }

  /**
   * Discards the results of a service method, matching its name anywhere in the key and ignoring
   * case.
   */
  @CanIgnoreReturnValue
  public int clearCacheFor(String method) {
    return cache.invalidateByPattern(
        Pattern.compile(Pattern.quote(method), Pattern.CASE_INSENSITIVE));
  }

  /** Discards the results whose keys contain a match of the regular expression. */
  @CanIgnoreReturnValue
  public int invalidatePattern(Pattern pattern) {
    return cache.invalidateByPattern(pattern);
  }

  /** Discards the results whose keys contain a match of the regular expression. */
  @CanIgnoreReturnValue
  public int invalidatePattern(String regex) {
    return cache.invalidateByPattern(regex);
  }

  /** Discards every result and resets the statistics. */
  public void clearCache() {
    cache.clear();
    resetStats();
  }

  /* --------------- Warm up --------------- */

  /**
   * Precomputes the platform and engagement statistics of each platform, and of every platform
   * combined. A failed computation is logged and does not prevent the others.
   *
   * @return a future that completes when every computation has finished
   */
  public CompletableFuture<Void> warmUpCache() {
    return warmUpCache((key, error) -> {});
  }

  /**
   * Precomputes the platform and engagement statistics of each platform, and of every platform
   * combined, reporting each failed computation to the handler.
   *
   * @param errorHandler receives the key and failure of each computation that throws
   * @return a future that completes when every computation has finished
   */
  public CompletableFuture<Void> warmUpCache(BiConsumer<String, Throwable> errorHandler) {
    int days = settings.warmUpDays();
    var tasks = new ArrayList<WarmUpTask<Object>>();
    for (Platform platform : WARM_UP_PLATFORMS) {
      if (!excludedMethods.contains(PLATFORM_STATS)) {
        tasks.add(WarmUpTask.<Object>of(keyFor(PLATFORM_STATS, platform, null),
                () -> source.getPlatformStats(platform, null))
            .withTtl(settings.ttlFor(PLATFORM_STATS))
            .withDependencies(Set.of(
                CacheDependency.DATA.tag(), CacheDependency.forPlatform(platform))));
      }
      if (!excludedMethods.contains(ENGAGEMENT_STATS)) {
        tasks.add(WarmUpTask.<Object>of(keyFor(ENGAGEMENT_STATS, platform, days),
                () -> source.getEngagementStats(platform, days))
            .withTtl(settings.ttlFor(ENGAGEMENT_STATS))
            .withDependencies(Set.of(CacheDependency.DATA.tag(),
                CacheDependency.TIME_RANGE.tag(), CacheDependency.forPlatform(platform))));
      }
    }
    logger.log(Level.DEBUG, "Warming up {0} analytics results", tasks.size());
    return cache.warmUp(tasks, errorHandler);
  }

  /* --------------- Statistics --------------- */

  /**
   * Returns the cache's statistics since the last {@link #resetStats()} or {@link #clearCache()}.
   * The entry count, size and top keys describe the current contents.
   */
  public CacheStats getCacheStats() {
    return cache.stats().minus(baseline);
  }

  /** Restarts the counters reported by {@link #getCacheStats()} from zero. */
  public void resetStats() {
    baseline = cache.stats();
  }

  /* --------------- Snapshots --------------- */

  /** Returns the JSON snapshot of the cached results. */
  public String serialize() {
    return cache.serialize();
  }

  /**
   * Restores the results of a snapshot written by {@link #serialize()}, converting each back to
   * its method's result type. A result that does not convert is discarded, and a malformed
   * snapshot leaves the cache unchanged.
   *
   * @param json the snapshot
   * @return the number of results restored
   */
  @CanIgnoreReturnValue
  public int deserialize(String json) {
    var restored = ImmutableSet.copyOf(cache.deserialize(json, Object.class));
    int count = 0;
    for (CacheEntry<Object> entry : cache.entries()) {
      if (!restored.contains(entry.getKey())) {
        continue;
      }
      JavaType type = resultType(entry.getKey());
      if ((type == null) || (entry.getValue() == null)) {
        count++;
        continue;
      }
      Object value;
      try {
        value = mapper.convertValue(entry.getValue(), type);
      } catch (IllegalArgumentException e) {
        logger.log(Level.WARNING, "Discarding the restored result " + entry.getKey(), e);
        cache.delete(entry.getKey(), entry.getValue());
        continue;
      }
      cache.set(entry.getKey(), value, entry.expiresAfter(), entry.dependencies());
      count++;
    }
    return count;
  }

  /** Returns the result type of the method that the key belongs to, if known. */
  @Nullable JavaType resultType(String key) {
    int index = key.indexOf(':');
    String method = (index < 0) ? key : key.substring(0, index);
    var types = mapper.getTypeFactory();
    switch (method) {
      case PLATFORM_STATS:
        return types.constructType(PlatformStats.class);
      case ENGAGEMENT_STATS:
        return types.constructType(EngagementStats.class);
      case TIME_SERIES_DATA:
        return types.constructCollectionType(List.class, TimeSeriesPoint.class);
      case TRENDING_POSTS:
        return types.constructCollectionType(List.class, TrendingPost.class);
      default:
        return null;
    }
  }

  /* --------------- Lifecycle --------------- */

  /** Discards every result and stops the cache's background sweep. */
  public void destroy() {
    cache.destroy();
  }

  public boolean isDestroyed() {
    return cache.isDestroyed();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{' + cache + '}';
  }

  /** A builder of {@link CachedAnalyticsService} instances. */
  public static final class Builder {
    final AnalyticsSource source;

    @Nullable AnalyticsCacheSettings settings;
    @Nullable CachePredicate shouldCache;
    @Nullable Cache<Object> cache;

    Builder(AnalyticsSource source) {
      this.source = requireNonNull(source);
    }

    /** Specifies the settings; defaults to {@link AnalyticsCacheSettings#load()}. */
    @CanIgnoreReturnValue
    public Builder settings(AnalyticsCacheSettings settings) {
      checkState(this.settings == null, "settings were already set to %s", this.settings);
      this.settings = requireNonNull(settings);
      return this;
    }

    AnalyticsCacheSettings getSettings() {
      return (settings == null) ? AnalyticsCacheSettings.load() : settings;
    }

    /** Specifies which computed results may be cached; by default every result is. */
    @CanIgnoreReturnValue
    public Builder shouldCache(CachePredicate shouldCache) {
      checkState(this.shouldCache == null, "cache predicate was already set");
      this.shouldCache = requireNonNull(shouldCache);
      return this;
    }

    CachePredicate getShouldCache() {
      return (shouldCache == null) ? CachePredicate.always() : shouldCache;
    }

    /**
     * Specifies the cache to store results in, replacing the one that would be built from the
     * settings. The service takes ownership of it.
     */
    @CanIgnoreReturnValue
    public Builder cache(Cache<Object> cache) {
      checkState(this.cache == null, "cache was already set to %s", this.cache);
      this.cache = requireNonNull(cache);
      return this;
    }

    Cache<Object> getCache(AnalyticsCacheSettings settings) {
      if (cache != null) {
        return cache;
      }
      return CacheBuilder.newBuilder()
          .defaultTtl(settings.defaultTtl())
          .maximumEntries(settings.maxEntries())
          .maximumSizeBytes(settings.maxSizeBytes())
          .cleanupInterval(settings.cleanupInterval())
          .recordStats()
          .build();
    }

    public CachedAnalyticsService build() {
      return new CachedAnalyticsService(this);
    }
  }
}
