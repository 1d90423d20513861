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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.forumscraper.analytics.PlatformStats.ActiveUser;
import com.github.forumscraper.cache.Cache;
import com.github.forumscraper.cache.CacheBuilder;
import com.github.forumscraper.cache.Scheduler;
import com.github.valfirst.slf4jtest.TestLoggerFactory;
import com.google.common.testing.FakeTicker;
import com.typesafe.config.ConfigFactory;

public final class CachedAnalyticsServiceTest {
  static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  static final DateRange WEEK = DateRange.lastDays(NOW, 7);

  static final PlatformStats REDDIT_STATS = new PlatformStats(Platform.REDDIT, 120, 860, 45,
      12.5, 20.0, 4.25, 7.0, new ActiveUser("alice", 12, 40), NOW);
  static final PlatformStats HACKERNEWS_STATS = new PlatformStats(Platform.HACKERNEWS, 80, 300,
      30, 8.0, 10.5, 2.0, 3.75, null, NOW);
  static final PlatformStats ALL_STATS = new PlatformStats(null, 200, 1160, 75,
      10.5, 16.0, 3.5, 5.75, new ActiveUser("alice", 12, 40), NOW);
  static final EngagementStats ENGAGEMENT = new EngagementStats(0.25, 0.0, 0.9, 14, 3);
  static final List<TrendingPost> TRENDING = List.of(
      new TrendingPost("t3_1", "Launch", "https://example.com/1", "bob", 950, 120, 31.5,
          NOW.minus(Duration.ofHours(3)), Platform.REDDIT),
      new TrendingPost("hn_2", "Show HN", "https://example.com/2", "carol", 400, 80, 22.0,
          NOW.minus(Duration.ofHours(5)), Platform.HACKERNEWS));
  static final List<TimeSeriesPoint> SERIES = List.of(
      new TimeSeriesPoint(NOW.minus(Duration.ofDays(1)), 10, 40, 8, 5.5),
      new TimeSeriesPoint(NOW, 12, 52, 9, 6.0));

  private AnalyticsSource source;
  private FakeTicker ticker;
  private Cache<Object> cache;

  @BeforeEach
  public void setUp() {
    TestLoggerFactory.clearAll();
    ticker = new FakeTicker();
    source = mock(AnalyticsSource.class);
    when(source.getPlatformStats(Platform.REDDIT, null)).thenReturn(REDDIT_STATS);
    when(source.getPlatformStats(Platform.HACKERNEWS, null)).thenReturn(HACKERNEWS_STATS);
    when(source.getPlatformStats(null, null)).thenReturn(ALL_STATS);
    when(source.getEngagementStats(any(), anyInt())).thenReturn(ENGAGEMENT);
    when(source.getTrendingPosts(anyInt(), any())).thenReturn(TRENDING);
    when(source.getTimeSeriesData(any(), any()))
        .thenAnswer(invocation -> CompletableFuture.completedFuture(SERIES));
  }

  private Cache<Object> newCache() {
    return CacheBuilder.newBuilder()
        .scheduler(Scheduler.disabledScheduler())
        .executor(Runnable::run)
        .ticker(ticker::read)
        .recordStats()
        .build();
  }

  private CachedAnalyticsService newService(String config) {
    return newService(config, CachePredicate.always());
  }

  private CachedAnalyticsService newService(String config, CachePredicate shouldCache) {
    cache = newCache();
    return CachedAnalyticsService.newBuilder(source)
        .settings(AnalyticsCacheSettings.from(ConfigFactory.parseString(config)))
        .shouldCache(shouldCache)
        .cache(cache)
        .build();
  }

  @Test
  public void platformStats_cached() {
    var service = newService("");

    assertThat(service.getPlatformStats(Platform.REDDIT, null)).isEqualTo(REDDIT_STATS);
    assertThat(service.getPlatformStats(Platform.REDDIT, null)).isEqualTo(REDDIT_STATS);

    verify(source, times(1)).getPlatformStats(Platform.REDDIT, null);
    var stats = service.getCacheStats();
    assertThat(stats.hitCount()).isEqualTo(1);
    assertThat(stats.missCount()).isEqualTo(1);
    assertThat(stats.loadSuccessCount()).isEqualTo(1);
    assertThat(stats.entryCount()).isEqualTo(1);
  }

  @Test
  public void platformStats_keyedByArguments() {
    var service = newService("");

    service.getPlatformStats(Platform.REDDIT, null);
    service.getPlatformStats(Platform.HACKERNEWS, null);
    service.getPlatformStats(null, null);
    service.getPlatformStats(Platform.REDDIT, WEEK);

    verify(source, times(1)).getPlatformStats(Platform.REDDIT, null);
    verify(source, times(1)).getPlatformStats(Platform.REDDIT, WEEK);
    assertThat(cache.estimatedSize()).isEqualTo(4);
    assertThat(cache.keys().get(0))
        .isEqualTo(CachedAnalyticsService.keyFor("getPlatformStats", Platform.REDDIT, null));
  }

  @Test
  public void platformStats_nullResult() {
    var service = newService("");

    assertThat(service.getPlatformStats(Platform.REDDIT, WEEK)).isNull();
    assertThat(service.getPlatformStats(Platform.REDDIT, WEEK)).isNull();
    verify(source, times(1)).getPlatformStats(Platform.REDDIT, WEEK);
  }

  @Test
  public void ttl_default() {
    var service = newService("forum-scraper.analytics.ttl.default = 1m");

    service.getPlatformStats(Platform.REDDIT, null);
    ticker.advance(Duration.ofSeconds(59));
    service.getPlatformStats(Platform.REDDIT, null);
    verify(source, times(1)).getPlatformStats(Platform.REDDIT, null);

    ticker.advance(Duration.ofSeconds(1));
    service.getPlatformStats(Platform.REDDIT, null);
    verify(source, times(2)).getPlatformStats(Platform.REDDIT, null);
  }

  @Test
  public void ttl_perMethod() {
    var service = newService("forum-scraper.analytics.ttl.getEngagementStats = 10m");

    service.getTrendingPosts(10);
    service.getEngagementStats(Platform.REDDIT, 7);
    ticker.advance(Duration.ofMinutes(2));

    service.getTrendingPosts(10);
    service.getEngagementStats(Platform.REDDIT, 7);
    verify(source, times(2)).getTrendingPosts(10, null);
    verify(source, times(1)).getEngagementStats(Platform.REDDIT, 7);

    ticker.advance(Duration.ofMinutes(8));
    service.getEngagementStats(Platform.REDDIT, 7);
    verify(source, times(2)).getEngagementStats(Platform.REDDIT, 7);
  }

  @Test
  public void invalidArguments() {
    var service = newService("");
    assertThrows(IllegalArgumentException.class, () -> service.getEngagementStats(null, 0));
    assertThrows(IllegalArgumentException.class, () -> service.getTrendingPosts(0));
    assertThrows(NullPointerException.class, () -> service.getTimeSeriesData(null, null));
  }

  @Test
  public void failure_notCached() {
    var service = newService("");
    when(source.getPlatformStats(Platform.REDDIT, WEEK))
        .thenThrow(new IllegalStateException("database is locked"))
        .thenReturn(REDDIT_STATS);

    assertThrows(IllegalStateException.class,
        () -> service.getPlatformStats(Platform.REDDIT, WEEK));
    assertThat(service.getPlatformStats(Platform.REDDIT, WEEK)).isEqualTo(REDDIT_STATS);
    assertThat(service.getCacheStats().loadFailureCount()).isEqualTo(1);
  }

  @Test
  public void failure_cachedWhenConfigured() {
    var service = newService("forum-scraper.analytics { cache-errors = true, error-ttl = 30s }");
    var failure = new IllegalStateException("database is locked");
    when(source.getPlatformStats(Platform.REDDIT, WEEK))
        .thenThrow(failure)
        .thenReturn(REDDIT_STATS);

    var first = assertThrows(IllegalStateException.class,
        () -> service.getPlatformStats(Platform.REDDIT, WEEK));
    var second = assertThrows(IllegalStateException.class,
        () -> service.getPlatformStats(Platform.REDDIT, WEEK));
    assertThat(first).isSameInstanceAs(failure);
    assertThat(second).isSameInstanceAs(failure);
    verify(source, times(1)).getPlatformStats(Platform.REDDIT, WEEK);

    ticker.advance(Duration.ofSeconds(30));
    assertThat(service.getPlatformStats(Platform.REDDIT, WEEK)).isEqualTo(REDDIT_STATS);
  }

  @Test
  public void excludedMethods() {
    var service = newService("forum-scraper.analytics.excluded-methods = [getTrendingPosts]");

    assertThat(service.getTrendingPosts(5)).isEqualTo(TRENDING);
    assertThat(service.getTrendingPosts(5)).isEqualTo(TRENDING);
    service.getPlatformStats(Platform.REDDIT, null);

    verify(source, times(2)).getTrendingPosts(5, null);
    assertThat(cache.estimatedSize()).isEqualTo(1);
  }

  @Test
  public void shouldCache_rejectsResult() {
    var service = newService("", (method, args, result) ->
        !method.equals("getTrendingPosts") || !((List<?>) result).isEmpty());
    when(source.getTrendingPosts(3, null)).thenReturn(List.of());

    assertThat(service.getTrendingPosts(3)).isEmpty();
    assertThat(service.getTrendingPosts(3)).isEmpty();
    assertThat(service.getTrendingPosts(10)).isEqualTo(TRENDING);
    assertThat(service.getTrendingPosts(10)).isEqualTo(TRENDING);

    verify(source, times(2)).getTrendingPosts(3, null);
    verify(source, times(1)).getTrendingPosts(10, null);
    assertThat(cache.estimatedSize()).isEqualTo(1);
  }

  @Test
  public void shouldCache_receivesArguments() {
    var calls = new ConcurrentHashMap<String, List<Object>>();
    var service = newService("", (method, args, result) -> {
      calls.put(method, args);
      return true;
    });

    service.getEngagementStats(Platform.HACKERNEWS, 14);
    service.getEngagementStats(Platform.HACKERNEWS, 14);

    assertThat(calls).containsExactly("getEngagementStats", List.of(Platform.HACKERNEWS, 14));
  }

  @Test
  public void timeSeries_singleFlight() {
    var service = newService("");
    var pending = new CompletableFuture<List<TimeSeriesPoint>>();
    when(source.getTimeSeriesData(Platform.REDDIT, WEEK)).thenReturn(pending);

    var first = service.getTimeSeriesData(Platform.REDDIT, WEEK);
    var second = service.getTimeSeriesData(Platform.REDDIT, WEEK);
    assertThat(first.isDone()).isFalse();
    assertThat(second.isDone()).isFalse();

    pending.complete(SERIES);
    assertThat(first.join()).isEqualTo(SERIES);
    assertThat(second.join()).isEqualTo(SERIES);
    assertThat(service.getTimeSeriesData(Platform.REDDIT, WEEK).join()).isEqualTo(SERIES);
    verify(source, times(1)).getTimeSeriesData(Platform.REDDIT, WEEK);
  }

  @Test
  public void timeSeries_failureNotCached() {
    var service = newService("");
    when(source.getTimeSeriesData(Platform.REDDIT, WEEK))
        .thenReturn(CompletableFuture.failedFuture(new IllegalStateException()))
        .thenReturn(CompletableFuture.completedFuture(SERIES));

    var failed = service.getTimeSeriesData(Platform.REDDIT, WEEK);
    var error = assertThrows(CompletionException.class, failed::join);
    assertThat(error).hasCauseThat().isInstanceOf(IllegalStateException.class);
    assertThat(cache.estimatedSize()).isEqualTo(0);

    assertThat(service.getTimeSeriesData(Platform.REDDIT, WEEK).join()).isEqualTo(SERIES);
    verify(source, times(2)).getTimeSeriesData(Platform.REDDIT, WEEK);
  }

  @Test
  public void timeSeries_rejectedByPredicate() {
    var service = newService("", (method, args, result) -> !method.equals("getTimeSeriesData"));

    assertThat(service.getTimeSeriesData(null, WEEK).join()).isEqualTo(SERIES);
    assertThat(service.getTimeSeriesData(null, WEEK).join()).isEqualTo(SERIES);

    verify(source, times(2)).getTimeSeriesData(null, WEEK);
    assertThat(cache.estimatedSize()).isEqualTo(0);
  }

  @Test
  public void timeSeries_rejectedResultKeepsNewerLoad() {
    var service = newService("", (method, args, result) -> !((List<?>) result).isEmpty());
    var stale = new CompletableFuture<List<TimeSeriesPoint>>();
    var fresh = new CompletableFuture<List<TimeSeriesPoint>>();
    when(source.getTimeSeriesData(Platform.REDDIT, WEEK)).thenReturn(stale).thenReturn(fresh);

    var first = service.getTimeSeriesData(Platform.REDDIT, WEEK);
    assertThat(service.invalidateCache(CacheDependency.DATA)).isEqualTo(1);
    var second = service.getTimeSeriesData(Platform.REDDIT, WEEK);

    stale.complete(List.of());
    assertThat(first.join()).isEmpty();
    assertThat(cache.estimatedSize()).isEqualTo(1);

    var third = service.getTimeSeriesData(Platform.REDDIT, WEEK);
    fresh.complete(SERIES);
    assertThat(second.join()).isEqualTo(SERIES);
    assertThat(third.join()).isEqualTo(SERIES);
    verify(source, times(2)).getTimeSeriesData(Platform.REDDIT, WEEK);
  }

  @Test
  public void timeSeries_excluded() {
    var service = newService("forum-scraper.analytics.excluded-methods = [getTimeSeriesData]");

    service.getTimeSeriesData(null, WEEK).join();
    service.getTimeSeriesData(null, WEEK).join();

    verify(source, times(2)).getTimeSeriesData(null, WEEK);
    assertThat(cache.estimatedSize()).isEqualTo(0);
  }

  @Test
  public void invalidatePlatform() {
    var service = newService("");
    service.getPlatformStats(Platform.REDDIT, null);
    service.getEngagementStats(Platform.REDDIT, 7);
    service.getPlatformStats(Platform.HACKERNEWS, null);
    service.getPlatformStats(null, null);

    assertThat(service.invalidatePlatform(Platform.REDDIT)).isEqualTo(2);

    service.getPlatformStats(Platform.REDDIT, null);
    service.getPlatformStats(Platform.HACKERNEWS, null);
    verify(source, times(2)).getPlatformStats(Platform.REDDIT, null);
    verify(source, times(1)).getPlatformStats(Platform.HACKERNEWS, null);
  }

  @Test
  public void invalidateCache_byDependency() {
    var service = newService("");
    service.getPlatformStats(Platform.REDDIT, null);
    service.getEngagementStats(null, 30);
    service.getTimeSeriesData(Platform.HACKERNEWS, WEEK).join();
    service.getTrendingPosts(10);

    assertThat(service.invalidateCache(CacheDependency.TIME_RANGE)).isEqualTo(2);
    assertThat(service.invalidateCache(CacheDependency.PLATFORM)).isEqualTo(1);
    assertThat(service.invalidateCache("data")).isEqualTo(1);
    assertThat(cache.estimatedSize()).isEqualTo(0);
    assertThat(service.getCacheStats().evictionCount()).isEqualTo(4);
  }

  @Test
  public void clearCacheFor_ignoresCase() {
    var service = newService("");
    service.getPlatformStats(Platform.REDDIT, null);
    service.getPlatformStats(Platform.HACKERNEWS, null);
    service.getEngagementStats(Platform.REDDIT, 7);

    assertThat(service.clearCacheFor("getplatformstats")).isEqualTo(2);
    assertThat(cache.keys()).containsExactly(
        CachedAnalyticsService.keyFor("getEngagementStats", Platform.REDDIT, 7));
  }

  @Test
  public void invalidatePattern() {
    var service = newService("");
    service.getTrendingPosts(5);
    service.getTrendingPosts(10);
    service.getPlatformStats(null, null);

    assertThat(service.invalidatePattern("^getTrending")).isEqualTo(2);
    assertThat(service.invalidatePattern(Pattern.compile("Stats:"))).isEqualTo(1);
    assertThat(cache.estimatedSize()).isEqualTo(0);
  }

  @Test
  public void warmUpCache() {
    var service = newService("");

    service.warmUpCache().join();

    assertThat(cache.estimatedSize()).isEqualTo(6);
    for (Platform platform : CachedAnalyticsService.WARM_UP_PLATFORMS) {
      service.getPlatformStats(platform, null);
      service.getEngagementStats(platform, 30);
      verify(source, times(1)).getPlatformStats(platform, null);
      verify(source, times(1)).getEngagementStats(platform, 30);
    }
    assertThat(service.getCacheStats().hitCount()).isEqualTo(6);
    assertThat(service.getCacheStats().loadSuccessCount()).isEqualTo(6);
  }

  @Test
  public void warmUpCache_failureIsolated() {
    var service = newService("");
    var failure = new IllegalStateException("database is locked");
    when(source.getPlatformStats(Platform.HACKERNEWS, null)).thenThrow(failure);
    var failures = new ConcurrentHashMap<String, Throwable>();

    service.warmUpCache(failures::put).join();

    assertThat(failures).containsExactly(
        CachedAnalyticsService.keyFor("getPlatformStats", Platform.HACKERNEWS, null), failure);
    assertThat(cache.estimatedSize()).isEqualTo(5);
  }

  @Test
  public void warmUpCache_skipsExcluded() {
    var service = newService("forum-scraper.analytics {"
        + " excluded-methods = [getEngagementStats], warm-up-days = 7 }");

    service.warmUpCache().join();

    assertThat(cache.estimatedSize()).isEqualTo(3);
    verify(source, never()).getEngagementStats(any(), anyInt());
  }

  @Test
  public void resetStats() {
    var service = newService("");
    service.getPlatformStats(Platform.REDDIT, null);
    service.getPlatformStats(Platform.REDDIT, null);

    service.resetStats();
    var stats = service.getCacheStats();
    assertThat(stats.hitCount()).isEqualTo(0);
    assertThat(stats.missCount()).isEqualTo(0);
    assertThat(stats.hitRate()).isEqualTo(0.0);
    assertThat(stats.entryCount()).isEqualTo(1);

    service.getPlatformStats(Platform.REDDIT, null);
    assertThat(service.getCacheStats().hitCount()).isEqualTo(1);
  }

  @Test
  public void clearCache() {
    var service = newService("");
    service.getPlatformStats(Platform.REDDIT, null);
    service.getPlatformStats(Platform.REDDIT, null);

    service.clearCache();

    assertThat(cache.estimatedSize()).isEqualTo(0);
    assertThat(service.getCacheStats().requestCount()).isEqualTo(0);
    service.getPlatformStats(Platform.REDDIT, null);
    verify(source, times(2)).getPlatformStats(Platform.REDDIT, null);
  }

  @Test
  public void serialize_roundTrip() {
    var service = newService("");
    service.getPlatformStats(Platform.REDDIT, null);
    service.getEngagementStats(null, 30);
    service.getTrendingPosts(10, Platform.REDDIT);
    service.getTimeSeriesData(Platform.REDDIT, WEEK).join();
    String json = service.serialize();

    var restoredSource = mock(AnalyticsSource.class);
    var restored = CachedAnalyticsService.newBuilder(restoredSource)
        .settings(AnalyticsCacheSettings.from(ConfigFactory.empty()))
        .cache(newCache())
        .build();

    assertThat(restored.deserialize(json)).isEqualTo(4);
    assertThat(restored.getPlatformStats(Platform.REDDIT, null)).isEqualTo(REDDIT_STATS);
    assertThat(restored.getEngagementStats(null, 30)).isEqualTo(ENGAGEMENT);
    assertThat(restored.getTrendingPosts(10, Platform.REDDIT)).isEqualTo(TRENDING);
    assertThat(restored.getTimeSeriesData(Platform.REDDIT, WEEK).join()).isEqualTo(SERIES);
    assertThat(restored.invalidatePlatform(Platform.REDDIT)).isEqualTo(3);

    verify(restoredSource, never()).getPlatformStats(any(), any());
    verify(restoredSource, never()).getEngagementStats(any(), anyInt());
    verify(restoredSource, never()).getTrendingPosts(anyInt(), any());
    verify(restoredSource, never()).getTimeSeriesData(any(), any());
  }

  @Test
  public void deserialize_malformed() {
    var service = newService("");
    service.getPlatformStats(Platform.REDDIT, null);

    assertThat(service.deserialize("{\"cache\":")).isEqualTo(0);
    assertThat(cache.estimatedSize()).isEqualTo(1);
  }

  @Test
  public void deserialize_discardsUnconvertible() {
    var service = newService("");
    String key = CachedAnalyticsService.keyFor("getPlatformStats", Platform.REDDIT, null);

    int restored = service.deserialize("{\"cache\":{\"" + key + "\":\"not stats\","
        + "\"custom:1\":{\"a\":1}}}");

    assertThat(restored).isEqualTo(1);
    assertThat(cache.keys()).containsExactly("custom:1");
    assertThat(cache.getIfPresent("custom:1")).isEqualTo(Map.of("a", 1));
    assertThat(TestLoggerFactory.getAllLoggingEvents().stream()
        .filter(event -> event.getMessage().equals("Discarding the restored result " + key))
        .count()).isEqualTo(1);
  }

  @Test
  public void destroy() {
    var service = newService("");
    service.getPlatformStats(Platform.REDDIT, null);

    service.destroy();

    assertThat(service.isDestroyed()).isTrue();
    assertThat(service.getPlatformStats(Platform.REDDIT, null)).isEqualTo(REDDIT_STATS);
    verify(source, times(2)).getPlatformStats(Platform.REDDIT, null);
    assertThat(cache.estimatedSize()).isEqualTo(0);
  }
}
