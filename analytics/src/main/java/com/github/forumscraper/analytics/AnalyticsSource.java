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
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

/**
 * The uncached analytics computations over the scraped data. Implementations query the database
 * and may be slow; {@link CachedAnalyticsService} calls them only on a cache miss.
 */
public interface AnalyticsSource {

  /**
   * Returns the totals of a platform's content.
   *
   * @param platform the platform, or {@code null} for every platform combined
   * @param range the period to restrict the totals to, or {@code null} for all time
   * @return the statistics, or {@code null} if nothing has been scraped
   */
  @Nullable
  PlatformStats getPlatformStats(@Nullable Platform platform, @Nullable DateRange range);

  /**
   * Returns the engagement rates of the posts scraped in the last {@code days}.
   *
   * @param platform the platform, or {@code null} for every platform combined
   * @param days the number of days to look back
   */
  EngagementStats getEngagementStats(@Nullable Platform platform, int days);

  /**
   * Returns the daily activity counts within the range.
   *
   * @param platform the platform, or {@code null} for every platform combined
   * @param range the period to report
   */
  CompletableFuture<List<TimeSeriesPoint>> getTimeSeriesData(
      @Nullable Platform platform, DateRange range);

  /**
   * Returns the hottest posts, most trending first.
   *
   * @param limit the maximum number of posts
   * @param platform the platform, or {@code null} for every platform combined
   */
  List<TrendingPost> getTrendingPosts(int limit, @Nullable Platform platform);
}
