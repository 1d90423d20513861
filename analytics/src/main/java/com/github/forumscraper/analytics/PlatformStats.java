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

import java.time.Instant;

import org.jspecify.annotations.Nullable;

/**
 * The totals and averages of a platform's scraped content.
 *
 * @param platform the platform, or {@code null} for every platform combined
 * @param mostActiveUser the user with the most posts and comments, if any
 */
public record PlatformStats(@Nullable Platform platform, long totalPosts, long totalComments,
    long totalUsers, double avgScore, double avgPostScore, double avgCommentScore,
    double avgCommentCount, @Nullable ActiveUser mostActiveUser, Instant lastUpdateTime) {

  /** A user's contribution counts. */
  public record ActiveUser(String username, long posts, long comments) {}
}
