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
/**
 * Cached access to the forum scraper's analytics. {@link
 * com.github.forumscraper.analytics.CachedAnalyticsService} serves platform, engagement, time
 * series and trending queries from a {@link com.github.forumscraper.cache.Cache}, tagging each
 * result with the {@link com.github.forumscraper.analytics.CacheDependency} groups it derives
 * from so that new data invalidates exactly the affected results.
 */
@NullMarked
package com.github.forumscraper.analytics;

import org.jspecify.annotations.NullMarked;
