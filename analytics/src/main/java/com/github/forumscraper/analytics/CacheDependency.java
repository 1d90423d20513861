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

import org.jspecify.annotations.Nullable;

/**
 * The groups of inputs that cached analytics results derive from. Each result is tagged with the
 * groups it depends on, and invalidating a group's tag discards every result derived from it.
 */
public enum CacheDependency {
  /** Raw scraped posts, comments and users. */
  DATA("data"),
  /** The time window a result was computed over. */
  TIME_RANGE("time"),
  /** Results spanning every platform. */
  PLATFORM("platform"),
  /** The analytics configuration. */
  CONFIG("config"),
  /** User specific data. */
  USER("user");

  private final String tag;

  CacheDependency(String tag) {
    this.tag = tag;
  }

  /** Returns the dependency tag. */
  public String tag() {
    return tag;
  }

  /**
   * Returns the tag of a platform's data, or the cross-platform {@link #PLATFORM} tag when no
   * platform is given.
   */
  public static String forPlatform(@Nullable Platform platform) {
    return (platform == null) ? PLATFORM.tag() : platform.tag();
  }
}
