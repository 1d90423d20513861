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

import static java.util.Locale.US;

/** The forums that are scraped. */
public enum Platform {
  REDDIT("reddit"),
  HACKERNEWS("hackernews");

  private final String id;

  Platform(String id) {
    this.id = id;
  }

  /** Returns the lowercase identifier used in storage and dependency tags. */
  public String id() {
    return id;
  }

  /** Returns the dependency tag of the data scraped from this platform. */
  public String tag() {
    return CacheDependency.PLATFORM.tag() + ':' + id;
  }

  /**
   * Returns the platform with the identifier, ignoring case.
   *
   * @throws IllegalArgumentException if no platform has the identifier
   */
  public static Platform of(String id) {
    String normalized = id.trim().toLowerCase(US);
    for (Platform platform : values()) {
      if (platform.id.equals(normalized)) {
        return platform;
      }
    }
    throw new IllegalArgumentException("Unknown platform: " + id);
  }
}
