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

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * The cache's settings, read from the {@code forum-scraper.cache} section of a Typesafe
 * {@link Config}. Missing values fall back to the defaults in the module's {@code reference.conf}.
 * <p>
 * <pre>{@code
 * forum-scraper.cache {
 *   default-ttl = 5m
 *   max-entries = 1000
 *   max-size = 100MiB
 *   cleanup-interval = 1m
 *   enable-metrics = true
 *   top-keys = 10
 * }
 * }</pre>
 */
public final class CacheConfig {
  static final String PATH = "forum-scraper.cache";

  private final Config config;

  private CacheConfig(Config config) {
    this.config = requireNonNull(config);
  }

  /** Returns the settings from the application's configuration, as loaded by {@link ConfigFactory#load()}. */
  public static CacheConfig load() {
    return from(ConfigFactory.load());
  }

  /**
   * Returns the settings from the {@code forum-scraper.cache} section of the given configuration.
   *
   * @param root the root configuration
   * @return the cache settings
   * @throws com.typesafe.config.ConfigException if a value is missing or has the wrong type
   */
  public static CacheConfig from(Config root) {
    Config resolved = root.withFallback(ConfigFactory.defaultReference()).resolve();
    return new CacheConfig(resolved.getConfig(PATH));
  }

  /** Returns the time-to-live of entries stored without an explicit one. */
  public Duration defaultTtl() {
    return config.getDuration("default-ttl");
  }

  /** Returns the maximum number of entries before the least recently used ones are evicted. */
  public long maxEntries() {
    return config.getLong("max-entries");
  }

  /** Returns the maximum estimated size, in bytes, before the least recently used are evicted. */
  public long maxSizeBytes() {
    return config.getBytes("max-size");
  }

  /** Returns the period of the expiration sweep; zero or negative disables it. */
  public Duration cleanupInterval() {
    return config.getDuration("cleanup-interval");
  }

  /** Returns whether hit, miss, load and eviction statistics are recorded. */
  public boolean enableMetrics() {
    return config.getBoolean("enable-metrics");
  }

  /** Returns the number of most frequently hit keys reported by the statistics. */
  public int topKeys() {
    return config.getInt("top-keys");
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{'
        + "defaultTtl=" + defaultTtl() + ", "
        + "maxEntries=" + maxEntries() + ", "
        + "maxSizeBytes=" + maxSizeBytes() + ", "
        + "cleanupInterval=" + cleanupInterval() + ", "
        + "enableMetrics=" + enableMetrics() + ", "
        + "topKeys=" + topKeys()
        + '}';
  }
}
