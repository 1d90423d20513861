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

import static java.util.Objects.requireNonNull;

import java.time.Duration;

import com.google.common.collect.ImmutableSet;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;
import com.typesafe.config.ConfigUtil;

/**
 * The analytics service's cache settings, read from the {@code forum-scraper.analytics} section of
 * a Typesafe {@link Config} with the module's {@code reference.conf} as the fallback.
 */
public final class AnalyticsCacheSettings {
  static final String PATH = "forum-scraper.analytics";

  private final Config config;

  private AnalyticsCacheSettings(Config config) {
    this.config = requireNonNull(config);
  }

  /** Returns the settings from the application's configuration. */
  public static AnalyticsCacheSettings load() {
    return from(ConfigFactory.load());
  }

  /**
   * Returns the settings from the {@code forum-scraper.analytics} section of the configuration.
   *
   * @throws com.typesafe.config.ConfigException if a value is missing or has the wrong type
   */
  public static AnalyticsCacheSettings from(Config root) {
    Config resolved = root.withFallback(ConfigFactory.defaultReference()).resolve();
    return new AnalyticsCacheSettings(resolved.getConfig(PATH));
  }

  public Duration defaultTtl() {
    return config.getDuration("ttl.default");
  }

  /** Returns the time-to-live of the method's results, or the default if it has no override. */
  public Duration ttlFor(String method) {
    String path = ConfigUtil.joinPath("ttl", method);
    return config.hasPath(path) ? config.getDuration(path) : defaultTtl();
  }

  public long maxEntries() {
    return config.getLong("max-entries");
  }

  public long maxSizeBytes() {
    return config.getBytes("max-size");
  }

  public Duration cleanupInterval() {
    return config.getDuration("cleanup-interval");
  }

  public boolean cacheErrors() {
    return config.getBoolean("cache-errors");
  }

  public Duration errorTtl() {
    return config.getDuration("error-ttl");
  }

  public int warmUpDays() {
    return config.getInt("warm-up-days");
  }

  /** Returns the methods whose results are never cached. */
  public ImmutableSet<String> excludedMethods() {
    return ImmutableSet.copyOf(config.getStringList("excluded-methods"));
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{' + config.root().render(ConfigRenderOptions.concise()) + '}';
  }
}
