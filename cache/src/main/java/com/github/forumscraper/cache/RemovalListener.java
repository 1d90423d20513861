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

import org.jspecify.annotations.Nullable;

/**
 * An object that can receive a notification when an entry is removed from a cache. The removal
 * resulting in notification could have occurred to an entry being manually removed or replaced, or
 * due to eviction resulting from expiration, a capacity ceiling, or a group invalidation.
 * <p>
 * Notifications are delivered on the cache's executor after the cache's lock has been released. An
 * exception thrown by the listener is logged and otherwise ignored.
 *
 * @param <V> the most general type of values this listener can listen for
 */
@FunctionalInterface
public interface RemovalListener<V> {

  /**
   * Notifies the listener that a removal occurred at some point in the past.
   *
   * @param key the key represented by this entry
   * @param value the value represented by this entry, which may be a cached {@code null}
   * @param cause the reason for which the entry was removed
   */
  void onRemoval(String key, @Nullable V value, RemovalCause cause);
}
