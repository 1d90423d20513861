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

/**
 * The reason why a cached entry was removed.
 */
public enum RemovalCause {

  /**
   * The entry was manually removed by the user through {@link Cache#delete}, {@link Cache#clear}
   * or {@link Cache#destroy}.
   */
  EXPLICIT {
    @Override public boolean wasEvicted() {
      return false;
    }
  },

  /**
   * The entry itself was not actually removed, but its value was replaced by a later
   * {@link Cache#set}.
   */
  REPLACED {
    @Override public boolean wasEvicted() {
      return false;
    }
  },

  /**
   * The entry was removed as part of a group invalidation, either through one of its dependency
   * tags ({@link Cache#invalidateByDependency}) or because its key matched a pattern
   * ({@link Cache#invalidateByPattern}).
   */
  INVALIDATED {
    @Override public boolean wasEvicted() {
      return true;
    }
  },

  /**
   * The entry's expiration timestamp has passed. It was discovered either by a read or by the
   * periodic sweep.
   */
  EXPIRED {
    @Override public boolean wasEvicted() {
      return true;
    }
  },

  /**
   * The entry was evicted because the cache exceeded its maximum entry count or its maximum
   * estimated size.
   */
  SIZE {
    @Override public boolean wasEvicted() {
      return true;
    }
  };

  /**
   * Returns {@code true} if the removal is counted as an eviction (the cause is neither
   * {@link #EXPLICIT} nor {@link #REPLACED}).
   *
   * @return if the entry was removed by the cache rather than by the user
   */
  public abstract boolean wasEvicted();
}
