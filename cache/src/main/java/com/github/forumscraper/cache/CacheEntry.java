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
import java.util.Map;
import java.util.Objects;

import org.checkerframework.checker.index.qual.NonNegative;
import org.jspecify.annotations.Nullable;

import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.Immutable;

/**
 * An immutable snapshot of a cache entry, taken at the ticker reading {@link #snapshotAt()}. All
 * timestamps are {@link Ticker} readings in nanoseconds and are only meaningful relative to each
 * other. The entry's value may be {@code null} when a {@code null} result was cached.
 *
 * @param <V> the type of the value
 */
@Immutable(containerOf = "V")
public final class CacheEntry<V> implements Map.Entry<String, @Nullable V> {
  private final String key;
  private final @Nullable V value;
  private final ImmutableSet<String> dependencies;
  private final long sizeBytes;
  private final long hitCount;
  private final long createdAt;
  private final long lastAccessedAt;
  private final long expiresAt;
  private final long snapshotAt;

  CacheEntry(String key, @Nullable V value, ImmutableSet<String> dependencies, long sizeBytes,
      long hitCount, long createdAt, long lastAccessedAt, long expiresAt, long snapshotAt) {
    this.key = requireNonNull(key);
    this.dependencies = requireNonNull(dependencies);
    this.lastAccessedAt = lastAccessedAt;
    this.snapshotAt = snapshotAt;
    this.sizeBytes = sizeBytes;
    this.createdAt = createdAt;
    this.expiresAt = expiresAt;
    this.hitCount = hitCount;
    this.value = value;
  }

  @Override
  public String getKey() {
    return key;
  }

  @Override
  public @Nullable V getValue() {
    return value;
  }

  /** Entries are read-only snapshots; this always throws. */
  @Override
  public @Nullable V setValue(@Nullable V value) {
    throw new UnsupportedOperationException();
  }

  /** Returns the dependency tags that the entry was stored with. */
  public ImmutableSet<String> dependencies() {
    return dependencies;
  }

  /** Returns the estimated size of the entry in bytes, as computed by the cache's weigher. */
  public @NonNegative long sizeBytes() {
    return sizeBytes;
  }

  /** Returns the number of reads that found this entry. */
  public @NonNegative long hitCount() {
    return hitCount;
  }

  /** Returns the ticker reading when the entry was stored. */
  public long createdAt() {
    return createdAt;
  }

  /** Returns the ticker reading of the last read that found this entry, or its creation time. */
  public long lastAccessedAt() {
    return lastAccessedAt;
  }

  /**
   * Returns the ticker reading at which the entry expires. An entry is expired once the ticker
   * reads a value greater than or equal to this one.
   */
  public long expiresAt() {
    return expiresAt;
  }

  /** Returns the ticker reading when this snapshot was taken. */
  public long snapshotAt() {
    return snapshotAt;
  }

  /**
   * Returns the time remaining until the entry expires, relative to when the snapshot was taken,
   * or {@link Duration#ZERO} if it has already expired.
   */
  public Duration expiresAfter() {
    long remaining = expiresAt - snapshotAt;
    if (((expiresAt ^ snapshotAt) & (expiresAt ^ remaining)) < 0) {
      // overflowed, the expiration time is effectively unbounded
      return Duration.ofNanos(Long.MAX_VALUE);
    }
    return Duration.ofNanos(Math.max(0L, remaining));
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (o == this) {
      return true;
    } else if (!(o instanceof Map.Entry)) {
      return false;
    }
    var entry = (Map.Entry<?, ?>) o;
    return key.equals(entry.getKey()) && Objects.equals(value, entry.getValue());
  }

  @Override
  public int hashCode() {
    return key.hashCode() ^ Objects.hashCode(value);
  }

  @Override
  public String toString() {
    return key + '=' + value;
  }
}
