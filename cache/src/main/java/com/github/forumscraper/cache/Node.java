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

import org.jspecify.annotations.Nullable;

import com.github.forumscraper.cache.AccessOrderDeque.AccessOrder;
import com.google.common.collect.ImmutableSet;

/**
 * An entry in the cache containing the key, value, dependency tags, estimated size, and the
 * timestamps and counters used for expiration, LRU ordering and statistics. The key, value and
 * tags never change; storing a new value for the key creates a new node. All mutable state is
 * guarded by the cache's lock.
 *
 * @param <V> the type of value
 */
final class Node<V> implements AccessOrder<Node<V>> {
  final String key;
  final @Nullable V value;
  final ImmutableSet<String> dependencies;
  final long createdAt;
  final long expiresAt;

  long sizeBytes;
  long hitCount;
  long lastAccessedAt;

  @Nullable Node<V> previousInAccessOrder;
  @Nullable Node<V> nextInAccessOrder;

  Node(String key, @Nullable V value, ImmutableSet<String> dependencies,
      long sizeBytes, long now, long expiresAt) {
    this.key = requireNonNull(key);
    this.dependencies = requireNonNull(dependencies);
    this.value = value;
    this.sizeBytes = sizeBytes;
    this.expiresAt = expiresAt;
    this.lastAccessedAt = now;
    this.createdAt = now;
  }

  /** Returns if the entry's time-to-live has elapsed at the given ticker reading. */
  boolean hasExpired(long now) {
    return (now >= expiresAt);
  }

  /** Records a successful read of the entry. */
  void recordHit(long now) {
    lastAccessedAt = now;
    hitCount++;
  }

  /** Returns an immutable view of the entry as of the given ticker reading. */
  CacheEntry<V> snapshot(long now) {
    return new CacheEntry<>(key, value, dependencies, sizeBytes,
        hitCount, createdAt, lastAccessedAt, expiresAt, now);
  }

  @Override
  public @Nullable Node<V> getPreviousInAccessOrder() {
    return previousInAccessOrder;
  }

  @Override
  public void setPreviousInAccessOrder(@Nullable Node<V> prev) {
    this.previousInAccessOrder = prev;
  }

  @Override
  public @Nullable Node<V> getNextInAccessOrder() {
    return nextInAccessOrder;
  }

  @Override
  public void setNextInAccessOrder(@Nullable Node<V> next) {
    this.nextInAccessOrder = next;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{'
        + "key=" + key + ", "
        + "dependencies=" + dependencies + ", "
        + "sizeBytes=" + sizeBytes + ", "
        + "hitCount=" + hitCount + ", "
        + "createdAt=" + createdAt + ", "
        + "expiresAt=" + expiresAt
        + '}';
  }
}
