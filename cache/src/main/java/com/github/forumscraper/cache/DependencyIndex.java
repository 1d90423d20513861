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

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * A reverse index from a dependency tag to the keys currently stored with that tag. A key appears
 * under every tag of its entry and under no other tag; a tag without keys is dropped from the
 * index.
 * <p>
 * This class is not thread-safe; the cache only touches it while holding its lock.
 */
final class DependencyIndex {
  final Map<String, Set<String>> keysByTag;

  DependencyIndex() {
    keysByTag = new HashMap<>();
  }

  /** Associates the key with each of the tags. */
  void add(String key, Set<String> tags) {
    for (var tag : tags) {
      keysByTag.computeIfAbsent(tag, t -> new LinkedHashSet<>()).add(key);
    }
  }

  /** Dissociates the key from each of the tags, dropping tags that no longer have keys. */
  void remove(String key, Set<String> tags) {
    for (var tag : tags) {
      var keys = keysByTag.get(tag);
      if (keys != null) {
        keys.remove(key);
        if (keys.isEmpty()) {
          keysByTag.remove(tag);
        }
      }
    }
  }

  /**
   * Moves the key from its prior tags to its new ones, touching only the tags that differ between
   * the two sets.
   */
  void replace(String key, Set<String> oldTags, Set<String> newTags) {
    if (oldTags.equals(newTags)) {
      return;
    }
    remove(key, Sets.difference(oldTags, newTags));
    add(key, Sets.difference(newTags, oldTags));
  }

  /** Returns a copy of the keys tagged with {@code tag}, which is safe to use while removing. */
  ImmutableSet<String> keysFor(String tag) {
    var keys = keysByTag.get(tag);
    return (keys == null) ? ImmutableSet.of() : ImmutableSet.copyOf(keys);
  }

  /** Returns the tags that currently have at least one key. */
  ImmutableSet<String> tags() {
    return ImmutableSet.copyOf(keysByTag.keySet());
  }

  boolean isEmpty() {
    return keysByTag.isEmpty();
  }

  void clear() {
    keysByTag.clear();
  }
}
