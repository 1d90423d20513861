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

import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.forumscraper.cache.stats.CacheStats;
import com.github.forumscraper.cache.stats.KeyHits;
import com.google.common.collect.ImmutableSet;

/**
 * Converts a cache's contents to and from JSON. The document has the layout
 * <pre>{@code
 * {
 *   "cache": { "<key>": <value>, ... },
 *   "stats": { "hits": 0, "misses": 0, "evictions": 0, "entries": 0, "size": 0,
 *              "avgEntrySize": 0.0, "hitRate": 0.0, "topKeys": [ { "key": "...", "hits": 0 } ] },
 *   "timestamp": "2026-01-01T00:00:00Z",
 *   "entries": { "<key>": { "ttlMillis": 1000, "dependencies": [ "..." ] }, ... }
 * }
 * }</pre>
 * Only the {@code cache} section is required when restoring; an entry without metadata gets the
 * cache's default time-to-live and no dependency tags.
 */
final class CacheSnapshot {
  static final Logger logger = System.getLogger(CacheSnapshot.class.getName());
  static final ObjectMapper mapper = CacheKeys.newObjectMapper();

  private CacheSnapshot() {}

  /** Returns the JSON document of the entries and statistics. */
  static String serialize(List<? extends CacheEntry<?>> entries, CacheStats stats) {
    ObjectNode root = mapper.createObjectNode();
    ObjectNode values = root.putObject("cache");
    ObjectNode statsNode = root.putObject("stats");
    root.put("timestamp", Instant.now().toString());
    ObjectNode metadata = root.putObject("entries");

    for (CacheEntry<?> entry : entries) {
      JsonNode value;
      try {
        value = toJson(entry.getValue());
      } catch (IllegalArgumentException e) {
        logger.log(Level.WARNING, "Skipping unserializable cache entry " + entry.getKey(), e);
        continue;
      }
      if (value == null) {
        continue;
      }
      values.set(entry.getKey(), value);

      ObjectNode meta = metadata.putObject(entry.getKey());
      meta.put("ttlMillis", entry.expiresAfter().toMillis());
      ArrayNode tags = meta.putArray("dependencies");
      entry.dependencies().forEach(tags::add);
    }

    statsNode.put("hits", stats.hitCount());
    statsNode.put("misses", stats.missCount());
    statsNode.put("evictions", stats.evictionCount());
    statsNode.put("entries", stats.entryCount());
    statsNode.put("size", stats.totalSize());
    statsNode.put("avgEntrySize", stats.averageEntrySize());
    statsNode.put("hitRate", stats.hitRate());
    ArrayNode topKeys = statsNode.putArray("topKeys");
    for (KeyHits keyHits : stats.topKeys()) {
      topKeys.addObject().put("key", keyHits.key()).put("hits", keyHits.hits());
    }

    try {
      return mapper.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Returns the JSON form of the value, or {@code null} if it is an asynchronous value that has not
   * completed successfully.
   */
  static @Nullable JsonNode toJson(@Nullable Object value) {
    if (value instanceof CompletableFuture<?>) {
      var future = (CompletableFuture<?>) value;
      if (!future.isDone() || future.isCompletedExceptionally()) {
        return null;
      }
      return toJson(future.join());
    }
    return (value == null) ? NullNode.getInstance() : mapper.valueToTree(value);
  }

  /**
   * Returns the entries of the JSON document converted to {@code valueType}, or an empty list if
   * the document is malformed. Nothing is returned unless every entry converts.
   */
  static <V> List<Restored<V>> deserialize(String json, Class<? extends V> valueType) {
    JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      logger.log(Level.WARNING, "Failed to parse the cache snapshot", e);
      return List.of();
    }
    JsonNode values = (root == null) ? null : root.get("cache");
    if ((values == null) || !values.isObject()) {
      logger.log(Level.WARNING, "Ignoring a cache snapshot without a \"cache\" object");
      return List.of();
    }
    JsonNode metadata = root.path("entries");

    var restored = new ArrayList<Restored<V>>(values.size());
    for (Iterator<Map.Entry<String, JsonNode>> it = values.fields(); it.hasNext();) {
      var field = it.next();
      String key = field.getKey();
      @Nullable V value;
      try {
        value = field.getValue().isNull() ? null : mapper.treeToValue(field.getValue(), valueType);
      } catch (JsonProcessingException | IllegalArgumentException e) {
        logger.log(Level.WARNING, "Failed to restore the cache snapshot entry " + key, e);
        return List.of();
      }

      JsonNode meta = metadata.path(key);
      JsonNode ttlMillis = meta.path("ttlMillis");
      Duration ttl = ttlMillis.canConvertToLong() ? Duration.ofMillis(ttlMillis.asLong()) : null;
      var dependencies = ImmutableSet.<String>builder();
      for (JsonNode tag : meta.path("dependencies")) {
        if (tag.isTextual()) {
          dependencies.add(tag.asText());
        }
      }
      restored.add(new Restored<>(key, value, ttl, dependencies.build()));
    }
    return restored;
  }

  /** An entry read from a snapshot. */
  record Restored<V>(String key, @Nullable V value,
      @Nullable Duration ttl, ImmutableSet<String> dependencies) {}
}
