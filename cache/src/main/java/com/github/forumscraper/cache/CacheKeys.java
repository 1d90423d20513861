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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.hash.Hashing;

/**
 * Derives cache keys from a namespace and arbitrary parameters. The parameters are converted into a
 * canonical JSON form, where every object's fields are sorted by name at every depth and dates are
 * written as ISO-8601 strings, so that structurally equal parameters always produce the same key
 * regardless of property order. The key is {@code namespace + ":" + digest}, where the digest is
 * the first 16 hexadecimal characters of the SHA-256 hash of the canonical form.
 */
public final class CacheKeys {
  static final int DIGEST_LENGTH = 16;

  private static final ObjectMapper mapper = newObjectMapper();

  private CacheKeys() {}

  /**
   * Returns the cache key for the parameters within the namespace.
   *
   * @param namespace the prefix identifying the kind of computation
   * @param params the parameters of the computation, which may be {@code null}
   * @return a key of the form {@code namespace:digest}
   * @throws IllegalArgumentException if the parameters cannot be converted into JSON
   */
  public static String generateKey(String namespace, @Nullable Object params) {
    requireNonNull(namespace);
    return namespace + ':' + digest(params);
  }

  /**
   * Returns the first 16 hexadecimal characters of the SHA-256 hash of the parameters' canonical
   * form.
   *
   * @throws IllegalArgumentException if the parameters cannot be converted into JSON
   */
  public static String digest(@Nullable Object params) {
    String canonical = canonicalize(params);
    return Hashing.sha256().hashString(canonical, UTF_8).toString().substring(0, DIGEST_LENGTH);
  }

  /**
   * Returns the canonical JSON form of the parameters.
   *
   * @throws IllegalArgumentException if the parameters cannot be converted into JSON
   */
  public static String canonicalize(@Nullable Object params) {
    JsonNode tree;
    try {
      tree = (params == null) ? JsonNodeFactory.instance.nullNode() : mapper.valueToTree(params);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Cannot derive a cache key from the parameters", e);
    }
    try {
      return mapper.writeValueAsString(sorted(tree));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot derive a cache key from " + tree, e);
    }
  }

  /** Returns a copy of the tree where every object's fields are ordered by name. */
  static JsonNode sorted(JsonNode node) {
    if (node.isObject()) {
      var names = new ArrayList<String>(node.size());
      for (Iterator<String> it = node.fieldNames(); it.hasNext();) {
        names.add(it.next());
      }
      Collections.sort(names);

      ObjectNode copy = JsonNodeFactory.instance.objectNode();
      for (String name : names) {
        copy.set(name, sorted(node.get(name)));
      }
      return copy;
    } else if (node.isArray()) {
      ArrayNode copy = JsonNodeFactory.instance.arrayNode(node.size());
      for (JsonNode element : node) {
        copy.add(sorted(element));
      }
      return copy;
    }
    return node;
  }

  /** Returns the argument list used as the parameters of a memoized call. */
  static List<@Nullable Object> arguments(@Nullable Object... args) {
    var list = new ArrayList<@Nullable Object>(args.length);
    Collections.addAll(list, args);
    return list;
  }

  /**
   * Returns a mapper configured the same way for keys, size estimates and snapshots: java.time
   * support, dates as ISO-8601 strings, and beans without properties allowed. Values restored
   * from a snapshot as JSON trees may be converted back to their types with it.
   */
  public static ObjectMapper newObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
  }
}
