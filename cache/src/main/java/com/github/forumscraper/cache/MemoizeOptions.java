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

import static com.github.forumscraper.cache.CacheBuilder.requireState;
import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;

import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;

/**
 * The settings of a memoized function: the namespace of its keys, the time-to-live and dependency
 * tags of its entries, and an optional key generator that replaces the default
 * {@link CacheKeys#generateKey} derivation from the call's arguments.
 */
@Immutable
public final class MemoizeOptions {
  private static final MemoizeOptions DEFAULTS = newBuilder().build();

  private final @Nullable String namespace;
  private final @Nullable Duration ttl;
  private final ImmutableSet<String> dependencies;
  @SuppressWarnings("Immutable")
  private final @Nullable Function<List<@Nullable Object>, String> keyGenerator;

  private MemoizeOptions(Builder builder) {
    this.namespace = builder.namespace;
    this.ttl = builder.ttl;
    this.dependencies = builder.dependencies.build();
    this.keyGenerator = builder.keyGenerator;
  }

  /** Returns options that use the function's class name as the namespace and the cache defaults. */
  public static MemoizeOptions defaults() {
    return DEFAULTS;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Returns the key namespace, if one was specified. */
  public Optional<String> namespace() {
    return Optional.ofNullable(namespace);
  }

  /** Returns the time-to-live of the memoized entries, or {@code null} for the cache default. */
  public @Nullable Duration ttl() {
    return ttl;
  }

  public ImmutableSet<String> dependencies() {
    return dependencies;
  }

  /** Returns the custom key generator, if one was specified. */
  public Optional<Function<List<@Nullable Object>, String>> keyGenerator() {
    return Optional.ofNullable(keyGenerator);
  }

  /**
   * Returns the cache key of a call with the given arguments.
   *
   * @param function the memoized function, whose class name is the fallback namespace
   * @param args the call's arguments
   */
  String keyFor(Object function, List<@Nullable Object> args) {
    if (keyGenerator != null) {
      return requireNonNull(keyGenerator.apply(args), "key generator returned null");
    }
    String ns = (namespace == null) ? function.getClass().getName() : namespace;
    return CacheKeys.generateKey(ns, args);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{'
        + "namespace=" + namespace + ", "
        + "ttl=" + ttl + ", "
        + "dependencies=" + dependencies + ", "
        + "keyGenerator=" + (keyGenerator != null)
        + '}';
  }

  /** A builder of {@link MemoizeOptions}. */
  public static final class Builder {
    final ImmutableSet.Builder<String> dependencies = ImmutableSet.builder();
    @Nullable Function<List<@Nullable Object>, String> keyGenerator;
    @Nullable String namespace;
    @Nullable Duration ttl;

    Builder() {}

    /** Specifies the prefix of the generated keys; defaults to the function's class name. */
    @CanIgnoreReturnValue
    public Builder namespace(String namespace) {
      requireState(this.namespace == null, "namespace was already set to %s", this.namespace);
      this.namespace = requireNonNull(namespace);
      return this;
    }

    /** Specifies the time-to-live of the memoized entries; defaults to the cache's. */
    @CanIgnoreReturnValue
    public Builder ttl(Duration ttl) {
      requireState(this.ttl == null, "ttl was already set to %s", this.ttl);
      this.ttl = requireNonNull(ttl);
      return this;
    }

    /** Adds dependency tags to the memoized entries. */
    @CanIgnoreReturnValue
    public Builder dependencies(String... dependencies) {
      this.dependencies.add(dependencies);
      return this;
    }

    /** Adds dependency tags to the memoized entries. */
    @CanIgnoreReturnValue
    public Builder dependencies(Iterable<String> dependencies) {
      this.dependencies.addAll(dependencies);
      return this;
    }

    /**
     * Specifies how to derive the key from the call's arguments, replacing the default of the
     * namespace followed by the digest of the arguments.
     */
    @CanIgnoreReturnValue
    public Builder keyGenerator(Function<List<@Nullable Object>, String> keyGenerator) {
      requireState(this.keyGenerator == null, "key generator was already set");
      this.keyGenerator = requireNonNull(keyGenerator);
      return this;
    }

    public MemoizeOptions build() {
      return new MemoizeOptions(this);
    }
  }
}
