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

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.regex.Pattern;

import org.jspecify.annotations.Nullable;

import com.github.forumscraper.cache.stats.CacheStats;
import com.github.forumscraper.cache.stats.KeyHits;
import com.github.forumscraper.cache.stats.StatsCounter;
import com.google.common.collect.Comparators;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.concurrent.GuardedBy;

/**
 * An in-memory cache guarded by a single lock. The lock covers the entry map, the access-order
 * deque, the dependency index and the size accounting, so that every operation observes and leaves
 * them consistent with each other. Weighing, removal notifications, memoized functions and warm-up
 * tasks run outside of the lock.
 *
 * @param <V> the type of mapped values
 */
final class LocalCache<V> implements Cache<V> {
  static final Logger logger = System.getLogger(LocalCache.class.getName());

  final ReentrantLock lock;
  @GuardedBy("lock")
  final HashMap<String, Node<V>> data;
  @GuardedBy("lock")
  final AccessOrderDeque<Node<V>> accessOrderDeque;
  @GuardedBy("lock")
  final DependencyIndex dependencyIndex;
  @GuardedBy("lock")
  long totalSize;
  volatile boolean destroyed;

  final @Nullable RemovalListener<V> removalListener;
  final Executor executor;
  final StatsCounter statsCounter;
  final boolean recordStats;
  final Weigher<V> weigher;
  final Ticker ticker;
  final long defaultTtlNanos;
  final long maximumEntries;
  final long maximumSizeBytes;
  final int topKeys;
  final Sweeper sweeper;

  LocalCache(CacheBuilder<? super V> builder) {
    this.lock = new ReentrantLock();
    this.data = new HashMap<>();
    this.accessOrderDeque = new AccessOrderDeque<>();
    this.dependencyIndex = new DependencyIndex();
    this.defaultTtlNanos = saturatedToNanos(builder.getDefaultTtl());
    this.maximumSizeBytes = builder.getMaximumSizeBytes();
    this.maximumEntries = builder.getMaximumEntries();
    this.removalListener = builder.getRemovalListener();
    this.recordStats = builder.isRecordingStats();
    this.statsCounter = builder.getStatsCounter();
    this.executor = builder.getExecutor();
    this.weigher = builder.getWeigher();
    this.topKeys = builder.getTopKeys();
    this.ticker = builder.getTicker();
    this.sweeper = new Sweeper(builder.getScheduler(), this::cleanUp,
        builder.getCleanupInterval());
    sweeper.start();
  }

  /** Returns the cache's implementation, which the memoizer needs for its atomic operations. */
  static <V> LocalCache<V> asLocalCache(Cache<V> cache) {
    if (cache instanceof LocalCache<?>) {
      return (LocalCache<V>) cache;
    }
    throw new IllegalArgumentException("Unsupported cache implementation: " + cache.getClass());
  }

  /* --------------- Reads --------------- */

  @Override
  public @Nullable V getIfPresent(String key) {
    CacheEntry<V> entry = getEntry(key);
    return (entry == null) ? null : entry.getValue();
  }

  @Override
  public @Nullable CacheEntry<V> getEntry(String key) {
    requireNonNull(key);
    var removals = new ArrayList<Removal<V>>(1);
    @Nullable CacheEntry<V> entry = null;
    lock.lock();
    try {
      if (!destroyed) {
        long now = ticker.read();
        Node<V> node = liveNode(key, now, removals);
        if (node == null) {
          statsCounter.recordMisses(1);
        } else {
          entry = onHit(node, now);
        }
      }
    } finally {
      lock.unlock();
    }
    notifyRemovals(removals);
    return entry;
  }

  @Override
  public boolean containsKey(String key) {
    requireNonNull(key);
    lock.lock();
    try {
      if (destroyed) {
        return false;
      }
      Node<V> node = data.get(key);
      return (node != null) && !node.hasExpired(ticker.read());
    } finally {
      lock.unlock();
    }
  }

  /** Returns the live node for the key, removing it if it has expired. */
  @GuardedBy("lock")
  @Nullable Node<V> liveNode(String key, long now, List<Removal<V>> removals) {
    Node<V> node = data.get(key);
    if ((node != null) && node.hasExpired(now)) {
      removeNode(node, RemovalCause.EXPIRED, removals);
      return null;
    }
    return node;
  }

  @GuardedBy("lock")
  CacheEntry<V> onHit(Node<V> node, long now) {
    node.recordHit(now);
    accessOrderDeque.moveToBack(node);
    statsCounter.recordHits(1);
    return node.snapshot(now);
  }

  /* --------------- Writes --------------- */

  @Override
  public void set(String key, @Nullable V value) {
    set(key, value, /* ttl= */ null, Set.of());
  }

  @Override
  public void set(String key, @Nullable V value, Duration ttl) {
    set(key, value, requireNonNull(ttl), Set.of());
  }

  @Override
  public void set(String key, @Nullable V value, Set<String> dependencies) {
    set(key, value, /* ttl= */ null, dependencies);
  }

  @Override
  public void set(String key, @Nullable V value,
      @Nullable Duration ttl, Set<String> dependencies) {
    requireNonNull(key);
    var tags = ImmutableSet.copyOf(dependencies);
    long ttlNanos = (ttl == null) ? defaultTtlNanos : saturatedToNanos(ttl);
    long sizeBytes = weigher.weigh(key, value);

    var removals = new ArrayList<Removal<V>>(1);
    lock.lock();
    try {
      if (!destroyed) {
        put(key, value, tags, sizeBytes, ttlNanos, ticker.read(), removals);
      }
    } finally {
      lock.unlock();
    }
    notifyRemovals(removals);
  }

  @Override
  public @Nullable CacheEntry<V> setIfAbsent(String key, @Nullable V value,
      @Nullable Duration ttl, Set<String> dependencies) {
    requireNonNull(key);
    var tags = ImmutableSet.copyOf(dependencies);
    long ttlNanos = (ttl == null) ? defaultTtlNanos : saturatedToNanos(ttl);
    long sizeBytes = weigher.weigh(key, value);

    var removals = new ArrayList<Removal<V>>(1);
    @Nullable CacheEntry<V> existing = null;
    lock.lock();
    try {
      if (!destroyed) {
        long now = ticker.read();
        Node<V> node = liveNode(key, now, removals);
        if (node == null) {
          statsCounter.recordMisses(1);
          put(key, value, tags, sizeBytes, ttlNanos, now, removals);
        } else {
          existing = onHit(node, now);
        }
      }
    } finally {
      lock.unlock();
    }
    notifyRemovals(removals);
    return existing;
  }

  /** Stores the entry, replacing any prior one, and then evicts down to the ceilings. */
  @GuardedBy("lock")
  void put(String key, @Nullable V value, ImmutableSet<String> tags,
      long sizeBytes, long ttlNanos, long now, List<Removal<V>> removals) {
    var node = new Node<>(key, value, tags, sizeBytes, now, expirationTime(now, ttlNanos));
    Node<V> prior = data.put(key, node);
    if (prior == null) {
      dependencyIndex.add(key, tags);
    } else {
      accessOrderDeque.remove(prior);
      totalSize -= prior.sizeBytes;
      dependencyIndex.replace(key, prior.dependencies, tags);

      RemovalCause cause = prior.hasExpired(now) ? RemovalCause.EXPIRED : RemovalCause.REPLACED;
      if (cause.wasEvicted()) {
        statsCounter.recordEviction(prior.sizeBytes, cause);
      }
      removals.add(new Removal<>(key, prior.value, cause));
    }
    accessOrderDeque.offerLast(node);
    totalSize += sizeBytes;
    evict(removals);
  }

  /**
   * Evicts the least recently used entries while the cache exceeds its entry count ceiling, and
   * then while it exceeds its size ceiling. A lone entry is never evicted for its size.
   */
  @GuardedBy("lock")
  void evict(List<Removal<V>> removals) {
    for (;;) {
      boolean overCount = (data.size() > maximumEntries);
      boolean overSize = (totalSize > maximumSizeBytes) && (data.size() > 1);
      Node<V> victim = accessOrderDeque.peekFirst();
      if ((!overCount && !overSize) || (victim == null)) {
        return;
      }
      if (logger.isLoggable(Level.TRACE)) {
        logger.log(Level.TRACE, "Evicting {0} ({1} entries, {2} bytes)",
            victim.key, data.size(), totalSize);
      }
      removeNode(victim, RemovalCause.SIZE, removals);
    }
  }

  /** Updates the size of the entry if it still holds the value, then evicts to the ceilings. */
  void reweigh(String key, @Nullable V expectedValue) {
    long sizeBytes = weigher.weigh(key, expectedValue);
    var removals = new ArrayList<Removal<V>>(1);
    lock.lock();
    try {
      Node<V> node = data.get(key);
      if (destroyed || (node == null) || (node.value != expectedValue)) {
        return;
      }
      totalSize += (sizeBytes - node.sizeBytes);
      node.sizeBytes = sizeBytes;
      evict(removals);
    } finally {
      lock.unlock();
      notifyRemovals(removals);
    }
  }

  /* --------------- Removals --------------- */

  @Override
  public boolean delete(String key) {
    requireNonNull(key);
    var removals = new ArrayList<Removal<V>>(1);
    boolean removed = false;
    lock.lock();
    try {
      Node<V> node = destroyed ? null : data.get(key);
      if (node != null) {
        var cause = node.hasExpired(ticker.read()) ? RemovalCause.EXPIRED : RemovalCause.EXPLICIT;
        removeNode(node, cause, removals);
        removed = true;
      }
    } finally {
      lock.unlock();
    }
    notifyRemovals(removals);
    return removed;
  }

  @Override
  public boolean delete(String key, @Nullable Object expectedValue) {
    requireNonNull(key);
    var removals = new ArrayList<Removal<V>>(1);
    boolean removed = false;
    lock.lock();
    try {
      Node<V> node = data.get(key);
      if (!destroyed && (node != null) && (node.value == expectedValue)) {
        removeNode(node, RemovalCause.EXPLICIT, removals);
        removed = true;
      }
    } finally {
      lock.unlock();
    }
    notifyRemovals(removals);
    return removed;
  }

  @Override
  public void clear() {
    var removals = new ArrayList<Removal<V>>();
    lock.lock();
    try {
      removeAll(removals);
    } finally {
      lock.unlock();
    }
    notifyRemovals(removals);
  }

  @GuardedBy("lock")
  void removeAll(List<Removal<V>> removals) {
    if (removalListener != null) {
      for (Node<V> node : accessOrderDeque) {
        removals.add(new Removal<>(node.key, node.value, RemovalCause.EXPLICIT));
      }
    }
    accessOrderDeque.clear();
    dependencyIndex.clear();
    data.clear();
    totalSize = 0;
  }

  @Override
  public int invalidateByDependency(String dependency) {
    requireNonNull(dependency);
    var removals = new ArrayList<Removal<V>>();
    int count = 0;
    lock.lock();
    try {
      if (!destroyed) {
        for (String key : dependencyIndex.keysFor(dependency)) {
          Node<V> node = data.get(key);
          if (node != null) {
            removeNode(node, RemovalCause.INVALIDATED, removals);
            count++;
          }
        }
      }
    } finally {
      lock.unlock();
    }
    notifyRemovals(removals);
    logger.log(Level.DEBUG, "Invalidated {0} entries with the dependency {1}", count, dependency);
    return count;
  }

  @Override
  public int invalidateByPattern(String regex) {
    return invalidateByPattern(Pattern.compile(regex));
  }

  @Override
  public int invalidateByPattern(Pattern pattern) {
    requireNonNull(pattern);
    var removals = new ArrayList<Removal<V>>();
    int count = 0;
    lock.lock();
    try {
      if (!destroyed) {
        var matches = new ArrayList<Node<V>>();
        for (Node<V> node : accessOrderDeque) {
          if (pattern.matcher(node.key).find()) {
            matches.add(node);
          }
        }
        for (Node<V> node : matches) {
          removeNode(node, RemovalCause.INVALIDATED, removals);
        }
        count = matches.size();
      }
    } finally {
      lock.unlock();
    }
    notifyRemovals(removals);
    logger.log(Level.DEBUG, "Invalidated {0} entries matching {1}", count, pattern);
    return count;
  }

  @Override
  public int cleanUp() {
    var removals = new ArrayList<Removal<V>>();
    lock.lock();
    try {
      if (destroyed) {
        return 0;
      }
      long now = ticker.read();
      var expired = new ArrayList<Node<V>>();
      for (Node<V> node : accessOrderDeque) {
        if (node.hasExpired(now)) {
          expired.add(node);
        }
      }
      for (Node<V> node : expired) {
        removeNode(node, RemovalCause.EXPIRED, removals);
      }
    } finally {
      lock.unlock();
    }
    notifyRemovals(removals);
    if (!removals.isEmpty()) {
      logger.log(Level.DEBUG, "Swept {0} expired entries", removals.size());
    }
    return removals.size();
  }

  /** Unlinks the node from every structure and records the removal. */
  @GuardedBy("lock")
  void removeNode(Node<V> node, RemovalCause cause, List<Removal<V>> removals) {
    data.remove(node.key, node);
    accessOrderDeque.remove(node);
    dependencyIndex.remove(node.key, node.dependencies);
    totalSize -= node.sizeBytes;
    if (cause.wasEvicted()) {
      statsCounter.recordEviction(node.sizeBytes, cause);
    }
    removals.add(new Removal<>(node.key, node.value, cause));
  }

  /** Publishes the removals to the listener, if present, on the executor. */
  void notifyRemovals(List<Removal<V>> removals) {
    var listener = removalListener;
    if ((listener == null) || removals.isEmpty()) {
      return;
    }
    for (var removal : removals) {
      Runnable task = () -> {
        try {
          listener.onRemoval(removal.key(), removal.value(), removal.cause());
        } catch (Throwable t) {
          logger.log(Level.WARNING, "Exception thrown by removal listener", t);
        }
      };
      try {
        executor.execute(task);
      } catch (Throwable t) {
        logger.log(Level.ERROR, "Exception thrown when submitting removal listener", t);
        task.run();
      }
    }
  }

  /* --------------- Inspection --------------- */

  @Override
  public ImmutableList<String> keys() {
    lock.lock();
    try {
      long now = ticker.read();
      var keys = ImmutableList.<String>builder();
      for (Node<V> node : accessOrderDeque) {
        if (!node.hasExpired(now)) {
          keys.add(node.key);
        }
      }
      return keys.build();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public ImmutableList<CacheEntry<V>> entries() {
    lock.lock();
    try {
      long now = ticker.read();
      var entries = ImmutableList.<CacheEntry<V>>builder();
      for (Node<V> node : accessOrderDeque) {
        if (!node.hasExpired(now)) {
          entries.add(node.snapshot(now));
        }
      }
      return entries.build();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public ImmutableSet<String> dependencies() {
    lock.lock();
    try {
      return dependencyIndex.tags();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public long estimatedSize() {
    lock.lock();
    try {
      return data.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public CacheStats stats() {
    CacheStats counters = statsCounter.snapshot();
    long entryCount = 0;
    long liveSize = 0;
    var candidates = new ArrayList<KeyHits>();
    lock.lock();
    try {
      long now = ticker.read();
      for (Node<V> node : accessOrderDeque) {
        if (!node.hasExpired(now)) {
          entryCount++;
          liveSize += node.sizeBytes;
          if (recordStats && (topKeys > 0)) {
            candidates.add(new KeyHits(node.key, node.hitCount));
          }
        }
      }
    } finally {
      lock.unlock();
    }
    List<KeyHits> top = candidates.stream().collect(Comparators.greatest(
        topKeys, Comparator.comparingLong(KeyHits::hits)));
    return counters.withContents(entryCount, liveSize, top);
  }

  /* --------------- Warm up --------------- */

  @Override
  public CompletableFuture<Void> warmUp(Collection<? extends WarmUpTask<? extends V>> tasks,
      BiConsumer<String, Throwable> errorHandler) {
    requireNonNull(errorHandler);
    logger.log(Level.DEBUG, "Warming up the cache with {0} tasks", tasks.size());
    var futures = new ArrayList<CompletableFuture<?>>(tasks.size());
    for (WarmUpTask<? extends V> task : tasks) {
      futures.add(warmUp(task, errorHandler));
    }
    return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new));
  }

  /** Returns a future that runs the task, stores its value, and never completes exceptionally. */
  CompletableFuture<?> warmUp(WarmUpTask<? extends V> task,
      BiConsumer<String, Throwable> errorHandler) {
    long startTime = ticker.read();
    CompletableFuture<? extends V> future;
    try {
      future = CompletableFuture.supplyAsync(() -> {
        try {
          return task.compute().call();
        } catch (Exception e) {
          throw new CompletionException(e);
        }
      }, executor);
    } catch (Throwable t) {
      future = CompletableFuture.failedFuture(t);
    }
    return future.handle((value, error) -> {
      long loadTime = Math.max(0L, ticker.read() - startTime);
      if (error == null) {
        statsCounter.recordLoadSuccess(loadTime);
        set(task.key(), value, task.ttl(), task.dependencies());
        return null;
      }
      Throwable cause = (error instanceof CompletionException) && (error.getCause() != null)
          ? error.getCause()
          : error;
      statsCounter.recordLoadFailure(loadTime);
      logger.log(Level.WARNING, "Failed to warm up the cache for " + task.key(), cause);
      try {
        errorHandler.accept(task.key(), cause);
      } catch (Throwable t) {
        logger.log(Level.WARNING, "Exception thrown by warm up error handler", t);
      }
      return null;
    });
  }

  /* --------------- Snapshots --------------- */

  @Override
  public String serialize() {
    return CacheSnapshot.serialize(entries(), stats());
  }

  @Override
  public List<String> deserialize(String json, Class<? extends V> valueType) {
    var restored = CacheSnapshot.<V>deserialize(json, valueType);
    var keys = new ArrayList<String>(restored.size());
    for (var entry : restored) {
      set(entry.key(), entry.value(), entry.ttl(), entry.dependencies());
      keys.add(entry.key());
    }
    return keys;
  }

  /* --------------- Lifecycle --------------- */

  @Override
  public void destroy() {
    var removals = new ArrayList<Removal<V>>();
    lock.lock();
    try {
      if (destroyed) {
        return;
      }
      destroyed = true;
      removeAll(removals);
    } finally {
      lock.unlock();
    }
    sweeper.cancel();
    notifyRemovals(removals);
    logger.log(Level.DEBUG, "Destroyed the cache");
  }

  @Override
  public boolean isDestroyed() {
    return destroyed;
  }

  @Override
  public String toString() {
    lock.lock();
    try {
      return getClass().getSimpleName() + '{'
          + "entries=" + data.size() + ", "
          + "totalSize=" + totalSize + ", "
          + "destroyed=" + destroyed
          + '}';
    } finally {
      lock.unlock();
    }
  }

  /* --------------- Utilities --------------- */

  /** Returns the duration in nanoseconds, saturating at the bounds of a {@code long}. */
  static long saturatedToNanos(Duration duration) {
    try {
      return duration.toNanos();
    } catch (ArithmeticException tooBig) {
      return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
  }

  /** Returns the ticker reading at which an entry stored at {@code now} expires. */
  static long expirationTime(long now, long ttlNanos) {
    long expiresAt = now + ttlNanos;
    if (((now ^ expiresAt) & (ttlNanos ^ expiresAt)) < 0) {
      return (ttlNanos > 0) ? Long.MAX_VALUE : Long.MIN_VALUE;
    }
    return expiresAt;
  }

  /** A removal to publish to the listener once the lock is released. */
  record Removal<V>(String key, @Nullable V value, RemovalCause cause) {}
}
