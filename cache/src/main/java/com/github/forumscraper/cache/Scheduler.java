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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Delays the cache's periodic sweep of expired entries. Each call arranges a single run; the
 * sweeper asks again after every run, so an implementation never repeats the task on its own.
 * <p>
 * A scheduler may reject the request by throwing, in which case the sweeper logs the failure and
 * stops sweeping. Expired entries are then still discarded when they are read.
 */
@FunctionalInterface
public interface Scheduler {

  /**
   * Arranges for the sweep to run once after the delay.
   *
   * @param sweep the sweep of expired entries
   * @param delay how long to wait before running the sweep
   * @return a handle whose {@link Future#cancel} withdraws the pending run
   */
  Future<?> schedule(Runnable sweep, Duration delay);

  /**
   * Returns a scheduler that never runs the sweep, leaving expired entries to be discarded when
   * they are read.
   */
  static Scheduler disabledScheduler() {
    return SweepSchedulers.DISABLED;
  }

  /** Returns a scheduler that runs the sweep on the common pool once the delay has elapsed. */
  static Scheduler systemScheduler() {
    return SweepSchedulers.SYSTEM;
  }

  /**
   * Returns a scheduler that runs the sweep on the given executor's thread. Once the executor is
   * shut down further sweeps are rejected.
   *
   * @param scheduledExecutorService the executor to schedule on
   * @return a scheduler that delegates to a {@link ScheduledExecutorService}
   */
  static Scheduler forScheduledExecutorService(ScheduledExecutorService scheduledExecutorService) {
    requireNonNull(scheduledExecutorService);
    return (sweep, delay) ->
        scheduledExecutorService.schedule(sweep, delay.toNanos(), TimeUnit.NANOSECONDS);
  }
}

enum SweepSchedulers implements Scheduler {
  DISABLED {
    @Override public Future<?> schedule(Runnable sweep, Duration delay) {
      requireNonNull(sweep);
      requireNonNull(delay);
      return CompletableFuture.completedFuture(null);
    }
  },
  SYSTEM {
    @Override public Future<?> schedule(Runnable sweep, Duration delay) {
      return CompletableFuture.runAsync(sweep,
          CompletableFuture.delayedExecutor(delay.toNanos(), TimeUnit.NANOSECONDS));
    }
  };
}
