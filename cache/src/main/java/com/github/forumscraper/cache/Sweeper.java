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
import java.util.concurrent.Future;

import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.concurrent.GuardedBy;

/**
 * A periodic task that reschedules itself after every run. Only one run is scheduled at any given
 * time, and once cancelled the task is never scheduled again. A run that is already executing when
 * the sweeper is cancelled completes, so the task itself must tolerate running after its owner has
 * shut down.
 */
final class Sweeper implements Runnable {
  static final Logger logger = System.getLogger(Sweeper.class.getName());

  final Scheduler scheduler;
  final Runnable task;
  final Duration period;

  @GuardedBy("this")
  @Nullable Future<?> future;
  @GuardedBy("this")
  boolean cancelled;
  @GuardedBy("this")
  long runs;

  Sweeper(Scheduler scheduler, Runnable task, Duration period) {
    this.scheduler = requireNonNull(scheduler);
    this.task = requireNonNull(task);
    this.period = requireNonNull(period);
  }

  /** Schedules the first run, unless the period disables the sweeper. */
  synchronized void start() {
    if (!period.isZero() && !period.isNegative() && !cancelled && (future == null)) {
      scheduleNext();
    }
  }

  @Override
  public void run() {
    synchronized (this) {
      if (cancelled) {
        return;
      }
      runs++;
    }
    try {
      task.run();
    } catch (Throwable t) {
      logger.log(Level.ERROR, "Exception thrown when sweeping expired entries", t);
    } finally {
      synchronized (this) {
        if (!cancelled) {
          scheduleNext();
        }
      }
    }
  }

  /** Asks the scheduler for the next run; a rejection stops the sweeper. */
  @GuardedBy("this")
  private void scheduleNext() {
    try {
      future = scheduler.schedule(this, period);
    } catch (RuntimeException e) {
      future = null;
      cancelled = true;
      logger.log(Level.WARNING, "Failed to schedule the sweep of expired entries", e);
    }
  }

  /** Cancels the pending run, if present, and prevents any further scheduling. */
  synchronized void cancel() {
    cancelled = true;
    if (future != null) {
      future.cancel(/* mayInterruptIfRunning= */ false);
      future = null;
    }
  }

  /** Returns if a run is scheduled. */
  synchronized boolean isScheduled() {
    return (future != null) && !future.isDone();
  }

  /** Returns the number of runs that have started. */
  synchronized long runs() {
    return runs;
  }
}
