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
package com.github.forumscraper.testing;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

import org.jspecify.annotations.Nullable;
import org.slf4j.event.Level;

import com.github.valfirst.slf4jtest.LoggingEvent;
import com.github.valfirst.slf4jtest.TestLoggerFactory;
import com.google.common.collect.ForwardingList;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * The logging events captured from every thread, narrowed by fluent filters. The cache logs from
 * its executor and sweeper threads, so events are read across all threads.
 */
public final class LoggingEvents extends ForwardingList<LoggingEvent> {
  private final List<Predicate<LoggingEvent>> predicates;
  private final ImmutableList<LoggingEvent> events;

  private @Nullable ImmutableList<LoggingEvent> filteredEvents;

  private LoggingEvents(Iterable<LoggingEvent> events) {
    this.events = ImmutableList.copyOf(events);
    this.predicates = new ArrayList<>();
  }

  /** Returns the events logged so far by any thread. */
  public static LoggingEvents logEvents() {
    return new LoggingEvents(TestLoggerFactory.getAllLoggingEvents());
  }

  /** Discards the captured events of every thread. */
  public static void clearLogEvents() {
    TestLoggerFactory.clearAll();
  }

  /** Returns the events with the message. */
  @CanIgnoreReturnValue
  public LoggingEvents withMessage(String formattedMessage) {
    return filter(e -> Objects.equals(e.getFormattedMessage(), formattedMessage));
  }

  /** Returns the events whose message starts with the prefix. */
  @CanIgnoreReturnValue
  public LoggingEvents withMessageStartingWith(String prefix) {
    return filter(e -> e.getFormattedMessage().startsWith(prefix));
  }

  /** Returns the events with the same throwable. */
  @CanIgnoreReturnValue
  public LoggingEvents withThrowable(Throwable t) {
    return filter(e -> e.getThrowable().orElse(null) == t);
  }

  /** Returns the events with the throwable class. */
  @CanIgnoreReturnValue
  public LoggingEvents withThrowable(Class<? extends Throwable> clazz) {
    return filter(e -> clazz.isInstance(e.getThrowable().orElse(null)));
  }

  /** Returns the events with the log level. */
  @CanIgnoreReturnValue
  public LoggingEvents withLevel(Level level) {
    return filter(e -> e.getLevel() == level);
  }

  /** Returns the events that satisfy the predicate. */
  @CanIgnoreReturnValue
  public LoggingEvents filter(Predicate<LoggingEvent> predicate) {
    if (filteredEvents != null) {
      throw new IllegalStateException("The events were already evaluated");
    }
    predicates.add(requireNonNull(predicate));
    return this;
  }

  @Override
  protected ImmutableList<LoggingEvent> delegate() {
    if (filteredEvents == null) {
      var stream = events.stream();
      for (var predicate : predicates) {
        stream = stream.filter(predicate);
      }
      filteredEvents = stream.collect(toImmutableList());
    }
    return filteredEvents;
  }
}
