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
package com.github.forumscraper.analytics;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.time.Instant;

/**
 * An inclusive range of instants.
 *
 * @param start the first instant of the range
 * @param end the last instant of the range
 */
public record DateRange(Instant start, Instant end) {

  public DateRange {
    requireNonNull(start);
    requireNonNull(end);
    checkArgument(!end.isBefore(start), "end %s is before start %s", end, start);
  }

  /** Returns the range covering the {@code days} before {@code end}. */
  public static DateRange lastDays(Instant end, int days) {
    checkArgument(days >= 0, "days must not be negative: %s", days);
    return new DateRange(end.minus(Duration.ofDays(days)), end);
  }
}
