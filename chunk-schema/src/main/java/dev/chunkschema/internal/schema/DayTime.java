/*
 * Copyright 2023 Responsive Computing, Inc.
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

package dev.chunkschema.internal.schema;

import static dev.chunkschema.internal.utils.Constants.MILLIS_PER_DAY;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.chunkschema.internal.schema.exception.DayTimeFormatException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * A millisecond timestamp that always sits on a UTC day boundary. Its text form is
 * {@code YYYY-MM-DD}, which is how period start dates appear in schema files.
 */
public final class DayTime implements Comparable<DayTime> {

  private static final DateTimeFormatter FORMAT = DateTimeFormatter
      .ofPattern("uuuu-MM-dd")
      .withResolverStyle(ResolverStyle.STRICT);

  private final long millis;

  private DayTime(final long millis) {
    this.millis = millis;
  }

  /**
   * Truncates {@code epochMillis} down to the start of its UTC day.
   */
  public static DayTime of(final long epochMillis) {
    return new DayTime(Math.floorDiv(epochMillis, MILLIS_PER_DAY) * MILLIS_PER_DAY);
  }

  @JsonCreator
  public static DayTime parse(final String text) {
    if (text == null) {
      throw new DayTimeFormatException(null, null);
    }
    final LocalDate date;
    try {
      date = LocalDate.parse(text, FORMAT);
    } catch (final DateTimeParseException e) {
      throw new DayTimeFormatException(text, e);
    }
    return new DayTime(date.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli());
  }

  public long millis() {
    return millis;
  }

  public long unixSeconds() {
    return millis / 1000;
  }

  @Override
  public int compareTo(final DayTime o) {
    return Long.compare(millis, o.millis);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return millis == ((DayTime) o).millis;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(millis);
  }

  @JsonValue
  @Override
  public String toString() {
    return FORMAT.format(Instant.ofEpochMilli(millis).atOffset(ZoneOffset.UTC));
  }
}
