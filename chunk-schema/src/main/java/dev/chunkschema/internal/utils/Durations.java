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

package dev.chunkschema.internal.utils;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and prints durations in the compact unit-suffixed form used by schema files,
 * e.g. {@code 168h}, {@code 1w} or {@code 1d12h}. Units must appear largest first and
 * each at most once; a year is 365 days and a week is 7 days.
 */
public final class Durations {

  private static final Pattern DURATION = Pattern.compile(
      "^(?:(\\d+)y)?(?:(\\d+)w)?(?:(\\d+)d)?(?:(\\d+)h)?(?:(\\d+)m)?(?:(\\d+)s)?(?:(\\d+)ms)?$"
  );

  private static final long[] UNIT_MILLIS = {
      Duration.ofDays(365).toMillis(),
      Duration.ofDays(7).toMillis(),
      Duration.ofDays(1).toMillis(),
      Duration.ofHours(1).toMillis(),
      Duration.ofMinutes(1).toMillis(),
      Duration.ofSeconds(1).toMillis(),
      1L
  };

  private static final String[] UNIT_NAMES = {"y", "w", "d", "h", "m", "s", "ms"};

  private Durations() {
  }

  public static Duration parse(final String text) {
    if (text == null || text.isEmpty()) {
      throw new IllegalArgumentException("empty duration string");
    }
    if (text.equals("0")) {
      return Duration.ZERO;
    }

    final Matcher matcher = DURATION.matcher(text);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("not a valid duration string: '" + text + "'");
    }

    long millis = 0;
    for (int i = 0; i < UNIT_MILLIS.length; ++i) {
      final String group = matcher.group(i + 1);
      if (group != null) {
        millis = Math.addExact(millis, Math.multiplyExact(Long.parseLong(group), UNIT_MILLIS[i]));
      }
    }
    return Duration.ofMillis(millis);
  }

  public static String format(final Duration duration) {
    long millis = duration.toMillis();
    if (millis == 0) {
      return "0s";
    }
    if (millis < 0) {
      throw new IllegalArgumentException("negative duration: " + duration);
    }

    final StringBuilder sb = new StringBuilder();
    for (int i = 0; i < UNIT_MILLIS.length; ++i) {
      final long units = millis / UNIT_MILLIS[i];
      if (units > 0) {
        sb.append(units).append(UNIT_NAMES[i]);
        millis -= units * UNIT_MILLIS[i];
      }
    }
    return sb.toString();
  }
}
