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

package dev.chunkschema.internal.partitioning;

import static dev.chunkschema.internal.utils.Constants.MILLIS_PER_DAY;
import static dev.chunkschema.internal.utils.Constants.SECONDS_PER_DAY;

import dev.chunkschema.internal.schema.PeriodicTableConfig;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a time range into UTC calendar-day buckets. The hash key of each bucket names the
 * day, and the range keys written under it only carry the offset into that day. A chunk
 * spanning several days therefore gets its real start offset in the first bucket, its real
 * end offset in the last one, and the whole {@code [0, day]} span in every bucket between.
 * <p>
 * Day indexes are computed with truncating division on unix seconds, the same arithmetic
 * {@link PeriodicTableConfig#periodIndex(long)} uses to pick a table shard.
 */
public class DailyBucketer {

  private final PeriodicTableConfig indexTables;

  public DailyBucketer(final PeriodicTableConfig indexTables) {
    this.indexTables = indexTables;
  }

  /**
   * @param from     start of the range in epoch millis, inclusive
   * @param through  end of the range in epoch millis, inclusive
   * @param tenantId tenant the hash keys are scoped to
   * @return one bucket per day touched by the range, in ascending day order
   */
  public List<Bucket> split(final long from, final long through, final String tenantId) {
    if (from > through) {
      throw new IllegalArgumentException(
          "Bucket range must not end before it starts, got from=" + from
              + " through=" + through);
    }

    final long fromDay = dayIndex(from);
    final long throughDay = dayIndex(through);

    final List<Bucket> buckets = new ArrayList<>((int) (throughDay - fromDay + 1));
    for (long day = fromDay; day <= throughDay; ++day) {
      final long dayStart = day * MILLIS_PER_DAY;
      final long relativeFrom = Math.max(0L, from - dayStart);
      final long relativeThrough = Math.min(MILLIS_PER_DAY, through - dayStart);

      buckets.add(new Bucket(
          (int) relativeFrom,
          (int) relativeThrough,
          indexTables.tableFor(day * SECONDS_PER_DAY * 1000),
          tenantId + ":d" + day,
          (int) MILLIS_PER_DAY
      ));
    }
    return buckets;
  }

  public static long dayIndex(final long timestamp) {
    return (timestamp / 1000) / SECONDS_PER_DAY;
  }
}
