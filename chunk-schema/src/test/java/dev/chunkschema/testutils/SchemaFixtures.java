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

package dev.chunkschema.testutils;

import dev.chunkschema.internal.schema.DayTime;
import dev.chunkschema.internal.schema.PeriodConfig;
import dev.chunkschema.internal.schema.PeriodicTableConfig;
import java.time.Duration;
import java.util.Map;

public final class SchemaFixtures {

  public static final PeriodicTableConfig WEEKLY_INDEX =
      new PeriodicTableConfig("index_", Duration.ofDays(7), Map.of());
  public static final PeriodicTableConfig WEEKLY_CHUNKS =
      new PeriodicTableConfig("chunks_", Duration.ofDays(7), Map.of());

  private SchemaFixtures() {
  }

  /**
   * A period on a store that needs no chunk prefix, with weekly index tables.
   */
  public static PeriodConfig period(final String from, final String schema, final Integer rowShards) {
    return new PeriodConfig(
        DayTime.parse(from),
        "boltdb-shipper",
        "s3",
        schema,
        WEEKLY_INDEX,
        null,
        rowShards
    );
  }

  /**
   * A period on a store that keeps chunks in weekly tables.
   */
  public static PeriodConfig tablePeriod(final String from, final String schema) {
    return new PeriodConfig(
        DayTime.parse(from),
        "aws-dynamo",
        null,
        schema,
        WEEKLY_INDEX,
        WEEKLY_CHUNKS,
        null
    );
  }
}
