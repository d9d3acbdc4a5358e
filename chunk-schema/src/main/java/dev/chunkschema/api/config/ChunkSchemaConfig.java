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

package dev.chunkschema.api.config;

import static org.apache.kafka.common.config.ConfigDef.Range.atLeast;

import java.time.Duration;
import java.util.Map;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;

/**
 * Process-level settings for schema loading and table enumeration.
 */
@SuppressWarnings("checkstyle:linelength")
public class ChunkSchemaConfig extends AbstractConfig {

  // ------------------ schema file ---------------------

  public static final String SCHEMA_CONFIG_FILE_CONFIG = "chunk.schema.config.file";
  private static final String SCHEMA_CONFIG_FILE_DEFAULT = "";
  private static final String SCHEMA_CONFIG_FILE_DOC = "The path to the YAML file listing the schema periods.";

  // ------------------ table enumeration ---------------------

  public static final String TABLE_GRACE_PERIOD_BEFORE_MS_CONFIG = "chunk.schema.table.grace.period.before.ms";
  public static final long TABLE_GRACE_PERIOD_BEFORE_MS_DEFAULT = Duration.ofMinutes(10).toMillis();
  private static final String TABLE_GRACE_PERIOD_BEFORE_MS_DOC = "How long before the start of its time window "
      + "a periodic table is provisioned as active. This also controls how far ahead of the current time "
      + "tables are created.";

  public static final String TABLE_GRACE_PERIOD_AFTER_MS_CONFIG = "chunk.schema.table.grace.period.after.ms";
  public static final long TABLE_GRACE_PERIOD_AFTER_MS_DEFAULT = Duration.ofHours(1).toMillis();
  private static final String TABLE_GRACE_PERIOD_AFTER_MS_DOC = "How long after the end of its time window a "
      + "periodic table stays active. Should cover the longest time a chunk is held in memory before it "
      + "is flushed.";

  public static final String RETENTION_PERIOD_MS_CONFIG = "chunk.schema.retention.period.ms";
  public static final long RETENTION_PERIOD_MS_DEFAULT = 0L;
  private static final String RETENTION_PERIOD_MS_DOC = "Tables whose time window ends further back than this "
      + "are no longer enumerated. 0 disables the limit. When set, it must be a multiple of every periodic "
      + "table period.";

  private static final ConfigDef CONFIG_DEF = new ConfigDef()
      .define(
          SCHEMA_CONFIG_FILE_CONFIG,
          Type.STRING,
          SCHEMA_CONFIG_FILE_DEFAULT,
          Importance.HIGH,
          SCHEMA_CONFIG_FILE_DOC
      ).define(
          TABLE_GRACE_PERIOD_BEFORE_MS_CONFIG,
          Type.LONG,
          TABLE_GRACE_PERIOD_BEFORE_MS_DEFAULT,
          atLeast(0),
          Importance.MEDIUM,
          TABLE_GRACE_PERIOD_BEFORE_MS_DOC
      ).define(
          TABLE_GRACE_PERIOD_AFTER_MS_CONFIG,
          Type.LONG,
          TABLE_GRACE_PERIOD_AFTER_MS_DEFAULT,
          atLeast(0),
          Importance.MEDIUM,
          TABLE_GRACE_PERIOD_AFTER_MS_DOC
      ).define(
          RETENTION_PERIOD_MS_CONFIG,
          Type.LONG,
          RETENTION_PERIOD_MS_DEFAULT,
          atLeast(0),
          Importance.MEDIUM,
          RETENTION_PERIOD_MS_DOC
      );

  public static ChunkSchemaConfig chunkSchemaConfig(final Map<?, ?> originals) {
    return new ChunkSchemaConfig(originals, false);
  }

  /**
   * Logs every value. Use once at startup; prefer {@link #chunkSchemaConfig(Map)} elsewhere.
   */
  public static ChunkSchemaConfig loggedConfig(final Map<?, ?> originals) {
    return new ChunkSchemaConfig(originals, true);
  }

  private ChunkSchemaConfig(final Map<?, ?> originals, final boolean doLog) {
    super(CONFIG_DEF, originals, doLog);
  }
}
