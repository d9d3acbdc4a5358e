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

import dev.chunkschema.api.config.ChunkSchemaConfig;
import dev.chunkschema.internal.config.ConfigUtils;
import dev.chunkschema.internal.schema.PeriodConfig;
import dev.chunkschema.internal.schema.PeriodicTableConfig;
import dev.chunkschema.internal.schema.SchemaConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Works out every table the schema needs right now: for each period that has started, or
 * starts within the creation grace period, the index tables (and chunk tables, if the
 * period names a chunk prefix) from the period start up to the next period or the grace
 * horizon, whichever comes first. A table shared by two periods is listed once.
 */
public class ExpectedTablePlanner {

  private static final Logger LOG = LoggerFactory.getLogger(ExpectedTablePlanner.class);

  private final SchemaConfig schemaConfig;
  private final PeriodicTableGenerator generator;
  private final Time time;
  private final Duration graceBefore;
  private final Duration graceAfter;
  private final Duration retention;

  public ExpectedTablePlanner(
      final ChunkSchemaConfig config,
      final SchemaConfig schemaConfig,
      final Time time
  ) {
    this.schemaConfig = schemaConfig;
    this.time = time;
    this.generator = new PeriodicTableGenerator(time);
    this.graceBefore = ConfigUtils.graceBefore(config);
    this.graceAfter = ConfigUtils.graceAfter(config);
    this.retention = ConfigUtils.retention(config);

    if (!retention.isZero()) {
      for (final PeriodConfig period : schemaConfig.configs()) {
        checkRetention(period.indexTables());
        checkRetention(period.chunkTables());
      }
    }
  }

  /**
   * @return the descriptors of every expected table, ordered by period and then by time
   */
  public <T> List<T> expectedTables(
      final TableProvisioner<T> indexProvisioner,
      final TableProvisioner<T> chunkProvisioner
  ) {
    final long now = time.milliseconds();
    final long horizon = now + graceBefore.toMillis();
    final List<PeriodConfig> periods = schemaConfig.configs();
    final Map<String, T> tables = new LinkedHashMap<>();

    for (int i = 0; i < periods.size(); ++i) {
      final PeriodConfig period = periods.get(i);
      if (period.from().millis() > horizon) {
        continue;
      }

      long end = horizon;
      if (i + 1 < periods.size()) {
        end = Math.min(end, periods.get(i + 1).from().millis());
      }
      // table boundaries are whole seconds
      end = (end / 1000) * 1000;

      addTables(tables, period.indexTables(), period.from().millis(), end, indexProvisioner, now);
      if (!period.chunkTables().prefix().isEmpty()) {
        addTables(tables, period.chunkTables(), period.from().millis(), end, chunkProvisioner, now);
      }
    }

    LOG.debug("Expecting {} table(s): {}", tables.size(), tables.keySet());
    return new ArrayList<>(tables.values());
  }

  private <T> void addTables(
      final Map<String, T> tables,
      final PeriodicTableConfig family,
      final long from,
      final long through,
      final TableProvisioner<T> provisioner,
      final long now
  ) {
    generator.forEachTable(
        family,
        from,
        through,
        provisioner,
        graceBefore,
        graceAfter,
        retention,
        now,
        tables::putIfAbsent
    );
  }

  private void checkRetention(final PeriodicTableConfig tables) {
    if (tables.isPeriodic() && retention.toMillis() % tables.period().toMillis() != 0) {
      LOG.error("Retention period {} is not a multiple of the period {} of tables {}",
          retention, tables.period(), tables.prefix());
      throw new ConfigException(
          ChunkSchemaConfig.RETENTION_PERIOD_MS_CONFIG,
          retention.toMillis(),
          "must be a multiple of the table period " + tables.period()
              + " of tables '" + tables.prefix() + "'"
      );
    }
  }
}
