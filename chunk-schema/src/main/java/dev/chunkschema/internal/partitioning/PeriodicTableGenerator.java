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

import dev.chunkschema.internal.schema.PeriodicTableConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates the physical tables of a periodic table family that cover a time range and asks
 * a {@link TableProvisioner} for the descriptor of each one.
 * <p>
 * A table is active while the wall clock is within {@code [start - graceBefore,
 * end + graceAfter)} of its window. Inactive tables more than
 * {@link TableProvisioner#inactiveWriteScaleLastN()} periods behind the current one are
 * provisioned with write autoscaling disabled.
 */
public class PeriodicTableGenerator {

  private static final Logger LOG = LoggerFactory.getLogger(PeriodicTableGenerator.class);

  private final Time time;

  public PeriodicTableGenerator(final Time time) {
    this.time = time;
  }

  /**
   * @param tables      the table family
   * @param from        start of the range in epoch millis, inclusive
   * @param through     end of the range in epoch millis; a value exactly on a period boundary
   *                    does not pull in the table that starts there
   * @param provisioner builds the per-table descriptors
   * @param graceBefore how long before its window a table becomes active
   * @param graceAfter  how long after its window a table stays active
   * @param retention   if positive, at most {@code retention / period} tables, ending at the
   *                    last one, are produced; zero means no limit
   * @throws IllegalArgumentException if {@code retention} is negative
   * @return one descriptor per table, oldest first
   */
  public <T> List<T> tablesForRange(
      final PeriodicTableConfig tables,
      final long from,
      final long through,
      final TableProvisioner<T> provisioner,
      final Duration graceBefore,
      final Duration graceAfter,
      final Duration retention
  ) {
    final List<T> result = new ArrayList<>();
    forEachTable(
        tables,
        from,
        through,
        provisioner,
        graceBefore,
        graceAfter,
        retention,
        time.milliseconds(),
        (tableName, table) -> result.add(table)
    );
    return result;
  }

  /**
   * Same as {@link #tablesForRange} but against a caller-supplied {@code nowMs}, handing
   * each table name and descriptor to {@code consumer} in order.
   */
  public <T> void forEachTable(
      final PeriodicTableConfig tables,
      final long from,
      final long through,
      final TableProvisioner<T> provisioner,
      final Duration graceBefore,
      final Duration graceAfter,
      final Duration retention,
      final long nowMs,
      final BiConsumer<String, T> consumer
  ) {
    if (retention.isNegative()) {
      throw new IllegalArgumentException("Retention must not be negative, got " + retention);
    }
    if (!tables.isPeriodic()) {
      consumer.accept(tables.prefix(), provisioner.activeTable(tables.prefix(), tables.tags()));
      return;
    }

    final long now = nowMs / 1000;
    final long periodSecs = tables.periodSeconds();
    final long graceBeforeSecs = graceBefore.toSeconds();
    final long graceAfterSecs = graceAfter.toSeconds();
    final long tablesToKeep = retention.toSeconds() / periodSecs;
    final long nowPeriod = now / periodSecs;

    long firstTable = tables.periodIndex(from);
    long lastTable = tables.periodIndex(through);

    if ((through / 1000) % periodSecs == 0) {
      lastTable--;
    }

    if (!retention.isZero() && lastTable - firstTable + 1 > tablesToKeep) {
      firstTable = Math.max(firstTable, lastTable - tablesToKeep + 1);
    }

    for (long i = firstTable; i <= lastTable; ++i) {
      final String tableName = tables.tableForPeriod(i);
      final long tableStart = i * periodSecs;

      if (tableStart - graceBeforeSecs <= now && now < tableStart + periodSecs + graceAfterSecs) {
        LOG.debug("Table {} is active", tableName);
        consumer.accept(tableName, provisioner.activeTable(tableName, tables.tags()));
      } else {
        // measured against now rather than the end of the range, so the last N tables
        // before the current one keep their write autoscaling
        final boolean disableAutoscale = i < nowPeriod - provisioner.inactiveWriteScaleLastN();
        LOG.debug("Table {} is inactive, disableWriteAutoscale={}", tableName, disableAutoscale);
        consumer.accept(
            tableName,
            provisioner.inactiveTable(tableName, tables.tags(), disableAutoscale)
        );
      }
    }
  }
}
