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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.chunkschema.internal.key.ChunkRef;
import dev.chunkschema.internal.schema.exception.NoMatchingPeriodException;
import dev.chunkschema.internal.schema.exception.NonMonotonicPeriodsException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The ordered list of schema periods for a cluster. Data written under an old period must
 * stay readable after newer periods are added, so every lookup resolves the period that was
 * in effect at the timestamp in question.
 * <p>
 * The period list is an immutable snapshot behind a volatile reference. Lookups read the
 * current snapshot without locking. {@link #validate()} and {@link #forEachAfter} build a
 * new list and publish it in one write; they are serialized with each other.
 */
public class SchemaConfig {

  private static final Logger LOG = LoggerFactory.getLogger(SchemaConfig.class);

  private volatile List<PeriodConfig> configs;

  @JsonCreator
  public SchemaConfig(@JsonProperty("configs") final List<PeriodConfig> configs) {
    this.configs = configs == null ? List.of() : List.copyOf(configs);
  }

  @JsonProperty("configs")
  public List<PeriodConfig> configs() {
    return configs;
  }

  @JsonIgnore
  public boolean isEmpty() {
    return configs.isEmpty();
  }

  /**
   * Applies per-period defaults, validates every period and checks that the periods start
   * on strictly increasing days. Nothing is published unless every check passes.
   */
  public synchronized void validate() {
    final List<PeriodConfig> current = configs;
    final List<PeriodConfig> validated = new ArrayList<>(current.size());

    for (int i = 0; i < current.size(); ++i) {
      final PeriodConfig period = current.get(i).withDefaults();
      period.validate();

      if (i + 1 < current.size()) {
        final DayTime next = current.get(i + 1).from();
        if (period.from().compareTo(next) >= 0) {
          LOG.error("Schema period starting {} is followed by a period starting {}",
              period.from(), next);
          throw new NonMonotonicPeriodsException(period.from(), next);
        }
      }
      validated.add(period);
    }

    configs = List.copyOf(validated);
    LOG.info("Validated schema config with {} period(s)", validated.size());
  }

  /**
   * @param timestamp epoch millis
   * @return the period in effect at {@code timestamp}
   * @throws NoMatchingPeriodException if {@code timestamp} precedes the first period
   */
  public PeriodConfig schemaForTime(final long timestamp) {
    return periodFor(timestamp).orElseThrow(() -> new NoMatchingPeriodException(timestamp));
  }

  /**
   * @param timestamp epoch millis
   * @return the chunk table shard for {@code timestamp} under the period in effect then
   * @throws NoMatchingPeriodException if {@code timestamp} precedes the first period
   */
  public String chunkTableFor(final long timestamp) {
    return schemaForTime(timestamp).chunkTables().tableFor(timestamp);
  }

  public Optional<PeriodConfig> periodFor(final long timestamp) {
    final List<PeriodConfig> snapshot = configs;
    for (int i = 0; i < snapshot.size(); ++i) {
      if (timestamp >= snapshot.get(i).from().millis()
          && (i + 1 == snapshot.size() || timestamp < snapshot.get(i + 1).from().millis())) {
        return Optional.of(snapshot.get(i));
      }
    }
    return Optional.empty();
  }

  /**
   * Makes sure a period starts exactly at {@code cutoff}, splitting the period that spans
   * it if needed, then replaces every period starting at or after {@code cutoff} with the
   * result of {@code visitor}. Calling this twice with the same cutoff leaves the same
   * period boundaries as calling it once.
   *
   * @param visitor may change anything but the start day of the period it is given
   */
  public synchronized void forEachAfter(
      final DayTime cutoff,
      final UnaryOperator<PeriodConfig> visitor
  ) {
    final List<PeriodConfig> updated = new ArrayList<>(configs);

    for (int i = 0; i < updated.size(); ++i) {
      final PeriodConfig period = updated.get(i);
      if (cutoff.compareTo(period.from()) > 0
          && (i + 1 == updated.size() || cutoff.compareTo(updated.get(i + 1).from()) < 0)) {
        LOG.info("Splitting schema period starting {} at {}", period.from(), cutoff);
        updated.add(i + 1, period.withFrom(cutoff));
      }

      final PeriodConfig candidate = updated.get(i);
      if (candidate.from().compareTo(cutoff) >= 0) {
        final PeriodConfig visited = visitor.apply(candidate);
        if (!visited.from().equals(candidate.from())) {
          throw new IllegalArgumentException("Visitor moved period starting " + candidate.from()
              + " to " + visited.from());
        }
        updated.set(i, visited);
      }
    }

    configs = List.copyOf(updated);
  }

  /**
   * @return the numeric schema version of the period holding {@code chunk}'s start
   * @throws NoMatchingPeriodException if the chunk starts before the first period
   */
  public int versionForChunk(final ChunkRef chunk) {
    return schemaForTime(chunk.from()).versionAsInt();
  }

  /**
   * Encodes the object-store key of {@code chunk} in the format of the period its start
   * falls in. A chunk older than every period is keyed by the base rules.
   */
  public String externalKey(final ChunkRef chunk) {
    final int version = periodFor(chunk.from())
        .map(PeriodConfig::versionAsInt)
        .orElse(0);
    return SchemaVersion.nearest(version).externalKey(chunk);
  }

  @Override
  public String toString() {
    return "SchemaConfig{"
        + "configs=" + configs
        + '}';
  }
}
