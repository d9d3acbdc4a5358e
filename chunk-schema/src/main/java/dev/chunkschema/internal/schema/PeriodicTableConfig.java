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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.chunkschema.internal.utils.Durations;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Naming policy for a family of time-sharded tables. A zero period means the family is a
 * single static table named exactly {@link #prefix()}; otherwise shard {@code i} covers
 * unix seconds {@code [i * period, (i + 1) * period)} and is named {@code prefix + i}.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class PeriodicTableConfig {

  private final String prefix;
  private final Duration period;
  private final Map<String, String> tags;

  public PeriodicTableConfig(
      final String prefix,
      final Duration period,
      final Map<String, String> tags
  ) {
    this.prefix = prefix == null ? "" : prefix;
    this.period = period == null ? Duration.ZERO : period;
    this.tags = tags == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new TreeMap<>(tags));
  }

  @JsonCreator
  static PeriodicTableConfig fromYaml(
      @JsonProperty("prefix") final String prefix,
      @JsonProperty("period") final String period,
      @JsonProperty("tags") final Map<String, String> tags
  ) {
    return new PeriodicTableConfig(
        prefix,
        period == null ? Duration.ZERO : Durations.parse(period),
        tags
    );
  }

  public static PeriodicTableConfig staticTable(final String name) {
    return new PeriodicTableConfig(name, Duration.ZERO, null);
  }

  @JsonProperty("prefix")
  public String prefix() {
    return prefix;
  }

  public Duration period() {
    return period;
  }

  @JsonProperty("period")
  String periodString() {
    return Durations.format(period);
  }

  @JsonProperty("tags")
  public Map<String, String> tags() {
    return tags;
  }

  @JsonIgnore
  public boolean isPeriodic() {
    return !period.isZero();
  }

  public long periodSeconds() {
    return period.toSeconds();
  }

  /**
   * @param timestamp epoch milliseconds
   * @return the physical table holding {@code timestamp}
   */
  public String tableFor(final long timestamp) {
    if (!isPeriodic()) {
      return prefix;
    }
    return tableForPeriod(periodIndex(timestamp));
  }

  /**
   * Shard index of {@code timestamp}. Both divisions truncate toward zero, matching the
   * daily bucket arithmetic so that pre-epoch timestamps route consistently.
   */
  public long periodIndex(final long timestamp) {
    return (timestamp / 1000) / periodSeconds();
  }

  public String tableForPeriod(final long index) {
    return prefix + index;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final PeriodicTableConfig that = (PeriodicTableConfig) o;
    return Objects.equals(prefix, that.prefix)
        && Objects.equals(period, that.period)
        && Objects.equals(tags, that.tags);
  }

  @Override
  public int hashCode() {
    return Objects.hash(prefix, period, tags);
  }

  @Override
  public String toString() {
    return "PeriodicTableConfig{"
        + "prefix='" + prefix + '\''
        + ", period=" + Durations.format(period)
        + ", tags=" + tags
        + '}';
  }
}
