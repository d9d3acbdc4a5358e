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

import static dev.chunkschema.testutils.SchemaFixtures.period;
import static dev.chunkschema.testutils.SchemaFixtures.tablePeriod;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.chunkschema.internal.key.ChunkRef;
import dev.chunkschema.internal.schema.exception.InvalidRowShardsException;
import dev.chunkschema.internal.schema.exception.NoMatchingPeriodException;
import dev.chunkschema.internal.schema.exception.NonMonotonicPeriodsException;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class SchemaConfigTest {

  private static final long DAY = 86_400_000L;
  private static final long JAN_1_2020 = DayTime.parse("2020-01-01").millis();
  private static final long JUN_1_2020 = DayTime.parse("2020-06-01").millis();

  private static List<String> starts(final SchemaConfig config) {
    return config.configs().stream()
        .map(p -> p.from().toString())
        .collect(Collectors.toList());
  }

  private static SchemaConfig twoPeriods() {
    final SchemaConfig config = new SchemaConfig(List.of(
        tablePeriod("2020-01-01", "v9"),
        period("2020-06-01", "v11", 32)
    ));
    config.validate();
    return config;
  }

  @Test
  public void shouldPublishDefaultsOnValidate() {
    // Given:
    final SchemaConfig config = new SchemaConfig(List.of(
        period("2020-01-01", "v9", null),
        period("2020-06-01", "v10", null)
    ));

    // When:
    config.validate();

    // Then:
    assertThat(config.configs().get(0).rowShards(), equalTo(0));
    assertThat(config.configs().get(1).rowShards(), equalTo(16));
  }

  @Test
  public void shouldRejectPeriodsOutOfOrder() {
    // Given:
    final SchemaConfig config = new SchemaConfig(List.of(
        period("2020-06-01", "v9", null),
        period("2020-01-01", "v9", null)
    ));

    // Then:
    assertThrows(NonMonotonicPeriodsException.class, config::validate);
  }

  @Test
  public void shouldRejectPeriodsStartingTheSameDay() {
    // Given:
    final SchemaConfig config = new SchemaConfig(List.of(
        period("2020-01-01", "v9", null),
        period("2020-01-01", "v11", null)
    ));

    // Then:
    assertThrows(NonMonotonicPeriodsException.class, config::validate);
  }

  @Test
  public void shouldNotPublishAnythingWhenValidationFails() {
    // Given:
    final SchemaConfig config = new SchemaConfig(List.of(
        period("2020-01-01", "v9", null),
        period("2020-06-01", "v10", 0)
    ));

    // When:
    assertThrows(InvalidRowShardsException.class, config::validate);

    // Then: the first period's default was not published
    assertThat(config.configs().get(0).configuredRowShards(), nullValue());
  }

  @Test
  public void shouldAcceptEmptyConfig() {
    // Given:
    final SchemaConfig config = new SchemaConfig(null);

    // When:
    config.validate();

    // Then:
    assertThat(config.isEmpty(), is(true));
    assertThat(config.periodFor(JAN_1_2020), equalTo(Optional.empty()));
  }

  @Test
  public void shouldResolvePeriodAtBoundaries() {
    // Given:
    final SchemaConfig config = twoPeriods();

    // Then:
    assertThat(config.schemaForTime(JAN_1_2020).schema(), equalTo("v9"));
    assertThat(config.schemaForTime(JUN_1_2020 - 1).schema(), equalTo("v9"));
    assertThat(config.schemaForTime(JUN_1_2020).schema(), equalTo("v11"));
    assertThat(config.schemaForTime(Long.MAX_VALUE).schema(), equalTo("v11"));
  }

  @Test
  public void shouldThrowForTimeBeforeFirstPeriod() {
    // Given:
    final SchemaConfig config = twoPeriods();

    // When:
    final NoMatchingPeriodException e = assertThrows(
        NoMatchingPeriodException.class,
        () -> config.schemaForTime(JAN_1_2020 - 1)
    );

    // Then:
    assertThat(e.timestamp(), equalTo(JAN_1_2020 - 1));
  }

  @Test
  public void shouldResolveChunkTable() {
    // Given:
    final SchemaConfig config = twoPeriods();

    // Then:
    assertThat(config.chunkTableFor(JAN_1_2020), equalTo("chunks_2608"));
    assertThat(config.chunkTableFor(JAN_1_2020 + 7 * DAY), equalTo("chunks_2609"));
    // no chunk tables once chunks move to the object store
    assertThat(config.chunkTableFor(JUN_1_2020), equalTo(""));
  }

  @Test
  public void shouldSplitPeriodAtCutoff() {
    // Given:
    final SchemaConfig config = twoPeriods();

    // When:
    config.forEachAfter(DayTime.parse("2020-03-01"), p -> p.withIndexType("tsdb"));

    // Then:
    assertThat(starts(config), contains("2020-01-01", "2020-03-01", "2020-06-01"));
    assertThat(config.configs().get(0).indexType(), equalTo("aws-dynamo"));
    assertThat(config.configs().get(1).indexType(), equalTo("tsdb"));
    assertThat(config.configs().get(1).schema(), equalTo("v9"));
    assertThat(config.configs().get(2).indexType(), equalTo("tsdb"));
    assertThat(config.configs().get(2).rowShards(), equalTo(32));
  }

  @Test
  public void shouldNotSplitWhenCutoffIsPeriodStart() {
    // Given:
    final SchemaConfig config = twoPeriods();

    // When:
    config.forEachAfter(DayTime.parse("2020-06-01"), p -> p.withSchema("v12"));

    // Then:
    assertThat(starts(config), contains("2020-01-01", "2020-06-01"));
    assertThat(config.configs().get(0).schema(), equalTo("v9"));
    assertThat(config.configs().get(1).versionAsInt(), equalTo(12));
  }

  @Test
  public void shouldSplitOnlyOnceForRepeatedCutoff() {
    // Given:
    final SchemaConfig config = twoPeriods();
    final DayTime cutoff = DayTime.parse("2020-03-01");

    // When:
    config.forEachAfter(cutoff, p -> p);
    config.forEachAfter(cutoff, p -> p);

    // Then:
    assertThat(starts(config), contains("2020-01-01", "2020-03-01", "2020-06-01"));
  }

  @Test
  public void shouldSplitLastPeriodAtCutoff() {
    // Given:
    final SchemaConfig config = twoPeriods();

    // When:
    config.forEachAfter(DayTime.parse("2021-01-01"), p -> p.withObjectType("gcs"));

    // Then:
    assertThat(starts(config), contains("2020-01-01", "2020-06-01", "2021-01-01"));
    assertThat(config.configs().get(1).resolvedObjectType(), equalTo("s3"));
    assertThat(config.configs().get(2).resolvedObjectType(), equalTo("gcs"));
  }

  @Test
  public void shouldRejectVisitorThatMovesPeriod() {
    // Given:
    final SchemaConfig config = twoPeriods();
    final List<PeriodConfig> before = config.configs();

    // When:
    assertThrows(
        IllegalArgumentException.class,
        () -> config.forEachAfter(
            DayTime.parse("2020-06-01"), p -> p.withFrom(DayTime.parse("2020-07-01")))
    );

    // Then:
    assertThat(config.configs(), equalTo(before));
  }

  @Test
  public void shouldResolveVersionForChunk() {
    // Given:
    final SchemaConfig config = twoPeriods();

    // Then:
    assertThat(config.versionForChunk(ChunkRef.legacy("acme", 1L, JAN_1_2020, JAN_1_2020)),
        equalTo(9));
    assertThat(config.versionForChunk(ChunkRef.legacy("acme", 1L, JUN_1_2020, JUN_1_2020)),
        equalTo(11));
    assertThrows(
        NoMatchingPeriodException.class,
        () -> config.versionForChunk(ChunkRef.legacy("acme", 1L, 0L, 0L))
    );
  }

  @Test
  public void shouldEncodeExternalKeyPerPeriod() {
    // Given:
    final SchemaConfig config = twoPeriods();
    final ChunkRef legacy = ChunkRef.legacy("acme", 255L, JAN_1_2020, JAN_1_2020);
    final ChunkRef checksummed = ChunkRef.withChecksum("acme", 255L, JUN_1_2020, JUN_1_2020, 1);

    // Then:
    assertThat(config.externalKey(legacy), equalTo("255:1577836800000:1577836800000"));
    assertThat(config.externalKey(checksummed), equalTo(
        SchemaVersion.V11.externalKey(checksummed)));
  }

  @Test
  public void shouldUseBaseRulesForChunkBeforeFirstPeriod() {
    // Given:
    final SchemaConfig config = twoPeriods();
    final ChunkRef chunk = ChunkRef.withChecksum("acme", 255L, 0L, 1L, 2);

    // Then:
    assertThat(config.externalKey(chunk), equalTo("acme/ff:0:1:2"));
  }
}
