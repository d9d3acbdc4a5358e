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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.chunkschema.api.config.ChunkSchemaConfig;
import dev.chunkschema.internal.schema.exception.DayTimeFormatException;
import dev.chunkschema.internal.schema.exception.InvalidRowShardsException;
import dev.chunkschema.internal.schema.exception.NonMonotonicPeriodsException;
import dev.chunkschema.internal.schema.exception.SchemaConfigException;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SchemaConfigLoaderTest {

  @TempDir
  Path tempDir;

  private static Path resource(final String name) throws URISyntaxException {
    return Path.of(SchemaConfigLoaderTest.class.getClassLoader().getResource(name).toURI());
  }

  @Test
  public void shouldLoadFileNamedInConfig() throws Exception {
    // Given:
    final ChunkSchemaConfig config = ChunkSchemaConfig.chunkSchemaConfig(Map.of(
        ChunkSchemaConfig.SCHEMA_CONFIG_FILE_CONFIG, resource("schema-config.yaml").toString()
    ));

    // When:
    final SchemaConfig schemaConfig = SchemaConfigLoader.load(config);

    // Then:
    final List<PeriodConfig> periods = schemaConfig.configs();
    assertThat(periods.size(), equalTo(3));

    final PeriodConfig first = periods.get(0);
    assertThat(first.from(), equalTo(DayTime.parse("2019-01-01")));
    assertThat(first.indexType(), equalTo("aws-dynamo"));
    assertThat(first.resolvedObjectType(), equalTo("aws-dynamo"));
    assertThat(first.indexTables().period(), equalTo(Duration.ofDays(7)));
    assertThat(first.indexTables().tags(), equalTo(Map.of("team", "storage")));
    assertThat(first.chunkTables().prefix(), equalTo("chunks_"));
    assertThat(first.rowShards(), equalTo(0));

    assertThat(periods.get(1).resolvedObjectType(), equalTo("s3"));
    assertThat(periods.get(1).rowShards(), equalTo(32));
    assertThat(periods.get(1).chunkTables().isPeriodic(), is(false));

    assertThat(periods.get(2).versionAsInt(), equalTo(12));
    assertThat(periods.get(2).rowShards(), equalTo(16));
    assertThat(periods.get(2).indexTables().tableFor(DayTime.parse("2021-01-01").millis()),
        equalTo("loki_index_18628"));
  }

  @Test
  public void shouldRequireFileWhenNoPreset() {
    // Given:
    final ChunkSchemaConfig config = ChunkSchemaConfig.chunkSchemaConfig(Map.of());

    // When:
    final SchemaConfigException e = assertThrows(
        SchemaConfigException.class,
        () -> SchemaConfigLoader.load(new SchemaConfig(List.of()), config)
    );

    // Then:
    assertThat(e.getMessage(), containsString("schema config file needs to be set"));
  }

  @Test
  public void shouldPreferPresetOverFile() throws Exception {
    // Given:
    final SchemaConfig preset = new SchemaConfig(List.of(period("2020-01-01", "v11", null)));
    final ChunkSchemaConfig config = ChunkSchemaConfig.chunkSchemaConfig(Map.of(
        ChunkSchemaConfig.SCHEMA_CONFIG_FILE_CONFIG, resource("schema-config.yaml").toString()
    ));

    // When:
    final SchemaConfig loaded = SchemaConfigLoader.load(preset, config);

    // Then:
    assertThat(loaded, sameInstance(preset));
    assertThat(loaded.configs().size(), equalTo(1));
    assertThat(loaded.configs().get(0).rowShards(), equalTo(16));
  }

  @Test
  public void shouldValidatePreset() {
    // Given:
    final SchemaConfig preset = new SchemaConfig(List.of(period("2020-01-01", "v10", 0)));

    // Then:
    assertThrows(
        InvalidRowShardsException.class,
        () -> SchemaConfigLoader.load(preset, ChunkSchemaConfig.chunkSchemaConfig(Map.of()))
    );
  }

  @Test
  public void shouldRoundTripThroughYaml() throws Exception {
    // Given:
    final SchemaConfig loaded = SchemaConfigLoader.loadFromFile(resource("schema-config.yaml"));

    // When:
    final String yaml = SchemaConfigLoader.toYaml(loaded);
    final SchemaConfig reloaded = SchemaConfigLoader.fromYaml(yaml);

    // Then:
    assertThat(reloaded.configs(), equalTo(loaded.configs()));
    assertThat(yaml, containsString("period: 1w"));
    assertThat(yaml, containsString("row_shards: 32"));
  }

  @Test
  public void shouldSurfaceBadDateAsDayTimeFormatException() {
    // Given:
    final String yaml = "configs:\n"
        + "  - from: 2020-13-01\n"
        + "    store: boltdb-shipper\n"
        + "    schema: v9\n";

    // Then:
    assertThrows(DayTimeFormatException.class, () -> SchemaConfigLoader.fromYaml(yaml));
  }

  @Test
  public void shouldRejectUnknownField() {
    // Given:
    final String yaml = "configs:\n"
        + "  - from: 2020-01-01\n"
        + "    store: boltdb-shipper\n"
        + "    schema: v9\n"
        + "    shards: 4\n";

    // When:
    final SchemaConfigException e =
        assertThrows(SchemaConfigException.class, () -> SchemaConfigLoader.fromYaml(yaml));

    // Then:
    assertThat(e.getCause(), instanceOf(IOException.class));
  }

  @Test
  public void shouldRejectMalformedTablePeriod() {
    // Given:
    final String yaml = "configs:\n"
        + "  - from: 2020-01-01\n"
        + "    store: boltdb-shipper\n"
        + "    schema: v9\n"
        + "    index:\n"
        + "      prefix: index_\n"
        + "      period: one week\n";

    // Then:
    assertThrows(SchemaConfigException.class, () -> SchemaConfigLoader.fromYaml(yaml));
  }

  @Test
  public void shouldValidateLoadedFile() throws IOException {
    // Given:
    final Path file = tempDir.resolve("schema.yaml");
    Files.writeString(file, "configs:\n"
        + "  - from: 2021-01-01\n"
        + "    store: boltdb-shipper\n"
        + "    schema: v11\n"
        + "  - from: 2020-01-01\n"
        + "    store: boltdb-shipper\n"
        + "    schema: v12\n");

    // Then:
    assertThrows(NonMonotonicPeriodsException.class, () -> SchemaConfigLoader.loadFromFile(file));
  }

  @Test
  public void shouldWrapMissingFile() {
    // When:
    final SchemaConfigException e = assertThrows(
        SchemaConfigException.class,
        () -> SchemaConfigLoader.loadFromFile(tempDir.resolve("missing.yaml"))
    );

    // Then:
    assertThat(e.getMessage(), containsString("missing.yaml"));
  }
}
