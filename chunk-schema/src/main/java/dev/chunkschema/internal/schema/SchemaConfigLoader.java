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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import dev.chunkschema.api.config.ChunkSchemaConfig;
import dev.chunkschema.internal.config.ConfigUtils;
import dev.chunkschema.internal.schema.exception.SchemaConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes schema files. A schema file is a YAML document with a single
 * {@code configs} list of periods; any field the schema does not know is an error.
 * Every {@link SchemaConfig} handed out by this class has been validated.
 */
public final class SchemaConfigLoader {

  private static final Logger LOG = LoggerFactory.getLogger(SchemaConfigLoader.class);

  private static final ObjectMapper MAPPER = new ObjectMapper(
      new YAMLFactory()
          .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
          .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
  ).enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private SchemaConfigLoader() {
  }

  /**
   * Loads the file named by {@link ChunkSchemaConfig#SCHEMA_CONFIG_FILE_CONFIG}.
   */
  public static SchemaConfig load(final ChunkSchemaConfig config) {
    final String fileName = ConfigUtils.schemaConfigFile(config);
    if (fileName.isEmpty()) {
      throw new SchemaConfigException("schema config file needs to be set");
    }
    return loadFromFile(Path.of(fileName));
  }

  /**
   * Uses {@code preset} if it already holds periods, so a registry built in code takes
   * precedence over the file. Either way the result is validated.
   */
  public static SchemaConfig load(final SchemaConfig preset, final ChunkSchemaConfig config) {
    if (!preset.isEmpty()) {
      preset.validate();
      return preset;
    }
    return load(config);
  }

  public static SchemaConfig loadFromFile(final Path path) {
    final SchemaConfig schemaConfig;
    try (InputStream in = Files.newInputStream(path)) {
      schemaConfig = MAPPER.readValue(in, SchemaConfig.class);
    } catch (final IOException e) {
      throw translate(e, path.toString());
    }
    schemaConfig.validate();
    LOG.info("Loaded schema config from {} with periods starting {}",
        path, schemaConfig.configs().stream().map(PeriodConfig::from).collect(Collectors.toList()));
    return schemaConfig;
  }

  public static SchemaConfig fromYaml(final String yaml) {
    final SchemaConfig schemaConfig;
    try {
      schemaConfig = MAPPER.readValue(yaml, SchemaConfig.class);
    } catch (final JsonProcessingException e) {
      throw translate(e, "string");
    }
    schemaConfig.validate();
    return schemaConfig;
  }

  public static String toYaml(final SchemaConfig schemaConfig) {
    try {
      return MAPPER.writeValueAsString(schemaConfig);
    } catch (final JsonProcessingException e) {
      throw new SchemaConfigException("Failed to write schema config", e);
    }
  }

  // errors raised by our own creators come back wrapped by Jackson
  private static SchemaConfigException translate(final IOException e, final String source) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof SchemaConfigException) {
        return (SchemaConfigException) t;
      }
    }
    LOG.error("Failed to read schema config from {}", source, e);
    return new SchemaConfigException("Failed to read schema config from " + source, e);
  }
}
