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

package dev.chunkschema.internal.config;

import dev.chunkschema.api.config.ChunkSchemaConfig;
import java.time.Duration;

/**
 * Typed accessors for {@link ChunkSchemaConfig} values that should not be part of its
 * public API.
 *
 * @implNote please keep this in the {@code .internal} package
 */
public final class ConfigUtils {

  private ConfigUtils() {
  }

  public static Duration graceBefore(final ChunkSchemaConfig config) {
    return Duration.ofMillis(
        config.getLong(ChunkSchemaConfig.TABLE_GRACE_PERIOD_BEFORE_MS_CONFIG));
  }

  public static Duration graceAfter(final ChunkSchemaConfig config) {
    return Duration.ofMillis(
        config.getLong(ChunkSchemaConfig.TABLE_GRACE_PERIOD_AFTER_MS_CONFIG));
  }

  public static Duration retention(final ChunkSchemaConfig config) {
    return Duration.ofMillis(config.getLong(ChunkSchemaConfig.RETENTION_PERIOD_MS_CONFIG));
  }

  public static String schemaConfigFile(final ChunkSchemaConfig config) {
    return config.getString(ChunkSchemaConfig.SCHEMA_CONFIG_FILE_CONFIG);
  }
}
