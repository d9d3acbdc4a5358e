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

package dev.chunkschema.internal.schema.exception;

import org.apache.kafka.common.config.ConfigException;

/**
 * Base type for every fault found while building or validating a schema configuration.
 * None of these are transient: a registry that raises one must not be used.
 */
public class SchemaConfigException extends ConfigException {
  private static final long serialVersionUID = 0L;

  public SchemaConfigException(final String message) {
    super(message);
  }

  public SchemaConfigException(final String message, final Throwable cause) {
    super(message);
    initCause(cause);
  }
}
