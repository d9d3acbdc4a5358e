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

/**
 * Thrown when a timestamp precedes every configured period. Unlike the
 * {@link SchemaConfigException} family this is an ordinary query-time outcome
 * that callers are expected to handle per request.
 */
public class NoMatchingPeriodException extends RuntimeException {
  private static final long serialVersionUID = 0L;

  private final long timestamp;

  public NoMatchingPeriodException(final long timestamp) {
    super("no schema config found for time " + timestamp);
    this.timestamp = timestamp;
  }

  public long timestamp() {
    return timestamp;
  }
}
