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

import dev.chunkschema.internal.schema.DayTime;

public class NonMonotonicPeriodsException extends SchemaConfigException {
  private static final long serialVersionUID = 0L;

  public NonMonotonicPeriodsException(final DayTime previous, final DayTime next) {
    super(String.format(
        "from time in schemas must be distinct and in increasing order, but %s is followed by %s",
        previous,
        next
    ));
  }
}
