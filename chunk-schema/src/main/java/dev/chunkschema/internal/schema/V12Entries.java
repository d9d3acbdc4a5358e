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

import dev.chunkschema.internal.key.ExternalKeyFormat;
import java.util.Optional;

final class V12Entries implements EntryLayer {

  @Override
  public Optional<ExternalKeyFormat> externalKeyFormat(final boolean checksumSet) {
    return Optional.of(ExternalKeyFormat.FINGERPRINT_DIRECTORY);
  }
}
