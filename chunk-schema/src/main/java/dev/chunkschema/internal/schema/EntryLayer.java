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
import dev.chunkschema.internal.partitioning.Bucket;
import java.util.Optional;

/**
 * One layer of a schema version's encoding rules. A layer only answers for the behaviors it
 * changes and returns empty for everything else, so that {@link SchemaVersion} can fall
 * through to the layer the version was built on. The base layer answers everything.
 */
interface EntryLayer {

  default Optional<String> seriesHashKey(
      final Bucket bucket,
      final long fingerprint,
      final int rowShards
  ) {
    return Optional.empty();
  }

  default Optional<LabelValueEncoding> labelValueEncoding() {
    return Optional.empty();
  }

  default Optional<ExternalKeyFormat> externalKeyFormat(final boolean checksumSet) {
    return Optional.empty();
  }
}
