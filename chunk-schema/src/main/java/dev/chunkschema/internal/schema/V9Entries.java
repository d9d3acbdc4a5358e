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
 * Base layer: one index row per series per day, hashed label values, and the key format
 * picked by whether the chunk carries a checksum.
 */
final class V9Entries implements EntryLayer {

  @Override
  public Optional<String> seriesHashKey(
      final Bucket bucket,
      final long fingerprint,
      final int rowShards
  ) {
    return Optional.of(bucket.hashKey());
  }

  @Override
  public Optional<LabelValueEncoding> labelValueEncoding() {
    return Optional.of(LabelValueEncoding.HASHED);
  }

  @Override
  public Optional<ExternalKeyFormat> externalKeyFormat(final boolean checksumSet) {
    return Optional.of(checksumSet ? ExternalKeyFormat.CHECKSUMMED : ExternalKeyFormat.LEGACY);
  }
}
