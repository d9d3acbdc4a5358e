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
import dev.chunkschema.internal.partitioning.DailyBucketer;
import java.util.List;

/**
 * The bucketing and key rules of one period, as selected by
 * {@link PeriodConfig#createSchema()}.
 */
public final class SeriesStoreSchema {

  private final SchemaVersion version;
  private final int rowShards;
  private final DailyBucketer bucketer;

  SeriesStoreSchema(
      final SchemaVersion version,
      final int rowShards,
      final DailyBucketer bucketer
  ) {
    this.version = version;
    this.rowShards = rowShards;
    this.bucketer = bucketer;
  }

  public SchemaVersion version() {
    return version;
  }

  public int rowShards() {
    return rowShards;
  }

  public List<Bucket> buckets(final long from, final long through, final String tenantId) {
    return bucketer.split(from, through, tenantId);
  }

  public String seriesHashKey(final Bucket bucket, final long fingerprint) {
    return version.resolve(layer -> layer.seriesHashKey(bucket, fingerprint, rowShards));
  }

  public LabelValueEncoding labelValueEncoding() {
    return version.resolve(EntryLayer::labelValueEncoding);
  }

  public ExternalKeyFormat externalKeyFormat(final boolean checksumSet) {
    return version.externalKeyFormat(checksumSet);
  }

  @Override
  public String toString() {
    return "SeriesStoreSchema{"
        + "version=" + version
        + ", rowShards=" + rowShards
        + '}';
  }
}
