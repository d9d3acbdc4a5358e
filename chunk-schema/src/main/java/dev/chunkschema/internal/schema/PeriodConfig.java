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

import static dev.chunkschema.internal.utils.Constants.MILLIS_PER_DAY;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableSet;
import dev.chunkschema.internal.partitioning.DailyBucketer;
import dev.chunkschema.internal.schema.exception.InvalidRowShardsException;
import dev.chunkschema.internal.schema.exception.InvalidSchemaVersionException;
import dev.chunkschema.internal.schema.exception.InvalidTablePeriodException;
import dev.chunkschema.internal.schema.exception.MissingChunkPrefixException;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The schema and tables in effect from {@link #from()} until the start of the next period.
 * <p>
 * Instances are immutable. The numeric schema version is parsed once on construction and
 * recomputed only by {@link #withSchema(String)}, so a validated period can be shared
 * between threads without coordination.
 */
@JsonPropertyOrder({"from", "store", "object_store", "schema", "index", "chunks", "row_shards"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PeriodConfig {

  private static final Logger LOG = LoggerFactory.getLogger(PeriodConfig.class);

  private static final Pattern VERSION = Pattern.compile("^v(\\d{1,9})$");

  // versions whose series rows were never sharded
  private static final Set<String> UNSHARDED_SCHEMAS =
      ImmutableSet.of("v1", "v2", "v3", "v4", "v5", "v6", "v9");

  static final int DEFAULT_ROW_SHARDS = 16;

  private final DayTime from;
  private final String indexType;
  private final String objectType;
  private final String schema;
  private final PeriodicTableConfig indexTables;
  private final PeriodicTableConfig chunkTables;
  private final Integer rowShards;

  private final Integer schemaInt;

  @JsonCreator
  public PeriodConfig(
      @JsonProperty("from") final DayTime from,
      @JsonProperty("store") final String indexType,
      @JsonProperty("object_store") final String objectType,
      @JsonProperty("schema") final String schema,
      @JsonProperty("index") final PeriodicTableConfig indexTables,
      @JsonProperty("chunks") final PeriodicTableConfig chunkTables,
      @JsonProperty("row_shards") final Integer rowShards
  ) {
    this.from = Objects.requireNonNull(from, "from");
    this.indexType = indexType;
    this.objectType = objectType;
    this.schema = schema;
    this.indexTables = indexTables == null ? PeriodicTableConfig.staticTable("") : indexTables;
    this.chunkTables = chunkTables == null ? PeriodicTableConfig.staticTable("") : chunkTables;
    this.rowShards = rowShards;
    this.schemaInt = parseVersion(schema);
  }

  @JsonProperty("from")
  public DayTime from() {
    return from;
  }

  @JsonProperty("store")
  public String indexType() {
    return indexType;
  }

  @JsonProperty("object_store")
  public String objectType() {
    return objectType;
  }

  /**
   * @return the configured object store, or the index store if none was set
   */
  public String resolvedObjectType() {
    return objectType == null || objectType.isEmpty() ? indexType : objectType;
  }

  @JsonProperty("schema")
  public String schema() {
    return schema;
  }

  @JsonProperty("index")
  public PeriodicTableConfig indexTables() {
    return indexTables;
  }

  @JsonProperty("chunks")
  public PeriodicTableConfig chunkTables() {
    return chunkTables;
  }

  /**
   * @return the row shard count, 0 if none has been configured or defaulted yet
   */
  public int rowShards() {
    return rowShards == null ? 0 : rowShards;
  }

  @JsonProperty("row_shards")
  Integer configuredRowShards() {
    return rowShards;
  }

  /**
   * @return the numeric form of {@link #schema()}
   * @throws InvalidSchemaVersionException if the schema is not of the form {@code v<digits>}
   */
  public int versionAsInt() {
    if (schemaInt == null) {
      throw new InvalidSchemaVersionException(schema);
    }
    return schemaInt;
  }

  public PeriodConfig withFrom(final DayTime newFrom) {
    return new PeriodConfig(
        newFrom, indexType, objectType, schema, indexTables, chunkTables, rowShards);
  }

  public PeriodConfig withSchema(final String newSchema) {
    return new PeriodConfig(
        from, indexType, objectType, newSchema, indexTables, chunkTables, rowShards);
  }

  public PeriodConfig withIndexType(final String newIndexType) {
    return new PeriodConfig(
        from, newIndexType, objectType, schema, indexTables, chunkTables, rowShards);
  }

  public PeriodConfig withObjectType(final String newObjectType) {
    return new PeriodConfig(
        from, indexType, newObjectType, schema, indexTables, chunkTables, rowShards);
  }

  public PeriodConfig withRowShards(final int newRowShards) {
    return new PeriodConfig(
        from, indexType, objectType, schema, indexTables, chunkTables, newRowShards);
  }

  /**
   * Fills in the row shard count when none was configured. An explicit value, zero
   * included, is always kept.
   */
  public PeriodConfig withDefaults() {
    if (rowShards != null) {
      return this;
    }
    return withRowShards(defaultRowShards(schema));
  }

  static int defaultRowShards(final String schema) {
    return UNSHARDED_SCHEMAS.contains(schema) ? 0 : DEFAULT_ROW_SHARDS;
  }

  /**
   * Checks the table periods, the chunk prefix and that a schema can be built for this
   * period, in that order.
   */
  public void validate() {
    checkTablePeriod(indexTables);
    checkTablePeriod(chunkTables);

    final String objectStore = resolvedObjectType();
    if (TablePartitionedStore.requiresChunkPrefix(objectStore)
        && chunkTables.prefix().isEmpty()) {
      LOG.error("Period starting {} uses object store {} but has no chunk table prefix",
          from, objectStore);
      throw new MissingChunkPrefixException(objectStore);
    }

    createSchema();
  }

  /**
   * Builds the bucketing and key rules for this period.
   *
   * @throws InvalidTablePeriodException   if a table period is not a whole number of days
   * @throws InvalidSchemaVersionException if the schema version is not supported
   * @throws InvalidRowShardsException     if row shards are negative, or the version needs row
   *                                       shards and has none
   */
  public SeriesStoreSchema createSchema() {
    checkTablePeriod(indexTables);
    checkTablePeriod(chunkTables);

    final SchemaVersion version = SchemaVersion.forName(schema);
    if (rowShards() < 0 || version.requiresRowShards() && rowShards() == 0) {
      LOG.error("Period starting {} has schema {} with invalid row_shards {}",
          from, schema, rowShards());
      throw new InvalidRowShardsException(schema, rowShards());
    }
    return new SeriesStoreSchema(version, rowShards(), new DailyBucketer(indexTables));
  }

  private void checkTablePeriod(final PeriodicTableConfig tables) {
    if (tables.isPeriodic() && tables.period().toMillis() % MILLIS_PER_DAY != 0) {
      LOG.error("Period starting {} has table prefix {} with period {} which is not a "
          + "multiple of 24h", from, tables.prefix(), tables.period());
      throw new InvalidTablePeriodException(tables.prefix(), tables.period());
    }
  }

  private static Integer parseVersion(final String schema) {
    if (schema == null) {
      return null;
    }
    final Matcher matcher = VERSION.matcher(schema);
    if (!matcher.matches()) {
      return null;
    }
    return Integer.parseInt(matcher.group(1));
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final PeriodConfig that = (PeriodConfig) o;
    return Objects.equals(from, that.from)
        && Objects.equals(indexType, that.indexType)
        && Objects.equals(objectType, that.objectType)
        && Objects.equals(schema, that.schema)
        && Objects.equals(indexTables, that.indexTables)
        && Objects.equals(chunkTables, that.chunkTables)
        && Objects.equals(rowShards, that.rowShards);
  }

  @Override
  public int hashCode() {
    return Objects.hash(from, indexType, objectType, schema, indexTables, chunkTables, rowShards);
  }

  @Override
  public String toString() {
    return "PeriodConfig{"
        + "from=" + from
        + ", store='" + indexType + '\''
        + ", objectStore='" + objectType + '\''
        + ", schema='" + schema + '\''
        + ", index=" + indexTables
        + ", chunks=" + chunkTables
        + ", rowShards=" + rowShards
        + '}';
  }
}
