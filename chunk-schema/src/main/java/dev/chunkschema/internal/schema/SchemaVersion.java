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

import dev.chunkschema.internal.key.ChunkRef;
import dev.chunkschema.internal.key.ExternalKeyFormat;
import dev.chunkschema.internal.schema.exception.InvalidSchemaVersionException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * The schema versions that can still be written. Each version is an ordered chain of
 * {@link EntryLayer}s, most specific first: v11 is v10 plus its own layer, v12 is v11 plus
 * its own layer. A behavior resolves to the first layer in the chain that defines it.
 */
public enum SchemaVersion {

  V9(9, false, new V9Entries()),
  V10(10, true, new V10Entries(), new V9Entries()),
  V11(11, true, new V11Entries(), new V10Entries(), new V9Entries()),
  V12(12, true, new V12Entries(), new V11Entries(), new V10Entries(), new V9Entries());

  private final int number;
  private final boolean requiresRowShards;
  private final List<EntryLayer> chain;

  SchemaVersion(final int number, final boolean requiresRowShards, final EntryLayer... chain) {
    this.number = number;
    this.requiresRowShards = requiresRowShards;
    this.chain = List.of(chain);
  }

  /**
   * @throws InvalidSchemaVersionException if {@code schema} is not a supported version name
   */
  public static SchemaVersion forName(final String schema) {
    return Arrays.stream(values())
        .filter(v -> v.versionName().equals(schema))
        .findFirst()
        .orElseThrow(() -> new InvalidSchemaVersionException(schema));
  }

  /**
   * Maps any version number to the version whose encoding rules apply to it: numbers below
   * v9 use the base rules, numbers above the newest version use the newest rules.
   */
  public static SchemaVersion nearest(final int number) {
    final SchemaVersion[] versions = values();
    if (number <= versions[0].number) {
      return versions[0];
    }
    for (final SchemaVersion version : versions) {
      if (version.number == number) {
        return version;
      }
    }
    return versions[versions.length - 1];
  }

  public int number() {
    return number;
  }

  public String versionName() {
    return "v" + number;
  }

  public boolean requiresRowShards() {
    return requiresRowShards;
  }

  public ExternalKeyFormat externalKeyFormat(final boolean checksumSet) {
    return resolve(layer -> layer.externalKeyFormat(checksumSet));
  }

  /**
   * Encodes the object-store key of {@code chunk} as this version writes it.
   */
  public String externalKey(final ChunkRef chunk) {
    return externalKeyFormat(chunk.checksumSet()).encode(chunk);
  }

  <T> T resolve(final Function<EntryLayer, Optional<T>> behavior) {
    for (final EntryLayer layer : chain) {
      final Optional<T> result = behavior.apply(layer);
      if (result.isPresent()) {
        return result.get();
      }
    }
    throw new IllegalStateException("No layer of " + this + " defines the requested behavior");
  }
}
