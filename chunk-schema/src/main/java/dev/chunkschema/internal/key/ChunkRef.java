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

package dev.chunkschema.internal.key;

import java.util.Objects;

/**
 * Identity of a stored chunk: the owning tenant, the series fingerprint and the
 * {@code [from, through)} time range in epoch milliseconds. Chunks written before
 * checksums were introduced have {@link #checksumSet()} false.
 */
public final class ChunkRef {

  private final String tenantId;
  private final long fingerprint;
  private final long from;
  private final long through;
  private final int checksum;
  private final boolean checksumSet;

  private ChunkRef(
      final String tenantId,
      final long fingerprint,
      final long from,
      final long through,
      final int checksum,
      final boolean checksumSet
  ) {
    this.tenantId = Objects.requireNonNull(tenantId);
    this.fingerprint = fingerprint;
    this.from = from;
    this.through = through;
    this.checksum = checksum;
    this.checksumSet = checksumSet;
  }

  public static ChunkRef withChecksum(
      final String tenantId,
      final long fingerprint,
      final long from,
      final long through,
      final int checksum
  ) {
    return new ChunkRef(tenantId, fingerprint, from, through, checksum, true);
  }

  public static ChunkRef legacy(
      final String tenantId,
      final long fingerprint,
      final long from,
      final long through
  ) {
    return new ChunkRef(tenantId, fingerprint, from, through, 0, false);
  }

  public String tenantId() {
    return tenantId;
  }

  /**
   * Unsigned 64-bit series fingerprint.
   */
  public long fingerprint() {
    return fingerprint;
  }

  public long from() {
    return from;
  }

  public long through() {
    return through;
  }

  /**
   * Unsigned 32-bit checksum, only meaningful if {@link #checksumSet()}.
   */
  public int checksum() {
    return checksum;
  }

  public boolean checksumSet() {
    return checksumSet;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final ChunkRef that = (ChunkRef) o;
    return fingerprint == that.fingerprint
        && from == that.from
        && through == that.through
        && checksum == that.checksum
        && checksumSet == that.checksumSet
        && tenantId.equals(that.tenantId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tenantId, fingerprint, from, through, checksum, checksumSet);
  }

  @Override
  public String toString() {
    return "ChunkRef{"
        + "tenantId='" + tenantId + '\''
        + ", fingerprint=" + Long.toUnsignedString(fingerprint, 16)
        + ", from=" + from
        + ", through=" + through
        + (checksumSet ? ", checksum=" + Integer.toHexString(checksum) : "")
        + '}';
  }
}
