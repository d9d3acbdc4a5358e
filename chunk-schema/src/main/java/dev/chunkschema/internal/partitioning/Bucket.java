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

package dev.chunkschema.internal.partitioning;

import java.util.Objects;

/**
 * One calendar-day slice of a time range. {@link #from()} and {@link #through()} are
 * millisecond offsets from the start of the bucket's own day, so they always fit in an
 * unsigned 32-bit range key.
 */
public final class Bucket {

  private final int from;
  private final int through;
  private final String tableName;
  private final String hashKey;
  private final int bucketSize;

  public Bucket(
      final int from,
      final int through,
      final String tableName,
      final String hashKey,
      final int bucketSize
  ) {
    this.from = from;
    this.through = through;
    this.tableName = tableName;
    this.hashKey = hashKey;
    this.bucketSize = bucketSize;
  }

  public int from() {
    return from;
  }

  public int through() {
    return through;
  }

  public String tableName() {
    return tableName;
  }

  public String hashKey() {
    return hashKey;
  }

  /**
   * Width of the bucket in milliseconds, needed when deleting series ids from the index.
   */
  public int bucketSize() {
    return bucketSize;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Bucket bucket = (Bucket) o;
    return from == bucket.from
        && through == bucket.through
        && bucketSize == bucket.bucketSize
        && Objects.equals(tableName, bucket.tableName)
        && Objects.equals(hashKey, bucket.hashKey);
  }

  @Override
  public int hashCode() {
    return Objects.hash(from, through, tableName, hashKey, bucketSize);
  }

  @Override
  public String toString() {
    return "Bucket{"
        + "from=" + from
        + ", through=" + through
        + ", tableName='" + tableName + '\''
        + ", hashKey='" + hashKey + '\''
        + ", bucketSize=" + bucketSize
        + '}';
  }
}
