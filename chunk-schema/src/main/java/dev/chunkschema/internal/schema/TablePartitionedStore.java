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

import java.util.Arrays;

/**
 * Object stores that keep chunks in physically partitioned tables, and therefore need a
 * chunk table prefix to name them.
 */
public enum TablePartitionedStore {

  CASSANDRA("cassandra"),
  AWS_DYNAMO("aws-dynamo"),
  BIGTABLE_HASHED("bigtable-hashed"),
  GCP("gcp"),
  GCP_COLUMNKEY("gcp-columnkey"),
  BIGTABLE("bigtable"),
  GRPC_STORE("grpc-store");

  private final String storeType;

  TablePartitionedStore(final String storeType) {
    this.storeType = storeType;
  }

  public String storeType() {
    return storeType;
  }

  public static boolean requiresChunkPrefix(final String storeType) {
    return Arrays.stream(values()).anyMatch(s -> s.storeType.equals(storeType));
  }
}
