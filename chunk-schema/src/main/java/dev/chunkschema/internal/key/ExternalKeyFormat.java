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

/**
 * The string forms a chunk's object-store key has taken over time. Stored objects keep
 * the key they were written with, so every format must stay encodable exactly as it was:
 * the choice of hex or decimal and the field order are part of the on-disk contract.
 */
public enum ExternalKeyFormat {

  /**
   * Pre-checksum chunks: {@code <fingerprint>:<from>:<through>}, all decimal, no tenant.
   */
  LEGACY {
    @Override
    public String encode(final ChunkRef chunk) {
      return Long.toUnsignedString(chunk.fingerprint())
          + ':' + chunk.from()
          + ':' + chunk.through();
    }
  },

  /**
   * {@code <tenant>/<fingerprint>:<from>:<through>:<checksum>}, all hex.
   */
  CHECKSUMMED {
    @Override
    public String encode(final ChunkRef chunk) {
      return chunk.tenantId()
          + '/' + Long.toUnsignedString(chunk.fingerprint(), 16)
          + ':' + timestampHex(chunk.from())
          + ':' + timestampHex(chunk.through())
          + ':' + Integer.toHexString(chunk.checksum());
    }
  },

  /**
   * {@code <tenant>/<fingerprint>/<from>:<through>:<checksum>}, all hex. Each series gets
   * its own directory in the object store.
   */
  FINGERPRINT_DIRECTORY {
    @Override
    public String encode(final ChunkRef chunk) {
      return chunk.tenantId()
          + '/' + Long.toUnsignedString(chunk.fingerprint(), 16)
          + '/' + timestampHex(chunk.from())
          + ':' + timestampHex(chunk.through())
          + ':' + Integer.toHexString(chunk.checksum());
    }
  };

  public abstract String encode(ChunkRef chunk);

  // timestamps are signed, so a pre-epoch value keeps its sign instead of two's complement
  private static String timestampHex(final long timestamp) {
    return Long.toString(timestamp, 16);
  }
}
