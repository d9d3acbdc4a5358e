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

import java.util.Map;

/**
 * Builds the provisioning descriptor for one physical table. Implementations belong to the
 * storage backend: they decide what "active" and "inactive" mean in terms of capacity,
 * on-demand mode and autoscaling.
 *
 * @param <T> the backend's table descriptor type
 */
public interface TableProvisioner<T> {

  /**
   * Descriptor for a table that currently receives writes.
   */
  T activeTable(String tableName, Map<String, String> tags);

  /**
   * Descriptor for a table outside its write window.
   *
   * @param disableWriteAutoscale true once the table is further back than
   *                              {@link #inactiveWriteScaleLastN()} periods
   */
  T inactiveTable(String tableName, Map<String, String> tags, boolean disableWriteAutoscale);

  /**
   * Number of most recent inactive tables that keep write autoscaling.
   */
  long inactiveWriteScaleLastN();
}
