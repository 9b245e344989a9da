/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.metainsights;

import java.util.List;
import java.util.Map;

/**
 * Reads the snapshot, manifest and schema metadata of a table.
 *
 * <p>Each fetch is independent. A failure to read one kind of metadata is reported by that call
 * only and does not affect the other calls, so callers can substitute an empty result and carry
 * on.
 *
 * <p>A provider is created once per process and reused. Implementations must have a no-arg
 * constructor; callers create the provider and then call {@link #initialize(Map)}.
 */
public interface MetadataProvider {

  /**
   * Initialize the provider with configuration properties.
   *
   * @param properties provider properties
   */
  default void initialize(Map<String, String> properties) {}

  /**
   * Lists the snapshots of a table.
   *
   * @param tableLocation a table location or metadata file location
   * @return the snapshot table
   * @throws org.metainsights.exceptions.NoSuchTableException if no metadata exists at the location
   * @throws org.metainsights.exceptions.RuntimeIOException if the metadata cannot be read
   */
  SnapshotTable fetchSnapshots(String tableLocation);

  /**
   * Lists the manifest entries of a table.
   *
   * @param tableLocation a table location or metadata file location
   * @return the manifest entry table
   * @throws org.metainsights.exceptions.NoSuchTableException if no metadata exists at the location
   * @throws org.metainsights.exceptions.RuntimeIOException if the metadata cannot be read
   */
  ManifestEntryTable fetchManifests(String tableLocation);

  /**
   * Returns the columns of a table's current schema.
   *
   * @param tableLocation a table location or metadata file location
   * @return the top-level schema fields
   */
  List<SchemaField> fetchSchema(String tableLocation);
}
