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
package org.metainsights.local;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.metainsights.InsightsProperties;
import org.metainsights.ManifestEntry;
import org.metainsights.ManifestEntryTable;
import org.metainsights.MetadataProvider;
import org.metainsights.SchemaField;
import org.metainsights.SnapshotTable;
import org.metainsights.TableSnapshot;
import org.metainsights.util.PropertyUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link MetadataProvider} that reads table metadata files, manifest lists and manifests from
 * the local file system.
 *
 * <p>Each call resolves and reads the table's current metadata file again.
 */
public class LocalMetadataProvider implements MetadataProvider {
  private static final Logger LOG = LoggerFactory.getLogger(LocalMetadataProvider.class);

  private boolean allSnapshots = false;

  public LocalMetadataProvider() {}

  @Override
  public void initialize(Map<String, String> properties) {
    Preconditions.checkArgument(properties != null, "Invalid properties: null");
    String scope =
        PropertyUtil.propertyAsString(
                properties,
                InsightsProperties.MANIFEST_SCOPE,
                InsightsProperties.MANIFEST_SCOPE_DEFAULT)
            .trim()
            .toLowerCase(Locale.ROOT);
    Preconditions.checkArgument(
        InsightsProperties.MANIFEST_SCOPE_CURRENT.equals(scope)
            || InsightsProperties.MANIFEST_SCOPE_ALL.equals(scope),
        "Invalid %s: %s (must be %s or %s)",
        InsightsProperties.MANIFEST_SCOPE,
        scope,
        InsightsProperties.MANIFEST_SCOPE_CURRENT,
        InsightsProperties.MANIFEST_SCOPE_ALL);
    this.allSnapshots = InsightsProperties.MANIFEST_SCOPE_ALL.equals(scope);
  }

  @Override
  public SnapshotTable fetchSnapshots(String tableLocation) {
    TableMetadataFile metadata = readMetadata(tableLocation);
    return SnapshotTable.of(metadata.snapshots());
  }

  @Override
  public ManifestEntryTable fetchManifests(String tableLocation) {
    TableMetadataFile metadata = readMetadata(tableLocation);

    List<Long> snapshotIds = Lists.newArrayList();
    if (allSnapshots) {
      for (TableSnapshot snapshot : metadata.snapshots()) {
        snapshotIds.add(snapshot.snapshotId());
      }
    } else if (metadata.currentSnapshotId() != null) {
      snapshotIds.add(metadata.currentSnapshotId());
    }

    // manifests are shared between snapshots, so each path is read once
    Map<String, AvroManifests.ManifestRef> manifests = Maps.newLinkedHashMap();
    for (long snapshotId : snapshotIds) {
      for (AvroManifests.ManifestRef manifest : manifestsOf(metadata, snapshotId)) {
        manifests.putIfAbsent(manifest.path(), manifest);
      }
    }

    ImmutableList.Builder<ManifestEntry> entries = ImmutableList.builder();
    for (AvroManifests.ManifestRef manifest : manifests.values()) {
      entries.addAll(AvroManifests.readEntries(manifest));
    }

    ManifestEntryTable table = ManifestEntryTable.of(entries.build());
    LOG.debug(
        "Read {} manifest entries from {} manifests of {} snapshots in {}",
        table.size(),
        manifests.size(),
        snapshotIds.size(),
        metadata.location());
    return table;
  }

  @Override
  public List<SchemaField> fetchSchema(String tableLocation) {
    return readMetadata(tableLocation).schema();
  }

  private static List<AvroManifests.ManifestRef> manifestsOf(
      TableMetadataFile metadata, long snapshotId) {
    String manifestList = metadata.manifestList(snapshotId);
    if (manifestList != null) {
      return AvroManifests.readManifestList(manifestList);
    }

    ImmutableList.Builder<AvroManifests.ManifestRef> manifests = ImmutableList.builder();
    for (String path : metadata.embeddedManifests(snapshotId)) {
      manifests.add(new AvroManifests.ManifestRef(path, TableMetadataFile.INITIAL_SEQUENCE_NUMBER));
    }

    return manifests.build();
  }

  private static TableMetadataFile readMetadata(String tableLocation) {
    TableMetadataFile metadata = TableMetadataFile.read(MetadataLocations.resolve(tableLocation));
    LOG.debug(
        "Loaded format v{} metadata for {} from {}",
        metadata.formatVersion(),
        tableLocation,
        metadata.location());
    return metadata;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add(
            InsightsProperties.MANIFEST_SCOPE,
            allSnapshots
                ? InsightsProperties.MANIFEST_SCOPE_ALL
                : InsightsProperties.MANIFEST_SCOPE_CURRENT)
        .toString();
  }
}
