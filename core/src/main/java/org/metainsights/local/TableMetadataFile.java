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

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.metainsights.SchemaField;
import org.metainsights.TableSnapshot;
import org.metainsights.exceptions.NoSuchTableException;
import org.metainsights.exceptions.RuntimeIOException;
import org.metainsights.util.JsonUtil;

/**
 * The parts of a table metadata JSON file needed for insights: the snapshot list, the manifests
 * each snapshot references, and the current schema.
 */
class TableMetadataFile {
  static final long INITIAL_SEQUENCE_NUMBER = 0;

  private static final String FORMAT_VERSION = "format-version";
  private static final String CURRENT_SNAPSHOT_ID = "current-snapshot-id";
  private static final String SNAPSHOTS = "snapshots";
  private static final String SNAPSHOT_ID = "snapshot-id";
  private static final String SEQUENCE_NUMBER = "sequence-number";
  private static final String TIMESTAMP_MS = "timestamp-ms";
  private static final String MANIFEST_LIST = "manifest-list";
  private static final String MANIFESTS = "manifests";
  private static final String SCHEMA = "schema";
  private static final String SCHEMAS = "schemas";
  private static final String CURRENT_SCHEMA_ID = "current-schema-id";
  private static final String SCHEMA_ID = "schema-id";
  private static final String FIELDS = "fields";
  private static final String ID = "id";
  private static final String NAME = "name";
  private static final String REQUIRED = "required";
  private static final String TYPE = "type";

  private final String location;
  private final int formatVersion;
  private final Long currentSnapshotId;
  private final List<TableSnapshot> snapshots;
  private final Map<Long, String> manifestLists;
  private final Map<Long, List<String>> embeddedManifests;
  private final List<SchemaField> schema;

  private TableMetadataFile(
      String location,
      int formatVersion,
      Long currentSnapshotId,
      List<TableSnapshot> snapshots,
      Map<Long, String> manifestLists,
      Map<Long, List<String>> embeddedManifests,
      List<SchemaField> schema) {
    this.location = location;
    this.formatVersion = formatVersion;
    this.currentSnapshotId = currentSnapshotId;
    this.snapshots = snapshots;
    this.manifestLists = manifestLists;
    this.embeddedManifests = embeddedManifests;
    this.schema = schema;
  }

  static TableMetadataFile read(Path metadataFile) {
    String json;
    try {
      json = new String(Files.readAllBytes(metadataFile), StandardCharsets.UTF_8);
    } catch (NoSuchFileException e) {
      throw new NoSuchTableException(e, "Metadata file does not exist: %s", metadataFile);
    } catch (IOException e) {
      throw new RuntimeIOException(e, "Failed to read metadata file: %s", metadataFile);
    }

    return JsonUtil.parse(json, node -> fromJson(metadataFile.toString(), node));
  }

  static TableMetadataFile fromJson(String location, JsonNode node) {
    Preconditions.checkArgument(
        node.isObject(), "Cannot parse metadata from a non-object: %s", node);

    int formatVersion = JsonUtil.getInt(FORMAT_VERSION, node);
    Long currentSnapshotId = JsonUtil.getLongOrNull(CURRENT_SNAPSHOT_ID, node);
    if (currentSnapshotId != null && currentSnapshotId == -1L) {
      // v1 writers used -1 for no current snapshot
      currentSnapshotId = null;
    }

    ImmutableList.Builder<TableSnapshot> snapshots = ImmutableList.builder();
    ImmutableMap.Builder<Long, String> manifestLists = ImmutableMap.builder();
    ImmutableMap.Builder<Long, List<String>> embeddedManifests = ImmutableMap.builder();
    if (node.hasNonNull(SNAPSHOTS)) {
      JsonNode snapshotArray = node.get(SNAPSHOTS);
      Preconditions.checkArgument(
          snapshotArray.isArray(), "Cannot parse snapshots from non-array: %s", snapshotArray);

      for (JsonNode snapshot : snapshotArray) {
        Preconditions.checkArgument(
            snapshot.isObject(), "Cannot parse snapshot from a non-object: %s", snapshot);
        long snapshotId = JsonUtil.getLong(SNAPSHOT_ID, snapshot);
        long sequenceNumber = INITIAL_SEQUENCE_NUMBER;
        if (snapshot.has(SEQUENCE_NUMBER)) {
          sequenceNumber = JsonUtil.getLong(SEQUENCE_NUMBER, snapshot);
        }

        snapshots.add(
            new TableSnapshot(
                snapshotId, sequenceNumber, JsonUtil.getLongOrNull(TIMESTAMP_MS, snapshot)));

        if (snapshot.hasNonNull(MANIFEST_LIST)) {
          manifestLists.put(snapshotId, JsonUtil.getString(MANIFEST_LIST, snapshot));
        } else if (snapshot.hasNonNull(MANIFESTS)) {
          embeddedManifests.put(snapshotId, JsonUtil.getStringList(MANIFESTS, snapshot));
        }
      }
    }

    return new TableMetadataFile(
        location,
        formatVersion,
        currentSnapshotId,
        snapshots.build(),
        manifestLists.buildKeepingLast(),
        embeddedManifests.buildKeepingLast(),
        schemaFromJson(node));
  }

  private static List<SchemaField> schemaFromJson(JsonNode node) {
    JsonNode schemaNode = null;
    if (node.hasNonNull(SCHEMAS)) {
      Integer currentSchemaId = JsonUtil.getIntOrNull(CURRENT_SCHEMA_ID, node);
      for (JsonNode candidate : node.get(SCHEMAS)) {
        Integer schemaId = JsonUtil.getIntOrNull(SCHEMA_ID, candidate);
        if (currentSchemaId == null || currentSchemaId.equals(schemaId)) {
          schemaNode = candidate;
        }
      }
    }

    if (schemaNode == null && node.hasNonNull(SCHEMA)) {
      schemaNode = node.get(SCHEMA);
    }

    if (schemaNode == null || !schemaNode.hasNonNull(FIELDS)) {
      return ImmutableList.of();
    }

    ImmutableList.Builder<SchemaField> fields = ImmutableList.builder();
    for (JsonNode field : schemaNode.get(FIELDS)) {
      JsonNode type = JsonUtil.get(TYPE, field);
      fields.add(
          new SchemaField(
              JsonUtil.getInt(ID, field),
              JsonUtil.getString(NAME, field),
              type.isTextual() ? type.asText() : type.toString(),
              JsonUtil.getBool(REQUIRED, field)));
    }

    return fields.build();
  }

  String location() {
    return location;
  }

  int formatVersion() {
    return formatVersion;
  }

  /** Returns the current snapshot ID, or null if the table has no current snapshot. */
  Long currentSnapshotId() {
    return currentSnapshotId;
  }

  List<TableSnapshot> snapshots() {
    return snapshots;
  }

  /** Returns the manifest list location of a snapshot, or null if its manifests are embedded. */
  String manifestList(long snapshotId) {
    return manifestLists.get(snapshotId);
  }

  /** Returns manifest locations embedded in a v1 snapshot, or an empty list. */
  List<String> embeddedManifests(long snapshotId) {
    List<String> manifests = embeddedManifests.get(snapshotId);
    return manifests != null ? manifests : ImmutableList.of();
  }

  List<SchemaField> schema() {
    return schema;
  }
}
