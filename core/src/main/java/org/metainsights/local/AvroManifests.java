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
import java.io.IOException;
import java.util.List;
import org.apache.avro.Schema;
import org.apache.avro.file.DataFileReader;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericRecord;
import org.metainsights.ManifestEntry;
import org.metainsights.ManifestEntryStatus;
import org.metainsights.exceptions.RuntimeIOException;

/** Reads manifest lists and manifests stored as Avro files. */
class AvroManifests {
  // manifest list fields
  static final String MANIFEST_PATH = "manifest_path";
  static final String SEQUENCE_NUMBER = "sequence_number";

  // manifest entry fields
  static final String STATUS = "status";
  static final String DATA_FILE = "data_file";
  static final String FILE_PATH = "file_path";
  static final String RECORD_COUNT = "record_count";

  private AvroManifests() {}

  /** A manifest referenced by a manifest list, with the sequence number it was written at. */
  static class ManifestRef {
    private final String path;
    private final long sequenceNumber;

    ManifestRef(String path, long sequenceNumber) {
      this.path = path;
      this.sequenceNumber = sequenceNumber;
    }

    String path() {
      return path;
    }

    long sequenceNumber() {
      return sequenceNumber;
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("path", path)
          .add("sequence_number", sequenceNumber)
          .toString();
    }
  }

  /**
   * Reads the manifests listed in a manifest list.
   *
   * <p>Manifest lists written for format v1 have no sequence numbers; their manifests are assigned
   * the initial sequence number.
   *
   * @param manifestListLocation location of the manifest list file
   * @return the listed manifests in file order
   */
  static List<ManifestRef> readManifestList(String manifestListLocation) {
    ImmutableList.Builder<ManifestRef> manifests = ImmutableList.builder();
    try (DataFileReader<GenericRecord> reader = open(manifestListLocation)) {
      for (GenericRecord record : reader) {
        Object path = get(record, MANIFEST_PATH);
        Preconditions.checkArgument(
            path != null,
            "Invalid manifest list %s: missing %s",
            manifestListLocation,
            MANIFEST_PATH);
        Object sequenceNumber = get(record, SEQUENCE_NUMBER);
        manifests.add(
            new ManifestRef(
                path.toString(),
                sequenceNumber != null
                    ? ((Number) sequenceNumber).longValue()
                    : TableMetadataFile.INITIAL_SEQUENCE_NUMBER));
      }

    } catch (IOException e) {
      throw new RuntimeIOException(e, "Failed to read manifest list: %s", manifestListLocation);
    }

    return manifests.build();
  }

  /**
   * Reads the entries of a manifest.
   *
   * <p>Every entry is returned, including entries with EXISTING or DELETED status. Status ids that
   * are not known produce entries with a null status.
   *
   * @param manifest a manifest reference from a manifest list
   * @return one {@link ManifestEntry} per manifest entry
   */
  static List<ManifestEntry> readEntries(ManifestRef manifest) {
    ImmutableList.Builder<ManifestEntry> entries = ImmutableList.builder();
    try (DataFileReader<GenericRecord> reader = open(manifest.path())) {
      for (GenericRecord record : reader) {
        Object status = get(record, STATUS);
        Object dataFile = get(record, DATA_FILE);
        Preconditions.checkArgument(
            dataFile instanceof GenericRecord,
            "Invalid manifest %s: missing %s",
            manifest.path(),
            DATA_FILE);

        GenericRecord file = (GenericRecord) dataFile;
        Object recordCount = get(file, RECORD_COUNT);
        Object filePath = get(file, FILE_PATH);
        entries.add(
            new ManifestEntry(
                manifest.sequenceNumber(),
                status != null ? ManifestEntryStatus.fromId(((Number) status).intValue()) : null,
                recordCount != null ? ((Number) recordCount).longValue() : 0L,
                manifest.path(),
                filePath != null ? filePath.toString() : null));
      }

    } catch (IOException e) {
      throw new RuntimeIOException(e, "Failed to read manifest: %s", manifest.path());
    }

    return entries.build();
  }

  private static DataFileReader<GenericRecord> open(String location) throws IOException {
    return new DataFileReader<>(
        MetadataLocations.toPath(location).toFile(), new GenericDatumReader<>());
  }

  private static Object get(GenericRecord record, String field) {
    Schema.Field schemaField = record.getSchema().getField(field);
    return schemaField != null ? record.get(schemaField.pos()) : null;
  }
}
