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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * A file-level add or delete record read from a manifest.
 *
 * <p>The manifest sequence number is the sequence number of the snapshot that wrote the manifest
 * and is used to join entries back to {@link TableSnapshot#sequenceNumber()}.
 */
public class ManifestEntry {
  private final long manifestSequenceNumber;
  private final ManifestEntryStatus status;
  private final long recordCount;
  private final String manifestPath;
  private final String filePath;

  public ManifestEntry(long manifestSequenceNumber, ManifestEntryStatus status, long recordCount) {
    this(manifestSequenceNumber, status, recordCount, null, null);
  }

  public ManifestEntry(
      long manifestSequenceNumber,
      ManifestEntryStatus status,
      long recordCount,
      String manifestPath,
      String filePath) {
    this.manifestSequenceNumber = manifestSequenceNumber;
    this.status = status;
    this.recordCount = recordCount;
    this.manifestPath = manifestPath;
    this.filePath = filePath;
  }

  public long manifestSequenceNumber() {
    return manifestSequenceNumber;
  }

  /**
   * Returns the status of this entry.
   *
   * @return the status, or null if the status is missing or not known
   */
  public ManifestEntryStatus status() {
    return status;
  }

  /** Returns the number of rows in the file this entry references. */
  public long recordCount() {
    return recordCount;
  }

  public String manifestPath() {
    return manifestPath;
  }

  public String filePath() {
    return filePath;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }

    if (!(o instanceof ManifestEntry)) {
      return false;
    }

    ManifestEntry other = (ManifestEntry) o;
    return manifestSequenceNumber == other.manifestSequenceNumber
        && status == other.status
        && recordCount == other.recordCount
        && Objects.equal(manifestPath, other.manifestPath)
        && Objects.equal(filePath, other.filePath);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(manifestSequenceNumber, status, recordCount, manifestPath, filePath);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("manifest_sequence_number", manifestSequenceNumber)
        .add("status", status)
        .add("record_count", recordCount)
        .add("manifest_path", manifestPath)
        .add("file_path", filePath)
        .omitNullValues()
        .toString();
  }
}
