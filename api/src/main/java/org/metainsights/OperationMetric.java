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
 * Write and delete activity of a single snapshot.
 *
 * <p>Added and deleted record counts are sums of the record counts of the manifest entries written
 * with the snapshot's sequence number. The manifest count is the number of those entries,
 * regardless of their status.
 */
public class OperationMetric {
  private final long snapshotId;
  private final Long timestampMillis;
  private final long sequenceNumber;
  private final long addedRecords;
  private final long deletedRecords;
  private final int manifestCount;

  public OperationMetric(
      long snapshotId,
      Long timestampMillis,
      long sequenceNumber,
      long addedRecords,
      long deletedRecords,
      int manifestCount) {
    this.snapshotId = snapshotId;
    this.timestampMillis = timestampMillis;
    this.sequenceNumber = sequenceNumber;
    this.addedRecords = addedRecords;
    this.deletedRecords = deletedRecords;
    this.manifestCount = manifestCount;
  }

  public long snapshotId() {
    return snapshotId;
  }

  /** Returns the snapshot's commit time in milliseconds, or null if it is unknown. */
  public Long timestampMillis() {
    return timestampMillis;
  }

  public long sequenceNumber() {
    return sequenceNumber;
  }

  public long addedRecords() {
    return addedRecords;
  }

  public long deletedRecords() {
    return deletedRecords;
  }

  /** Returns added records minus deleted records. */
  public long netChange() {
    return addedRecords - deletedRecords;
  }

  public int manifestCount() {
    return manifestCount;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }

    if (!(o instanceof OperationMetric)) {
      return false;
    }

    OperationMetric other = (OperationMetric) o;
    return snapshotId == other.snapshotId
        && Objects.equal(timestampMillis, other.timestampMillis)
        && sequenceNumber == other.sequenceNumber
        && addedRecords == other.addedRecords
        && deletedRecords == other.deletedRecords
        && manifestCount == other.manifestCount;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(
        snapshotId, timestampMillis, sequenceNumber, addedRecords, deletedRecords, manifestCount);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("snapshot_id", snapshotId)
        .add("timestamp_ms", timestampMillis)
        .add("sequence_number", sequenceNumber)
        .add("added_records", addedRecords)
        .add("deleted_records", deletedRecords)
        .add("net_change", netChange())
        .add("manifest_count", manifestCount)
        .toString();
  }
}
