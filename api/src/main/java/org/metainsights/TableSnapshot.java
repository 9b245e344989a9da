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

/** A version of a table's contents as listed in the table metadata. */
public class TableSnapshot {
  private final long snapshotId;
  private final long sequenceNumber;
  private final Long timestampMillis;

  public TableSnapshot(long snapshotId, long sequenceNumber, Long timestampMillis) {
    this.snapshotId = snapshotId;
    this.sequenceNumber = sequenceNumber;
    this.timestampMillis = timestampMillis;
  }

  /** Return this snapshot's ID. */
  public long snapshotId() {
    return snapshotId;
  }

  /**
   * Return this snapshot's sequence number.
   *
   * <p>Manifests written by this snapshot's commit carry the same sequence number.
   */
  public long sequenceNumber() {
    return sequenceNumber;
  }

  /**
   * Return the time in milliseconds since the epoch when this snapshot was committed.
   *
   * @return a timestamp in milliseconds, or null if the metadata did not record one
   */
  public Long timestampMillis() {
    return timestampMillis;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }

    if (!(o instanceof TableSnapshot)) {
      return false;
    }

    TableSnapshot other = (TableSnapshot) o;
    return snapshotId == other.snapshotId
        && sequenceNumber == other.sequenceNumber
        && Objects.equal(timestampMillis, other.timestampMillis);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(snapshotId, sequenceNumber, timestampMillis);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", snapshotId)
        .add("sequence_number", sequenceNumber)
        .add("timestamp_ms", timestampMillis)
        .toString();
  }
}
