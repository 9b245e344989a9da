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
import com.google.common.base.Preconditions;

/**
 * Elapsed time between two consecutive snapshots in commit time order.
 *
 * <p>The duration is stored once, in milliseconds. Seconds, hours and days are all derived from
 * that value.
 */
public class SnapshotInterval {
  private static final double MILLIS_PER_SECOND = 1000.0;
  private static final double SECONDS_PER_HOUR = 3600.0;
  private static final double SECONDS_PER_DAY = 86400.0;

  private final long previousSnapshotId;
  private final long currentSnapshotId;
  private final long previousTimestampMillis;
  private final long currentTimestampMillis;
  private final long durationMillis;

  public SnapshotInterval(
      long previousSnapshotId,
      long currentSnapshotId,
      long previousTimestampMillis,
      long currentTimestampMillis) {
    Preconditions.checkArgument(
        currentTimestampMillis >= previousTimestampMillis,
        "Invalid interval: snapshot %s at %s is earlier than snapshot %s at %s",
        currentSnapshotId,
        currentTimestampMillis,
        previousSnapshotId,
        previousTimestampMillis);
    this.previousSnapshotId = previousSnapshotId;
    this.currentSnapshotId = currentSnapshotId;
    this.previousTimestampMillis = previousTimestampMillis;
    this.currentTimestampMillis = currentTimestampMillis;
    this.durationMillis = currentTimestampMillis - previousTimestampMillis;
  }

  public long previousSnapshotId() {
    return previousSnapshotId;
  }

  public long currentSnapshotId() {
    return currentSnapshotId;
  }

  public long previousTimestampMillis() {
    return previousTimestampMillis;
  }

  public long currentTimestampMillis() {
    return currentTimestampMillis;
  }

  public long durationMillis() {
    return durationMillis;
  }

  public double intervalSeconds() {
    return durationMillis / MILLIS_PER_SECOND;
  }

  public double intervalHours() {
    return intervalSeconds() / SECONDS_PER_HOUR;
  }

  public double intervalDays() {
    return intervalSeconds() / SECONDS_PER_DAY;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }

    if (!(o instanceof SnapshotInterval)) {
      return false;
    }

    SnapshotInterval other = (SnapshotInterval) o;
    return previousSnapshotId == other.previousSnapshotId
        && currentSnapshotId == other.currentSnapshotId
        && previousTimestampMillis == other.previousTimestampMillis
        && currentTimestampMillis == other.currentTimestampMillis;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(
        previousSnapshotId, currentSnapshotId, previousTimestampMillis, currentTimestampMillis);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("previous_snapshot", previousSnapshotId)
        .add("current_snapshot", currentSnapshotId)
        .add("previous_time_ms", previousTimestampMillis)
        .add("current_time_ms", currentTimestampMillis)
        .add("interval_seconds", intervalSeconds())
        .toString();
  }
}
