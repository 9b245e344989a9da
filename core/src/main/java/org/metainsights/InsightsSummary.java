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
import com.google.common.base.Preconditions;
import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Scalar reductions over operation metrics and snapshot intervals.
 *
 * <p>A reduction over an empty sequence is unavailable and is returned as an empty optional, so
 * that "no data" is not confused with "no activity".
 */
public class InsightsSummary {
  private final int totalSnapshots;
  private final OptionalLong writeOperations;
  private final OptionalLong deleteOperations;
  private final OptionalDouble averageManifestCount;
  private final OptionalDouble averageIntervalHours;
  private final OptionalDouble minIntervalHours;
  private final OptionalDouble maxIntervalHours;

  private InsightsSummary(
      int totalSnapshots, List<OperationMetric> metrics, List<SnapshotInterval> intervals) {
    this.totalSnapshots = totalSnapshots;

    if (metrics.isEmpty()) {
      this.writeOperations = OptionalLong.empty();
      this.deleteOperations = OptionalLong.empty();
    } else {
      this.writeOperations =
          OptionalLong.of(metrics.stream().filter(m -> m.addedRecords() > 0).count());
      this.deleteOperations =
          OptionalLong.of(metrics.stream().filter(m -> m.deletedRecords() > 0).count());
    }

    this.averageManifestCount =
        metrics.stream().mapToInt(OperationMetric::manifestCount).average();
    this.averageIntervalHours =
        intervals.stream().mapToDouble(SnapshotInterval::intervalHours).average();
    this.minIntervalHours = intervals.stream().mapToDouble(SnapshotInterval::intervalHours).min();
    this.maxIntervalHours = intervals.stream().mapToDouble(SnapshotInterval::intervalHours).max();
  }

  public static InsightsSummary of(
      int totalSnapshots, List<OperationMetric> metrics, List<SnapshotInterval> intervals) {
    Preconditions.checkArgument(
        totalSnapshots >= 0, "Invalid snapshot count: %s (must be >= 0)", totalSnapshots);
    Preconditions.checkArgument(metrics != null, "Invalid operation metrics: null");
    Preconditions.checkArgument(intervals != null, "Invalid snapshot intervals: null");
    return new InsightsSummary(totalSnapshots, metrics, intervals);
  }

  public int totalSnapshots() {
    return totalSnapshots;
  }

  /** Number of snapshots that added records. */
  public OptionalLong writeOperations() {
    return writeOperations;
  }

  /** Number of snapshots that deleted records. */
  public OptionalLong deleteOperations() {
    return deleteOperations;
  }

  public OptionalDouble averageManifestCount() {
    return averageManifestCount;
  }

  public OptionalDouble averageIntervalHours() {
    return averageIntervalHours;
  }

  public OptionalDouble minIntervalHours() {
    return minIntervalHours;
  }

  public OptionalDouble maxIntervalHours() {
    return maxIntervalHours;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("total_snapshots", totalSnapshots)
        .add("write_operations", writeOperations)
        .add("delete_operations", deleteOperations)
        .add("avg_manifest_count", averageManifestCount)
        .add("avg_interval_hours", averageIntervalHours)
        .add("min_interval_hours", minIntervalHours)
        .add("max_interval_hours", maxIntervalHours)
        .toString();
  }
}
