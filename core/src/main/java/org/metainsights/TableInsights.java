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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;

/**
 * Insights computed for one table location.
 *
 * <p>Metadata that could not be fetched is reported in {@link #failures()}; the corresponding
 * inputs were treated as empty.
 */
public class TableInsights {

  /** Kinds of metadata fetched for a report. */
  public enum Source {
    SNAPSHOTS,
    MANIFESTS,
    SCHEMA
  }

  private final String location;
  private final SnapshotTable snapshots;
  private final int manifestEntryCount;
  private final List<SchemaField> schema;
  private final List<OperationMetric> operationMetrics;
  private final List<SnapshotInterval> intervals;
  private final List<TableSnapshot> timeline;
  private final InsightsSummary summary;
  private final List<TableSnapshot> recentSnapshots;
  private final Map<Source, String> failures;

  TableInsights(
      String location,
      SnapshotTable snapshots,
      int manifestEntryCount,
      List<SchemaField> schema,
      List<OperationMetric> operationMetrics,
      List<SnapshotInterval> intervals,
      List<TableSnapshot> timeline,
      List<TableSnapshot> recentSnapshots,
      Map<Source, String> failures) {
    this.location = location;
    this.snapshots = snapshots;
    this.manifestEntryCount = manifestEntryCount;
    this.schema = ImmutableList.copyOf(schema);
    this.operationMetrics = operationMetrics;
    this.intervals = intervals;
    this.timeline = timeline;
    this.summary = InsightsSummary.of(snapshots.size(), operationMetrics, intervals);
    this.recentSnapshots = recentSnapshots;
    this.failures = ImmutableMap.copyOf(failures);
  }

  public String location() {
    return location;
  }

  public SnapshotTable snapshots() {
    return snapshots;
  }

  public int manifestEntryCount() {
    return manifestEntryCount;
  }

  public List<SchemaField> schema() {
    return schema;
  }

  public List<OperationMetric> operationMetrics() {
    return operationMetrics;
  }

  public List<SnapshotInterval> intervals() {
    return intervals;
  }

  /**
   * Returns the snapshots that have a timestamp in ascending timestamp order.
   *
   * <p>Only meaningful when {@link #hasTimeline()} is true.
   */
  public List<TableSnapshot> timeline() {
    return timeline;
  }

  public InsightsSummary summary() {
    return summary;
  }

  /** Returns the most recent snapshots, newest first. */
  public List<TableSnapshot> recentSnapshots() {
    return recentSnapshots;
  }

  /** Returns the error message of each fetch that failed. */
  public Map<Source, String> failures() {
    return failures;
  }

  /**
   * Whether a snapshot timeline can be shown: at least two snapshots and a timestamp column.
   */
  public boolean hasTimeline() {
    return snapshots.hasTimestampColumn() && snapshots.size() > 1;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("location", location)
        .add("snapshots", snapshots.size())
        .add("manifest_entries", manifestEntryCount)
        .add("summary", summary)
        .add("failures", failures.keySet())
        .toString();
  }
}
