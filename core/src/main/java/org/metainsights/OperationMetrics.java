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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimaps;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Derives per-snapshot write and delete activity from manifest entries. */
public class OperationMetrics {
  private static final Logger LOG = LoggerFactory.getLogger(OperationMetrics.class);

  private OperationMetrics() {}

  /**
   * Extracts one {@link OperationMetric} per snapshot.
   *
   * <p>Manifest entries are joined to snapshots on sequence number. Record counts of {@link
   * ManifestEntryStatus#ADDED ADDED} and {@link ManifestEntryStatus#DELETED DELETED} entries are
   * summed separately; entries with any other status only count toward the manifest count. Entries
   * whose sequence number matches no snapshot are ignored.
   *
   * <p>Returns an empty list if either table is empty. If the manifest table has no status column,
   * no snapshot produces a metric and the result is also empty.
   *
   * @param snapshots a snapshot table
   * @param manifests a manifest entry table
   * @return metrics in the order of the snapshot table
   */
  public static List<OperationMetric> extract(
      SnapshotTable snapshots, ManifestEntryTable manifests) {
    Preconditions.checkArgument(snapshots != null, "Invalid snapshot table: null");
    Preconditions.checkArgument(manifests != null, "Invalid manifest entry table: null");

    if (snapshots.isEmpty() || manifests.isEmpty()) {
      return ImmutableList.of();
    }

    if (!manifests.hasStatusColumn()) {
      LOG.debug(
          "Skipping operation metrics for {} snapshots: manifests have no status",
          snapshots.size());
      return ImmutableList.of();
    }

    ListMultimap<Long, ManifestEntry> entriesBySequenceNumber =
        Multimaps.index(manifests, ManifestEntry::manifestSequenceNumber);

    ImmutableList.Builder<OperationMetric> metrics = ImmutableList.builder();
    for (TableSnapshot snapshot : snapshots) {
      List<ManifestEntry> entries = entriesBySequenceNumber.get(snapshot.sequenceNumber());
      metrics.add(metric(snapshot, snapshots.timestampOf(snapshot), entries));
    }

    return metrics.build();
  }

  private static OperationMetric metric(
      TableSnapshot snapshot, Long timestampMillis, List<ManifestEntry> entries) {
    long added = 0L;
    long deleted = 0L;
    for (ManifestEntry entry : entries) {
      if (entry.status() == ManifestEntryStatus.ADDED) {
        added += entry.recordCount();
      } else if (entry.status() == ManifestEntryStatus.DELETED) {
        deleted += entry.recordCount();
      }
    }

    return new OperationMetric(
        snapshot.snapshotId(),
        timestampMillis,
        snapshot.sequenceNumber(),
        added,
        deleted,
        entries.size());
  }
}
