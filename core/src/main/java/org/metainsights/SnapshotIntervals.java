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
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Measures the time between consecutive snapshots. */
public class SnapshotIntervals {
  private static final Logger LOG = LoggerFactory.getLogger(SnapshotIntervals.class);

  private SnapshotIntervals() {}

  /**
   * Calculates the interval between each pair of consecutive snapshots in timestamp order.
   *
   * <p>Snapshots are sorted by timestamp with a stable sort, so snapshots with equal timestamps
   * keep their relative order and produce zero-length intervals. Snapshots without a timestamp
   * cannot be placed in the sequence and are left out.
   *
   * <p>Returns an empty list when the table has no timestamp column or fewer than two snapshots
   * with timestamps; otherwise returns exactly one interval less than the number of those
   * snapshots.
   *
   * @param snapshots a snapshot table
   * @return intervals in ascending timestamp order
   */
  public static List<SnapshotInterval> calculate(SnapshotTable snapshots) {
    Preconditions.checkArgument(snapshots != null, "Invalid snapshot table: null");

    if (!snapshots.hasTimestampColumn() || snapshots.size() < 2) {
      return ImmutableList.of();
    }

    List<TableSnapshot> sorted = timeline(snapshots);
    if (sorted.size() < snapshots.size()) {
      LOG.debug("Ignoring {} snapshots without a timestamp", snapshots.size() - sorted.size());
    }

    ImmutableList.Builder<SnapshotInterval> intervals = ImmutableList.builder();
    for (int i = 1; i < sorted.size(); i += 1) {
      TableSnapshot previous = sorted.get(i - 1);
      TableSnapshot current = sorted.get(i);
      intervals.add(
          new SnapshotInterval(
              previous.snapshotId(),
              current.snapshotId(),
              previous.timestampMillis(),
              current.timestampMillis()));
    }

    return intervals.build();
  }

  /**
   * Returns the snapshots that have a timestamp, in ascending timestamp order.
   *
   * @param snapshots a snapshot table
   * @return sorted snapshots, or an empty list if the table has no timestamp column
   */
  public static List<TableSnapshot> timeline(SnapshotTable snapshots) {
    if (!snapshots.hasTimestampColumn()) {
      return ImmutableList.of();
    }

    return snapshots.snapshots().stream()
        .filter(snapshot -> snapshot.timestampMillis() != null)
        .sorted(Comparator.comparing(TableSnapshot::timestampMillis))
        .collect(Collectors.toList());
  }

  /**
   * Returns the most recently committed snapshots, newest first.
   *
   * <p>When the table has no timestamp column, the first snapshots in listing order are returned.
   * Snapshots without a timestamp are placed after all others.
   *
   * @param snapshots a snapshot table
   * @param limit maximum number of snapshots to return
   * @return at most {@code limit} snapshots
   */
  public static List<TableSnapshot> recent(SnapshotTable snapshots, int limit) {
    Preconditions.checkArgument(snapshots != null, "Invalid snapshot table: null");
    Preconditions.checkArgument(limit > 0, "Invalid limit: %s (must be > 0)", limit);

    if (!snapshots.hasTimestampColumn()) {
      return snapshots.snapshots().stream().limit(limit).collect(ImmutableList.toImmutableList());
    }

    return snapshots.snapshots().stream()
        .sorted(
            Comparator.comparing(
                TableSnapshot::timestampMillis,
                Comparator.nullsLast(Comparator.<Long>reverseOrder())))
        .limit(limit)
        .collect(ImmutableList.toImmutableList());
  }
}
