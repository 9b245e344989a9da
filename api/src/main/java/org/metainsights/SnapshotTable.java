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
import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.List;

/**
 * The snapshot listing of a table.
 *
 * <p>Metadata sources do not always provide a timestamp column. When the column is absent, {@link
 * #hasTimestampColumn()} returns false and timestamps of the listed snapshots are not used.
 */
public class SnapshotTable implements Iterable<TableSnapshot> {
  private static final SnapshotTable EMPTY = new SnapshotTable(ImmutableList.of(), true);

  private final List<TableSnapshot> snapshots;
  private final boolean hasTimestampColumn;

  private SnapshotTable(List<TableSnapshot> snapshots, boolean hasTimestampColumn) {
    this.snapshots = snapshots;
    this.hasTimestampColumn = hasTimestampColumn;
  }

  public static SnapshotTable of(TableSnapshot... snapshots) {
    return of(ImmutableList.copyOf(snapshots));
  }

  public static SnapshotTable of(Iterable<TableSnapshot> snapshots) {
    Preconditions.checkArgument(snapshots != null, "Invalid snapshots: null");
    return new SnapshotTable(ImmutableList.copyOf(snapshots), true);
  }

  public static SnapshotTable withoutTimestamps(Iterable<TableSnapshot> snapshots) {
    Preconditions.checkArgument(snapshots != null, "Invalid snapshots: null");
    return new SnapshotTable(ImmutableList.copyOf(snapshots), false);
  }

  public static SnapshotTable empty() {
    return EMPTY;
  }

  /** Returns the snapshots in the order they were listed. */
  public List<TableSnapshot> snapshots() {
    return snapshots;
  }

  public boolean hasTimestampColumn() {
    return hasTimestampColumn;
  }

  /**
   * Returns the commit timestamp of a snapshot, honoring the timestamp column presence.
   *
   * @param snapshot a snapshot from this table
   * @return the timestamp in milliseconds, or null if unknown
   */
  public Long timestampOf(TableSnapshot snapshot) {
    return hasTimestampColumn ? snapshot.timestampMillis() : null;
  }

  public int size() {
    return snapshots.size();
  }

  public boolean isEmpty() {
    return snapshots.isEmpty();
  }

  @Override
  public Iterator<TableSnapshot> iterator() {
    return snapshots.iterator();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("size", snapshots.size())
        .add("timestamps", hasTimestampColumn)
        .toString();
  }
}
