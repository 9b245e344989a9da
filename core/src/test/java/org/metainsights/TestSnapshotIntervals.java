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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

public class TestSnapshotIntervals {
  private static final long T0 = 1_700_000_000_000L;
  private static final long HOUR = 3_600_000L;

  @Test
  public void testSingleInterval() {
    SnapshotTable snapshots =
        SnapshotTable.of(new TableSnapshot(1L, 1L, T0), new TableSnapshot(2L, 2L, T0 + HOUR));

    List<SnapshotInterval> intervals = SnapshotIntervals.calculate(snapshots);

    assertThat(intervals).containsExactly(new SnapshotInterval(1L, 2L, T0, T0 + HOUR));
    assertThat(intervals.get(0).intervalHours()).isEqualTo(1.0);
  }

  @Test
  public void testSingleSnapshot() {
    assertThat(SnapshotIntervals.calculate(SnapshotTable.of(new TableSnapshot(1L, 1L, T0))))
        .isEmpty();
    assertThat(SnapshotIntervals.calculate(SnapshotTable.empty())).isEmpty();
  }

  @Test
  public void testOneIntervalLessThanSnapshots() {
    List<TableSnapshot> list = Lists.newArrayList();
    for (int i = 0; i < 10; i += 1) {
      list.add(new TableSnapshot(i, i, T0 + i * 7 * HOUR));
    }

    List<SnapshotInterval> intervals = SnapshotIntervals.calculate(SnapshotTable.of(list));

    assertThat(intervals).hasSize(9);
    assertThat(intervals)
        .allSatisfy(interval -> assertThat(interval.intervalHours()).isEqualTo(7.0));
  }

  @Test
  public void testIndependentOfListingOrder() {
    List<TableSnapshot> list = Lists.newArrayList();
    for (int i = 0; i < 20; i += 1) {
      list.add(new TableSnapshot(i, i, T0 + (long) i * i * 1000));
    }

    List<SnapshotInterval> expected = SnapshotIntervals.calculate(SnapshotTable.of(list));

    List<TableSnapshot> shuffled = Lists.newArrayList(list);
    Collections.shuffle(shuffled, new Random(42));
    assertThat(SnapshotIntervals.calculate(SnapshotTable.of(shuffled))).isEqualTo(expected);
  }

  @Test
  public void testIntervalsFollowTimestampOrder() {
    SnapshotTable snapshots =
        SnapshotTable.of(
            new TableSnapshot(3L, 3L, T0 + 3 * HOUR),
            new TableSnapshot(1L, 1L, T0),
            new TableSnapshot(2L, 2L, T0 + HOUR));

    List<SnapshotInterval> intervals = SnapshotIntervals.calculate(snapshots);

    assertThat(intervals)
        .containsExactly(
            new SnapshotInterval(1L, 2L, T0, T0 + HOUR),
            new SnapshotInterval(2L, 3L, T0 + HOUR, T0 + 3 * HOUR));
    assertThat(intervals)
        .allSatisfy(interval -> assertThat(interval.durationMillis()).isNotNegative());
  }

  @Test
  public void testEqualTimestampsKeepListingOrder() {
    SnapshotTable snapshots =
        SnapshotTable.of(
            new TableSnapshot(5L, 1L, T0),
            new TableSnapshot(4L, 2L, T0),
            new TableSnapshot(6L, 3L, T0));

    List<SnapshotInterval> intervals = SnapshotIntervals.calculate(snapshots);

    assertThat(intervals)
        .containsExactly(
            new SnapshotInterval(5L, 4L, T0, T0), new SnapshotInterval(4L, 6L, T0, T0));
    assertThat(intervals).allSatisfy(interval -> assertThat(interval.intervalSeconds()).isZero());
  }

  @Test
  public void testNoTimestampColumn() {
    SnapshotTable snapshots =
        SnapshotTable.withoutTimestamps(
            ImmutableList.of(new TableSnapshot(1L, 1L, T0), new TableSnapshot(2L, 2L, T0 + HOUR)));

    assertThat(SnapshotIntervals.calculate(snapshots)).isEmpty();
    assertThat(SnapshotIntervals.timeline(snapshots)).isEmpty();
  }

  @Test
  public void testSnapshotsWithoutTimestampAreSkipped() {
    SnapshotTable snapshots =
        SnapshotTable.of(
            new TableSnapshot(1L, 1L, T0),
            new TableSnapshot(2L, 2L, null),
            new TableSnapshot(3L, 3L, T0 + HOUR));

    assertThat(SnapshotIntervals.calculate(snapshots))
        .containsExactly(new SnapshotInterval(1L, 3L, T0, T0 + HOUR));
  }

  @Test
  public void testRecent() {
    SnapshotTable snapshots =
        SnapshotTable.of(
            new TableSnapshot(1L, 1L, T0),
            new TableSnapshot(2L, 2L, null),
            new TableSnapshot(3L, 3L, T0 + 2 * HOUR),
            new TableSnapshot(4L, 4L, T0 + HOUR));

    assertThat(SnapshotIntervals.recent(snapshots, 2))
        .extracting(TableSnapshot::snapshotId)
        .containsExactly(3L, 4L);
    assertThat(SnapshotIntervals.recent(snapshots, 10))
        .extracting(TableSnapshot::snapshotId)
        .containsExactly(3L, 4L, 1L, 2L);
  }

  @Test
  public void testRecentWithoutTimestampColumn() {
    SnapshotTable snapshots =
        SnapshotTable.withoutTimestamps(
            ImmutableList.of(
                new TableSnapshot(1L, 1L, T0),
                new TableSnapshot(2L, 2L, T0 + HOUR),
                new TableSnapshot(3L, 3L, T0 + 2 * HOUR)));

    assertThat(SnapshotIntervals.recent(snapshots, 2))
        .extracting(TableSnapshot::snapshotId)
        .containsExactly(1L, 2L);
  }

  @Test
  public void testRecentRejectsInvalidLimit() {
    assertThatThrownBy(() -> SnapshotIntervals.recent(SnapshotTable.empty(), 0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid limit: 0 (must be > 0)");
  }
}
