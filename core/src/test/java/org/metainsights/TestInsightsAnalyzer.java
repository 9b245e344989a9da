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
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.metainsights.exceptions.NoSuchTableException;
import org.metainsights.exceptions.RuntimeIOException;

public class TestInsightsAnalyzer {
  private static final String LOCATION = "/warehouse/db/events";
  private static final long T0 = 1_700_000_000_000L;
  private static final long HOUR = 3_600_000L;

  private static final SnapshotTable SNAPSHOTS =
      SnapshotTable.of(new TableSnapshot(1L, 1L, T0), new TableSnapshot(2L, 2L, T0 + HOUR));
  private static final ManifestEntryTable MANIFESTS =
      ManifestEntryTable.of(
          new ManifestEntry(1L, ManifestEntryStatus.ADDED, 100L),
          new ManifestEntry(2L, ManifestEntryStatus.DELETED, 30L));
  private static final ImmutableList<SchemaField> SCHEMA =
      ImmutableList.of(new SchemaField(1, "id", "long", true));

  private MetadataProvider provider;

  @BeforeEach
  public void before() {
    provider = mock(MetadataProvider.class);
    when(provider.fetchSnapshots(LOCATION)).thenReturn(SNAPSHOTS);
    when(provider.fetchManifests(LOCATION)).thenReturn(MANIFESTS);
    when(provider.fetchSchema(LOCATION)).thenReturn(SCHEMA);
  }

  @Test
  public void testAnalyze() {
    TableInsights insights = new InsightsAnalyzer(provider).analyze(LOCATION);

    assertThat(insights.location()).isEqualTo(LOCATION);
    assertThat(insights.failures()).isEmpty();
    assertThat(insights.manifestEntryCount()).isEqualTo(2);
    assertThat(insights.schema()).isEqualTo(SCHEMA);
    assertThat(insights.operationMetrics()).hasSize(2);
    assertThat(insights.intervals()).hasSize(1);
    assertThat(insights.hasTimeline()).isTrue();
    assertThat(insights.timeline()).extracting(TableSnapshot::snapshotId).containsExactly(1L, 2L);
    assertThat(insights.recentSnapshots())
        .extracting(TableSnapshot::snapshotId)
        .containsExactly(2L, 1L);

    InsightsSummary summary = insights.summary();
    assertThat(summary.totalSnapshots()).isEqualTo(2);
    assertThat(summary.writeOperations()).hasValue(1L);
    assertThat(summary.deleteOperations()).hasValue(1L);
    assertThat(summary.averageIntervalHours()).hasValue(1.0);
  }

  @Test
  public void testManifestFailureKeepsSnapshots() {
    when(provider.fetchManifests(LOCATION))
        .thenThrow(new RuntimeIOException(new IOException("disk"), "Failed to read"));

    TableInsights insights = new InsightsAnalyzer(provider).analyze(LOCATION);

    assertThat(insights.failures()).containsOnlyKeys(TableInsights.Source.MANIFESTS);
    assertThat(insights.failures().get(TableInsights.Source.MANIFESTS)).contains("Failed to read");
    assertThat(insights.operationMetrics()).isEmpty();
    assertThat(insights.intervals()).hasSize(1);
    assertThat(insights.summary().writeOperations()).isEmpty();
    assertThat(insights.schema()).isEqualTo(SCHEMA);
  }

  @Test
  public void testMissingTable() {
    when(provider.fetchSnapshots(LOCATION)).thenThrow(new NoSuchTableException("No table"));
    when(provider.fetchManifests(LOCATION)).thenThrow(new NoSuchTableException("No table"));
    when(provider.fetchSchema(LOCATION)).thenThrow(new IllegalStateException());

    TableInsights insights = new InsightsAnalyzer(provider).analyze(LOCATION);

    assertThat(insights.failures())
        .containsOnlyKeys(
            TableInsights.Source.SNAPSHOTS,
            TableInsights.Source.MANIFESTS,
            TableInsights.Source.SCHEMA);
    assertThat(insights.failures().get(TableInsights.Source.SCHEMA))
        .isEqualTo(IllegalStateException.class.getName());
    assertThat(insights.summary().totalSnapshots()).isZero();
    assertThat(insights.hasTimeline()).isFalse();
    assertThat(insights.schema()).isEmpty();
  }

  @Test
  public void testNullResultsAreEmpty() {
    when(provider.fetchSchema(LOCATION)).thenReturn(null);
    assertThat(new InsightsAnalyzer(provider).analyze(LOCATION).schema()).isEmpty();
  }

  @Test
  public void testRecentSnapshotsLimit() {
    TableInsights insights =
        new InsightsAnalyzer(
                provider, ImmutableMap.of(InsightsProperties.RECENT_SNAPSHOTS_LIMIT, "1"))
            .analyze(LOCATION);

    assertThat(insights.recentSnapshots())
        .extracting(TableSnapshot::snapshotId)
        .containsExactly(2L);
    verify(provider).fetchSnapshots(LOCATION);
  }

  @Test
  public void testInvalidConfiguration() {
    assertThatThrownBy(
            () ->
                new InsightsAnalyzer(
                    provider, ImmutableMap.of(InsightsProperties.RECENT_SNAPSHOTS_LIMIT, "0")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid recent-snapshots.limit: 0 (must be > 0)");

    assertThatThrownBy(() -> new InsightsAnalyzer(null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid metadata provider: null");
  }

  @Test
  public void testInvalidLocation() {
    assertThatThrownBy(() -> new InsightsAnalyzer(provider).analyze(""))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid table location: null or empty");
  }
}
