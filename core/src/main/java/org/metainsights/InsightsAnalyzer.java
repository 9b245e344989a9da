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
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.metainsights.util.PropertyUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces {@link TableInsights} for table locations using a {@link MetadataProvider}.
 *
 * <p>Snapshots, manifests and schema are fetched independently. When a fetch fails, the failure
 * is logged and recorded in the report and an empty result is used in its place, so a report is
 * always returned.
 */
public class InsightsAnalyzer {
  private static final Logger LOG = LoggerFactory.getLogger(InsightsAnalyzer.class);

  private final MetadataProvider provider;
  private final int recentSnapshotsLimit;

  public InsightsAnalyzer(MetadataProvider provider) {
    this(provider, ImmutableMap.of());
  }

  public InsightsAnalyzer(MetadataProvider provider, Map<String, String> properties) {
    Preconditions.checkArgument(provider != null, "Invalid metadata provider: null");
    Preconditions.checkArgument(properties != null, "Invalid properties: null");
    this.provider = provider;
    this.recentSnapshotsLimit =
        PropertyUtil.propertyAsInt(
            properties,
            InsightsProperties.RECENT_SNAPSHOTS_LIMIT,
            InsightsProperties.RECENT_SNAPSHOTS_LIMIT_DEFAULT);
    Preconditions.checkArgument(
        recentSnapshotsLimit > 0,
        "Invalid %s: %s (must be > 0)",
        InsightsProperties.RECENT_SNAPSHOTS_LIMIT,
        recentSnapshotsLimit);
  }

  /**
   * Fetches the metadata of a table and computes its insights.
   *
   * @param tableLocation a table location or metadata file location
   * @return insights for the table
   */
  public TableInsights analyze(String tableLocation) {
    Preconditions.checkArgument(
        !Strings.isNullOrEmpty(tableLocation), "Invalid table location: null or empty");

    Map<TableInsights.Source, String> failures = Maps.newEnumMap(TableInsights.Source.class);

    SnapshotTable snapshots =
        fetch(
            tableLocation,
            TableInsights.Source.SNAPSHOTS,
            () -> provider.fetchSnapshots(tableLocation),
            SnapshotTable.empty(),
            failures);
    ManifestEntryTable manifests =
        fetch(
            tableLocation,
            TableInsights.Source.MANIFESTS,
            () -> provider.fetchManifests(tableLocation),
            ManifestEntryTable.empty(),
            failures);
    List<SchemaField> schema =
        fetch(
            tableLocation,
            TableInsights.Source.SCHEMA,
            () -> provider.fetchSchema(tableLocation),
            ImmutableList.<SchemaField>of(),
            failures);

    List<OperationMetric> metrics = OperationMetrics.extract(snapshots, manifests);
    List<SnapshotInterval> intervals = SnapshotIntervals.calculate(snapshots);
    List<TableSnapshot> timeline = SnapshotIntervals.timeline(snapshots);
    List<TableSnapshot> recent = SnapshotIntervals.recent(snapshots, recentSnapshotsLimit);

    TableInsights insights =
        new TableInsights(
            tableLocation,
            snapshots,
            manifests.size(),
            schema,
            metrics,
            intervals,
            timeline,
            recent,
            failures);

    LOG.info("Analyzed table {}: {}", tableLocation, insights.summary());
    return insights;
  }

  private static <T> T fetch(
      String tableLocation,
      TableInsights.Source source,
      Supplier<T> fetcher,
      T emptyResult,
      Map<TableInsights.Source, String> failures) {
    try {
      T result = fetcher.get();
      return result != null ? result : emptyResult;
    } catch (RuntimeException e) {
      LOG.warn("Failed to fetch {} for table {}", source, tableLocation, e);
      failures.put(source, e.getMessage() != null ? e.getMessage() : e.getClass().getName());
      return emptyResult;
    }
  }
}
