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

import com.fasterxml.jackson.core.JsonGenerator;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import org.metainsights.util.JsonUtil;

/**
 * Writes {@link TableInsights} as JSON.
 *
 * <p>Summary values that are unavailable are written as JSON null.
 */
public class TableInsightsParser {

  private TableInsightsParser() {}

  private static final String LOCATION = "location";
  private static final String SUMMARY = "summary";
  private static final String TOTAL_SNAPSHOTS = "total-snapshots";
  private static final String WRITE_OPERATIONS = "write-operations";
  private static final String DELETE_OPERATIONS = "delete-operations";
  private static final String AVG_MANIFEST_COUNT = "avg-manifest-count";
  private static final String AVG_INTERVAL_HOURS = "avg-interval-hours";
  private static final String MIN_INTERVAL_HOURS = "min-interval-hours";
  private static final String MAX_INTERVAL_HOURS = "max-interval-hours";
  private static final String MANIFEST_ENTRY_COUNT = "manifest-entry-count";
  private static final String OPERATIONS = "operations";
  private static final String SNAPSHOT_ID = "snapshot-id";
  private static final String TIMESTAMP_MS = "timestamp-ms";
  private static final String SEQUENCE_NUMBER = "sequence-number";
  private static final String ADDED_RECORDS = "added-records";
  private static final String DELETED_RECORDS = "deleted-records";
  private static final String NET_CHANGE = "net-change";
  private static final String MANIFEST_COUNT = "manifest-count";
  private static final String INTERVALS = "intervals";
  private static final String PREVIOUS_SNAPSHOT = "previous-snapshot";
  private static final String CURRENT_SNAPSHOT = "current-snapshot";
  private static final String PREVIOUS_TIME_MS = "previous-time-ms";
  private static final String CURRENT_TIME_MS = "current-time-ms";
  private static final String INTERVAL_SECONDS = "interval-seconds";
  private static final String INTERVAL_HOURS = "interval-hours";
  private static final String INTERVAL_DAYS = "interval-days";
  private static final String HAS_TIMELINE = "has-timeline";
  private static final String TIMELINE = "timeline";
  private static final String RECENT_SNAPSHOTS = "recent-snapshots";
  private static final String SCHEMA = "schema";
  private static final String ID = "id";
  private static final String NAME = "name";
  private static final String TYPE = "type";
  private static final String REQUIRED = "required";
  private static final String FAILURES = "failures";

  public static String toJson(TableInsights insights) {
    return toJson(insights, false);
  }

  public static String toJson(TableInsights insights, boolean pretty) {
    return JsonUtil.generate(gen -> toJson(insights, gen), pretty);
  }

  public static void toJson(TableInsights insights, JsonGenerator generator) throws IOException {
    Preconditions.checkArgument(insights != null, "Invalid table insights: null");

    generator.writeStartObject();
    generator.writeStringField(LOCATION, insights.location());
    generator.writeFieldName(SUMMARY);
    toJson(insights.summary(), generator);
    generator.writeNumberField(MANIFEST_ENTRY_COUNT, insights.manifestEntryCount());

    generator.writeArrayFieldStart(OPERATIONS);
    for (OperationMetric metric : insights.operationMetrics()) {
      toJson(metric, generator);
    }
    generator.writeEndArray();

    generator.writeArrayFieldStart(INTERVALS);
    for (SnapshotInterval interval : insights.intervals()) {
      toJson(interval, generator);
    }
    generator.writeEndArray();

    // the timeline is written only when it can be shown
    generator.writeBooleanField(HAS_TIMELINE, insights.hasTimeline());
    generator.writeArrayFieldStart(TIMELINE);
    if (insights.hasTimeline()) {
      for (TableSnapshot snapshot : insights.timeline()) {
        toJson(snapshot, insights.snapshots(), generator);
      }
    }
    generator.writeEndArray();

    generator.writeArrayFieldStart(RECENT_SNAPSHOTS);
    for (TableSnapshot snapshot : insights.recentSnapshots()) {
      toJson(snapshot, insights.snapshots(), generator);
    }
    generator.writeEndArray();

    generator.writeArrayFieldStart(SCHEMA);
    for (SchemaField field : insights.schema()) {
      generator.writeStartObject();
      generator.writeNumberField(ID, field.id());
      generator.writeStringField(NAME, field.name());
      generator.writeStringField(TYPE, field.type());
      generator.writeBooleanField(REQUIRED, field.isRequired());
      generator.writeEndObject();
    }
    generator.writeEndArray();

    generator.writeObjectFieldStart(FAILURES);
    for (Map.Entry<TableInsights.Source, String> failure : insights.failures().entrySet()) {
      String source = failure.getKey().name().toLowerCase(Locale.ROOT);
      generator.writeStringField(source, failure.getValue());
    }
    generator.writeEndObject();

    generator.writeEndObject();
  }

  private static void toJson(
      TableSnapshot snapshot, SnapshotTable snapshots, JsonGenerator generator)
      throws IOException {
    generator.writeStartObject();
    generator.writeNumberField(SNAPSHOT_ID, snapshot.snapshotId());
    generator.writeNumberField(SEQUENCE_NUMBER, snapshot.sequenceNumber());
    JsonUtil.writeLongOrNull(TIMESTAMP_MS, snapshots.timestampOf(snapshot), generator);
    generator.writeEndObject();
  }

  static void toJson(InsightsSummary summary, JsonGenerator generator) throws IOException {
    generator.writeStartObject();
    generator.writeNumberField(TOTAL_SNAPSHOTS, summary.totalSnapshots());
    JsonUtil.writeLongOrNull(WRITE_OPERATIONS, summary.writeOperations(), generator);
    JsonUtil.writeLongOrNull(DELETE_OPERATIONS, summary.deleteOperations(), generator);
    JsonUtil.writeDoubleOrNull(AVG_MANIFEST_COUNT, summary.averageManifestCount(), generator);
    JsonUtil.writeDoubleOrNull(AVG_INTERVAL_HOURS, summary.averageIntervalHours(), generator);
    JsonUtil.writeDoubleOrNull(MIN_INTERVAL_HOURS, summary.minIntervalHours(), generator);
    JsonUtil.writeDoubleOrNull(MAX_INTERVAL_HOURS, summary.maxIntervalHours(), generator);
    generator.writeEndObject();
  }

  static void toJson(OperationMetric metric, JsonGenerator generator) throws IOException {
    generator.writeStartObject();
    generator.writeNumberField(SNAPSHOT_ID, metric.snapshotId());
    JsonUtil.writeLongOrNull(TIMESTAMP_MS, metric.timestampMillis(), generator);
    generator.writeNumberField(SEQUENCE_NUMBER, metric.sequenceNumber());
    generator.writeNumberField(ADDED_RECORDS, metric.addedRecords());
    generator.writeNumberField(DELETED_RECORDS, metric.deletedRecords());
    generator.writeNumberField(NET_CHANGE, metric.netChange());
    generator.writeNumberField(MANIFEST_COUNT, metric.manifestCount());
    generator.writeEndObject();
  }

  static void toJson(SnapshotInterval interval, JsonGenerator generator) throws IOException {
    generator.writeStartObject();
    generator.writeNumberField(PREVIOUS_SNAPSHOT, interval.previousSnapshotId());
    generator.writeNumberField(CURRENT_SNAPSHOT, interval.currentSnapshotId());
    generator.writeNumberField(PREVIOUS_TIME_MS, interval.previousTimestampMillis());
    generator.writeNumberField(CURRENT_TIME_MS, interval.currentTimestampMillis());
    generator.writeNumberField(INTERVAL_SECONDS, interval.intervalSeconds());
    generator.writeNumberField(INTERVAL_HOURS, interval.intervalHours());
    generator.writeNumberField(INTERVAL_DAYS, interval.intervalDays());
    generator.writeEndObject();
  }
}
