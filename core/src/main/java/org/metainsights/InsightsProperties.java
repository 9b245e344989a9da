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

public class InsightsProperties {

  private InsightsProperties() {}

  /**
   * Controls which manifests the local metadata provider reads.
   *
   * <ul>
   *   <li>current - manifests of the current snapshot
   *   <li>all - manifests of every snapshot in the metadata, each read once
   * </ul>
   */
  public static final String MANIFEST_SCOPE = "manifest-scope";

  public static final String MANIFEST_SCOPE_CURRENT = "current";
  public static final String MANIFEST_SCOPE_ALL = "all";
  public static final String MANIFEST_SCOPE_DEFAULT = MANIFEST_SCOPE_CURRENT;

  /** Number of snapshots listed in the recent snapshots view of a report. */
  public static final String RECENT_SNAPSHOTS_LIMIT = "recent-snapshots.limit";

  public static final int RECENT_SNAPSHOTS_LIMIT_DEFAULT = 5;
}
