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
 * The manifest entries of a table.
 *
 * <p>When the source did not provide a status column, {@link #hasStatusColumn()} returns false.
 * An empty table has no columns at all.
 */
public class ManifestEntryTable implements Iterable<ManifestEntry> {
  private static final ManifestEntryTable EMPTY =
      new ManifestEntryTable(ImmutableList.of(), false);

  private final List<ManifestEntry> entries;
  private final boolean hasStatusColumn;

  private ManifestEntryTable(List<ManifestEntry> entries, boolean hasStatusColumn) {
    this.entries = entries;
    this.hasStatusColumn = hasStatusColumn;
  }

  public static ManifestEntryTable of(ManifestEntry... entries) {
    return of(ImmutableList.copyOf(entries));
  }

  public static ManifestEntryTable of(Iterable<ManifestEntry> entries) {
    Preconditions.checkArgument(entries != null, "Invalid manifest entries: null");
    List<ManifestEntry> copy = ImmutableList.copyOf(entries);
    return copy.isEmpty() ? EMPTY : new ManifestEntryTable(copy, true);
  }

  public static ManifestEntryTable withoutStatus(Iterable<ManifestEntry> entries) {
    Preconditions.checkArgument(entries != null, "Invalid manifest entries: null");
    return new ManifestEntryTable(ImmutableList.copyOf(entries), false);
  }

  public static ManifestEntryTable empty() {
    return EMPTY;
  }

  public List<ManifestEntry> entries() {
    return entries;
  }

  public boolean hasStatusColumn() {
    return hasStatusColumn;
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Override
  public Iterator<ManifestEntry> iterator() {
    return entries.iterator();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("size", entries.size())
        .add("status", hasStatusColumn)
        .toString();
  }
}
