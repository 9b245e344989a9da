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

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

public class TestManifestEntryTable {

  @Test
  public void testStatusColumn() {
    ManifestEntryTable table =
        ManifestEntryTable.of(new ManifestEntry(1L, ManifestEntryStatus.ADDED, 10L));
    assertThat(table.hasStatusColumn()).isTrue();
    assertThat(table.size()).isEqualTo(1);
  }

  @Test
  public void testEmptyTableHasNoStatusColumn() {
    assertThat(ManifestEntryTable.of().hasStatusColumn()).isFalse();
    assertThat(ManifestEntryTable.of(ImmutableList.of()).isEmpty()).isTrue();
    assertThat(ManifestEntryTable.empty().hasStatusColumn()).isFalse();
  }

  @Test
  public void testWithoutStatus() {
    ManifestEntryTable table =
        ManifestEntryTable.withoutStatus(ImmutableList.of(new ManifestEntry(1L, null, 10L)));
    assertThat(table.hasStatusColumn()).isFalse();
    assertThat(table.entries()).hasSize(1);
  }
}
