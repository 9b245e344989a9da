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

import org.junit.jupiter.api.Test;

public class TestOperationMetric {

  @Test
  public void testNetChange() {
    assertThat(new OperationMetric(1L, 10L, 1L, 100L, 0L, 1).netChange()).isEqualTo(100L);
    assertThat(new OperationMetric(2L, 20L, 2L, 0L, 30L, 1).netChange()).isEqualTo(-30L);
    assertThat(new OperationMetric(3L, null, 3L, 5L, 5L, 2).netChange()).isZero();
  }

  @Test
  public void testEquality() {
    assertThat(new OperationMetric(1L, null, 1L, 100L, 0L, 1))
        .isEqualTo(new OperationMetric(1L, null, 1L, 100L, 0L, 1))
        .hasSameHashCodeAs(new OperationMetric(1L, null, 1L, 100L, 0L, 1))
        .isNotEqualTo(new OperationMetric(1L, 5L, 1L, 100L, 0L, 1));
  }
}
