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
package org.metainsights.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

public class TestJsonUtil {

  @Test
  public void getInt() throws Exception {
    assertThatThrownBy(() -> JsonUtil.getInt("x", JsonUtil.mapper().readTree("{}")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Cannot parse missing int: x");

    assertThatThrownBy(() -> JsonUtil.getInt("x", JsonUtil.mapper().readTree("{\"x\": \"23\"}")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Cannot parse to an integer value: x: \"23\"");

    assertThat(JsonUtil.getInt("x", JsonUtil.mapper().readTree("{\"x\": 23}"))).isEqualTo(23);
  }

  @Test
  public void getLongOrNull() throws Exception {
    assertThat(JsonUtil.getLongOrNull("x", JsonUtil.mapper().readTree("{\"x\": 23}")))
        .isEqualTo(23L);
    assertThat(JsonUtil.getLongOrNull("x", JsonUtil.mapper().readTree("{\"x\": null}"))).isNull();
    assertThat(JsonUtil.getLongOrNull("x", JsonUtil.mapper().readTree("{}"))).isNull();

    assertThatThrownBy(
            () -> JsonUtil.getLongOrNull("x", JsonUtil.mapper().readTree("{\"x\": 2.5}")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Cannot parse to a long value: x: 2.5");
  }

  @Test
  public void getStringList() throws Exception {
    JsonNode node = JsonUtil.mapper().readTree("{\"items\": [\"a\", \"b\"]}");
    assertThat(JsonUtil.getStringList("items", node)).containsExactly("a", "b");

    assertThatThrownBy(
            () -> JsonUtil.getStringList("items", JsonUtil.mapper().readTree("{\"items\": [1]}")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Cannot parse string from non-text value in items: 1");

    assertThatThrownBy(
            () -> JsonUtil.getStringList("items", JsonUtil.mapper().readTree("{\"items\": \"a\"}")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Cannot parse string list from non-array value: items: \"a\"");
  }

  @Test
  public void writeOptionals() {
    String json =
        JsonUtil.generate(
            gen -> {
              gen.writeStartObject();
              JsonUtil.writeLongOrNull("a", OptionalLong.of(3L), gen);
              JsonUtil.writeLongOrNull("b", OptionalLong.empty(), gen);
              JsonUtil.writeDoubleOrNull("c", OptionalDouble.of(1.5), gen);
              JsonUtil.writeDoubleOrNull("d", OptionalDouble.empty(), gen);
              JsonUtil.writeLongOrNull("e", (Long) null, gen);
              gen.writeEndObject();
            },
            false);

    assertThat(json).isEqualTo("{\"a\":3,\"b\":null,\"c\":1.5,\"d\":null,\"e\":null}");
  }
}
