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

import com.google.common.base.Objects;

/** A top-level column of a table's current schema, kept for display. */
public class SchemaField {
  private final int id;
  private final String name;
  private final String type;
  private final boolean required;

  public SchemaField(int id, String name, String type, boolean required) {
    this.id = id;
    this.name = name;
    this.type = type;
    this.required = required;
  }

  public int id() {
    return id;
  }

  public String name() {
    return name;
  }

  /** Returns the type as written in the metadata; nested types are rendered as JSON. */
  public String type() {
    return type;
  }

  public boolean isRequired() {
    return required;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }

    if (!(o instanceof SchemaField)) {
      return false;
    }

    SchemaField other = (SchemaField) o;
    return id == other.id
        && required == other.required
        && Objects.equal(name, other.name)
        && Objects.equal(type, other.type);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id, name, type, required);
  }

  @Override
  public String toString() {
    return id + ": " + name + ": " + (required ? "required " : "optional ") + type;
  }
}
