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

import java.util.Locale;

/**
 * Status of an entry in a manifest file.
 *
 * <p>Status values that are not known to this enum are returned as {@code null} by the lookup
 * methods so that entries written by newer format versions can still be read.
 */
public enum ManifestEntryStatus {
  EXISTING(0),
  ADDED(1),
  DELETED(2);

  private final int id;

  ManifestEntryStatus(int id) {
    this.id = id;
  }

  public int id() {
    return id;
  }

  /**
   * Returns the status for an id stored in a manifest file.
   *
   * @param id a status id
   * @return the matching status, or null if the id is not known
   */
  public static ManifestEntryStatus fromId(int id) {
    for (ManifestEntryStatus status : values()) {
      if (status.id == id) {
        return status;
      }
    }

    return null;
  }

  /**
   * Returns the status for a name, ignoring case.
   *
   * @param name a status name, such as "ADDED"
   * @return the matching status, or null if the name is null or not known
   */
  public static ManifestEntryStatus fromName(String name) {
    if (name == null) {
      return null;
    }

    String normalized = name.trim().toUpperCase(Locale.ROOT);
    for (ManifestEntryStatus status : values()) {
      if (status.name().equals(normalized)) {
        return status;
      }
    }

    return null;
  }
}
