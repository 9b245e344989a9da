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
package org.metainsights.local;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.io.BufferedReader;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.metainsights.exceptions.NoSuchTableException;
import org.metainsights.exceptions.RuntimeIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Resolves table and metadata locations on the local file system. */
class MetadataLocations {
  private static final Logger LOG = LoggerFactory.getLogger(MetadataLocations.class);

  static final String METADATA_FOLDER_NAME = "metadata";
  static final String VERSION_HINT_FILENAME = "version-hint.text";
  static final String METADATA_FILE_SUFFIX = ".metadata.json";

  // v3.metadata.json or 00003-6f9a4b0e-...metadata.json
  private static final Pattern VERSION_PATTERN = Pattern.compile("^v?(\\d+)[.-].*");

  private MetadataLocations() {}

  /**
   * Converts a location to a local path.
   *
   * <p>Plain paths and {@code file:} URIs are accepted.
   *
   * @param location a location string
   * @return the path for the location
   * @throws IllegalArgumentException if the location uses a scheme other than file
   */
  static Path toPath(String location) {
    Preconditions.checkArgument(
        !Strings.isNullOrEmpty(location), "Invalid location: null or empty");

    int colon = location.indexOf(':');
    int slash = location.indexOf('/');
    boolean hasScheme = colon > 1 && (slash < 0 || colon < slash);
    if (!hasScheme) {
      return Paths.get(location);
    }

    String scheme = location.substring(0, colon).toLowerCase(Locale.ROOT);
    Preconditions.checkArgument(
        "file".equals(scheme),
        "Unsupported location scheme: %s in %s (%s reads local files only, "
            + "object store locations need another MetadataProvider)",
        scheme,
        location,
        LocalMetadataProvider.class.getSimpleName());

    return Paths.get(URI.create(location));
  }

  /**
   * Finds the metadata file for a table location.
   *
   * <p>The location may be a metadata file, a table directory, or a table's metadata directory. For
   * directories, the version in {@code version-hint.text} is used when it names an existing
   * metadata file; otherwise the metadata file with the highest version is used.
   *
   * @param location a table or metadata file location
   * @return path to the table's metadata file
   * @throws NoSuchTableException if no metadata file exists at the location
   */
  static Path resolve(String location) {
    Path path = toPath(location);
    if (Files.isRegularFile(path)) {
      return path;
    }

    if (!Files.isDirectory(path)) {
      throw new NoSuchTableException("Table does not exist at location: %s", location);
    }

    Path metadataDir = path.resolve(METADATA_FOLDER_NAME);
    if (!Files.isDirectory(metadataDir)) {
      metadataDir = path;
    }

    Path hinted = hintedMetadataFile(metadataDir);
    if (hinted != null) {
      return hinted;
    }

    Path latest = latestMetadataFile(metadataDir);
    if (latest == null) {
      throw new NoSuchTableException("No metadata file found in %s", metadataDir);
    }

    return latest;
  }

  private static Path hintedMetadataFile(Path metadataDir) {
    Path versionHintFile = metadataDir.resolve(VERSION_HINT_FILENAME);
    if (!Files.isRegularFile(versionHintFile)) {
      return null;
    }

    try (BufferedReader in = Files.newBufferedReader(versionHintFile, StandardCharsets.UTF_8)) {
      String line = in.readLine();
      int version = Integer.parseInt(line != null ? line.trim() : "");
      Path metadataFile = metadataDir.resolve("v" + version + METADATA_FILE_SUFFIX);
      if (Files.isRegularFile(metadataFile)) {
        return metadataFile;
      }

      LOG.warn("Version hint {} points to missing metadata file {}", versionHintFile, metadataFile);
      return null;

    } catch (IOException | NumberFormatException e) {
      LOG.warn("Error reading version hint file {}", versionHintFile, e);
      return null;
    }
  }

  private static Path latestMetadataFile(Path metadataDir) {
    try (Stream<Path> files = Files.list(metadataDir)) {
      Path latest = null;
      int maxVersion = -1;
      for (Path file : (Iterable<Path>) files::iterator) {
        int version = version(file.getFileName().toString());
        if (version > maxVersion) {
          maxVersion = version;
          latest = file;
        }
      }

      return latest;

    } catch (IOException e) {
      throw new RuntimeIOException(e, "Failed to list metadata directory: %s", metadataDir);
    }
  }

  static int version(String fileName) {
    if (!fileName.endsWith(METADATA_FILE_SUFFIX)) {
      return -1;
    }

    Matcher matcher = VERSION_PATTERN.matcher(fileName);
    if (!matcher.matches()) {
      return -1;
    }

    try {
      return Integer.parseInt(matcher.group(1));
    } catch (NumberFormatException e) {
      LOG.debug("Ignoring metadata file with unparseable version: {}", fileName);
      return -1;
    }
  }
}
