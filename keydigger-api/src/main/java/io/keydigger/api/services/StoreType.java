package io.keydigger.api.services;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/// A canonical name for the kind of storage behind a key store
public enum StoreType {
  /// a directory tree of raw files, one key per file
  directory(),
  /// a zip archive, one key per entry; `.npz` archives are zip archives of `.npy` entries
  zip(".zip", ".npz"),
  /// an HDF5 file, one key per dataset
  hdf5(".h5", ".hdf5", ".hdf"),
  /// an in-memory map
  memory();

  private final String[] extensions;

  StoreType(String... extensions) {
    this.extensions = extensions;
  }

  /// Detect the store type from a path on the filesystem.
  /// @param path a directory or file
  /// @return the store type, or empty if the path is not recognized
  public static Optional<StoreType> fromPath(Path path) {
    if (Files.isDirectory(path)) {
      return Optional.of(directory);
    }
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    for (StoreType type : values()) {
      for (String extension : type.extensions) {
        if (name.endsWith(extension)) {
          return Optional.of(type);
        }
      }
    }
    return Optional.empty();
  }
}
