package io.keydigger.command.common;

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

import io.keydigger.core.store.CachingKeyStore;
import io.keydigger.core.store.KeyStoreOptions;
import io.keydigger.core.store.KeyStores;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Shared key store argument, with the exclusion options which shape what the store shows.
///
/// The store may be a directory, a `.zip` or `.npz` archive, or an HDF5 file.
public class StoreOption {

    @CommandLine.Parameters(
        index = "0",
        paramLabel = "STORE",
        description = "The key store: a directory, a .zip/.npz archive, or an .h5/.hdf5 file"
    )
    private Path storePath;

    @CommandLine.Option(
        names = {"-x", "--exclude"},
        description = "Hide keys equal to or fully matching this expression (repeatable)"
    )
    private List<String> excludeKeys = new ArrayList<>();

    @CommandLine.Option(
        names = {"--exclude-group"},
        description = "Hide every key under groups equal to or fully matching this expression (repeatable)"
    )
    private List<String> excludeGroups = new ArrayList<>();

    @CommandLine.Option(
        names = {"--description-key"},
        description = "The key holding the store description (default: ${DEFAULT-VALUE})",
        defaultValue = KeyStoreOptions.DESCRIPTION
    )
    private String descriptionKey = KeyStoreOptions.DESCRIPTION;

    public Path getStorePath() {
        return storePath;
    }

    /// @return the store options built from the exclusion flags
    public KeyStoreOptions toOptions() {
        return new KeyStoreOptions(excludeKeys, excludeGroups, descriptionKey);
    }

    /// Validates that the store exists.
    public void validate() {
        if (storePath == null || !Files.exists(storePath)) {
            throw new IllegalStateException("Key store does not exist: " + storePath);
        }
    }

    /// @return the opened store
    /// @throws IOException if the store cannot be opened
    public CachingKeyStore open() throws IOException {
        validate();
        return KeyStores.open(storePath, toOptions());
    }
}
