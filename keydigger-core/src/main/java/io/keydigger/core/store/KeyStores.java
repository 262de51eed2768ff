package io.keydigger.core.store;

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

import io.keydigger.api.keys.KeyLoader;
import io.keydigger.api.keys.KeyStore;
import io.keydigger.api.services.StoreType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/// Unified entry point for opening key stores from various sources.
///
/// This class picks the right {@link KeyLoader} without the caller needing to know the
/// underlying format. It automatically:
/// - Uses a {@link DirectoryKeyLoader} for directories of raw output files
/// - Uses a {@link ZipKeyLoader} for `.zip` archives, and for `.npz` archives with the `.npy`
///   entry suffix stripped from keys
/// - Uses an {@link Hdf5KeyLoader} for `.h5`, `.hdf5` and `.hdf` files
/// - Expands a leading tilde to the user's home directory
///
/// Example usage:
/// <pre>
/// KeyStore store = KeyStores.open("~/gtc/run1.h5");
/// List&lt;WorkUnit&gt; units = Resolver.resolve(store, spec);
/// </pre>
public class KeyStores {
    private static final Logger logger = LogManager.getLogger(KeyStores.class);

    /// The entry suffix of numpy arrays inside `.npz` archives
    public static final String NPY_SUFFIX = ".npy";

    private KeyStores() {
    }

    /// Opens a key store from a local path string.
    ///
    /// @param path The local path to the data
    /// @return A caching key store over the data
    /// @throws IOException If the path cannot be opened
    public static CachingKeyStore open(String path) throws IOException {
        return open(path, KeyStoreOptions.defaults());
    }

    /// Opens a key store from a local path string with options.
    ///
    /// @param path The local path to the data
    /// @param options Exclusions and description key
    /// @return A caching key store over the data
    /// @throws IOException If the path cannot be opened
    public static CachingKeyStore open(String path, KeyStoreOptions options) throws IOException {
        if (path.startsWith("~")) {
            path = System.getProperty("user.home") + path.substring(1);
        }
        return open(Path.of(path), options);
    }

    /// Opens a key store from a local Path.
    ///
    /// @param path The path to the data
    /// @param options Exclusions and description key
    /// @return A caching key store over the data
    /// @throws IOException If the path cannot be opened
    public static CachingKeyStore open(Path path, KeyStoreOptions options) throws IOException {
        return new CachingKeyStore(loaderFor(path), options);
    }

    /// Wraps an in-memory map as a key store.
    ///
    /// @param values The keys and values
    /// @return A caching key store over the map
    public static KeyStore of(Map<String, ?> values) {
        return new CachingKeyStore(new MapKeyLoader(values));
    }

    /// Chooses the loader for a path.
    ///
    /// @param path The path to the data
    /// @return The loader for that kind of storage
    /// @throws IOException If the path does not exist or is of an unsupported kind
    public static KeyLoader loaderFor(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Key store path does not exist: " + path);
        }
        StoreType type = StoreType.fromPath(path)
            .orElseThrow(() -> new IOException("Unsupported key store: " + path
                + ". Provide a directory, a .zip/.npz archive, or an .h5/.hdf5 file."));
        logger.info("Opening {} key store at {}", type, path);
        switch (type) {
            case directory:
                return new DirectoryKeyLoader(path);
            case zip:
                boolean npz = path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".npz");
                return new ZipKeyLoader(path, npz ? NPY_SUFFIX : "");
            case hdf5:
                return new Hdf5KeyLoader(path);
            default:
                throw new IOException("Unsupported key store type " + type + ": " + path);
        }
    }
}
