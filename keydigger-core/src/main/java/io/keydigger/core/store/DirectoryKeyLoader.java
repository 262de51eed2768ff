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
import io.keydigger.api.keys.KeyNotFoundException;
import io.keydigger.api.keys.KeyPaths;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// A {@link KeyLoader} over a directory of raw output files.
///
/// Every regular file below the directory is one key, named by its path relative to the
/// directory with `/` separators. Values are the file contents as `byte[]`; decoding them is up
/// to the consumer.
public class DirectoryKeyLoader implements KeyLoader {
    private static final Logger logger = LogManager.getLogger(DirectoryKeyLoader.class);

    private final Path directory;

    /// @param directory the directory to scan
    /// @throws IOException if the path is not a readable directory
    public DirectoryKeyLoader(Path directory) throws IOException {
        if (!Files.isDirectory(directory) || !Files.isReadable(directory)) {
            throw new IOException("Failed to access path '" + directory + "'.");
        }
        this.directory = directory;
    }

    @Override
    public String location() {
        return directory.toString();
    }

    @Override
    public List<String> listKeys() throws IOException {
        logger.debug("Getting filenames from {} ...", directory);
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk.filter(Files::isRegularFile)
                .map(this::keyOf)
                .collect(Collectors.toList());
        }
    }

    @Override
    public Object fetch(String key) throws IOException {
        Path file = resolve(key);
        if (!Files.isRegularFile(file)) {
            throw new KeyNotFoundException(key, location());
        }
        logger.debug("Getting file '{}' from {} ...", key, directory);
        return Files.readAllBytes(file);
    }

    private String keyOf(Path file) {
        Path relative = directory.relativize(file);
        StringBuilder sb = new StringBuilder();
        for (Path part : relative) {
            if (sb.length() > 0) {
                sb.append(KeyPaths.SEPARATOR);
            }
            sb.append(part);
        }
        return sb.toString();
    }

    private Path resolve(String key) {
        Path file = directory;
        for (String part : key.split(String.valueOf(KeyPaths.SEPARATOR))) {
            file = file.resolve(part);
        }
        Path normalized = file.normalize();
        if (!normalized.startsWith(directory.normalize())) {
            throw new KeyNotFoundException(key, location());
        }
        return normalized;
    }
}
