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

import io.keydigger.api.keys.KeyNotFoundException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/// A loader over a zip archive, one key per file entry.
///
/// An entry suffix such as `.npy` may be stripped from the keys, so that an archive entry
/// `snap00100/ion-profile.npy` is reported as the key `snap00100/ion-profile`. Values are the
/// raw entry bytes.
public class ZipKeyLoader extends ScopedKeyLoader<ZipFile> {

    private final Path archive;
    private final String entrySuffix;

    /// @param archive the zip file
    /// @throws IOException if the file is not readable
    public ZipKeyLoader(Path archive) throws IOException {
        this(archive, "");
    }

    /// @param archive the zip file
    /// @param entrySuffix the suffix to strip from entry names, or the empty string
    /// @throws IOException if the file is not readable
    public ZipKeyLoader(Path archive, String entrySuffix) throws IOException {
        if (!Files.isRegularFile(archive) || !Files.isReadable(archive)) {
            throw new IOException("Failed to access path '" + archive + "'.");
        }
        this.archive = archive;
        this.entrySuffix = entrySuffix == null ? "" : entrySuffix;
    }

    @Override
    public String location() {
        return archive.toString();
    }

    @Override
    protected ZipFile open() throws IOException {
        return new ZipFile(archive.toFile());
    }

    @Override
    protected List<String> listKeys(ZipFile zip) {
        List<String> keys = new ArrayList<>();
        Enumeration<? extends ZipEntry> entries = zip.entries();
        while (entries.hasMoreElements()) {
            ZipEntry entry = entries.nextElement();
            if (entry.isDirectory()) {
                continue;
            }
            String name = entry.getName();
            if (name.endsWith(entrySuffix)) {
                keys.add(name.substring(0, name.length() - entrySuffix.length()));
            }
        }
        return keys;
    }

    @Override
    protected Object read(ZipFile zip, String key) throws IOException {
        ZipEntry entry = zip.getEntry(key + entrySuffix);
        if (entry == null || entry.isDirectory()) {
            throw new KeyNotFoundException(key, location());
        }
        try (InputStream in = zip.getInputStream(entry)) {
            return in.readAllBytes();
        }
    }
}
