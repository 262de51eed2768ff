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
import io.keydigger.api.keys.LoaderException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ZipKeyLoaderTest {

    @TempDir
    Path tempDir;

    static Path writeZip(Path file, Map<String, String> entries) throws IOException {
        try (OutputStream out = Files.newOutputStream(file); ZipOutputStream zip = new ZipOutputStream(out)) {
            zip.putNextEntry(new ZipEntry("dir/"));
            zip.closeEntry();
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
        return file;
    }

    @Test
    void shouldListEntriesWithoutDirectories() throws IOException {
        Path archive = writeZip(tempDir.resolve("run.zip"), Map.of("his/n", "n", "his/i", "i", "g/c", "c"));
        ZipKeyLoader loader = new ZipKeyLoader(archive);
        assertThat(loader.listKeys()).containsExactlyInAnyOrder("his/n", "his/i", "g/c");
    }

    @Test
    void shouldStripEntrySuffixAndReadInOneScope() throws IOException {
        Path archive = writeZip(tempDir.resolve("run.npz"),
            Map.of("da/i-p-f.npy", "ipf", "da/e-p-f.npy", "epf", "notes.txt", "skip"));
        ZipKeyLoader loader = new ZipKeyLoader(archive, ".npy");
        assertThat(loader.listKeys()).containsExactlyInAnyOrder("da/i-p-f", "da/e-p-f");

        List<Object> values = loader.fetchAll(List.of("da/e-p-f", "da/i-p-f"));
        assertThat(new String((byte[]) values.get(0), StandardCharsets.UTF_8)).isEqualTo("epf");
        assertThat(new String((byte[]) values.get(1), StandardCharsets.UTF_8)).isEqualTo("ipf");
    }

    @Test
    void shouldReportAbsentEntriesAsNotFound() throws IOException {
        Path archive = writeZip(tempDir.resolve("run.zip"), Map.of("g/c", "c"));
        ZipKeyLoader loader = new ZipKeyLoader(archive);
        assertThatThrownBy(() -> loader.fetch("g/d")).isInstanceOf(KeyNotFoundException.class);
    }

    @Test
    void shouldWrapUnreadableArchives() throws IOException {
        Path archive = tempDir.resolve("broken.zip");
        Files.writeString(archive, "this is not a zip archive");
        ZipKeyLoader loader = new ZipKeyLoader(archive);
        assertThatThrownBy(loader::listKeys).isInstanceOfAny(IOException.class, LoaderException.class);
    }
}
