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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectoryKeyLoaderTest {

    @TempDir
    Path tempDir;

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void shouldListFilesAsSlashSeparatedKeys() throws IOException {
        write("snap00100/ion-profile", "ions");
        write("snap00100/nested/flux", "flux");
        write("description", "run 1");
        Files.createDirectories(tempDir.resolve("empty"));

        DirectoryKeyLoader loader = new DirectoryKeyLoader(tempDir);
        assertThat(loader.listKeys()).containsExactlyInAnyOrder(
            "snap00100/ion-profile", "snap00100/nested/flux", "description");
    }

    @Test
    void shouldReadFileBytes() throws IOException {
        write("gtc/tstep", "0.01");
        DirectoryKeyLoader loader = new DirectoryKeyLoader(tempDir);
        assertThat(new String((byte[]) loader.fetch("gtc/tstep"), StandardCharsets.UTF_8)).isEqualTo("0.01");
        assertThat(loader.fetchAll(List.of("gtc/tstep", "gtc/tstep"))).hasSize(2);
    }

    @Test
    void shouldReportMissingAndEscapingKeysAsNotFound() throws IOException {
        write("gtc/tstep", "0.01");
        DirectoryKeyLoader loader = new DirectoryKeyLoader(tempDir);
        assertThatThrownBy(() -> loader.fetch("gtc/nope")).isInstanceOf(KeyNotFoundException.class);
        assertThatThrownBy(() -> loader.fetch("../outside")).isInstanceOf(KeyNotFoundException.class);
        assertThatThrownBy(() -> loader.fetch("gtc")).isInstanceOf(KeyNotFoundException.class);
    }

    @Test
    void shouldRejectMissingDirectory() {
        assertThatThrownBy(() -> new DirectoryKeyLoader(tempDir.resolve("absent")))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("absent");
    }
}
