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

import io.keydigger.api.keys.KeyStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyStoresTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPickLoaderByPath() throws IOException {
        Files.createDirectories(tempDir.resolve("raw"));
        assertThat(KeyStores.loaderFor(tempDir.resolve("raw"))).isInstanceOf(DirectoryKeyLoader.class);

        Path zip = ZipKeyLoaderTest.writeZip(tempDir.resolve("run.zip"), Map.of("g/c", "c"));
        assertThat(KeyStores.loaderFor(zip)).isInstanceOf(ZipKeyLoader.class);

        Path h5 = Hdf5KeyLoaderTest.writeRun(tempDir.resolve("run.h5"));
        assertThat(KeyStores.loaderFor(h5)).isInstanceOf(Hdf5KeyLoader.class);
    }

    @Test
    void shouldStripNpySuffixForNpzArchives() throws IOException {
        Path npz = ZipKeyLoaderTest.writeZip(tempDir.resolve("run.npz"), Map.of("his/n.npy", "n", "his/i.npy", "i"));
        KeyStore store = KeyStores.open(npz.toString());
        assertThat(store.keys()).containsExactly("his/i", "his/n");
    }

    @Test
    void shouldApplyOptionsWhenOpening() throws IOException {
        Path zip = ZipKeyLoaderTest.writeZip(tempDir.resolve("run.zip"),
            Map.of("g/c", "c", "bigdata.out", "x", "snap00100/p", "p"));
        KeyStore store = KeyStores.open(zip, KeyStoreOptions.defaults()
            .excludingKeys("bigdata.out")
            .excludingGroups("snap\\d+"));
        assertThat(store.keys()).containsExactly("g/c");
    }

    @Test
    void shouldRejectMissingAndUnsupportedPaths() throws IOException {
        assertThatThrownBy(() -> KeyStores.open(tempDir.resolve("absent.h5"), KeyStoreOptions.defaults()))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("does not exist");
        Path text = Files.writeString(tempDir.resolve("notes.txt"), "notes");
        assertThatThrownBy(() -> KeyStores.loaderFor(text))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("Unsupported");
    }

    @Test
    void shouldWrapMapsInMemory() {
        KeyStore store = KeyStores.of(Map.of("b", 2, "a/x", 1));
        assertThat(store.keys()).containsExactly("a/x", "b");
        assertThat(store.get("b")).isEqualTo(2);
        assertThat(store.location()).isEqualTo("memory");
    }
}
