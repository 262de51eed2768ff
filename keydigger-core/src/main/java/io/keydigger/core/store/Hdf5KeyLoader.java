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

import io.jhdf.HdfFile;
import io.jhdf.api.Dataset;
import io.jhdf.api.Group;
import io.jhdf.api.Node;
import io.jhdf.exceptions.HdfException;
import io.jhdf.exceptions.HdfInvalidPathException;
import io.keydigger.api.keys.KeyNotFoundException;
import io.keydigger.api.keys.KeyPaths;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// A loader over an HDF5 file, one key per dataset.
///
/// Keys are dataset paths relative to the root group, without a leading slash, so the dataset
/// `/snap00100/ion-profile` is the key `snap00100/ion-profile`. Values are whatever
/// {@link Dataset#getData()} returns for the dataset, typically a primitive array.
public class Hdf5KeyLoader extends ScopedKeyLoader<HdfFile> {

    private final Path file;

    /// @param file the HDF5 file
    /// @throws IOException if the file is not readable
    public Hdf5KeyLoader(Path file) throws IOException {
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new IOException("Failed to access path '" + file + "'.");
        }
        this.file = file;
    }

    @Override
    public String location() {
        return file.toString();
    }

    @Override
    protected HdfFile open() throws IOException {
        try {
            return new HdfFile(file);
        } catch (HdfException e) {
            throw new IOException("Failed to open HDF5 file '" + file + "'", e);
        }
    }

    @Override
    protected List<String> listKeys(HdfFile hdfFile) throws IOException {
        List<String> keys = new ArrayList<>();
        try {
            collect(hdfFile, KeyPaths.ROOT_GROUP, keys);
        } catch (HdfException e) {
            throw new IOException("Failed to traverse HDF5 file '" + file + "'", e);
        }
        return keys;
    }

    private void collect(Group group, String prefix, List<String> keys) {
        for (Node node : group.getChildren().values()) {
            String key = KeyPaths.join(prefix, node.getName());
            if (node instanceof Dataset) {
                keys.add(key);
            } else if (node instanceof Group) {
                collect((Group) node, key, keys);
            }
        }
    }

    @Override
    protected Object read(HdfFile hdfFile, String key) throws IOException {
        Dataset dataset;
        try {
            dataset = hdfFile.getDatasetByPath(key);
        } catch (HdfInvalidPathException e) {
            throw new KeyNotFoundException(key, location());
        } catch (HdfException e) {
            throw new IOException("Failed to locate dataset '" + key + "'", e);
        }
        try {
            return dataset.getData();
        } catch (HdfException e) {
            throw new IOException("Failed to read dataset '" + key + "'", e);
        }
    }
}
