package io.keydigger.api.keys;

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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/// The backing storage behind a {@link KeyStore}.
///
/// A loader knows how to enumerate the keys at its location and how to read the value of a key.
/// It does no caching of its own. Implementations may be an archive reader, a directory scanner,
/// an HDF5 file, or an in-memory map.
///
/// Absent keys are reported with {@link KeyNotFoundException}; I/O failures surface as
/// {@link IOException} or {@link LoaderException}.
public interface KeyLoader {

    /// @return a description of where the data lives, used in log and error messages
    String location();

    /// @return every key available at this location, in any order
    /// @throws IOException if the location cannot be read
    List<String> listKeys() throws IOException;

    /// Read one value.
    /// @param key the key to read
    /// @return the value, never null
    /// @throws IOException if the value cannot be read
    /// @throws KeyNotFoundException if the key does not exist
    Object fetch(String key) throws IOException;

    /// Read several values in one round trip. Loaders which have to open a resource should
    /// override this to open it only once.
    /// @param keys the keys to read
    /// @return the values, in the same order as the keys
    /// @throws IOException if any value cannot be read
    default List<Object> fetchAll(List<String> keys) throws IOException {
        List<Object> values = new ArrayList<>(keys.size());
        for (String key : keys) {
            values.add(fetch(key));
        }
        return values;
    }
}
