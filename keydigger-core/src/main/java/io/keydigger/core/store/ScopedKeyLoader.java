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
import io.keydigger.api.keys.LoaderException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/// Base class for loaders which must open a resource, such as an archive or a file, to read it.
///
/// The resource is opened for each listing or batch read and is always closed afterwards,
/// whether reading succeeded or not. Failures to read a key are logged with the location and
/// the key, then rethrown as {@link LoaderException}.
///
/// @param <H> the type of the opened resource
public abstract class ScopedKeyLoader<H extends AutoCloseable> implements KeyLoader {
    private static final Logger logger = LogManager.getLogger(ScopedKeyLoader.class);

    /// @return a newly opened handle on the resource
    /// @throws IOException if the resource cannot be opened
    protected abstract H open() throws IOException;

    /// @param handle the opened resource
    /// @return every key in the resource
    /// @throws IOException if the resource cannot be read
    protected abstract List<String> listKeys(H handle) throws IOException;

    /// @param handle the opened resource
    /// @param key the key to read
    /// @return the value of the key
    /// @throws IOException if the value cannot be read
    /// @throws KeyNotFoundException if the key is not in the resource
    protected abstract Object read(H handle, String key) throws IOException;

    @Override
    public final List<String> listKeys() throws IOException {
        try (Scope scope = openScope()) {
            logger.debug("Getting keys from {} ...", location());
            return listKeys(scope.handle);
        }
    }

    @Override
    public final Object fetch(String key) throws IOException {
        return fetchAll(List.of(key)).get(0);
    }

    @Override
    public final List<Object> fetchAll(List<String> keys) throws IOException {
        try (Scope scope = openScope()) {
            List<Object> values = new ArrayList<>(keys.size());
            for (String key : keys) {
                values.add(readLogged(scope.handle, key));
            }
            return values;
        }
    }

    private Object readLogged(H handle, String key) {
        logger.debug("Getting key '{}' from {} ...", key, location());
        try {
            return read(handle, key);
        } catch (IOException e) {
            logger.error("Failed to get '{}' from {}!", key, location(), e);
            throw new LoaderException(location(), key, e);
        }
    }

    private Scope openScope() throws IOException {
        logger.debug("Open path {}.", location());
        return new Scope(open());
    }

    private final class Scope implements Closeable {
        private final H handle;

        private Scope(H handle) {
            this.handle = handle;
        }

        @Override
        public void close() throws IOException {
            logger.debug("Close path {}.", location());
            try {
                handle.close();
            } catch (IOException e) {
                throw e;
            } catch (Exception e) {
                throw new IOException("Failed to close " + location(), e);
            }
        }
    }
}
