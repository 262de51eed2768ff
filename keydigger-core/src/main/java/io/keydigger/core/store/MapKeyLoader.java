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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A {@link KeyLoader} over an in-memory map, for embedding and for tests.
public class MapKeyLoader implements KeyLoader {

    private final String location;
    private final Map<String, Object> values;

    /// @param location a name for this map, used in messages
    /// @param values the keys and values; null values are rejected
    public MapKeyLoader(String location, Map<String, ?> values) {
        this.location = location;
        this.values = new LinkedHashMap<>();
        values.forEach((k, v) -> this.values.put(k, Objects.requireNonNull(v, "value of '" + k + "'")));
    }

    /// @param values the keys and values; null values are rejected
    public MapKeyLoader(Map<String, ?> values) {
        this("memory", values);
    }

    @Override
    public String location() {
        return location;
    }

    @Override
    public List<String> listKeys() {
        return new ArrayList<>(values.keySet());
    }

    @Override
    public Object fetch(String key) {
        Object value = values.get(key);
        if (value == null) {
            throw new KeyNotFoundException(key, location);
        }
        return value;
    }
}
