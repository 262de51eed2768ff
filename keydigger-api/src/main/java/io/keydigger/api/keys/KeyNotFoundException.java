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

/// Thrown when a requested key is not present in a {@link KeyStore} or its {@link KeyLoader}.
public class KeyNotFoundException extends RuntimeException {

    private final String key;
    private final String location;

    public KeyNotFoundException(String key, String location) {
        super(String.format("key '%s' is not in '%s'", key, location));
        this.key = key;
        this.location = location;
    }

    public String getKey() {
        return key;
    }

    public String getLocation() {
        return location;
    }
}
