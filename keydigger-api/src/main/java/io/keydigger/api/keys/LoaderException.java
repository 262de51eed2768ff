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

/// Thrown when the backing storage of a {@link KeyStore} fails to list or read keys.
///
/// The key is null when the failure happened while listing or opening the location rather
/// than while reading a specific key.
public class LoaderException extends RuntimeException {

    private final String location;
    private final String key;

    public LoaderException(String location, String key, Throwable cause) {
        super(key == null
                ? String.format("Failed to read path '%s'", location)
                : String.format("Failed to get '%s' from '%s'", key, location),
            cause);
        this.location = location;
        this.key = key;
    }

    public LoaderException(String location, String key, String message) {
        super(String.format("%s (key '%s' in '%s')", message, key, location));
        this.location = location;
        this.key = key;
    }

    public String getLocation() {
        return location;
    }

    public String getKey() {
        return key;
    }
}
