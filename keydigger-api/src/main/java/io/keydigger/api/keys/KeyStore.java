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

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/// Uniform, cached access to a flat namespace of array-valued keys.
///
/// Keys are strings of the form `group/name`, or bare names for the root group. Enumeration
/// order is deterministic. Values are fetched lazily from the backing {@link KeyLoader} on first
/// access and cached per store instance until {@link #clearCache()} is called.
///
/// Implementations must tolerate concurrent readers.
public interface KeyStore {

    /// @return a description of the backing location
    String location();

    /// @return all visible keys, sorted
    List<String> keys();

    /// @return all non-root groups, sorted
    List<String> groups();

    /// @param key the key to look up
    /// @return the value of the key
    /// @throws KeyNotFoundException if the key is not in this store
    /// @throws LoaderException if the backing storage fails
    Object get(String key);

    /// @param keys the keys to look up
    /// @return the values, in the order of the requested keys
    /// @throws KeyNotFoundException if any key is not in this store
    /// @throws LoaderException if the backing storage fails
    List<Object> getMany(List<String> keys);

    /// @param group a group name
    /// @return a map from local name to value for every key directly under the group
    Map<String, Object> getByGroup(String group);

    /// @param keys keys which are expected to be present
    /// @return true only if every key is present
    boolean allPresent(String... keys);

    /// @return the value of the description key, when the store has one
    Optional<String> description();

    /// Drop every cached value. The key listing is kept.
    void clearCache();

    /// @see #getMany(List)
    default List<Object> getMany(String... keys) {
        return getMany(Arrays.asList(keys));
    }

    /// Get a value with a checked cast.
    /// @param key the key to look up
    /// @param type the expected value type
    /// @param <T> the expected value type
    /// @return the value cast to the type
    /// @throws ClassCastException if the value is of another type
    default <T> T get(String key, Class<T> type) {
        Object value = get(key);
        if (!type.isInstance(value)) {
            throw new ClassCastException(
                "value of '" + key + "' is " + value.getClass().getName() + ", not " + type.getName());
        }
        return type.cast(value);
    }

    /// @param key a key
    /// @return true if the key is visible in this store
    default boolean contains(String key) {
        return keys().contains(key);
    }

    /// Find the keys which contain every one of the given fragments.
    /// @param fragments literal substrings
    /// @return the matching keys, in store order
    default List<String> find(String... fragments) {
        return keys().stream()
            .filter(k -> Arrays.stream(fragments).allMatch(k::contains))
            .collect(Collectors.toList());
    }

    /// Find the keys matched by a regular expression, anchored at the start of the key.
    /// @param regex the regular expression
    /// @return the matching keys, in store order
    default List<String> refind(String regex) {
        Pattern pattern = Pattern.compile(regex);
        return keys().stream()
            .filter(k -> pattern.matcher(k).lookingAt())
            .collect(Collectors.toList());
    }
}
