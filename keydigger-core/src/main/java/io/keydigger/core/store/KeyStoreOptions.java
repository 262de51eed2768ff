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

import io.keydigger.api.keys.KeyPaths;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// Options for a {@link CachingKeyStore}.
///
/// Exclusion entries are either literal names or regular expressions. A key (or group) is
/// excluded when it equals an entry or is fully matched by it. Excluding a group hides every
/// key below it.
///
/// @param excludeKeys keys to hide, e.g. `bigdata.out` or `.*\.txt`
/// @param excludeGroups groups to hide, e.g. `snap\d+`
/// @param descriptionKey the key holding a free-text description of the data
public record KeyStoreOptions(List<String> excludeKeys, List<String> excludeGroups, String descriptionKey) {

    /// The conventional description key
    public static final String DESCRIPTION = "description";

    public KeyStoreOptions {
        excludeKeys = List.copyOf(excludeKeys);
        excludeGroups = List.copyOf(excludeGroups);
        if (descriptionKey == null || descriptionKey.isEmpty()) {
            throw new IllegalArgumentException("description key cannot be empty");
        }
        compileAll(excludeKeys);
        compileAll(excludeGroups);
    }

    /// @return options which hide nothing
    public static KeyStoreOptions defaults() {
        return new KeyStoreOptions(List.of(), List.of(), DESCRIPTION);
    }

    /// @param entries additional key exclusions
    /// @return a copy of these options with the exclusions added
    public KeyStoreOptions excludingKeys(String... entries) {
        List<String> merged = new ArrayList<>(excludeKeys);
        merged.addAll(Arrays.asList(entries));
        return new KeyStoreOptions(merged, excludeGroups, descriptionKey);
    }

    /// @param entries additional group exclusions
    /// @return a copy of these options with the exclusions added
    public KeyStoreOptions excludingGroups(String... entries) {
        List<String> merged = new ArrayList<>(excludeGroups);
        merged.addAll(Arrays.asList(entries));
        return new KeyStoreOptions(excludeKeys, merged, descriptionKey);
    }

    /// @param key the description key to use
    /// @return a copy of these options with another description key
    public KeyStoreOptions withDescriptionKey(String key) {
        return new KeyStoreOptions(excludeKeys, excludeGroups, key);
    }

    /// @param key a key
    /// @return true if the key, or any group above it, is excluded
    public boolean isExcluded(String key) {
        if (matchesAny(key, excludeKeys)) {
            return true;
        }
        if (excludeGroups.isEmpty()) {
            return false;
        }
        String group = KeyPaths.groupOf(key);
        while (!group.isEmpty()) {
            if (matchesAny(group, excludeGroups)) {
                return true;
            }
            group = KeyPaths.groupOf(group);
        }
        return false;
    }

    private static boolean matchesAny(String name, List<String> entries) {
        for (String entry : entries) {
            if (entry.equals(name) || Pattern.compile(entry).matcher(name).matches()) {
                return true;
            }
        }
        return false;
    }

    private static void compileAll(List<String> entries) {
        for (String entry : entries) {
            try {
                Pattern.compile(entry);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("invalid exclusion pattern '" + entry + "'", e);
            }
        }
    }
}
