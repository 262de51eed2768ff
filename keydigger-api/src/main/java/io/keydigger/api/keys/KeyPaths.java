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


/// Helpers for the `group/name` key convention.
///
/// A key's group is everything before its last separator. Keys without a separator live in the
/// root group, which is the empty string and is never reported as a group.
public final class KeyPaths {

    /// The separator between a group and a local name
    public static final char SEPARATOR = '/';

    /// The name of the root group
    public static final String ROOT_GROUP = "";

    private KeyPaths() {
    }

    /// @param key a key such as `snap00100/ion-profile`
    /// @return the prefix up to the last separator, or {@link #ROOT_GROUP} for bare keys
    public static String groupOf(String key) {
        int last = key.lastIndexOf(SEPARATOR);
        return last < 0 ? ROOT_GROUP : key.substring(0, last);
    }

    /// @param key a key such as `snap00100/ion-profile`
    /// @return the part after the last separator
    public static String nameOf(String key) {
        int last = key.lastIndexOf(SEPARATOR);
        return last < 0 ? key : key.substring(last + 1);
    }

    /// Join a group and a local name into a key.
    /// @param group the group, which may be the root group
    /// @param name the local name
    /// @return the key
    public static String join(String group, String name) {
        if (group == null || group.isEmpty()) {
            return name;
        }
        return group + SEPARATOR + name;
    }

    /// @param key a key
    /// @param group a group name
    /// @return true if the key sits directly under the group
    public static boolean isDirectChild(String key, String group) {
        return groupOf(key).equals(group);
    }

    /// @param key a key
    /// @param group a group name
    /// @return true if the key sits anywhere below the group
    public static boolean isUnder(String key, String group) {
        return key.startsWith(group + SEPARATOR);
    }
}
