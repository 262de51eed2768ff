package io.keydigger.core.pattern;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// One key matched by a {@link KeyPattern}, with the values of its named captures.
///
/// Captures which did not participate in the match are absent from the map.
///
/// @param key the matched key
/// @param captures named capture values, in the order the names appear in the pattern
public record KeyMatch(String key, Map<String, String> captures) {

    public KeyMatch {
        captures = Collections.unmodifiableMap(new LinkedHashMap<>(captures));
    }

    /// @param name a capture name
    /// @return the captured value, or the empty string if the capture did not participate
    public String capture(String name) {
        return captures.getOrDefault(name, "");
    }
}
