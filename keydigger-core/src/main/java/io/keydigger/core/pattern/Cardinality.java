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

import java.util.Locale;

/// Whether a work-unit shape is defined by one pattern or by a primary pattern with companions.
public enum Cardinality {
    /// one pattern; every match stands alone
    SINGLE,
    /// several patterns; primary matches must be completed by companion matches in their group
    MULTI;

    /// @param patternCount the number of patterns in a spec
    /// @return the cardinality implied by that count
    public static Cardinality forPatternCount(int patternCount) {
        if (patternCount < 1) {
            throw new PatternSpecException("a pattern spec needs at least one pattern");
        }
        return patternCount == 1 ? SINGLE : MULTI;
    }

    /// Parse a cardinality name, also accepting the `?` and `+` shorthands.
    /// @param text `SINGLE`, `MULTI`, `?` or `+`, in any case
    /// @return the cardinality
    public static Cardinality fromString(String text) {
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "?":
                return SINGLE;
            case "+":
                return MULTI;
            default:
                try {
                    return valueOf(normalized);
                } catch (IllegalArgumentException e) {
                    throw new PatternSpecException("unknown cardinality '" + text + "'", e);
                }
        }
    }
}
