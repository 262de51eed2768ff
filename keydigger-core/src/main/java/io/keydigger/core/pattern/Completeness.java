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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// The rule deciding whether a candidate group/variant combination has enough matched keys to
/// become a work unit.
///
/// {@link #ALL} requires at least one match for every pattern of the spec. An explicit rule
/// lists expressions which must each match at least one of the combination's keys; this lets
/// one companion pattern such as `(?:x|y)` be split into separately required `x` and `y`.
public final class Completeness {

    /// Every pattern of the spec must have a match in the group
    public static final Completeness ALL = new Completeness(List.of());

    private final List<KeyPattern> requirements;

    private Completeness(List<KeyPattern> requirements) {
        this.requirements = requirements;
    }

    /// @param regexes the expressions which must all be satisfied
    /// @return an explicit completeness rule
    /// @throws PatternSpecException if the list is empty or an expression is invalid
    public static Completeness of(List<String> regexes) {
        if (regexes == null || regexes.isEmpty()) {
            throw new PatternSpecException("an explicit completeness rule needs at least one pattern");
        }
        List<KeyPattern> compiled = new ArrayList<>(regexes.size());
        for (String regex : regexes) {
            compiled.add(KeyPattern.compile(regex));
        }
        return new Completeness(Collections.unmodifiableList(compiled));
    }

    /// @see #of(List)
    public static Completeness of(String... regexes) {
        return of(List.of(regexes));
    }

    /// @return true for the {@link #ALL} rule
    public boolean isAll() {
        return requirements.isEmpty();
    }

    /// @return the explicit requirements; empty for {@link #ALL}
    public List<KeyPattern> requirements() {
        return requirements;
    }

    @Override
    public String toString() {
        return isAll() ? "ALL" : requirements.toString();
    }
}
