package io.keydigger.core.resolve;

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

import java.util.LinkedHashSet;
import java.util.List;

/// One resolved, ready-to-consume binding of a group/variant combination to concrete keys.
///
/// A work unit only names keys. Its consumer fetches their values with
/// `keyStore.getMany(unit.allKeys())`.
///
/// @param group the group value the unit was resolved in, such as `snap00100`
/// @param primaryKeys the primary keys first, then companion keys in pattern order, sorted within each pattern
/// @param auxiliaryKeys the rendered auxiliary keys, in template order
/// @param label the label derived from the primary key
public record WorkUnit(String group, List<String> primaryKeys, List<String> auxiliaryKeys, String label) {

    public WorkUnit {
        if (primaryKeys.isEmpty()) {
            throw new IllegalArgumentException("a work unit needs at least one primary key");
        }
        primaryKeys = List.copyOf(primaryKeys);
        auxiliaryKeys = List.copyOf(auxiliaryKeys);
    }

    /// @return the first primary key
    public String primaryKey() {
        return primaryKeys.get(0);
    }

    /// @return primary keys then auxiliary keys, each key once
    public List<String> allKeys() {
        LinkedHashSet<String> all = new LinkedHashSet<>(primaryKeys);
        all.addAll(auxiliaryKeys);
        return List.copyOf(all);
    }
}
