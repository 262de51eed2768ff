package io.keydigger.core.dispatch;

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

import io.keydigger.api.keys.KeyStore;
import io.keydigger.core.resolve.WorkUnit;

/// A computation over one work unit, such as a profile plot or a numeric reduction.
///
/// A payload fetches what it needs with `store.getMany(unit.allKeys())`.
/// @param <R> the result type
@FunctionalInterface
public interface WorkUnitPayload<R> {
    R apply(WorkUnit unit, KeyStore store);
}
