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

/// Thrown when a {@link PatternSpec} is malformed: no patterns, an invalid regular expression,
/// a declared cardinality which does not fit the patterns, or a template referring to captures
/// that do not exist.
public class PatternSpecException extends IllegalArgumentException {

    public PatternSpecException(String message) {
        super(message);
    }

    public PatternSpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
