/// The declarative model of a work-unit shape.
///
/// A {@link io.keydigger.core.pattern.PatternSpec} is a plain value: patterns, cardinality,
/// completeness, auxiliary key templates and a labeler. Each concrete kind of work is one spec
/// instance, not a subclass.
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

