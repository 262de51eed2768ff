/// The key store contract.
///
/// A {@link io.keydigger.api.keys.KeyStore} gives cached access to a flat namespace of
/// `group/name` keys whose values are arrays. It is backed by a
/// {@link io.keydigger.api.keys.KeyLoader}, which only knows how to list and read keys.
///
/// ## Key Components
///
/// - {@link io.keydigger.api.keys.KeyStore}: cached, enumerable key-value access
/// - {@link io.keydigger.api.keys.KeyLoader}: the uncached backing storage
/// - {@link io.keydigger.api.keys.KeyPaths}: helpers for the `group/name` convention
/// - {@link io.keydigger.api.keys.KeyNotFoundException}: an absent key
/// - {@link io.keydigger.api.keys.LoaderException}: a failure of the backing storage
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

