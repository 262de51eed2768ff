/// Key store implementations and their backing loaders.
///
/// {@link io.keydigger.core.store.CachingKeyStore} is the one store implementation; the loaders
/// differ only in how they list and read keys:
///
/// - {@link io.keydigger.core.store.MapKeyLoader}: in-memory values
/// - {@link io.keydigger.core.store.DirectoryKeyLoader}: raw files in a directory tree
/// - {@link io.keydigger.core.store.ZipKeyLoader}: entries of a zip or npz archive
/// - {@link io.keydigger.core.store.Hdf5KeyLoader}: datasets of an HDF5 file
///
/// {@link io.keydigger.core.store.KeyStores} picks a loader for a path.
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

