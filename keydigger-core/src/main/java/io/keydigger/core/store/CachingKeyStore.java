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

import io.keydigger.api.keys.KeyLoader;
import io.keydigger.api.keys.KeyNotFoundException;
import io.keydigger.api.keys.KeyPaths;
import io.keydigger.api.keys.KeyStore;
import io.keydigger.api.keys.LoaderException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/// The standard {@link KeyStore}: a sorted key listing taken from a {@link KeyLoader}, with a
/// per-instance value cache.
///
/// Reads of cached values never block. Fetching is serialized through one lock per store and
/// re-checks the cache after acquiring it, so concurrent first reads of the same key fetch it
/// only once. A batch read fetches only the keys which are not cached yet, in a single call to
/// {@link KeyLoader#fetchAll(List)}.
public class CachingKeyStore implements KeyStore {
    private static final Logger logger = LogManager.getLogger(CachingKeyStore.class);

    private final KeyLoader loader;
    private final KeyStoreOptions options;
    private final Map<String, Object> cache = new ConcurrentHashMap<>();
    private final ReentrantLock fetchLock = new ReentrantLock();

    private volatile List<String> keys = List.of();
    private volatile Set<String> keySet = Set.of();
    private volatile List<String> groups = List.of();

    /// Create a store with default options.
    /// @param loader the backing storage
    /// @throws LoaderException if the keys cannot be listed
    public CachingKeyStore(KeyLoader loader) {
        this(loader, KeyStoreOptions.defaults());
    }

    /// Create a store.
    /// @param loader the backing storage
    /// @param options exclusions and the description key
    /// @throws LoaderException if the keys cannot be listed
    public CachingKeyStore(KeyLoader loader, KeyStoreOptions options) {
        this.loader = loader;
        this.options = options;
        refresh();
    }

    /// Re-list the keys from the loader and drop every cached value.
    /// @throws LoaderException if the keys cannot be listed
    public void refresh() {
        List<String> listed;
        try {
            logger.debug("Getting keys from {} ...", loader.location());
            listed = loader.listKeys();
        } catch (IOException e) {
            logger.error("Failed to read path {}.", loader.location(), e);
            throw new LoaderException(loader.location(), null, e);
        }

        TreeSet<String> visible = new TreeSet<>();
        int excluded = 0;
        for (String key : listed) {
            if (options.isExcluded(key)) {
                excluded++;
            } else {
                visible.add(key);
            }
        }
        TreeSet<String> visibleGroups = new TreeSet<>();
        for (String key : visible) {
            String group = KeyPaths.groupOf(key);
            if (!group.equals(KeyPaths.ROOT_GROUP)) {
                visibleGroups.add(group);
            }
        }

        fetchLock.lock();
        try {
            this.keys = List.copyOf(visible);
            this.keySet = Collections.unmodifiableSet(new LinkedHashSet<>(visible));
            this.groups = List.copyOf(visibleGroups);
            cache.clear();
        } finally {
            fetchLock.unlock();
        }
        logger.debug("Found {} keys in {} groups at {} ({} excluded)",
            visible.size(), visibleGroups.size(), loader.location(), excluded);
    }

    @Override
    public String location() {
        return loader.location();
    }

    @Override
    public List<String> keys() {
        return keys;
    }

    @Override
    public List<String> groups() {
        return groups;
    }

    @Override
    public boolean contains(String key) {
        return keySet.contains(key);
    }

    @Override
    public Object get(String key) {
        requirePresent(key);
        Object cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        return fetchMissing(List.of(key)).get(key);
    }

    @Override
    public List<Object> getMany(List<String> requested) {
        requested.forEach(this::requirePresent);
        Object[] values = new Object[requested.size()];
        Set<String> missing = new LinkedHashSet<>();
        for (int i = 0; i < values.length; i++) {
            values[i] = cache.get(requested.get(i));
            if (values[i] == null) {
                missing.add(requested.get(i));
            }
        }
        if (!missing.isEmpty()) {
            Map<String, Object> fetched = fetchMissing(new ArrayList<>(missing));
            for (int i = 0; i < values.length; i++) {
                if (values[i] == null) {
                    values[i] = fetched.get(requested.get(i));
                }
            }
        }
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    @Override
    public Map<String, Object> getByGroup(String group) {
        List<String> members = new ArrayList<>();
        for (String key : keys) {
            if (KeyPaths.isDirectChild(key, group)) {
                members.add(key);
            }
        }
        List<Object> values = getMany(members);
        Map<String, Object> byName = new LinkedHashMap<>();
        for (int i = 0; i < members.size(); i++) {
            byName.put(KeyPaths.nameOf(members.get(i)), values.get(i));
        }
        return byName;
    }

    @Override
    public boolean allPresent(String... required) {
        boolean result = true;
        for (String key : required) {
            if (!contains(key)) {
                logger.warn("Key '{}' not in {}!", key, location());
                result = false;
            }
        }
        return result;
    }

    @Override
    public Optional<String> description() {
        String key = options.descriptionKey();
        if (!contains(key)) {
            return Optional.empty();
        }
        Object value = get(key);
        if (value instanceof byte[]) {
            return Optional.of(new String((byte[]) value, StandardCharsets.UTF_8));
        }
        return Optional.of(String.valueOf(value));
    }

    @Override
    public void clearCache() {
        fetchLock.lock();
        try {
            logger.debug("Clearing {} cached values of {}", cache.size(), location());
            cache.clear();
        } finally {
            fetchLock.unlock();
        }
    }

    /// @return the number of values currently cached
    public int cachedCount() {
        return cache.size();
    }

    /// @return the options this store was opened with
    public KeyStoreOptions options() {
        return options;
    }

    private void requirePresent(String key) {
        if (!keySet.contains(key)) {
            throw new KeyNotFoundException(key, location());
        }
    }

    /// Fetch the given keys unless another thread cached them in the meantime.
    /// @return the values of all the given keys
    private Map<String, Object> fetchMissing(List<String> candidates) {
        Map<String, Object> result = new LinkedHashMap<>();
        fetchLock.lock();
        try {
            List<String> todo = new ArrayList<>();
            for (String key : candidates) {
                Object cached = cache.get(key);
                if (cached != null) {
                    result.put(key, cached);
                } else {
                    todo.add(key);
                }
            }
            if (todo.isEmpty()) {
                return result;
            }
            List<Object> values = fetchFromLoader(todo);
            for (int i = 0; i < todo.size(); i++) {
                Object value = values.get(i);
                if (value == null) {
                    throw new LoaderException(location(), todo.get(i), "loader returned no value");
                }
                cache.put(todo.get(i), value);
                result.put(todo.get(i), value);
            }
            return result;
        } finally {
            fetchLock.unlock();
        }
    }

    private List<Object> fetchFromLoader(List<String> todo) {
        try {
            List<Object> values = loader.fetchAll(todo);
            if (values.size() != todo.size()) {
                throw new LoaderException(location(), todo.get(0),
                    "loader returned " + values.size() + " values for " + todo.size() + " keys");
            }
            return values;
        } catch (IOException e) {
            logger.error("Failed to get {} from {}!", todo, location(), e);
            throw new LoaderException(location(), todo.size() == 1 ? todo.get(0) : String.join(",", todo), e);
        }
    }

    @Override
    public String toString() {
        return "CachingKeyStore{" + location() + ", keys=" + keys.size() + ", cached=" + cache.size() + "}";
    }
}
