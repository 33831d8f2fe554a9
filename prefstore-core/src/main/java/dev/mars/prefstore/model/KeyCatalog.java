/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.prefstore.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The set of keys one store instance knows about.
 * <p>
 * The catalog enforces the key invariant: an id maps to exactly one
 * {@link ValueType}. It also gives the document codec the type hints it
 * needs to tell a Base64 blob from a plain string.
 * <p>
 * Keys that appear in a document but not in the catalog are still kept;
 * their type is inferred from the JSON shape. A blob is stored as a Base64
 * string and cannot be told apart from a plain string that way, so blob
 * keys must be declared.
 */
public final class KeyCatalog {

    private final Map<String, PrefKey<?>> byId;

    private KeyCatalog(Map<String, PrefKey<?>> byId) {
        this.byId = Collections.unmodifiableMap(byId);
    }

    /**
     * Builds a catalog from the given keys.
     *
     * @throws IllegalArgumentException if two keys share an id but not a type
     */
    public static KeyCatalog of(Collection<? extends PrefKey<?>> keys) {
        Map<String, PrefKey<?>> byId = new LinkedHashMap<>();
        for (PrefKey<?> key : keys) {
            PrefKey<?> previous = byId.putIfAbsent(key.id(), key);
            if (previous != null && previous.type() != key.type()) {
                throw new IllegalArgumentException("Key '" + key.id() + "' declared as both "
                        + previous.type() + " and " + key.type());
            }
        }
        return new KeyCatalog(byId);
    }

    public static KeyCatalog of(PrefKey<?>... keys) {
        return of(List.of(keys));
    }

    public static KeyCatalog empty() {
        return new KeyCatalog(Map.of());
    }

    public Optional<PrefKey<?>> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Checks that {@code key} does not contradict a catalog entry with the same id,
     * and that an undeclared key has a type the codec can infer on reload.
     *
     * @throws IllegalArgumentException on a type conflict or an undeclared blob key
     */
    public void requireCompatible(PrefKey<?> key) {
        PrefKey<?> known = byId.get(key.id());
        if (known == null) {
            if (key.type() == ValueType.BLOB) {
                throw new IllegalArgumentException("Blob key '" + key.id()
                        + "' must be declared in the catalog to survive a reload");
            }
            return;
        }
        if (known.type() != key.type()) {
            throw new IllegalArgumentException("Key '" + key.id() + "' is " + known.type()
                    + " in this store, not " + key.type());
        }
    }

    public Collection<PrefKey<?>> keys() {
        return byId.values();
    }

    public int size() {
        return byId.size();
    }
}
