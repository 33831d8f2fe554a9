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
package dev.mars.prefstore.migration;

import dev.mars.prefstore.model.PrefValue;
import dev.mars.prefstore.model.ValueType;

import java.util.Optional;

/**
 * The flat preference store this engine replaces.
 * <p>
 * Values are only ever read. The one thing written back is the
 * migration-completed flag, which lives here rather than in the new
 * document so that it survives a fully reset store.
 */
public interface LegacyPreferenceStore {

    /**
     * Reads a legacy value, interpreting it as {@code type}.
     *
     * @return the value, or empty when the key is absent or its value does not parse as {@code type}
     */
    Optional<PrefValue> read(String legacyKey, ValueType type);

    /** Reads a boolean flag; absent means false. */
    boolean readFlag(String flagKey);

    /**
     * Persists a boolean flag.
     *
     * @throws dev.mars.prefstore.storage.StoreException if the flag cannot be written
     */
    void writeFlag(String flagKey, boolean value);
}
