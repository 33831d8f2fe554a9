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
import dev.mars.prefstore.storage.StoreException;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory legacy store holding already-typed values.
 */
class InMemoryLegacyStore implements LegacyPreferenceStore {

    private final Map<String, PrefValue> values = new HashMap<>();
    private final Map<String, Boolean> flags = new HashMap<>();
    private boolean failFlagWrites = false;
    private int flagWrites = 0;

    InMemoryLegacyStore put(String legacyKey, PrefValue value) {
        values.put(legacyKey, value);
        return this;
    }

    void failFlagWrites(boolean fail) {
        this.failFlagWrites = fail;
    }

    int flagWrites() {
        return flagWrites;
    }

    @Override
    public Optional<PrefValue> read(String legacyKey, ValueType type) {
        PrefValue value = values.get(legacyKey);
        return value != null && value.type() == type ? Optional.of(value) : Optional.empty();
    }

    @Override
    public boolean readFlag(String flagKey) {
        return flags.getOrDefault(flagKey, false);
    }

    @Override
    public void writeFlag(String flagKey, boolean value) {
        flagWrites++;
        if (failFlagWrites) {
            throw new StoreException("Injected flag write failure");
        }
        flags.put(flagKey, value);
    }
}
