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

import dev.mars.prefstore.model.PrefKey;
import dev.mars.prefstore.model.PrefValue;

import java.util.Objects;

/**
 * One row of the migration table: where a legacy value lives, which key it
 * becomes, and what to use when the legacy store has nothing.
 *
 * @param legacyKey    key in the legacy store
 * @param target       key in the new store; its type decides how the legacy value is read
 * @param defaultValue value imported when the legacy key is absent, or null to import nothing
 */
public record LegacyMapping(String legacyKey, PrefKey<?> target, PrefValue defaultValue) {

    public LegacyMapping {
        Objects.requireNonNull(legacyKey, "legacyKey");
        Objects.requireNonNull(target, "target");
        if (defaultValue != null && defaultValue.type() != target.type()) {
            throw new IllegalArgumentException("Default for " + target + " has type " + defaultValue.type());
        }
    }

    /** Mapping with a default used when the legacy key is absent. */
    public static <T> LegacyMapping of(String legacyKey, PrefKey<T> target, T defaultValue) {
        return new LegacyMapping(legacyKey, target, target.wrap(defaultValue));
    }

    /** Mapping that imports only when the legacy key is present. */
    public static LegacyMapping of(String legacyKey, PrefKey<?> target) {
        return new LegacyMapping(legacyKey, target, null);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
