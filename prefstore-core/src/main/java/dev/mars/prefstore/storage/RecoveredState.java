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
package dev.mars.prefstore.storage;

import dev.mars.prefstore.model.PrefValue;

import java.util.Map;

/**
 * Outcome of loading the store at startup.
 *
 * @param values the recovered store contents (never null)
 * @param source which document the contents came from
 */
public record RecoveredState(Map<String, PrefValue> values, Source source) {

    /** Where the recovered values were read from. */
    public enum Source {
        PRIMARY,
        BACKUP,
        EMPTY
    }

    public RecoveredState {
        values = Map.copyOf(values);
    }

    public static RecoveredState empty() {
        return new RecoveredState(Map.of(), Source.EMPTY);
    }
}
