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

import java.util.Optional;

/**
 * Result of one migration run.
 *
 * @param phase        terminal phase: COMMITTED, ROLLED_BACK or SKIPPED
 * @param importedKeys number of keys written into the store by the import step
 * @param failure      the failure that caused a rollback
 */
public record MigrationOutcome(MigrationPhase phase, int importedKeys, Optional<MigrationException> failure) {

    public static MigrationOutcome skipped() {
        return new MigrationOutcome(MigrationPhase.SKIPPED, 0, Optional.empty());
    }

    public static MigrationOutcome committed(int importedKeys) {
        return new MigrationOutcome(MigrationPhase.COMMITTED, importedKeys, Optional.empty());
    }

    public static MigrationOutcome rolledBack(MigrationException failure) {
        return new MigrationOutcome(MigrationPhase.ROLLED_BACK, 0, Optional.of(failure));
    }

    public boolean committed() {
        return phase == MigrationPhase.COMMITTED;
    }

    public boolean rolledBack() {
        return phase == MigrationPhase.ROLLED_BACK;
    }
}
