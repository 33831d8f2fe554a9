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

/**
 * Phases of a migration run.
 * <pre>
 * NOT_STARTED → SNAPSHOTTING → IMPORTING → WRITING → COMMITTED
 *                    │                        └────→ ROLLED_BACK
 *                    └──────────────────────────────→ ROLLED_BACK
 * NOT_STARTED → SKIPPED   (flag already set)
 * </pre>
 */
public enum MigrationPhase {
    NOT_STARTED,
    SNAPSHOTTING,
    IMPORTING,
    WRITING,
    COMMITTED,
    ROLLED_BACK,
    SKIPPED;

    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK || this == SKIPPED;
    }
}
