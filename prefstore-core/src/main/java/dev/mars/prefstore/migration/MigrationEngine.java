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
import dev.mars.prefstore.storage.DocumentWriteException;
import dev.mars.prefstore.storage.StateDocumentStore;
import dev.mars.prefstore.storage.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One-time import from a {@link LegacyPreferenceStore}, with rollback.
 * <p>
 * <b>Usage Pattern (Snapshot → Import → Write → Commit | Roll back):</b>
 * <ol>
 *   <li><b>Snapshotting</b>: copy the live store; copy the primary document
 *       to the pre-migration backup.</li>
 *   <li><b>Importing</b>: for each {@link LegacyMapping}, take the legacy value
 *       (or the default) unless the key already holds a non-default value.</li>
 *   <li><b>Writing</b>: persist the whole store.</li>
 *   <li><b>Committed</b>: set the flag, drop the pre-migration backup.
 *       <b>Rolled back</b>: restore the live store and the primary document,
 *       leave the flag unset so the next start retries.</li>
 * </ol>
 * <p>
 * A crash after the write but before the flag is set is safe: the next run
 * snapshots the already-migrated document and the import step leaves every
 * non-default value alone, so it converges on the same state.
 * <p>
 * Not thread-safe; the preference store runs it on its writer thread.
 */
public final class MigrationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationEngine.class);

    private final LegacyPreferenceStore legacy;
    private final List<LegacyMapping> table;
    private final String flagKey;

    private volatile MigrationPhase phase = MigrationPhase.NOT_STARTED;

    public MigrationEngine(LegacyPreferenceStore legacy, List<LegacyMapping> table, String flagKey) {
        this.legacy = Objects.requireNonNull(legacy, "legacy");
        this.table = List.copyOf(table);
        this.flagKey = Objects.requireNonNull(flagKey, "flagKey");
    }

    /** Phase of the most recent run, for diagnostics. */
    public MigrationPhase phase() {
        return phase;
    }

    /**
     * Runs the migration unless the flag says it already completed.
     *
     * @param live      the live store map; mutated by the import, restored on rollback
     * @param documents durable storage for the snapshot and the write
     * @return the outcome; failures are reported here, never thrown
     */
    public MigrationOutcome runIfNeeded(Map<String, PrefValue> live, StateDocumentStore documents) {
        if (legacy.readFlag(flagKey)) {
            phase = MigrationPhase.SKIPPED;
            LOG.debug("Migration flag '{}' already set, skipping migration", flagKey);
            return MigrationOutcome.skipped();
        }

        LOG.info("Migrating from legacy preference store ({} mappings)...", table.size());

        // Snapshotting
        phase = MigrationPhase.SNAPSHOTTING;
        Map<String, PrefValue> snapshot = new HashMap<>(live);
        boolean primaryExisted;
        try {
            primaryExisted = documents.createPreMigrationBackup();
        } catch (DocumentWriteException e) {
            phase = MigrationPhase.ROLLED_BACK;
            MigrationException failure = new MigrationException("Could not snapshot state before migration", e);
            LOG.error("Migration aborted before import: {}", e.getMessage());
            return MigrationOutcome.rolledBack(failure);
        }

        // Importing
        phase = MigrationPhase.IMPORTING;
        int imported = importLegacyValues(live);
        LOG.debug("Imported {} legacy values", imported);

        // Writing
        phase = MigrationPhase.WRITING;
        try {
            documents.persist(Map.copyOf(live));
        } catch (DocumentWriteException e) {
            return rollBack(live, snapshot, documents, primaryExisted, e);
        }

        phase = MigrationPhase.COMMITTED;
        try {
            legacy.writeFlag(flagKey, true);
        } catch (StoreException e) {
            LOG.warn("Migration written but flag '{}' could not be set; it will rerun on next start: {}",
                    flagKey, e.getMessage());
        }
        documents.discardPreMigrationBackup();
        LOG.info("Migration complete ({} keys imported, {} keys total)", imported, live.size());
        return MigrationOutcome.committed(imported);
    }

    private int importLegacyValues(Map<String, PrefValue> live) {
        int imported = 0;
        for (LegacyMapping mapping : table) {
            String id = mapping.target().id();
            PrefValue current = live.get(id);
            if (current != null && !current.equals(mapping.defaultValue())) {
                LOG.trace("Keeping existing value for '{}'", id);
                continue;
            }

            Optional<PrefValue> legacyValue = legacy.read(mapping.legacyKey(), mapping.target().type());
            PrefValue chosen = legacyValue.orElse(mapping.defaultValue());
            if (chosen == null) {
                continue;
            }
            live.put(id, chosen);
            imported++;
            LOG.trace("Imported '{}' <- legacy '{}' ({})", id, mapping.legacyKey(),
                    legacyValue.isPresent() ? "legacy value" : "default");
        }
        return imported;
    }

    private MigrationOutcome rollBack(Map<String, PrefValue> live,
                                      Map<String, PrefValue> snapshot,
                                      StateDocumentStore documents,
                                      boolean primaryExisted,
                                      DocumentWriteException cause) {
        phase = MigrationPhase.ROLLED_BACK;
        MigrationException failure = new MigrationException("Migration write failed, rolled back", cause);
        LOG.error("Migration FAILED ({}), rolling back", cause.getMessage());

        live.clear();
        live.putAll(snapshot);

        try {
            documents.restorePreMigrationBackup(primaryExisted);
        } catch (DocumentWriteException restoreFailure) {
            failure.addSuppressed(restoreFailure);
            LOG.error("Could not restore the pre-migration document: {}", restoreFailure.getMessage());
        }
        return MigrationOutcome.rolledBack(failure);
    }
}
