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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Startup loader that always produces a store.
 * <p>
 * Fallback chain: primary document, then backup document, then an empty
 * store. Each fallback is logged; nothing is raised to the caller, which
 * only ever observes values being present or absent.
 */
public final class StateRecovery {

    private static final Logger LOG = LoggerFactory.getLogger(StateRecovery.class);

    private StateRecovery() {
    }

    /**
     * Loads the store from {@code documents}. Never throws for decode
     * failures.
     */
    public static RecoveredState recover(StateDocumentStore documents) {
        boolean primaryMissing;
        try {
            Map<String, PrefValue> values = documents.readPrimary();
            LOG.info("Loaded {} keys from primary document", values.size());
            return new RecoveredState(values, RecoveredState.Source.PRIMARY);
        } catch (DocumentDecodeException primaryFailure) {
            primaryMissing = primaryFailure.isMissing();
            if (primaryMissing) {
                LOG.debug("No primary document, checking backup");
            } else {
                LOG.warn("Primary document unusable ({}), attempting recovery from backup",
                        primaryFailure.getMessage());
            }
        }

        try {
            Map<String, PrefValue> values = documents.readBackup();
            LOG.warn("Recovered {} keys from backup document", values.size());
            return new RecoveredState(values, RecoveredState.Source.BACKUP);
        } catch (DocumentDecodeException backupFailure) {
            if (primaryMissing && backupFailure.isMissing()) {
                LOG.info("No state document found, starting with an empty store");
            } else {
                LOG.warn("Backup document unusable ({}), starting with an empty store",
                        backupFailure.getMessage());
            }
        }
        return RecoveredState.empty();
    }
}
