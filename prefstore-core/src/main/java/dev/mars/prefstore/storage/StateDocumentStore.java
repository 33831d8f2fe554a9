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

import java.io.Closeable;
import java.util.Map;

/**
 * Durable home of the state document.
 * <p>
 * The preference store depends solely on this interface, which keeps the
 * engine testable against failing or counting implementations.
 * <p>
 * <b>Threading:</b> implementations are not thread-safe. The preference
 * store calls every method from its single writer thread, which is what
 * orders reads, writes and backup rotation.
 * <p>
 * <b>Critical Contract:</b> {@link #persist(Map)} must leave the primary
 * document either fully old or fully new, never a mix, and must not return
 * before the new document is durable.
 *
 * @see FileStateDocumentStore
 */
public interface StateDocumentStore extends Closeable {

    /**
     * Prepares storage (directories, locks). Idempotent.
     *
     * @throws StoreException if the storage cannot be used at all
     */
    void open();

    /**
     * Reads and decodes the primary document.
     *
     * @throws DocumentDecodeException if it is missing, unreadable or malformed
     */
    Map<String, PrefValue> readPrimary();

    /**
     * Reads and decodes the backup document (one generation behind the primary).
     *
     * @throws DocumentDecodeException if it is missing, unreadable or malformed
     */
    Map<String, PrefValue> readBackup();

    /**
     * Serializes the whole store and atomically replaces the primary document.
     * The previous primary is rotated into the backup only after the new bytes
     * are staged durably.
     *
     * @throws DocumentWriteException if any step fails; the primary is left as it was,
     *         and the backup holds either its old content or that same primary
     */
    void persist(Map<String, PrefValue> state);

    /**
     * Copies the current primary document aside before a migration.
     *
     * @return true if a primary existed and was copied
     * @throws DocumentWriteException if the copy fails
     */
    boolean createPreMigrationBackup();

    /**
     * Puts the primary back exactly as it was before the migration started.
     *
     * @param primaryExisted the value returned by {@link #createPreMigrationBackup()}
     * @throws DocumentWriteException if the primary cannot be restored
     */
    void restorePreMigrationBackup(boolean primaryExisted);

    /**
     * Removes the pre-migration copy once a migration has committed.
     */
    void discardPreMigrationBackup();

    /**
     * Releases locks and other resources. Idempotent.
     */
    @Override
    void close();
}
