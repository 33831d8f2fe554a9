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
/**
 * Durability layer: one JSON document on disk, written atomically, with a
 * rotating backup.
 * <p>
 * <ul>
 *   <li>{@link dev.mars.prefstore.storage.StateDocumentStore} - The storage interface</li>
 *   <li>{@link dev.mars.prefstore.storage.FileStateDocumentStore} - File-based implementation</li>
 *   <li>{@link dev.mars.prefstore.storage.StateDocumentCodec} - JSON encoding of the store</li>
 *   <li>{@link dev.mars.prefstore.storage.StateRecovery} - Primary → backup → empty loading</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Atomic replace:</b> a reader sees the old document or the new one, never a mix</li>
 *   <li><b>One good generation:</b> the backup always holds the last document that decoded</li>
 *   <li><b>Never fail to start:</b> unreadable documents degrade to an older or empty state</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * data/
 *  ├─ prefstore.lock             // exclusive process lock
 *  ├─ state.json                 // primary document
 *  ├─ state.json.backup          // previous primary
 *  └─ state.json.pre-migration   // only while a migration is in flight
 * </pre>
 *
 * @see dev.mars.prefstore.storage.StateDocumentStore
 */
package dev.mars.prefstore.storage;
