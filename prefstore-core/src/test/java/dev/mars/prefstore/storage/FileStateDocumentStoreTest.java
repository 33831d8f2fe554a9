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

import dev.mars.prefstore.PrefStoreConfig;
import dev.mars.prefstore.model.KeyCatalog;
import dev.mars.prefstore.model.PrefKey;
import dev.mars.prefstore.model.PrefValue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FileStateDocumentStore}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Atomic replace and backup rotation</li>
 *   <li>The corrupt generation guard</li>
 *   <li>Exclusive locking</li>
 *   <li>Pre-migration backup, restore and discard</li>
 * </ul>
 */
class FileStateDocumentStoreTest {

    private static final PrefKey<String> THEME = PrefKey.string("notchTheme");
    private static final KeyCatalog CATALOG = KeyCatalog.of(THEME);

    @TempDir
    Path tempDir;

    private FileStateDocumentStore store;

    private PrefStoreConfig.Builder configFor(Path dir) {
        return PrefStoreConfig.builder()
                .dataDir(dir)
                .minFreeSpaceMb(0);
    }

    private static Map<String, PrefValue> theme(String value) {
        return Map.of(THEME.id(), THEME.wrap(value));
    }

    @BeforeEach
    void setUp() {
        store = new FileStateDocumentStore(configFor(tempDir).build(), CATALOG);
        store.open();
    }

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    // ========================================================================
    // Write and rotation
    // ========================================================================

    @Nested
    @DisplayName("Atomic write and backup rotation")
    class Rotation {

        @Test
        void testFirstWrite_NoBackupYet() {
            store.persist(theme("light"));

            assertEquals(theme("light"), store.readPrimary());
            assertFalse(Files.exists(store.backupPath()));
        }

        @Test
        void testSecondWrite_PreviousGenerationBecomesBackup() {
            store.persist(theme("light"));
            store.persist(theme("dark"));

            assertEquals(theme("dark"), store.readPrimary());
            assertEquals(theme("light"), store.readBackup());
        }

        @Test
        void testNoTempFilesLeftBehind() throws IOException {
            store.persist(theme("light"));
            store.persist(theme("dark"));

            try (Stream<Path> files = Files.list(tempDir)) {
                assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
            }
        }

        @Test
        void testVerifiedWrite() {
            store.close();
            store = new FileStateDocumentStore(configFor(tempDir).verifyWrites(true).build(), CATALOG);
            store.open();

            store.persist(theme("verified"));
            assertEquals(theme("verified"), store.readPrimary());
        }

        @Test
        void testFailedStaging_LeavesBothGenerationsUntouched() throws IOException {
            store.persist(theme("light"));
            store.persist(theme("dark"));
            byte[] primaryBefore = Files.readAllBytes(store.primaryPath());
            byte[] backupBefore = Files.readAllBytes(store.backupPath());

            // A directory where the temp file goes makes the staging write fail
            Path staging = store.primaryPath().resolveSibling(store.primaryPath().getFileName() + ".tmp");
            Files.createDirectory(staging);

            assertThrows(DocumentWriteException.class, () -> store.persist(theme("solarized")));
            assertArrayEquals(primaryBefore, Files.readAllBytes(store.primaryPath()));
            assertArrayEquals(backupBefore, Files.readAllBytes(store.backupPath()));
            assertEquals(theme("light"), store.readBackup());
        }

        @Test
        void testInsufficientDiskSpace_FailsWithoutTouchingDocuments() throws IOException {
            store.persist(theme("light"));
            byte[] before = Files.readAllBytes(store.primaryPath());
            store.close();

            store = new FileStateDocumentStore(configFor(tempDir).minFreeSpaceMb(Integer.MAX_VALUE).build(), CATALOG);
            store.open();

            assertThrows(DocumentWriteException.class, () -> store.persist(theme("dark")));
            assertArrayEquals(before, Files.readAllBytes(store.primaryPath()));
            assertFalse(Files.exists(store.backupPath()));
        }
    }

    @Nested
    @DisplayName("Corrupt generation guard")
    class CorruptGeneration {

        @Test
        void testCorruptPrimaryIsNotRotatedIntoBackup() throws IOException {
            store.persist(theme("gen1"));
            store.persist(theme("gen2"));
            byte[] goodBackup = Files.readAllBytes(store.backupPath());

            Files.write(store.primaryPath(), "{\"notchTheme\": \"gen".getBytes(StandardCharsets.UTF_8));
            assertThrows(DocumentDecodeException.class, store::readPrimary);

            store.persist(theme("gen3"));

            assertArrayEquals(goodBackup, Files.readAllBytes(store.backupPath()));
            assertEquals(theme("gen3"), store.readPrimary());
        }

        @Test
        void testRotationResumesAfterGoodWrite() throws IOException {
            store.persist(theme("gen1"));
            Files.write(store.primaryPath(), new byte[]{0, 0, 0});
            assertThrows(DocumentDecodeException.class, store::readPrimary);

            store.persist(theme("gen2"));
            store.persist(theme("gen3"));

            assertEquals(theme("gen2"), store.readBackup());
        }

        @Test
        void testMissingPrimary_ReportedAsMissing() {
            DocumentDecodeException e = assertThrows(DocumentDecodeException.class, store::readPrimary);
            assertTrue(e.isMissing());
        }

        @Test
        void testGarbagePrimary_NotReportedAsMissing() throws IOException {
            Files.write(store.primaryPath(), "not json".getBytes(StandardCharsets.UTF_8));

            DocumentDecodeException e = assertThrows(DocumentDecodeException.class, store::readPrimary);
            assertFalse(e.isMissing());
        }
    }

    // ========================================================================
    // Lifecycle and locking
    // ========================================================================

    @Nested
    @DisplayName("Lifecycle and locking")
    class Lifecycle {

        @Test
        void testSecondInstanceCannotOpenSameDirectory() {
            FileStateDocumentStore second = new FileStateDocumentStore(configFor(tempDir).build(), CATALOG);

            assertThrows(StoreException.class, second::open);
            second.close();
        }

        @Test
        void testLockReleasedOnClose() {
            store.close();

            FileStateDocumentStore second = new FileStateDocumentStore(configFor(tempDir).build(), CATALOG);
            assertDoesNotThrow(second::open);
            second.close();
        }

        @Test
        void testPersistBeforeOpen_Throws() {
            FileStateDocumentStore unopened = new FileStateDocumentStore(
                    configFor(tempDir.resolve("other")).build(), CATALOG);

            assertThrows(IllegalStateException.class, () -> unopened.persist(theme("x")));
        }

        @Test
        void testPersistAfterClose_Throws() {
            store.close();

            assertThrows(IllegalStateException.class, () -> store.persist(theme("x")));
        }

        @Test
        void testOpenCreatesDirectoryAndRemovesStaleTempFiles() throws IOException {
            Path dir = tempDir.resolve("nested").resolve("data");
            Files.createDirectories(dir);
            Path stale = dir.resolve("state.json.tmp");
            Files.write(stale, "half a document".getBytes(StandardCharsets.UTF_8));

            FileStateDocumentStore other = new FileStateDocumentStore(configFor(dir).build(), CATALOG);
            other.open();
            try {
                assertFalse(Files.exists(stale));
                assertTrue(Files.exists(dir.resolve("prefstore.lock")));
            } finally {
                other.close();
            }
        }

        @Test
        void testCloseIsIdempotent() {
            store.close();
            assertDoesNotThrow(store::close);
        }
    }

    // ========================================================================
    // Pre-migration backup
    // ========================================================================

    @Nested
    @DisplayName("Pre-migration backup")
    class PreMigration {

        @Test
        void testNoPrimary_NothingToBackUp() {
            assertFalse(store.createPreMigrationBackup());
            assertFalse(Files.exists(store.preMigrationPath()));
        }

        @Test
        void testRestore_PrimaryByteIdentical() throws IOException {
            store.persist(theme("before"));
            byte[] original = Files.readAllBytes(store.primaryPath());

            assertTrue(store.createPreMigrationBackup());
            store.persist(theme("migrated"));
            store.restorePreMigrationBackup(true);

            assertArrayEquals(original, Files.readAllBytes(store.primaryPath()));
            assertFalse(Files.exists(store.preMigrationPath()));
        }

        @Test
        void testRestore_NoPriorPrimaryRemovesWrittenDocument() {
            assertFalse(store.createPreMigrationBackup());
            store.persist(theme("migrated"));

            store.restorePreMigrationBackup(false);

            assertFalse(Files.exists(store.primaryPath()));
        }

        @Test
        void testDiscard() {
            store.persist(theme("before"));
            assertTrue(store.createPreMigrationBackup());

            store.discardPreMigrationBackup();

            assertFalse(Files.exists(store.preMigrationPath()));
            assertEquals(theme("before"), store.readPrimary());
        }
    }
}
