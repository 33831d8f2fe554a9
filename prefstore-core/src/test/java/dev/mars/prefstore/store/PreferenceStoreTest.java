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
package dev.mars.prefstore.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.prefstore.PrefStoreConfig;
import dev.mars.prefstore.model.KeyCatalog;
import dev.mars.prefstore.model.PrefKey;
import dev.mars.prefstore.model.PrefValue;
import dev.mars.prefstore.model.StandardKeys;
import dev.mars.prefstore.storage.FileStateDocumentStore;
import dev.mars.prefstore.storage.InstrumentedDocumentStore;
import dev.mars.prefstore.storage.RecoveredState;
import dev.mars.prefstore.storage.StateDocumentCodec;
import dev.mars.prefstore.storage.StoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link PreferenceStore}.
 * <p>
 * The debounce delay is long here so deferred writes only reach disk
 * through {@code flush()} or {@code close()}; timing behaviour is covered
 * by {@link DebounceCoalescingTest}.
 */
class PreferenceStoreTest {

    private static final int LONG_DEBOUNCE_MILLIS = 60_000;

    @TempDir
    Path tempDir;

    private PreferenceStore store;
    private InstrumentedDocumentStore documents;

    private PrefStoreConfig config() {
        return PrefStoreConfig.builder()
                .dataDir(tempDir)
                .debounceMillis(LONG_DEBOUNCE_MILLIS)
                .syncEnabled(false)
                .minFreeSpaceMb(0)
                .build();
    }

    private PreferenceStore newStore(KeyCatalog catalog) {
        PrefStoreConfig config = config();
        documents = new InstrumentedDocumentStore(new FileStateDocumentStore(config, catalog));
        return new PreferenceStore(config, catalog, documents, null, Clock.systemUTC());
    }

    private PreferenceStore reopen() throws Exception {
        store.close();
        store = newStore(StandardKeys.catalog());
        store.open().get(5, TimeUnit.SECONDS);
        return store;
    }

    /** Decodes the primary document straight from disk. */
    private Map<String, PrefValue> primaryOnDisk() throws Exception {
        byte[] bytes = Files.readAllBytes(config().documentPath());
        return new StateDocumentCodec(StandardKeys.catalog()).decode(bytes);
    }

    @BeforeEach
    void setUp() throws Exception {
        store = newStore(StandardKeys.catalog());
        store.open().get(5, TimeUnit.SECONDS);
    }

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    // ========================================================================
    // Reads and writes
    // ========================================================================

    @Nested
    @DisplayName("Typed access")
    class TypedAccess {

        @Test
        void testEveryTypeSurvivesRestart() throws Exception {
            store.set(StandardKeys.HAPTIC_ENABLED, false);
            store.set(StandardKeys.THEME, "midnight");
            store.set(StandardKeys.EXCLUDED_APPS, List.of("com.example.Zed", "com.example.Alpha"));
            store.set(StandardKeys.MENU_BAR_REDUNDANCIES, Map.of("clock", true, "wifi", false));
            store.setEncoded(StandardKeys.VAULT_ITEMS, new byte[]{1, 2, 3});

            reopen();

            assertFalse(store.bool(StandardKeys.HAPTIC_ENABLED, true));
            assertEquals("midnight", store.string(StandardKeys.THEME, "system"));
            assertEquals(List.of("com.example.Zed", "com.example.Alpha"), store.stringList(StandardKeys.EXCLUDED_APPS));
            assertEquals(Map.of("clock", true, "wifi", false), store.boolMap(StandardKeys.MENU_BAR_REDUNDANCIES));
            assertArrayEquals(new byte[]{1, 2, 3}, store.getEncoded(StandardKeys.VAULT_ITEMS).orElseThrow());
            assertEquals(RecoveredState.Source.PRIMARY, store.recoverySource().orElseThrow());
        }

        @Test
        void testAbsentKeys_ReadAsDefaults() {
            assertTrue(store.get(StandardKeys.THEME).isEmpty());
            assertTrue(store.bool(StandardKeys.CHAMELEON_ENABLED, true));
            assertEquals("system", store.string(StandardKeys.THEME, "system"));
            assertEquals(List.of(), store.stringList(StandardKeys.SEEN_TIP_IDS));
            assertEquals(Map.of(), store.boolMap(StandardKeys.MENU_BAR_REDUNDANCIES));
            assertTrue(store.getEncoded(StandardKeys.QUICK_NOTES).isEmpty());
        }

        @Test
        void testFirstStart_RecoveredFromNothing() {
            assertEquals(RecoveredState.Source.EMPTY, store.recoverySource().orElseThrow());
            assertTrue(store.migrationOutcome().isEmpty());
        }

        @Test
        void testNullRemoves() {
            store.set(StandardKeys.THEME, "dark");
            store.set(StandardKeys.THEME, null);

            assertTrue(store.get(StandardKeys.THEME).isEmpty());
            assertFalse(store.snapshot().containsKey(StandardKeys.THEME.id()));
        }

        @Test
        void testRemove_Critical() throws Exception {
            store.set(StandardKeys.THEME, "dark", WritePriority.CRITICAL);
            store.remove(StandardKeys.THEME, WritePriority.CRITICAL);

            assertFalse(primaryOnDisk().containsKey(StandardKeys.THEME.id()));
        }

        @Test
        void testKeyOfConflictingType_Rejected() {
            PrefKey<Boolean> wrong = PrefKey.bool(StandardKeys.THEME.id());

            assertThrows(IllegalArgumentException.class, () -> store.set(wrong, true));
            assertThrows(IllegalArgumentException.class, () -> store.get(wrong));
        }

        @Test
        void testUndeclaredBlobKey_Rejected() {
            PrefKey<byte[]> custom = PrefKey.blob("custom_payload");

            assertThrows(IllegalArgumentException.class, () -> store.setEncoded(custom, new byte[]{1, 2, 3}));
            assertThrows(IllegalArgumentException.class, () -> store.getEncoded(custom));
            assertThrows(IllegalArgumentException.class, () -> store.setObject(custom, List.of("x")));
            assertFalse(store.snapshot().containsKey("custom_payload"));
            assertEquals(0, documents.persistCalls());
        }

        @Test
        void testUndeclaredKeys_KeepTheirTypeAcrossRestart() throws Exception {
            PrefKey<Boolean> flag = PrefKey.bool("custom.flag");
            PrefKey<String> label = PrefKey.string("custom.label");
            PrefKey<List<String>> tags = PrefKey.stringList("custom.tags");
            PrefKey<Map<String, Boolean>> toggles = PrefKey.boolMap("custom.toggles");
            store.set(flag, true);
            store.set(label, "AQID");
            store.set(tags, List.of());
            store.set(toggles, Map.of("a", false));

            reopen();

            assertEquals(Boolean.TRUE, store.get(flag).orElseThrow());
            assertEquals("AQID", store.get(label).orElseThrow());
            assertEquals(List.of(), store.get(tags).orElseThrow());
            assertEquals(Map.of("a", false), store.get(toggles).orElseThrow());
        }

        @Test
        void testStoredVariantMismatch_ReadsEmpty() throws Exception {
            store.close();
            store = newStore(KeyCatalog.empty());
            store.open().get(5, TimeUnit.SECONDS);

            store.set(PrefKey.string("shared"), "text");

            assertTrue(store.get(PrefKey.bool("shared")).isEmpty());
            assertEquals(Map.of(), store.boolMap(PrefKey.boolMap("shared")));
            assertEquals("text", store.string(PrefKey.string("shared"), "none"));
        }

        @Test
        void testSnapshotIsImmutableCopy() {
            store.set(StandardKeys.THEME, "dark");
            Map<String, PrefValue> snapshot = store.snapshot();
            store.set(StandardKeys.THEME, "light");

            assertEquals(StandardKeys.THEME.wrap("dark"), snapshot.get(StandardKeys.THEME.id()));
            assertThrows(UnsupportedOperationException.class, () -> snapshot.clear());
        }

        @Test
        void testConcurrentCallers_AllWritesApplied() throws Exception {
            int threads = 8;
            int perThread = 100;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int t = 0; t < threads; t++) {
                    int thread = t;
                    futures.add(pool.submit(() -> {
                        for (int i = 0; i < perThread; i++) {
                            store.set(PrefKey.string("load." + thread + "." + i), "v" + i);
                        }
                    }));
                }
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(threads * perThread, store.snapshot().size());
            store.flush();
            assertEquals(threads * perThread, primaryOnDisk().size());
        }
    }

    // ========================================================================
    // Durability
    // ========================================================================

    @Nested
    @DisplayName("Write priorities")
    class Priorities {

        @Test
        void testCriticalWrite_DurableBeforeReturn() throws Exception {
            byte[] payload = "[{\"id\":1}]".getBytes(StandardCharsets.UTF_8);

            store.setEncoded(StandardKeys.VAULT_ITEMS, payload);

            assertEquals(1, documents.persistCalls());
            PrefValue onDisk = primaryOnDisk().get(StandardKeys.VAULT_ITEMS.id());
            assertEquals(new PrefValue.BlobValue(payload), onDisk);
            assertEquals(WriteScheduler.Phase.IDLE, store.pendingPhase());
        }

        @Test
        void testCriticalApiKey_OnDiskWhenSetReturns() throws Exception {
            store.set(StandardKeys.RELAY_API_KEY, "abc123", WritePriority.CRITICAL);

            JsonNode document = new ObjectMapper().readTree(config().documentPath().toFile());
            assertEquals("abc123", document.path(StandardKeys.RELAY_API_KEY.id()).textValue());
        }

        @Test
        void testRepeatedSet_SameDocumentBytes() throws Exception {
            store.set(StandardKeys.THEME, "dark");
            store.set(StandardKeys.EXCLUDED_APPS, List.of("com.example.Zed"));
            store.flush();
            byte[] once = Files.readAllBytes(config().documentPath());

            store.set(StandardKeys.THEME, "dark");
            store.set(StandardKeys.EXCLUDED_APPS, List.of("com.example.Zed"));
            store.flush();
            byte[] twice = Files.readAllBytes(config().documentPath());

            store.set(StandardKeys.THEME, "dark", WritePriority.CRITICAL);
            byte[] critical = Files.readAllBytes(config().documentPath());

            assertArrayEquals(once, twice);
            assertArrayEquals(once, critical);
        }

        @Test
        void testDeferredWrite_WaitsForQuietPeriod() {
            store.set(StandardKeys.THEME, "dark");

            assertEquals(0, documents.persistCalls());
            assertEquals(WriteScheduler.Phase.SCHEDULED, store.pendingPhase());
            assertEquals("dark", store.string(StandardKeys.THEME, "system"));
        }

        @Test
        void testCriticalWrite_AbsorbsPendingDeferredChange() throws Exception {
            store.set(StandardKeys.THEME, "dark");
            store.setEncoded(StandardKeys.QUICK_NOTES, new byte[]{42});

            assertEquals(1, documents.persistCalls());
            assertEquals(WriteScheduler.Phase.IDLE, store.pendingPhase());
            assertEquals(StandardKeys.THEME.wrap("dark"), primaryOnDisk().get(StandardKeys.THEME.id()));
        }

        @Test
        void testFlush_WritesPendingChangeOnce() throws Exception {
            store.set(StandardKeys.THEME, "dark");
            store.set(StandardKeys.LIQUID_GLASS, true);

            store.flush();

            assertEquals(1, documents.persistCalls());
            assertEquals(WriteScheduler.Phase.IDLE, store.pendingPhase());
            assertEquals(new StoreStats(1, 0, 1), store.stats());
            assertEquals(2, primaryOnDisk().size());
        }

        @Test
        void testClose_FlushesPendingChange() throws Exception {
            store.set(StandardKeys.THEME, "dark");

            reopen();

            assertEquals("dark", store.string(StandardKeys.THEME, "system"));
        }

        @Test
        void testFailedWrite_StateKeptAndCounted() throws Exception {
            documents.failPersist(true);

            assertDoesNotThrow(() -> store.setEncoded(StandardKeys.VAULT_ITEMS, new byte[]{5}));

            assertEquals(1, store.stats().failedWrites());
            assertEquals(0, store.stats().durableWrites());
            assertArrayEquals(new byte[]{5}, store.getEncoded(StandardKeys.VAULT_ITEMS).orElseThrow());

            documents.failPersist(false);
            store.flush();

            assertEquals(1, store.stats().durableWrites());
            assertEquals(new PrefValue.BlobValue(new byte[]{5}), primaryOnDisk().get(StandardKeys.VAULT_ITEMS.id()));
        }
    }

    // ========================================================================
    // Structured payloads
    // ========================================================================

    public record VaultItem(String title, int order) {
    }

    @Nested
    @DisplayName("Structured payloads")
    class StructuredPayloads {

        @Test
        void testObjectSurvivesRestart() throws Exception {
            List<VaultItem> items = List.of(new VaultItem("passport", 1), new VaultItem("keys", 2));
            store.setObject(StandardKeys.VAULT_ITEMS, items);

            reopen();

            List<VaultItem> loaded = store.getObject(StandardKeys.VAULT_ITEMS,
                    new TypeReference<List<VaultItem>>() { }).orElseThrow();
            assertEquals(items, loaded);
        }

        @Test
        void testSingleObject() {
            store.setObject(StandardKeys.EVOLUTION_GENOME, new VaultItem("genome", 7));

            assertEquals(new VaultItem("genome", 7),
                    store.getObject(StandardKeys.EVOLUTION_GENOME, VaultItem.class).orElseThrow());
        }

        @Test
        void testUndecodablePayload_ReadsEmpty() {
            store.setEncoded(StandardKeys.SCRIPT_HISTORY, "not json".getBytes(StandardCharsets.UTF_8));

            assertTrue(store.getObject(StandardKeys.SCRIPT_HISTORY, VaultItem.class).isEmpty());
        }

        @Test
        void testNullObjectRemoves() {
            store.setObject(StandardKeys.PINNED_APPS, List.of("mail"));
            store.setObject(StandardKeys.PINNED_APPS, null);

            assertTrue(store.getEncoded(StandardKeys.PINNED_APPS).isEmpty());
        }
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        void testUseBeforeOpen_Throws() {
            PreferenceStore unopened = new PreferenceStore(PrefStoreConfig.builder()
                    .dataDir(tempDir.resolve("unopened"))
                    .minFreeSpaceMb(0)
                    .build());
            try {
                assertThrows(IllegalStateException.class, () -> unopened.get(StandardKeys.THEME));
                assertThrows(IllegalStateException.class, () -> unopened.set(StandardKeys.THEME, "x"));
            } finally {
                unopened.close();
            }
        }

        @Test
        void testUseAfterClose_Throws() {
            store.close();

            assertThrows(IllegalStateException.class, () -> store.get(StandardKeys.THEME));
            assertThrows(IllegalStateException.class, store::flush);
            assertTrue(store.open().isCompletedExceptionally());
            assertFalse(store.isOpen());
        }

        @Test
        void testOpenTwice_Harmless() throws Exception {
            store.set(StandardKeys.THEME, "dark");

            store.open().get(5, TimeUnit.SECONDS);

            assertEquals("dark", store.string(StandardKeys.THEME, "system"));
        }

        @Test
        void testSecondStoreOnSameDirectory_FailsToOpen() {
            PreferenceStore second = new PreferenceStore(config());
            try {
                ExecutionException e = assertThrows(ExecutionException.class,
                        () -> second.open().get(5, TimeUnit.SECONDS));
                assertInstanceOf(StoreException.class, e.getCause());
                assertFalse(second.isOpen());
            } finally {
                second.close();
            }
        }

        @Test
        void testCloseIsIdempotent() {
            store.close();
            assertDoesNotThrow(store::close);
        }
    }
}
