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
package dev.mars.prefstore.demo;

import dev.mars.prefstore.PrefStoreConfig;
import dev.mars.prefstore.migration.MigrationEngine;
import dev.mars.prefstore.migration.MigrationOutcome;
import dev.mars.prefstore.migration.PropertiesLegacyStore;
import dev.mars.prefstore.migration.StandardMigrationTable;
import dev.mars.prefstore.model.KeyCatalog;
import dev.mars.prefstore.model.PrefKey;
import dev.mars.prefstore.model.PrefValue;
import dev.mars.prefstore.model.StandardKeys;
import dev.mars.prefstore.storage.DocumentWriteException;
import dev.mars.prefstore.storage.FileStateDocumentStore;
import dev.mars.prefstore.storage.RecoveredState;
import dev.mars.prefstore.storage.StateDocumentStore;
import dev.mars.prefstore.store.PreferenceStore;
import dev.mars.prefstore.store.StoreStats;
import dev.mars.prefstore.store.WritePriority;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Chaos testing for the preference store.
 * <p>
 * Throws the scenarios a desktop shell actually meets at the store:
 * <ul>
 *   <li>Concurrent writer storms from many UI threads</li>
 *   <li>Rapid open/close cycles</li>
 *   <li>Torn primary documents (power loss mid-write)</li>
 *   <li>Garbage in both generations</li>
 *   <li>A migration whose write fails</li>
 *   <li>Debounce bursts</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build
 * mvn package -pl prefstore-demo -am
 *
 * # Run all chaos tests
 * java -cp prefstore-demo/target/prefstore-demo-1.0-SNAPSHOT.jar dev.mars.prefstore.demo.StoreChaos
 *
 * # Run specific group
 * java -cp prefstore-demo/target/prefstore-demo-1.0-SNAPSHOT.jar dev.mars.prefstore.demo.StoreChaos concurrent
 * java -cp prefstore-demo/target/prefstore-demo-1.0-SNAPSHOT.jar dev.mars.prefstore.demo.StoreChaos corruption
 * java -cp prefstore-demo/target/prefstore-demo-1.0-SNAPSHOT.jar dev.mars.prefstore.demo.StoreChaos migration
 * java -cp prefstore-demo/target/prefstore-demo-1.0-SNAPSHOT.jar dev.mars.prefstore.demo.StoreChaos debounce
 * </pre>
 *
 * @see PreferenceStore
 */
public class StoreChaos {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final Path baseDir;
    private final AtomicInteger testsPassed = new AtomicInteger(0);
    private final AtomicInteger testsFailed = new AtomicInteger(0);

    public StoreChaos(Path baseDir) {
        this.baseDir = baseDir;
    }

    public static void main(String[] args) throws Exception {
        System.out.println("╔═══════════════════════════════════════════════════════════════╗");
        System.out.println("║           PREFERENCE STORE CHAOS TESTING SUITE                ║");
        System.out.println("╚═══════════════════════════════════════════════════════════════╝");
        System.out.println();

        Path chaosDir = Files.createTempDirectory("prefstore-chaos-");
        System.out.println("Chaos directory: " + chaosDir.toAbsolutePath());
        System.out.println();

        StoreChaos chaos = new StoreChaos(chaosDir);

        String testFilter = args.length > 0 ? args[0].toLowerCase() : "all";

        try {
            switch (testFilter) {
                case "concurrent" -> chaos.runConcurrencyTests();
                case "corruption" -> chaos.runCorruptionTests();
                case "migration" -> chaos.runMigrationTests();
                case "debounce" -> chaos.runDebounceTests();
                case "all" -> {
                    chaos.runConcurrencyTests();
                    chaos.runCorruptionTests();
                    chaos.runMigrationTests();
                    chaos.runDebounceTests();
                }
                default -> {
                    System.err.println("Unknown test filter: " + testFilter);
                    System.err.println("Available: concurrent, corruption, migration, debounce, all");
                    System.exit(1);
                }
            }
        } finally {
            System.out.println();
            System.out.println("╔═══════════════════════════════════════════════════════════════╗");
            System.out.printf("║  RESULTS: %d passed, %d failed                                 ║%n",
                    chaos.testsPassed.get(), chaos.testsFailed.get());
            System.out.println("╚═══════════════════════════════════════════════════════════════╝");

            deleteRecursively(chaosDir);
        }

        System.exit(chaos.testsFailed.get() > 0 ? 1 : 0);
    }

    // =========================================================================
    // CONCURRENCY CHAOS
    // =========================================================================

    private void runConcurrencyTests() throws Exception {
        printSection("CONCURRENCY CHAOS");

        chaosTest("Concurrent Writer Storm (20 threads × 100 sets)", this::concurrentWriterStorm);
        chaosTest("Mixed Critical and Deferred Writers", this::mixedPriorityWriters);
        chaosTest("Rapid Open/Close Cycles", this::rapidOpenCloseCycles);
    }

    private void concurrentWriterStorm() throws Exception {
        PrefStoreConfig config = configFor(createTestDir("writer-storm"), 50);

        int numThreads = 20;
        int setsPerThread = 100;
        AtomicInteger errorCount = new AtomicInteger(0);

        try (PreferenceStore store = new PreferenceStore(config)) {
            store.open().join();
            runConcurrently(numThreads, threadId -> {
                for (int i = 0; i < setsPerThread; i++) {
                    store.set(PrefKey.string("storm." + threadId + "." + i), "Thread" + threadId + "-Set" + i);
                }
            }, errorCount);
        }

        if (errorCount.get() > 0) {
            throw new AssertionError(errorCount.get() + " writer threads failed");
        }

        try (PreferenceStore store = new PreferenceStore(config)) {
            store.open().join();
            Map<String, PrefValue> snapshot = store.snapshot();
            int expected = numThreads * setsPerThread;
            if (snapshot.size() != expected) {
                throw new AssertionError("Expected " + expected + " keys after reopen, got " + snapshot.size());
            }
            for (Map.Entry<String, PrefValue> e : snapshot.entrySet()) {
                String value = (String) e.getValue().raw();
                if (!value.matches("Thread\\d+-Set\\d+")) {
                    throw new AssertionError("Corrupt value under " + e.getKey() + ": " + value);
                }
            }
        }
    }

    private void mixedPriorityWriters() throws Exception {
        PrefStoreConfig config = configFor(createTestDir("mixed-priority"), 20);
        AtomicInteger errorCount = new AtomicInteger(0);
        StoreStats stats;

        try (PreferenceStore store = new PreferenceStore(config)) {
            store.open().join();
            runConcurrently(10, threadId -> {
                for (int i = 0; i < 50; i++) {
                    if (threadId % 2 == 0) {
                        store.set(StandardKeys.SEEN_TIP_IDS, List.of("t" + threadId + "-" + i));
                    } else {
                        byte[] payload = ("note " + threadId + "/" + i).getBytes(StandardCharsets.UTF_8);
                        store.set(StandardKeys.QUICK_NOTES, payload, WritePriority.CRITICAL);
                    }
                }
            }, errorCount);
            stats = store.stats();
        }

        if (errorCount.get() > 0) {
            throw new AssertionError(errorCount.get() + " writer threads failed");
        }
        if (stats.durableWrites() < 250) {
            throw new AssertionError("Every critical set must be written, got " + stats.durableWrites() + " writes");
        }
        if (stats.failedWrites() != 0) {
            throw new AssertionError(stats.failedWrites() + " writes failed");
        }
    }

    private void rapidOpenCloseCycles() throws Exception {
        PrefStoreConfig config = configFor(createTestDir("open-close"), 10);

        for (int cycle = 0; cycle < 50; cycle++) {
            try (PreferenceStore store = new PreferenceStore(config)) {
                store.open().join();
                List<String> seen = store.stringList(StandardKeys.SEEN_TIP_IDS);
                if (seen.size() != cycle) {
                    throw new AssertionError("Cycle " + cycle + ": expected " + cycle + " tips, got " + seen.size());
                }
                List<String> next = new ArrayList<>(seen);
                next.add("tip-" + cycle);
                store.set(StandardKeys.SEEN_TIP_IDS, next);
            }
        }
    }

    // =========================================================================
    // CORRUPTION CHAOS
    // =========================================================================

    private void runCorruptionTests() throws Exception {
        printSection("CORRUPTION CHAOS");

        chaosTest("Torn Primary at Random Offsets (100 cuts)", this::tornPrimaryAtRandomOffsets);
        chaosTest("Random Garbage in Primary", this::garbagePrimary);
        chaosTest("Garbage in Primary and Backup", this::garbageEverywhere);
        chaosTest("Corrupt Primary Never Replaces Backup", this::corruptPrimaryKeepsBackup);
    }

    private void tornPrimaryAtRandomOffsets() throws Exception {
        PrefStoreConfig config = configFor(createTestDir("torn"), 10);
        writeGenerations(config, "older", "newer");
        byte[] full = Files.readAllBytes(config.documentPath());
        byte[] backup = Files.readAllBytes(backupOf(config));

        for (int i = 0; i < 100; i++) {
            int cut = SECURE_RANDOM.nextInt(full.length);
            Files.write(config.documentPath(), Arrays.copyOf(full, cut));
            Files.write(backupOf(config), backup);

            try (PreferenceStore store = new PreferenceStore(config)) {
                store.open().join();
                expectSource(store, RecoveredState.Source.BACKUP);
                String theme = store.string(StandardKeys.THEME, "none");
                if (!"older".equals(theme)) {
                    throw new AssertionError("Cut at " + cut + ": expected backup theme, got " + theme);
                }
            }
        }
    }

    private void garbagePrimary() throws Exception {
        PrefStoreConfig config = configFor(createTestDir("garbage-primary"), 10);
        writeGenerations(config, "older", "newer");

        byte[] garbage = new byte[4096];
        SECURE_RANDOM.nextBytes(garbage);
        Files.write(config.documentPath(), garbage);

        try (PreferenceStore store = new PreferenceStore(config)) {
            store.open().join();
            expectSource(store, RecoveredState.Source.BACKUP);
        }
    }

    private void garbageEverywhere() throws Exception {
        PrefStoreConfig config = configFor(createTestDir("garbage-both"), 10);
        writeGenerations(config, "older", "newer");
        Files.write(config.documentPath(), "{\"notchTheme\": ".getBytes(StandardCharsets.UTF_8));
        Files.write(backupOf(config), new byte[]{(byte) 0xFF, (byte) 0xFE, 0});

        try (PreferenceStore store = new PreferenceStore(config)) {
            store.open().join();
            expectSource(store, RecoveredState.Source.EMPTY);
            if (!store.snapshot().isEmpty()) {
                throw new AssertionError("Expected empty store");
            }
            store.set(StandardKeys.THEME, "fresh", WritePriority.CRITICAL);
        }

        try (PreferenceStore store = new PreferenceStore(config)) {
            store.open().join();
            expectSource(store, RecoveredState.Source.PRIMARY);
        }
    }

    private void corruptPrimaryKeepsBackup() throws Exception {
        PrefStoreConfig config = configFor(createTestDir("corrupt-guard"), 10);
        writeGenerations(config, "older", "newer");
        byte[] goodBackup = Files.readAllBytes(backupOf(config));
        Files.write(config.documentPath(), "###".getBytes(StandardCharsets.UTF_8));

        try (PreferenceStore store = new PreferenceStore(config)) {
            store.open().join();
            store.set(StandardKeys.THEME, "after-recovery", WritePriority.CRITICAL);
        }

        if (!Arrays.equals(goodBackup, Files.readAllBytes(backupOf(config)))) {
            throw new AssertionError("Backup was replaced by a corrupt generation");
        }
    }

    // =========================================================================
    // MIGRATION CHAOS
    // =========================================================================

    private void runMigrationTests() throws Exception {
        printSection("MIGRATION CHAOS");

        chaosTest("Failing Migration Write Rolls Back", this::failingMigrationWrite);
        chaosTest("Migration Retries After Failure", this::migrationRetry);
    }

    private void failingMigrationWrite() throws Exception {
        Path dir = createTestDir("migration-fail");
        PrefStoreConfig config = migrationConfig(dir);
        writeGenerations(config, "older", "before-migration");
        byte[] before = Files.readAllBytes(config.documentPath());

        KeyCatalog catalog = StandardKeys.catalog();
        StateDocumentStore failing = new FailingDocumentStore(new FileStateDocumentStore(config, catalog));
        MigrationEngine migration = new MigrationEngine(new PropertiesLegacyStore(config.legacyFile()),
                StandardMigrationTable.entries(), config.migrationFlagKey());

        PreferenceStore store = new PreferenceStore(config, catalog, failing, migration, Clock.systemUTC());
        try {
            store.open().join();
            MigrationOutcome outcome = store.migrationOutcome().orElseThrow();
            if (!outcome.rolledBack()) {
                throw new AssertionError("Expected rollback, got " + outcome.phase());
            }
            if (!"before-migration".equals(store.string(StandardKeys.THEME, "none"))) {
                throw new AssertionError("Live store not restored");
            }
        } finally {
            store.close();
        }

        if (!Arrays.equals(before, Files.readAllBytes(config.documentPath()))) {
            throw new AssertionError("Primary document changed by failed migration");
        }
        if (new PropertiesLegacyStore(config.legacyFile()).readFlag(config.migrationFlagKey())) {
            throw new AssertionError("Flag set despite rollback");
        }
    }

    private void migrationRetry() throws Exception {
        Path dir = createTestDir("migration-retry");
        PrefStoreConfig config = migrationConfig(dir);

        KeyCatalog catalog = StandardKeys.catalog();
        MigrationEngine first = new MigrationEngine(new PropertiesLegacyStore(config.legacyFile()),
                StandardMigrationTable.entries(), config.migrationFlagKey());
        try (PreferenceStore store = new PreferenceStore(config, catalog,
                new FailingDocumentStore(new FileStateDocumentStore(config, catalog)), first, Clock.systemUTC())) {
            store.open().join();
        }

        try (PreferenceStore store = PreferenceStore.standard(config)) {
            store.open().join();
            if (!store.migrationOutcome().orElseThrow().committed()) {
                throw new AssertionError("Retry did not commit");
            }
            if (store.bool(StandardKeys.HAPTIC_ENABLED, true)) {
                throw new AssertionError("Legacy value not imported on retry");
            }
        }
    }

    // =========================================================================
    // DEBOUNCE CHAOS
    // =========================================================================

    private void runDebounceTests() throws Exception {
        printSection("DEBOUNCE CHAOS");

        chaosTest("Burst of 1000 Deferred Sets", this::deferredBurst);
    }

    private void deferredBurst() throws Exception {
        PrefStoreConfig config = configFor(createTestDir("burst"), 200);

        try (PreferenceStore store = new PreferenceStore(config)) {
            store.open().join();
            for (int i = 0; i < 1000; i++) {
                store.set(StandardKeys.LIQUID_GLASS, i % 2 == 0);
            }
            Thread.sleep(1000);
            StoreStats stats = store.stats();
            if (stats.durableWrites() > 5) {
                throw new AssertionError("Burst not coalesced: " + stats.durableWrites() + " writes");
            }
            if (stats.coalescedWrites() < 995) {
                throw new AssertionError("Expected the burst to coalesce, got " + stats);
            }
        }
    }

    // =========================================================================
    // UTILITIES
    // =========================================================================

    /**
     * Passes every write through until a migration is in flight, then fails it.
     */
    private static final class FailingDocumentStore implements StateDocumentStore {

        private final StateDocumentStore delegate;
        private boolean migrating = false;

        FailingDocumentStore(StateDocumentStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public void open() {
            delegate.open();
        }

        @Override
        public Map<String, PrefValue> readPrimary() {
            return delegate.readPrimary();
        }

        @Override
        public Map<String, PrefValue> readBackup() {
            return delegate.readBackup();
        }

        @Override
        public void persist(Map<String, PrefValue> state) {
            if (migrating) {
                throw new DocumentWriteException("Chaos: disk vanished during migration");
            }
            delegate.persist(state);
        }

        @Override
        public boolean createPreMigrationBackup() {
            migrating = true;
            return delegate.createPreMigrationBackup();
        }

        @Override
        public void restorePreMigrationBackup(boolean primaryExisted) {
            migrating = false;
            delegate.restorePreMigrationBackup(primaryExisted);
        }

        @Override
        public void discardPreMigrationBackup() {
            migrating = false;
            delegate.discardPreMigrationBackup();
        }

        @Override
        public void close() {
            delegate.close();
        }
    }

    @FunctionalInterface
    interface ChaosTestRunnable {
        void run() throws Exception;
    }

    @FunctionalInterface
    interface ThreadBody {
        void run(int threadId) throws Exception;
    }

    private PrefStoreConfig configFor(Path dir, int debounceMillis) {
        return PrefStoreConfig.builder()
                .dataDir(dir)
                .debounceMillis(debounceMillis)
                .syncEnabled(false) // Speed up test
                .minFreeSpaceMb(0)
                .legacyFile(dir.resolve("no-legacy.properties"))
                .build();
    }

    private PrefStoreConfig migrationConfig(Path dir) throws IOException {
        Path legacy = dir.resolve("legacy.properties");
        Files.write(legacy, String.join("\n",
                "hapticEnabled=false",
                "excluded_apps=[\"com.example.Player\"]").getBytes(StandardCharsets.ISO_8859_1));
        return PrefStoreConfig.builder()
                .dataDir(dir.resolve("data"))
                .syncEnabled(false)
                .minFreeSpaceMb(0)
                .legacyFile(legacy)
                .build();
    }

    /** Leaves {@code older} as the backup theme and {@code newer} as the primary one. */
    private static void writeGenerations(PrefStoreConfig config, String older, String newer) {
        try (PreferenceStore store = new PreferenceStore(config)) {
            store.open().join();
            store.set(StandardKeys.THEME, older, WritePriority.CRITICAL);
            store.set(StandardKeys.THEME, newer, WritePriority.CRITICAL);
        }
    }

    private static Path backupOf(PrefStoreConfig config) {
        return config.documentPath().resolveSibling(config.documentName() + ".backup");
    }

    private static void expectSource(PreferenceStore store, RecoveredState.Source expected) {
        RecoveredState.Source actual = store.recoverySource().orElseThrow();
        if (actual != expected) {
            throw new AssertionError("Expected state from " + expected + ", got " + actual);
        }
    }

    private static void runConcurrently(int numThreads, ThreadBody body, AtomicInteger errorCount)
            throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);

        for (int t = 0; t < numThreads; t++) {
            final int threadId = t;
            executor.submit(() -> {
                try {
                    startLatch.await(); // All threads start together
                    body.run(threadId);
                } catch (Exception e) {
                    errorCount.incrementAndGet();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        doneLatch.await(60, TimeUnit.SECONDS);
        executor.shutdown();
    }

    private void printSection(String name) {
        System.out.println();
        System.out.println("┌───────────────────────────────────────────────────────────────┐");
        System.out.printf("│  %-61s │%n", name);
        System.out.println("└───────────────────────────────────────────────────────────────┘");
    }

    private void chaosTest(String name, ChaosTestRunnable test) {
        System.out.printf("  %-50s ", name);
        try {
            test.run();
            System.out.println("[PASS]");
            testsPassed.incrementAndGet();
        } catch (Throwable e) {
            System.out.println("[FAIL]");
            System.err.println("    Error: " + e.getMessage());
            e.printStackTrace(System.err);
            testsFailed.incrementAndGet();
        }
    }

    private Path createTestDir(String name) throws IOException {
        Path dir = baseDir.resolve(name + "-" + System.nanoTime());
        Files.createDirectories(dir);
        return dir;
    }

    private static void deleteRecursively(Path path) {
        try {
            if (Files.isDirectory(path)) {
                try (var stream = Files.list(path)) {
                    stream.forEach(StoreChaos::deleteRecursively);
                }
            }
            Files.deleteIfExists(path);
        } catch (IOException e) {
            System.err.println("Could not clean up " + path + ": " + e.getMessage());
        }
    }
}
