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

import com.fasterxml.jackson.core.type.TypeReference;
import dev.mars.prefstore.PrefStoreConfig;
import dev.mars.prefstore.migration.MigrationOutcome;
import dev.mars.prefstore.model.StandardKeys;
import dev.mars.prefstore.store.PreferenceStore;
import dev.mars.prefstore.store.StoreStats;

import java.util.ArrayList;
import java.util.List;

/**
 * Demo entry point for the preference store.
 * <p>
 * This demonstrates:
 * <ul>
 *   <li>Opening the store (recovery plus one-time legacy migration)</li>
 *   <li>Deferred writes for toggles and lists</li>
 *   <li>Critical writes for user data payloads</li>
 *   <li>Reloading everything on the next run</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link PrefStoreConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (data directory only)</li>
 *   <li>System properties: {@code -Dprefstore.dataDir=/path -Dprefstore.debounceMillis=250 ...}</li>
 *   <li>Environment variables: {@code PREFSTORE_DATA_DIR, PREFSTORE_LEGACY_FILE, ...}</li>
 *   <li>Properties file: {@code prefstore.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl prefstore-demo -am
 *
 * # Run with default configuration
 * java -jar prefstore-demo/target/prefstore-demo-1.0-SNAPSHOT.jar
 *
 * # Run with CLI data directory override
 * java -jar prefstore-demo/target/prefstore-demo-1.0-SNAPSHOT.jar /path/to/data
 *
 * # Import from a legacy properties file on first run
 * java -Dprefstore.legacyFile=/path/to/legacy.properties -jar prefstore-demo/target/prefstore-demo-1.0-SNAPSHOT.jar
 * </pre>
 *
 * @see PrefStoreConfig
 */
public class PrefStoreDemo {

    /** Payload stored as a JSON blob under {@link StandardKeys#QUICK_NOTES}. */
    public record QuickNote(String text, long createdAt) {
    }

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|        Preference Store Demo          |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        PrefStoreConfig config = args.length > 0 && !args[0].isBlank()
                ? PrefStoreConfig.builder().dataDir(args[0]).build()
                : PrefStoreConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        try (PreferenceStore prefs = PreferenceStore.standard(config)) {
            prefs.open().join();
            System.out.println("[OK] Store opened at: " + config.documentPath().toAbsolutePath());
            System.out.println("[OK] State loaded from: " + prefs.recoverySource().orElseThrow());

            MigrationOutcome migration = prefs.migrationOutcome().orElseThrow();
            System.out.println("[OK] Legacy migration: " + migration.phase()
                    + (migration.committed() ? " (" + migration.importedKeys() + " keys imported)" : ""));

            // Show current values
            System.out.println("\n  Current preferences:");
            System.out.println("    theme          = " + prefs.string(StandardKeys.THEME, "system"));
            System.out.println("    haptics        = " + prefs.bool(StandardKeys.HAPTIC_ENABLED, true));
            System.out.println("    liquid glass   = " + prefs.bool(StandardKeys.LIQUID_GLASS, false));
            System.out.println("    seen tips      = " + prefs.stringList(StandardKeys.SEEN_TIP_IDS));
            System.out.println("    excluded apps  = " + prefs.stringList(StandardKeys.EXCLUDED_APPS));

            List<QuickNote> notes = new ArrayList<>(prefs.getObject(StandardKeys.QUICK_NOTES,
                    new TypeReference<List<QuickNote>>() { }).orElse(List.of()));
            System.out.println("    quick notes    = " + notes.size());

            // Deferred writes: coalesced into one document write
            List<String> seenTips = new ArrayList<>(prefs.stringList(StandardKeys.SEEN_TIP_IDS));
            seenTips.add("tip-" + (seenTips.size() + 1));
            prefs.set(StandardKeys.SEEN_TIP_IDS, seenTips);
            prefs.set(StandardKeys.LIQUID_GLASS, !prefs.bool(StandardKeys.LIQUID_GLASS, false));
            System.out.println("\n[OK] Deferred writes queued, scheduler is " + prefs.pendingPhase());

            // Critical write: durable before setObject returns
            notes.add(new QuickNote("Run " + (notes.size() + 1), System.currentTimeMillis()));
            prefs.setObject(StandardKeys.QUICK_NOTES, notes);
            System.out.println("[OK] Quick note saved durably, scheduler is " + prefs.pendingPhase());

            // Durability barrier for the deferred changes
            prefs.set(StandardKeys.THEME, "midnight");
            prefs.flush();
            System.out.println("[OK] Flushed, scheduler is " + prefs.pendingPhase());

            StoreStats stats = prefs.stats();
            System.out.println("[OK] Writes so far: durable=" + stats.durableWrites()
                    + ", failed=" + stats.failedWrites() + ", coalesced=" + stats.coalescedWrites());

            System.out.println("\n+---------------------------------------+");
            System.out.println("|  Demo complete!                       |");
            System.out.println("|  Run again to see values reloaded.    |");
            System.out.println("+---------------------------------------+");
        }
    }
}
