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
package dev.mars.prefstore.model;

import java.util.List;
import java.util.Map;

/**
 * Keys used by the desktop shell that embeds this store.
 * <p>
 * Ids are frozen: several of them match the ids the legacy preference store
 * used, which keeps the migration table a straight mapping.
 */
public final class StandardKeys {

    // Core UI
    public static final PrefKey<Boolean> CHAMELEON_ENABLED = PrefKey.bool("chameleonEnabled");
    public static final PrefKey<Boolean> LIQUID_GLASS = PrefKey.bool("liquidGlass");
    public static final PrefKey<String> THEME = PrefKey.string("notchTheme");
    public static final PrefKey<Boolean> HAPTIC_ENABLED = PrefKey.bool("hapticEnabled");

    // Services
    public static final PrefKey<Boolean> GESTURE_EYE_ENABLED = PrefKey.bool("gestureEyeEnabled");
    public static final PrefKey<String> RELAY_BASE_URL = PrefKey.string("notch.relay.base_url");
    public static final PrefKey<String> RELAY_DEVICE_TOKEN = PrefKey.string("notch.relay.device_token");
    public static final PrefKey<String> RELAY_API_KEY = PrefKey.string("notch.relay.api_key");
    public static final PrefKey<String> RESCUE_TIME_API_KEY = PrefKey.string("notch.rescuetime.api_key");

    // Secondary services
    public static final PrefKey<List<String>> EXCLUDED_APPS = PrefKey.stringList("excluded_apps");
    public static final PrefKey<Map<String, Boolean>> MENU_BAR_REDUNDANCIES = PrefKey.boolMap("menubar_redundancies");
    public static final PrefKey<List<String>> SEEN_TIP_IDS = PrefKey.stringList("TipEngine.seenTipIDs");

    // Encoded structured payloads
    public static final PrefKey<byte[]> VAULT_ITEMS = PrefKey.blob("notch_vault_items");
    public static final PrefKey<byte[]> BRAIN_DUMP_ITEMS = PrefKey.blob("braindump_items");
    public static final PrefKey<byte[]> QUICK_NOTES = PrefKey.blob("quicknotes_items");
    public static final PrefKey<byte[]> SCRIPT_HISTORY = PrefKey.blob("script_history");
    public static final PrefKey<byte[]> PINNED_APPS = PrefKey.blob("quicklaunch_pinned");
    public static final PrefKey<byte[]> EVOLUTION_GENOME = PrefKey.blob("evolution_genome");

    // User profile
    public static final PrefKey<String> USER_PROFILE_ACCENT = PrefKey.string("user_profile_accent");

    private static final KeyCatalog CATALOG = KeyCatalog.of(
            CHAMELEON_ENABLED, LIQUID_GLASS, THEME, HAPTIC_ENABLED,
            GESTURE_EYE_ENABLED, RELAY_BASE_URL, RELAY_DEVICE_TOKEN, RELAY_API_KEY, RESCUE_TIME_API_KEY,
            EXCLUDED_APPS, MENU_BAR_REDUNDANCIES, SEEN_TIP_IDS,
            VAULT_ITEMS, BRAIN_DUMP_ITEMS, QUICK_NOTES, SCRIPT_HISTORY, PINNED_APPS, EVOLUTION_GENOME,
            USER_PROFILE_ACCENT);

    private StandardKeys() {
    }

    /** Catalog of every standard key. */
    public static KeyCatalog catalog() {
        return CATALOG;
    }
}
