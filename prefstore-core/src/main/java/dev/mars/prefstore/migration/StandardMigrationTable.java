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

import dev.mars.prefstore.model.StandardKeys;

import java.util.List;

/**
 * The fixed legacy-key table for {@link StandardKeys}.
 * <p>
 * Toggles carry the defaults the legacy UI shipped with; strings and
 * collections import only when the user had set them.
 */
public final class StandardMigrationTable {

    private static final List<LegacyMapping> ENTRIES = List.of(
            // Toggles
            LegacyMapping.of("chameleonEnabled", StandardKeys.CHAMELEON_ENABLED, true),
            LegacyMapping.of("liquidGlass", StandardKeys.LIQUID_GLASS, false),
            LegacyMapping.of("hapticEnabled", StandardKeys.HAPTIC_ENABLED, true),
            LegacyMapping.of("gestureEyeEnabled", StandardKeys.GESTURE_EYE_ENABLED, false),

            // Collections
            LegacyMapping.of("excluded_apps", StandardKeys.EXCLUDED_APPS),
            LegacyMapping.of("TipEngine.seenTipIDs", StandardKeys.SEEN_TIP_IDS),
            LegacyMapping.of("menubar_redundancies", StandardKeys.MENU_BAR_REDUNDANCIES),

            // Strings
            LegacyMapping.of("notchTheme", StandardKeys.THEME),
            LegacyMapping.of("notch.relay.base_url", StandardKeys.RELAY_BASE_URL),
            LegacyMapping.of("notch.relay.device_token", StandardKeys.RELAY_DEVICE_TOKEN),
            LegacyMapping.of("notch.relay.api_key", StandardKeys.RELAY_API_KEY),
            LegacyMapping.of("notch.rescuetime.api_key", StandardKeys.RESCUE_TIME_API_KEY));

    private StandardMigrationTable() {
    }

    public static List<LegacyMapping> entries() {
        return ENTRIES;
    }
}
