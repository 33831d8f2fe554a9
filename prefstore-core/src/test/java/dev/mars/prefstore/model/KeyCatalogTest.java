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

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KeyCatalogTest {

    @Test
    void testFind_DeclaredKey() {
        KeyCatalog catalog = KeyCatalog.of(PrefKey.bool("a"), PrefKey.blob("b"));

        assertEquals(2, catalog.size());
        assertEquals(ValueType.BLOB, catalog.find("b").orElseThrow().type());
        assertTrue(catalog.find("missing").isEmpty());
    }

    @Test
    void testSameIdTwoTypes_Rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> KeyCatalog.of(PrefKey.bool("dup"), PrefKey.string("dup")));
    }

    @Test
    void testSameKeyTwice_Allowed() {
        KeyCatalog catalog = KeyCatalog.of(PrefKey.bool("dup"), PrefKey.bool("dup"));
        assertEquals(1, catalog.size());
    }

    @Test
    void testRequireCompatible() {
        KeyCatalog catalog = KeyCatalog.of(PrefKey.string("theme"));

        assertDoesNotThrow(() -> catalog.requireCompatible(PrefKey.string("theme")));
        assertDoesNotThrow(() -> catalog.requireCompatible(PrefKey.bool("undeclared")));
        assertThrows(IllegalArgumentException.class, () -> catalog.requireCompatible(PrefKey.bool("theme")));
    }

    @Test
    void testRequireCompatible_UndeclaredBlobRejected() {
        KeyCatalog catalog = KeyCatalog.of(PrefKey.blob("declared_payload"));

        assertDoesNotThrow(() -> catalog.requireCompatible(PrefKey.blob("declared_payload")));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> catalog.requireCompatible(PrefKey.blob("custom_payload")));
        assertTrue(e.getMessage().contains("custom_payload"));
    }

    @Test
    void testStandardCatalog_IdsAreUnique() {
        KeyCatalog catalog = StandardKeys.catalog();
        Set<String> ids = new HashSet<>();
        for (PrefKey<?> key : catalog.keys()) {
            assertTrue(ids.add(key.id()), "duplicate id " + key.id());
        }
        assertEquals(ValueType.BLOB, catalog.find(StandardKeys.VAULT_ITEMS.id()).orElseThrow().type());
        assertEquals(ValueType.STRING_LIST, catalog.find("excluded_apps").orElseThrow().type());
    }
}
