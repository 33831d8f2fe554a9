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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.mars.prefstore.model.PrefValue;
import dev.mars.prefstore.model.ValueType;
import dev.mars.prefstore.storage.StateDocumentCodec;
import dev.mars.prefstore.storage.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.Properties;

/**
 * {@link LegacyPreferenceStore} backed by a flat {@code .properties} file.
 * <p>
 * Value encoding:
 * <table border="1">
 *   <tr><th>Type</th><th>Encoding</th><th>Example</th></tr>
 *   <tr><td>BOOL</td><td>true / false (any case)</td><td>{@code hapticEnabled=false}</td></tr>
 *   <tr><td>STRING</td><td>raw text</td><td>{@code notchTheme=midnight}</td></tr>
 *   <tr><td>STRING_LIST</td><td>JSON array</td><td>{@code excluded_apps=["com.a","com.b"]}</td></tr>
 *   <tr><td>BOOL_MAP</td><td>JSON object</td><td>{@code menubar_redundancies={"wifi":true}}</td></tr>
 *   <tr><td>BLOB</td><td>Base64</td><td>{@code notch_vault_items=W10=}</td></tr>
 * </table>
 * A value that does not parse as the requested type reads as absent.
 * <p>
 * Flag writes rewrite the whole file through a temp file and an atomic
 * rename; {@link Properties#store} does not keep comments or ordering.
 */
public final class PropertiesLegacyStore implements LegacyPreferenceStore {

    private static final Logger LOG = LoggerFactory.getLogger(PropertiesLegacyStore.class);

    private final Path file;
    private final Properties properties;
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Loads the legacy file. A missing file is an empty legacy store.
     *
     * @throws StoreException if the file exists but cannot be read
     */
    public PropertiesLegacyStore(Path file) {
        this.file = file;
        this.properties = new Properties();
        if (!Files.exists(file)) {
            LOG.info("No legacy preference file at {}, treating it as empty", file);
            return;
        }
        try (InputStream in = Files.newInputStream(file)) {
            properties.load(in);
            LOG.info("Loaded {} legacy preferences from {}", properties.size(), file);
        } catch (IOException e) {
            throw new StoreException("Cannot read legacy preference file " + file, e);
        }
    }

    public Path file() {
        return file;
    }

    @Override
    public Optional<PrefValue> read(String legacyKey, ValueType type) {
        String raw = properties.getProperty(legacyKey);
        if (raw == null) {
            return Optional.empty();
        }

        PrefValue value = parse(type, raw);
        if (value == null) {
            LOG.warn("Legacy value for '{}' does not parse as {}, ignoring it", legacyKey, type);
        }
        return Optional.ofNullable(value);
    }

    private PrefValue parse(ValueType type, String raw) {
        switch (type) {
            case BOOL: {
                String trimmed = raw.trim();
                if (trimmed.equalsIgnoreCase("true") || trimmed.equalsIgnoreCase("false")) {
                    return new PrefValue.BoolValue(Boolean.parseBoolean(trimmed));
                }
                return null;
            }
            case STRING:
                return new PrefValue.StringValue(raw);
            case BLOB:
                return StateDocumentCodec.valueFromNode(type, TextNode.valueOf(raw.trim()));
            case STRING_LIST:
            case BOOL_MAP:
                try {
                    JsonNode node = mapper.readTree(raw);
                    return node == null ? null : StateDocumentCodec.valueFromNode(type, node);
                } catch (JsonProcessingException e) {
                    LOG.debug("Legacy JSON value is malformed: {}", e.getOriginalMessage());
                    return null;
                }
            default:
                return null;
        }
    }

    @Override
    public boolean readFlag(String flagKey) {
        return Boolean.parseBoolean(properties.getProperty(flagKey, "false").trim());
    }

    @Override
    public void writeFlag(String flagKey, boolean value) {
        String previous = properties.getProperty(flagKey);
        properties.setProperty(flagKey, Boolean.toString(value));
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(tmp)) {
                properties.store(out, "legacy preferences");
            }
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            LOG.info("Legacy flag written: {}={}", flagKey, value);
        } catch (IOException e) {
            if (previous == null) {
                properties.remove(flagKey);
            } else {
                properties.setProperty(flagKey, previous);
            }
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new StoreException("Cannot write flag '" + flagKey + "' to " + file, e);
        }
    }
}
