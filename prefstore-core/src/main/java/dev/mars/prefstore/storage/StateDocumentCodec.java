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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.mars.prefstore.model.KeyCatalog;
import dev.mars.prefstore.model.PrefKey;
import dev.mars.prefstore.model.PrefValue;
import dev.mars.prefstore.model.PrefValue.BlobValue;
import dev.mars.prefstore.model.PrefValue.BoolMapValue;
import dev.mars.prefstore.model.PrefValue.BoolValue;
import dev.mars.prefstore.model.PrefValue.StringListValue;
import dev.mars.prefstore.model.PrefValue.StringValue;
import dev.mars.prefstore.model.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Encodes the store into its durable JSON document and back.
 * <p>
 * <b>Format:</b> a single pretty-printed JSON object whose keys are the
 * {@link PrefKey} ids, sorted, with values of the JSON shape given by
 * {@link ValueType}. Nested bool maps are sorted as well, so the same store
 * always produces the same bytes.
 * <pre>
 * {
 *   "excluded_apps" : [ "com.example.Player" ],
 *   "hapticEnabled" : true,
 *   "menubar_redundancies" : { "clock" : false, "wifi" : true },
 *   "notch_vault_items" : "W3siaWQiOjF9XQ==",
 *   "notchTheme" : "midnight"
 * }
 * </pre>
 * <b>Decoding:</b> anything that is not exactly one JSON object (empty,
 * truncated, trailing garbage, duplicate keys) is a {@link DocumentDecodeException}.
 * Inside a valid object, an entry whose shape contradicts its catalog type
 * is dropped with a warning; entries for unknown keys are kept with a type
 * inferred from their shape.
 */
public final class StateDocumentCodec {

    private static final Logger LOG = LoggerFactory.getLogger(StateDocumentCodec.class);

    private final ObjectMapper mapper;
    private final KeyCatalog catalog;

    public StateDocumentCodec(KeyCatalog catalog) {
        this.catalog = catalog;
        this.mapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }

    /**
     * Serializes the full store into canonical document bytes.
     *
     * @throws DocumentWriteException if Jackson cannot produce the document
     */
    public byte[] encode(Map<String, PrefValue> state) {
        ObjectNode root = mapper.createObjectNode();
        for (Map.Entry<String, PrefValue> entry : new TreeMap<>(state).entrySet()) {
            root.set(entry.getKey(), toNode(entry.getValue()));
        }
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new DocumentWriteException("Failed to encode state document", e);
        }
    }

    /**
     * Parses document bytes into a store map.
     *
     * @throws DocumentDecodeException if the bytes are not a single JSON object
     */
    public Map<String, PrefValue> decode(byte[] bytes) {
        JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (IOException e) {
            throw new DocumentDecodeException("Malformed state document: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new DocumentDecodeException("State document is not a JSON object (found "
                    + (root == null ? "nothing" : root.getNodeType()) + ")");
        }

        Map<String, PrefValue> values = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            decodeEntry(field.getKey(), field.getValue()).ifPresent(v -> values.put(field.getKey(), v));
        }
        return values;
    }

    private Optional<PrefValue> decodeEntry(String id, JsonNode node) {
        Optional<PrefKey<?>> known = catalog.find(id);
        if (known.isPresent()) {
            ValueType type = known.get().type();
            PrefValue value = valueFromNode(type, node);
            if (value == null) {
                LOG.warn("Skipping entry '{}': expected {} but document holds {}", id, type, node.getNodeType());
            }
            return Optional.ofNullable(value);
        }

        PrefValue inferred = inferFromNode(node);
        if (inferred == null) {
            LOG.warn("Skipping entry '{}': unsupported JSON shape {}", id, node.getNodeType());
        } else {
            LOG.trace("Inferred {} for unknown key '{}'", inferred.type(), id);
        }
        return Optional.ofNullable(inferred);
    }

    /**
     * Converts a JSON node into a value of the given type.
     *
     * @return the value, or null when the node's shape does not fit {@code type}
     */
    public static PrefValue valueFromNode(ValueType type, JsonNode node) {
        switch (type) {
            case BOOL:
                return node.isBoolean() ? new BoolValue(node.booleanValue()) : null;
            case STRING:
                return node.isTextual() ? new StringValue(node.textValue()) : null;
            case STRING_LIST: {
                if (!node.isArray()) {
                    return null;
                }
                List<String> strings = new ArrayList<>(node.size());
                for (JsonNode element : node) {
                    if (!element.isTextual()) {
                        return null;
                    }
                    strings.add(element.textValue());
                }
                return new StringListValue(strings);
            }
            case BOOL_MAP: {
                if (!node.isObject()) {
                    return null;
                }
                Map<String, Boolean> flags = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> it = node.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> e = it.next();
                    if (!e.getValue().isBoolean()) {
                        return null;
                    }
                    flags.put(e.getKey(), e.getValue().booleanValue());
                }
                return new BoolMapValue(flags);
            }
            case BLOB:
                if (!node.isTextual()) {
                    return null;
                }
                try {
                    return new BlobValue(Base64.getDecoder().decode(node.textValue()));
                } catch (IllegalArgumentException e) {
                    return null;
                }
            default:
                return null;
        }
    }

    private static PrefValue inferFromNode(JsonNode node) {
        if (node.isBoolean()) {
            return valueFromNode(ValueType.BOOL, node);
        }
        if (node.isTextual()) {
            return valueFromNode(ValueType.STRING, node);
        }
        if (node.isArray()) {
            return valueFromNode(ValueType.STRING_LIST, node);
        }
        if (node.isObject()) {
            return valueFromNode(ValueType.BOOL_MAP, node);
        }
        return null;
    }

    private static JsonNode toNode(PrefValue value) {
        if (value instanceof BoolValue b) {
            return BooleanNode.valueOf(b.value());
        }
        if (value instanceof StringValue s) {
            return TextNode.valueOf(s.value());
        }
        if (value instanceof StringListValue list) {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            list.values().forEach(array::add);
            return array;
        }
        if (value instanceof BoolMapValue map) {
            ObjectNode object = JsonNodeFactory.instance.objectNode();
            map.values().forEach(object::put);
            return object;
        }
        if (value instanceof BlobValue blob) {
            return TextNode.valueOf(blob.base64());
        }
        throw new IllegalArgumentException("Unsupported value: " + value);
    }
}
