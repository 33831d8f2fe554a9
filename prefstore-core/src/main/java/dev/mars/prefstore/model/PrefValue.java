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

import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A stored value: a tagged union over the {@link ValueType} kinds.
 * <p>
 * Exactly one variant is populated per entry. All variants are immutable;
 * collections and byte arrays are copied on the way in and on the way out,
 * and null elements are rejected.
 */
public sealed interface PrefValue
        permits PrefValue.BoolValue, PrefValue.StringValue, PrefValue.StringListValue,
                PrefValue.BoolMapValue, PrefValue.BlobValue {

    /** The kind of this value. */
    ValueType type();

    /**
     * The plain Java value: {@code Boolean}, {@code String}, {@code List<String>},
     * {@code Map<String, Boolean>} or a copy of the {@code byte[]}.
     */
    Object raw();

    /**
     * Wraps a plain Java value into the variant for {@code type}.
     *
     * @throws IllegalArgumentException if {@code raw} is not of the Java type for {@code type}
     * @throws NullPointerException     if {@code raw} or any element is null
     */
    static PrefValue of(ValueType type, Object raw) {
        Objects.requireNonNull(raw, "value");
        switch (type) {
            case BOOL:
                if (raw instanceof Boolean b) {
                    return new BoolValue(b);
                }
                break;
            case STRING:
                if (raw instanceof String s) {
                    return new StringValue(s);
                }
                break;
            case STRING_LIST:
                if (raw instanceof List<?> list) {
                    for (Object element : list) {
                        if (!(element instanceof String)) {
                            throw new IllegalArgumentException("STRING_LIST element is not a String: " + element);
                        }
                    }
                    @SuppressWarnings("unchecked")
                    List<String> strings = (List<String>) list;
                    return new StringListValue(strings);
                }
                break;
            case BOOL_MAP:
                if (raw instanceof Map<?, ?> map) {
                    for (Map.Entry<?, ?> e : map.entrySet()) {
                        if (!(e.getKey() instanceof String) || !(e.getValue() instanceof Boolean)) {
                            throw new IllegalArgumentException("BOOL_MAP entry is not String->Boolean: " + e);
                        }
                    }
                    @SuppressWarnings("unchecked")
                    Map<String, Boolean> flags = (Map<String, Boolean>) map;
                    return new BoolMapValue(flags);
                }
                break;
            case BLOB:
                if (raw instanceof byte[] bytes) {
                    return new BlobValue(bytes);
                }
                break;
            default:
                break;
        }
        throw new IllegalArgumentException(
                "Value of class " + raw.getClass().getName() + " does not fit type " + type);
    }

    record BoolValue(boolean value) implements PrefValue {
        @Override
        public ValueType type() {
            return ValueType.BOOL;
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record StringValue(String value) implements PrefValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ValueType type() {
            return ValueType.STRING;
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    /**
     * Ordered list of strings. Order is preserved exactly as given.
     */
    record StringListValue(List<String> values) implements PrefValue {
        public StringListValue {
            values = List.copyOf(values);
        }

        @Override
        public ValueType type() {
            return ValueType.STRING_LIST;
        }

        @Override
        public Object raw() {
            return values;
        }
    }

    /**
     * String-keyed map of flags. Held sorted so iteration order is canonical.
     */
    record BoolMapValue(Map<String, Boolean> values) implements PrefValue {
        public BoolMapValue {
            TreeMap<String, Boolean> sorted = new TreeMap<>();
            for (Map.Entry<String, Boolean> e : values.entrySet()) {
                sorted.put(Objects.requireNonNull(e.getKey(), "key"),
                        Objects.requireNonNull(e.getValue(), "value"));
            }
            values = Collections.unmodifiableSortedMap(sorted);
        }

        @Override
        public ValueType type() {
            return ValueType.BOOL_MAP;
        }

        @Override
        public Object raw() {
            return values;
        }
    }

    /**
     * Opaque encoded payload. The store never looks inside it.
     */
    record BlobValue(byte[] bytes) implements PrefValue {
        public BlobValue {
            bytes = bytes.clone();
        }

        /** Returns a copy of the payload. */
        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        @Override
        public ValueType type() {
            return ValueType.BLOB;
        }

        @Override
        public Object raw() {
            return bytes.clone();
        }

        /** Base64 form used in the durable document. */
        public String base64() {
            return Base64.getEncoder().encodeToString(bytes);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BlobValue other && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "BlobValue[" + bytes.length + " bytes]";
        }
    }
}
