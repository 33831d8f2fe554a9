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
import java.util.Objects;

/**
 * A stable, globally unique key with a fixed semantic type.
 * <p>
 * The type parameter is the plain Java type callers read and write:
 * {@code Boolean}, {@code String}, {@code List<String>},
 * {@code Map<String, Boolean>} or {@code byte[]}. Keys are created only
 * through the typed factories, so a key's {@link ValueType} and its Java
 * type always agree.
 *
 * <pre>{@code
 * PrefKey<Boolean> HAPTICS = PrefKey.bool("hapticEnabled");
 * store.set(HAPTICS, true, WritePriority.DEFERRED);
 * boolean on = store.bool(HAPTICS, true);
 * }</pre>
 *
 * @param <T> the Java type of values stored under this key
 */
public final class PrefKey<T> {

    private final String id;
    private final ValueType type;

    private PrefKey(String id, ValueType type) {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Key id must not be blank");
        }
        this.id = id;
        this.type = Objects.requireNonNull(type, "type");
    }

    public static PrefKey<Boolean> bool(String id) {
        return new PrefKey<>(id, ValueType.BOOL);
    }

    public static PrefKey<String> string(String id) {
        return new PrefKey<>(id, ValueType.STRING);
    }

    public static PrefKey<List<String>> stringList(String id) {
        return new PrefKey<>(id, ValueType.STRING_LIST);
    }

    public static PrefKey<Map<String, Boolean>> boolMap(String id) {
        return new PrefKey<>(id, ValueType.BOOL_MAP);
    }

    public static PrefKey<byte[]> blob(String id) {
        return new PrefKey<>(id, ValueType.BLOB);
    }

    /** The string id used in the durable document. */
    public String id() {
        return id;
    }

    public ValueType type() {
        return type;
    }

    /** Wraps a plain value into its {@link PrefValue} variant. */
    public PrefValue wrap(T value) {
        return PrefValue.of(type, value);
    }

    /**
     * Unwraps a stored value, or returns null when the stored variant
     * does not belong to this key's type.
     */
    @SuppressWarnings("unchecked")
    public T unwrap(PrefValue value) {
        if (value == null || value.type() != type) {
            return null;
        }
        return (T) value.raw();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrefKey<?> other)) return false;
        return id.equals(other.id) && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type);
    }

    @Override
    public String toString() {
        return id + ":" + type;
    }
}
