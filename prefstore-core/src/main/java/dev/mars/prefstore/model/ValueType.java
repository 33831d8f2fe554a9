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

/**
 * The closed set of value kinds a {@link PrefKey} can carry.
 * <p>
 * Each kind maps to exactly one {@link PrefValue} variant and one JSON shape
 * in the durable document:
 * <table border="1">
 *   <tr><th>Type</th><th>Java type</th><th>JSON</th></tr>
 *   <tr><td>BOOL</td><td>{@code Boolean}</td><td>true / false</td></tr>
 *   <tr><td>STRING</td><td>{@code String}</td><td>string</td></tr>
 *   <tr><td>STRING_LIST</td><td>{@code List<String>}</td><td>array of strings</td></tr>
 *   <tr><td>BOOL_MAP</td><td>{@code Map<String, Boolean>}</td><td>object of booleans</td></tr>
 *   <tr><td>BLOB</td><td>{@code byte[]}</td><td>Base64 string</td></tr>
 * </table>
 */
public enum ValueType {
    BOOL,
    STRING,
    STRING_LIST,
    BOOL_MAP,
    BLOB
}
