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

/**
 * A primary or backup document is missing, unreadable or malformed.
 */
public class DocumentDecodeException extends StoreException {

    private final boolean missing;

    public DocumentDecodeException(String message) {
        this(message, null, false);
    }

    public DocumentDecodeException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private DocumentDecodeException(String message, Throwable cause, boolean missing) {
        super(message, cause);
        this.missing = missing;
    }

    /** The document does not exist at all, as on a first start. */
    public static DocumentDecodeException missing(String message) {
        return new DocumentDecodeException(message, null, true);
    }

    public boolean isMissing() {
        return missing;
    }
}
