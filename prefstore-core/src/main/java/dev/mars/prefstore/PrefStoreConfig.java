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
package dev.mars.prefstore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * Configuration for a preference store.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dprefstore.dataDir=/path})</li>
 *   <li>Environment variables (e.g., {@code PREFSTORE_DATA_DIR})</li>
 *   <li>Properties file ({@code prefstore.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>dataDir</td><td>prefstore.dataDir</td><td>PREFSTORE_DATA_DIR</td><td>~/.prefstore/data</td></tr>
 *   <tr><td>documentName</td><td>prefstore.documentName</td><td>PREFSTORE_DOCUMENT_NAME</td><td>state.json</td></tr>
 *   <tr><td>debounceMillis</td><td>prefstore.debounceMillis</td><td>PREFSTORE_DEBOUNCE_MILLIS</td><td>500</td></tr>
 *   <tr><td>syncEnabled</td><td>prefstore.syncEnabled</td><td>PREFSTORE_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>verifyWrites</td><td>prefstore.verifyWrites</td><td>PREFSTORE_VERIFY_WRITES</td><td>false</td></tr>
 *   <tr><td>minFreeSpaceMb</td><td>prefstore.minFreeSpaceMb</td><td>PREFSTORE_MIN_FREE_SPACE_MB</td><td>8</td></tr>
 *   <tr><td>migrationFlagKey</td><td>prefstore.migrationFlagKey</td><td>PREFSTORE_MIGRATION_FLAG_KEY</td><td>prefstore.migrated.v1</td></tr>
 *   <tr><td>legacyFile</td><td>prefstore.legacyFile</td><td>PREFSTORE_LEGACY_FILE</td><td>~/.prefstore/legacy.properties</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # prefstore.properties
 * prefstore.dataDir=/home/me/.config/shell/state
 * prefstore.debounceMillis=250
 * prefstore.verifyWrites=true
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * PrefStoreConfig config = PrefStoreConfig.builder()
 *     .dataDir(Path.of("/var/lib/shell"))
 *     .debounceMillis(250)
 *     .build();
 *
 * PreferenceStore store = new PreferenceStore(config);
 * store.open().join();
 * </pre>
 */
public final class PrefStoreConfig {

    private static final Logger LOG = LoggerFactory.getLogger(PrefStoreConfig.class);

    private static final String PROPERTIES_FILE = "prefstore.properties";

    // Property keys
    private static final String PROP_DATA_DIR = "prefstore.dataDir";
    private static final String PROP_DOCUMENT_NAME = "prefstore.documentName";
    private static final String PROP_DEBOUNCE_MILLIS = "prefstore.debounceMillis";
    private static final String PROP_SYNC_ENABLED = "prefstore.syncEnabled";
    private static final String PROP_VERIFY_WRITES = "prefstore.verifyWrites";
    private static final String PROP_MIN_FREE_SPACE_MB = "prefstore.minFreeSpaceMb";
    private static final String PROP_MIGRATION_FLAG_KEY = "prefstore.migrationFlagKey";
    private static final String PROP_LEGACY_FILE = "prefstore.legacyFile";

    // Environment variable keys
    private static final String ENV_DATA_DIR = "PREFSTORE_DATA_DIR";
    private static final String ENV_DOCUMENT_NAME = "PREFSTORE_DOCUMENT_NAME";
    private static final String ENV_DEBOUNCE_MILLIS = "PREFSTORE_DEBOUNCE_MILLIS";
    private static final String ENV_SYNC_ENABLED = "PREFSTORE_SYNC_ENABLED";
    private static final String ENV_VERIFY_WRITES = "PREFSTORE_VERIFY_WRITES";
    private static final String ENV_MIN_FREE_SPACE_MB = "PREFSTORE_MIN_FREE_SPACE_MB";
    private static final String ENV_MIGRATION_FLAG_KEY = "PREFSTORE_MIGRATION_FLAG_KEY";
    private static final String ENV_LEGACY_FILE = "PREFSTORE_LEGACY_FILE";

    // Defaults
    private static final Path DEFAULT_HOME = Path.of(System.getProperty("user.home"), ".prefstore");
    private static final Path DEFAULT_DATA_DIR = DEFAULT_HOME.resolve("data");
    private static final String DEFAULT_DOCUMENT_NAME = "state.json";
    private static final int DEFAULT_DEBOUNCE_MILLIS = 500;
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final boolean DEFAULT_VERIFY_WRITES = false;
    private static final int DEFAULT_MIN_FREE_SPACE_MB = 8;
    private static final String DEFAULT_MIGRATION_FLAG_KEY = "prefstore.migrated.v1";
    private static final Path DEFAULT_LEGACY_FILE = DEFAULT_HOME.resolve("legacy.properties");

    private final Path dataDir;
    private final String documentName;
    private final int debounceMillis;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final int minFreeSpaceMb;
    private final String migrationFlagKey;
    private final Path legacyFile;

    private PrefStoreConfig(Builder builder) {
        this.dataDir = builder.dataDir;
        this.documentName = builder.documentName;
        this.debounceMillis = builder.debounceMillis;
        this.syncEnabled = builder.syncEnabled;
        this.verifyWrites = builder.verifyWrites;
        this.minFreeSpaceMb = builder.minFreeSpaceMb;
        this.migrationFlagKey = builder.migrationFlagKey;
        this.legacyFile = builder.legacyFile;
    }

    /** Directory holding the state document, its backups and the lock file. */
    public Path dataDir() {
        return dataDir;
    }

    /** File name of the primary state document. */
    public String documentName() {
        return documentName;
    }

    /** Path of the primary state document. */
    public Path documentPath() {
        return dataDir.resolve(documentName);
    }

    /** Quiet period before a deferred write is persisted. */
    public int debounceMillis() {
        return debounceMillis;
    }

    public Duration debounceDelay() {
        return Duration.ofMillis(debounceMillis);
    }

    /** Whether fsync is enabled (should be true outside tests). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Whether to re-read the primary after each write and compare bytes. */
    public boolean verifyWrites() {
        return verifyWrites;
    }

    /** Minimum free disk space in MB required before writes. */
    public int minFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    /** Minimum free disk space in bytes. */
    public long minFreeSpaceBytes() {
        return (long) minFreeSpaceMb * 1024 * 1024;
    }

    /** Key of the migration-completed flag inside the legacy store. */
    public String migrationFlagKey() {
        return migrationFlagKey;
    }

    /** Legacy preference file read by the migration. */
    public Path legacyFile() {
        return legacyFile;
    }

    @Override
    public String toString() {
        return "PrefStoreConfig{" +
                "dataDir=" + dataDir +
                ", documentName=" + documentName +
                ", debounceMillis=" + debounceMillis +
                ", syncEnabled=" + syncEnabled +
                ", verifyWrites=" + verifyWrites +
                ", minFreeSpaceMb=" + minFreeSpaceMb +
                ", migrationFlagKey=" + migrationFlagKey +
                ", legacyFile=" + legacyFile +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code PrefStoreConfig.builder().build()}.
     */
    public static PrefStoreConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link PrefStoreConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path dataDir;
        private String documentName;
        private Integer debounceMillis;
        private Boolean syncEnabled;
        private Boolean verifyWrites;
        private Integer minFreeSpaceMb;
        private String migrationFlagKey;
        private Path legacyFile;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        public Builder dataDir(String dataDir) {
            this.dataDir = Path.of(dataDir);
            return this;
        }

        public Builder documentName(String documentName) {
            this.documentName = documentName;
            return this;
        }

        /** Sets the debounce delay in milliseconds (default: 500). */
        public Builder debounceMillis(int debounceMillis) {
            this.debounceMillis = debounceMillis;
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Enables or disables read-after-write verification (default: false). */
        public Builder verifyWrites(boolean verifyWrites) {
            this.verifyWrites = verifyWrites;
            return this;
        }

        /** Sets minimum free disk space in MB (default: 8). */
        public Builder minFreeSpaceMb(int minFreeSpaceMb) {
            this.minFreeSpaceMb = minFreeSpaceMb;
            return this;
        }

        public Builder migrationFlagKey(String migrationFlagKey) {
            this.migrationFlagKey = migrationFlagKey;
            return this;
        }

        public Builder legacyFile(Path legacyFile) {
            this.legacyFile = legacyFile;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if the debounce delay is negative
         *                                  or the document name is blank
         */
        public PrefStoreConfig build() {
            if (dataDir == null) {
                dataDir = resolvePath(PROP_DATA_DIR, ENV_DATA_DIR, DEFAULT_DATA_DIR);
            }
            if (documentName == null) {
                documentName = resolveString(PROP_DOCUMENT_NAME, ENV_DOCUMENT_NAME, DEFAULT_DOCUMENT_NAME);
            }
            if (debounceMillis == null) {
                debounceMillis = resolveInt(PROP_DEBOUNCE_MILLIS, ENV_DEBOUNCE_MILLIS, DEFAULT_DEBOUNCE_MILLIS);
            }
            if (syncEnabled == null) {
                syncEnabled = resolveBoolean(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, DEFAULT_SYNC_ENABLED);
            }
            if (verifyWrites == null) {
                verifyWrites = resolveBoolean(PROP_VERIFY_WRITES, ENV_VERIFY_WRITES, DEFAULT_VERIFY_WRITES);
            }
            if (minFreeSpaceMb == null) {
                minFreeSpaceMb = resolveInt(PROP_MIN_FREE_SPACE_MB, ENV_MIN_FREE_SPACE_MB, DEFAULT_MIN_FREE_SPACE_MB);
            }
            if (migrationFlagKey == null) {
                migrationFlagKey = resolveString(PROP_MIGRATION_FLAG_KEY, ENV_MIGRATION_FLAG_KEY, DEFAULT_MIGRATION_FLAG_KEY);
            }
            if (legacyFile == null) {
                legacyFile = resolvePath(PROP_LEGACY_FILE, ENV_LEGACY_FILE, DEFAULT_LEGACY_FILE);
            }

            if (debounceMillis < 0) {
                throw new IllegalArgumentException("debounceMillis must be >= 0, was " + debounceMillis);
            }
            if (documentName.isBlank()) {
                throw new IllegalArgumentException("documentName must not be blank");
            }

            return new PrefStoreConfig(this);
        }

        /** System property, then environment variable, then properties file; null if none is set. */
        private String lookup(String sysProp, String envVar) {
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }

            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value;
            }

            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }
            return null;
        }

        private Path resolvePath(String sysProp, String envVar, Path defaultValue) {
            String value = lookup(sysProp, envVar);
            return value != null ? Path.of(value) : defaultValue;
        }

        private String resolveString(String sysProp, String envVar, String defaultValue) {
            String value = lookup(sysProp, envVar);
            return value != null ? value.trim() : defaultValue;
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            String value = lookup(sysProp, envVar);
            return value != null ? Boolean.parseBoolean(value.trim()) : defaultValue;
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            String value = lookup(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring non-numeric value '{}' for {}, using {}", value, sysProp, defaultValue);
                return defaultValue;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = PrefStoreConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
