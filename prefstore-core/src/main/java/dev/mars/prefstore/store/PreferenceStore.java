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
package dev.mars.prefstore.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.prefstore.PrefStoreConfig;
import dev.mars.prefstore.migration.MigrationEngine;
import dev.mars.prefstore.migration.MigrationOutcome;
import dev.mars.prefstore.migration.PropertiesLegacyStore;
import dev.mars.prefstore.migration.StandardMigrationTable;
import dev.mars.prefstore.model.KeyCatalog;
import dev.mars.prefstore.model.PrefKey;
import dev.mars.prefstore.model.PrefValue;
import dev.mars.prefstore.model.StandardKeys;
import dev.mars.prefstore.storage.DocumentWriteException;
import dev.mars.prefstore.storage.FileStateDocumentStore;
import dev.mars.prefstore.storage.RecoveredState;
import dev.mars.prefstore.storage.StateDocumentStore;
import dev.mars.prefstore.storage.StateRecovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Process-wide preference store: typed values in memory, persisted as one
 * JSON document.
 * <p>
 * <b>Threading:</b> every read and mutation runs on a single writer thread,
 * so callers on any thread see a linearizable sequence of operations.
 * Public methods block until the writer has executed them; when invoked
 * from the writer thread itself they run inline.
 * <p>
 * <b>Durability:</b> {@link WritePriority#CRITICAL} sets are on disk when
 * {@code set} returns. {@link WritePriority#DEFERRED} sets are coalesced by a
 * {@link WriteScheduler} and written once the store has been quiet for the
 * configured debounce delay. Write failures are logged and counted in
 * {@link #stats()}; the in-memory value stays authoritative and the next
 * write carries it.
 * <p>
 * <b>Usage Pattern:</b>
 * <pre>{@code
 * try (PreferenceStore prefs = PreferenceStore.standard(PrefStoreConfig.load())) {
 *     prefs.open().get(5, TimeUnit.SECONDS);
 *     prefs.set(StandardKeys.THEME, "dark");
 *     boolean haptics = prefs.bool(StandardKeys.HAPTIC_ENABLED, true);
 * }
 * }</pre>
 */
public final class PreferenceStore implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(PreferenceStore.class);

    private static final long CLOSE_TIMEOUT_SECONDS = 10;

    private final StateDocumentStore documents;
    private final KeyCatalog catalog;
    private final MigrationEngine migration;
    private final WriteScheduler scheduler;
    private final ScheduledExecutorService writer;
    private final ObjectMapper mapper = new ObjectMapper();

    private final AtomicLong durableWrites = new AtomicLong();
    private final AtomicLong failedWrites = new AtomicLong();
    private final AtomicLong coalescedWrites = new AtomicLong();

    // Writer-thread confined
    private final Map<String, PrefValue> state = new HashMap<>();
    private ScheduledFuture<?> pendingTimer;

    private volatile Thread writerThread;
    private volatile boolean open = false;
    private volatile boolean closed = false;
    private volatile RecoveredState.Source recoverySource;
    private volatile MigrationOutcome migrationOutcome;

    /**
     * Creates a file-backed store for the standard keys, without legacy migration.
     */
    public PreferenceStore(PrefStoreConfig config) {
        this(config, StandardKeys.catalog());
    }

    /**
     * Creates a file-backed store for the given catalog, without legacy migration.
     */
    public PreferenceStore(PrefStoreConfig config, KeyCatalog catalog) {
        this(config, catalog, new FileStateDocumentStore(config, catalog), null, Clock.systemUTC());
    }

    /**
     * Creates a store over explicit collaborators.
     *
     * @param config    supplies the debounce delay
     * @param catalog   declared keys; sets and gets must agree with it
     * @param documents durable storage, owned (and closed) by this store
     * @param migration legacy import run by {@link #open()}, or null for none
     * @param clock     time source for debouncing
     */
    public PreferenceStore(PrefStoreConfig config,
                           KeyCatalog catalog,
                           StateDocumentStore documents,
                           MigrationEngine migration,
                           Clock clock) {
        Objects.requireNonNull(config, "config");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.documents = Objects.requireNonNull(documents, "documents");
        this.migration = migration;
        this.scheduler = new WriteScheduler(clock, config.debounceDelay());

        // Single-threaded executor serializes every access to the state map
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "prefstore-writer");
            t.setDaemon(true);
            writerThread = t;
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.writer = executor;

        LOG.info("PreferenceStore created: debounce={} ms, catalog={} keys, migration={}",
                config.debounceMillis(), catalog.size(), migration != null ? "enabled" : "disabled");
    }

    /**
     * Creates the production wiring: file-backed document store, the
     * standard key catalog, and the one-time import from the legacy
     * properties file named by {@link PrefStoreConfig#legacyFile()}.
     */
    public static PreferenceStore standard(PrefStoreConfig config) {
        KeyCatalog catalog = StandardKeys.catalog();
        MigrationEngine migration = new MigrationEngine(
                new PropertiesLegacyStore(config.legacyFile()),
                StandardMigrationTable.entries(),
                config.migrationFlagKey());
        return new PreferenceStore(config, catalog, new FileStateDocumentStore(config, catalog),
                migration, Clock.systemUTC());
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Opens the document store, recovers the last good state and runs the
     * legacy migration if it has not completed yet.
     *
     * @return completes when the store is usable; completes exceptionally
     *         with a {@code StoreException} if the storage cannot be opened
     */
    public CompletableFuture<Void> open() {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Preference store is closed"));
        }
        return CompletableFuture.runAsync(() -> {
            if (open) {
                LOG.debug("Preference store already open");
                return;
            }
            documents.open();

            RecoveredState recovered = StateRecovery.recover(documents);
            state.clear();
            state.putAll(recovered.values());
            recoverySource = recovered.source();

            if (migration != null) {
                migrationOutcome = migration.runIfNeeded(state, documents);
                if (migrationOutcome.committed()) {
                    durableWrites.incrementAndGet();
                }
            }

            open = true;
            LOG.info("Preference store open: {} keys loaded from {}{}", state.size(), recoverySource,
                    migrationOutcome != null ? ", migration " + migrationOutcome.phase() : "");
        }, writer);
    }

    public boolean isOpen() {
        return open && !closed;
    }

    /**
     * Flushes pending changes, releases the storage lock and stops the writer.
     * Idempotent. Must not be called from the writer thread.
     */
    @Override
    public void close() {
        if (closed) {
            LOG.debug("Preference store already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        LOG.info("Closing preference store");

        try {
            CompletableFuture.runAsync(() -> {
                if (open) {
                    cancelPendingWrite();
                    persistNow("close");
                }
                documents.close();
            }, writer).join();
        } catch (CompletionException e) {
            LOG.error("Final flush on close failed: {}", e.getCause().getMessage());
        } finally {
            open = false;
            writer.shutdown();
            try {
                if (!writer.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    LOG.warn("Writer thread did not stop within {} s", CLOSE_TIMEOUT_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        LOG.info("Preference store closed");
    }

    // ========================================================================
    // Reads
    // ========================================================================

    /**
     * Returns the value stored under {@code key}. A value of a different
     * variant reads as empty.
     */
    public <T> Optional<T> get(PrefKey<T> key) {
        Objects.requireNonNull(key, "key");
        catalog.requireCompatible(key);
        return call(() -> Optional.ofNullable(readTyped(key)));
    }

    public boolean bool(PrefKey<Boolean> key, boolean defaultValue) {
        return get(key).orElse(defaultValue);
    }

    public String string(PrefKey<String> key, String defaultValue) {
        return get(key).orElse(defaultValue);
    }

    public List<String> stringList(PrefKey<List<String>> key) {
        return get(key).orElse(List.of());
    }

    public Map<String, Boolean> boolMap(PrefKey<Map<String, Boolean>> key) {
        return get(key).orElse(Map.of());
    }

    public Optional<byte[]> getEncoded(PrefKey<byte[]> key) {
        return get(key);
    }

    /**
     * Decodes the JSON payload stored under {@code key}. Payloads that do
     * not decode as {@code type} read as empty.
     */
    public <V> Optional<V> getObject(PrefKey<byte[]> key, Class<V> type) {
        return getObject(key, mapper.constructType(type));
    }

    public <V> Optional<V> getObject(PrefKey<byte[]> key, TypeReference<V> type) {
        return getObject(key, mapper.getTypeFactory().constructType(type));
    }

    private <V> Optional<V> getObject(PrefKey<byte[]> key, JavaType type) {
        Optional<byte[]> payload = getEncoded(key);
        if (payload.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(payload.get(), type));
        } catch (IOException e) {
            LOG.warn("Payload under '{}' does not decode as {}: {}", key.id(), type, e.getMessage());
            return Optional.empty();
        }
    }

    /** Immutable copy of every stored entry. */
    public Map<String, PrefValue> snapshot() {
        return call(() -> Map.copyOf(state));
    }

    /** Current phase of the debounce scheduler. */
    public WriteScheduler.Phase pendingPhase() {
        return call(scheduler::phase);
    }

    public StoreStats stats() {
        return new StoreStats(durableWrites.get(), failedWrites.get(), coalescedWrites.get());
    }

    /** Where {@link #open()} loaded the state from; empty until opened. */
    public Optional<RecoveredState.Source> recoverySource() {
        return Optional.ofNullable(recoverySource);
    }

    /** Result of the legacy migration run by {@link #open()}; empty when none is configured. */
    public Optional<MigrationOutcome> migrationOutcome() {
        return Optional.ofNullable(migrationOutcome);
    }

    // ========================================================================
    // Writes
    // ========================================================================

    public <T> void set(PrefKey<T> key, T value) {
        set(key, value, WritePriority.DEFERRED);
    }

    /**
     * Stores {@code value} under {@code key}; {@code null} removes the entry.
     * With {@link WritePriority#CRITICAL} the change is durable on return,
     * unless the write failed (see {@link #stats()}).
     */
    public <T> void set(PrefKey<T> key, T value, WritePriority priority) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(priority, "priority");
        catalog.requireCompatible(key);
        PrefValue wrapped = value == null ? null : key.wrap(value);
        call(() -> {
            if (wrapped == null) {
                state.remove(key.id());
            } else {
                state.put(key.id(), wrapped);
            }
            afterMutation(priority);
            return null;
        });
    }

    public void remove(PrefKey<?> key, WritePriority priority) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(priority, "priority");
        catalog.requireCompatible(key);
        call(() -> {
            state.remove(key.id());
            afterMutation(priority);
            return null;
        });
    }

    /** Stores an opaque payload, durable on return. */
    public void setEncoded(PrefKey<byte[]> key, byte[] blob) {
        set(key, blob, WritePriority.CRITICAL);
    }

    /**
     * Encodes {@code value} as JSON and stores it like {@link #setEncoded}.
     *
     * @throws IllegalArgumentException if Jackson cannot serialize the value
     */
    public void setObject(PrefKey<byte[]> key, Object value) {
        if (value == null) {
            setEncoded(key, null);
            return;
        }
        byte[] payload;
        try {
            payload = mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot encode " + value.getClass().getName()
                    + " for '" + key.id() + "'", e);
        }
        setEncoded(key, payload);
    }

    /**
     * Persists the current state now, cancelling any pending deferred write.
     */
    public void flush() {
        call(() -> {
            cancelPendingWrite();
            persistNow("flush");
            return null;
        });
    }

    // ========================================================================
    // Writer-thread internals
    // ========================================================================

    private <T> T readTyped(PrefKey<T> key) {
        PrefValue stored = state.get(key.id());
        if (stored == null) {
            return null;
        }
        T value = key.unwrap(stored);
        if (value == null) {
            LOG.debug("Key '{}' holds a {} value, read as {}", key.id(), stored.type(), key.type());
        }
        return value;
    }

    private void afterMutation(WritePriority priority) {
        switch (priority) {
            case CRITICAL:
                cancelPendingWrite();
                persistNow("critical");
                break;
            case DEFERRED:
                if (scheduler.defer()) {
                    armTimer(scheduler.delay());
                } else {
                    coalescedWrites.incrementAndGet();
                }
                break;
            default:
                throw new IllegalArgumentException("Unknown priority: " + priority);
        }
    }

    private void armTimer(Duration delay) {
        pendingTimer = writer.schedule(this::onDebounceTimer, delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void onDebounceTimer() {
        pendingTimer = null;
        switch (scheduler.onTimer()) {
            case FIRE:
                try {
                    persistNow("debounce");
                } finally {
                    scheduler.fired();
                }
                break;
            case REARM:
                armTimer(scheduler.remaining());
                break;
            case IGNORE:
            default:
                LOG.trace("Stale debounce timer ignored");
                break;
        }
    }

    private void cancelPendingWrite() {
        scheduler.cancel();
        if (pendingTimer != null) {
            pendingTimer.cancel(false);
            pendingTimer = null;
        }
    }

    private void persistNow(String trigger) {
        try {
            documents.persist(Map.copyOf(state));
            durableWrites.incrementAndGet();
            LOG.debug("Persisted {} keys ({})", state.size(), trigger);
        } catch (DocumentWriteException e) {
            failedWrites.incrementAndGet();
            LOG.error("Durable write ({}) FAILED, keeping state in memory: {}", trigger, e.getMessage());
        }
    }

    /**
     * Runs {@code action} on the writer thread and waits for it. Runtime
     * exceptions thrown by the action reach the caller unwrapped.
     */
    private <R> R call(Supplier<R> action) {
        if (closed) {
            throw new IllegalStateException("Preference store is closed");
        }
        if (!open) {
            throw new IllegalStateException("Preference store is not open; call open() first");
        }
        if (Thread.currentThread() == writerThread) {
            return action.get();
        }
        try {
            return CompletableFuture.supplyAsync(action, writer).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Preference store is closed", e);
        }
    }
}
