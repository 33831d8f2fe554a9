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

import dev.mars.prefstore.PrefStoreConfig;
import dev.mars.prefstore.model.KeyCatalog;
import dev.mars.prefstore.model.PrefValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Map;

/**
 * File-based implementation of {@link StateDocumentStore}.
 * <p>
 * <b>Files:</b>
 * <pre>
 * data/
 *  ├─ state.json                 // primary document (atomic replace)
 *  ├─ state.json.backup          // previous generation of the primary
 *  ├─ state.json.pre-migration   // only while a migration is in flight
 *  └─ prefstore.lock             // exclusive process lock
 * </pre>
 * <p>
 * <b>Durability:</b>
 * <ol>
 *   <li>Stage: bytes → state.json.tmp → fsync, optionally read back and compared</li>
 *   <li>Rotate: primary → backup.tmp → fsync → rename over backup</li>
 *   <li>Commit: rename state.json.tmp over primary → fsync dir</li>
 * </ol>
 * A write that fails while staging leaves both generations untouched.
 * Once rotation has run, the backup equals the primary it replaced, so a
 * failed commit still leaves the previous generation in both files.
 * <p>
 * <b>Protection Mechanisms:</b>
 * <ul>
 *   <li><b>File Locking:</b> Exclusive lock on a separate lock file prevents two
 *       processes (or two instances in one JVM) from writing the same document.</li>
 *   <li><b>Disk Space Checking:</b> Pre-flight check before each write so a full disk
 *       fails the write cleanly instead of mid-file.</li>
 *   <li><b>Corrupt Generation Guard:</b> a primary that failed to decode is never
 *       rotated into the backup, so recovery keeps a good generation.</li>
 * </ul>
 */
public final class FileStateDocumentStore implements StateDocumentStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileStateDocumentStore.class);

    /** Lock file name */
    private static final String LOCK_FILE = "prefstore.lock";

    private static final String TMP_SUFFIX = ".tmp";
    private static final String BACKUP_SUFFIX = ".backup";
    private static final String PRE_MIGRATION_SUFFIX = ".pre-migration";

    private final PrefStoreConfig config;
    private final StateDocumentCodec codec;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final long minFreeSpace;

    private final Path dataDir;
    private final Path primaryPath;
    private final Path primaryTmpPath;
    private final Path backupPath;
    private final Path backupTmpPath;
    private final Path preMigrationPath;

    private FileChannel lockChannel;
    private FileLock exclusiveLock;
    private boolean opened = false;
    private volatile boolean closed = false;

    /**
     * Set when the primary exists but failed to decode. Cleared by the next
     * successful write, which replaces it.
     */
    private boolean primaryCorrupt = false;

    public FileStateDocumentStore(PrefStoreConfig config, KeyCatalog catalog) {
        this.config = config;
        this.codec = new StateDocumentCodec(catalog);
        this.syncEnabled = config.syncEnabled();
        this.verifyWrites = config.verifyWrites();
        this.minFreeSpace = config.minFreeSpaceBytes();

        this.dataDir = config.dataDir();
        this.primaryPath = config.documentPath();
        this.primaryTmpPath = sibling(primaryPath, TMP_SUFFIX);
        this.backupPath = sibling(primaryPath, BACKUP_SUFFIX);
        this.backupTmpPath = sibling(backupPath, TMP_SUFFIX);
        this.preMigrationPath = sibling(primaryPath, PRE_MIGRATION_SUFFIX);

        LOG.info("FileStateDocumentStore initialized: document={}, syncEnabled={}, verifyWrites={}, minFreeSpace={} MB",
                primaryPath, syncEnabled, verifyWrites, config.minFreeSpaceMb());

        if (!syncEnabled) {
            LOG.warn("FileStateDocumentStore created with fsync DISABLED. Do NOT use in production!");
        }
    }

    public PrefStoreConfig config() {
        return config;
    }

    public Path primaryPath() {
        return primaryPath;
    }

    public Path backupPath() {
        return backupPath;
    }

    public Path preMigrationPath() {
        return preMigrationPath;
    }

    // ========================================================================
    // Open / Close
    // ========================================================================

    @Override
    public void open() {
        if (opened) {
            return;
        }
        if (closed) {
            throw new StoreException("Document store at " + dataDir + " is closed");
        }
        try {
            LOG.info("Opening state document store at: {}", dataDir);
            Files.createDirectories(dataDir);
            acquireExclusiveLock();
            warnOnLowDiskSpace();
            // A crash mid-write can leave temp files behind; they are never read.
            deleteIfPresent(primaryTmpPath);
            deleteIfPresent(backupTmpPath);
            opened = true;
        } catch (IOException e) {
            LOG.error("Failed to open state document store at {}: {}", dataDir, e.getMessage(), e);
            releaseExclusiveLock();
            throw new StoreException("Failed to open state document store at " + dataDir, e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            LOG.debug("Document store already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        releaseExclusiveLock();
        LOG.info("State document store closed: {}", dataDir);
    }

    // ========================================================================
    // Reads
    // ========================================================================

    @Override
    public Map<String, PrefValue> readPrimary() {
        try {
            Map<String, PrefValue> values = readDocument(primaryPath, "primary");
            primaryCorrupt = false;
            return values;
        } catch (DocumentDecodeException e) {
            primaryCorrupt = Files.exists(primaryPath);
            throw e;
        }
    }

    @Override
    public Map<String, PrefValue> readBackup() {
        return readDocument(backupPath, "backup");
    }

    private Map<String, PrefValue> readDocument(Path path, String label) {
        if (!Files.exists(path)) {
            throw DocumentDecodeException.missing("No " + label + " document at " + path);
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new DocumentDecodeException("Cannot read " + label + " document " + path, e);
        }
        LOG.debug("Decoding {} document: path={}, size={} bytes", label, path, bytes.length);
        return codec.decode(bytes);
    }

    // ========================================================================
    // Writes
    // ========================================================================

    @Override
    public void persist(Map<String, PrefValue> state) {
        requireOpen();
        byte[] bytes = codec.encode(state);
        long startNanos = System.nanoTime();
        try {
            checkDiskSpace(bytes.length);
            writeTemp(primaryTmpPath, bytes);
            if (verifyWrites) {
                verifyWritten(primaryTmpPath, bytes);
            }
            rotateBackup();
            commitTemp(primaryTmpPath, primaryPath);
            primaryCorrupt = false;
            long elapsedMicros = (System.nanoTime() - startNanos) / 1000;
            LOG.debug("Persisted {} keys ({} bytes) to {} in {} us", state.size(), bytes.length, primaryPath, elapsedMicros);
        } catch (IOException e) {
            LOG.error("Failed to persist state document {}: {}", primaryPath, e.getMessage(), e);
            throw new DocumentWriteException("Failed to persist state document " + primaryPath, e);
        } finally {
            deleteIfPresent(primaryTmpPath);
            deleteIfPresent(backupTmpPath);
        }
    }

    /**
     * Copies the current primary over the backup, through a temp file so a
     * crash never leaves a torn backup.
     */
    private void rotateBackup() throws IOException {
        if (!Files.exists(primaryPath)) {
            LOG.trace("No primary document yet, nothing to rotate");
            return;
        }
        if (primaryCorrupt) {
            LOG.warn("Primary document {} failed to decode; keeping existing backup instead of rotating it",
                    primaryPath);
            return;
        }
        copyAtomically(primaryPath, backupTmpPath, backupPath);
        LOG.trace("Rotated {} -> {}", primaryPath, backupPath);
    }

    private void writeTemp(Path tmp, byte[] bytes) throws IOException {
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        try (FileChannel ch = FileChannel.open(tmp,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            if (syncEnabled) {
                ch.force(true);
                LOG.trace("Synced temp file {}", tmp);
            }
        }
    }

    private void commitTemp(Path tmp, Path target) throws IOException {
        Files.move(tmp, target,
                StandardCopyOption.REPLACE_EXISTING,
                StandardCopyOption.ATOMIC_MOVE);
        LOG.trace("Atomic rename: {} -> {}", tmp, target);

        // Fsync directory (critical on Linux)
        if (syncEnabled) {
            syncDirectory(dataDir);
        }
    }

    private void copyAtomically(Path source, Path tmp, Path target) throws IOException {
        Files.copy(source, tmp, StandardCopyOption.REPLACE_EXISTING);
        if (syncEnabled) {
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
                ch.force(true);
            }
        }
        Files.move(tmp, target,
                StandardCopyOption.REPLACE_EXISTING,
                StandardCopyOption.ATOMIC_MOVE);
        if (syncEnabled) {
            syncDirectory(dataDir);
        }
    }

    /**
     * Reads the staged file back and compares it to what was written.
     * Runs before rotation, so a mismatch touches neither generation.
     */
    private void verifyWritten(Path staged, byte[] expected) throws IOException {
        byte[] actual = Files.readAllBytes(staged);
        if (!Arrays.equals(expected, actual)) {
            LOG.error("Write verification failed for {}: wrote {} bytes, read back {} bytes",
                    staged, expected.length, actual.length);
            throw new DocumentWriteException("Write verification failed for " + staged
                    + ". Possible silent data corruption!");
        }
        LOG.trace("Write verification passed for {}", staged);
    }

    // ========================================================================
    // Pre-migration backup
    // ========================================================================

    @Override
    public boolean createPreMigrationBackup() {
        requireOpen();
        Path tmp = sibling(preMigrationPath, TMP_SUFFIX);
        try {
            if (!Files.exists(primaryPath)) {
                deleteIfPresent(preMigrationPath);
                LOG.debug("No primary document, pre-migration backup not needed");
                return false;
            }
            copyAtomically(primaryPath, tmp, preMigrationPath);
            LOG.info("Pre-migration backup written: {}", preMigrationPath);
            return true;
        } catch (IOException e) {
            LOG.error("Failed to write pre-migration backup {}: {}", preMigrationPath, e.getMessage(), e);
            throw new DocumentWriteException("Failed to write pre-migration backup " + preMigrationPath, e);
        } finally {
            deleteIfPresent(tmp);
        }
    }

    @Override
    public void restorePreMigrationBackup(boolean primaryExisted) {
        requireOpen();
        try {
            if (Files.exists(preMigrationPath)) {
                Files.move(preMigrationPath, primaryPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
                LOG.info("Primary document restored from pre-migration backup");
            } else if (!primaryExisted && Files.deleteIfExists(primaryPath)) {
                LOG.info("Removed primary document written by the failed migration");
            }
            if (syncEnabled) {
                syncDirectory(dataDir);
            }
        } catch (IOException e) {
            LOG.error("Failed to restore pre-migration state of {}: {}", primaryPath, e.getMessage(), e);
            throw new DocumentWriteException("Failed to restore pre-migration state of " + primaryPath, e);
        }
    }

    @Override
    public void discardPreMigrationBackup() {
        deleteIfPresent(preMigrationPath);
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private void requireOpen() {
        if (!opened || closed) {
            throw new IllegalStateException("Document store is not open: " + dataDir);
        }
    }

    private static Path sibling(Path path, String suffix) {
        return path.resolveSibling(path.getFileName().toString() + suffix);
    }

    private static void deleteIfPresent(Path path) {
        try {
            if (Files.deleteIfExists(path)) {
                LOG.debug("Deleted {}", path);
            }
        } catch (IOException e) {
            LOG.warn("Could not delete {}: {}", path, e.getMessage());
        }
    }

    /**
     * Fsyncs a directory to ensure metadata changes (renames) are durable.
     * <p>
     * On Windows, this may fail or be a no-op. That's acceptable for development.
     * On Linux (ext4/xfs), this is critical for durability.
     */
    private void syncDirectory(Path dir) {
        // Skip on Windows - directory sync isn't supported the same way
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            LOG.trace("Skipping directory sync on Windows");
            return;
        }

        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            // Some systems don't support directory fsync - log but continue
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }

    /**
     * Acquires an exclusive lock on the data directory to prevent multiple writers.
     *
     * @throws StoreException if the lock is held by another process or instance
     */
    private void acquireExclusiveLock() throws IOException {
        Path lockPath = dataDir.resolve(LOCK_FILE);
        LOG.debug("Acquiring exclusive lock: {}", lockPath);

        lockChannel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);

        try {
            exclusiveLock = lockChannel.tryLock();
            if (exclusiveLock == null) {
                lockChannel.close();
                LOG.error("Cannot acquire exclusive lock: another process holds the lock");
                throw new StoreException(
                        "Cannot acquire exclusive lock on " + dataDir +
                        ". Another process may be using this store.");
            }
            LOG.info("Exclusive lock acquired: {}", lockPath);
        } catch (OverlappingFileLockException e) {
            lockChannel.close();
            LOG.error("Cannot acquire exclusive lock: lock already held in this JVM");
            throw new StoreException(
                    "Cannot acquire exclusive lock: lock already held in this JVM", e);
        }
    }

    private void releaseExclusiveLock() {
        try {
            if (exclusiveLock != null && exclusiveLock.isValid()) {
                exclusiveLock.release();
                LOG.debug("Exclusive lock released");
            }
        } catch (IOException e) {
            LOG.warn("Could not release lock: {}", e.getMessage());
        }
        try {
            if (lockChannel != null && lockChannel.isOpen()) {
                lockChannel.close();
                LOG.trace("Lock channel closed");
            }
        } catch (IOException e) {
            LOG.warn("Could not close lock channel: {}", e.getMessage());
        }
    }

    private void warnOnLowDiskSpace() throws IOException {
        long usable = Files.getFileStore(dataDir).getUsableSpace();
        if (usable < minFreeSpace) {
            LOG.warn("Low disk space at {}: {} MB available, writes need at least {} MB",
                    dataDir, usable / 1024 / 1024, minFreeSpace / 1024 / 1024);
        }
    }

    /**
     * Checks that the write fits with the configured headroom to spare.
     *
     * @throws DocumentWriteException if disk space is below the threshold
     */
    private void checkDiskSpace(long bytesToWrite) throws IOException {
        FileStore store = Files.getFileStore(dataDir);
        long usableSpace = store.getUsableSpace();
        long required = minFreeSpace + bytesToWrite;

        LOG.trace("Disk space check: {} bytes available, {} bytes required", usableSpace, required);

        if (usableSpace < required) {
            LOG.error("Insufficient disk space: {} MB available, need at least {} MB",
                    usableSpace / 1024 / 1024, required / 1024 / 1024);
            throw new DocumentWriteException(
                    "Insufficient disk space: " + usableSpace / 1024 / 1024 + " MB available, " +
                    "need at least " + required / 1024 / 1024 + " MB");
        }
    }
}
