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
package dev.mars.vercon.store;

import dev.mars.vercon.ErrorKind;
import dev.mars.vercon.VerConException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * All store-side file I/O of a repository.
 * <p>
 * Every write, rename and delete performed on {@code REPO/} goes through this
 * class so that durability and backups are handled in one place.
 * <p>
 * <b>Durability:</b>
 * <ul>
 *   <li>Artifact writes: written in full, then fsynced when sync is enabled</li>
 *   <li>Metadata replace: write temp, fsync, atomic rename, fsync directory</li>
 *   <li>Renames and deletes: directory fsynced afterwards</li>
 * </ul>
 * <p>
 * <b>Backups:</b> between {@link #beginRevision(int)} and
 * {@link #discardBackups()}, {@link #backup(Path)} copies an artifact that is
 * about to be replaced or removed to a sibling named {@code BAK<R>- <name>}.
 * Crash recovery copies those back if the commit never completed.
 */
public final class ArtifactStore {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactStore.class);

    /** Prefix of backup artifacts, followed by the pending revision and {@code "- "}. */
    public static final String BACKUP_PREFIX = "BAK";

    /** Suffix of the temp file written by {@link #replaceAtomically(Path, String)}. */
    public static final String TMP_SUFFIX = ".tmp";

    private static final Pattern BACKUP_NAME = Pattern.compile(BACKUP_PREFIX + "\\d+- .+");

    private final boolean syncEnabled;
    private final boolean preserveTimestamps;

    private int pendingRevision;
    private final List<Path> backups = new ArrayList<>();

    /**
     * @param syncEnabled        fsync files and directories after writes
     * @param preserveTimestamps copy the working file's modification time onto artifacts
     */
    public ArtifactStore(boolean syncEnabled, boolean preserveTimestamps) {
        this.syncEnabled = syncEnabled;
        this.preserveTimestamps = preserveTimestamps;
        if (!syncEnabled) {
            LOG.warn("ArtifactStore created with fsync DISABLED. A crash may lose committed data.");
        }
    }

    // ========================================================================
    // Backups
    // ========================================================================

    /**
     * Starts backing up artifacts for a commit targeting {@code revision}.
     */
    public void beginRevision(int revision) {
        if (revision <= 0) {
            throw new IllegalArgumentException("Revision must be positive: " + revision);
        }
        this.pendingRevision = revision;
        this.backups.clear();
        LOG.debug("Backups armed for revision {}", revision);
    }

    /**
     * @return the revision being committed, or 0 outside a commit
     */
    public int pendingRevision() {
        return pendingRevision;
    }

    /**
     * Copies {@code artifact} to its backup sibling before it gets replaced.
     * Missing artifacts are ignored.
     *
     * @return the backup path, or {@code null} if there was nothing to back up
     */
    public Path backup(Path artifact) {
        if (pendingRevision == 0) {
            throw new IllegalStateException("backup() called outside a commit: " + artifact);
        }
        if (!Files.exists(artifact)) {
            return null;
        }
        Path backup = backupPathFor(artifact, pendingRevision);
        try {
            Files.copy(artifact, backup,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.COPY_ATTRIBUTES);
            if (syncEnabled) {
                force(backup);
            }
            backups.add(backup);
            LOG.trace("Backed up {} -> {}", artifact.getFileName(), backup.getFileName());
            return backup;
        } catch (IOException e) {
            LOG.error("Failed to back up {}: {}", artifact, e.getMessage(), e);
            throw ioFailure("Failed to back up " + artifact, e);
        }
    }

    /**
     * @return the backups taken since {@link #beginRevision(int)}
     */
    public List<Path> backups() {
        return Collections.unmodifiableList(backups);
    }

    /**
     * Deletes the backups of the current commit once it is fully persisted.
     */
    public void discardBackups() {
        for (Path backup : backups) {
            delete(backup);
        }
        LOG.debug("Discarded {} backups of revision {}", backups.size(), pendingRevision);
        backups.clear();
        pendingRevision = 0;
    }

    /**
     * Backup location of {@code artifact} for a commit targeting {@code revision}.
     */
    public static Path backupPathFor(Path artifact, int revision) {
        return artifact.resolveSibling(backupPrefix(revision) + artifact.getFileName());
    }

    /**
     * File name prefix of every backup taken for {@code revision}.
     */
    public static String backupPrefix(int revision) {
        return BACKUP_PREFIX + revision + "- ";
    }

    /**
     * @return true if {@code fileName} has the form {@code BAK<R>- <name>}
     */
    public static boolean isBackupName(String fileName) {
        return BACKUP_NAME.matcher(fileName).matches();
    }

    /**
     * Temp sibling used while {@code target} is replaced atomically.
     */
    public static Path tempPathFor(Path target) {
        return target.resolveSibling(target.getFileName() + TMP_SUFFIX);
    }

    // ========================================================================
    // Reads
    // ========================================================================

    public byte[] readBytes(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            LOG.error("Failed to read {}: {}", path, e.getMessage(), e);
            throw ioFailure("Failed to read " + path, e);
        }
    }

    public String readText(Path path) {
        return new String(readBytes(path), StandardCharsets.UTF_8);
    }

    /**
     * Compares two files byte for byte.
     *
     * @return true if both hold identical bytes
     */
    public boolean sameContent(Path a, Path b) {
        try {
            return Files.mismatch(a, b) == -1L;
        } catch (IOException e) {
            LOG.error("Failed to compare {} and {}: {}", a, b, e.getMessage(), e);
            throw ioFailure("Failed to compare " + a + " with " + b, e);
        }
    }

    // ========================================================================
    // Writes
    // ========================================================================

    /**
     * Writes {@code data} to {@code target}, replacing any previous content.
     *
     * @param timestampSource file whose modification time is copied onto the
     *                        target, or {@code null}
     */
    public void writeBytes(Path target, byte[] data, Path timestampSource) {
        try {
            writeFully(target, data, StandardOpenOption.TRUNCATE_EXISTING);
            if (preserveTimestamps && timestampSource != null && Files.exists(timestampSource)) {
                FileTime mtime = Files.getLastModifiedTime(timestampSource);
                Files.setLastModifiedTime(target, mtime);
            }
            LOG.trace("Wrote {} bytes to {}", data.length, target.getFileName());
        } catch (IOException e) {
            LOG.error("Failed to write {}: {}", target, e.getMessage(), e);
            throw ioFailure("Failed to write " + target, e);
        }
    }

    public void writeText(Path target, String text, Path timestampSource) {
        writeBytes(target, text.getBytes(StandardCharsets.UTF_8), timestampSource);
    }

    /**
     * Replaces {@code target} atomically: temp file, fsync, atomic rename,
     * directory fsync.
     */
    public void replaceAtomically(Path target, String text) {
        Path tmp = tempPathFor(target);
        try {
            writeFully(tmp, text.getBytes(StandardCharsets.UTF_8), StandardOpenOption.TRUNCATE_EXISTING);
            Files.move(tmp, target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            LOG.trace("Atomic rename: {} -> {}", tmp.getFileName(), target.getFileName());
            if (syncEnabled) {
                syncDirectory(target.getParent());
            }
        } catch (IOException e) {
            LOG.error("Failed to replace {}: {}", target, e.getMessage(), e);
            throw ioFailure("Failed to replace " + target, e);
        }
    }

    /**
     * Appends UTF-8 text to {@code target}, creating it if needed.
     */
    public void append(Path target, String text) {
        try {
            writeFully(target, text.getBytes(StandardCharsets.UTF_8), StandardOpenOption.APPEND);
        } catch (IOException e) {
            LOG.error("Failed to append to {}: {}", target, e.getMessage(), e);
            throw ioFailure("Failed to append to " + target, e);
        }
    }

    /**
     * Renames an artifact within the store.
     */
    public void move(Path from, Path to) {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
            LOG.trace("Moved {} -> {}", from.getFileName(), to.getFileName());
            if (syncEnabled) {
                syncDirectory(to.getParent());
            }
        } catch (IOException e) {
            LOG.error("Failed to move {} to {}: {}", from, to, e.getMessage(), e);
            throw ioFailure("Failed to move " + from + " to " + to, e);
        }
    }

    /**
     * Copies {@code from} over {@code to}; used by recovery so that a backup
     * survives a crash in the middle of being restored.
     */
    public void copy(Path from, Path to) {
        try {
            Files.copy(from, to,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.COPY_ATTRIBUTES);
            if (syncEnabled) {
                force(to);
            }
            LOG.trace("Copied {} -> {}", from.getFileName(), to.getFileName());
        } catch (IOException e) {
            LOG.error("Failed to copy {} to {}: {}", from, to, e.getMessage(), e);
            throw ioFailure("Failed to copy " + from + " to " + to, e);
        }
    }

    /**
     * Deletes a file if present.
     *
     * @return true if something was deleted
     */
    public boolean delete(Path path) {
        try {
            boolean deleted = Files.deleteIfExists(path);
            if (deleted) {
                LOG.trace("Deleted {}", path.getFileName());
            }
            return deleted;
        } catch (IOException e) {
            LOG.error("Failed to delete {}: {}", path, e.getMessage(), e);
            throw ioFailure("Failed to delete " + path, e);
        }
    }

    public void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            LOG.error("Failed to create directory {}: {}", dir, e.getMessage(), e);
            throw ioFailure("Failed to create directory " + dir, e);
        }
    }

    /**
     * Checks that sufficient disk space is available.
     *
     * @throws VerConException {@link ErrorKind#INSUFFICIENT_SPACE} if usable space is
     *                         below {@code minFreeBytes}
     */
    public void checkDiskSpace(Path dir, long minFreeBytes) {
        if (minFreeBytes <= 0) {
            return;
        }
        try {
            FileStore store = Files.getFileStore(dir);
            long usableSpace = store.getUsableSpace();
            LOG.trace("Disk space check: {} MB available, {} MB required",
                    usableSpace / 1024 / 1024, minFreeBytes / 1024 / 1024);
            if (usableSpace < minFreeBytes) {
                LOG.error("Insufficient disk space: {} MB available, need at least {} MB",
                        usableSpace / 1024 / 1024, minFreeBytes / 1024 / 1024);
                throw new VerConException(ErrorKind.INSUFFICIENT_SPACE,
                        "Insufficient disk space: " + usableSpace / 1024 / 1024 + " MB available, "
                                + "need at least " + minFreeBytes / 1024 / 1024 + " MB");
            }
        } catch (IOException e) {
            throw ioFailure("Failed to check disk space of " + dir, e);
        }
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private void writeFully(Path target, byte[] data, StandardOpenOption mode) throws IOException {
        ByteBuffer buf = ByteBuffer.wrap(data);
        try (FileChannel ch = FileChannel.open(target,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                mode)) {
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            if (syncEnabled) {
                ch.force(true);
            }
        }
    }

    private void force(Path file) throws IOException {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.WRITE)) {
            ch.force(true);
        }
    }

    /**
     * Fsyncs a directory so that renames and deletes in it are durable.
     * <p>
     * Not supported on Windows; some filesystems refuse it too. Both cases are
     * logged and tolerated.
     */
    private void syncDirectory(Path dir) {
        if (dir == null || System.getProperty("os.name").toLowerCase().contains("win")) {
            return;
        }
        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }

    private static VerConException ioFailure(String message, IOException cause) {
        return new VerConException(ErrorKind.IO_FAILURE, message + ": " + cause.getMessage(), cause);
    }
}
