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
package dev.mars.vercon.repository;

import dev.mars.vercon.ErrorKind;
import dev.mars.vercon.VerConException;
import dev.mars.vercon.history.ArtifactName;
import dev.mars.vercon.history.ContentKind;
import dev.mars.vercon.history.EventState;
import dev.mars.vercon.store.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Rolls back a commit that was interrupted before it removed its {@code LOCK}.
 * <p>
 * <b>Recovery sequence</b> for a lock holding revision R:
 * <ol>
 *   <li>Copy every {@code BAK<R>- X} back over {@code X}. Copying, not moving,
 *       keeps the backups intact if recovery itself is interrupted.</li>
 *   <li>For every live artifact put back that way, delete the historical
 *       artifact the commit made out of it.</li>
 *   <li>Delete every {@code ET<R>-}, {@code EB<R>-} and {@code D<R>-} artifact.</li>
 *   <li>Delete {@code LOCK}, then the backups.</li>
 * </ol>
 * The sequence is idempotent: running it again after a crash in any step
 * leaves the store at the end of revision R-1.
 */
final class CrashRecovery {

    private static final Logger LOG = LoggerFactory.getLogger(CrashRecovery.class);

    private CrashRecovery() {
    }

    /**
     * Checks for a lock and rolls back if one is found. Without a lock, only
     * leftovers of a commit that had already completed are swept: a temp lock
     * that was never renamed into place and backups whose removal was cut short.
     *
     * @return true if an interrupted commit was found and undone
     * @throws VerConException {@link ErrorKind#MALFORMED_METADATA} if the lock does not
     *                         hold a positive revision number
     */
    static boolean recoverIfNeeded(RepositoryLayout layout, ArtifactStore store) {
        Path lock = layout.lockFile();
        if (store.delete(ArtifactStore.tempPathFor(lock))) {
            LOG.warn("Removed partially written {}", ArtifactStore.tempPathFor(lock));
        }
        if (!Files.exists(lock)) {
            sweepStaleBackups(layout, store);
            return false;
        }

        String content = store.readText(lock).trim();
        if (content.isEmpty()) {
            // Nothing is backed up or written before LOCK holds its revision
            LOG.warn("Empty {} found, no commit work to roll back", lock);
            store.delete(lock);
            sweepStaleBackups(layout, store);
            return true;
        }

        int revision = parseLock(content);
        LOG.warn("Interrupted commit of revision {} detected in {}, rolling back", revision, layout.repoDir());

        String prefix = ArtifactStore.backupPrefix(revision);
        List<Path> backups = listFiles(layout.repoDir()).stream()
                .filter(p -> p.getFileName().toString().startsWith(prefix))
                .collect(Collectors.toList());

        // 1 + 2. Put pre-commit artifacts back
        for (Path backup : backups) {
            Path original = backup.resolveSibling(backup.getFileName().toString().substring(prefix.length()));
            store.copy(backup, original);
            dropHistoricalSibling(original, store);
        }

        // 3. Remove what the interrupted commit created
        int removed = 0;
        for (Path artifact : listFiles(layout.dataDir())) {
            Optional<ArtifactName> name = ArtifactName.parse(artifact.getFileName().toString());
            if (name.isPresent() && name.get().revision() == revision
                    && name.get().state() != EventState.HISTORICAL) {
                store.delete(artifact);
                removed++;
            }
        }
        store.delete(ArtifactStore.tempPathFor(layout.metadataFile()));

        // 4. Done
        store.delete(lock);
        for (Path backup : backups) {
            store.delete(backup);
        }

        LOG.info("Rolled back revision {}: {} backups restored, {} artifacts removed",
                revision, backups.size(), removed);
        return true;
    }

    private static int parseLock(String content) {
        try {
            int revision = Integer.parseInt(content);
            if (revision > 0) {
                return revision;
            }
        } catch (NumberFormatException e) {
            LOG.error("Unreadable lock file content: '{}'", content);
        }
        throw new VerConException(ErrorKind.MALFORMED_METADATA,
                "LOCK does not hold a revision number: '" + content + "'");
    }

    /**
     * Backups outlive their commit only when the process stopped between
     * removing {@code LOCK} and removing them. With no lock present they are
     * never needed again.
     */
    private static void sweepStaleBackups(RepositoryLayout layout, ArtifactStore store) {
        int swept = 0;
        for (Path file : listFiles(layout.repoDir())) {
            if (ArtifactStore.isBackupName(file.getFileName().toString()) && store.delete(file)) {
                swept++;
            }
        }
        if (swept > 0) {
            LOG.warn("Removed {} stale backups left by a completed commit", swept);
        }
    }

    /**
     * A live artifact {@code ET<p>-}/{@code EB<p>-} that had to be restored was
     * historicized by the interrupted commit; its historical form must go.
     */
    private static void dropHistoricalSibling(Path restored, ArtifactStore store) {
        Optional<ArtifactName> name = ArtifactName.parse(restored.getFileName().toString());
        if (name.isEmpty() || name.get().state() != EventState.LIVE) {
            return;
        }
        for (ContentKind kind : ContentKind.values()) {
            ArtifactName historical = ArtifactName.of(EventState.HISTORICAL, kind,
                    name.get().revision(), name.get().fileName());
            if (store.delete(restored.resolveSibling(historical.toString()))) {
                LOG.debug("Dropped {} superseded by the interrupted commit", historical);
            }
        }
    }

    private static List<Path> listFiles(Path root) {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            LOG.error("Failed to scan {}: {}", root, e.getMessage(), e);
            throw new VerConException(ErrorKind.IO_FAILURE, "Failed to scan " + root + ": " + e.getMessage(), e);
        }
    }
}
