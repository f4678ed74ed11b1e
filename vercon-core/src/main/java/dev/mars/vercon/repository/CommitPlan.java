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
import dev.mars.vercon.history.VersionedFile;
import dev.mars.vercon.store.ArtifactStore;
import dev.mars.vercon.tree.DirectoryNode;
import dev.mars.vercon.tree.DirectoryTree;
import dev.mars.vercon.tree.PathChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The differences between the working tree and the last revision, computed
 * without touching the store.
 * <p>
 * <b>Usage Pattern (Scan → Persist → Apply):</b>
 * <pre>{@code
 * // 1. Calculate the plan (only touched flags change)
 * CommitPlan plan = CommitPlan.scan(layout, tree);
 *
 * // 2. Nothing to do?
 * if (!plan.requiresPersistence()) return CommitResult.NO_CHANGE;
 *
 * // 3. Persist the additions, then let the tree delete what was not seen
 * }</pre>
 * Creations and modifications are listed in walk order: within a directory,
 * subdirectories by name (each followed by its contents), then files by name.
 * Deletions are not listed; they are whatever the walk left untouched.
 *
 * @param additions   planned directory creations, file creations and file modifications;
 *                    the content kind of file entries is not known yet and left {@code null}
 * @param deletions   number of active directories and live files the walk did not see
 */
record CommitPlan(List<PathChange> additions, int deletions) {

    private static final Logger LOG = LoggerFactory.getLogger(CommitPlan.class);

    CommitPlan {
        additions = additions == null ? Collections.emptyList() : List.copyOf(additions);
    }

    /**
     * Walks the working tree and compares it with the tree's last revision.
     * <p>
     * Resets then sets the touched flags of {@code tree}: every active
     * directory and unchanged or modified live file found on disk ends up
     * touched.
     */
    static CommitPlan scan(RepositoryLayout layout, DirectoryTree tree) {
        tree.resetTouched();
        List<PathChange> additions = new ArrayList<>();
        scanDirectory(layout, tree, "", additions);
        int deletions = tree.countUntouched();
        LOG.debug("Scanned {}: {} additions/modifications, {} deletions",
                layout.baseDir(), additions.size(), deletions);
        return new CommitPlan(additions, deletions);
    }

    /**
     * @return true if the working tree differs from the last revision
     */
    boolean requiresPersistence() {
        return !additions.isEmpty() || deletions > 0;
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private static void scanDirectory(RepositoryLayout layout, DirectoryTree tree,
                                      String relativeDir, List<PathChange> additions) {
        List<String> directories = new ArrayList<>();
        List<String> files = new ArrayList<>();
        list(layout, relativeDir, directories, files);

        Optional<DirectoryNode> node = tree.find(relativeDir).filter(DirectoryNode::isActive);

        for (String name : directories) {
            String path = RepositoryLayout.join(relativeDir, name);
            Optional<DirectoryNode> child = node.flatMap(n -> tree.child(n, name));
            if (child.isPresent() && child.get().isActive()) {
                child.get().touch();
            } else {
                additions.add(PathChange.directoryCreated(path));
            }
            scanDirectory(layout, tree, path, additions);
        }

        for (String name : files) {
            String path = RepositoryLayout.join(relativeDir, name);
            Optional<VersionedFile> file = node.flatMap(n -> n.file(name)).filter(VersionedFile::isLive);
            if (file.isEmpty()) {
                additions.add(PathChange.fileCreated(path, null));
                continue;
            }
            file.get().touch();
            if (file.get().isModified()) {
                additions.add(PathChange.fileModified(path, null));
            }
        }
    }

    /**
     * Sorts the entries of a working directory into subdirectories and
     * regular files, both by name. Skips the top-level store directory,
     * symbolic links and special files.
     */
    private static void list(RepositoryLayout layout, String relativeDir,
                             List<String> directories, List<String> files) {
        Path dir = layout.workingPath(relativeDir);
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (relativeDir.isEmpty() && name.equals(RepositoryLayout.REPO_DIR)) {
                    continue;
                }
                if (Files.isSymbolicLink(entry)) {
                    LOG.warn("Skipping symbolic link {}", entry);
                } else if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    requireStorableDirectoryName(entry, name);
                    directories.add(name);
                } else if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
                    files.add(name);
                } else {
                    LOG.warn("Skipping special file {}", entry);
                }
            }
        } catch (IOException e) {
            LOG.error("Failed to list {}: {}", dir, e.getMessage(), e);
            throw new VerConException(ErrorKind.IO_FAILURE, "Failed to list " + dir + ": " + e.getMessage(), e);
        }
        Collections.sort(directories);
        Collections.sort(files);
    }

    /**
     * Data directories share their parent with file artifacts and backups, so a
     * working directory named like one of them would collide with the store.
     *
     * @throws VerConException {@link ErrorKind#PATH_CONFLICT} for such a directory
     */
    private static void requireStorableDirectoryName(Path entry, String name) {
        if (ArtifactName.parse(name).isPresent() || ArtifactStore.isBackupName(name)) {
            LOG.warn("Directory {} is named like a store artifact and cannot be committed", entry);
            throw new VerConException(ErrorKind.PATH_CONFLICT,
                    "Directory name collides with the store's artifact naming: " + entry);
        }
    }
}
