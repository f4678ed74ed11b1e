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
import dev.mars.vercon.history.VersionedFile;
import dev.mars.vercon.store.ArtifactStore;
import dev.mars.vercon.tree.DirectoryNode;
import dev.mars.vercon.tree.DirectoryTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Brings the working tree back to a committed revision.
 * <p>
 * Runs in three phases: plan ({@link RestorePlan}), validate, apply. Nothing in
 * the working tree changes until validation has passed. The store is only
 * read.
 */
final class RestoreEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RestoreEngine.class);

    private final RepositoryLayout layout;
    private final ArtifactStore store;

    RestoreEngine(RepositoryLayout layout, ArtifactStore store) {
        this.layout = layout;
        this.store = store;
    }

    /**
     * @param revision a revision between 1 and the tree's maximum, checked by the caller
     * @param filter   regular expression matched at the start of each file path
     * @throws VerConException {@link ErrorKind#INVALID_FILTER} if {@code filter} does not compile
     */
    RestoreResult restore(DirectoryTree tree, int revision, String filter) {
        RestorePlan plan = RestorePlan.from(tree, revision, compile(filter));
        LOG.debug("Restore plan for revision {}: {} dirs, {} restores, {} file deletes, {} dir deletes",
                revision, plan.createDirectories().size(), plan.restoreFiles().size(),
                plan.deleteFiles().size(), plan.deleteDirectories().size());

        validate(tree, plan, revision != tree.maxRevision());
        RestoreResult result = apply(tree, plan);

        LOG.info("Restored {} to revision {}: {} files written, {} files and {} directories removed",
                layout.baseDir(), revision, result.restoredFiles().size(),
                result.deletedFiles().size(), result.deletedDirectories().size());
        return result;
    }

    // ========================================================================
    // Validation
    // ========================================================================

    /**
     * @param guardModified refuse to overwrite uncommitted working changes
     */
    private void validate(DirectoryTree tree, RestorePlan plan, boolean guardModified) {
        if (guardModified) {
            for (VersionedFile file : plan.affectedFiles()) {
                if (file.isModified()) {
                    throw new VerConException(ErrorKind.UNCOMMITTED_CHANGES,
                            file.relativePath() + " has uncommitted changes; commit them or restore the last revision");
                }
            }
        }

        for (DirectoryNode node : plan.deleteDirectories()) {
            String path = tree.pathOf(node);
            Path dir = layout.workingPath(path);
            if (!Files.exists(dir, LinkOption.NOFOLLOW_LINKS)) {
                continue;
            }
            if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
                throw new VerConException(ErrorKind.UNTRACKED_PATH,
                        path + " is expected to be a tracked directory but is not a directory");
            }
            for (String entry : entries(dir)) {
                if (!node.children().containsKey(entry) && node.file(entry).isEmpty()) {
                    throw new VerConException(ErrorKind.UNTRACKED_PATH,
                            RepositoryLayout.join(path, entry) + " is not tracked and would block removing " + path);
                }
            }
        }
    }

    // ========================================================================
    // Application
    // ========================================================================

    private RestoreResult apply(DirectoryTree tree, RestorePlan plan) {
        List<String> created = new ArrayList<>();
        List<String> restored = new ArrayList<>();
        List<String> deletedFiles = new ArrayList<>();
        List<String> deletedDirs = new ArrayList<>();

        for (DirectoryNode node : plan.createDirectories()) {
            String path = tree.pathOf(node);
            Path dir = layout.workingPath(path);
            if (Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
                continue;
            }
            if (Files.exists(dir, LinkOption.NOFOLLOW_LINKS)) {
                throw new VerConException(ErrorKind.PATH_CONFLICT,
                        "Cannot create directory " + path + ": a file is in the way");
            }
            store.createDirectories(dir);
            created.add(path);
        }

        for (VersionedFile file : plan.restoreFiles()) {
            Path target = file.workingFile();
            if (Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS)) {
                throw new VerConException(ErrorKind.PATH_CONFLICT,
                        "Cannot restore " + file.relativePath() + ": a directory is in the way");
            }
            store.writeBytes(target, file.contentsAt(plan.revision()).data(), null);
            restored.add(file.relativePath());
        }

        for (VersionedFile file : plan.deleteFiles()) {
            if (Files.isRegularFile(file.workingFile(), LinkOption.NOFOLLOW_LINKS) && store.delete(file.workingFile())) {
                deletedFiles.add(file.relativePath());
            }
        }

        List<DirectoryNode> deleteDirs = plan.deleteDirectories();
        for (int i = deleteDirs.size() - 1; i >= 0; i--) {
            String path = tree.pathOf(deleteDirs.get(i));
            if (deleteDirectory(path)) {
                deletedDirs.add(path);
            }
        }

        return new RestoreResult(plan.revision(), created, restored, deletedFiles, deletedDirs);
    }

    private boolean deleteDirectory(String path) {
        Path dir = layout.workingPath(path);
        try {
            return Files.deleteIfExists(dir);
        } catch (DirectoryNotEmptyException e) {
            throw new VerConException(ErrorKind.DIRECTORY_NOT_EMPTY,
                    "Cannot remove " + path + ": directory is not empty", e);
        } catch (IOException e) {
            LOG.error("Failed to remove directory {}: {}", dir, e.getMessage(), e);
            throw new VerConException(ErrorKind.IO_FAILURE,
                    "Failed to remove directory " + dir + ": " + e.getMessage(), e);
        }
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private static Pattern compile(String filter) {
        try {
            return Pattern.compile(filter);
        } catch (PatternSyntaxException e) {
            throw new VerConException(ErrorKind.INVALID_FILTER,
                    "Invalid filter '" + filter + "': " + e.getDescription(), e);
        }
    }

    private static List<String> entries(Path dir) {
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path entry : stream) {
                names.add(entry.getFileName().toString());
            }
        } catch (IOException e) {
            LOG.error("Failed to list {}: {}", dir, e.getMessage(), e);
            throw new VerConException(ErrorKind.IO_FAILURE, "Failed to list " + dir + ": " + e.getMessage(), e);
        }
        return names;
    }
}
