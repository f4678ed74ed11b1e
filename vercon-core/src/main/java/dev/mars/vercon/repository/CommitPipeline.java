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

import dev.mars.vercon.history.ContentKind;
import dev.mars.vercon.history.VersionedFile;
import dev.mars.vercon.store.ArtifactStore;
import dev.mars.vercon.tree.DirectoryNode;
import dev.mars.vercon.tree.DirectoryTree;
import dev.mars.vercon.tree.PathChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link CommitPlan} into a persisted revision.
 * <p>
 * <b>Write order:</b>
 * <ol>
 *   <li>Free-space pre-flight</li>
 *   <li>{@code LOCK} holding the new revision, written atomically so it is
 *       either absent or complete</li>
 *   <li>Backups of {@code metadatadir.txt} and {@code commits.txt}</li>
 *   <li>Artifacts of created and modified paths (each rename/delete backed up)</li>
 *   <li>Delete markers for everything the walk did not see</li>
 *   <li>{@code metadatadir.txt}, replaced atomically</li>
 *   <li>The commit-log entry</li>
 *   <li>{@code LOCK} removed: the revision is durable from here on</li>
 *   <li>Backups removed</li>
 * </ol>
 * A failure anywhere from step 2 to step 8 leaves {@code LOCK} behind and the
 * in-memory tree half-updated; the caller must run crash recovery and
 * reload before using the repository again.
 */
final class CommitPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(CommitPipeline.class);

    private final RepositoryLayout layout;
    private final ArtifactStore store;
    private final CommitLog commitLog;
    private final RepositoryConfig config;

    CommitPipeline(RepositoryLayout layout, ArtifactStore store, CommitLog commitLog, RepositoryConfig config) {
        this.layout = layout;
        this.store = store;
        this.commitLog = commitLog;
        this.config = config;
    }

    CommitResult commit(DirectoryTree tree, String comment) {
        CommitPlan plan = CommitPlan.scan(layout, tree);
        if (!plan.requiresPersistence()) {
            LOG.info("Nothing to commit in {}", layout.baseDir());
            return CommitResult.NO_CHANGE;
        }

        int revision = tree.maxRevision() + 1;
        store.checkDiskSpace(layout.repoDir(), config.minFreeSpaceBytes());

        store.beginRevision(revision);
        store.replaceAtomically(layout.lockFile(), Integer.toString(revision));
        store.backup(layout.metadataFile());
        store.backup(layout.commitsFile());

        List<PathChange> changes = new ArrayList<>(plan.additions().size() + plan.deletions());
        for (PathChange addition : plan.additions()) {
            changes.add(apply(tree, addition, revision));
        }
        tree.markUntouchedDeleted(revision, changes);

        store.replaceAtomically(layout.metadataFile(), tree.serialize());
        commitLog.append(revision, comment, changes);

        store.delete(layout.lockFile());
        store.discardBackups();

        LOG.info("Committed revision {} ({} changes)", revision, changes.size());
        return new CommitResult(revision, changes);
    }

    /**
     * Persists one planned addition.
     *
     * @return the change as it goes into the commit log, with its content kind resolved
     */
    private PathChange apply(DirectoryTree tree, PathChange addition, int revision) {
        String path = addition.path();
        switch (addition.type()) {
            case DIR_CREATED -> {
                tree.add(path, revision);
                store.createDirectories(layout.dataDirFor(path));
                return addition;
            }
            case FILE_CREATED -> {
                DirectoryNode parent = tree.atPath(RepositoryLayout.parentOf(path));
                VersionedFile file = parent.file(fileName(path))
                        .orElseGet(() -> parent.addFile(FileRepository.newVersionedFile(layout, store, path)));
                ContentKind kind = file.createAtRevision(revision);
                file.touch();
                tree.recordRevision(parent, revision);
                return PathChange.fileCreated(path, kind);
            }
            case FILE_MODIFIED -> {
                DirectoryNode parent = tree.atPath(RepositoryLayout.parentOf(path));
                VersionedFile file = parent.file(fileName(path))
                        .orElseThrow(() -> new IllegalStateException("Planned modification of unknown file " + path));
                ContentKind kind = file.changeAtRevision(revision);
                tree.recordRevision(parent, revision);
                return PathChange.fileModified(path, kind);
            }
            default -> throw new IllegalStateException("Not an addition: " + addition);
        }
    }

    private static String fileName(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
