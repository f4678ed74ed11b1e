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

import java.nio.file.Path;
import java.util.Optional;

/**
 * Single-user version control over one working tree.
 * <p>
 * A repository snapshots the tree under its base directory into the reserved
 * {@code REPO} directory and can bring the tree back to any committed
 * revision.
 * <p>
 * <b>Critical Contract:</b> a commit is atomic from the caller's point of
 * view. If it fails or the process dies half way, the next open (or the next
 * call on this instance) rolls the store back to the previous revision.
 * <p>
 * Not thread-safe, and not protected against a second process working on the
 * same store.
 *
 * @see FileRepository
 */
public interface Repository {

    /** Default restore filter: every path. */
    String ALL_PATHS = ".*";

    /**
     * Records every difference between the working tree and the last revision.
     *
     * @param comment free text stored in the commit log
     * @return the new revision and its changes, or {@link CommitResult#NO_CHANGE}
     *         if the working tree matches the last revision
     */
    CommitResult commit(String comment);

    /**
     * Returns the commit log.
     *
     * @param verbose true for the raw log with every changed path, false for
     *                the {@code "<R>. <comment>"} header lines only
     */
    String list(boolean verbose);

    /**
     * Brings the working tree back to a committed revision.
     * <p>
     * Restoring to the last revision discards uncommitted working changes;
     * restoring to an earlier one refuses to run while such changes exist.
     *
     * @param revision target revision, empty for the last revision
     * @param filter   regular expression matched against the start of each
     *                 POSIX relative file path
     * @return what was created, restored and deleted
     */
    RestoreResult restoreTo(Optional<Integer> revision, String filter);

    /**
     * {@link #restoreTo(Optional, String)} over every path.
     */
    default RestoreResult restoreTo(Optional<Integer> revision) {
        return restoreTo(revision, ALL_PATHS);
    }

    /**
     * @return the last committed revision, 0 if nothing was ever committed
     */
    int lastRevision();

    /** Root of the working tree. */
    Path baseDir();

    /** The reserved {@code REPO} directory. */
    Path repoDir();
}
