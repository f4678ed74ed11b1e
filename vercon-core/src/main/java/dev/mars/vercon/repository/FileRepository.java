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
 * File-based implementation of {@link Repository}.
 * <p>
 * <b>Opening a repository:</b>
 * <ol>
 *   <li>Walk up from the given directory to the nearest one containing
 *       {@code REPO}; if there is none, the given directory becomes the base
 *       and an empty store is created in it</li>
 *   <li>Roll back an interrupted commit if {@code LOCK} is present</li>
 *   <li>Rebuild the directory tree from {@code metadatadir.txt} and every
 *       file's event log from the artifact names under {@code REPO/DATA}</li>
 * </ol>
 * <p>
 * <b>Failure handling:</b> an operation that fails may leave the in-memory
 * state out of step with the store. The instance then marks itself, and the
 * next operation repeats steps 2 and 3 before doing anything else.
 * <p>
 * Not thread-safe.
 */
public final class FileRepository implements Repository {

    private static final Logger LOG = LoggerFactory.getLogger(FileRepository.class);

    private final RepositoryLayout layout;
    private final RepositoryConfig config;
    private final ArtifactStore store;
    private final CommitLog commitLog;
    private final CommitPipeline commitPipeline;
    private final RestoreEngine restoreEngine;

    private DirectoryTree tree;
    private boolean needsRecovery;

    private FileRepository(RepositoryLayout layout, RepositoryConfig config) {
        this.layout = layout;
        this.config = config;
        this.store = new ArtifactStore(config.syncEnabled(), config.preserveTimestamps());
        this.commitLog = new CommitLog(layout.commitsFile(), store);
        this.commitPipeline = new CommitPipeline(layout, store, commitLog, config);
        this.restoreEngine = new RestoreEngine(layout, store);
    }

    /**
     * Opens the repository governing {@code directory} with configuration
     * resolved by {@link RepositoryConfig#load()}.
     */
    public static FileRepository open(Path directory) {
        return open(directory, RepositoryConfig.load());
    }

    /**
     * Opens the repository governing {@code directory}, creating one there if
     * neither it nor any ancestor holds a {@code REPO} directory.
     *
     * @throws VerConException {@link ErrorKind#MALFORMED_METADATA} if the store cannot be
     *                         read back; {@link ErrorKind#IO_FAILURE} on I/O errors
     */
    public static FileRepository open(Path directory, RepositoryConfig config) {
        Path start = directory.toAbsolutePath().normalize();
        Path base = locate(start).orElse(start);
        LOG.info("Opening repository at {} with {}", base, config);

        FileRepository repository = new FileRepository(new RepositoryLayout(base), config);
        repository.initialize();
        CrashRecovery.recoverIfNeeded(repository.layout, repository.store);
        repository.load();
        return repository;
    }

    // ========================================================================
    // Repository
    // ========================================================================

    @Override
    public CommitResult commit(String comment) {
        ensureRecovered();
        try {
            return commitPipeline.commit(tree, comment);
        } catch (RuntimeException e) {
            needsRecovery = true;
            LOG.error("Commit failed, repository will be recovered before next use: {}", e.getMessage());
            throw e;
        }
    }

    @Override
    public String list(boolean verbose) {
        ensureRecovered();
        return commitLog.list(verbose);
    }

    @Override
    public RestoreResult restoreTo(Optional<Integer> revision, String filter) {
        ensureRecovered();
        int last = lastRevision();
        int target = revision.orElse(last);
        if (target < 1 || target > last) {
            throw new VerConException(ErrorKind.REVISION_OUT_OF_RANGE,
                    "Revision " + target + " is out of range; committed revisions are 1.." + last);
        }
        return restoreEngine.restore(tree, target, filter);
    }

    @Override
    public int lastRevision() {
        ensureRecovered();
        return tree.maxRevision();
    }

    @Override
    public Path baseDir() {
        return layout.baseDir();
    }

    @Override
    public Path repoDir() {
        return layout.repoDir();
    }

    public RepositoryConfig config() {
        return config;
    }

    @Override
    public String toString() {
        return "FileRepository{" + layout.baseDir() + ", lastRevision=" + tree.maxRevision() + '}';
    }

    /**
     * Creates the tracking object of a file; its artifacts live in the data
     * directory mirroring the file's parent.
     */
    static VersionedFile newVersionedFile(RepositoryLayout layout, ArtifactStore store, String relativePath) {
        return new VersionedFile(relativePath,
                layout.workingPath(relativePath),
                layout.dataDirFor(RepositoryLayout.parentOf(relativePath)),
                store);
    }

    // ========================================================================
    // Startup
    // ========================================================================

    private static Optional<Path> locate(Path start) {
        for (Path dir = start; dir != null; dir = dir.getParent()) {
            if (Files.isDirectory(dir.resolve(RepositoryLayout.REPO_DIR))) {
                return Optional.of(dir);
            }
        }
        return Optional.empty();
    }

    /**
     * Creates whatever part of the store skeleton is missing; existing files are left alone.
     */
    private void initialize() {
        boolean fresh = !Files.isDirectory(layout.repoDir());
        store.createDirectories(layout.dataDir());
        if (!Files.exists(layout.metadataFile())) {
            store.writeText(layout.metadataFile(), "", null);
        }
        if (!Files.exists(layout.commitsFile())) {
            store.writeText(layout.commitsFile(), "", null);
        }
        if (fresh) {
            LOG.info("Created empty repository in {}", layout.repoDir());
        }
    }

    /**
     * Rebuilds the in-memory state from the store.
     */
    private void load() {
        DirectoryTree loaded = DirectoryTree.deserialize(store.readText(layout.metadataFile()));
        int files = 0;
        for (DirectoryNode node : loaded.preOrder()) {
            String dirPath = loaded.pathOf(node);
            for (Path artifact : artifactsIn(layout.dataDirFor(dirPath))) {
                Optional<ArtifactName> name = ArtifactName.parse(artifact.getFileName().toString());
                if (name.isEmpty()) {
                    LOG.debug("Ignoring {}: not an artifact", artifact);
                    continue;
                }
                String fileName = name.get().fileName();
                VersionedFile file = node.file(fileName).orElse(null);
                if (file == null) {
                    file = node.addFile(newVersionedFile(layout, store, RepositoryLayout.join(dirPath, fileName)));
                    files++;
                }
                file.loadEvent(name.get());
            }
            node.files().values().forEach(VersionedFile::verify);
        }
        loaded.recomputeMaxRevisions();

        this.tree = loaded;
        this.needsRecovery = false;
        LOG.info("Loaded {} directories and {} files, last revision {}",
                loaded.size() - 1, files, loaded.maxRevision());
    }

    private void ensureRecovered() {
        if (!needsRecovery) {
            return;
        }
        LOG.warn("Recovering {} after a failed operation", layout.repoDir());
        CrashRecovery.recoverIfNeeded(layout, store);
        load();
    }

    private static List<Path> artifactsIn(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            LOG.error("Failed to list artifacts in {}: {}", dir, e.getMessage(), e);
            throw new VerConException(ErrorKind.IO_FAILURE,
                    "Failed to list artifacts in " + dir + ": " + e.getMessage(), e);
        }
    }
}
