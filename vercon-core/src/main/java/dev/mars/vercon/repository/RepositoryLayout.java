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

/**
 * Locations of the working tree and of the store beneath it.
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * base/
 *  ├─ ...                 // working tree
 *  └─ REPO/
 *      ├─ metadatadir.txt // directory histories
 *      ├─ commits.txt     // append-only commit log
 *      ├─ LOCK            // pending revision, only while a commit is in flight
 *      └─ DATA/           // mirror of the working tree holding per-file artifacts
 * </pre>
 *
 * @param baseDir root of the working tree
 */
public record RepositoryLayout(Path baseDir) {

    /** Name of the reserved metadata directory. */
    public static final String REPO_DIR = "REPO";
    public static final String DATA_DIR = "DATA";
    public static final String METADATA_FILE = "metadatadir.txt";
    public static final String COMMITS_FILE = "commits.txt";
    public static final String LOCK_FILE = "LOCK";

    public Path repoDir() {
        return baseDir.resolve(REPO_DIR);
    }

    public Path dataDir() {
        return repoDir().resolve(DATA_DIR);
    }

    public Path metadataFile() {
        return repoDir().resolve(METADATA_FILE);
    }

    public Path commitsFile() {
        return repoDir().resolve(COMMITS_FILE);
    }

    public Path lockFile() {
        return repoDir().resolve(LOCK_FILE);
    }

    /**
     * Artifact directory mirroring a working directory.
     *
     * @param relativePath POSIX directory path relative to the base; empty for the root
     */
    public Path dataDirFor(String relativePath) {
        return resolve(dataDir(), relativePath);
    }

    /**
     * Working-tree location of a POSIX relative path.
     */
    public Path workingPath(String relativePath) {
        return resolve(baseDir, relativePath);
    }

    /**
     * Joins POSIX path segments; the empty parent is the base.
     */
    public static String join(String parent, String name) {
        return parent.isEmpty() ? name : parent + "/" + name;
    }

    /**
     * @return the directory part of a POSIX relative path, empty for top-level entries
     */
    public static String parentOf(String relativePath) {
        int slash = relativePath.lastIndexOf('/');
        return slash < 0 ? "" : relativePath.substring(0, slash);
    }

    private static Path resolve(Path root, String relativePath) {
        Path out = root;
        if (!relativePath.isEmpty()) {
            for (String segment : relativePath.split("/")) {
                out = out.resolve(segment);
            }
        }
        return out;
    }
}
