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

import dev.mars.vercon.store.ArtifactStore;
import dev.mars.vercon.tree.PathChange;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * The human-readable, append-only commit log ({@code commits.txt}).
 * <p>
 * <b>Entry format:</b>
 * <pre>
 * 3. fix typos
 *   +d docs
 *   +ft docs/intro.txt
 *   *fb logo.png
 *   -f old.txt
 *
 * </pre>
 */
final class CommitLog {

    private static final String INDENT = "  ";

    private final Path file;
    private final ArtifactStore store;

    CommitLog(Path file, ArtifactStore store) {
        this.file = file;
        this.store = store;
    }

    /**
     * Appends the entry of a commit.
     */
    void append(int revision, String comment, List<PathChange> changes) {
        store.append(file, format(revision, comment, changes));
    }

    /**
     * @param verbose raw log if true, header lines only otherwise
     */
    String list(boolean verbose) {
        if (!Files.exists(file)) {
            return "";
        }
        String log = store.readText(file);
        if (verbose) {
            return log;
        }
        StringBuilder headers = new StringBuilder();
        for (String line : log.split("\n")) {
            if (!line.isEmpty() && !line.startsWith(INDENT)) {
                headers.append(line).append('\n');
            }
        }
        return headers.toString();
    }

    static String format(int revision, String comment, List<PathChange> changes) {
        StringBuilder entry = new StringBuilder();
        entry.append(revision).append(". ").append(singleLine(comment)).append('\n');
        for (PathChange change : changes) {
            entry.append(INDENT).append(change.toLogLine()).append('\n');
        }
        entry.append('\n');
        return entry.toString();
    }

    /** Line breaks in a comment would be read back as change lines or headers. */
    private static String singleLine(String comment) {
        return comment == null ? "" : comment.replaceAll("[\\r\\n]+", " ").strip();
    }
}
