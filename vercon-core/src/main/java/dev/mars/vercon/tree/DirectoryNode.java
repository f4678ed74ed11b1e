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
package dev.mars.vercon.tree;

import dev.mars.vercon.history.VersionedFile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One directory of the tracked tree.
 * <p>
 * Nodes live in the arena of their {@link DirectoryTree}; children and parent
 * are handles into that arena. The parent handle is only used to rebuild
 * paths. A node is never removed, only deactivated.
 * <p>
 * The history alternates creation and deletion revisions, so an odd length
 * means the directory is currently active.
 */
public final class DirectoryNode {

    private final int id;
    private final String name;
    private final int parent;
    private final List<Integer> history;
    private final SortedMap<String, Integer> children = new TreeMap<>();
    private final SortedMap<String, VersionedFile> files = new TreeMap<>();

    private int maxRevision;

    /**
     * Commit-scoped scratch flag: set when the current commit walk saw this
     * directory on disk, reset at the start of every walk. Never persisted.
     */
    private boolean touched;

    DirectoryNode(int id, String name, int parent, List<Integer> history) {
        this.id = id;
        this.name = name;
        this.parent = parent;
        this.history = new ArrayList<>(history);
        this.maxRevision = history.isEmpty() ? 0 : history.get(history.size() - 1);
    }

    public int id() {
        return id;
    }

    /** Path segment; empty for the root. */
    public String name() {
        return name;
    }

    /** Handle of the parent node, -1 for the root. */
    public int parent() {
        return parent;
    }

    public boolean isRoot() {
        return parent < 0;
    }

    public List<Integer> history() {
        return Collections.unmodifiableList(history);
    }

    public int lastHistoryRevision() {
        return history.get(history.size() - 1);
    }

    public boolean isActive() {
        return history.size() % 2 == 1;
    }

    /**
     * Replays the history up to {@code revision}: inactive at first, flipped by
     * every entry at or below it.
     */
    public boolean isActiveAt(int revision) {
        boolean active = false;
        for (int entry : history) {
            if (entry > revision) {
                break;
            }
            active = !active;
        }
        return active;
    }

    /** Highest revision recorded anywhere in this subtree. */
    public int maxRevision() {
        return maxRevision;
    }

    public Map<String, Integer> children() {
        return Collections.unmodifiableMap(children);
    }

    public Map<String, VersionedFile> files() {
        return Collections.unmodifiableMap(files);
    }

    public Optional<VersionedFile> file(String fileName) {
        return Optional.ofNullable(files.get(fileName));
    }

    /**
     * Attaches a file to this directory.
     *
     * @return the attached file
     */
    public VersionedFile addFile(VersionedFile file) {
        VersionedFile previous = files.putIfAbsent(file.name(), file);
        if (previous != null) {
            throw new IllegalStateException("File already attached: " + file.relativePath());
        }
        return file;
    }

    public boolean touched() {
        return touched;
    }

    public void touch() {
        this.touched = true;
    }

    // ========================================================================
    // Arena-internal mutation
    // ========================================================================

    void appendHistory(int revision) {
        history.add(revision);
    }

    void putChild(String childName, int handle) {
        children.put(childName, handle);
    }

    void raiseMaxRevision(int revision) {
        maxRevision = Math.max(maxRevision, revision);
    }

    void resetTouched() {
        touched = false;
    }

    @Override
    public String toString() {
        return "DirectoryNode{" + (isRoot() ? "<root>" : name) + ", history=" + history + '}';
    }
}
