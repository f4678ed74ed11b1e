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

import dev.mars.vercon.ErrorKind;
import dev.mars.vercon.VerConException;
import dev.mars.vercon.history.VersionedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hierarchy of tracked directories and their activity histories.
 * <p>
 * Nodes are stored in an arena and refer to each other by integer handle;
 * handle 0 is the root. The root has history {@code [0]}, no name, and is
 * always active.
 * <p>
 * <b>Serialized form</b> ({@code metadatadir.txt}): one line per node in
 * pre-order, siblings sorted by name, the root omitted, one leading space per
 * level of depth:
 * <pre>
 * 1,4,6 docs
 *  4 drafts
 * 1 src
 * </pre>
 * File objects are not part of this text; they are rehydrated from the
 * artifacts under {@code REPO/DATA}.
 */
public final class DirectoryTree {

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryTree.class);

    /** Handle of the root node. */
    public static final int ROOT = 0;

    private static final Pattern LINE = Pattern.compile("^( *)(\\d+(?:,\\d+)*) (.+)$");

    private final List<DirectoryNode> nodes = new ArrayList<>();

    public DirectoryTree() {
        nodes.add(new DirectoryNode(ROOT, "", -1, List.of(0)));
    }

    // ========================================================================
    // Navigation
    // ========================================================================

    public DirectoryNode root() {
        return nodes.get(ROOT);
    }

    public DirectoryNode node(int handle) {
        return nodes.get(handle);
    }

    public Optional<DirectoryNode> child(DirectoryNode parent, String name) {
        Integer handle = parent.children().get(name);
        return handle == null ? Optional.empty() : Optional.of(nodes.get(handle));
    }

    /**
     * Finds the node at a POSIX relative path; the empty path is the root.
     */
    public Optional<DirectoryNode> find(String path) {
        DirectoryNode current = root();
        for (String segment : segments(path)) {
            Optional<DirectoryNode> next = child(current, segment);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    /**
     * @throws VerConException {@link ErrorKind#PATH_NOT_FOUND} if a segment is missing
     */
    public DirectoryNode atPath(String path) {
        return find(path).orElseThrow(() -> new VerConException(ErrorKind.PATH_NOT_FOUND,
                "No directory '" + path + "' in the repository"));
    }

    /**
     * Rebuilds the POSIX relative path of a node; the root's path is empty.
     */
    public String pathOf(DirectoryNode node) {
        List<String> parts = new ArrayList<>();
        for (DirectoryNode current = node; !current.isRoot(); current = nodes.get(current.parent())) {
            parts.add(current.name());
        }
        Collections.reverse(parts);
        return String.join("/", parts);
    }

    /**
     * @return every node, parents before children, siblings by name
     */
    public List<DirectoryNode> preOrder() {
        List<DirectoryNode> out = new ArrayList<>(nodes.size());
        collect(root(), out);
        return out;
    }

    public int size() {
        return nodes.size();
    }

    /** Highest revision recorded anywhere in the tree, directories and files. */
    public int maxRevision() {
        return root().maxRevision();
    }

    // ========================================================================
    // Mutation
    // ========================================================================

    /**
     * Creates the missing segments of {@code path} at {@code revision} and
     * reactivates inactive ones. Every created or reactivated node is touched.
     *
     * @return the node at {@code path}
     * @throws VerConException {@link ErrorKind#DUPLICATE_ENTRY} if the full path was already active
     */
    public DirectoryNode add(String path, int revision) {
        List<String> segments = segments(path);
        if (segments.isEmpty()) {
            throw new VerConException(ErrorKind.DUPLICATE_ENTRY, "The root directory always exists");
        }

        DirectoryNode current = root();
        boolean alreadyActive = false;
        for (String segment : segments) {
            Optional<DirectoryNode> existing = child(current, segment);
            if (existing.isEmpty()) {
                current = createChild(current, segment, List.of(revision));
                current.touch();
                alreadyActive = false;
            } else if (!existing.get().isActive()) {
                current = existing.get();
                toggleState(current, revision);
                current.touch();
                alreadyActive = false;
            } else {
                current = existing.get();
                alreadyActive = true;
            }
        }

        if (alreadyActive) {
            throw new VerConException(ErrorKind.DUPLICATE_ENTRY,
                    "Directory '" + path + "' already exists and is active");
        }
        LOG.debug("Directory {} active from revision {}", path, revision);
        return current;
    }

    /**
     * Flips a node between active and inactive at {@code revision}.
     *
     * @throws VerConException {@link ErrorKind#INVALID_EVENT_ORDER} if {@code revision}
     *                         is not above the node's last history entry
     */
    public void toggleState(DirectoryNode node, int revision) {
        if (node.isRoot()) {
            throw new VerConException(ErrorKind.INVALID_EVENT_ORDER, "The root directory cannot be toggled");
        }
        if (revision <= node.lastHistoryRevision()) {
            throw new VerConException(ErrorKind.INVALID_EVENT_ORDER,
                    "Revision " + revision + " is not above " + node.history() + " of '" + pathOf(node) + "'");
        }
        node.appendHistory(revision);
        recordRevision(node, revision);
    }

    /**
     * Raises the subtree maximum of {@code node} and all its ancestors.
     */
    public void recordRevision(DirectoryNode node, int revision) {
        for (DirectoryNode current = node; ; current = nodes.get(current.parent())) {
            current.raiseMaxRevision(revision);
            if (current.isRoot()) {
                return;
            }
        }
    }

    /**
     * Recomputes every subtree maximum from histories and file logs; used
     * once after rehydration.
     */
    public void recomputeMaxRevisions() {
        List<DirectoryNode> order = preOrder();
        for (int i = order.size() - 1; i >= 0; i--) {
            DirectoryNode node = order.get(i);
            node.raiseMaxRevision(node.lastHistoryRevision());
            for (VersionedFile file : node.files().values()) {
                node.raiseMaxRevision(file.lastRevision());
            }
            if (!node.isRoot()) {
                nodes.get(node.parent()).raiseMaxRevision(node.maxRevision());
            }
        }
    }

    /**
     * Clears the touched flags of every node and file. The root stays touched.
     */
    public void resetTouched() {
        for (DirectoryNode node : nodes) {
            node.resetTouched();
            node.files().values().forEach(VersionedFile::resetTouched);
        }
        root().touch();
    }

    /**
     * Counts what {@link #markUntouchedDeleted(int, List)} would change, without changing it.
     */
    public int countUntouched() {
        return countUntouched(root());
    }

    /**
     * Deactivates every active node and deletes every live file that the
     * current walk did not touch.
     *
     * @param revision revision of the deletions
     * @param changes  receives one entry per change, in traversal order
     * @return the number of changes made
     */
    public int markUntouchedDeleted(int revision, List<PathChange> changes) {
        int count = markUntouchedDeleted(root(), revision, changes);
        if (count > 0) {
            LOG.debug("Marked {} untouched paths deleted at revision {}", count, revision);
        }
        return count;
    }

    // ========================================================================
    // Serialization
    // ========================================================================

    public String serialize() {
        StringBuilder out = new StringBuilder();
        serialize(root(), 0, out);
        return out.toString();
    }

    /**
     * Parses the text produced by {@link #serialize()}.
     *
     * @throws VerConException {@link ErrorKind#MALFORMED_METADATA} on an unparsable line,
     *                         a depth jump, a duplicate sibling or a non-increasing history
     */
    public static DirectoryTree deserialize(String text) {
        DirectoryTree tree = new DirectoryTree();
        if (text.isBlank()) {
            return tree;
        }

        String body = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        List<DirectoryNode> stack = new ArrayList<>();
        stack.add(tree.root());

        int lineNo = 0;
        for (String line : body.split("\n", -1)) {
            lineNo++;
            Matcher m = LINE.matcher(line);
            if (!m.matches()) {
                throw malformed(lineNo, line, "expected '<revisions> <name>'");
            }
            int depth = m.group(1).length();
            if (depth > stack.size() - 1) {
                throw malformed(lineNo, line, "depth " + depth + " skips a level");
            }

            List<Integer> history = parseHistory(m.group(2), lineNo, line);
            String name = m.group(3);
            DirectoryNode parent = stack.get(depth);
            if (parent.children().containsKey(name)) {
                throw malformed(lineNo, line, "duplicate entry '" + name + "'");
            }

            DirectoryNode node = tree.createChild(parent, name, history);
            stack.subList(depth + 1, stack.size()).clear();
            stack.add(node);
        }

        tree.recomputeMaxRevisions();
        LOG.debug("Deserialized directory tree: {} nodes", tree.size() - 1);
        return tree;
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private DirectoryNode createChild(DirectoryNode parent, String name, List<Integer> history) {
        DirectoryNode node = new DirectoryNode(nodes.size(), name, parent.id(), history);
        nodes.add(node);
        parent.putChild(name, node.id());
        recordRevision(node, node.lastHistoryRevision());
        return node;
    }

    private void collect(DirectoryNode node, List<DirectoryNode> out) {
        out.add(node);
        for (int handle : node.children().values()) {
            collect(nodes.get(handle), out);
        }
    }

    private int countUntouched(DirectoryNode node) {
        int count = 0;
        for (VersionedFile file : node.files().values()) {
            if (file.isLive() && !file.touched()) {
                count++;
            }
        }
        for (int handle : node.children().values()) {
            DirectoryNode child = nodes.get(handle);
            if (child.isActive() && !child.touched()) {
                count++;
            }
            count += countUntouched(child);
        }
        return count;
    }

    private int markUntouchedDeleted(DirectoryNode node, int revision, List<PathChange> changes) {
        int count = 0;
        for (VersionedFile file : node.files().values()) {
            if (file.isLive() && !file.touched()) {
                file.deleteAtRevision(revision);
                recordRevision(node, revision);
                changes.add(PathChange.fileDeleted(file.relativePath()));
                count++;
            }
        }
        for (int handle : node.children().values()) {
            DirectoryNode child = nodes.get(handle);
            if (child.isActive() && !child.touched()) {
                toggleState(child, revision);
                changes.add(PathChange.directoryDeleted(pathOf(child)));
                count++;
            }
            count += markUntouchedDeleted(child, revision, changes);
        }
        return count;
    }

    private void serialize(DirectoryNode node, int depth, StringBuilder out) {
        for (int handle : node.children().values()) {
            DirectoryNode child = nodes.get(handle);
            out.append(" ".repeat(depth));
            for (int i = 0; i < child.history().size(); i++) {
                if (i > 0) {
                    out.append(',');
                }
                out.append(child.history().get(i));
            }
            out.append(' ').append(child.name()).append('\n');
            serialize(child, depth + 1, out);
        }
    }

    private static List<Integer> parseHistory(String csv, int lineNo, String line) {
        List<Integer> history = new ArrayList<>();
        for (String part : csv.split(",")) {
            int revision;
            try {
                revision = Integer.parseInt(part);
            } catch (NumberFormatException e) {
                throw malformed(lineNo, line, "revision out of range '" + part + "'");
            }
            if (revision <= 0 || (!history.isEmpty() && revision <= history.get(history.size() - 1))) {
                throw malformed(lineNo, line, "history must be strictly increasing positive revisions");
            }
            history.add(revision);
        }
        return history;
    }

    private static List<String> segments(String path) {
        if (path == null || path.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String segment : Arrays.asList(path.split("/"))) {
            if (!segment.isEmpty()) {
                out.add(segment);
            }
        }
        return out;
    }

    private static VerConException malformed(int lineNo, String line, String reason) {
        return new VerConException(ErrorKind.MALFORMED_METADATA,
                "metadatadir.txt line " + lineNo + " '" + line + "': " + reason);
    }
}
