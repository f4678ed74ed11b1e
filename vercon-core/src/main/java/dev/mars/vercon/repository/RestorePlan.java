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

import dev.mars.vercon.history.VersionedFile;
import dev.mars.vercon.tree.DirectoryNode;
import dev.mars.vercon.tree.DirectoryTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * What a restore to a given revision has to do to the working tree.
 * <p>
 * Computed from the tree alone; the working tree is only inspected when the
 * plan is validated and applied by {@link RestoreEngine}.
 * <ul>
 *   <li>A directory inactive at the target revision goes, with every file and
 *       directory below it, into the delete sets. The filter does not apply
 *       there.</li>
 *   <li>An active directory goes into the create set; each of its files whose
 *       path matches the filter is restored if it exists at the target
 *       revision and deleted otherwise.</li>
 * </ul>
 *
 * @param revision           target revision
 * @param createDirectories  directories to create, parents first
 * @param restoreFiles       files to write with their content at {@code revision}
 * @param deleteFiles        files to remove
 * @param deleteDirectories  directories to remove, parents first (removed in reverse)
 */
record RestorePlan(
        int revision,
        List<DirectoryNode> createDirectories,
        List<VersionedFile> restoreFiles,
        List<VersionedFile> deleteFiles,
        List<DirectoryNode> deleteDirectories
) {

    RestorePlan {
        createDirectories = List.copyOf(createDirectories);
        restoreFiles = List.copyOf(restoreFiles);
        deleteFiles = List.copyOf(deleteFiles);
        deleteDirectories = List.copyOf(deleteDirectories);
    }

    /**
     * @param filter matched against the start of each POSIX relative file path
     */
    static RestorePlan from(DirectoryTree tree, int revision, Pattern filter) {
        List<DirectoryNode> create = new ArrayList<>();
        List<VersionedFile> restore = new ArrayList<>();
        List<VersionedFile> delete = new ArrayList<>();
        List<DirectoryNode> deleteDirs = new ArrayList<>();

        plan(tree, tree.root(), revision, filter, create, restore, delete, deleteDirs);
        return new RestorePlan(revision, create, restore, delete, deleteDirs);
    }

    /**
     * @return every file the restore writes or removes
     */
    List<VersionedFile> affectedFiles() {
        List<VersionedFile> all = new ArrayList<>(restoreFiles.size() + deleteFiles.size());
        all.addAll(restoreFiles);
        all.addAll(deleteFiles);
        return Collections.unmodifiableList(all);
    }

    private static void plan(DirectoryTree tree, DirectoryNode node, int revision, Pattern filter,
                             List<DirectoryNode> create, List<VersionedFile> restore,
                             List<VersionedFile> delete, List<DirectoryNode> deleteDirs) {
        if (!node.isRoot() && !node.isActiveAt(revision)) {
            removeSubtree(tree, node, delete, deleteDirs);
            return;
        }
        if (!node.isRoot()) {
            create.add(node);
        }
        for (VersionedFile file : node.files().values()) {
            if (!filter.matcher(file.relativePath()).lookingAt()) {
                continue;
            }
            if (file.existsAt(revision)) {
                restore.add(file);
            } else {
                delete.add(file);
            }
        }
        for (int handle : node.children().values()) {
            plan(tree, tree.node(handle), revision, filter, create, restore, delete, deleteDirs);
        }
    }

    private static void removeSubtree(DirectoryTree tree, DirectoryNode node,
                                      List<VersionedFile> delete, List<DirectoryNode> deleteDirs) {
        deleteDirs.add(node);
        delete.addAll(node.files().values());
        for (int handle : node.children().values()) {
            removeSubtree(tree, tree.node(handle), delete, deleteDirs);
        }
    }
}
