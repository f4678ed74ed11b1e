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

import java.util.List;

/**
 * Outcome of a restore. Paths are POSIX and relative to the base directory.
 *
 * @param revision            the revision the tree was brought back to
 * @param createdDirectories  directories that did not exist and were created
 * @param restoredFiles       files written with their content at {@code revision}
 * @param deletedFiles        files removed from the working tree
 * @param deletedDirectories  directories removed from the working tree
 */
public record RestoreResult(
        int revision,
        List<String> createdDirectories,
        List<String> restoredFiles,
        List<String> deletedFiles,
        List<String> deletedDirectories
) {

    public RestoreResult {
        createdDirectories = List.copyOf(createdDirectories);
        restoredFiles = List.copyOf(restoredFiles);
        deletedFiles = List.copyOf(deletedFiles);
        deletedDirectories = List.copyOf(deletedDirectories);
    }
}
