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

import dev.mars.vercon.tree.PathChange;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a commit.
 *
 * @param revision the allocated revision, 0 when nothing changed
 * @param changes  the changed paths, in commit-log order
 */
public record CommitResult(int revision, List<PathChange> changes) {

    /** Result of a commit that found nothing to record. */
    public static final CommitResult NO_CHANGE = new CommitResult(0, Collections.emptyList());

    public CommitResult {
        changes = changes == null ? Collections.emptyList() : List.copyOf(changes);
    }

    public boolean isNoChange() {
        return revision == 0;
    }
}
