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
package dev.mars.vercon;

/**
 * Kinds of failure surfaced by the repository.
 * <p>
 * Every failure is reported synchronously to the caller through a
 * {@link VerConException} carrying one of these kinds. None of them is
 * retried internally.
 */
public enum ErrorKind {

    /** A line of {@code metadatadir.txt} or the {@code LOCK} file could not be parsed. */
    MALFORMED_METADATA,

    /** A path lookup missed a segment of the directory tree. */
    PATH_NOT_FOUND,

    /** Re-adding an active directory, or a file event at an already recorded revision. */
    DUPLICATE_ENTRY,

    /** Event added out of causal order, a second live event, or an event after a delete. */
    INVALID_EVENT_ORDER,

    /** Malformed or overrunning delta stream. */
    CORRUPT_DELTA,

    /** Content requested before the file was first committed. */
    NOT_YET_PRESENT,

    /** Content requested at a revision where the file is deleted. */
    DELETED_AT_REVISION,

    /** Restore blocked by edits that were never committed. */
    UNCOMMITTED_CHANGES,

    /** The working tree holds something the store does not know about. */
    UNTRACKED_PATH,

    /** The restore filter is not a valid regular expression. */
    INVALID_FILTER,

    /** Restore target below 1 or above the last revision. */
    REVISION_OUT_OF_RANGE,

    /** A filesystem entry of the wrong kind blocks a create or a restore. */
    PATH_CONFLICT,

    /** A directory could not be removed because untracked entries remain in it. */
    DIRECTORY_NOT_EMPTY,

    /** Not enough usable disk space to start a commit. */
    INSUFFICIENT_SPACE,

    /** An underlying filesystem operation failed. */
    IO_FAILURE
}
