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
package dev.mars.vercon.history;

/**
 * State of one event in a file's log.
 */
public enum EventState {
    /** The current content of the file ({@code e}). At most one per file. */
    LIVE('e'),
    /** A superseded version, kept as a delta or a snapshot ({@code h}). */
    HISTORICAL('h'),
    /** The file was removed at this revision ({@code d}). */
    DELETED('d');

    private final char code;

    EventState(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }
}
