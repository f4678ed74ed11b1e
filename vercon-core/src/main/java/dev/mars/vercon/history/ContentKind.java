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
 * How a file's content is stored: text content gets reverse deltas, binary
 * content gets full snapshots.
 */
public enum ContentKind {
    TEXT('t'),
    BINARY('b');

    private final char code;

    ContentKind(char code) {
        this.code = code;
    }

    /** Single-letter code used in the commit log ({@code +ft}, {@code *fb}). */
    public char code() {
        return code;
    }
}
