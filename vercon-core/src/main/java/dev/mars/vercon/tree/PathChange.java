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

import dev.mars.vercon.history.ContentKind;

/**
 * One line of a commit-log entry: a path that was added, modified or removed.
 *
 * @param type what happened
 * @param path POSIX path relative to the repository base
 * @param kind content kind for file creations and modifications, otherwise {@code null}
 */
public record PathChange(Type type, String path, ContentKind kind) {

    public enum Type {
        DIR_CREATED("+d"),
        DIR_DELETED("-d"),
        FILE_CREATED("+f"),
        FILE_MODIFIED("*f"),
        FILE_DELETED("-f");

        private final String marker;

        Type(String marker) {
            this.marker = marker;
        }

        public String marker() {
            return marker;
        }
    }

    public static PathChange directoryCreated(String path) {
        return new PathChange(Type.DIR_CREATED, path, null);
    }

    public static PathChange directoryDeleted(String path) {
        return new PathChange(Type.DIR_DELETED, path, null);
    }

    public static PathChange fileCreated(String path, ContentKind kind) {
        return new PathChange(Type.FILE_CREATED, path, kind);
    }

    public static PathChange fileModified(String path, ContentKind kind) {
        return new PathChange(Type.FILE_MODIFIED, path, kind);
    }

    public static PathChange fileDeleted(String path) {
        return new PathChange(Type.FILE_DELETED, path, null);
    }

    /**
     * Renders the change as a commit-log line, without indentation:
     * {@code +d dir}, {@code *ft notes.txt}, {@code -f old.bin}.
     */
    public String toLogLine() {
        return kind == null
                ? type.marker() + " " + path
                : type.marker() + kind.code() + " " + path;
    }
}
