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

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Name of a per-file artifact under {@code REPO/DATA}: {@code <PREFIX><revision>- <filename>}.
 *
 * @param prefix   what the artifact holds
 * @param revision revision of the event the artifact belongs to
 * @param fileName name of the tracked file
 */
public record ArtifactName(Prefix prefix, int revision, String fileName) {

    private static final Pattern PATTERN = Pattern.compile("^(ET|EB|HT|HB|D)(\\d+)- (.+)$");

    /**
     * Artifact prefixes. The prefix alone determines both the event state and
     * the content kind recorded on disk.
     */
    public enum Prefix {
        ET(EventState.LIVE, ContentKind.TEXT),
        EB(EventState.LIVE, ContentKind.BINARY),
        HT(EventState.HISTORICAL, ContentKind.TEXT),
        HB(EventState.HISTORICAL, ContentKind.BINARY),
        D(EventState.DELETED, ContentKind.BINARY);

        private final EventState state;
        private final ContentKind kind;

        Prefix(EventState state, ContentKind kind) {
            this.state = state;
            this.kind = kind;
        }

        public EventState state() {
            return state;
        }

        public ContentKind kind() {
            return kind;
        }

        /**
         * Delete markers have a single prefix whatever the kind.
         */
        public static Prefix of(EventState state, ContentKind kind) {
            return switch (state) {
                case LIVE -> kind == ContentKind.TEXT ? ET : EB;
                case HISTORICAL -> kind == ContentKind.TEXT ? HT : HB;
                case DELETED -> D;
            };
        }
    }

    public ArtifactName {
        if (revision <= 0) {
            throw new IllegalArgumentException("Artifact revision must be positive: " + revision);
        }
        if (fileName == null || fileName.isEmpty()) {
            throw new IllegalArgumentException("Artifact file name must not be empty");
        }
    }

    public static ArtifactName of(EventState state, ContentKind kind, int revision, String fileName) {
        return new ArtifactName(Prefix.of(state, kind), revision, fileName);
    }

    /**
     * Parses an artifact file name. Anything else found in a data directory
     * (backups, temp files) yields an empty result.
     */
    public static Optional<ArtifactName> parse(String name) {
        Matcher m = PATTERN.matcher(name);
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            int revision = Integer.parseInt(m.group(2));
            if (revision <= 0) {
                return Optional.empty();
            }
            return Optional.of(new ArtifactName(Prefix.valueOf(m.group(1)), revision, m.group(3)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public EventState state() {
        return prefix.state();
    }

    public ContentKind kind() {
        return prefix.kind();
    }

    @Override
    public String toString() {
        return prefix.name() + revision + "- " + fileName;
    }
}
