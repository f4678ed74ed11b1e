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
 * One entry of a file's event log.
 *
 * @param revision revision at which the event happened
 * @param state    live, historical or deleted
 * @param kind     content kind valid at that revision
 * @param locator  artifact file name holding the event's content
 */
public record FileEvent(int revision, EventState state, ContentKind kind, String locator) {

    public static FileEvent of(ArtifactName artifact) {
        return new FileEvent(artifact.revision(), artifact.state(), artifact.kind(), artifact.toString());
    }

    public boolean isLive() {
        return state == EventState.LIVE;
    }

    /**
     * @return true if the file has content at this event (live or historical)
     */
    public boolean isPresent() {
        return state != EventState.DELETED;
    }

    /**
     * A chain of text deltas ends at an anchor: anything but a historical text delta.
     */
    public boolean isAnchor() {
        return !(state == EventState.HISTORICAL && kind == ContentKind.TEXT);
    }
}
