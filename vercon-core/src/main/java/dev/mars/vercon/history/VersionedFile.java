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

import dev.mars.vercon.ErrorKind;
import dev.mars.vercon.VerConException;
import dev.mars.vercon.delta.Delta;
import dev.mars.vercon.delta.DeltaCodec;
import dev.mars.vercon.store.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Event log of one tracked path, plus reconstruction of its content at any
 * revision.
 * <p>
 * <b>Storage:</b> each event owns one artifact in the file's data directory.
 * <pre>
 * REPO/DATA/&lt;dir&gt;/
 *  ├─ HT1- notes.txt   // delta turning revision 3's text into revision 1's
 *  ├─ HT3- notes.txt   // delta turning revision 5's text into revision 3's
 *  └─ ET5- notes.txt   // full current text
 * </pre>
 * Deltas always point backwards in time: a historical text artifact holds the
 * script that turns its successor's text into its own. When the successor is
 * binary or a delete marker, the script is computed from the empty text.
 * <p>
 * <b>INVARIANTS:</b>
 * <ul>
 *   <li>At most one live event, and no event above it</li>
 *   <li>At most one event per revision</li>
 *   <li>New events are only recorded above {@link #lastRevision()}</li>
 * </ul>
 * <p>
 * Mutations back up every artifact they rename or delete through the
 * {@link ArtifactStore}, so they may only run inside a commit.
 */
public final class VersionedFile {

    private static final Logger LOG = LoggerFactory.getLogger(VersionedFile.class);

    private final String relativePath;
    private final String name;
    private final Path workingFile;
    private final Path dataDir;
    private final ArtifactStore store;

    private final NavigableMap<Integer, FileEvent> events = new TreeMap<>();
    private int lastRevision;
    private int liveRevision;

    /** Commit-scoped scratch flag; see {@code DirectoryNode#touched()}. */
    private boolean touched;

    /**
     * @param relativePath POSIX path of the file relative to the repository base
     * @param workingFile  location of the file in the working tree
     * @param dataDir      directory holding this file's artifacts
     * @param store        store used for every artifact operation
     */
    public VersionedFile(String relativePath, Path workingFile, Path dataDir, ArtifactStore store) {
        this.relativePath = relativePath;
        this.name = relativePath.substring(relativePath.lastIndexOf('/') + 1);
        this.workingFile = workingFile;
        this.dataDir = dataDir;
        this.store = store;
    }

    // ========================================================================
    // Rehydration
    // ========================================================================

    /**
     * Records an event read back from disk. Events may arrive in any order;
     * the log invariants are checked against the whole log after insertion.
     *
     * @throws VerConException {@link ErrorKind#DUPLICATE_ENTRY} if an event already exists
     *                         at {@code revision}; {@link ErrorKind#INVALID_EVENT_ORDER} for a
     *                         second live event or any event above the live one
     */
    public void loadEvent(EventState state, int revision, ContentKind kind, String locator) {
        if (events.containsKey(revision)) {
            throw new VerConException(ErrorKind.DUPLICATE_ENTRY,
                    relativePath + ": two events at revision " + revision
                            + " (" + events.get(revision).locator() + ", " + locator + ")");
        }
        if (state == EventState.LIVE && liveRevision != 0) {
            throw new VerConException(ErrorKind.INVALID_EVENT_ORDER,
                    relativePath + ": second live event at revision " + revision
                            + ", already live at " + liveRevision);
        }

        events.put(revision, new FileEvent(revision, state, kind, locator));
        if (state == EventState.LIVE) {
            liveRevision = revision;
        }
        lastRevision = Math.max(lastRevision, revision);

        if (liveRevision != 0 && lastRevision > liveRevision) {
            throw new VerConException(ErrorKind.INVALID_EVENT_ORDER,
                    relativePath + ": event at revision " + lastRevision
                            + " recorded after live event " + liveRevision);
        }
    }

    public void loadEvent(ArtifactName artifact) {
        loadEvent(artifact.state(), artifact.revision(), artifact.kind(), artifact.toString());
    }

    /**
     * Checks the invariants that can only be judged once every event is loaded.
     *
     * @throws VerConException {@link ErrorKind#INVALID_EVENT_ORDER} if the most recent
     *                         event is a historical one
     */
    public void verify() {
        if (!events.isEmpty() && events.lastEntry().getValue().state() == EventState.HISTORICAL) {
            throw new VerConException(ErrorKind.INVALID_EVENT_ORDER,
                    relativePath + ": most recent event " + events.lastEntry().getValue().locator()
                            + " is historical");
        }
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public String relativePath() {
        return relativePath;
    }

    public String name() {
        return name;
    }

    public Path workingFile() {
        return workingFile;
    }

    public boolean isNew() {
        return events.isEmpty();
    }

    public int lastRevision() {
        return lastRevision;
    }

    /**
     * @return true if the file currently exists in the store (has a live event)
     */
    public boolean isLive() {
        return liveRevision != 0;
    }

    public Optional<FileEvent> liveEvent() {
        return isLive() ? Optional.of(events.get(liveRevision)) : Optional.empty();
    }

    public List<FileEvent> events() {
        return Collections.unmodifiableList(new ArrayList<>(events.values()));
    }

    /**
     * @return true if the latest event at or below {@code revision} has content
     */
    public boolean existsAt(int revision) {
        Map.Entry<Integer, FileEvent> entry = events.floorEntry(revision);
        return entry != null && entry.getValue().isPresent();
    }

    /**
     * @return the content kind at {@code revision}, empty if the file does not exist then
     */
    public Optional<ContentKind> contentKindAt(int revision) {
        Map.Entry<Integer, FileEvent> entry = events.floorEntry(revision);
        if (entry == null || !entry.getValue().isPresent()) {
            return Optional.empty();
        }
        return Optional.of(entry.getValue().kind());
    }

    /**
     * Reconstructs the content of the file as committed at {@code revision}.
     *
     * @throws VerConException {@link ErrorKind#NOT_YET_PRESENT} before the first event,
     *                         {@link ErrorKind#DELETED_AT_REVISION} if deleted at that revision
     */
    public FileContent contentsAt(int revision) {
        Map.Entry<Integer, FileEvent> entry = events.floorEntry(revision);
        if (entry == null) {
            throw new VerConException(ErrorKind.NOT_YET_PRESENT,
                    relativePath + " does not exist yet at revision " + revision);
        }
        FileEvent event = entry.getValue();

        return switch (event.state()) {
            case DELETED -> throw new VerConException(ErrorKind.DELETED_AT_REVISION,
                    relativePath + " is deleted at revision " + revision
                            + " (deleted in " + event.revision() + ")");
            case LIVE -> new FileContent(event.kind(), store.readBytes(artifactPath(event)));
            case HISTORICAL -> event.kind() == ContentKind.BINARY
                    ? FileContent.ofBinary(store.readBytes(artifactPath(event)))
                    : FileContent.ofText(mergeTextBackwards(chainFrom(event.revision())));
        };
    }

    /**
     * Replays a chain of text deltas backwards in time.
     * <p>
     * The running buffer starts as the anchor's text (the empty text when the
     * anchor is binary or a delete marker); each earlier delta is then applied
     * to it, most recent first.
     *
     * @param revisions ascending revisions, all historical text except the last, which is the anchor
     * @return the text at {@code revisions.get(0)}
     */
    public String mergeTextBackwards(List<Integer> revisions) {
        if (revisions.isEmpty()) {
            throw new IllegalArgumentException("Empty delta chain for " + relativePath);
        }
        FileEvent anchor = requireEvent(revisions.get(revisions.size() - 1));
        String buffer = anchor.isLive() && anchor.kind() == ContentKind.TEXT
                ? store.readText(artifactPath(anchor))
                : "";

        for (int i = revisions.size() - 2; i >= 0; i--) {
            FileEvent step = requireEvent(revisions.get(i));
            if (step.isAnchor()) {
                throw new VerConException(ErrorKind.INVALID_EVENT_ORDER,
                        relativePath + ": " + step.locator() + " is not a text delta");
            }
            Delta delta = DeltaCodec.parse(store.readText(artifactPath(step)));
            buffer = DeltaCodec.applyDelta(buffer, delta);
        }
        LOG.trace("{}: merged {} deltas back to revision {}", relativePath, revisions.size() - 1, revisions.get(0));
        return buffer;
    }

    /**
     * Compares the working file with the live artifact. Timestamps are never consulted.
     *
     * @return false if the working file is missing; true if it exists but the store
     *         has no live content for it, or if the contents differ. Something other
     *         than a regular file at the path only counts while the file is live.
     */
    public boolean isModified() {
        if (!Files.exists(workingFile)) {
            return false;
        }
        if (!Files.isRegularFile(workingFile)) {
            return isLive();
        }
        Optional<FileEvent> live = liveEvent();
        if (live.isEmpty()) {
            return true;
        }
        return !store.sameContent(workingFile, artifactPath(live.get()));
    }

    // ========================================================================
    // Mutations (commit only)
    // ========================================================================

    /**
     * Records the working file as created at {@code revision}. A file whose
     * last event is a delete marker may be created again.
     *
     * @return the kind the content was classified as
     * @throws VerConException {@link ErrorKind#DUPLICATE_ENTRY} if the file is live already
     */
    public ContentKind createAtRevision(int revision) {
        if (isLive()) {
            throw new VerConException(ErrorKind.DUPLICATE_ENTRY,
                    relativePath + " already has history (live at revision " + liveRevision + ")");
        }
        requireAbove(revision);

        byte[] data = readWorking();
        ContentKind kind = ContentClassifier.classify(data);
        recordLive(revision, kind, data);
        LOG.debug("{}: created at revision {} as {}", relativePath, revision, kind);
        return kind;
    }

    /**
     * Records the current working content as a new version at {@code revision}
     * and historicizes the previous live event.
     *
     * @return the kind the new content was classified as
     * @throws VerConException {@link ErrorKind#INVALID_EVENT_ORDER} if there is no live
     *                         event or {@code revision} is not above the last event
     */
    public ContentKind changeAtRevision(int revision) {
        FileEvent previous = requireLive(revision);

        byte[] data = readWorking();
        Optional<String> text = ContentClassifier.decode(data);
        ContentKind kind = text.isPresent() ? ContentKind.TEXT : ContentKind.BINARY;

        historicize(previous, text.orElse(""));
        recordLive(revision, kind, data);
        LOG.debug("{}: {} -> {} at revision {} (previous {})",
                relativePath, previous.kind(), kind, revision, previous.revision());
        return kind;
    }

    /**
     * Records the file as deleted at {@code revision}: the live content is kept
     * as a full snapshot and an empty delete marker is written.
     *
     * @throws VerConException {@link ErrorKind#INVALID_EVENT_ORDER} if there is no live
     *                         event or {@code revision} is not above the last event
     */
    public void deleteAtRevision(int revision) {
        FileEvent previous = requireLive(revision);

        historicize(previous, "");

        ArtifactName marker = ArtifactName.of(EventState.DELETED, ContentKind.BINARY, revision, name);
        store.writeBytes(dataDir.resolve(marker.toString()), new byte[0], null);
        events.put(revision, FileEvent.of(marker));
        lastRevision = revision;
        LOG.debug("{}: deleted at revision {}", relativePath, revision);
    }

    // ========================================================================
    // Commit-scoped scratch state
    // ========================================================================

    public boolean touched() {
        return touched;
    }

    public void touch() {
        this.touched = true;
    }

    public void resetTouched() {
        this.touched = false;
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    /**
     * Turns the live event into a historical one.
     * <p>
     * Binary content is renamed verbatim. Text content is replaced by the delta
     * that rebuilds it from {@code successorText}, which is the empty text
     * whenever the successor is binary or a delete marker.
     */
    private void historicize(FileEvent live, String successorText) {
        Path liveArtifact = artifactPath(live);
        store.backup(liveArtifact);

        ArtifactName historical = ArtifactName.of(EventState.HISTORICAL, live.kind(), live.revision(), name);
        Path historicalArtifact = dataDir.resolve(historical.toString());

        if (live.kind() == ContentKind.BINARY) {
            store.move(liveArtifact, historicalArtifact);
        } else {
            String oldText = store.readText(liveArtifact);
            Delta delta = DeltaCodec.computeDelta(successorText, oldText);
            store.writeText(historicalArtifact, DeltaCodec.serialize(delta), workingFile);
            store.delete(liveArtifact);
        }

        events.put(live.revision(), FileEvent.of(historical));
        liveRevision = 0;
    }

    private void recordLive(int revision, ContentKind kind, byte[] data) {
        ArtifactName artifact = ArtifactName.of(EventState.LIVE, kind, revision, name);
        store.writeBytes(dataDir.resolve(artifact.toString()), data, workingFile);
        events.put(revision, FileEvent.of(artifact));
        liveRevision = revision;
        lastRevision = revision;
    }

    private FileEvent requireLive(int revision) {
        if (!isLive()) {
            throw new VerConException(ErrorKind.INVALID_EVENT_ORDER,
                    relativePath + " has no live event to supersede at revision " + revision);
        }
        requireAbove(revision);
        return events.get(liveRevision);
    }

    private void requireAbove(int revision) {
        if (revision <= lastRevision) {
            throw new VerConException(ErrorKind.INVALID_EVENT_ORDER,
                    relativePath + ": revision " + revision + " is not above last event " + lastRevision);
        }
    }

    private FileEvent requireEvent(int revision) {
        FileEvent event = events.get(revision);
        if (event == null) {
            throw new IllegalArgumentException(relativePath + " has no event at revision " + revision);
        }
        return event;
    }

    /**
     * Ascending revisions from {@code start} up to and including the next anchor.
     */
    private List<Integer> chainFrom(int start) {
        List<Integer> chain = new ArrayList<>();
        chain.add(start);
        for (FileEvent next : events.tailMap(start, false).values()) {
            chain.add(next.revision());
            if (next.isAnchor()) {
                return chain;
            }
        }
        throw new VerConException(ErrorKind.INVALID_EVENT_ORDER,
                relativePath + ": delta chain starting at revision " + start + " has no anchor");
    }

    private Path artifactPath(FileEvent event) {
        return dataDir.resolve(event.locator());
    }

    private byte[] readWorking() {
        try {
            return Files.readAllBytes(workingFile);
        } catch (IOException e) {
            LOG.error("Failed to read working file {}: {}", workingFile, e.getMessage(), e);
            throw new VerConException(ErrorKind.IO_FAILURE,
                    "Failed to read working file " + workingFile + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "VersionedFile{" + relativePath + ", events=" + events.values() + '}';
    }
}
