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
import dev.mars.vercon.store.ArtifactStore;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link VersionedFile}: event recording, backward delta chains and
 * rehydration from artifact names.
 */
class VersionedFileTest {

    private static final byte[] BINARY = {(byte) 0xFF, 0x00, 0x01, (byte) 0xFE};
    private static final byte[] OTHER_BINARY = {(byte) 0xC0, (byte) 0xC1};

    @TempDir
    Path tempDir;

    private Path workDir;
    private Path dataDir;
    private ArtifactStore store;
    private VersionedFile file;

    @BeforeEach
    void setUp() throws IOException {
        workDir = Files.createDirectories(tempDir.resolve("work"));
        dataDir = Files.createDirectories(tempDir.resolve("data"));
        store = new ArtifactStore(false, false);
        file = newFile();
    }

    private VersionedFile newFile() {
        return new VersionedFile("notes.txt", workDir.resolve("notes.txt"), dataDir, store);
    }

    private void write(String text) throws IOException {
        Files.writeString(workDir.resolve("notes.txt"), text, StandardCharsets.UTF_8);
    }

    private void write(byte[] data) throws IOException {
        Files.write(workDir.resolve("notes.txt"), data);
    }

    private void create(int revision) {
        store.beginRevision(revision);
        file.createAtRevision(revision);
        store.discardBackups();
    }

    private void change(int revision) {
        store.beginRevision(revision);
        file.changeAtRevision(revision);
        store.discardBackups();
    }

    private void delete(int revision) {
        store.beginRevision(revision);
        file.deleteAtRevision(revision);
        store.discardBackups();
    }

    private List<String> artifacts() throws IOException {
        try (Stream<Path> files = Files.list(dataDir)) {
            return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    // ========================================================================
    // Text history
    // ========================================================================

    @Nested
    @DisplayName("Text history")
    class TextHistoryTests {

        @Test
        @DisplayName("Every revision of a text file is reconstructed")
        void testThreeRevisions() throws IOException {
            write("hello\n");
            create(1);
            write("hello\nworld\n");
            change(2);
            write("hello world\n");
            change(3);

            assertEquals("hello\n", file.contentsAt(1).text());
            assertEquals("hello\nworld\n", file.contentsAt(2).text());
            assertEquals("hello world\n", file.contentsAt(3).text());
            assertEquals(List.of("ET3- notes.txt", "HT1- notes.txt", "HT2- notes.txt"), artifacts());
        }

        @Test
        @DisplayName("Revisions between events resolve to the earlier event")
        void testBetweenEvents() throws IOException {
            write("v1");
            create(2);
            write("v5");
            change(5);

            assertEquals("v1", file.contentsAt(4).text());
            assertEquals("v5", file.contentsAt(9).text());
        }

        @Test
        @DisplayName("mergeTextBackwards walks the whole chain down to the first revision")
        void testMergeTextBackwards() throws IOException {
            write("a\nb\nc\n");
            create(1);
            write("a\nB\nc\n");
            change(2);
            write("a\nB\nc\nd\n");
            change(3);

            assertEquals("a\nb\nc\n", file.mergeTextBackwards(List.of(1, 2, 3)));
            assertEquals("a\nB\nc\n", file.mergeTextBackwards(List.of(2, 3)));
            assertEquals("a\nB\nc\nd\n", file.mergeTextBackwards(List.of(3)));
        }

        @Test
        @DisplayName("Historical artifacts hold deltas, not full copies")
        void testHistoricalIsDelta() throws IOException {
            write("first line\nsecond line\n");
            create(1);
            write("first line\nsecond line\nthird line\n");
            change(2);

            String delta = Files.readString(dataDir.resolve("HT1- notes.txt"));
            assertEquals("c 23\ns 11\n", delta);
        }

        @Test
        @DisplayName("Empty text file is tracked as text")
        void testEmptyText() throws IOException {
            write("");
            create(1);
            write("now something\n");
            change(2);

            assertEquals(ContentKind.TEXT, file.contentKindAt(1).orElseThrow());
            assertEquals("", file.contentsAt(1).text());
        }
    }

    // ========================================================================
    // Content kind changes
    // ========================================================================

    @Nested
    @DisplayName("Content kind changes")
    class KindChangeTests {

        @Test
        @DisplayName("Text then binary: text revision is rebuilt from the empty text")
        void testTextToBinary() throws IOException {
            write("plain text\n");
            create(1);
            write(BINARY);
            change(2);

            assertEquals(Optional.of(ContentKind.TEXT), file.contentKindAt(1));
            assertEquals(Optional.of(ContentKind.BINARY), file.contentKindAt(2));
            assertEquals("plain text\n", file.contentsAt(1).text());
            assertArrayEquals(BINARY, file.contentsAt(2).data());
            assertEquals(List.of("EB2- notes.txt", "HT1- notes.txt"), artifacts());
        }

        @Test
        @DisplayName("Binary then text: binary revision is kept verbatim")
        void testBinaryToText() throws IOException {
            write(BINARY);
            create(1);
            write("text now\n");
            change(2);

            assertArrayEquals(BINARY, file.contentsAt(1).data());
            assertEquals(ContentKind.BINARY, file.contentsAt(1).kind());
            assertEquals("text now\n", file.contentsAt(2).text());
            assertEquals(List.of("ET2- notes.txt", "HB1- notes.txt"), artifacts());
        }

        @Test
        @DisplayName("Text, binary, binary, text")
        void testMixedChain() throws IOException {
            write("one\n");
            create(1);
            write(BINARY);
            change(2);
            write(OTHER_BINARY);
            change(3);
            write("one\ntwo\n");
            change(4);

            assertEquals("one\n", file.contentsAt(1).text());
            assertArrayEquals(BINARY, file.contentsAt(2).data());
            assertArrayEquals(OTHER_BINARY, file.contentsAt(3).data());
            assertEquals("one\ntwo\n", file.contentsAt(4).text());
        }
    }

    // ========================================================================
    // Deletion
    // ========================================================================

    @Nested
    @DisplayName("Deletion and re-creation")
    class DeletionTests {

        @Test
        @DisplayName("Deleted then recreated file keeps its whole history")
        void testDeleteAndRecreate() throws IOException {
            write("before\n");
            create(1);
            Files.delete(workDir.resolve("notes.txt"));
            delete(2);
            write("after\n");
            create(3);

            assertEquals(List.of(1, 2, 3), file.events().stream().map(FileEvent::revision).collect(Collectors.toList()));
            assertEquals(List.of("D2- notes.txt", "ET3- notes.txt", "HT1- notes.txt"), artifacts());
            assertEquals("before\n", file.contentsAt(1).text());
            assertEquals("after\n", file.contentsAt(3).text());
            assertTrue(file.existsAt(1));
            assertFalse(file.existsAt(2));
            assertTrue(file.existsAt(3));
        }

        @Test
        @DisplayName("Contents at a deleted revision fail with DELETED_AT_REVISION")
        void testContentsAtDeleted() throws IOException {
            write("x");
            create(1);
            delete(2);

            VerConException e = assertThrows(VerConException.class, () -> file.contentsAt(2));
            assertEquals(ErrorKind.DELETED_AT_REVISION, e.kind());
            assertFalse(file.isLive());
            assertEquals(Optional.empty(), file.contentKindAt(5));
        }

        @Test
        @DisplayName("Deleted binary file is kept as a historical binary")
        void testDeleteBinary() throws IOException {
            write(BINARY);
            create(1);
            delete(2);

            assertArrayEquals(BINARY, file.contentsAt(1).data());
            assertEquals(List.of("D2- notes.txt", "HB1- notes.txt"), artifacts());
        }

        @Test
        @DisplayName("Contents before the first event fail with NOT_YET_PRESENT")
        void testNotYetPresent() throws IOException {
            write("x");
            create(3);

            VerConException e = assertThrows(VerConException.class, () -> file.contentsAt(2));
            assertEquals(ErrorKind.NOT_YET_PRESENT, e.kind());
        }
    }

    // ========================================================================
    // Event order
    // ========================================================================

    @Nested
    @DisplayName("Event order")
    class EventOrderTests {

        @Test
        @DisplayName("Creating a live file again fails with DUPLICATE_ENTRY")
        void testCreateTwice() throws IOException {
            write("x");
            create(1);

            store.beginRevision(2);
            VerConException e = assertThrows(VerConException.class, () -> file.createAtRevision(2));
            assertEquals(ErrorKind.DUPLICATE_ENTRY, e.kind());
        }

        @Test
        @DisplayName("Changing at a revision not above the last event fails")
        void testChangeNotAbove() throws IOException {
            write("x");
            create(3);

            store.beginRevision(3);
            VerConException e = assertThrows(VerConException.class, () -> file.changeAtRevision(3));
            assertEquals(ErrorKind.INVALID_EVENT_ORDER, e.kind());
        }

        @Test
        @DisplayName("Changing or deleting a file without live event fails")
        void testNoLiveEvent() {
            store.beginRevision(1);
            assertEquals(ErrorKind.INVALID_EVENT_ORDER,
                    assertThrows(VerConException.class, () -> file.changeAtRevision(1)).kind());
            assertEquals(ErrorKind.INVALID_EVENT_ORDER,
                    assertThrows(VerConException.class, () -> file.deleteAtRevision(1)).kind());
        }

        @Test
        @DisplayName("Loading two events at one revision fails with DUPLICATE_ENTRY")
        void testLoadDuplicate() {
            file.loadEvent(EventState.HISTORICAL, 1, ContentKind.TEXT, "HT1- notes.txt");

            VerConException e = assertThrows(VerConException.class,
                    () -> file.loadEvent(EventState.LIVE, 1, ContentKind.BINARY, "EB1- notes.txt"));
            assertEquals(ErrorKind.DUPLICATE_ENTRY, e.kind());
        }

        @Test
        @DisplayName("Loading a second live event fails with INVALID_EVENT_ORDER")
        void testLoadSecondLive() {
            file.loadEvent(EventState.LIVE, 1, ContentKind.TEXT, "ET1- notes.txt");

            VerConException e = assertThrows(VerConException.class,
                    () -> file.loadEvent(EventState.LIVE, 2, ContentKind.TEXT, "ET2- notes.txt"));
            assertEquals(ErrorKind.INVALID_EVENT_ORDER, e.kind());
        }

        @Test
        @DisplayName("Loading an event above the live one fails with INVALID_EVENT_ORDER")
        void testLoadAboveLive() {
            file.loadEvent(EventState.LIVE, 2, ContentKind.TEXT, "ET2- notes.txt");

            VerConException e = assertThrows(VerConException.class,
                    () -> file.loadEvent(EventState.DELETED, 3, ContentKind.BINARY, "D3- notes.txt"));
            assertEquals(ErrorKind.INVALID_EVENT_ORDER, e.kind());
        }

        @Test
        @DisplayName("A log ending in a historical event does not verify")
        void testVerifyTrailingHistorical() {
            file.loadEvent(EventState.HISTORICAL, 1, ContentKind.TEXT, "HT1- notes.txt");

            VerConException e = assertThrows(VerConException.class, file::verify);
            assertEquals(ErrorKind.INVALID_EVENT_ORDER, e.kind());
        }
    }

    // ========================================================================
    // Rehydration and modification check
    // ========================================================================

    @Test
    void testRehydratedFileRebuildsEveryRevision() throws IOException {
        write("one\n");
        create(1);
        write("one\ntwo\n");
        change(2);
        delete(3);
        write("three\n");
        create(4);

        VersionedFile reloaded = newFile();
        for (String artifact : artifacts()) {
            reloaded.loadEvent(ArtifactName.parse(artifact).orElseThrow());
        }
        reloaded.verify();

        assertEquals(4, reloaded.lastRevision());
        assertTrue(reloaded.isLive());
        assertEquals("one\n", reloaded.contentsAt(1).text());
        assertEquals("one\ntwo\n", reloaded.contentsAt(2).text());
        assertEquals("three\n", reloaded.contentsAt(4).text());
    }

    @Test
    void testIsModified() throws IOException {
        assertFalse(file.isModified(), "missing working file is not a modification");

        write("same");
        assertTrue(file.isModified(), "untracked working file counts as modified");

        create(1);
        assertFalse(file.isModified());

        write("different");
        assertTrue(file.isModified());

        Files.delete(workDir.resolve("notes.txt"));
        assertFalse(file.isModified());
    }
}
