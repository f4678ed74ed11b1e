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

import dev.mars.vercon.ErrorKind;
import dev.mars.vercon.VerConException;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DirectoryTree} and {@link DirectoryNode}.
 */
class DirectoryTreeTest {

    private DirectoryTree tree;

    @BeforeEach
    void setUp() {
        tree = new DirectoryTree();
    }

    // ========================================================================
    // Structure
    // ========================================================================

    @Nested
    @DisplayName("Structure")
    class StructureTests {

        @Test
        @DisplayName("New tree holds only the always-active root")
        void testEmptyTree() {
            assertEquals(1, tree.size());
            assertEquals(List.of(0), tree.root().history());
            assertTrue(tree.root().isActive());
            assertTrue(tree.root().isRoot());
            assertEquals(0, tree.maxRevision());
            assertEquals("", tree.serialize());
        }

        @Test
        @DisplayName("add creates every missing segment at the revision")
        void testAddNested() {
            DirectoryNode b = tree.add("a/b", 1);

            assertEquals("a/b", tree.pathOf(b));
            assertEquals(List.of(1), tree.atPath("a").history());
            assertTrue(tree.atPath("a").touched());
            assertTrue(b.touched());
            assertEquals(1, tree.maxRevision());
            assertEquals("1 a\n 1 b\n", tree.serialize());
        }

        @Test
        @DisplayName("Adding an active path fails with DUPLICATE_ENTRY")
        void testAddDuplicate() {
            tree.add("a", 1);

            assertEquals(ErrorKind.DUPLICATE_ENTRY,
                    assertThrows(VerConException.class, () -> tree.add("a", 2)).kind());
            assertEquals(ErrorKind.DUPLICATE_ENTRY,
                    assertThrows(VerConException.class, () -> tree.add("", 2)).kind());
        }

        @Test
        @DisplayName("Adding below an existing directory only creates the new part")
        void testAddBelowExisting() {
            tree.add("a", 1);
            tree.add("a/b", 2);

            assertEquals(List.of(1), tree.atPath("a").history());
            assertEquals(List.of(2), tree.atPath("a/b").history());
        }

        @Test
        @DisplayName("Unknown path fails with PATH_NOT_FOUND")
        void testAtPathMissing() {
            tree.add("a", 1);

            assertTrue(tree.find("a/zz").isEmpty());
            assertEquals(ErrorKind.PATH_NOT_FOUND,
                    assertThrows(VerConException.class, () -> tree.atPath("a/zz")).kind());
            assertSame(tree.root(), tree.atPath(""));
        }

        @Test
        @DisplayName("Pre-order visits parents first and siblings by name")
        void testPreOrder() {
            tree.add("zeta", 1);
            tree.add("alpha/inner", 1);
            tree.add("beta", 1);

            List<String> paths = tree.preOrder().stream().map(tree::pathOf).collect(Collectors.toList());
            assertEquals(List.of("", "alpha", "alpha/inner", "beta", "zeta"), paths);
        }
    }

    // ========================================================================
    // Activity history
    // ========================================================================

    @Nested
    @DisplayName("Activity history")
    class HistoryTests {

        @Test
        @DisplayName("Activity at a revision follows the parity of the history prefix")
        void testIsActiveAt() {
            DirectoryNode node = tree.add("docs", 1);
            tree.toggleState(node, 4);
            tree.toggleState(node, 6);

            assertFalse(node.isActiveAt(0));
            assertTrue(node.isActiveAt(1));
            assertTrue(node.isActiveAt(3));
            assertFalse(node.isActiveAt(4));
            assertFalse(node.isActiveAt(5));
            assertTrue(node.isActiveAt(6));
            assertTrue(node.isActiveAt(100));
            assertTrue(node.isActive());
            assertEquals(6, tree.maxRevision());
        }

        @Test
        @DisplayName("add reactivates an inactive directory")
        void testReactivate() {
            DirectoryNode node = tree.add("docs", 1);
            tree.toggleState(node, 2);
            assertFalse(node.isActive());

            tree.add("docs", 3);

            assertEquals(List.of(1, 2, 3), node.history());
            assertTrue(node.isActive());
        }

        @Test
        @DisplayName("Toggling at a revision not above the history fails")
        void testToggleNotAbove() {
            DirectoryNode node = tree.add("docs", 3);

            assertEquals(ErrorKind.INVALID_EVENT_ORDER,
                    assertThrows(VerConException.class, () -> tree.toggleState(node, 3)).kind());
            assertEquals(ErrorKind.INVALID_EVENT_ORDER,
                    assertThrows(VerConException.class, () -> tree.toggleState(tree.root(), 5)).kind());
        }

        @Test
        @DisplayName("Untouched directories are deactivated with their log lines")
        void testMarkUntouchedDeleted() {
            tree.add("keep/gone", 1);
            tree.add("other", 1);

            tree.resetTouched();
            tree.atPath("keep").touch();

            assertEquals(2, tree.countUntouched());

            List<PathChange> changes = new ArrayList<>();
            assertEquals(2, tree.markUntouchedDeleted(2, changes));

            assertEquals(List.of(PathChange.directoryDeleted("keep/gone"), PathChange.directoryDeleted("other")),
                    changes);
            assertEquals(List.of(1, 2), tree.atPath("keep/gone").history());
            assertEquals(List.of(1), tree.atPath("keep").history());
            assertEquals(0, tree.countUntouched());
        }

        @Test
        @DisplayName("resetTouched leaves the root touched")
        void testResetTouched() {
            tree.add("a", 1);

            tree.resetTouched();

            assertTrue(tree.root().touched());
            assertFalse(tree.atPath("a").touched());
        }
    }

    // ========================================================================
    // Serialization
    // ========================================================================

    @Nested
    @DisplayName("Serialization")
    class SerializationTests {

        private static final String SAMPLE = "1,4,6 docs\n 4 drafts\n  5,7 old\n1 src\n 2 main\n";

        @Test
        @DisplayName("Well-formed text survives a round trip")
        void testRoundTrip() {
            DirectoryTree parsed = DirectoryTree.deserialize(SAMPLE);

            assertEquals(SAMPLE, parsed.serialize());
            assertEquals(6, parsed.size());
            assertEquals(7, parsed.maxRevision());
            assertEquals(List.of(5, 7), parsed.atPath("docs/drafts/old").history());
            assertEquals(7, parsed.atPath("docs").maxRevision());
            assertEquals(2, parsed.atPath("src").maxRevision());
        }

        @Test
        @DisplayName("Blank text is the empty tree")
        void testBlank() {
            assertEquals(1, DirectoryTree.deserialize("").size());
            assertEquals(1, DirectoryTree.deserialize("\n").size());
        }

        @Test
        @DisplayName("Serialized tree parses back to the same structure")
        void testSerializeBuiltTree() {
            DirectoryNode docs = tree.add("docs/api", 1);
            tree.toggleState(docs, 2);
            tree.add("bin", 3);

            DirectoryTree parsed = DirectoryTree.deserialize(tree.serialize());

            assertEquals("3 bin\n1 docs\n 1,2 api\n", parsed.serialize());
            assertFalse(parsed.atPath("docs/api").isActive());
        }

        @Test
        @DisplayName("Malformed lines fail with MALFORMED_METADATA")
        void testMalformed() {
            assertMalformed("x docs\n");
            assertMalformed("1docs\n");
            assertMalformed("1 a\n  2 b\n");
            assertMalformed("1 a\n1 a\n");
            assertMalformed("3,2 a\n");
            assertMalformed("0 a\n");
            assertMalformed("1,,2 a\n");
            assertMalformed("99999999999 a\n");
        }

        private void assertMalformed(String text) {
            VerConException e = assertThrows(VerConException.class, () -> DirectoryTree.deserialize(text));
            assertEquals(ErrorKind.MALFORMED_METADATA, e.kind(), "for input: " + text);
        }
    }
}
