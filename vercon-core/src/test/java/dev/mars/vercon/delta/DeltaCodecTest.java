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
package dev.mars.vercon.delta;

import dev.mars.vercon.ErrorKind;
import dev.mars.vercon.VerConException;
import dev.mars.vercon.delta.DeltaInstruction.Copy;
import dev.mars.vercon.delta.DeltaInstruction.Insert;
import dev.mars.vercon.delta.DeltaInstruction.Skip;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DeltaCodec}.
 */
class DeltaCodecTest {

    private static String roundTrip(String from, String to) {
        Delta delta = DeltaCodec.computeDelta(from, to);
        Delta parsed = DeltaCodec.parse(DeltaCodec.serialize(delta));
        assertEquals(delta, parsed, "serialized form must parse back to the same script");
        return DeltaCodec.applyDelta(from, parsed);
    }

    // ========================================================================
    // Compute / Apply
    // ========================================================================

    @Nested
    @DisplayName("Compute and apply")
    class ComputeApplyTests {

        @Test
        @DisplayName("Identical texts produce a single copy")
        void testIdenticalTexts() {
            Delta delta = DeltaCodec.computeDelta("a\nb\n", "a\nb\n");

            assertEquals(List.of(new Copy(4)), delta.instructions());
        }

        @Test
        @DisplayName("Empty to empty is the empty script")
        void testEmptyToEmpty() {
            Delta delta = DeltaCodec.computeDelta("", "");

            assertTrue(delta.isEmpty());
            assertEquals("", DeltaCodec.serialize(delta));
            assertEquals("", DeltaCodec.applyDelta("", delta));
        }

        @Test
        @DisplayName("Delta from the empty text is a single insert")
        void testFromEmpty() {
            Delta delta = DeltaCodec.computeDelta("", "hello\n");

            assertEquals(List.of(new Insert("hello\n")), delta.instructions());
        }

        @Test
        @DisplayName("Delta to the empty text is a single skip")
        void testToEmpty() {
            Delta delta = DeltaCodec.computeDelta("one\ntwo\n", "");

            assertEquals(List.of(new Skip(8)), delta.instructions());
            assertEquals("", DeltaCodec.applyDelta("one\ntwo\n", delta));
        }

        @Test
        @DisplayName("Changed middle line becomes copy, skip, insert, copy")
        void testChangedMiddleLine() {
            Delta delta = DeltaCodec.computeDelta("a\nb\nc\n", "a\nB\nc\n");

            assertEquals(List.of(new Copy(2), new Skip(2), new Insert("B\n"), new Copy(2)),
                    delta.instructions());
            assertEquals(6, delta.sourceLength());
            assertEquals(6, delta.targetLength());
        }

        @Test
        @DisplayName("Appending text to a line without newline")
        void testAppendToUnterminatedLine() {
            assertEquals("hello world", roundTrip("hello", "hello world"));
        }

        @Test
        @DisplayName("CRLF line endings survive untouched")
        void testCrlf() {
            String from = "line one\r\nline two\r\nline three\r\n";
            String to = "line one\r\nline 2\r\nline three\r\n";

            assertEquals(to, roundTrip(from, to));
        }

        @Test
        @DisplayName("Missing final newline is preserved in both directions")
        void testMissingFinalNewline() {
            assertEquals("a\nb", roundTrip("a\nb\n", "a\nb"));
            assertEquals("a\nb\n", roundTrip("a\nb", "a\nb\n"));
        }

        @Test
        @DisplayName("Counts are code points, not UTF-16 units")
        void testSurrogatePairs() {
            String from = "smile 😀\nsame\n";
            String to = "grin 😁😁\nsame\n";

            Delta delta = DeltaCodec.computeDelta(from, to);

            assertEquals(new Skip(8), delta.instructions().get(0));
            assertEquals(to, roundTrip(from, to));
        }

        @Test
        @DisplayName("Insert literal containing newlines and op-like lines")
        void testLiteralWithNewlines() {
            String to = "x\nc 5\ni 3\n\n\nend";

            assertEquals(to, roundTrip("", to));
        }

        @Test
        @DisplayName("Large edit with repeated lines")
        void testRepeatedLines() {
            StringBuilder from = new StringBuilder();
            StringBuilder to = new StringBuilder();
            for (int i = 0; i < 500; i++) {
                from.append(i % 3 == 0 ? "}\n" : "line " + i + "\n");
                to.append(i % 7 == 0 ? "changed " + i + "\n" : (i % 3 == 0 ? "}\n" : "line " + i + "\n"));
            }

            assertEquals(to.toString(), roundTrip(from.toString(), to.toString()));
        }

        @Test
        @DisplayName("Builder merges adjacent steps of the same op and apply honours each op")
        void testBuilderMergesAndApplies() {
            Delta delta = Delta.builder()
                    .copy(2).copy(1)
                    .skip(1).skip(2)
                    .insert("XY").insert("Z")
                    .copy(1)
                    .build();

            assertEquals(List.of(new Copy(3), new Skip(3), new Insert("XYZ"), new Copy(1)), delta.instructions());
            assertEquals(7, delta.sourceLength());
            assertEquals(7, delta.targetLength());
            assertEquals("abcXYZg", DeltaCodec.applyDelta("abcdefg", delta));
        }

        @Test
        @DisplayName("Applying to a shorter text fails with CORRUPT_DELTA")
        void testOverrun() {
            Delta delta = Delta.builder().copy(10).build();

            VerConException e = assertThrows(VerConException.class, () -> DeltaCodec.applyDelta("short", delta));
            assertEquals(ErrorKind.CORRUPT_DELTA, e.kind());
        }

        @Test
        @DisplayName("Leaving source unconsumed fails with CORRUPT_DELTA")
        void testUnconsumedSource() {
            Delta delta = Delta.builder().copy(2).build();

            VerConException e = assertThrows(VerConException.class, () -> DeltaCodec.applyDelta("longer", delta));
            assertEquals(ErrorKind.CORRUPT_DELTA, e.kind());
        }
    }

    // ========================================================================
    // Serialization
    // ========================================================================

    @Nested
    @DisplayName("Serialization")
    class SerializationTests {

        @Test
        @DisplayName("Serialized form is one header line per instruction")
        void testSerializedForm() {
            Delta delta = Delta.builder().copy(12).skip(4).insert("hello!").build();

            assertEquals("c 12\ns 4\ni 6\nhello!\n", DeltaCodec.serialize(delta));
        }

        @Test
        @DisplayName("Parse reads literals by code point count")
        void testParseLiteral() {
            Delta delta = DeltaCodec.parse("i 2\n😀\n\nc 1\n");

            assertEquals(List.of(new Insert("😀\n"), new Copy(1)), delta.instructions());
        }

        @Test
        @DisplayName("Unknown op is rejected")
        void testUnknownOp() {
            assertCorrupt("x 3\n");
        }

        @Test
        @DisplayName("Zero, negative and non-numeric counts are rejected")
        void testBadCounts() {
            assertCorrupt("c 0\n");
            assertCorrupt("c -1\n");
            assertCorrupt("s abc\n");
            assertCorrupt("c 99999999999\n");
        }

        @Test
        @DisplayName("Missing separator or terminator is rejected")
        void testMalformedHeader() {
            assertCorrupt("c12\n");
            assertCorrupt("c 12");
        }

        @Test
        @DisplayName("Literal shorter than its count is rejected")
        void testTruncatedLiteral() {
            assertCorrupt("i 10\nabc\n");
            assertCorrupt("i 3\nabc");
        }

        private void assertCorrupt(String text) {
            VerConException e = assertThrows(VerConException.class, () -> DeltaCodec.parse(text));
            assertEquals(ErrorKind.CORRUPT_DELTA, e.kind(), "for input: " + text);
        }
    }

    // ========================================================================
    // Line splitting
    // ========================================================================

    @Test
    void testSplitLines_KeepsTerminators() {
        assertEquals(List.of("a\n", "\n", "b"), DeltaCodec.splitLines("a\n\nb"));
        assertEquals(List.of(), DeltaCodec.splitLines(""));
    }
}
