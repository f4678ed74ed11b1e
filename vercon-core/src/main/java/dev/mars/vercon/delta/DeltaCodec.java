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

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Chunk;
import com.github.difflib.patch.Patch;
import dev.mars.vercon.ErrorKind;
import dev.mars.vercon.VerConException;
import dev.mars.vercon.delta.DeltaInstruction.Copy;
import dev.mars.vercon.delta.DeltaInstruction.Insert;
import dev.mars.vercon.delta.DeltaInstruction.Skip;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes, applies and (de)serializes {@link Delta} edit scripts.
 * <p>
 * Matching is line based: both texts are split after every {@code '\n'}
 * (terminators stay attached to their line) and compared with the Myers
 * algorithm of java-diff-utils. Unchanged lines become {@link Copy} spans,
 * removed lines {@link Skip} spans and added lines {@link Insert} literals.
 * Frequent lines are never discarded by the matcher.
 * <p>
 * <b>Serialized form:</b>
 * <pre>
 * c 12            // copy 12 code points
 * s 4             // skip 4 code points
 * i 6             // insert the next 6 code points verbatim
 * hello!
 * </pre>
 * Each instruction is one {@code "<op> <count>\n"} line. An {@code i} line is
 * followed by exactly {@code count} literal code points and a terminating
 * newline; the literal may itself contain newlines.
 */
public final class DeltaCodec {

    private static final Logger LOG = LoggerFactory.getLogger(DeltaCodec.class);

    private DeltaCodec() {
    }

    // ========================================================================
    // Compute / Apply
    // ========================================================================

    /**
     * Computes a script that turns {@code from} into {@code to}.
     *
     * @param from the source text
     * @param to   the target text
     * @return a script whose copies and skips consume all of {@code from}
     */
    public static Delta computeDelta(String from, String to) {
        List<String> source = splitLines(from);
        List<String> target = splitLines(to);

        Patch<String> patch = DiffUtils.diff(source, target);
        Delta.Builder builder = Delta.builder();

        int line = 0;
        for (AbstractDelta<String> change : patch.getDeltas()) {
            Chunk<String> removed = change.getSource();
            builder.copy(codePoints(source.subList(line, removed.getPosition())));
            builder.skip(codePoints(removed.getLines()));
            builder.insert(String.join("", change.getTarget().getLines()));
            line = removed.getPosition() + removed.size();
        }
        builder.copy(codePoints(source.subList(line, source.size())));

        Delta delta = builder.build();
        LOG.trace("Computed delta: {} lines -> {} lines, {} instructions",
                source.size(), target.size(), delta.instructions().size());
        return delta;
    }

    /**
     * Runs a script against its source text.
     *
     * @param from  the source text
     * @param delta the script
     * @return the target text
     * @throws VerConException {@link ErrorKind#CORRUPT_DELTA} if the cursor overruns
     *                         {@code from} or the script leaves part of it unconsumed
     */
    public static String applyDelta(String from, Delta delta) {
        StringBuilder out = new StringBuilder(from.length());
        int cursor = 0;

        for (DeltaInstruction instruction : delta.instructions()) {
            switch (instruction.op()) {
                case DeltaInstruction.COPY -> {
                    int end = advance(from, cursor, instruction.count());
                    out.append(from, cursor, end);
                    cursor = end;
                }
                case DeltaInstruction.SKIP -> cursor = advance(from, cursor, instruction.count());
                case DeltaInstruction.INSERT -> out.append(((Insert) instruction).text());
                default -> throw new IllegalStateException("Unknown instruction " + instruction);
            }
        }

        if (cursor != from.length()) {
            throw new VerConException(ErrorKind.CORRUPT_DELTA,
                    "Delta leaves " + from.codePointCount(cursor, from.length())
                            + " code points of the source unconsumed");
        }
        return out.toString();
    }

    // ========================================================================
    // Serialization
    // ========================================================================

    /**
     * Renders a script in its textual form.
     */
    public static String serialize(Delta delta) {
        StringBuilder out = new StringBuilder();
        for (DeltaInstruction instruction : delta.instructions()) {
            out.append(instruction.op()).append(' ').append(instruction.count()).append('\n');
            if (instruction.op() == DeltaInstruction.INSERT) {
                out.append(((Insert) instruction).text()).append('\n');
            }
        }
        return out.toString();
    }

    /**
     * Parses the textual form produced by {@link #serialize(Delta)}.
     *
     * @throws VerConException {@link ErrorKind#CORRUPT_DELTA} on any malformed instruction
     */
    public static Delta parse(String text) {
        List<DeltaInstruction> instructions = new ArrayList<>();
        int pos = 0;

        while (pos < text.length()) {
            int eol = text.indexOf('\n', pos);
            if (eol < 0) {
                throw corrupt("Unterminated instruction at offset " + pos);
            }
            String header = text.substring(pos, eol);
            if (header.length() < 3 || header.charAt(1) != ' ') {
                throw corrupt("Malformed instruction '" + header + "' at offset " + pos);
            }

            char op = header.charAt(0);
            int count = parseCount(header.substring(2), pos);
            pos = eol + 1;

            switch (op) {
                case DeltaInstruction.COPY -> instructions.add(new Copy(count));
                case DeltaInstruction.SKIP -> instructions.add(new Skip(count));
                case DeltaInstruction.INSERT -> {
                    int end = advance(text, pos, count);
                    if (end >= text.length() || text.charAt(end) != '\n') {
                        throw corrupt("Insert literal at offset " + pos + " is not newline-terminated");
                    }
                    instructions.add(new Insert(text.substring(pos, end)));
                    pos = end + 1;
                }
                default -> throw corrupt("Unknown op '" + op + "' at offset " + (pos - header.length() - 1));
            }
        }
        return new Delta(instructions);
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    /**
     * Splits after each line feed. A trailing fragment without terminator is
     * kept as the last line; the empty text has no lines.
     */
    static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int eol;
        while ((eol = text.indexOf('\n', start)) >= 0) {
            lines.add(text.substring(start, eol + 1));
            start = eol + 1;
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    private static int codePoints(List<String> lines) {
        int total = 0;
        for (String line : lines) {
            total += line.codePointCount(0, line.length());
        }
        return total;
    }

    private static int advance(String text, int cursor, int codePoints) {
        try {
            return text.offsetByCodePoints(cursor, codePoints);
        } catch (IndexOutOfBoundsException e) {
            throw new VerConException(ErrorKind.CORRUPT_DELTA,
                    "Delta overruns its text: " + codePoints + " code points requested at offset " + cursor, e);
        }
    }

    private static int parseCount(String digits, int offset) {
        if (digits.isEmpty() || !digits.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw corrupt("Invalid count '" + digits + "' at offset " + offset);
        }
        try {
            int count = Integer.parseInt(digits);
            if (count == 0) {
                throw corrupt("Zero count at offset " + offset);
            }
            return count;
        } catch (NumberFormatException e) {
            throw new VerConException(ErrorKind.CORRUPT_DELTA,
                    "Count out of range '" + digits + "' at offset " + offset, e);
        }
    }

    private static VerConException corrupt(String message) {
        return new VerConException(ErrorKind.CORRUPT_DELTA, message);
    }
}
