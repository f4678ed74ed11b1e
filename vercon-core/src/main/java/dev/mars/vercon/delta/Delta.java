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

import dev.mars.vercon.delta.DeltaInstruction.Copy;
import dev.mars.vercon.delta.DeltaInstruction.Insert;
import dev.mars.vercon.delta.DeltaInstruction.Skip;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered copy/skip/insert script transforming one text into another.
 * <p>
 * The script is consumed strictly left to right: {@link Copy} and {@link Skip}
 * move a cursor over the source, {@link Insert} contributes literal text.
 *
 * @param instructions the instructions, in application order
 */
public record Delta(List<DeltaInstruction> instructions) {

    public Delta {
        instructions = instructions == null
                ? Collections.emptyList()
                : List.copyOf(instructions);
    }

    /**
     * Creates an empty script (transforms the empty text into itself).
     */
    public static Delta empty() {
        return new Delta(Collections.emptyList());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return code points of the source consumed by copies and skips
     */
    public long sourceLength() {
        long total = 0;
        for (DeltaInstruction instruction : instructions) {
            if (instruction.op() != DeltaInstruction.INSERT) {
                total += instruction.count();
            }
        }
        return total;
    }

    /**
     * @return code points of the target produced by copies and inserts
     */
    public long targetLength() {
        long total = 0;
        for (DeltaInstruction instruction : instructions) {
            if (instruction.op() != DeltaInstruction.SKIP) {
                total += instruction.count();
            }
        }
        return total;
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    /**
     * Accumulates instructions, dropping zero-length steps and merging
     * consecutive steps of the same kind.
     */
    public static final class Builder {
        private final List<DeltaInstruction> instructions = new ArrayList<>();

        private Builder() {
        }

        public Builder copy(int count) {
            if (count > 0) {
                DeltaInstruction last = last();
                if (last != null && last.op() == DeltaInstruction.COPY) {
                    replaceLast(new Copy(last.count() + count));
                } else {
                    instructions.add(new Copy(count));
                }
            }
            return this;
        }

        public Builder skip(int count) {
            if (count > 0) {
                DeltaInstruction last = last();
                if (last != null && last.op() == DeltaInstruction.SKIP) {
                    replaceLast(new Skip(last.count() + count));
                } else {
                    instructions.add(new Skip(count));
                }
            }
            return this;
        }

        public Builder insert(String text) {
            if (text != null && !text.isEmpty()) {
                DeltaInstruction last = last();
                if (last != null && last.op() == DeltaInstruction.INSERT) {
                    replaceLast(new Insert(((Insert) last).text() + text));
                } else {
                    instructions.add(new Insert(text));
                }
            }
            return this;
        }

        public Delta build() {
            return new Delta(instructions);
        }

        private DeltaInstruction last() {
            return instructions.isEmpty() ? null : instructions.get(instructions.size() - 1);
        }

        private void replaceLast(DeltaInstruction instruction) {
            instructions.set(instructions.size() - 1, instruction);
        }
    }
}
