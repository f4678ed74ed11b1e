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

/**
 * One step of a {@link Delta} edit script.
 * <p>
 * Counts are expressed in Unicode code points, never in UTF-16 units, so a
 * serialized script means the same thing whatever produced it.
 */
public interface DeltaInstruction {

    char COPY = 'c';
    char SKIP = 's';
    char INSERT = 'i';

    /** Serialized op letter. */
    char op();

    /** Number of code points this instruction covers. */
    int count();

    /**
     * Emits the next {@code count} code points of the source.
     *
     * @param count code points to copy, positive
     */
    record Copy(int count) implements DeltaInstruction {
        public Copy {
            if (count <= 0) {
                throw new IllegalArgumentException("Copy count must be positive: " + count);
            }
        }

        @Override
        public char op() {
            return COPY;
        }
    }

    /**
     * Advances over the next {@code count} code points of the source without emitting them.
     *
     * @param count code points to skip, positive
     */
    record Skip(int count) implements DeltaInstruction {
        public Skip {
            if (count <= 0) {
                throw new IllegalArgumentException("Skip count must be positive: " + count);
            }
        }

        @Override
        public char op() {
            return SKIP;
        }
    }

    /**
     * Emits a literal.
     *
     * @param text the literal, never empty
     */
    record Insert(String text) implements DeltaInstruction {
        public Insert {
            if (text == null || text.isEmpty()) {
                throw new IllegalArgumentException("Insert literal must not be empty");
            }
        }

        @Override
        public char op() {
            return INSERT;
        }

        @Override
        public int count() {
            return text.codePointCount(0, text.length());
        }
    }
}
