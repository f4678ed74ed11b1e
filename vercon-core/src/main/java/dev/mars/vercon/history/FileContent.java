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

import java.nio.charset.StandardCharsets;

/**
 * Content of a file at some revision.
 *
 * @param kind whether the bytes are UTF-8 text or opaque binary
 * @param data the exact bytes of the file
 */
public record FileContent(ContentKind kind, byte[] data) {

    public static FileContent ofText(String text) {
        return new FileContent(ContentKind.TEXT, text.getBytes(StandardCharsets.UTF_8));
    }

    public static FileContent ofBinary(byte[] data) {
        return new FileContent(ContentKind.BINARY, data);
    }

    /**
     * Decodes the content; only meaningful for {@link ContentKind#TEXT}.
     */
    public String text() {
        if (kind != ContentKind.TEXT) {
            throw new IllegalStateException("Binary content has no text form");
        }
        return new String(data, StandardCharsets.UTF_8);
    }
}
