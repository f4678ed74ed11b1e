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
package dev.mars.vercon;

/**
 * Exception thrown when a repository operation fails.
 * <p>
 * The {@link #kind()} tells callers which condition was hit without having to
 * inspect the message text.
 */
public class VerConException extends RuntimeException {

    private final ErrorKind kind;

    public VerConException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public VerConException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    @Override
    public String toString() {
        return "VerConException{" + kind + ": " + getMessage() + '}';
    }
}
