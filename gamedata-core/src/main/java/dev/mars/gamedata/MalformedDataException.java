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
package dev.mars.gamedata;

/**
 * Structural parse failure: unterminated structures, wrong column count,
 * values that cannot be bound to the record type, missing keys.
 * <p>
 * Carries the source path and a 1-based position so the failure can be
 * logged meaningfully. For structural errors the position is the line in
 * the source text; for binding errors it is the row (CSV) or element (JSON,
 * YAML) number. A position of {@code 0} means unknown.
 */
public class MalformedDataException extends GameDataException {

    private final String sourcePath;
    private final int position;

    public MalformedDataException(String sourcePath, int position, String message) {
        super(describe(sourcePath, position, message));
        this.sourcePath = sourcePath;
        this.position = position;
    }

    public MalformedDataException(String sourcePath, int position, String message, Throwable cause) {
        super(describe(sourcePath, position, message), cause);
        this.sourcePath = sourcePath;
        this.position = position;
    }

    public String sourcePath() {
        return sourcePath;
    }

    public int position() {
        return position;
    }

    private static String describe(String sourcePath, int position, String message) {
        String where = sourcePath == null ? "<unknown>" : sourcePath;
        return position > 0
                ? where + " [" + position + "]: " + message
                : where + ": " + message;
    }
}
