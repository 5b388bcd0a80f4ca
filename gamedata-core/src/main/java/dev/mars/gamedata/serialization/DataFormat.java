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
package dev.mars.gamedata.serialization;

import dev.mars.gamedata.UnsupportedFormatException;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported data file formats, identified by file extension.
 */
public enum DataFormat {

    /** Array of flat objects. */
    JSON("json"),

    /** Header row plus one row per record. */
    CSV("csv"),

    /** Sequence of mappings. */
    YAML("yaml", "yml");

    private final List<String> extensions;

    DataFormat(String... extensions) {
        this.extensions = List.of(extensions);
    }

    /** The canonical extension, including the dot (e.g. {@code .json}). */
    public String extension() {
        return "." + extensions.get(0);
    }

    /** All extensions mapped to this format, without the dot. */
    public List<String> extensions() {
        return extensions;
    }

    /**
     * Detects the format of a path from its extension (case-insensitive).
     *
     * @throws UnsupportedFormatException if the extension is missing or unknown
     */
    public static DataFormat fromPath(String path) {
        return detect(path).orElseThrow(() ->
                new UnsupportedFormatException("File extension of '" + path + "' is not supported"));
    }

    /**
     * Detects the format of a path from its extension, if it has a known one.
     */
    public static Optional<DataFormat> detect(String path) {
        if (path == null) {
            return Optional.empty();
        }
        String name = path.substring(Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\')) + 1);
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (DataFormat format : values()) {
            if (format.extensions.contains(ext)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
