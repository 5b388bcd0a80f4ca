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
package dev.mars.gamedata.storage;

/**
 * Normalization rules for logical paths shared by the providers.
 */
final class LogicalPath {

    private LogicalPath() {
    }

    /**
     * Normalizes a logical file path: backslashes become {@code /}, leading
     * {@code ./} and {@code /} segments and repeated separators are dropped.
     *
     * @throws IllegalArgumentException if the path is null or blank
     */
    static String normalize(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Logical path must not be blank");
        }
        String p = path.trim().replace('\\', '/');
        while (p.contains("//")) {
            p = p.replace("//", "/");
        }
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        return p;
    }

    /**
     * Normalizes a folder path. Unlike files, a blank folder means the root.
     */
    static String normalizeFolder(String folder) {
        if (folder == null || folder.isBlank() || folder.trim().equals(".") || folder.trim().equals("/")) {
            return "";
        }
        String f = normalize(folder);
        while (f.endsWith("/")) {
            f = f.substring(0, f.length() - 1);
        }
        return f;
    }

    /** Joins a normalized folder and a file name. */
    static String join(String folder, String fileName) {
        return folder.isEmpty() ? fileName : folder + "/" + fileName;
    }

    /** Returns the last segment of a normalized path. */
    static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    /** Returns the folder part of a normalized path, empty for root-level files. */
    static String parent(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }
}
