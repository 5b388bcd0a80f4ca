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

import java.io.Closeable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Storage Provider Interface.
 * <p>
 * The I/O boundary of the data layer: reads and writes raw text by logical
 * path. Providers know nothing about the shape of the data they move;
 * repositories and serializers depend solely on this interface, so backends
 * (file system, in-memory, resource bundles, blob stores) are interchangeable.
 * <p>
 * Logical paths are relative, use {@code /} as separator (a {@code \} is
 * accepted and normalized) and are resolved against the provider's own root.
 * <p>
 * <b>Ownership:</b> a provider belongs to exactly one data context, which
 * closes it. After {@link #close()} every asynchronous operation fails with
 * {@link StorageException}.
 *
 * @see FileStorageProvider
 * @see InMemoryStorageProvider
 */
public interface StorageProvider extends Closeable {

    /** Pattern used by {@link #loadMultiple(String)}. */
    String DEFAULT_PATTERN = "*.json";

    /**
     * Loads the text stored at a logical path.
     *
     * @param path the logical path
     * @return a future with the full text; fails with
     *         {@link dev.mars.gamedata.DataNotFoundException} if nothing is
     *         stored at {@code path}
     */
    CompletableFuture<String> loadText(String path);

    /**
     * Stores text at a logical path, creating intermediate containers and
     * overwriting existing content.
     *
     * @param path    the logical path
     * @param content the text to store
     * @return a future that completes when the content is written; fails with
     *         {@link StorageException} on write errors
     */
    CompletableFuture<Void> saveText(String path, String content);

    /**
     * Checks whether content exists at a logical path. Never throws.
     */
    boolean exists(String path);

    /**
     * Resolves a logical path to the provider's absolute form, for diagnostics.
     * Pure: performs no I/O.
     */
    String resolvePath(String path);

    /**
     * Lists the logical paths of files directly inside a folder (non-recursive)
     * whose file name matches a glob pattern such as {@code *.csv}.
     *
     * @return a future with the matching paths in name order; an empty list if
     *         the folder does not exist
     */
    CompletableFuture<List<String>> listFiles(String folder, String pattern);

    /**
     * Loads every {@code *.json} file directly inside a folder.
     *
     * @see #loadMultiple(String, String)
     */
    default CompletableFuture<Map<String, String>> loadMultiple(String folder) {
        return loadMultiple(folder, DEFAULT_PATTERN);
    }

    /**
     * Loads every file directly inside a folder whose name matches a pattern.
     * <p>
     * A missing folder is not an error: the result is an empty map. This lets
     * callers such as the localization loader ask "are there any languages
     * yet" without knowing which backend is in use.
     *
     * @return a future with logical path to text, in path order
     */
    default CompletableFuture<Map<String, String>> loadMultiple(String folder, String pattern) {
        return listFiles(folder, pattern).thenCompose(paths -> {
            Map<String, CompletableFuture<String>> pending = new LinkedHashMap<>();
            for (String path : paths) {
                pending.put(path, loadText(path));
            }
            return CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0]))
                    .thenApply(v -> {
                        Map<String, String> result = new LinkedHashMap<>();
                        pending.forEach((path, text) -> result.put(path, text.join()));
                        return result;
                    });
        });
    }

    /**
     * Releases all resources held by the provider. Idempotent.
     */
    @Override
    void close();
}
