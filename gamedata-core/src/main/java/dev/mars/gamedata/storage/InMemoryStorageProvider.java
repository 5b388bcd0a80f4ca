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

import dev.mars.gamedata.DataNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link StorageProvider}.
 * <p>
 * Holds logical path to text in a concurrent map. Intended for tests,
 * tooling and data sets assembled at runtime; every operation completes
 * immediately.
 */
public final class InMemoryStorageProvider implements StorageProvider {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryStorageProvider.class);

    private static final String SCHEME = "memory:/";

    private final Map<String, String> files = new ConcurrentHashMap<>();
    private volatile boolean closed = false;

    public InMemoryStorageProvider() {
    }

    /**
     * Creates a provider pre-populated with the given logical path to text entries.
     */
    public InMemoryStorageProvider(Map<String, String> initialFiles) {
        initialFiles.forEach((path, text) -> files.put(LogicalPath.normalize(path), text));
    }

    /**
     * Stores text synchronously. Convenience for assembling fixtures.
     *
     * @return this provider
     */
    public InMemoryStorageProvider put(String path, String content) {
        files.put(LogicalPath.normalize(path), content);
        return this;
    }

    /** Removes an entry. Returns {@code true} if something was stored at the path. */
    public boolean delete(String path) {
        return files.remove(LogicalPath.normalize(path)) != null;
    }

    /** Returns the text stored at a path without going through a future. */
    public String peek(String path) {
        return files.get(LogicalPath.normalize(path));
    }

    @Override
    public CompletableFuture<String> loadText(String path) {
        try {
            ensureOpen();
            String key = LogicalPath.normalize(path);
            String text = files.get(key);
            if (text == null) {
                LOG.debug("Entry not found: {}", key);
                return CompletableFuture.failedFuture(
                        new DataNotFoundException(path, "File not found: " + SCHEME + key));
            }
            return CompletableFuture.completedFuture(text);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<Void> saveText(String path, String content) {
        try {
            ensureOpen();
            files.put(LogicalPath.normalize(path), content == null ? "" : content);
            return CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public boolean exists(String path) {
        try {
            return !closed && files.containsKey(LogicalPath.normalize(path));
        } catch (RuntimeException e) {
            return false;
        }
    }

    @Override
    public String resolvePath(String path) {
        return SCHEME + LogicalPath.normalize(path);
    }

    @Override
    public CompletableFuture<List<String>> listFiles(String folder, String pattern) {
        try {
            ensureOpen();
            String logicalFolder = LogicalPath.normalizeFolder(folder);
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher(
                    "glob:" + (pattern == null || pattern.isBlank() ? "*" : pattern));
            List<String> paths = new ArrayList<>();
            for (String key : files.keySet()) {
                if (LogicalPath.parent(key).equals(logicalFolder)
                        && matcher.matches(Path.of(LogicalPath.fileName(key)))) {
                    paths.add(key);
                }
            }
            Collections.sort(paths);
            return CompletableFuture.completedFuture(List.copyOf(paths));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            LOG.debug("InMemoryStorageProvider closed ({} entries)", files.size());
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageException("Storage provider is closed");
        }
    }
}
