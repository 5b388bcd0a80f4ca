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
import dev.mars.gamedata.config.GameDataConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousFileChannel;
import java.nio.channels.CompletionHandler;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * File-system implementation of {@link StorageProvider}.
 * <p>
 * Logical paths are resolved under a base directory. Reads and writes go
 * through {@link AsynchronousFileChannel}, so no caller thread blocks while
 * file I/O is outstanding; the returned futures complete on the channel's
 * completion threads.
 * <p>
 * <b>Layout example:</b>
 * <pre>
 * data/
 *  ├─ Characters.csv
 *  ├─ GameConfig.json
 *  └─ Localizations/
 *      ├─ LocalizationKeys.csv
 *      ├─ en.csv
 *      └─ ko.csv
 * </pre>
 * <p>
 * <b>Durability:</b> saves write a sibling {@code .tmp} file and atomically
 * rename it over the target, so readers never observe a half-written table.
 * <p>
 * Paths that resolve outside the base directory are rejected with
 * {@link StorageException}.
 *
 * @see StorageProvider
 */
public final class FileStorageProvider implements StorageProvider {

    private static final Logger LOG = LoggerFactory.getLogger(FileStorageProvider.class);

    /** Suffix of the temporary file written before the atomic rename. */
    private static final String TMP_SUFFIX = ".tmp";

    /** UTF-8 byte order mark, stripped on read. */
    private static final char BOM = '\uFEFF';

    private final Path basePath;
    private volatile boolean closed = false;

    /**
     * Creates a provider rooted at the base path from the configuration.
     *
     * @see GameDataConfig#basePath()
     */
    public FileStorageProvider(GameDataConfig config) {
        this(config.basePath());
    }

    /**
     * Creates a provider rooted at a base directory. The directory does not
     * need to exist yet; it is created by the first save.
     *
     * @param basePath the base directory for all logical paths
     */
    public FileStorageProvider(Path basePath) {
        if (basePath == null) {
            throw new IllegalArgumentException("basePath must not be null");
        }
        this.basePath = basePath.toAbsolutePath().normalize();
        LOG.info("FileStorageProvider initialized: basePath={}", this.basePath);
    }

    /** Creates a provider rooted at a base directory given as a string. */
    public FileStorageProvider(String basePath) {
        this(Path.of(basePath));
    }

    /** The absolute, normalized base directory. */
    public Path basePath() {
        return basePath;
    }

    // ========================================================================
    // Read
    // ========================================================================

    @Override
    public CompletableFuture<String> loadText(String path) {
        Path file;
        try {
            ensureOpen();
            file = resolve(path);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (!Files.isRegularFile(file)) {
            LOG.debug("File not found: {}", file);
            return CompletableFuture.failedFuture(new DataNotFoundException(path, "File not found: " + file));
        }

        CompletableFuture<String> result = new CompletableFuture<>();
        AsynchronousFileChannel channel;
        long size;
        try {
            channel = AsynchronousFileChannel.open(file, StandardOpenOption.READ);
            size = channel.size();
        } catch (NoSuchFileException e) {
            return CompletableFuture.failedFuture(new DataNotFoundException(path, "File not found: " + file));
        } catch (IOException e) {
            LOG.error("Failed to open {} for reading: {}", file, e.getMessage(), e);
            return CompletableFuture.failedFuture(new StorageException("Failed to read " + file, e));
        }
        if (size > Integer.MAX_VALUE) {
            closeChannel(channel, file);
            return CompletableFuture.failedFuture(
                    new StorageException("File too large to load as text: " + file + " (" + size + " bytes)"));
        }

        LOG.trace("Reading {} ({} bytes)", file, size);
        ByteBuffer buffer = ByteBuffer.allocate((int) size);
        readFully(channel, file, buffer, result);
        return result;
    }

    private void readFully(AsynchronousFileChannel channel, Path file, ByteBuffer buffer,
                           CompletableFuture<String> result) {
        if (!buffer.hasRemaining()) {
            finishRead(channel, file, buffer, result);
            return;
        }
        channel.read(buffer, buffer.position(), null, new CompletionHandler<Integer, Void>() {
            @Override
            public void completed(Integer bytesRead, Void attachment) {
                if (bytesRead < 0) {
                    finishRead(channel, file, buffer, result);
                } else {
                    readFully(channel, file, buffer, result);
                }
            }

            @Override
            public void failed(Throwable error, Void attachment) {
                closeChannel(channel, file);
                LOG.error("Failed to read {}: {}", file, error.getMessage(), error);
                result.completeExceptionally(new StorageException("Failed to read " + file, error));
            }
        });
    }

    private void finishRead(AsynchronousFileChannel channel, Path file, ByteBuffer buffer,
                            CompletableFuture<String> result) {
        closeChannel(channel, file);
        buffer.flip();
        String text = StandardCharsets.UTF_8.decode(buffer).toString();
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        LOG.debug("Loaded {} ({} chars)", file, text.length());
        result.complete(text);
    }

    // ========================================================================
    // Write
    // ========================================================================

    @Override
    public CompletableFuture<Void> saveText(String path, String content) {
        Path file;
        Path tmp;
        AsynchronousFileChannel channel;
        try {
            ensureOpen();
            file = resolve(path);
            tmp = file.resolveSibling(file.getFileName() + TMP_SUFFIX);
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = AsynchronousFileChannel.open(tmp,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
        } catch (IOException e) {
            LOG.error("Failed to prepare write of {}: {}", path, e.getMessage(), e);
            return CompletableFuture.failedFuture(new StorageException("Failed to write " + path, e));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        ByteBuffer buffer = StandardCharsets.UTF_8.encode(content == null ? "" : content);
        CompletableFuture<Void> result = new CompletableFuture<>();
        LOG.trace("Writing {} ({} bytes) via {}", file, buffer.remaining(), tmp);
        writeFully(channel, tmp, file, buffer, 0L, result);
        return result;
    }

    private void writeFully(AsynchronousFileChannel channel, Path tmp, Path file, ByteBuffer buffer,
                            long position, CompletableFuture<Void> result) {
        if (!buffer.hasRemaining()) {
            finishWrite(channel, tmp, file, result);
            return;
        }
        channel.write(buffer, position, null, new CompletionHandler<Integer, Void>() {
            @Override
            public void completed(Integer written, Void attachment) {
                writeFully(channel, tmp, file, buffer, position + written, result);
            }

            @Override
            public void failed(Throwable error, Void attachment) {
                closeChannel(channel, tmp);
                LOG.error("Failed to write {}: {}", file, error.getMessage(), error);
                result.completeExceptionally(new StorageException("Failed to write " + file, error));
            }
        });
    }

    private void finishWrite(AsynchronousFileChannel channel, Path tmp, Path file, CompletableFuture<Void> result) {
        try {
            channel.force(true);
            channel.close();
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.debug("Atomic move not supported for {}, falling back to replace", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.debug("Saved {}", file);
            result.complete(null);
        } catch (IOException e) {
            closeChannel(channel, tmp);
            LOG.error("Failed to commit {}: {}", file, e.getMessage(), e);
            result.completeExceptionally(new StorageException("Failed to write " + file, e));
        }
    }

    // ========================================================================
    // Queries
    // ========================================================================

    @Override
    public boolean exists(String path) {
        try {
            return !closed && Files.isRegularFile(resolve(path));
        } catch (RuntimeException e) {
            LOG.trace("exists({}) -> false: {}", path, e.getMessage());
            return false;
        }
    }

    /**
     * {@inheritDoc}
     *
     * @throws StorageException if the path escapes the base directory
     */
    @Override
    public String resolvePath(String path) {
        return resolve(path).toString();
    }

    @Override
    public CompletableFuture<List<String>> listFiles(String folder, String pattern) {
        String logicalFolder;
        Path dir;
        try {
            ensureOpen();
            logicalFolder = LogicalPath.normalizeFolder(folder);
            dir = logicalFolder.isEmpty() ? basePath : resolve(logicalFolder);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (!Files.isDirectory(dir)) {
            LOG.debug("Folder not found, nothing to list: {}", dir);
            return CompletableFuture.completedFuture(List.of());
        }

        String glob = pattern == null || pattern.isBlank() ? "*" : pattern;
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, glob)) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry)) {
                    names.add(entry.getFileName().toString());
                }
            }
        } catch (IOException e) {
            LOG.error("Failed to list {}: {}", dir, e.getMessage(), e);
            return CompletableFuture.failedFuture(new StorageException("Failed to list " + dir, e));
        }
        Collections.sort(names);

        List<String> paths = new ArrayList<>(names.size());
        for (String name : names) {
            paths.add(LogicalPath.join(logicalFolder, name));
        }
        LOG.debug("Listed {} file(s) matching '{}' in {}", paths.size(), glob, dir);
        return CompletableFuture.completedFuture(List.copyOf(paths));
    }

    // ========================================================================
    // Close
    // ========================================================================

    @Override
    public void close() {
        if (closed) {
            LOG.debug("Provider already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        LOG.info("FileStorageProvider closed: basePath={}", basePath);
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private Path resolve(String path) {
        Path resolved;
        try {
            resolved = basePath.resolve(LogicalPath.normalize(path)).normalize();
        } catch (InvalidPathException e) {
            throw new StorageException("Invalid path: " + path, e);
        }
        if (!resolved.startsWith(basePath)) {
            throw new StorageException("Path escapes base directory " + basePath + ": " + path);
        }
        return resolved;
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageException("Storage provider is closed: " + basePath);
        }
    }

    private static void closeChannel(AsynchronousFileChannel channel, Path file) {
        try {
            channel.close();
        } catch (IOException e) {
            LOG.warn("Error closing channel for {}: {}", file, e.getMessage());
        }
    }
}
