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
package dev.mars.gamedata.repository;

import dev.mars.gamedata.serialization.DataFormat;
import dev.mars.gamedata.serialization.DataSerializer;
import dev.mars.gamedata.serialization.DataSerializerFactory;
import dev.mars.gamedata.storage.StorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

/**
 * Skeleton shared by the table and single-record repositories.
 * <p>
 * Load runs as: resolve serializer, fetch text, check abort, decode, check
 * abort, install. Save runs as: encode, write. Subclasses supply the decode
 * and encode steps for their snapshot type {@code T}.
 * <p>
 * The snapshot is held behind a volatile reference and replaced whole;
 * {@code null} means nothing has been installed yet.
 *
 * @param <T> the immutable snapshot type held once loaded
 */
public abstract class AbstractRepository<T> implements Repository {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractRepository.class);

    private final String name;
    private final String path;
    private final DataFormat format;

    private volatile T snapshot;

    /**
     * @param name   repository name
     * @param path   logical path of the backing file
     * @param format the file format, or {@code null} to derive it from the path extension
     * @throws dev.mars.gamedata.UnsupportedFormatException if {@code format} is null and the
     *         extension is not recognized
     */
    protected AbstractRepository(String name, String path, DataFormat format) {
        this.name = Objects.requireNonNull(name, "name");
        this.path = Objects.requireNonNull(path, "path");
        this.format = format != null ? format : DataFormat.fromPath(path);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public DataFormat format() {
        return format;
    }

    @Override
    public boolean isLoaded() {
        return snapshot != null;
    }

    @Override
    public CompletableFuture<Void> load(StorageProvider provider, DataSerializerFactory factory,
                                        BooleanSupplier abortRequested) {
        final DataSerializer serializer;
        try {
            serializer = factory.serializerFor(format);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return provider.loadText(path).thenAccept(text -> {
            if (abortRequested.getAsBoolean()) {
                throw aborted("before parsing");
            }
            T decoded = decode(serializer, text);
            if (abortRequested.getAsBoolean()) {
                throw aborted("before install");
            }
            snapshot = decoded;
            LOG.debug("Loaded {} from {} ({})", name, path, describe(decoded));
        });
    }

    @Override
    public CompletableFuture<Void> save(StorageProvider provider, DataSerializerFactory factory) {
        final String text;
        try {
            text = encode(factory.serializerFor(format), snapshot);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return provider.saveText(path, text)
                .thenRun(() -> LOG.debug("Saved {} to {}", name, path));
    }

    /**
     * Decodes and installs already-fetched text, bypassing the provider.
     * Used when a caller has read several files in one bulk call.
     *
     * @throws dev.mars.gamedata.MalformedDataException if the text does not decode;
     *         the current snapshot is then kept
     */
    public void loadFromText(String text, DataSerializerFactory factory) {
        T decoded = decode(factory.serializerFor(format), text);
        snapshot = decoded;
        LOG.debug("Loaded {} from pre-fetched text ({})", name, describe(decoded));
    }

    /** The installed snapshot, or {@code null} before the first install. */
    protected final T snapshot() {
        return snapshot;
    }

    protected final void install(T value) {
        snapshot = value;
    }

    /** Parses file text into a snapshot. Must not touch the installed snapshot. */
    protected abstract T decode(DataSerializer serializer, String text);

    /**
     * Renders a snapshot as file text.
     *
     * @param current the installed snapshot, possibly {@code null}
     */
    protected abstract String encode(DataSerializer serializer, T current);

    /** Short summary of a snapshot for log lines. */
    protected String describe(T value) {
        return String.valueOf(value);
    }

    /** The failure raised when a load is asked to stop at a checkpoint. */
    protected final CancellationException aborted(String stage) {
        return new CancellationException("Load of " + name + " from " + path + " aborted " + stage);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + " @ " + path + " (" + format + ")]";
    }
}
