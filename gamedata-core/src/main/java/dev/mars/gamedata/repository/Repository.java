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
import dev.mars.gamedata.serialization.DataSerializerFactory;
import dev.mars.gamedata.storage.StorageProvider;

import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

/**
 * A typed view over one data file.
 * <p>
 * A repository owns its logical path and format, both fixed at construction,
 * and the records most recently loaded from that path. It does not own the
 * provider or the serializer factory; those are passed in by the owning
 * context on every load and save.
 * <p>
 * <b>Thread Safety:</b> reads are safe from any thread once loaded. A load
 * replaces the whole snapshot in one step, so readers see either the old or
 * the new records, never a mix. Loading and reading the same repository at
 * the same time is not supported.
 */
public interface Repository {

    /** Name unique within the owning context. */
    String name();

    /** Logical path of the backing file. */
    String path();

    DataFormat format();

    /** Whether records have been installed, by a load or an edit. */
    boolean isLoaded();

    /**
     * Loads the backing file and installs its records.
     *
     * @see #load(StorageProvider, DataSerializerFactory, BooleanSupplier)
     */
    default CompletableFuture<Void> load(StorageProvider provider, DataSerializerFactory factory) {
        return load(provider, factory, () -> false);
    }

    /**
     * Loads the backing file and installs its records.
     * <p>
     * {@code abortRequested} is polled before parsing and again before
     * installing; once it answers {@code true} the load stops and the future
     * fails with a {@link java.util.concurrent.CancellationException} cause.
     * On any failure the previously installed records are kept.
     *
     * @param provider       where to read from
     * @param factory        where to find the serializer for {@link #format()}
     * @param abortRequested cooperative cancellation flag
     * @return a future that completes once the records are installed
     */
    CompletableFuture<Void> load(StorageProvider provider, DataSerializerFactory factory,
                                 BooleanSupplier abortRequested);

    /**
     * Renders the current records and writes them to the backing file.
     */
    CompletableFuture<Void> save(StorageProvider provider, DataSerializerFactory factory);
}
