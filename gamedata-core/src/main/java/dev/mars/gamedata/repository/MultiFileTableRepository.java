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

import dev.mars.gamedata.DataNotFoundException;
import dev.mars.gamedata.DuplicateKeyException;
import dev.mars.gamedata.MalformedDataException;
import dev.mars.gamedata.serialization.DataFormat;
import dev.mars.gamedata.serialization.DataSerializer;
import dev.mars.gamedata.serialization.DataSerializerFactory;
import dev.mars.gamedata.serialization.TableSchema;
import dev.mars.gamedata.storage.StorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

/**
 * Keyed table whose records each live in their own file inside a folder.
 * <p>
 * Loading reads every file in the folder matching {@code *<ext>} (for
 * example {@code Quests/*.json}), parses each as one record and merges them
 * into one table, keyed and queried exactly like a {@link TableRepository}.
 * Two files holding the same key fail the load. The table is installed only
 * once every file has parsed.
 * <p>
 * Saving writes each record back to the file it came from. A record added
 * with {@link #put(Object)} goes to {@code <folder>/<key><ext>}. Records cannot
 * be removed, since a storage provider has no way to delete the file.
 *
 * <pre>{@code
 * MultiFileTableRepository<String, QuestData> quests =
 *         new MultiFileTableRepository<>(QuestData.SCHEMA, "Quests");
 * quests.load(provider, factory).get();
 * }</pre>
 *
 * @param <K> key type
 * @param <R> record type
 */
public class MultiFileTableRepository<K, R> extends TableRepository<K, R> {

    private static final Logger LOG = LoggerFactory.getLogger(MultiFileTableRepository.class);

    private final String pattern;

    private volatile Map<K, String> sourceFiles = Collections.emptyMap();

    /** One JSON file per record. */
    public MultiFileTableRepository(TableSchema<K, R> schema, String folder) {
        this(schema, folder, DataFormat.JSON);
    }

    public MultiFileTableRepository(TableSchema<K, R> schema, String folder, DataFormat format) {
        this(schema.name(), schema, folder, format);
    }

    /**
     * @throws IllegalArgumentException if {@code format} cannot hold a single record
     */
    public MultiFileTableRepository(String name, TableSchema<K, R> schema, String folder, DataFormat format) {
        super(name, schema, folder, Objects.requireNonNull(format, "format"));
        if (format == DataFormat.CSV) {
            throw new IllegalArgumentException("CSV holds tables only; " + name + " needs JSON or YAML files");
        }
        this.pattern = "*" + format.extension();
    }

    /** The folder holding the record files; same as {@link #path()}. */
    public String folder() {
        return path();
    }

    /** File name pattern matched inside the folder. */
    public String pattern() {
        return pattern;
    }

    /**
     * The file a record is saved to: the one it was loaded from, or
     * {@code <folder>/<key><ext>} for a record that has no file yet.
     */
    public String fileFor(K key) {
        String source = sourceFiles.get(key);
        if (source != null) {
            return source;
        }
        String folder = path().replace('\\', '/');
        if (!folder.isEmpty() && !folder.endsWith("/")) {
            folder = folder + "/";
        }
        return folder + key + format().extension();
    }

    @Override
    public CompletableFuture<Void> load(StorageProvider provider, DataSerializerFactory factory,
                                        BooleanSupplier abortRequested) {
        final DataSerializer serializer;
        try {
            serializer = factory.serializerFor(format());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return provider.loadMultiple(path(), pattern).thenAccept(files -> {
            if (abortRequested.getAsBoolean()) {
                throw aborted("before parsing");
            }
            Map<K, R> table = new LinkedHashMap<>();
            Map<K, String> sources = new LinkedHashMap<>();
            files.forEach((file, text) -> {
                R record = serializer.parseSingle(text, schema().recordType(), file);
                K key = schema().keyOf(record);
                if (key == null || (key instanceof String && ((String) key).isBlank())) {
                    throw new MalformedDataException(file, 1, schema().name() + " record has no key");
                }
                String first = sources.putIfAbsent(key, file);
                if (first != null) {
                    LOG.error("{} key '{}' appears in both {} and {}", name(), key, first, file);
                    throw new DuplicateKeyException(file, 1, key);
                }
                table.put(key, record);
            });
            if (abortRequested.getAsBoolean()) {
                throw aborted("before install");
            }
            installAll(table, sources);
            LOG.debug("Loaded {} from {} files in {}", name(), files.size(), path());
        });
    }

    private synchronized void installAll(Map<K, R> table, Map<K, String> sources) {
        sourceFiles = Collections.unmodifiableMap(sources);
        install(Collections.unmodifiableMap(table));
    }

    /**
     * Writes every record to its own file.
     *
     * @return a future failing with {@link DataNotFoundException} if nothing was ever loaded or put
     */
    @Override
    public CompletableFuture<Void> save(StorageProvider provider, DataSerializerFactory factory) {
        Map<K, R> current = snapshot();
        if (current == null) {
            return CompletableFuture.failedFuture(new DataNotFoundException(path(),
                    "Nothing to save: " + name() + " was never loaded or edited"));
        }
        Map<String, String> rendered = new LinkedHashMap<>();
        try {
            DataSerializer serializer = factory.serializerFor(format());
            current.forEach((key, record) ->
                    rendered.put(fileFor(key), serializer.renderSingle(record, schema().recordType())));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        List<CompletableFuture<Void>> writes = new ArrayList<>();
        rendered.forEach((file, text) -> writes.add(provider.saveText(file, text)));
        return CompletableFuture.allOf(writes.toArray(new CompletableFuture[0]))
                .thenRun(() -> LOG.debug("Saved {} records of {} to {}", writes.size(), name(), path()));
    }

    /**
     * Not supported: the record's file would survive and bring the record
     * back on the next load.
     *
     * @throws UnsupportedOperationException always
     */
    @Override
    public Optional<R> remove(K key) {
        throw new UnsupportedOperationException("Cannot remove " + key + " from " + name()
                + "; delete " + fileFor(key) + " and reload instead");
    }

    /**
     * Not supported: a folder of record files has no single text form.
     *
     * @throws UnsupportedOperationException always
     */
    @Override
    protected Map<K, R> decode(DataSerializer serializer, String text) {
        throw new UnsupportedOperationException(name() + " loads from a folder, not from one text");
    }

    @Override
    protected String encode(DataSerializer serializer, Map<K, R> current) {
        throw new UnsupportedOperationException(name() + " saves one file per record");
    }
}
