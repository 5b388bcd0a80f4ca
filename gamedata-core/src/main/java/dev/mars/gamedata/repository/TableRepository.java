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
import dev.mars.gamedata.serialization.DataFormat;
import dev.mars.gamedata.serialization.DataSerializer;
import dev.mars.gamedata.serialization.TableSchema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Keyed table of records loaded from one file.
 * <p>
 * Records keep the order they had in the file. Edits through
 * {@link #put(Object)} and {@link #remove(Object)} copy the current table,
 * change the copy and install it, so a concurrent reader keeps iterating
 * the old table undisturbed.
 *
 * <pre>{@code
 * TableRepository<String, ShopItemData> items =
 *         new TableRepository<>(TableSchema.of(ShopItemData.class, ShopItemData::id), "ShopItems.csv");
 * items.load(provider, factory).get();
 * ShopItemData potion = items.get("potion_hp_small");
 * }</pre>
 *
 * @param <K> key type
 * @param <R> record type
 */
public class TableRepository<K, R> extends AbstractRepository<Map<K, R>> {

    private final TableSchema<K, R> schema;

    public TableRepository(TableSchema<K, R> schema, String path) {
        this(schema, path, null);
    }

    public TableRepository(TableSchema<K, R> schema, String path, DataFormat format) {
        this(schema.name(), schema, path, format);
    }

    public TableRepository(String name, TableSchema<K, R> schema, String path, DataFormat format) {
        super(name, path, format);
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    public TableSchema<K, R> schema() {
        return schema;
    }

    /** Number of records; zero before the first load. */
    public int count() {
        return table().size();
    }

    /**
     * Returns the record stored under a key.
     *
     * @throws DataNotFoundException if there is none
     */
    public R get(K key) {
        R record = table().get(key);
        if (record == null) {
            throw new DataNotFoundException(String.valueOf(key),
                    "No " + schema.name() + " with key '" + key + "' in " + path());
        }
        return record;
    }

    public Optional<R> tryGet(K key) {
        return Optional.ofNullable(table().get(key));
    }

    public boolean contains(K key) {
        return table().containsKey(key);
    }

    public Set<K> keys() {
        return table().keySet();
    }

    /** Records in file order. */
    public Collection<R> values() {
        return table().values();
    }

    /** Read-only view of the whole table, in file order. */
    public Map<K, R> loadedItems() {
        return table();
    }

    /** Records matching a predicate, in file order. */
    public List<R> find(Predicate<? super R> predicate) {
        List<R> matches = new ArrayList<>();
        for (R record : table().values()) {
            if (predicate.test(record)) {
                matches.add(record);
            }
        }
        return matches;
    }

    /**
     * Inserts or replaces a record under its key. On a table that was never
     * loaded this starts a new table holding just this record.
     *
     * @return the record previously stored under the key, if any
     */
    public synchronized Optional<R> put(R record) {
        Objects.requireNonNull(record, "record");
        K key = schema.keyOf(record);
        Objects.requireNonNull(key, () -> schema.name() + " record has no key");
        Map<K, R> copy = new LinkedHashMap<>(table());
        R previous = copy.put(key, record);
        install(Collections.unmodifiableMap(copy));
        return Optional.ofNullable(previous);
    }

    /**
     * Removes the record stored under a key.
     *
     * @return the removed record, if there was one
     */
    public synchronized Optional<R> remove(K key) {
        Map<K, R> current = table();
        if (!current.containsKey(key)) {
            return Optional.empty();
        }
        Map<K, R> copy = new LinkedHashMap<>(current);
        R removed = copy.remove(key);
        install(Collections.unmodifiableMap(copy));
        return Optional.of(removed);
    }

    @Override
    protected Map<K, R> decode(DataSerializer serializer, String text) {
        return Collections.unmodifiableMap(serializer.parse(text, schema, path()));
    }

    @Override
    protected String encode(DataSerializer serializer, Map<K, R> current) {
        if (current == null) {
            throw new DataNotFoundException(path(), "Nothing to save: " + name() + " was never loaded or edited");
        }
        return serializer.render(current.values(), schema);
    }

    @Override
    protected String describe(Map<K, R> value) {
        return value.size() + " records";
    }

    private Map<K, R> table() {
        Map<K, R> current = snapshot();
        return current == null ? Collections.emptyMap() : current;
    }
}
