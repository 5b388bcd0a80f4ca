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

import java.util.Objects;
import java.util.function.Function;

/**
 * Shape of one table: the record type rows bind to and how to extract the
 * primary key from a record.
 * <p>
 * Record types are plain Java records whose component names match the
 * column (CSV) or field (JSON, YAML) names of the source files.
 * <pre>{@code
 * public record ShopItemData(String id, String name, int price) {
 *     public static final TableSchema<String, ShopItemData> SCHEMA =
 *             TableSchema.of(ShopItemData.class, ShopItemData::id);
 * }
 * }</pre>
 *
 * @param recordType   the record class
 * @param keyExtractor returns the primary key of a record
 * @param <K>          the key type (string or integer in practice)
 * @param <R>          the record type
 */
public record TableSchema<K, R>(Class<R> recordType, Function<R, K> keyExtractor) {

    public TableSchema {
        Objects.requireNonNull(recordType, "recordType");
        Objects.requireNonNull(keyExtractor, "keyExtractor");
    }

    public static <K, R> TableSchema<K, R> of(Class<R> recordType, Function<R, K> keyExtractor) {
        return new TableSchema<>(recordType, keyExtractor);
    }

    /** Returns the primary key of a record. */
    public K keyOf(R record) {
        return keyExtractor.apply(record);
    }

    /** Simple name of the record type, used in messages. */
    public String name() {
        return recordType.getSimpleName();
    }
}
