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

import java.util.Collection;
import java.util.Map;

/**
 * Converts between raw text and records for one file format.
 * <p>
 * Implementations are stateless after construction and safe for concurrent
 * use by any number of repositories and contexts.
 * <p>
 * <b>Round trip:</b> for every record set {@code x} accepted by
 * {@link #render}, {@code parse(render(x))} yields an equal, equally ordered
 * record set. Whitespace and quoting may differ.
 *
 * @see DataSerializerFactory
 */
public interface DataSerializer {

    /** The format this serializer reads and writes. */
    DataFormat format();

    /**
     * Parses a table.
     *
     * @param text       the raw text; blank text yields an empty table
     * @param schema     the record type and key extractor
     * @param sourcePath the logical path the text came from, for error messages
     * @return key to record, in source order
     * @throws dev.mars.gamedata.MalformedDataException on structural or binding errors
     * @throws dev.mars.gamedata.DuplicateKeyException  if two records share a key
     */
    <K, R> Map<K, R> parse(String text, TableSchema<K, R> schema, String sourcePath);

    /**
     * Renders records, in iteration order, as a table.
     */
    <K, R> String render(Collection<R> records, TableSchema<K, R> schema);

    /**
     * Parses a file holding a single record.
     *
     * @throws dev.mars.gamedata.MalformedDataException     on structural or binding errors
     * @throws dev.mars.gamedata.UnsupportedFormatException if the format cannot hold single records
     */
    <R> R parseSingle(String text, Class<R> type, String sourcePath);

    /**
     * Renders a single record.
     *
     * @throws dev.mars.gamedata.UnsupportedFormatException if the format cannot hold single records
     */
    <R> String renderSingle(R value, Class<R> type);
}
