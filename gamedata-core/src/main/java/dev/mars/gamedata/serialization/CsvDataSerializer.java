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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import dev.mars.gamedata.GameDataException;
import dev.mars.gamedata.MalformedDataException;
import dev.mars.gamedata.UnsupportedFormatException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CSV tables: a header row naming the record components, then one row per
 * record.
 * <pre>
 * id,name,price,dailyLimit,available
 * potion_hp_small,Small HP Potion,100,10,true
 * </pre>
 * Columns are matched by header name ignoring case, so {@code Id} binds to
 * {@code id} and column order is free. Rendering writes the columns in
 * record component order. Cells are
 * trimmed and coerced to the component types; array components hold
 * {@value #ARRAY_ELEMENT_SEPARATOR}-separated values. A row with more or
 * fewer cells than the header is malformed. Positions in errors are data row
 * numbers (the header is row 0).
 * <p>
 * CSV holds tables only; {@link #parseSingle} and {@link #renderSingle}
 * throw {@link UnsupportedFormatException}.
 */
public final class CsvDataSerializer extends AbstractDataSerializer {

    /** Separator between the elements of an array-valued cell. */
    public static final String ARRAY_ELEMENT_SEPARATOR = "|";

    private final CsvMapper mapper;

    public CsvDataSerializer() {
        this.mapper = CsvMapper.builder()
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .enable(CsvParser.Feature.FAIL_ON_MISSING_COLUMNS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
                .build();
    }

    @Override
    public DataFormat format() {
        return DataFormat.CSV;
    }

    @Override
    public <K, R> Map<K, R> parse(String text, TableSchema<K, R> schema, String sourcePath) {
        Map<K, R> table = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return table;
        }

        CsvSchema headerSchema = CsvSchema.emptySchema()
                .withHeader()
                .withArrayElementSeparator(ARRAY_ELEMENT_SEPARATOR);
        try (MappingIterator<R> rows = mapper.readerFor(schema.recordType())
                .with(headerSchema)
                .readValues(text)) {
            int row = 0;
            while (rows.hasNextValue()) {
                row++;
                R record = rows.nextValue();
                addRecord(table, schema, record, sourcePath, row);
            }
        } catch (JsonProcessingException e) {
            throw malformed(e, sourcePath);
        } catch (IOException e) {
            throw new MalformedDataException(sourcePath, 0, e.getMessage(), e);
        }
        return table;
    }

    @Override
    public <K, R> String render(Collection<R> records, TableSchema<K, R> schema) {
        CsvSchema columns = mapper.schemaFor(schema.recordType())
                .withHeader()
                .withArrayElementSeparator(ARRAY_ELEMENT_SEPARATOR);
        try {
            return mapper.writer(columns).writeValueAsString(new ArrayList<>(records));
        } catch (JsonProcessingException e) {
            throw new GameDataException("Failed to render " + schema.name() + " records as CSV", e);
        }
    }

    @Override
    public <R> R parseSingle(String text, Class<R> type, String sourcePath) {
        throw new UnsupportedFormatException("CSV cannot hold a single " + type.getSimpleName() + ": " + sourcePath);
    }

    @Override
    public <R> String renderSingle(R value, Class<R> type) {
        throw new UnsupportedFormatException("CSV cannot hold a single " + type.getSimpleName());
    }
}
