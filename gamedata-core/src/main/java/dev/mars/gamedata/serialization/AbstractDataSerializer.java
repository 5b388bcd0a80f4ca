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

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import dev.mars.gamedata.DuplicateKeyException;
import dev.mars.gamedata.MalformedDataException;

import java.util.Map;

/**
 * Key bookkeeping and error translation shared by the Jackson-backed serializers.
 */
abstract class AbstractDataSerializer implements DataSerializer {

    /**
     * Adds a parsed record under its key.
     *
     * @param position the row or element number reported on failure
     */
    protected <K, R> void addRecord(Map<K, R> table, TableSchema<K, R> schema, R record,
                                    String sourcePath, int position) {
        if (record == null) {
            throw new MalformedDataException(sourcePath, position, "empty " + schema.name() + " record");
        }
        K key = schema.keyOf(record);
        if (key == null || (key instanceof String && ((String) key).isBlank())) {
            throw new MalformedDataException(sourcePath, position, schema.name() + " record has no key");
        }
        if (table.putIfAbsent(key, record) != null) {
            throw new DuplicateKeyException(sourcePath, position, key);
        }
    }

    /**
     * Translates a Jackson failure into a {@link MalformedDataException}
     * positioned at the line Jackson reports.
     */
    protected static MalformedDataException malformed(JsonProcessingException e, String sourcePath) {
        JsonLocation location = e.getLocation();
        int line = location == null ? 0 : Math.max(location.getLineNr(), 0);
        return new MalformedDataException(sourcePath, line, e.getOriginalMessage(), e);
    }
}
