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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * JSON tables: a root array of flat objects.
 * <pre>
 * [
 *   { "id": 1001, "name": "Iron Sword", "attack": 12 },
 *   { "id": 1002, "name": "Oak Shield", "attack": 0 }
 * ]
 * </pre>
 * Field names match record components ignoring case. Unknown fields are
 * ignored; repeated fields inside one object are rejected.
 */
public final class JsonDataSerializer extends JacksonTreeSerializer {

    public JsonDataSerializer() {
        super(JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
                .build());
    }

    @Override
    protected ObjectWriter writer() {
        return mapper.writerWithDefaultPrettyPrinter();
    }

    @Override
    public DataFormat format() {
        return DataFormat.JSON;
    }
}
