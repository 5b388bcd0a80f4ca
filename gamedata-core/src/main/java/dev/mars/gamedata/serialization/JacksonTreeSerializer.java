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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import dev.mars.gamedata.GameDataException;
import dev.mars.gamedata.MalformedDataException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for document formats (JSON, YAML) whose tables are a root array of
 * objects.
 * <p>
 * The text is read into a tree first, so structural errors are reported with
 * the line Jackson stopped at; each element is then bound to the record type
 * on its own, so binding errors carry the element number.
 */
abstract class JacksonTreeSerializer extends AbstractDataSerializer {

    protected final ObjectMapper mapper;

    protected JacksonTreeSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public <K, R> Map<K, R> parse(String text, TableSchema<K, R> schema, String sourcePath) {
        Map<K, R> table = new LinkedHashMap<>();
        JsonNode root = readTree(text, sourcePath);
        if (root == null) {
            return table;
        }
        if (!root.isArray()) {
            throw new MalformedDataException(sourcePath, 1,
                    "expected an array of " + schema.name() + " records but found " + root.getNodeType());
        }

        int position = 0;
        for (JsonNode element : root) {
            position++;
            if (!element.isObject()) {
                throw new MalformedDataException(sourcePath, position,
                        "element is " + element.getNodeType() + ", expected an object");
            }
            R record = bind(element, schema.recordType(), sourcePath, position);
            addRecord(table, schema, record, sourcePath, position);
        }
        return table;
    }

    @Override
    public <K, R> String render(Collection<R> records, TableSchema<K, R> schema) {
        try {
            return writer().writeValueAsString(List.copyOf(records));
        } catch (JsonProcessingException e) {
            throw new GameDataException("Failed to render " + schema.name() + " records as " + format(), e);
        }
    }

    @Override
    public <R> R parseSingle(String text, Class<R> type, String sourcePath) {
        JsonNode root = readTree(text, sourcePath);
        if (root == null) {
            throw new MalformedDataException(sourcePath, 0, "empty document, expected a " + type.getSimpleName());
        }
        if (!root.isObject()) {
            throw new MalformedDataException(sourcePath, 1,
                    "expected an object but found " + root.getNodeType());
        }
        return bind(root, type, sourcePath, 1);
    }

    @Override
    public <R> String renderSingle(R value, Class<R> type) {
        try {
            return writer().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new GameDataException("Failed to render " + type.getSimpleName() + " as " + format(), e);
        }
    }

    /** Writer used for rendering; formats may override for layout. */
    protected ObjectWriter writer() {
        return mapper.writer();
    }

    /**
     * Reads the document tree, or returns {@code null} for an empty document.
     */
    private JsonNode readTree(String text, String sourcePath) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            JsonNode root = mapper.readTree(text);
            return root == null || root.isMissingNode() || root.isNull() ? null : root;
        } catch (JsonProcessingException e) {
            throw malformed(e, sourcePath);
        }
    }

    private <R> R bind(JsonNode node, Class<R> type, String sourcePath, int position) {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new MalformedDataException(sourcePath, position,
                    "cannot bind to " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new MalformedDataException(sourcePath, position,
                    "cannot bind to " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
