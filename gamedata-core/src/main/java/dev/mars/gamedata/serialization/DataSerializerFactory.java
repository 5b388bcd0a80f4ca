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

import dev.mars.gamedata.UnsupportedFormatException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps a {@link DataFormat} (or a file path, by extension) to its
 * {@link DataSerializer}.
 * <p>
 * The registry is fixed when the factory is built and never mutated
 * afterwards, so one factory can be shared by any number of contexts and
 * used from concurrent loads.
 * <pre>{@code
 * DataSerializerFactory factory = DataSerializerFactory.createDefault();
 * DataSerializer csv = factory.serializerFor("Characters.csv");
 * }</pre>
 */
public final class DataSerializerFactory {

    private final Map<DataFormat, DataSerializer> serializers;

    private DataSerializerFactory(Map<DataFormat, DataSerializer> serializers) {
        this.serializers = Collections.unmodifiableMap(new EnumMap<>(serializers));
    }

    /**
     * Creates a factory with the JSON, CSV and YAML serializers registered.
     */
    public static DataSerializerFactory createDefault() {
        return builder().registerDefaults().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the serializer registered for a format.
     *
     * @throws UnsupportedFormatException if none is registered
     */
    public DataSerializer serializerFor(DataFormat format) {
        DataSerializer serializer = format == null ? null : serializers.get(format);
        if (serializer == null) {
            throw new UnsupportedFormatException("No serializer registered for format " + format);
        }
        return serializer;
    }

    /**
     * Returns the serializer for a file path, by extension.
     *
     * @throws UnsupportedFormatException if the extension is unknown or its format is not registered
     */
    public DataSerializer serializerFor(String path) {
        return serializerFor(DataFormat.fromPath(path));
    }

    public boolean supports(DataFormat format) {
        return serializers.containsKey(format);
    }

    /** The registered formats. */
    public Set<DataFormat> formats() {
        return serializers.keySet();
    }

    @Override
    public String toString() {
        return "DataSerializerFactory" + serializers.keySet();
    }

    /**
     * Builder for {@link DataSerializerFactory}. A later registration for the
     * same format replaces the earlier one.
     */
    public static final class Builder {
        private final Map<DataFormat, DataSerializer> serializers = new EnumMap<>(DataFormat.class);

        private Builder() {
        }

        public Builder register(DataSerializer serializer) {
            serializers.put(serializer.format(), serializer);
            return this;
        }

        /** Registers the JSON, CSV and YAML serializers. */
        public Builder registerDefaults() {
            return register(new JsonDataSerializer())
                    .register(new CsvDataSerializer())
                    .register(new YamlDataSerializer());
        }

        public DataSerializerFactory build() {
            return new DataSerializerFactory(serializers);
        }
    }
}
