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

import java.util.Objects;
import java.util.Optional;

/**
 * Repository for a file holding exactly one record, such as a global
 * settings object. JSON and YAML only.
 *
 * @param <R> record type
 */
public class SingleRepository<R> extends AbstractRepository<R> {

    private final Class<R> type;

    public SingleRepository(Class<R> type, String path) {
        this(type, path, null);
    }

    public SingleRepository(Class<R> type, String path, DataFormat format) {
        this(type.getSimpleName(), type, path, format);
    }

    public SingleRepository(String name, Class<R> type, String path, DataFormat format) {
        super(name, path, format);
        this.type = Objects.requireNonNull(type, "type");
    }

    public Class<R> type() {
        return type;
    }

    /**
     * Returns the loaded record.
     *
     * @throws DataNotFoundException if nothing has been loaded or set yet
     */
    public R get() {
        R value = snapshot();
        if (value == null) {
            throw new DataNotFoundException(path(), type.getSimpleName() + " not loaded from " + path());
        }
        return value;
    }

    public Optional<R> tryGet() {
        return Optional.ofNullable(snapshot());
    }

    /** Replaces the held record; persisted on the next save. */
    public void set(R value) {
        install(Objects.requireNonNull(value, "value"));
    }

    @Override
    protected R decode(DataSerializer serializer, String text) {
        return serializer.parseSingle(text, type, path());
    }

    @Override
    protected String encode(DataSerializer serializer, R current) {
        if (current == null) {
            throw new DataNotFoundException(path(), "Nothing to save: " + type.getSimpleName() + " not loaded");
        }
        return serializer.renderSingle(current, type);
    }
}
