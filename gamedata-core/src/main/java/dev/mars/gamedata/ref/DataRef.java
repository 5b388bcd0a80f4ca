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
package dev.mars.gamedata.ref;

import dev.mars.gamedata.context.DataContext;
import dev.mars.gamedata.repository.TableRepository;

import java.util.Objects;
import java.util.Optional;

/**
 * A record field that points at a record of another table by key.
 * <p>
 * References are stored as the bare key, so a {@code bossId} column holding
 * {@code dragon} reads into a reference to the {@code dragon} record. They
 * are resolved on demand, against whatever the target table holds at the
 * time. An empty reference resolves to nothing without touching the table.
 *
 * @param <K> key type of the target table
 * @param <R> record type of the target table
 */
public interface DataRef<K, R> {

    /** The referenced key. */
    K key();

    /** Whether this reference names a record at all. */
    boolean hasValue();

    /**
     * Looks the referenced record up in a table.
     *
     * @return the record, or empty if the reference is empty or the key is not in the table
     */
    default Optional<R> resolve(TableRepository<K, R> table) {
        Objects.requireNonNull(table, "table");
        return hasValue() ? table.tryGet(key()) : Optional.empty();
    }

    /**
     * Looks the referenced record up in the context's table of {@code recordType}.
     *
     * @throws IllegalArgumentException if the context has no table of that type
     */
    default Optional<R> resolve(DataContext context, Class<R> recordType) {
        Objects.requireNonNull(context, "context");
        if (!hasValue()) {
            return Optional.empty();
        }
        return resolve(context.<K, R>table(recordType));
    }
}
