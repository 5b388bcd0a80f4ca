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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reference to a record of a table keyed by integer. Zero is not a valid
 * key and marks an empty reference.
 *
 * @param <R> record type of the target table
 */
public final class IntDataRef<R> implements DataRef<Integer, R> {

    private final int key;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public IntDataRef(int key) {
        this.key = key;
    }

    public static <R> IntDataRef<R> of(int key) {
        return new IntDataRef<>(key);
    }

    @Override
    @JsonValue
    public Integer key() {
        return key;
    }

    @Override
    public boolean hasValue() {
        return key != 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IntDataRef)) {
            return false;
        }
        return key == ((IntDataRef<?>) o).key;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(key);
    }

    @Override
    public String toString() {
        return Integer.toString(key);
    }
}
