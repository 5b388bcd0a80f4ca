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
 * Reference to a record of a table keyed by string. Empty when the key is
 * {@code null} or empty.
 *
 * <pre>{@code
 * public record QuestData(String id, String title, StringDataRef<CharacterData> giver) { }
 *
 * Optional<CharacterData> giver = quest.giver().resolve(context, CharacterData.class);
 * }</pre>
 *
 * @param <R> record type of the target table
 */
public final class StringDataRef<R> implements DataRef<String, R> {

    private final String key;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public StringDataRef(String key) {
        this.key = key == null ? "" : key;
    }

    public static <R> StringDataRef<R> of(String key) {
        return new StringDataRef<>(key);
    }

    @Override
    @JsonValue
    public String key() {
        return key;
    }

    @Override
    public boolean hasValue() {
        return !key.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StringDataRef)) {
            return false;
        }
        return key.equals(((StringDataRef<?>) o).key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return key;
    }
}
