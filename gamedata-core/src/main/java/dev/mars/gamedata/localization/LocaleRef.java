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
package dev.mars.gamedata.localization;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * A record field holding a localization key, resolved to text on demand.
 * <p>
 * Stored in data files as the bare key. Fixed keys follow the
 * {@code Type.id.property} convention, so the display name of the
 * {@code sword_001} item is {@code ItemData.sword_001.name}.
 *
 * <pre>{@code
 * public record ItemInfo(String id, LocaleRef name, int price) { }
 *
 * String label = item.name().resolve(localization);
 * }</pre>
 */
public final class LocaleRef {

    private final String key;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public LocaleRef(String key) {
        this.key = key == null ? "" : key;
    }

    public static LocaleRef of(String key) {
        return new LocaleRef(key);
    }

    /**
     * Builds the fixed key of a record property: {@code typeName.id.property},
     * with the property name lower-cased.
     */
    public static LocaleRef fixed(String typeName, Object id, String propertyName) {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(propertyName, "propertyName");
        return new LocaleRef(typeName + "." + id + "." + propertyName.toLowerCase(Locale.ROOT));
    }

    public static LocaleRef fixed(Class<?> type, Object id, String propertyName) {
        return fixed(type.getSimpleName(), id, propertyName);
    }

    /** Joins path segments with dots, e.g. {@code Graph.Nodes.Name}. */
    public static LocaleRef nested(String... path) {
        return new LocaleRef(String.join(".", path));
    }

    @JsonValue
    public String key() {
        return key;
    }

    public boolean hasValue() {
        return !key.isEmpty();
    }

    /**
     * Resolves the key in the active language.
     *
     * @return the text, or an empty string for an empty reference
     * @see LocalizationContext#resolve(String)
     */
    public String resolve(LocalizationContext context) {
        Objects.requireNonNull(context, "context");
        return hasValue() ? context.resolve(key) : "";
    }

    /**
     * Resolves the key in a given language.
     *
     * @see LocalizationContext#resolve(String, String)
     */
    public String resolve(LocalizationContext context, String language) {
        Objects.requireNonNull(context, "context");
        return hasValue() ? context.resolve(key, language) : "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LocaleRef)) {
            return false;
        }
        return key.equals(((LocaleRef) o).key);
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
