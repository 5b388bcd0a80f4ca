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

/**
 * Diagnostic callback invoked whenever {@link LocalizationContext#resolve}
 * cannot answer from the requested language.
 */
@FunctionalInterface
public interface MissingTranslationListener {

    /** How a missing translation was answered. */
    enum Fallback {
        /** The key is not in the key table; the key itself was returned. */
        UNKNOWN_KEY,
        /** The requested language had no text; the default language answered. */
        DEFAULT_LANGUAGE,
        /** Neither the requested nor the default language had text; the key itself was returned. */
        KEY_LITERAL
    }

    /**
     * @param key      the key that was resolved
     * @param language the language that was asked for
     * @param fallback how the answer was produced
     */
    void onMissingTranslation(String key, String language, Fallback fallback);
}
