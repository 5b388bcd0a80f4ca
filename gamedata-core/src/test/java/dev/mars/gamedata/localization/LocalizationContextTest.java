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

import dev.mars.gamedata.DataNotFoundException;
import dev.mars.gamedata.MalformedDataException;
import dev.mars.gamedata.config.GameDataConfig;
import dev.mars.gamedata.localization.MissingTranslationListener.Fallback;
import dev.mars.gamedata.serialization.DataSerializerFactory;
import dev.mars.gamedata.storage.FileStorageProvider;
import dev.mars.gamedata.storage.InMemoryStorageProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LocalizationContext}.
 */
class LocalizationContextTest {

    private final DataSerializerFactory factory = DataSerializerFactory.createDefault();
    private final List<String> reports = new ArrayList<>();

    private InMemoryStorageProvider provider;

    private static String resource(String name) throws Exception {
        try (InputStream in = LocalizationContextTest.class.getResourceAsStream(name)) {
            assertNotNull(in, "missing test resource " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        provider = new InMemoryStorageProvider()
                .put("Localizations/LocalizationKeys.csv", resource("/game-data/Localizations/LocalizationKeys.csv"))
                .put("Localizations/en.csv", resource("/game-data/Localizations/en.csv"))
                .put("Localizations/ko.csv", resource("/game-data/Localizations/ko.csv"));
    }

    private LocalizationContext lazyContext() {
        LocalizationContext context = new LocalizationContext(GameDataConfig.builder().build());
        context.addMissingTranslationListener((key, language, fallback) ->
                reports.add(key + "/" + language + "/" + fallback));
        return context;
    }

    // ========================================================================
    // Loading
    // ========================================================================

    @Nested
    @DisplayName("Loading")
    class LoadingTests {

        @Test
        @DisplayName("Lazy mode loads only the default language")
        void testLoad_Lazy_DefaultLanguageOnly() throws Exception {
            LocalizationContext context = lazyContext();

            context.load(provider, factory).get(5, TimeUnit.SECONDS);

            assertEquals(Set.of("en", "ko"), context.availableLanguages());
            assertEquals(Set.of("en"), context.loadedLanguages());
            assertEquals("en", context.currentLanguage());
            assertEquals(4, context.keys().size());
        }

        @Test
        void testLoad_Eager_AllLanguages() throws Exception {
            LocalizationContext context = new LocalizationContext(
                    GameDataConfig.builder().eagerLanguageLoading(true).build());

            context.load(provider, factory).get(5, TimeUnit.SECONDS);

            assertEquals(Set.of("en", "ko"), context.loadedLanguages());
            assertEquals("시작", context.resolve("Button_Start", "ko"));
        }

        @Test
        void testLoad_FromFileSystem() throws Exception {
            Path gameData = Path.of(getClass().getResource("/game-data").toURI());
            LocalizationContext context = new LocalizationContext(GameDataConfig.builder().build());

            try (FileStorageProvider files = new FileStorageProvider(gameData)) {
                context.load(files, factory).get(5, TimeUnit.SECONDS);
                context.useLanguage("ko").get(5, TimeUnit.SECONDS);

                assertEquals("종료", context.resolve("Button_Quit"));
            }
        }

        @Test
        void testLoad_MissingKeyTable_Fails() {
            provider.delete("Localizations/LocalizationKeys.csv");
            LocalizationContext context = lazyContext();

            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> context.load(provider, factory).get(5, TimeUnit.SECONDS));

            assertInstanceOf(DataNotFoundException.class, ex.getCause());
        }

        @Test
        void testLoad_NoDefaultLanguageFile_ResolvesToKey() throws Exception {
            provider.delete("Localizations/en.csv");
            LocalizationContext context = lazyContext();

            context.load(provider, factory).get(5, TimeUnit.SECONDS);

            assertEquals(Set.of("ko"), context.availableLanguages());
            assertEquals("Button_Start", context.resolve("Button_Start"));
        }

        @Test
        @DisplayName("A reload that fails on a language keeps the earlier key table")
        void testReload_LanguageFailure_KeepsPreviousKeys() throws Exception {
            LocalizationContext context = lazyContext();
            context.load(provider, factory).get(5, TimeUnit.SECONDS);
            provider.put("Localizations/LocalizationKeys.csv",
                    resource("/game-data/Localizations/LocalizationKeys.csv") + "Button_Help,Help button,UI,false\n");
            provider.put("Localizations/en.csv", "id,text,context\nButton_Start,Start\n");

            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> context.load(provider, factory).get(5, TimeUnit.SECONDS));

            assertInstanceOf(MalformedDataException.class, ex.getCause());
            assertEquals(4, context.keys().size());
            assertFalse(context.hasKey("Button_Help"));
            assertEquals("Start", context.resolve("Button_Start"));
        }
    }

    // ========================================================================
    // Resolution
    // ========================================================================

    @Nested
    @DisplayName("Fallback chain")
    class ResolveTests {

        private LocalizationContext context;

        @BeforeEach
        void load() throws Exception {
            context = lazyContext();
            context.load(provider, factory).get(5, TimeUnit.SECONDS);
        }

        @Test
        void testResolve_DefaultLanguage() {
            assertEquals("Welcome to the game!", context.resolve("Message_Welcome"));
            assertTrue(reports.isEmpty());
        }

        @Test
        void testUseLanguage_LoadsAndResolves() throws Exception {
            context.useLanguage("ko").get(5, TimeUnit.SECONDS);

            assertEquals("ko", context.currentLanguage());
            assertEquals(Set.of("en", "ko"), context.loadedLanguages());
            assertEquals("시작", context.resolve("Button_Start"));
        }

        @Test
        @DisplayName("Empty text falls back to the default language")
        void testResolve_EmptyText_FallsBack() throws Exception {
            context.useLanguage("ko").get(5, TimeUnit.SECONDS);

            assertEquals("Welcome to the game!", context.resolve("Message_Welcome"));
            assertEquals(List.of("Message_Welcome/ko/" + Fallback.DEFAULT_LANGUAGE), reports);
        }

        @Test
        @DisplayName("Key missing from the language file falls back to the default language")
        void testResolve_MissingEntry_FallsBack() throws Exception {
            context.useLanguage("ko").get(5, TimeUnit.SECONDS);

            assertEquals("See you soon", context.resolve("Message_Farewell"));
        }

        @Test
        @DisplayName("Language without a file is accepted and falls back")
        void testUseLanguage_NoFile_FallsBack() throws Exception {
            context.useLanguage("fr").get(5, TimeUnit.SECONDS);

            assertEquals("fr", context.currentLanguage());
            assertEquals("Quit", context.resolve("Button_Quit"));
            assertFalse(context.loadedLanguages().contains("fr"));
        }

        @Test
        void testResolve_UnknownKey_ReturnsKey() {
            assertEquals("Button_Missing", context.resolve("Button_Missing"));
            assertEquals(List.of("Button_Missing/en/" + Fallback.UNKNOWN_KEY), reports);
        }

        @Test
        void testResolve_NoTextAnywhere_ReturnsKey() throws Exception {
            provider.put("Localizations/LocalizationKeys.csv",
                    resource("/game-data/Localizations/LocalizationKeys.csv") + "Message_Secret,Hidden,Dialog,false\n");
            context.load(provider, factory).get(5, TimeUnit.SECONDS);

            assertEquals("Message_Secret", context.resolve("Message_Secret", "ko"));
            assertTrue(reports.contains("Message_Secret/ko/" + Fallback.KEY_LITERAL));
        }

        @Test
        void testResolve_UnloadedLanguage_UsesDefault() {
            assertEquals("Start", context.resolve("Button_Start", "ko"));
        }

        @Test
        void testResolve_NullKey_Empty() {
            assertEquals("", context.resolve(null));
        }

        @Test
        @DisplayName("Any language answers non-empty whenever the default has text")
        void testResolve_NeverEmptyWhenDefaultHasText() throws Exception {
            context.useLanguage("ko").get(5, TimeUnit.SECONDS);

            for (String key : context.keys()) {
                for (String language : List.of("en", "ko", "fr", "zz")) {
                    String text = context.resolve(key, language);
                    assertFalse(text.isEmpty(), key + " in " + language);
                }
            }
        }

        @Test
        void testResolve_ListenerFailure_DoesNotPropagate() {
            context.addMissingTranslationListener((key, language, fallback) -> {
                throw new IllegalStateException("listener broke");
            });

            assertEquals("Nope", context.resolve("Nope"));
        }

        @Test
        void testUseLanguage_Blank_Rejected() {
            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> context.useLanguage(" ").get(5, TimeUnit.SECONDS));

            assertInstanceOf(IllegalArgumentException.class, ex.getCause());
        }
    }

    // ========================================================================
    // Keys and Editing
    // ========================================================================

    @Nested
    @DisplayName("Keys and editing")
    class EditTests {

        private LocalizationContext context;

        @BeforeEach
        void load() throws Exception {
            context = lazyContext();
            context.load(provider, factory).get(5, TimeUnit.SECONDS);
        }

        @Test
        void testKeyData() {
            LocalizationKey start = context.keyData("Button_Start").orElseThrow();

            assertEquals("UI", start.category());
            assertTrue(start.fixedKey());
            assertTrue(context.hasKey("Message_Farewell"));
            assertFalse(context.hasKey("Nope"));
            assertFalse(context.hasKey(null));
        }

        @Test
        void testSetTextThenSave_Persists() throws Exception {
            context.useLanguage("ko").get(5, TimeUnit.SECONDS);
            context.setText("Message_Farewell", "또 만나요");

            context.saveLanguage("ko").get(5, TimeUnit.SECONDS);

            LocalizationContext reloaded = new LocalizationContext(
                    GameDataConfig.builder().eagerLanguageLoading(true).build());
            reloaded.load(provider, factory).get(5, TimeUnit.SECONDS);
            assertEquals("또 만나요", reloaded.resolve("Message_Farewell", "ko"));
            assertEquals("시작", reloaded.resolve("Button_Start", "ko"));
        }

        @Test
        void testSetText_KeepsTranslatorNote() throws Exception {
            context.setText("Button_Start", "Begin");
            context.saveLanguage("en").get(5, TimeUnit.SECONDS);

            String saved = provider.peek("Localizations/en.csv");
            assertTrue(saved.contains("Begin"));
            assertTrue(saved.contains("Main menu"));
            assertEquals("Begin", context.resolve("Button_Start"));
        }

        @Test
        void testSetText_NewLanguage_CreatesFile() throws Exception {
            context.useLanguage("fr").get(5, TimeUnit.SECONDS);
            context.setText("Button_Start", "Commencer");

            context.saveLanguage("fr").get(5, TimeUnit.SECONDS);

            assertNotNull(provider.peek("Localizations/fr.csv"));
            assertEquals("Commencer", context.resolve("Button_Start"));

            LocalizationContext reopened = new LocalizationContext(
                    GameDataConfig.builder().eagerLanguageLoading(true).build());
            reopened.load(provider, factory).get(5, TimeUnit.SECONDS);

            assertEquals(Set.of("en", "fr", "ko"), reopened.availableLanguages());
            assertEquals("Commencer", reopened.resolve("Button_Start", "fr"));
        }

        @Test
        void testSaveLanguage_NotLoaded_NotFound() {
            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> context.saveLanguage("ko").get(5, TimeUnit.SECONDS));

            assertInstanceOf(DataNotFoundException.class, ex.getCause());
        }
    }
}
