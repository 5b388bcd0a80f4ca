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
import dev.mars.gamedata.config.GameDataConfig;
import dev.mars.gamedata.repository.TableRepository;
import dev.mars.gamedata.serialization.DataFormat;
import dev.mars.gamedata.serialization.DataSerializerFactory;
import dev.mars.gamedata.serialization.TableSchema;
import dev.mars.gamedata.storage.StorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

/**
 * Localized text lookup layered over the data context.
 * <p>
 * A master key table lists every localization key. Each language lives in
 * its own file inside the localization data folder, named by language code
 * ({@code en.csv}, {@code ko.csv}). Languages are discovered by listing that
 * folder; the key table is skipped if it lives there too.
 *
 * <h2>Resolution</h2>
 * {@link #resolve(String, String)} answers from the requested language, then
 * from the default language, then returns the key itself. It never throws,
 * and empty text counts as missing. Every fallback is logged and reported to
 * the registered {@link MissingTranslationListener}s. A language with no file
 * is allowed: it simply always falls back.
 *
 * <h2>Loading</h2>
 * In eager mode every language file is read by {@link #load}. In lazy mode
 * only the default language is read; others are read by
 * {@link #useLanguage(String)} the first time they are selected and then
 * cached for the life of the context.
 */
public final class LocalizationContext {

    private static final Logger LOG = LoggerFactory.getLogger(LocalizationContext.class);

    static final TableSchema<String, LocalizationKey> KEY_SCHEMA =
            TableSchema.of(LocalizationKey.class, LocalizationKey::id);
    static final TableSchema<String, LocalizedText> TEXT_SCHEMA =
            TableSchema.of(LocalizedText.class, LocalizedText::id);

    private final String keyPath;
    private final String dataPath;
    private final String filePattern;
    private final String defaultLanguage;
    private final boolean eagerLoading;
    private final DataFormat languageFormat;

    private volatile TableRepository<String, LocalizationKey> keyRepository;
    private final List<MissingTranslationListener> listeners = new CopyOnWriteArrayList<>();

    private volatile Map<String, String> languagePaths = Map.of();
    private volatile ConcurrentMap<String, TableRepository<String, LocalizedText>> languages =
            new ConcurrentHashMap<>();
    private volatile String currentLanguage;

    private volatile StorageProvider provider;
    private volatile DataSerializerFactory factory;

    /**
     * Creates a localization context from the localization settings of a
     * configuration.
     */
    public LocalizationContext(GameDataConfig config) {
        this(config.localizationKeyPath(), config.localizationDataPath(), config.localizationFilePattern(),
                config.defaultLanguage(), config.eagerLanguageLoading());
    }

    public LocalizationContext(String keyPath, String dataPath, String filePattern,
                               String defaultLanguage, boolean eagerLoading) {
        this.keyPath = Objects.requireNonNull(keyPath, "keyPath");
        this.dataPath = Objects.requireNonNull(dataPath, "dataPath");
        this.filePattern = Objects.requireNonNull(filePattern, "filePattern");
        this.defaultLanguage = Objects.requireNonNull(defaultLanguage, "defaultLanguage");
        this.eagerLoading = eagerLoading;
        this.languageFormat = DataFormat.detect(filePattern).orElse(DataFormat.CSV);
        this.keyRepository = newKeyTable();
        this.currentLanguage = defaultLanguage;
    }

    // ========== Loading ==========

    /**
     * Loads the key table and discovers the available languages.
     *
     * @see #load(StorageProvider, DataSerializerFactory, BooleanSupplier)
     */
    public CompletableFuture<Void> load(StorageProvider provider, DataSerializerFactory factory) {
        return load(provider, factory, () -> false);
    }

    /**
     * Loads the key table, discovers languages and loads either every
     * language (eager) or the default one (lazy). The key table and the
     * language tables are read into fresh tables and installed together, so
     * a failed or aborted load keeps every table loaded earlier.
     *
     * @param abortRequested polled between steps; a {@code true} answer stops the load
     */
    public CompletableFuture<Void> load(StorageProvider provider, DataSerializerFactory factory,
                                        BooleanSupplier abortRequested) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.factory = Objects.requireNonNull(factory, "factory");

        TableRepository<String, LocalizationKey> loadedKeys = newKeyTable();
        return loadedKeys.load(provider, factory, abortRequested)
                .thenCompose(v -> provider.listFiles(dataPath, filePattern))
                .thenCompose(paths -> {
                    checkAbort(abortRequested);
                    Map<String, String> discovered = discoverLanguages(paths);
                    CompletableFuture<ConcurrentMap<String, TableRepository<String, LocalizedText>>> loaded =
                            eagerLoading
                                    ? loadAllLanguages(discovered, abortRequested)
                                    : loadDefaultLanguage(discovered, abortRequested);
                    return loaded.thenAccept(tables -> {
                        checkAbort(abortRequested);
                        keyRepository = loadedKeys;
                        languagePaths = discovered;
                        languages = tables;
                        LOG.info("Localization loaded: {} keys, languages {} (loaded {})",
                                loadedKeys.count(), discovered.keySet(), tables.keySet());
                    });
                });
    }

    private Map<String, String> discoverLanguages(List<String> paths) {
        String keyFile = fileName(keyPath);
        Map<String, String> discovered = new TreeMap<>();
        for (String path : paths) {
            String name = fileName(path);
            if (name.equalsIgnoreCase(keyFile)) {
                continue;
            }
            discovered.put(languageCode(name), path);
        }
        if (!discovered.containsKey(defaultLanguage)) {
            LOG.warn("No file for default language '{}' in {}", defaultLanguage, dataPath);
        }
        return Collections.unmodifiableMap(discovered);
    }

    private CompletableFuture<ConcurrentMap<String, TableRepository<String, LocalizedText>>> loadAllLanguages(
            Map<String, String> discovered, BooleanSupplier abortRequested) {
        return provider.loadMultiple(dataPath, filePattern).thenApply(texts -> {
            checkAbort(abortRequested);
            ConcurrentMap<String, TableRepository<String, LocalizedText>> tables = new ConcurrentHashMap<>();
            discovered.forEach((code, path) -> {
                String text = texts.get(path);
                if (text != null) {
                    TableRepository<String, LocalizedText> table = newLanguageTable(code, path);
                    table.loadFromText(text, factory);
                    tables.put(code, table);
                }
            });
            return tables;
        });
    }

    private CompletableFuture<ConcurrentMap<String, TableRepository<String, LocalizedText>>> loadDefaultLanguage(
            Map<String, String> discovered, BooleanSupplier abortRequested) {
        ConcurrentMap<String, TableRepository<String, LocalizedText>> tables = new ConcurrentHashMap<>();
        String path = discovered.get(defaultLanguage);
        if (path == null) {
            return CompletableFuture.completedFuture(tables);
        }
        TableRepository<String, LocalizedText> table = newLanguageTable(defaultLanguage, path);
        return table.load(provider, factory, abortRequested).thenApply(v -> {
            tables.put(defaultLanguage, table);
            return tables;
        });
    }

    /**
     * Writes the key table and every loaded language table back to storage.
     */
    public CompletableFuture<Void> save(StorageProvider provider, DataSerializerFactory factory) {
        List<CompletableFuture<Void>> saves = new ArrayList<>();
        TableRepository<String, LocalizationKey> keys = keyRepository;
        if (keys.isLoaded()) {
            saves.add(keys.save(provider, factory));
        }
        for (TableRepository<String, LocalizedText> table : languages.values()) {
            saves.add(table.save(provider, factory));
        }
        return CompletableFuture.allOf(saves.toArray(new CompletableFuture[0]));
    }

    // ========== Languages ==========

    /**
     * Makes a language the active one.
     * <p>
     * A cached language is switched to immediately. Otherwise its file is
     * loaded and cached first. A language without a file is accepted with a
     * warning; lookups in it fall back to the default language.
     *
     * @return a future that completes once the language is active
     */
    public CompletableFuture<Void> useLanguage(String code) {
        if (code == null || code.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Language code must not be blank"));
        }
        if (languages.containsKey(code)) {
            currentLanguage = code;
            LOG.debug("Switched to cached language '{}'", code);
            return CompletableFuture.completedFuture(null);
        }
        String path = languagePaths.get(code);
        if (path == null) {
            LOG.warn("No file for language '{}'; texts will fall back to '{}'", code, defaultLanguage);
            currentLanguage = code;
            return CompletableFuture.completedFuture(null);
        }
        if (provider == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Localization not loaded; cannot load language '" + code + "'"));
        }

        TableRepository<String, LocalizedText> table = newLanguageTable(code, path);
        ConcurrentMap<String, TableRepository<String, LocalizedText>> target = languages;
        return table.load(provider, factory).thenRun(() -> {
            target.putIfAbsent(code, table);
            currentLanguage = code;
            LOG.info("Loaded language '{}' ({} texts)", code, table.count());
        });
    }

    public String currentLanguage() {
        return currentLanguage;
    }

    public String defaultLanguage() {
        return defaultLanguage;
    }

    /** Language codes that have a file, in code order. */
    public Set<String> availableLanguages() {
        return languagePaths.keySet();
    }

    /** Language codes whose tables are in memory. */
    public Set<String> loadedLanguages() {
        return Collections.unmodifiableSet(new TreeSet<>(languages.keySet()));
    }

    // ========== Resolution ==========

    /**
     * Resolves a key in the active language.
     *
     * @see #resolve(String, String)
     */
    public String resolve(String key) {
        return resolve(key, currentLanguage);
    }

    /**
     * Resolves a key in a language. Never throws.
     * <p>
     * Only languages already in memory are consulted; asking for one that has
     * not been loaded falls back to the default language.
     *
     * @param key      the localization key
     * @param language the language code, or {@code null} for the active one
     * @return the text, the default-language text, or the key itself
     */
    public String resolve(String key, String language) {
        if (key == null) {
            return "";
        }
        String lang = language != null ? language : currentLanguage;
        if (!keyRepository.contains(key)) {
            report(key, lang, MissingTranslationListener.Fallback.UNKNOWN_KEY);
            return key;
        }
        Optional<String> text = lookup(lang, key);
        if (text.isPresent()) {
            return text.get();
        }
        if (!lang.equals(defaultLanguage)) {
            Optional<String> fallback = lookup(defaultLanguage, key);
            if (fallback.isPresent()) {
                report(key, lang, MissingTranslationListener.Fallback.DEFAULT_LANGUAGE);
                return fallback.get();
            }
        }
        report(key, lang, MissingTranslationListener.Fallback.KEY_LITERAL);
        return key;
    }

    private Optional<String> lookup(String language, String key) {
        TableRepository<String, LocalizedText> table = languages.get(language);
        if (table == null) {
            return Optional.empty();
        }
        return table.tryGet(key)
                .map(LocalizedText::text)
                .filter(text -> !text.isEmpty());
    }

    private void report(String key, String language, MissingTranslationListener.Fallback fallback) {
        LOG.warn("Missing translation for '{}' in '{}', answered by {}", key, language, fallback);
        for (MissingTranslationListener listener : listeners) {
            try {
                listener.onMissingTranslation(key, language, fallback);
            } catch (RuntimeException e) {
                LOG.error("Missing translation listener failed for '{}': {}", key, e.getMessage(), e);
            }
        }
    }

    public void addMissingTranslationListener(MissingTranslationListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeMissingTranslationListener(MissingTranslationListener listener) {
        listeners.remove(listener);
    }

    // ========== Keys and editing ==========

    /** Every key of the key table, in file order. */
    public Set<String> keys() {
        return keyRepository.keys();
    }

    public Optional<LocalizationKey> keyData(String key) {
        return keyRepository.tryGet(key);
    }

    public boolean hasKey(String key) {
        return key != null && keyRepository.contains(key);
    }

    /**
     * Sets the text of a key in the active language, keeping its translator
     * note. If the active language has no table yet, one is started at
     * {@code <dataPath>/<code><ext>}, for example {@code Localizations/fr.csv};
     * it is written by {@link #saveLanguage}.
     */
    public void setText(String key, String text) {
        Objects.requireNonNull(key, "key");
        String lang = currentLanguage;
        if (!hasKey(key)) {
            LOG.warn("Setting text for '{}' which is not in the key table", key);
        }
        TableRepository<String, LocalizedText> table = languages.computeIfAbsent(lang,
                code -> newLanguageTable(code, defaultPathFor(code)));
        String context = table.tryGet(key).map(LocalizedText::context).orElse("");
        table.put(new LocalizedText(key, text == null ? "" : text, context));
    }

    /**
     * Writes one language table back to its file.
     *
     * @return a future failing with {@link DataNotFoundException} if the language is not loaded
     */
    public CompletableFuture<Void> saveLanguage(String code) {
        TableRepository<String, LocalizedText> table = code == null ? null : languages.get(code);
        if (table == null) {
            return CompletableFuture.failedFuture(
                    new DataNotFoundException(String.valueOf(code), "Language '" + code + "' is not loaded"));
        }
        if (provider == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Localization not loaded; cannot save language '" + code + "'"));
        }
        return table.save(provider, factory)
                .thenRun(() -> LOG.info("Saved language '{}' to {}", code, table.path()));
    }

    public String keyPath() {
        return keyPath;
    }

    // ========== Helpers ==========

    private TableRepository<String, LocalizationKey> newKeyTable() {
        return new TableRepository<>("LocalizationKeys", KEY_SCHEMA, keyPath, null);
    }

    private TableRepository<String, LocalizedText> newLanguageTable(String code, String path) {
        return new TableRepository<>("LocalizedText[" + code + "]", TEXT_SCHEMA, path, null);
    }

    private String defaultPathFor(String code) {
        String folder = dataPath.replace('\\', '/');
        if (!folder.isEmpty() && !folder.endsWith("/")) {
            folder = folder + "/";
        }
        return folder + code + languageFormat.extension();
    }

    private static void checkAbort(BooleanSupplier abortRequested) {
        if (abortRequested.getAsBoolean()) {
            throw new CancellationException("Localization load aborted");
        }
    }

    private static String fileName(String path) {
        String p = path.replace('\\', '/');
        return p.substring(p.lastIndexOf('/') + 1);
    }

    private static String languageCode(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
