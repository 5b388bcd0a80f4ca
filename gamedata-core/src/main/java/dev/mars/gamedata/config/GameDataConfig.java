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
package dev.mars.gamedata.config;

import dev.mars.gamedata.serialization.DataFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Configuration for data contexts.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dgamedata.basePath=/path})</li>
 *   <li>Environment variables (e.g., {@code GAMEDATA_BASE_PATH})</li>
 *   <li>Properties file ({@code gamedata.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>basePath</td><td>gamedata.basePath</td><td>GAMEDATA_BASE_PATH</td><td>data</td></tr>
 *   <tr><td>enableLocalization</td><td>gamedata.enableLocalization</td><td>GAMEDATA_ENABLE_LOCALIZATION</td><td>false</td></tr>
 *   <tr><td>localizationKeyPath</td><td>gamedata.localizationKeyPath</td><td>GAMEDATA_LOCALIZATION_KEY_PATH</td><td>Localizations/LocalizationKeys.csv</td></tr>
 *   <tr><td>localizationDataPath</td><td>gamedata.localizationDataPath</td><td>GAMEDATA_LOCALIZATION_DATA_PATH</td><td>Localizations/</td></tr>
 *   <tr><td>localizationFilePattern</td><td>gamedata.localizationFilePattern</td><td>GAMEDATA_LOCALIZATION_FILE_PATTERN</td><td>*.csv</td></tr>
 *   <tr><td>defaultLanguage</td><td>gamedata.defaultLanguage</td><td>GAMEDATA_DEFAULT_LANGUAGE</td><td>en</td></tr>
 *   <tr><td>eagerLanguageLoading</td><td>gamedata.eagerLanguageLoading</td><td>GAMEDATA_EAGER_LANGUAGE_LOADING</td><td>false</td></tr>
 *   <tr><td>contextName</td><td>gamedata.contextName</td><td>GAMEDATA_CONTEXT_NAME</td><td>GameDataContext</td></tr>
 *   <tr><td>generatedNamespace</td><td>gamedata.generatedNamespace</td><td>GAMEDATA_GENERATED_NAMESPACE</td><td>dev.mars.gamedata.generated</td></tr>
 *   <tr><td>debugLogging</td><td>gamedata.debugLogging</td><td>GAMEDATA_DEBUG_LOGGING</td><td>false</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # gamedata.properties
 * gamedata.basePath=/srv/game/data
 * gamedata.enableLocalization=true
 * gamedata.defaultLanguage=en
 * gamedata.eagerLanguageLoading=false
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * GameDataConfig config = GameDataConfig.builder()
 *     .basePath(Path.of("/srv/game/data"))
 *     .enableLocalization(true)
 *     .defaultLanguage("ko")
 *     .build();
 *
 * GameDataContext context = new GameDataContext(new FileStorageProvider(config), factory, config);
 * context.loadAll().join();
 * </pre>
 */
public final class GameDataConfig {

    private static final Logger LOG = LoggerFactory.getLogger(GameDataConfig.class);

    private static final String PROPERTIES_FILE = "gamedata.properties";

    // Property keys
    private static final String PROP_BASE_PATH = "gamedata.basePath";
    private static final String PROP_ENABLE_LOCALIZATION = "gamedata.enableLocalization";
    private static final String PROP_LOCALIZATION_KEY_PATH = "gamedata.localizationKeyPath";
    private static final String PROP_LOCALIZATION_DATA_PATH = "gamedata.localizationDataPath";
    private static final String PROP_LOCALIZATION_FILE_PATTERN = "gamedata.localizationFilePattern";
    private static final String PROP_DEFAULT_LANGUAGE = "gamedata.defaultLanguage";
    private static final String PROP_EAGER_LANGUAGE_LOADING = "gamedata.eagerLanguageLoading";
    private static final String PROP_CONTEXT_NAME = "gamedata.contextName";
    private static final String PROP_GENERATED_NAMESPACE = "gamedata.generatedNamespace";
    private static final String PROP_DEBUG_LOGGING = "gamedata.debugLogging";

    // Environment variable keys
    private static final String ENV_BASE_PATH = "GAMEDATA_BASE_PATH";
    private static final String ENV_ENABLE_LOCALIZATION = "GAMEDATA_ENABLE_LOCALIZATION";
    private static final String ENV_LOCALIZATION_KEY_PATH = "GAMEDATA_LOCALIZATION_KEY_PATH";
    private static final String ENV_LOCALIZATION_DATA_PATH = "GAMEDATA_LOCALIZATION_DATA_PATH";
    private static final String ENV_LOCALIZATION_FILE_PATTERN = "GAMEDATA_LOCALIZATION_FILE_PATTERN";
    private static final String ENV_DEFAULT_LANGUAGE = "GAMEDATA_DEFAULT_LANGUAGE";
    private static final String ENV_EAGER_LANGUAGE_LOADING = "GAMEDATA_EAGER_LANGUAGE_LOADING";
    private static final String ENV_CONTEXT_NAME = "GAMEDATA_CONTEXT_NAME";
    private static final String ENV_GENERATED_NAMESPACE = "GAMEDATA_GENERATED_NAMESPACE";
    private static final String ENV_DEBUG_LOGGING = "GAMEDATA_DEBUG_LOGGING";

    // Defaults
    public static final String DEFAULT_BASE_PATH = "data";
    public static final String DEFAULT_LOCALIZATION_KEY_PATH = "Localizations/LocalizationKeys.csv";
    public static final String DEFAULT_LOCALIZATION_DATA_PATH = "Localizations/";
    public static final String DEFAULT_LOCALIZATION_FILE_PATTERN = "*.csv";
    public static final String DEFAULT_LANGUAGE = "en";
    public static final String DEFAULT_CONTEXT_NAME = "GameDataContext";
    public static final String DEFAULT_GENERATED_NAMESPACE = "dev.mars.gamedata.generated";
    private static final boolean DEFAULT_ENABLE_LOCALIZATION = false;
    private static final boolean DEFAULT_EAGER_LANGUAGE_LOADING = false;
    private static final boolean DEFAULT_DEBUG_LOGGING = false;

    private final Path basePath;
    private final boolean enableLocalization;
    private final String localizationKeyPath;
    private final String localizationDataPath;
    private final String localizationFilePattern;
    private final String defaultLanguage;
    private final boolean eagerLanguageLoading;
    private final String contextName;
    private final String generatedNamespace;
    private final boolean debugLogging;

    private GameDataConfig(Builder builder) {
        this.basePath = builder.basePath;
        this.enableLocalization = builder.enableLocalization;
        this.localizationKeyPath = builder.localizationKeyPath;
        this.localizationDataPath = builder.localizationDataPath;
        this.localizationFilePattern = builder.localizationFilePattern;
        this.defaultLanguage = builder.defaultLanguage;
        this.eagerLanguageLoading = builder.eagerLanguageLoading;
        this.contextName = builder.contextName;
        this.generatedNamespace = builder.generatedNamespace;
        this.debugLogging = builder.debugLogging;
    }

    /** Base directory that file-backed providers resolve logical paths against. */
    public Path basePath() {
        return basePath;
    }

    /** Whether contexts built with this configuration carry a localization overlay. */
    public boolean enableLocalization() {
        return enableLocalization;
    }

    /** Logical path of the localization key table. */
    public String localizationKeyPath() {
        return localizationKeyPath;
    }

    /** Logical folder holding one text table per language. */
    public String localizationDataPath() {
        return localizationDataPath;
    }

    /** Glob matched against file names in {@link #localizationDataPath()}. */
    public String localizationFilePattern() {
        return localizationFilePattern;
    }

    /** Language used for fallback resolution and selected initially. */
    public String defaultLanguage() {
        return defaultLanguage;
    }

    /** Whether every language table is loaded up front rather than on first use. */
    public boolean eagerLanguageLoading() {
        return eagerLanguageLoading;
    }

    public String contextName() {
        return contextName;
    }

    public String generatedNamespace() {
        return generatedNamespace;
    }

    /** Whether per-repository load/save details are logged at INFO instead of DEBUG. */
    public boolean debugLogging() {
        return debugLogging;
    }

    /** Returns a builder pre-filled with this configuration's values. */
    public Builder toBuilder() {
        return new Builder()
                .basePath(basePath)
                .enableLocalization(enableLocalization)
                .localizationKeyPath(localizationKeyPath)
                .localizationDataPath(localizationDataPath)
                .localizationFilePattern(localizationFilePattern)
                .defaultLanguage(defaultLanguage)
                .eagerLanguageLoading(eagerLanguageLoading)
                .contextName(contextName)
                .generatedNamespace(generatedNamespace)
                .debugLogging(debugLogging);
    }

    @Override
    public String toString() {
        return "GameDataConfig{" +
                "basePath=" + basePath +
                ", enableLocalization=" + enableLocalization +
                ", localizationKeyPath='" + localizationKeyPath + '\'' +
                ", localizationDataPath='" + localizationDataPath + '\'' +
                ", localizationFilePattern='" + localizationFilePattern + '\'' +
                ", defaultLanguage='" + defaultLanguage + '\'' +
                ", eagerLanguageLoading=" + eagerLanguageLoading +
                ", contextName='" + contextName + '\'' +
                ", generatedNamespace='" + generatedNamespace + '\'' +
                ", debugLogging=" + debugLogging +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code GameDataConfig.builder().build()}.
     */
    public static GameDataConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link GameDataConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path basePath;
        private Boolean enableLocalization;
        private String localizationKeyPath;
        private String localizationDataPath;
        private String localizationFilePattern;
        private String defaultLanguage;
        private Boolean eagerLanguageLoading;
        private String contextName;
        private String generatedNamespace;
        private Boolean debugLogging;

        private final Properties fileProperties;

        private Builder() {
            // Load properties file once
            this.fileProperties = loadPropertiesFile();
        }

        public Builder basePath(Path basePath) {
            this.basePath = basePath;
            return this;
        }

        public Builder basePath(String basePath) {
            this.basePath = Path.of(basePath);
            return this;
        }

        public Builder enableLocalization(boolean enableLocalization) {
            this.enableLocalization = enableLocalization;
            return this;
        }

        public Builder localizationKeyPath(String localizationKeyPath) {
            this.localizationKeyPath = localizationKeyPath;
            return this;
        }

        public Builder localizationDataPath(String localizationDataPath) {
            this.localizationDataPath = localizationDataPath;
            return this;
        }

        public Builder localizationFilePattern(String localizationFilePattern) {
            this.localizationFilePattern = localizationFilePattern;
            return this;
        }

        public Builder defaultLanguage(String defaultLanguage) {
            this.defaultLanguage = defaultLanguage;
            return this;
        }

        public Builder eagerLanguageLoading(boolean eagerLanguageLoading) {
            this.eagerLanguageLoading = eagerLanguageLoading;
            return this;
        }

        public Builder contextName(String contextName) {
            this.contextName = contextName;
            return this;
        }

        public Builder generatedNamespace(String generatedNamespace) {
            this.generatedNamespace = generatedNamespace;
            return this;
        }

        public Builder debugLogging(boolean debugLogging) {
            this.debugLogging = debugLogging;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if a resolved value is invalid
         */
        public GameDataConfig build() {
            // Resolve each value with priority: programmatic > sysprop > env > file > default
            if (basePath == null) {
                basePath = Path.of(resolveString(PROP_BASE_PATH, ENV_BASE_PATH, DEFAULT_BASE_PATH));
            }
            if (enableLocalization == null) {
                enableLocalization = resolveBoolean(PROP_ENABLE_LOCALIZATION, ENV_ENABLE_LOCALIZATION,
                        DEFAULT_ENABLE_LOCALIZATION);
            }
            if (localizationKeyPath == null) {
                localizationKeyPath = resolveString(PROP_LOCALIZATION_KEY_PATH, ENV_LOCALIZATION_KEY_PATH,
                        DEFAULT_LOCALIZATION_KEY_PATH);
            }
            if (localizationDataPath == null) {
                localizationDataPath = resolveString(PROP_LOCALIZATION_DATA_PATH, ENV_LOCALIZATION_DATA_PATH,
                        DEFAULT_LOCALIZATION_DATA_PATH);
            }
            if (localizationFilePattern == null) {
                localizationFilePattern = resolveString(PROP_LOCALIZATION_FILE_PATTERN,
                        ENV_LOCALIZATION_FILE_PATTERN, DEFAULT_LOCALIZATION_FILE_PATTERN);
            }
            if (defaultLanguage == null) {
                defaultLanguage = resolveString(PROP_DEFAULT_LANGUAGE, ENV_DEFAULT_LANGUAGE, DEFAULT_LANGUAGE);
            }
            if (eagerLanguageLoading == null) {
                eagerLanguageLoading = resolveBoolean(PROP_EAGER_LANGUAGE_LOADING, ENV_EAGER_LANGUAGE_LOADING,
                        DEFAULT_EAGER_LANGUAGE_LOADING);
            }
            if (contextName == null) {
                contextName = resolveString(PROP_CONTEXT_NAME, ENV_CONTEXT_NAME, DEFAULT_CONTEXT_NAME);
            }
            if (generatedNamespace == null) {
                generatedNamespace = resolveString(PROP_GENERATED_NAMESPACE, ENV_GENERATED_NAMESPACE,
                        DEFAULT_GENERATED_NAMESPACE);
            }
            if (debugLogging == null) {
                debugLogging = resolveBoolean(PROP_DEBUG_LOGGING, ENV_DEBUG_LOGGING, DEFAULT_DEBUG_LOGGING);
            }

            validate();
            return new GameDataConfig(this);
        }

        private void validate() {
            requireText(defaultLanguage, "defaultLanguage");
            requireText(localizationDataPath, "localizationDataPath");
            requireText(localizationFilePattern, "localizationFilePattern");
            requireText(contextName, "contextName");
            requireText(localizationKeyPath, "localizationKeyPath");
            if (DataFormat.detect(localizationKeyPath).isEmpty()) {
                throw new IllegalArgumentException(
                        "localizationKeyPath has an unsupported extension: " + localizationKeyPath);
            }
        }

        private static void requireText(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be blank");
            }
        }

        private String resolveString(String sysProp, String envVar, String defaultValue) {
            // 1. System property
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            // 2. Environment variable
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            // 3. Properties file
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            // 4. Default
            return defaultValue;
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            String value = resolveString(sysProp, envVar, null);
            if (value == null) {
                return defaultValue;
            }
            if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false")) {
                return Boolean.parseBoolean(value);
            }
            LOG.warn("Ignoring non-boolean value '{}' for {}, using default {}", value, sysProp, defaultValue);
            return defaultValue;
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = GameDataConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
