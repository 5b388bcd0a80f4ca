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
package dev.mars.gamedata.demo;

import dev.mars.gamedata.config.GameDataConfig;
import dev.mars.gamedata.context.DataContext;
import dev.mars.gamedata.localization.LocaleRef;
import dev.mars.gamedata.localization.LocalizationContext;
import dev.mars.gamedata.ref.StringDataRef;
import dev.mars.gamedata.repository.MultiFileTableRepository;
import dev.mars.gamedata.repository.SingleRepository;
import dev.mars.gamedata.repository.TableRepository;
import dev.mars.gamedata.serialization.DataSerializerFactory;
import dev.mars.gamedata.serialization.TableSchema;
import dev.mars.gamedata.storage.FileStorageProvider;
import dev.mars.gamedata.storage.StorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Demo entry point for the game data layer.
 * <p>
 * This demonstrates a full data context round trip:
 * <ul>
 *   <li>Seeding a data folder on first run (CSV, JSON, YAML and localization tables)</li>
 *   <li>Loading every repository concurrently</li>
 *   <li>Typed lookups by key, and quests kept one file each, pointing at monsters</li>
 *   <li>Localized text with language switching and fallback</li>
 *   <li>Editing and saving, then reloading in a fresh context</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link GameDataConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (base path only)</li>
 *   <li>System properties: {@code -Dgamedata.basePath=/path -Dgamedata.defaultLanguage=en ...}</li>
 *   <li>Environment variables: {@code GAMEDATA_BASE_PATH, GAMEDATA_DEFAULT_LANGUAGE, ...}</li>
 *   <li>Properties file: {@code gamedata.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl gamedata-demo -am
 *
 * # Run with default configuration (./data)
 * java -jar gamedata-demo/target/gamedata-demo-1.0-SNAPSHOT.jar
 *
 * # Run against another folder
 * java -jar gamedata-demo/target/gamedata-demo-1.0-SNAPSHOT.jar /path/to/data
 * </pre>
 *
 * @see GameDataConfig
 */
public class DataContextDemo {

    private static final Logger LOG = LoggerFactory.getLogger(DataContextDemo.class);

    /** A monster, stored as CSV. */
    public record Monster(String id, String name, int level, int hp, List<String> drops) {
        static final TableSchema<String, Monster> SCHEMA = TableSchema.of(Monster.class, Monster::id);
    }

    /** A quest, stored one per JSON file under {@code Quests/}. */
    public record Quest(int id, LocaleRef title, StringDataRef<Monster> target, int reward) {
        static final TableSchema<Integer, Quest> SCHEMA = TableSchema.of(Quest.class, Quest::id);
    }

    /** World settings, stored as a single YAML document. */
    public record WorldSettings(String startingZone, int maxPartySize, double dropRate) {
    }

    /** The demo's data context. */
    static final class DemoContext extends DataContext {
        final TableRepository<String, Monster> monsters;
        final MultiFileTableRepository<Integer, Quest> quests;
        final SingleRepository<WorldSettings> settings;

        DemoContext(StorageProvider provider, GameDataConfig config) {
            super(config.contextName(), provider, DataSerializerFactory.createDefault(), config);
            monsters = register(new TableRepository<>(Monster.SCHEMA, "Monsters.csv"));
            quests = register(new MultiFileTableRepository<>(Quest.SCHEMA, "Quests"));
            settings = register(new SingleRepository<>(WorldSettings.class, "World.yaml"));
        }
    }

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|         Game Data Context Demo        |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        // Build configuration with CLI override if provided; localization is always on here
        GameDataConfig.Builder builder = args.length > 0 && !args[0].isBlank()
                ? GameDataConfig.builder().basePath(args[0])
                : GameDataConfig.builder();
        GameDataConfig config = builder.enableLocalization(true).build();

        System.out.println("Configuration: " + config);
        System.out.println();

        FileStorageProvider seedProvider = new FileStorageProvider(config);
        if (!seedProvider.exists("Monsters.csv")) {
            seed(seedProvider, config);
            System.out.println("[OK] Seeded sample data at: " + seedProvider.basePath());
        }
        seedProvider.close();

        try (DemoContext context = new DemoContext(new FileStorageProvider(config), config)) {
            context.loadAll().join();
            System.out.println("[OK] Loaded context '" + context.name() + "': " + context.state());

            System.out.println("\n  Monsters:");
            for (Monster monster : context.monsters.values()) {
                System.out.printf("    %-10s lv%-3d hp=%-5d drops=%s%n",
                        monster.id(), monster.level(), monster.hp(), monster.drops());
            }

            WorldSettings world = context.settings.get();
            System.out.println("\n  World: start=" + world.startingZone()
                    + ", party=" + world.maxPartySize() + ", dropRate=" + world.dropRate());

            LocalizationContext localization = context.localization().orElseThrow();
            System.out.println("\n  Languages available: " + localization.availableLanguages());
            printQuests(context, localization);

            localization.useLanguage("ko").join();
            printQuests(context, localization);

            // Edit and save
            Monster slime = context.monsters.get("slime");
            context.monsters.put(new Monster(slime.id(), slime.name(), slime.level() + 1, slime.hp() + 10,
                    slime.drops()));
            context.saveAll().join();
            System.out.println("\n[OK] Saved: slime is now level " + context.monsters.get("slime").level());
        } catch (RuntimeException e) {
            LOG.error("Demo failed: {}", e.getMessage(), e);
            throw e;
        }

        // Reload in a fresh context to show the edit persisted
        try (DemoContext reopened = new DemoContext(new FileStorageProvider(config), config)) {
            reopened.loadAll().join();
            System.out.println("[OK] Reloaded: slime level " + reopened.monsters.get("slime").level());
        }

        System.out.println("\n[DONE] Run again to see the data carried forward.");
    }

    private static void printQuests(DemoContext context, LocalizationContext localization) {
        System.out.println("\n  Quests [" + localization.currentLanguage() + "]:");
        for (Quest quest : context.quests.values()) {
            String target = quest.target().resolve(context, Monster.class)
                    .map(Monster::name)
                    .orElse(quest.target().key());
            System.out.printf("    #%d %s -> %s (%d gold)%n",
                    quest.id(), quest.title().resolve(localization), target, quest.reward());
        }
    }

    private static void seed(StorageProvider provider, GameDataConfig config) {
        String folder = config.localizationDataPath().endsWith("/")
                ? config.localizationDataPath()
                : config.localizationDataPath() + "/";
        provider.saveText("Monsters.csv", "id,name,level,hp,drops\n"
                + "slime,Slime,1,30,gel\n"
                + "wolf,Grey Wolf,4,85,fang|pelt\n"
                + "golem,Stone Golem,12,400,ore|gem|rubble\n").join();
        provider.saveText("Quests/slimes.json",
                "{\"id\": 1, \"title\": \"Quest_Slimes\", \"target\": \"slime\", \"reward\": 20}\n").join();
        provider.saveText("Quests/wolves.json",
                "{\"id\": 2, \"title\": \"Quest_Wolves\", \"target\": \"wolf\", \"reward\": 75}\n").join();
        provider.saveText("Quests/golem.json",
                "{\"id\": 3, \"title\": \"Quest_Golem\", \"target\": \"golem\", \"reward\": 500}\n").join();
        provider.saveText("World.yaml", "startingZone: meadow\nmaxPartySize: 4\ndropRate: 0.35\n").join();
        provider.saveText(config.localizationKeyPath(), "id,description,category,fixedKey\n"
                + "Quest_Slimes,First quest title,Quest,true\n"
                + "Quest_Wolves,Second quest title,Quest,false\n"
                + "Quest_Golem,Boss quest title,Quest,false\n").join();
        provider.saveText(folder + config.defaultLanguage() + ".csv", "id,text,context\n"
                + "Quest_Slimes,Clear the slimes,Quest log\n"
                + "Quest_Wolves,Thin the wolf pack,Quest log\n"
                + "Quest_Golem,Topple the golem,Quest log\n").join();
        provider.saveText(folder + "ko.csv", "id,text,context\n"
                + "Quest_Slimes,슬라임 퇴치,Quest log\n"
                + "Quest_Wolves,늑대 무리 사냥,Quest log\n").join();
    }
}
