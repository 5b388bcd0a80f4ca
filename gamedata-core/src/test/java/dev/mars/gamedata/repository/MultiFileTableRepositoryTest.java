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
import dev.mars.gamedata.DuplicateKeyException;
import dev.mars.gamedata.MalformedDataException;
import dev.mars.gamedata.sample.QuestData;
import dev.mars.gamedata.serialization.DataFormat;
import dev.mars.gamedata.serialization.DataSerializerFactory;
import dev.mars.gamedata.storage.FileStorageProvider;
import dev.mars.gamedata.storage.InMemoryStorageProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link MultiFileTableRepository}.
 */
class MultiFileTableRepositoryTest {

    private static final String RESCUE = "{\"id\": \"rescue_mage\", \"title\": \"Rescue the Mage\", \"giver\": \"hero\"}";
    private static final String DELIVERY = "{\"id\": \"herb_delivery\", \"title\": \"Herb Delivery\", \"giver\": \"archer\"}";

    private final DataSerializerFactory factory = DataSerializerFactory.createDefault();

    private InMemoryStorageProvider provider;
    private MultiFileTableRepository<String, QuestData> quests;

    @BeforeEach
    void setUp() {
        provider = new InMemoryStorageProvider()
                .put("Quests/rescue.json", RESCUE)
                .put("Quests/delivery.json", DELIVERY)
                .put("Quests/notes.txt", "not a quest");
        quests = new MultiFileTableRepository<>(QuestData.SCHEMA, "Quests");
    }

    // ========================================================================
    // Construction
    // ========================================================================

    @Test
    void testConstruction_DefaultsToJsonFiles() {
        assertEquals(DataFormat.JSON, quests.format());
        assertEquals("*.json", quests.pattern());
        assertEquals("Quests", quests.folder());
        assertEquals("QuestData", quests.name());
    }

    @Test
    void testConstruction_Yaml_MatchesYamlFiles() {
        MultiFileTableRepository<String, QuestData> yaml =
                new MultiFileTableRepository<>(QuestData.SCHEMA, "Quests", DataFormat.YAML);

        assertEquals("*.yaml", yaml.pattern());
    }

    @Test
    void testConstruction_Csv_Rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new MultiFileTableRepository<>(QuestData.SCHEMA, "Quests", DataFormat.CSV));
    }

    // ========================================================================
    // Loading
    // ========================================================================

    @Nested
    @DisplayName("Loading")
    class LoadTests {

        @Test
        void testLoad_OneRecordPerFile_MergedInPathOrder() throws Exception {
            quests.load(provider, factory).get(5, TimeUnit.SECONDS);

            assertEquals(2, quests.count());
            assertEquals(List.of("herb_delivery", "rescue_mage"), List.copyOf(quests.keys()));
            assertEquals("Rescue the Mage", quests.get("rescue_mage").title());
            assertEquals("hero", quests.get("rescue_mage").giver().key());
        }

        @Test
        void testLoad_MissingFolder_EmptyTable() throws Exception {
            MultiFileTableRepository<String, QuestData> none =
                    new MultiFileTableRepository<>(QuestData.SCHEMA, "NoQuests");

            none.load(provider, factory).get(5, TimeUnit.SECONDS);

            assertTrue(none.isLoaded());
            assertEquals(0, none.count());
        }

        @Test
        void testLoad_YamlFiles() throws Exception {
            provider.put("Quests/escort.yaml", "id: escort\ntitle: Escort\ngiver: mage\n");
            MultiFileTableRepository<String, QuestData> yaml =
                    new MultiFileTableRepository<>(QuestData.SCHEMA, "Quests", DataFormat.YAML);

            yaml.load(provider, factory).get(5, TimeUnit.SECONDS);

            assertEquals(List.of("escort"), List.copyOf(yaml.keys()));
        }

        @Test
        @DisplayName("The same key in two files fails the load and names the second file")
        void testLoad_SameKeyInTwoFiles_Duplicate() {
            provider.put("Quests/rescue_copy.json", RESCUE);

            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> quests.load(provider, factory).get(5, TimeUnit.SECONDS));

            DuplicateKeyException dup = assertInstanceOf(DuplicateKeyException.class, ex.getCause());
            assertEquals("rescue_mage", dup.key());
            assertEquals("Quests/rescue_copy.json", dup.sourcePath());
            assertFalse(quests.isLoaded());
        }

        @Test
        void testLoad_FileWithoutKey_Malformed() {
            provider.put("Quests/blank.json", "{\"title\": \"Nameless\"}");

            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> quests.load(provider, factory).get(5, TimeUnit.SECONDS));

            MalformedDataException malformed = assertInstanceOf(MalformedDataException.class, ex.getCause());
            assertEquals("Quests/blank.json", malformed.sourcePath());
        }

        @Test
        void testReload_BrokenFile_KeepsPrevious() throws Exception {
            quests.load(provider, factory).get(5, TimeUnit.SECONDS);
            Map<String, QuestData> before = quests.loadedItems();
            provider.put("Quests/delivery.json", "{\"id\": \"herb_delivery\",");

            assertThrows(ExecutionException.class, () -> quests.load(provider, factory).get(5, TimeUnit.SECONDS));

            assertSame(before, quests.loadedItems());
        }

        @Test
        void testLoad_AbortRequested_NothingInstalled() {
            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> quests.load(provider, factory, () -> true).get(5, TimeUnit.SECONDS));

            assertInstanceOf(CancellationException.class, ex.getCause());
            assertFalse(quests.isLoaded());
        }

        @Test
        void testLoadFromText_Unsupported() {
            assertThrows(UnsupportedOperationException.class, () -> quests.loadFromText(RESCUE, factory));
        }
    }

    // ========================================================================
    // Editing and Save
    // ========================================================================

    @Nested
    @DisplayName("Editing and save")
    class SaveTests {

        @Test
        @DisplayName("An edited record is written back to the file it came from")
        void testSave_EditedRecord_WrittenToSourceFile() throws Exception {
            quests.load(provider, factory).get(5, TimeUnit.SECONDS);
            QuestData rescue = quests.get("rescue_mage");
            quests.put(new QuestData(rescue.id(), "Rescue the Archmage", rescue.giver(), null, null));

            quests.save(provider, factory).get(5, TimeUnit.SECONDS);

            assertTrue(provider.peek("Quests/rescue.json").contains("Rescue the Archmage"));
            assertFalse(provider.exists("Quests/rescue_mage.json"));
            assertTrue(provider.peek("Quests/delivery.json").contains("Herb Delivery"));
        }

        @Test
        void testSave_NewRecord_WrittenToKeyNamedFile() throws Exception {
            quests.load(provider, factory).get(5, TimeUnit.SECONDS);
            quests.put(new QuestData("slay_dragon", "Slay the Dragon", null, null, null));

            quests.save(provider, factory).get(5, TimeUnit.SECONDS);

            assertEquals("Quests/slay_dragon.json", quests.fileFor("slay_dragon"));
            MultiFileTableRepository<String, QuestData> reloaded =
                    new MultiFileTableRepository<>(QuestData.SCHEMA, "Quests");
            reloaded.load(provider, factory).get(5, TimeUnit.SECONDS);
            assertEquals(3, reloaded.count());
            assertEquals("Slay the Dragon", reloaded.get("slay_dragon").title());
        }

        @Test
        void testSave_Unloaded_NotFound() {
            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> quests.save(provider, factory).get(5, TimeUnit.SECONDS));

            assertInstanceOf(DataNotFoundException.class, ex.getCause());
            assertEquals(RESCUE, provider.peek("Quests/rescue.json"));
        }

        @Test
        void testRemove_Unsupported() throws Exception {
            quests.load(provider, factory).get(5, TimeUnit.SECONDS);

            assertThrows(UnsupportedOperationException.class, () -> quests.remove("rescue_mage"));
            assertEquals(2, quests.count());
        }
    }

    // ========================================================================
    // File System
    // ========================================================================

    @Test
    void testSaveThenLoad_FileSystem(@TempDir Path tempDir) throws Exception {
        Files.createDirectories(tempDir.resolve("Quests"));
        Files.writeString(tempDir.resolve("Quests/rescue.json"), RESCUE);

        try (FileStorageProvider files = new FileStorageProvider(tempDir)) {
            quests.load(files, factory).get(5, TimeUnit.SECONDS);
            quests.put(new QuestData("escort", "Escort", null, null, null));
            quests.save(files, factory).get(5, TimeUnit.SECONDS);
        }

        assertTrue(Files.exists(tempDir.resolve("Quests/escort.json")));
        try (FileStorageProvider files = new FileStorageProvider(tempDir)) {
            MultiFileTableRepository<String, QuestData> reloaded =
                    new MultiFileTableRepository<>(QuestData.SCHEMA, "Quests");
            reloaded.load(files, factory).get(5, TimeUnit.SECONDS);
            assertEquals(List.of("escort", "rescue_mage"), List.copyOf(reloaded.keys()));
        }
    }
}
