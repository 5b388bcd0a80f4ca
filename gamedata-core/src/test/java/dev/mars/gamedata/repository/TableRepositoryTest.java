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
import dev.mars.gamedata.MalformedDataException;
import dev.mars.gamedata.UnsupportedFormatException;
import dev.mars.gamedata.sample.ShopItemData;
import dev.mars.gamedata.serialization.DataFormat;
import dev.mars.gamedata.serialization.DataSerializerFactory;
import dev.mars.gamedata.storage.InMemoryStorageProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TableRepository}.
 */
class TableRepositoryTest {

    private static final String HEADER = "id,name,price,dailyLimit,available\n";
    private static final String SHOP_CSV = HEADER
            + "potion_hp_small,Small HP Potion,100,10,true\n"
            + "potion_mp_small,Small MP Potion,120,10,true\n"
            + "elixir,Elixir,5000,1,false\n";

    private final DataSerializerFactory factory = DataSerializerFactory.createDefault();

    private InMemoryStorageProvider provider;
    private TableRepository<String, ShopItemData> repository;

    @BeforeEach
    void setUp() {
        provider = new InMemoryStorageProvider().put("ShopItems.csv", SHOP_CSV);
        repository = new TableRepository<>(ShopItemData.SCHEMA, "ShopItems.csv");
    }

    // ========================================================================
    // Construction
    // ========================================================================

    @Test
    void testConstruction_FormatFromExtension() {
        assertEquals(DataFormat.CSV, repository.format());
        assertEquals("ShopItemData", repository.name());
        assertEquals("ShopItems.csv", repository.path());
        assertFalse(repository.isLoaded());
    }

    @Test
    void testConstruction_ExplicitFormatOverridesExtension() {
        TableRepository<String, ShopItemData> yaml =
                new TableRepository<>(ShopItemData.SCHEMA, "shop.data", DataFormat.YAML);

        assertEquals(DataFormat.YAML, yaml.format());
    }

    @Test
    void testConstruction_UnknownExtension_Rejected() {
        assertThrows(UnsupportedFormatException.class,
                () -> new TableRepository<>(ShopItemData.SCHEMA, "ShopItems.xml"));
    }

    // ========================================================================
    // Queries
    // ========================================================================

    @Nested
    @DisplayName("Queries after load")
    class QueryTests {

        @BeforeEach
        void load() throws Exception {
            repository.load(provider, factory).get(5, TimeUnit.SECONDS);
        }

        @Test
        void testGet_ExistingKey() {
            ShopItemData potion = repository.get("potion_hp_small");

            assertEquals("Small HP Potion", potion.name());
            assertEquals(100, potion.price());
        }

        @Test
        void testGet_MissingKey_NotFound() {
            DataNotFoundException ex = assertThrows(DataNotFoundException.class, () -> repository.get("sword"));

            assertEquals("sword", ex.target());
        }

        @Test
        void testTryGetAndContains() {
            assertTrue(repository.tryGet("elixir").isPresent());
            assertEquals(Optional.empty(), repository.tryGet("sword"));
            assertTrue(repository.contains("elixir"));
            assertFalse(repository.contains("sword"));
        }

        @Test
        void testKeysAndValues_InFileOrder() {
            assertEquals(3, repository.count());
            assertEquals(List.of("potion_hp_small", "potion_mp_small", "elixir"), List.copyOf(repository.keys()));
            assertEquals("Elixir", List.copyOf(repository.values()).get(2).name());
        }

        @Test
        void testLoadedItems_Unmodifiable() {
            Map<String, ShopItemData> items = repository.loadedItems();

            assertThrows(UnsupportedOperationException.class, () -> items.remove("elixir"));
        }

        @Test
        void testFind_ByPredicate() {
            List<ShopItemData> cheap = repository.find(item -> item.price() < 1000);

            assertEquals(2, cheap.size());
            assertEquals("potion_hp_small", cheap.get(0).id());
        }
    }

    // ========================================================================
    // Atomicity
    // ========================================================================

    @Nested
    @DisplayName("Failed loads keep prior state")
    class AtomicityTests {

        @Test
        @DisplayName("A malformed reload keeps the previous records")
        void testReload_Malformed_KeepsPrevious() throws Exception {
            repository.load(provider, factory).get(5, TimeUnit.SECONDS);
            Map<String, ShopItemData> before = repository.loadedItems();

            provider.put("ShopItems.csv", HEADER + "broken,Broken,not-a-number,1,true\n");
            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> repository.load(provider, factory).get(5, TimeUnit.SECONDS));

            assertInstanceOf(MalformedDataException.class, ex.getCause());
            assertSame(before, repository.loadedItems());
            assertEquals(3, repository.count());
        }

        @Test
        @DisplayName("A failed first load leaves the table empty and unloaded")
        void testFirstLoad_Missing_StaysEmpty() {
            TableRepository<String, ShopItemData> missing =
                    new TableRepository<>(ShopItemData.SCHEMA, "Missing.csv");

            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> missing.load(provider, factory).get(5, TimeUnit.SECONDS));

            assertInstanceOf(DataNotFoundException.class, ex.getCause());
            assertFalse(missing.isLoaded());
            assertEquals(0, missing.count());
        }

        @Test
        void testLoad_AbortRequested_NothingInstalled() {
            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> repository.load(provider, factory, () -> true).get(5, TimeUnit.SECONDS));

            assertInstanceOf(CancellationException.class, ex.getCause());
            assertFalse(repository.isLoaded());
        }

        @Test
        void testLoad_UnregisteredFormat_FailsFuture() {
            DataSerializerFactory jsonOnly = DataSerializerFactory.builder()
                    .register(new dev.mars.gamedata.serialization.JsonDataSerializer())
                    .build();

            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> repository.load(provider, jsonOnly).get(5, TimeUnit.SECONDS));

            assertInstanceOf(UnsupportedFormatException.class, ex.getCause());
        }
    }

    @Test
    void testLookups_NullKeyBeforeLoad_BehaveLikeMissingKey() {
        assertTrue(repository.tryGet(null).isEmpty());
        assertFalse(repository.contains(null));
        assertThrows(DataNotFoundException.class, () -> repository.get(null));
        assertTrue(repository.loadedItems().isEmpty());
    }

    // ========================================================================
    // Editing and Save
    // ========================================================================

    @Nested
    @DisplayName("Editing and save")
    class EditTests {

        @Test
        void testPut_CopyOnWrite_OldSnapshotUntouched() throws Exception {
            repository.load(provider, factory).get(5, TimeUnit.SECONDS);
            Map<String, ShopItemData> before = repository.loadedItems();

            Optional<ShopItemData> previous =
                    repository.put(new ShopItemData("elixir", "Elixir", 4500, 1, true));

            assertEquals(5000, previous.orElseThrow().price());
            assertEquals(5000, before.get("elixir").price());
            assertEquals(4500, repository.get("elixir").price());
        }

        @Test
        void testRemove() throws Exception {
            repository.load(provider, factory).get(5, TimeUnit.SECONDS);

            assertTrue(repository.remove("elixir").isPresent());
            assertFalse(repository.remove("elixir").isPresent());
            assertEquals(2, repository.count());
        }

        @Test
        void testSaveThenLoad_PersistsEdits() throws Exception {
            repository.load(provider, factory).get(5, TimeUnit.SECONDS);
            repository.put(new ShopItemData("ether", "Ether", 250, 3, true));
            repository.save(provider, factory).get(5, TimeUnit.SECONDS);

            TableRepository<String, ShopItemData> reloaded = new TableRepository<>(ShopItemData.SCHEMA, "ShopItems.csv");
            reloaded.load(provider, factory).get(5, TimeUnit.SECONDS);

            assertEquals(4, reloaded.count());
            assertEquals(repository.loadedItems(), reloaded.loadedItems());
        }

        @Test
        void testPut_OnUnloadedTable_StartsNewTable() {
            repository.put(new ShopItemData("ether", "Ether", 250, 3, true));

            assertTrue(repository.isLoaded());
            assertEquals(1, repository.count());
        }

        @Test
        void testSave_RendersColumnsInComponentOrder() throws Exception {
            repository.load(provider, factory).get(5, TimeUnit.SECONDS);
            repository.save(provider, factory).get(5, TimeUnit.SECONDS);

            assertTrue(provider.peek("ShopItems.csv").startsWith(HEADER), provider.peek("ShopItems.csv"));
        }

        @Test
        @DisplayName("Saving a table that never loaded fails and leaves the file alone")
        void testSave_Unloaded_FailsAndKeepsFile() {
            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> repository.save(provider, factory).get(5, TimeUnit.SECONDS));

            assertInstanceOf(DataNotFoundException.class, ex.getCause());
            assertEquals(SHOP_CSV, provider.peek("ShopItems.csv"));
        }

        @Test
        void testSave_AfterFailedFirstLoad_KeepsFile() {
            provider.put("ShopItems.csv", HEADER + "broken,Broken,lots,1,true\n");

            assertThrows(ExecutionException.class, () -> repository.load(provider, factory).get(5, TimeUnit.SECONDS));
            assertThrows(ExecutionException.class, () -> repository.save(provider, factory).get(5, TimeUnit.SECONDS));

            assertTrue(provider.peek("ShopItems.csv").contains("broken,Broken,lots"));
        }
    }
}
