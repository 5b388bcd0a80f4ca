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
package dev.mars.gamedata.serialization;

import dev.mars.gamedata.DuplicateKeyException;
import dev.mars.gamedata.MalformedDataException;
import dev.mars.gamedata.sample.CharacterData;
import dev.mars.gamedata.sample.GameConfigData;
import dev.mars.gamedata.sample.ShopItemData;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link YamlDataSerializer}.
 */
class YamlDataSerializerTest {

    private final YamlDataSerializer serializer = new YamlDataSerializer();

    @Test
    void testParse_SequenceOfMappings() {
        String yaml = "- id: potion_hp_small\n"
                + "  name: Small HP Potion\n"
                + "  price: 100\n"
                + "  dailyLimit: 10\n"
                + "  available: true\n"
                + "- id: elixir\n"
                + "  name: Elixir\n"
                + "  price: 5000\n"
                + "  dailyLimit: 1\n"
                + "  available: false\n";

        Map<String, ShopItemData> items = serializer.parse(yaml, ShopItemData.SCHEMA, "ShopItems.yaml");

        assertEquals(List.of("potion_hp_small", "elixir"), List.copyOf(items.keySet()));
        assertEquals(100, items.get("potion_hp_small").price());
        assertFalse(items.get("elixir").available());
    }

    @Test
    void testParse_NestedList() {
        String yaml = "- id: mage\n"
                + "  name: Mage\n"
                + "  level: 3\n"
                + "  health: 80\n"
                + "  skills: [fireball, ice_bolt]\n";

        Map<String, CharacterData> characters = serializer.parse(yaml, CharacterData.SCHEMA, "Characters.yml");

        assertEquals(List.of("fireball", "ice_bolt"), characters.get("mage").skills());
    }

    @Test
    void testParse_Blank_EmptyTable() {
        assertTrue(serializer.parse("", ShopItemData.SCHEMA, "ShopItems.yaml").isEmpty());
    }

    @Test
    void testParse_MappingRoot_Malformed() {
        MalformedDataException ex = assertThrows(MalformedDataException.class,
                () -> serializer.parse("id: lonely\n", ShopItemData.SCHEMA, "ShopItems.yaml"));

        assertEquals("ShopItems.yaml", ex.sourcePath());
    }

    @Test
    void testParse_BrokenSyntax_Malformed() {
        String yaml = "- id: a\n  name: [unclosed\n";

        assertThrows(MalformedDataException.class,
                () -> serializer.parse(yaml, ShopItemData.SCHEMA, "ShopItems.yaml"));
    }

    @Test
    void testParse_DuplicateKey_Rejected() {
        String yaml = "- id: a\n"
                + "  price: 1\n"
                + "- id: a\n"
                + "  price: 2\n";

        DuplicateKeyException ex = assertThrows(DuplicateKeyException.class,
                () -> serializer.parse(yaml, ShopItemData.SCHEMA, "ShopItems.yaml"));

        assertEquals(2, ex.position());
    }

    @Test
    void testRenderThenParse_RoundTrip() {
        List<CharacterData> characters = List.of(
                new CharacterData("hero", "Hero", 5, 120, List.of("slash", "guard")),
                new CharacterData("rogue", "Rogue: the quiet", 2, 60, List.of("stab")));

        String yaml = serializer.render(characters, CharacterData.SCHEMA);

        assertFalse(yaml.startsWith("---"));
        assertEquals(characters, List.copyOf(
                serializer.parse(yaml, CharacterData.SCHEMA, "Characters.yaml").values()));
    }

    @Test
    void testSingleRoundTrip() {
        GameConfigData config = new GameConfigData(40, 1.25, "harbor");

        String yaml = serializer.renderSingle(config, GameConfigData.class);

        assertEquals(config, serializer.parseSingle(yaml, GameConfigData.class, "GameConfig.yaml"));
    }

    @Test
    void testParseSingle_CapitalizedKeys_BindIgnoringCase() {
        String yaml = "MaxLevel: 40\nExpMultiplier: 1.25\nStartingMap: harbor\n";

        assertEquals(new GameConfigData(40, 1.25, "harbor"),
                serializer.parseSingle(yaml, GameConfigData.class, "GameConfig.yaml"));
    }
}
