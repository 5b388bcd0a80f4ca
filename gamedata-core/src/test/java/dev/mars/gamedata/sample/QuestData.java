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
package dev.mars.gamedata.sample;

import dev.mars.gamedata.localization.LocaleRef;
import dev.mars.gamedata.ref.IntDataRef;
import dev.mars.gamedata.ref.StringDataRef;
import dev.mars.gamedata.serialization.TableSchema;

/**
 * Quest stored one per JSON file, pointing at its giver, its reward item and
 * a localized summary.
 */
public record QuestData(String id, String title, StringDataRef<CharacterData> giver,
                        IntDataRef<ItemData> reward, LocaleRef summary) {

    public static final TableSchema<String, QuestData> SCHEMA =
            TableSchema.of(QuestData.class, QuestData::id);
}
