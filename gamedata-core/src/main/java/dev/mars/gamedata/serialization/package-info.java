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
/**
 * Serialization layer - text to typed records and back.
 * <p>
 * One {@link dev.mars.gamedata.serialization.DataSerializer} per
 * {@link dev.mars.gamedata.serialization.DataFormat}, all backed by Jackson:
 * <ul>
 *   <li>{@link dev.mars.gamedata.serialization.JsonDataSerializer} - array of flat objects</li>
 *   <li>{@link dev.mars.gamedata.serialization.CsvDataSerializer} - header row plus data rows</li>
 *   <li>{@link dev.mars.gamedata.serialization.YamlDataSerializer} - sequence of mappings</li>
 * </ul>
 * A {@link dev.mars.gamedata.serialization.TableSchema} names the record type
 * and how to extract its key. Serializers are stateless and thread-safe;
 * {@link dev.mars.gamedata.serialization.DataSerializerFactory} is the only
 * object contexts share.
 */
package dev.mars.gamedata.serialization;
