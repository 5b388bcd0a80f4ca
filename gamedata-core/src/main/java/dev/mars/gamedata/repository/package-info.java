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
 * Repositories - typed, keyed access to the records of a data file or folder.
 * <p>
 * {@link dev.mars.gamedata.repository.TableRepository} holds many records by
 * key, {@link dev.mars.gamedata.repository.SingleRepository} holds one, and
 * {@link dev.mars.gamedata.repository.MultiFileTableRepository} merges a
 * folder of one-record files into a table.
 * Both install loaded data atomically: a failed or aborted load leaves the
 * previous records in place.
 */
package dev.mars.gamedata.repository;
