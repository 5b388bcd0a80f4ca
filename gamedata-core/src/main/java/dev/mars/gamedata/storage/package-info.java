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
 * Storage layer - the raw text I/O boundary.
 * <p>
 * This package provides the persistence boundary of the data layer:
 * <ul>
 *   <li>{@link dev.mars.gamedata.storage.StorageProvider} - The provider interface</li>
 *   <li>{@link dev.mars.gamedata.storage.FileStorageProvider} - Non-blocking file-system implementation</li>
 *   <li>{@link dev.mars.gamedata.storage.InMemoryStorageProvider} - Map-backed implementation</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Shape-agnostic:</b> providers move text, never parse it</li>
 *   <li><b>Typed failures:</b> a missing path is {@link dev.mars.gamedata.DataNotFoundException},
 *       a failed write is {@link dev.mars.gamedata.storage.StorageException}</li>
 *   <li><b>Missing folders are empty:</b> listing or bulk-loading a folder that does not exist
 *       yields an empty result</li>
 * </ul>
 *
 * @see dev.mars.gamedata.storage.StorageProvider
 */
package dev.mars.gamedata.storage;
