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
 * Data contexts - named groups of repositories with a shared lifecycle.
 * <p>
 * Applications extend {@link dev.mars.gamedata.context.DataContext}, one
 * subclass per data set, and register their repositories in the
 * constructor. {@code loadAll()} is all-or-nothing from the caller's point
 * of view: it either completes with every repository loaded or fails with a
 * {@link dev.mars.gamedata.context.ContextLoadException}.
 */
package dev.mars.gamedata.context;
