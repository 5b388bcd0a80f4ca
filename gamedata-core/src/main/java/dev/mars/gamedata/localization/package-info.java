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
 * Localization overlay: a master key table plus one text table per language,
 * with a fallback chain that never fails a lookup. Record fields of type
 * {@link dev.mars.gamedata.localization.LocaleRef} hold keys into it.
 *
 * @see dev.mars.gamedata.localization.LocalizationContext
 */
package dev.mars.gamedata.localization;
