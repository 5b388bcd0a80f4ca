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
package dev.mars.gamedata.localization;

/**
 * One entry of the master key table: a localization key and what it is for.
 *
 * @param id          the key, e.g. {@code Button_Start}
 * @param description what the text is used for
 * @param category    grouping such as {@code UI} or {@code Dialog}
 * @param fixedKey    whether the key itself may not be renamed
 */
public record LocalizationKey(String id, String description, String category, boolean fixedKey) {
}
