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
package dev.mars.gamedata;

/**
 * Thrown when a logical path does not resolve to any content, or when a key
 * lookup misses.
 */
public class DataNotFoundException extends GameDataException {

    private final String target;

    public DataNotFoundException(String target, String message) {
        super(message);
        this.target = target;
    }

    /** The missing path or key. */
    public String target() {
        return target;
    }
}
