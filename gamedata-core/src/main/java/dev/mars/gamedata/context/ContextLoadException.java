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
package dev.mars.gamedata.context;

import dev.mars.gamedata.GameDataException;

/**
 * A context failed to load because one of its repositories did. The cause
 * is the repository's own failure.
 */
public class ContextLoadException extends GameDataException {

    private final String contextName;
    private final String repositoryName;
    private final String path;

    public ContextLoadException(String contextName, String repositoryName, String path, Throwable cause) {
        super("Context '" + contextName + "' failed to load " + repositoryName + " from " + path
                + ": " + cause.getMessage(), cause);
        this.contextName = contextName;
        this.repositoryName = repositoryName;
        this.path = path;
    }

    public String contextName() {
        return contextName;
    }

    public String repositoryName() {
        return repositoryName;
    }

    public String path() {
        return path;
    }
}
