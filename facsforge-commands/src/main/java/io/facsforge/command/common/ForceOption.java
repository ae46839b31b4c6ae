package io.facsforge.command.common;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared {@code -f/--force} flag guarding files a command would replace.
 */
public class ForceOption {

    @CommandLine.Option(
        names = {"-f", "--force"},
        description = "Force overwrite if the output already exists"
    )
    private boolean force = false;

    public boolean isForce() {
        return force;
    }

    /**
     * @param output a file the command is about to write
     * @throws IllegalArgumentException if it exists and force is not set
     */
    public void checkWritable(Path output) {
        if (Files.exists(output) && !force) {
            throw new IllegalArgumentException(
                "Output file already exists: " + output + ". Use --force to overwrite.");
        }
    }
}
