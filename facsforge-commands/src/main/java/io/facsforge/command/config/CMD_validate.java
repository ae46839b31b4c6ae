package io.facsforge.command.config;

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

import io.facsforge.command.CMD_facsforge;
import io.facsforge.workspace.config.ExperimentConfig;
import io.facsforge.workspace.config.ExperimentConfigs;
import io.facsforge.workspace.config.SchemaValidationException;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Checks an experiment configuration and reports every problem found.
 */
@CommandLine.Command(name = "validate",
    header = "Validate an experiment configuration",
    description = "Loads the configuration, builds its gate hierarchy and reports all schema errors.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: valid", "1: invalid"})
public class CMD_validate implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", paramLabel = "<config.yaml>", description = "Configuration to check")
    private Path config;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        try {
            ExperimentConfig loaded = ExperimentConfigs.load(config);
            out.printf("OK: %s (%d channel(s), %d population(s))%n", config, loaded.getChannels().size(),
                loaded.getCelltypePaths().size());
            return CMD_facsforge.EXIT_SUCCESS;
        } catch (SchemaValidationException e) {
            PrintWriter err = spec.commandLine().getErr();
            err.println(config + " is not valid:");
            for (String error : e.getErrors()) {
                err.println("  - " + error);
            }
            return CMD_facsforge.EXIT_INPUT_ERROR;
        }
    }
}
