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
import io.facsforge.command.common.ForceOption;
import io.facsforge.gating.events.EventMatrix;
import io.facsforge.gating.events.EventMatrixCsv;
import io.facsforge.workspace.config.ExperimentConfigs;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 # Panel skeleton

 Writes a configuration listing every channel of an event table with the default
 role and transform for its name. Celltypes are left empty for the user to fill in.

 # Basic Usage
 ```
 generate-config tube_01.csv facsforge.yaml
 ```
 */
@CommandLine.Command(name = "generate-config",
    header = "Write a configuration skeleton from an event table",
    description = "Lists the channels of the event table with default roles and transforms.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: written", "1: unreadable input or output exists"})
public class CMD_generate_config implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_generate_config.class);

    @CommandLine.Parameters(index = "0", paramLabel = "<events.csv>", description = "Event table with a header row")
    private Path events;

    @CommandLine.Parameters(index = "1", paramLabel = "<out.yaml>", description = "Configuration to write")
    private Path output;

    @CommandLine.Mixin
    private ForceOption force = new ForceOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws IOException {
        force.checkWritable(output);
        EventMatrix matrix = EventMatrixCsv.read(events);
        logger.debug("Read {} channel(s) from {}", matrix.channels().size(), events);
        ExperimentConfigs.write(output, ExperimentConfigs.skeleton(matrix.channels(), events.getFileName().toString()));
        spec.commandLine().getOut().printf("Wrote %d channel(s) to %s%n", matrix.channels().size(), output);
        return CMD_facsforge.EXIT_SUCCESS;
    }
}
