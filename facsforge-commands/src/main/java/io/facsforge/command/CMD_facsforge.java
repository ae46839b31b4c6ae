package io.facsforge.command;

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

import io.facsforge.command.analyze.CMD_analyze;
import io.facsforge.command.config.CMD_generate_config;
import io.facsforge.command.config.CMD_validate;
import io.facsforge.command.flowjo.CMD_flowjo10_import;
import io.facsforge.command.flowjo.CMD_flowjo9_import;
import io.facsforge.gating.engine.ChannelNotFoundException;
import io.facsforge.workspace.config.SchemaValidationException;
import io.facsforge.workspace.flowjo.ImportException;
import io.facsforge.workspace.flowjo.UnsupportedFormatException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.Callable;

/**
 # facsforge

 Imports FlowJo gate hierarchies into YAML experiment configurations and evaluates
 them against event tables.

 ## Subcommands
 - `flowjo9-import`: FlowJo v9 XML workspace to configuration
 - `flowjo10-import`: recognizes and refuses v10 archives
 - `validate`: check a configuration
 - `generate-config`: panel skeleton from an event table header
 - `analyze`: gate event tables and write per-population outputs

 # Basic Usage
 ```
 facsforge flowjo9-import experiment.wsp -o facsforge.yaml
 facsforge analyze tube_01.csv -c facsforge.yaml -o out
 ```
 */
@CommandLine.Command(name = "facsforge",
    mixinStandardHelpOptions = true,
    version = "facsforge 0.1.0",
    header = "Flow cytometry gate hierarchy import and evaluation",
    description = "Imports FlowJo gate hierarchies and evaluates them against event tables.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "1: invalid input, configuration or workspace", "2: unexpected failure"},
    subcommands = {
        CMD_flowjo9_import.class,
        CMD_flowjo10_import.class,
        CMD_validate.class,
        CMD_generate_config.class,
        CMD_analyze.class,
        CommandLine.HelpCommand.class
    })
public class CMD_facsforge implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_facsforge.class);

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_INPUT_ERROR = 1;
    public static final int EXIT_UNEXPECTED = 2;

    /**
     * Run the facsforge command
     * @param args Command line arguments
     */
    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /**
     * @return the root command line with the option and error handling the CLI uses
     */
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_facsforge())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true)
            .setExecutionExceptionHandler(CMD_facsforge::handleFailure);
    }

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_SUCCESS;
    }

    private static int handleFailure(Exception e, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        if (isInputError(e)) {
            logger.debug("Command {} failed", commandLine.getCommandName(), e);
            commandLine.getErr().println("error: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        }
        logger.error("Unexpected failure in {}", commandLine.getCommandName(), e);
        commandLine.getErr().println("unexpected error: " + e);
        return EXIT_UNEXPECTED;
    }

    /// Bad event tables, gates, transform parameters and option conflicts surface as
    /// [IllegalArgumentException] subclasses and count as input errors. An
    /// [IllegalStateException] is an internal fault and exits with [#EXIT_UNEXPECTED].
    static boolean isInputError(Exception e) {
        return e instanceof ImportException
            || e instanceof UnsupportedFormatException
            || e instanceof SchemaValidationException
            || e instanceof ChannelNotFoundException
            || e instanceof IllegalArgumentException
            || e instanceof IOException
            || e instanceof UncheckedIOException;
    }
}
