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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared verbosity control options.
 * Provides {@code -v/--verbose} and {@code -q/--quiet}, which move every logger to
 * DEBUG or ERROR.
 */
public class VerbosityOption {

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Log debug detail"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Suppress all output except errors"
    )
    private boolean quiet = false;

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * @return true if summaries should be printed to stdout
     */
    public boolean showNormalOutput() {
        return !quiet;
    }

    /**
     * Validates the flags and sets the root log level accordingly.
     *
     * @throws IllegalArgumentException if both verbose and quiet are enabled
     */
    public void apply() {
        if (verbose && quiet) {
            throw new IllegalArgumentException("Cannot specify both --verbose and --quiet options");
        }
        if (verbose) {
            Configurator.setAllLevels(LogManager.ROOT_LOGGER_NAME, Level.DEBUG);
        } else if (quiet) {
            Configurator.setAllLevels(LogManager.ROOT_LOGGER_NAME, Level.ERROR);
        }
    }
}
