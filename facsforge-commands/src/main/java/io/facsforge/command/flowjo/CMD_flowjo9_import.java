package io.facsforge.command.flowjo;

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
import io.facsforge.command.common.VerbosityOption;
import io.facsforge.workspace.config.ConfigMerger;
import io.facsforge.workspace.config.ConfigSchemaValidator;
import io.facsforge.workspace.config.ExperimentConfigs;
import io.facsforge.workspace.flowjo.FlowJo9WorkspaceImporter;
import io.facsforge.workspace.flowjo.ImportException;
import io.facsforge.workspace.flowjo.WorkspaceImport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// Imports the gate tree of one sample from a FlowJo v9 XML workspace.
///
/// The result is merged into the output file when it already exists: metadata and
/// celltypes from the workspace replace what is there, while channels already in the
/// panel keep their hand-edited entries. An empty `metadata.date` is set to today.
///
/// When the workspace cannot be read, or the merged configuration does not validate,
/// the structure that was parsed is printed to stderr as YAML and nothing is written.
@CommandLine.Command(name = "flowjo9-import",
    header = "Import a FlowJo v9 XML workspace into an experiment configuration",
    description = "Reads the gates, transforms and panel of one sample and writes them as YAML.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: configuration written", "1: workspace or merged configuration rejected"})
public class CMD_flowjo9_import implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_flowjo9_import.class);

    @CommandLine.Parameters(index = "0", paramLabel = "<wsp>", description = "FlowJo v9 workspace (.wsp XML)")
    private Path workspace;

    @CommandLine.Option(names = {"-o", "--output"}, defaultValue = "facsforge.yaml",
        description = "Configuration to write or merge into (default: ${DEFAULT-VALUE})")
    private Path output;

    @CommandLine.Option(names = {"--name"}, defaultValue = "FlowJoV9",
        description = "Experiment name for new configurations (default: ${DEFAULT-VALUE})")
    private String experimentName;

    @CommandLine.Option(names = {"--sample"},
        description = "Sample to import (default: the first one in the workspace)")
    private String sample;

    @CommandLine.Mixin
    private VerbosityOption verbosity = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws IOException {
        verbosity.apply();
        PrintWriter err = spec.commandLine().getErr();

        WorkspaceImport imported;
        try {
            imported = new FlowJo9WorkspaceImporter().importWorkspace(workspace, sample);
        } catch (ImportException e) {
            err.println("error: " + e.getMessage());
            printStructure(err, e.getParsedStructure());
            return CMD_facsforge.EXIT_INPUT_ERROR;
        }

        Map<String, Object> config = ExperimentConfigs.fromImport(imported, experimentName);
        if (Files.exists(output)) {
            logger.info("Merging into existing configuration {}", output);
            dropBlankMetadata(config);
            config = ConfigMerger.merge(ExperimentConfigs.read(output), config);
        }
        fillDefaults(config);

        List<String> errors = new ConfigSchemaValidator().check(config);
        if (!errors.isEmpty()) {
            err.println("error: the merged configuration is not valid:");
            for (String error : errors) {
                err.println("  - " + error);
            }
            printStructure(err, config);
            return CMD_facsforge.EXIT_INPUT_ERROR;
        }

        ExperimentConfigs.write(output, config);
        if (verbosity.showNormalOutput()) {
            spec.commandLine().getOut().printf("Imported %d population(s) of sample %s into %s%n",
                imported.hierarchy().size() - 1, imported.sampleName(), output);
        }
        return CMD_facsforge.EXIT_SUCCESS;
    }

    /// Blank operator, date and notes from the workspace must not clear hand-written ones.
    @SuppressWarnings("unchecked")
    private static void dropBlankMetadata(Map<String, Object> config) {
        if (config.get("metadata") instanceof Map) {
            Map<String, Object> values = (Map<String, Object>) config.get("metadata");
            values.values().removeIf(value -> value == null || value.toString().isBlank());
        }
    }

    @SuppressWarnings("unchecked")
    private static void fillDefaults(Map<String, Object> config) {
        Object metadata = config.get("metadata");
        if (metadata instanceof Map) {
            Map<String, Object> values = (Map<String, Object>) metadata;
            Object date = values.get("date");
            if (date == null || date.toString().isBlank()) {
                values.put("date", LocalDate.now().toString());
            }
        }
        Object compensation = config.get("compensation");
        if (compensation instanceof Map) {
            Map<String, Object> values = (Map<String, Object>) compensation;
            if (values.get("path") == null) {
                values.put("path", "");
            }
        }
    }

    private static void printStructure(PrintWriter err, Map<String, Object> structure) {
        if (structure.isEmpty()) {
            return;
        }
        err.println("parsed structure:");
        err.print(ExperimentConfigs.toYaml(new LinkedHashMap<>(structure)));
        err.flush();
    }
}
