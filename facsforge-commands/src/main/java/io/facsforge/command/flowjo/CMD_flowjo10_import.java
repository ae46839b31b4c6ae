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
import io.facsforge.workspace.flowjo.UnsupportedFormatException;
import io.facsforge.workspace.flowjo.WorkspaceFormat;
import io.facsforge.workspace.flowjo.WorkspaceImporter;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Placeholder for FlowJo v10 archives, which are recognized but not read.
 */
@CommandLine.Command(name = "flowjo10-import",
    header = "FlowJo v10 workspaces are not supported",
    description = "Always fails; re-export the workspace from FlowJo as v9 XML and use flowjo9-import.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"1: always"})
public class CMD_flowjo10_import implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", paramLabel = "<wsp>", description = "FlowJo v10 workspace")
    private Path workspace;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws IOException {
        try {
            WorkspaceImporter.forFormat(WorkspaceFormat.FLOWJO_V10).importWorkspace(workspace);
        } catch (UnsupportedFormatException e) {
            spec.commandLine().getErr().println("error: " + e.getMessage());
        }
        return CMD_facsforge.EXIT_INPUT_ERROR;
    }
}
