package io.facsforge.workspace.flowjo;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;

/**
 * Recognizes FlowJo v10 archives and refuses them.
 */
public final class FlowJo10WorkspaceImporter implements WorkspaceImporter {

    private static final Logger logger = LogManager.getLogger(FlowJo10WorkspaceImporter.class);

    static final String MESSAGE = "FlowJo v10 workspaces (ZIP .wsp archives) are not supported; "
        + "re-export the workspace from FlowJo as v9 XML";

    @Override
    public WorkspaceImport importWorkspace(Path workspace, String sampleName) {
        logger.debug("Refusing FlowJo v10 workspace {}", workspace);
        throw new UnsupportedFormatException(WorkspaceFormat.FLOWJO_V10, workspace + ": " + MESSAGE);
    }
}
