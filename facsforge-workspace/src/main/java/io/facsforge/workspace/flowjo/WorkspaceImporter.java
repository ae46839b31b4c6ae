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

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads the gate tree and transforms of one sample from a workspace file.
 */
public interface WorkspaceImporter {

    /**
     * @param workspace  the workspace file
     * @param sampleName the sample to read, or null for the first one
     * @return the import
     * @throws IOException                 if the file cannot be read
     * @throws ImportException             if the document is malformed or inconsistent
     * @throws UnsupportedFormatException  if the importer does not read this format
     */
    WorkspaceImport importWorkspace(Path workspace, String sampleName) throws IOException;

    /**
     * @param workspace the workspace file
     * @return the import of the first sample
     * @throws IOException if the file cannot be read
     */
    default WorkspaceImport importWorkspace(Path workspace) throws IOException {
        return importWorkspace(workspace, null);
    }

    /**
     * @param format a detected format
     * @return the importer for it
     */
    static WorkspaceImporter forFormat(WorkspaceFormat format) {
        switch (format) {
            case FLOWJO_V10:
                return new FlowJo10WorkspaceImporter();
            case FLOWJO_V9_XML:
            default:
                return new FlowJo9WorkspaceImporter();
        }
    }
}
