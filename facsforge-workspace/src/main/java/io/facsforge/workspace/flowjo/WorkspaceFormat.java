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
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * FlowJo workspace file formats, told apart by content rather than extension.
 */
public enum WorkspaceFormat {

    /** A plain XML document, as written by FlowJo v9. */
    FLOWJO_V9_XML,
    /** A ZIP archive, as written by FlowJo v10. */
    FLOWJO_V10;

    private static final byte[] ZIP_MAGIC = {'P', 'K', 3, 4};

    /**
     * @param path a workspace file
     * @return its format
     * @throws IOException if the file cannot be read
     */
    public static WorkspaceFormat detect(Path path) throws IOException {
        byte[] head = new byte[ZIP_MAGIC.length];
        int read;
        try (InputStream in = Files.newInputStream(path)) {
            read = in.readNBytes(head, 0, head.length);
        }
        if (read == ZIP_MAGIC.length) {
            boolean zip = true;
            for (int i = 0; i < ZIP_MAGIC.length; i++) {
                zip &= head[i] == ZIP_MAGIC[i];
            }
            if (zip) {
                return FLOWJO_V10;
            }
        }
        return FLOWJO_V9_XML;
    }
}
