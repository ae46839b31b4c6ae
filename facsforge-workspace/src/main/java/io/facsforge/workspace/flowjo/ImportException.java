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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A workspace document is malformed or internally inconsistent.
 *
 * <p>The exception may carry the structure parsed before the failure, for display to
 * the user. It is diagnostic only and never a usable partial import.
 */
public class ImportException extends RuntimeException {

    private final Map<String, Object> parsedStructure;

    public ImportException(String message) {
        this(message, null, Map.of());
    }

    public ImportException(String message, Throwable cause) {
        this(message, cause, Map.of());
    }

    /**
     * @param message         detail message
     * @param cause           underlying failure, may be null
     * @param parsedStructure what was read before the failure
     */
    public ImportException(String message, Throwable cause, Map<String, Object> parsedStructure) {
        super(message, cause);
        this.parsedStructure = Collections.unmodifiableMap(new LinkedHashMap<>(parsedStructure));
    }

    /**
     * @return the structure read before the failure, possibly empty
     */
    public Map<String, Object> getParsedStructure() {
        return parsedStructure;
    }
}
