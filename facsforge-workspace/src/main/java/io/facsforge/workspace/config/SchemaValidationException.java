package io.facsforge.workspace.config;

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

import java.util.List;

/// Thrown when an experiment configuration does not satisfy the schema.
///
/// Carries every violation found, not just the first, each prefixed with the
/// location of the offending value (`celltypes → CD3 → gate`).
public class SchemaValidationException extends RuntimeException {

    private final List<String> errors;

    /// @param errors one message per violation, at least one
    public SchemaValidationException(List<String> errors) {
        super(format(errors));
        this.errors = List.copyOf(errors);
    }

    /// @param errors one message per violation
    /// @param cause  the underlying failure
    public SchemaValidationException(List<String> errors, Throwable cause) {
        super(format(errors), cause);
        this.errors = List.copyOf(errors);
    }

    /// @return the individual violations in the order they were found
    public List<String> getErrors() {
        return errors;
    }

    private static String format(List<String> errors) {
        StringBuilder sb = new StringBuilder("Experiment configuration has ")
            .append(errors.size()).append(errors.size() == 1 ? " error:" : " errors:");
        for (String error : errors) {
            sb.append(System.lineSeparator()).append("  - ").append(error);
        }
        return sb.toString();
    }
}
