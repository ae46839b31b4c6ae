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

/// The compensation a workspace names for its sample. It is carried through as an
/// opaque label; matrices are never read or applied here.
///
/// @param id   the matrix id the sample refers to, may be null
/// @param name the matrix name, may be null
public record CompensationReference(String id, String name) {

    private static final CompensationReference NONE = new CompensationReference(null, null);

    /// @return a reference to no compensation
    public static CompensationReference none() {
        return NONE;
    }

    /// @return true if the workspace names no compensation
    public boolean isNone() {
        return id == null && name == null;
    }

    /// @return the name, else the id, else null
    public String label() {
        return name != null ? name : id;
    }
}
