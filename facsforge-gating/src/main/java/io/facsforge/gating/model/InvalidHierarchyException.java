package io.facsforge.gating.model;

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

/// Thrown when a gate tree or gate shape is structurally invalid.
///
/// Examples: a polygon with fewer than three vertices, a parent id that names no
/// node, a cycle, or two sibling populations with the same name.
public class InvalidHierarchyException extends IllegalArgumentException {

    /// @param message description of the structural problem
    public InvalidHierarchyException(String message) {
        super(message);
    }
}
