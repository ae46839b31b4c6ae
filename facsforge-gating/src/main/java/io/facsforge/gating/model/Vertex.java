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

/// A polygon vertex in display coordinates.
///
/// @param x display value on the first gate channel
/// @param y display value on the second gate channel
public record Vertex(double x, double y) {

    /// @param x first coordinate
    /// @param y second coordinate
    /// @return a new vertex
    public static Vertex of(double x, double y) {
        return new Vertex(x, y);
    }
}
