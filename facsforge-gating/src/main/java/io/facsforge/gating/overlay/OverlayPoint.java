package io.facsforge.gating.overlay;

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

/// An index row placed on a plot.
///
/// @param well       label text, null when the index table has no wells
/// @param eventIndex matched event's index in the source matrix
/// @param x          display x of the matched event
/// @param y          display y of the matched event
/// @param distance   relative match distance, NaN for positional matches
public record OverlayPoint(String well, int eventIndex, double x, double y, double distance) {
}
