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

import java.util.List;
import java.util.Optional;

/// One population in a {@link GateHierarchy}.
///
/// Nodes refer to each other by integer id, which is also the node's index in the
/// hierarchy's arena. Ids are assigned in depth-first pre-order, so a parent's id
/// is always lower than its children's.
///
/// @param id          arena index
/// @param name        population name, unique among siblings
/// @param path        `/`-joined names from the top-level population down
/// @param shape       gate region, or null for an ungated root
/// @param parentId    parent id, or {@link #NO_PARENT} for the root
/// @param childIds    child ids in source order
/// @param markerRules marker calls applied after the shape test
public record GateNode(
    int id,
    String name,
    String path,
    GateShape shape,
    int parentId,
    List<Integer> childIds,
    MarkerRules markerRules
) {

    /// Parent id of the root node.
    public static final int NO_PARENT = -1;

    public GateNode {
        childIds = List.copyOf(childIds);
        if (markerRules == null) {
            markerRules = MarkerRules.none();
        }
    }

    /// @return true for the root
    public boolean isRoot() {
        return parentId == NO_PARENT;
    }

    /// @return the shape, if this node is gated
    public Optional<GateShape> gate() {
        return Optional.ofNullable(shape);
    }

    /// @return the gated channels, empty for an ungated root
    public List<String> channels() {
        return shape == null ? List.of() : shape.channels();
    }
}
