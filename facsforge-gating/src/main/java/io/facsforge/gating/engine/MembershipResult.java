package io.facsforge.gating.engine;

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

import java.util.BitSet;

/// Events in one population.
///
/// The mask is copied in and out, so results stay immutable.
///
/// @param id          node id in the hierarchy
/// @param name        population name
/// @param path        population path
/// @param mask        indices of member events in the source matrix
/// @param count       number of members
/// @param parentCount number of members of the parent, or the total for the root
/// @param totalCount  number of events in the source matrix
public record MembershipResult(int id, String name, String path, BitSet mask, int count, int parentCount,
                               int totalCount) {

    public MembershipResult {
        mask = (BitSet) mask.clone();
    }

    @Override
    public BitSet mask() {
        return (BitSet) mask.clone();
    }

    /// @return `count / parentCount`, or 0 when the parent is empty
    public double frequencyOfParent() {
        return parentCount == 0 ? 0.0 : (double) count / parentCount;
    }

    /// @return `count / totalCount`, or 0 for an empty matrix
    public double frequencyOfTotal() {
        return totalCount == 0 ? 0.0 : (double) count / totalCount;
    }

    /// @param event an event index
    /// @return true if that event is a member
    public boolean contains(int event) {
        return mask.get(event);
    }
}
