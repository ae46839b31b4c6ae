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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Positive/negative marker calls applied after a node's shape test.
///
/// A positive channel keeps events whose raw value is above that channel's
/// threshold; a negative channel keeps events at or below it.
///
/// @param positive channels that must be above threshold
/// @param negative channels that must be at or below threshold
public record MarkerRules(List<String> positive, List<String> negative) {

    private static final MarkerRules NONE = new MarkerRules(List.of(), List.of());

    public MarkerRules {
        positive = List.copyOf(Objects.requireNonNull(positive, "positive"));
        negative = List.copyOf(Objects.requireNonNull(negative, "negative"));
    }

    /// @return rules that keep every event
    public static MarkerRules none() {
        return NONE;
    }

    /// @return true if there is nothing to apply
    public boolean isEmpty() {
        return positive.isEmpty() && negative.isEmpty();
    }

    /// @return every channel named by either list, positive first
    public List<String> channels() {
        Set<String> all = new LinkedHashSet<>(positive);
        all.addAll(negative);
        return new ArrayList<>(all);
    }
}
