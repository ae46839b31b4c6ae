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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Membership of every population of a hierarchy, in depth-first order.
 */
public final class GatingResult {

    private final int totalEvents;
    private final List<MembershipResult> populations;
    private final Map<String, MembershipResult> byPath;

    public GatingResult(int totalEvents, List<MembershipResult> populations) {
        this.totalEvents = totalEvents;
        this.populations = Collections.unmodifiableList(new ArrayList<>(populations));
        this.byPath = new HashMap<>();
        for (MembershipResult population : populations) {
            byPath.put(population.path(), population);
        }
    }

    public int getTotalEvents() {
        return totalEvents;
    }

    /**
     * @return one entry per node, indexed by node id
     */
    public List<MembershipResult> getPopulations() {
        return populations;
    }

    /**
     * @param id a node id
     * @return that node's membership
     */
    public MembershipResult byId(int id) {
        return populations.get(id);
    }

    /**
     * @param path a population path
     * @return that population's membership
     */
    public Optional<MembershipResult> byPath(String path) {
        return Optional.ofNullable(byPath.get(path));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("GatingResult{total=").append(totalEvents);
        for (MembershipResult population : populations) {
            sb.append(", ").append(population.path()).append('=').append(population.count());
        }
        return sb.append('}').toString();
    }
}
