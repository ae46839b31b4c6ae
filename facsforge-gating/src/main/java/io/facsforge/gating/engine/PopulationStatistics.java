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
import java.util.List;

/**
 * Per-population counts and frequencies of a {@link GatingResult}.
 */
public final class PopulationStatistics {

    /// One population's statistics. Percentages are in [0, 100].
    ///
    /// @param path          population path
    /// @param count         members
    /// @param parentCount   members of the parent
    /// @param percentParent `100 * count / parentCount`
    /// @param percentTotal  `100 * count / total`
    public record Row(String path, int count, int parentCount, double percentParent, double percentTotal) {
    }

    private final int totalEvents;
    private final List<Row> rows;

    private PopulationStatistics(int totalEvents, List<Row> rows) {
        this.totalEvents = totalEvents;
        this.rows = List.copyOf(rows);
    }

    /**
     * @param result a gating result
     * @return one row per population, depth-first
     */
    public static PopulationStatistics from(GatingResult result) {
        List<Row> rows = new ArrayList<>();
        for (MembershipResult population : result.getPopulations()) {
            rows.add(new Row(population.path(), population.count(), population.parentCount(),
                100.0 * population.frequencyOfParent(), 100.0 * population.frequencyOfTotal()));
        }
        return new PopulationStatistics(result.getTotalEvents(), rows);
    }

    public int getTotalEvents() {
        return totalEvents;
    }

    public List<Row> getRows() {
        return rows;
    }
}
