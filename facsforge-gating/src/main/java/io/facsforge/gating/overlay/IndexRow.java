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

import java.util.Map;

/// One row of sort-time metadata from an index CSV.
///
/// @param well    well or tube label, null when the table has no `Well` column
/// @param ordinal event ordinal recorded by the sorter, null when absent
/// @param values  numeric cells keyed by normalized column name
public record IndexRow(String well, Long ordinal, Map<String, Double> values) {

    public IndexRow {
        values = Map.copyOf(values);
    }

    /// @param column a column name, normalized or not
    /// @return true if this row has a number in that column
    public boolean hasValue(String column) {
        return values.containsKey(IndexTable.normalize(column));
    }

    /// @param column a column name, normalized or not
    /// @return the value, or NaN when absent
    public double value(String column) {
        Double value = values.get(IndexTable.normalize(column));
        return value == null ? Double.NaN : value;
    }
}
