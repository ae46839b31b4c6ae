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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows of an index-sort table with the bookkeeping gathered while reading it.
 */
public final class IndexTable {

    private final List<String> columns;
    private final List<IndexRow> rows;
    private final boolean wellColumn;
    private final int removedZeroRows;
    private final Map<String, Integer> wellConflicts;

    public IndexTable(List<String> columns, List<IndexRow> rows, boolean wellColumn, int removedZeroRows) {
        this.columns = new ArrayList<>();
        for (String column : columns) {
            this.columns.add(normalize(column));
        }
        this.rows = List.copyOf(rows);
        this.wellColumn = wellColumn;
        this.removedZeroRows = removedZeroRows;
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (IndexRow row : rows) {
            if (row.well() != null && !row.well().isBlank()) {
                counts.merge(row.well(), 1, Integer::sum);
            }
        }
        counts.values().removeIf(count -> count < 2);
        this.wellConflicts = Map.copyOf(counts);
    }

    /**
     * Column names are compared without spaces, so {@code "FSC A"} and {@code "FSCA"}
     * refer to the same column.
     *
     * @param column a raw column or channel name
     * @return the normalized name
     */
    public static String normalize(String column) {
        return column.trim().replace(" ", "");
    }

    /**
     * @return normalized column names in file order
     */
    public List<String> getColumns() {
        return List.copyOf(columns);
    }

    /**
     * @param column a column or channel name, normalized or not
     * @return true if the table has that column
     */
    public boolean hasColumn(String column) {
        return columns.contains(normalize(column));
    }

    public List<IndexRow> getRows() {
        return rows;
    }

    /**
     * @return true if the table has a {@code Well} column
     */
    public boolean hasWellColumn() {
        return wellColumn;
    }

    /**
     * @return rows dropped because all their numeric cells were zero
     */
    public int getRemovedZeroRows() {
        return removedZeroRows;
    }

    /**
     * @return wells listed more than once, with their row counts
     */
    public Map<String, Integer> getWellConflicts() {
        return wellConflicts;
    }

    /**
     * @return true if every row carries an ordinal
     */
    public boolean hasOrdinals() {
        if (rows.isEmpty()) {
            return false;
        }
        for (IndexRow row : rows) {
            if (row.ordinal() == null) {
                return false;
            }
        }
        return true;
    }
}
