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

import io.facsforge.gating.events.Csv;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads index-sort CSV exports.
 *
 * <p>Sorter exports open with free-form metadata lines; the table starts at the first
 * line beginning with {@code Well,}. Files without such a line are read as plain CSV
 * from the first non-blank line. A column is numeric when every non-blank cell in it
 * parses as a number. Rows whose numeric cells are all zero or blank are empty wells
 * and are dropped.
 */
public final class IndexCsv {

    private static final Logger logger = LogManager.getLogger(IndexCsv.class);

    private static final Set<String> ORDINAL_COLUMNS = Set.of("event", "eventid", "eventindex");
    private static final String WELL_COLUMN = "well";

    private IndexCsv() {
    }

    /**
     * @param path an index CSV
     * @return the parsed table
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file has no header
     */
    public static IndexTable read(Path path) throws IOException {
        IndexTable table = parse(Files.readAllLines(path, StandardCharsets.UTF_8), path.toString());
        logger.info("Loaded index CSV {}: {} rows, removed {} zero rows", path, table.getRows().size(),
            table.getRemovedZeroRows());
        if (!table.getWellConflicts().isEmpty()) {
            logger.warn("Well conflicts in {}: {}", path, table.getWellConflicts());
        }
        return table;
    }

    /**
     * @param lines  file content
     * @param source name used in messages
     * @return the parsed table
     */
    public static IndexTable parse(List<String> lines, String source) {
        int headerLine = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).startsWith("Well,")) {
                headerLine = i;
                break;
            }
        }
        if (headerLine < 0) {
            for (int i = 0; i < lines.size(); i++) {
                if (!lines.get(i).isBlank()) {
                    headerLine = i;
                    break;
                }
            }
        }
        if (headerLine < 0) {
            throw new IllegalArgumentException(source + ": no header row");
        }

        List<String> columns = new ArrayList<>();
        for (String name : Csv.split(lines.get(headerLine))) {
            columns.add(IndexTable.normalize(name));
        }
        int wellIndex = -1;
        int ordinalIndex = -1;
        for (int c = 0; c < columns.size(); c++) {
            String lower = columns.get(c).toLowerCase(Locale.ROOT);
            if (wellIndex < 0 && lower.equals(WELL_COLUMN)) {
                wellIndex = c;
            } else if (ordinalIndex < 0 && ORDINAL_COLUMNS.contains(lower)) {
                ordinalIndex = c;
            }
        }

        List<List<String>> cells = new ArrayList<>();
        for (int i = headerLine + 1; i < lines.size(); i++) {
            if (!lines.get(i).isBlank()) {
                cells.add(Csv.split(lines.get(i)));
            }
        }

        boolean[] numeric = new boolean[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            numeric[c] = c != wellIndex;
            for (List<String> row : cells) {
                String cell = cell(row, c);
                if (!cell.isEmpty() && parse(cell) == null) {
                    numeric[c] = false;
                    break;
                }
            }
        }

        List<IndexRow> rows = new ArrayList<>();
        int removed = 0;
        for (List<String> row : cells) {
            Map<String, Double> values = new HashMap<>();
            boolean allZero = true;
            for (int c = 0; c < columns.size(); c++) {
                if (!numeric[c]) {
                    continue;
                }
                Double value = parse(cell(row, c));
                if (value != null) {
                    values.put(columns.get(c), value);
                    if (value != 0.0) {
                        allZero = false;
                    }
                }
            }
            if (allZero) {
                removed++;
                continue;
            }
            String well = wellIndex < 0 ? null : cell(row, wellIndex);
            Long ordinal = null;
            if (ordinalIndex >= 0) {
                Double value = parse(cell(row, ordinalIndex));
                ordinal = value == null ? null : (long) value.doubleValue();
            }
            rows.add(new IndexRow(well, ordinal, values));
        }
        return new IndexTable(columns, rows, wellIndex >= 0, removed);
    }

    private static String cell(List<String> row, int column) {
        return column < row.size() ? row.get(column).trim() : "";
    }

    private static Double parse(String cell) {
        if (cell.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(cell);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
