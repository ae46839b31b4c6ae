package io.facsforge.gating.events;

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

import io.facsforge.transforms.ChannelTransform;
import io.facsforge.transforms.ChannelTransforms;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Reads and writes event matrices as CSV with a header row of channel names.
 */
public final class EventMatrixCsv {

    private static final Logger logger = LogManager.getLogger(EventMatrixCsv.class);

    private EventMatrixCsv() {
    }

    /**
     * @param path a CSV file whose first line names the channels
     * @return the parsed matrix
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException on a ragged row or a non-numeric value, naming the line
     */
    public static EventMatrix read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String header = reader.readLine();
            if (header == null || header.isBlank()) {
                throw new IllegalArgumentException(path + ": missing header row");
            }
            List<String> channels = new ArrayList<>();
            for (String name : Csv.split(stripBom(header))) {
                channels.add(name.trim());
            }
            EventMatrix.Builder builder = EventMatrix.builder(channels);
            int lineNumber = 1;
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                List<String> fields = Csv.split(line);
                if (fields.size() != channels.size()) {
                    throw new IllegalArgumentException(path + ":" + lineNumber + ": expected "
                        + channels.size() + " values, found " + fields.size());
                }
                double[] values = new double[fields.size()];
                for (int i = 0; i < values.length; i++) {
                    try {
                        values[i] = Double.parseDouble(fields.get(i).trim());
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException(path + ":" + lineNumber + ": '" + fields.get(i)
                            + "' in column " + channels.get(i) + " is not a number", e);
                    }
                }
                builder.addRow(values);
            }
            EventMatrix matrix = builder.build();
            logger.debug("Read {} from {}", matrix, path);
            return matrix;
        }
    }

    /**
     * Writes the selected events.
     *
     * @param path        output file, replaced if present
     * @param matrix      source events
     * @param rows        events to write
     * @param transforms  channel transforms, used when {@code transformed} is set
     * @param transformed write display values instead of raw values
     * @throws IOException if the file cannot be written
     */
    public static void write(Path path, EventMatrix matrix, BitSet rows, ChannelTransforms transforms,
                             boolean transformed) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(Csv.join(matrix.channels()));
            writer.newLine();
            writeRows(writer, null, matrix, rows, transforms, transformed);
        }
        logger.debug("Wrote {} events to {}", rows.cardinality(), path);
    }

    /**
     * Writes rows without a header, optionally prefixed by a label column.
     *
     * @param out         destination
     * @param label       value of the leading column, or null for none
     * @param matrix      source events
     * @param rows        events to write
     * @param transforms  channel transforms
     * @param transformed write display values instead of raw values
     * @throws IOException on write failure
     */
    public static void writeRows(Appendable out, String label, EventMatrix matrix, BitSet rows,
                                 ChannelTransforms transforms, boolean transformed) throws IOException {
        List<String> channels = matrix.channels();
        ChannelTransform[] perColumn = new ChannelTransform[channels.size()];
        for (int c = 0; c < perColumn.length; c++) {
            perColumn[c] = transforms.forChannel(channels.get(c));
        }
        String prefix = label == null ? "" : Csv.quote(label) + ",";
        StringBuilder line = new StringBuilder();
        for (int r = rows.nextSetBit(0); r >= 0; r = rows.nextSetBit(r + 1)) {
            line.setLength(0);
            line.append(prefix);
            for (int c = 0; c < perColumn.length; c++) {
                if (c > 0) {
                    line.append(',');
                }
                double raw = matrix.value(r, c);
                line.append(transformed ? perColumn[c].toDisplay(raw) : raw);
            }
            line.append(System.lineSeparator());
            out.append(line);
        }
    }

    private static String stripBom(String header) {
        return !header.isEmpty() && header.charAt(0) == '\uFEFF' ? header.substring(1) : header;
    }
}
