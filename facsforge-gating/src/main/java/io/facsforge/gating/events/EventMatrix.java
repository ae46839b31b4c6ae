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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable table of raw event values, one column per channel.
 *
 * <p>Values are stored column-major since gating reads one or two channels at a time
 * across all events.
 */
public final class EventMatrix {

    private final List<String> channels;
    private final Map<String, Integer> columnIndex;
    private final double[][] columns;
    private final int rowCount;

    private EventMatrix(List<String> channels, double[][] columns, int rowCount) {
        this.channels = Collections.unmodifiableList(new ArrayList<>(channels));
        this.columns = columns;
        this.rowCount = rowCount;
        this.columnIndex = new HashMap<>();
        for (int i = 0; i < channels.size(); i++) {
            if (columnIndex.put(channels.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate channel name: " + channels.get(i));
            }
        }
    }

    /**
     * @param channels column names in order
     * @return a row-at-a-time builder
     */
    public static Builder builder(List<String> channels) {
        return new Builder(channels);
    }

    /**
     * @param channels column names in order
     * @return a row-at-a-time builder
     */
    public static Builder builder(String... channels) {
        return new Builder(Arrays.asList(channels));
    }

    /**
     * @return channel names in column order
     */
    public List<String> channels() {
        return channels;
    }

    /**
     * @return the number of events
     */
    public int rowCount() {
        return rowCount;
    }

    /**
     * @param channel a channel name
     * @return true if the matrix has that column
     */
    public boolean hasChannel(String channel) {
        return columnIndex.containsKey(channel);
    }

    /**
     * @param channel a channel name
     * @return the column index
     * @throws IllegalArgumentException if the channel is absent
     */
    public int indexOf(String channel) {
        Integer index = columnIndex.get(channel);
        if (index == null) {
            throw new IllegalArgumentException("No such channel: " + channel);
        }
        return index;
    }

    /**
     * @param channel a channel name
     * @return a copy of the raw column
     */
    public double[] column(String channel) {
        return columns[indexOf(channel)].clone();
    }

    /**
     * @param row event index
     * @param channel a channel name
     * @return the raw value
     */
    public double value(int row, String channel) {
        return columns[indexOf(channel)][row];
    }

    /**
     * @param row event index
     * @param column column index
     * @return the raw value
     */
    public double value(int row, int column) {
        return columns[column][row];
    }

    /**
     * @param row event index
     * @return the raw values of that event in column order
     */
    public double[] row(int row) {
        Objects.checkIndex(row, rowCount);
        double[] values = new double[columns.length];
        for (int c = 0; c < columns.length; c++) {
            values[c] = columns[c][row];
        }
        return values;
    }

    /**
     * @param rows the events to keep
     * @return a new matrix holding only those rows, in order
     */
    public EventMatrix select(BitSet rows) {
        int count = rows.cardinality();
        if (count > 0 && rows.length() > rowCount) {
            throw new IndexOutOfBoundsException("Row " + (rows.length() - 1) + " out of " + rowCount);
        }
        double[][] selected = new double[columns.length][count];
        int out = 0;
        for (int r = rows.nextSetBit(0); r >= 0; r = rows.nextSetBit(r + 1)) {
            for (int c = 0; c < columns.length; c++) {
                selected[c][out] = columns[c][r];
            }
            out++;
        }
        return new EventMatrix(channels, selected, count);
    }

    /**
     * @param dropped channels to remove; names not in the matrix are ignored
     * @return a matrix without those columns, or this matrix if none of them is present
     */
    public EventMatrix withoutChannels(Collection<String> dropped) {
        List<String> kept = new ArrayList<>();
        List<double[]> keptColumns = new ArrayList<>();
        for (int c = 0; c < channels.size(); c++) {
            if (!dropped.contains(channels.get(c))) {
                kept.add(channels.get(c));
                keptColumns.add(columns[c]);
            }
        }
        if (kept.size() == channels.size()) {
            return this;
        }
        return new EventMatrix(kept, keptColumns.toArray(new double[0][]), rowCount);
    }

    @Override
    public String toString() {
        return "EventMatrix{" + rowCount + " events x " + channels + "}";
    }

    /**
     * Accumulates rows for an {@link EventMatrix}.
     */
    public static final class Builder {

        private final List<String> channels;
        private final List<double[]> rows = new ArrayList<>();

        private Builder(List<String> channels) {
            if (channels.isEmpty()) {
                throw new IllegalArgumentException("An event matrix needs at least one channel");
            }
            this.channels = new ArrayList<>(channels);
        }

        /**
         * @param values one raw value per channel
         * @return this builder
         */
        public Builder addRow(double... values) {
            if (values.length != channels.size()) {
                throw new IllegalArgumentException(
                    "Row has " + values.length + " values, expected " + channels.size());
            }
            rows.add(values.clone());
            return this;
        }

        /**
         * @return the number of rows added so far
         */
        public int size() {
            return rows.size();
        }

        public EventMatrix build() {
            double[][] columns = new double[channels.size()][rows.size()];
            for (int r = 0; r < rows.size(); r++) {
                double[] row = rows.get(r);
                for (int c = 0; c < row.length; c++) {
                    columns[c][r] = row[c];
                }
            }
            return new EventMatrix(channels, columns, rows.size());
        }
    }
}
