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

import io.facsforge.transforms.ChannelTransforms;
import io.facsforge.transforms.LogicleParameters;
import io.facsforge.transforms.LogicleTransform;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.BitSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class EventMatrixCsvTest {

    @TempDir
    Path tempDir;

    @Test
    void readsHeaderAndRows() throws IOException {
        Path csv = tempDir.resolve("events.csv");
        Files.writeString(csv, "FSC-A,SSC-A,CD3\n1.5,2,-3e2\n\n4,5,6\n");

        EventMatrix matrix = EventMatrixCsv.read(csv);

        assertThat(matrix.channels()).containsExactly("FSC-A", "SSC-A", "CD3");
        assertThat(matrix.rowCount()).isEqualTo(2);
        assertThat(matrix.value(0, "CD3")).isEqualTo(-300.0);
        assertThat(matrix.column("FSC-A")).containsExactly(1.5, 4.0);
        assertThat(matrix.row(1)).containsExactly(4.0, 5.0, 6.0);
    }

    @Test
    void namesTheLineOfARaggedRow() throws IOException {
        Path csv = tempDir.resolve("ragged.csv");
        Files.writeString(csv, "A,B\n1,2\n3\n");

        assertThatThrownBy(() -> EventMatrixCsv.read(csv))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(":3:")
            .hasMessageContaining("expected 2 values");
    }

    @Test
    void namesTheColumnOfABadNumber() throws IOException {
        Path csv = tempDir.resolve("bad.csv");
        Files.writeString(csv, "A,B\n1,x\n");

        assertThatThrownBy(() -> EventMatrixCsv.read(csv))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(":2:")
            .hasMessageContaining("column B");
    }

    @Test
    void writesSelectedRowsRawOrTransformed() throws IOException {
        EventMatrix matrix = EventMatrix.builder("FSC-A", "CD3")
            .addRow(1, 0)
            .addRow(2, 1000)
            .addRow(3, 262144)
            .build();
        BitSet rows = new BitSet();
        rows.set(1);
        rows.set(2);
        ChannelTransforms transforms = ChannelTransforms.builder()
            .logicle("CD3", LogicleParameters.defaults())
            .build();

        Path raw = tempDir.resolve("raw.csv");
        EventMatrixCsv.write(raw, matrix, rows, transforms, false);
        EventMatrix rawBack = EventMatrixCsv.read(raw);
        assertThat(rawBack.rowCount()).isEqualTo(2);
        assertThat(rawBack.column("CD3")).containsExactly(1000.0, 262144.0);

        Path display = tempDir.resolve("display.csv");
        EventMatrixCsv.write(display, matrix, rows, transforms, true);
        EventMatrix displayBack = EventMatrixCsv.read(display);
        LogicleTransform logicle = LogicleTransform.create(LogicleParameters.defaults());
        assertThat(displayBack.value(0, "CD3")).isEqualTo(logicle.toDisplay(1000));
        assertThat(displayBack.value(1, "CD3")).isCloseTo(1.0, within(1e-12));
        assertThat(displayBack.column("FSC-A")).containsExactly(2.0, 3.0);
    }

    @Test
    void selectKeepsOrder() {
        EventMatrix matrix = EventMatrix.builder(List.of("A"))
            .addRow(10).addRow(11).addRow(12).addRow(13)
            .build();
        BitSet rows = new BitSet();
        rows.set(3);
        rows.set(1);
        assertThat(matrix.select(rows).column("A")).containsExactly(11.0, 13.0);
        assertThatThrownBy(() -> matrix.column("B")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withoutChannelsDropsColumns() {
        EventMatrix matrix = EventMatrix.builder("A", "Time", "B")
            .addRow(1, 100, 2)
            .addRow(3, 101, 4)
            .build();

        EventMatrix dropped = matrix.withoutChannels(List.of("Time", "missing"));

        assertThat(dropped.channels()).containsExactly("A", "B");
        assertThat(dropped.rowCount()).isEqualTo(2);
        assertThat(dropped.row(1)).containsExactly(3.0, 4.0);
        assertThat(matrix.withoutChannels(List.of("missing"))).isSameAs(matrix);
    }
}
