package io.facsforge.command.analyze;

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

import io.facsforge.command.CommandRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CMD_analyzeTest {

    private static final String CONFIG = """
        metadata: {experiment_name: cli test}
        panel:
          FSC-A: {role: scatter-linear}
          SSC-A: {role: scatter-linear}
          CD3: {fluor: FITC, transform: {type: linear}}
          Time: {ignore: true}
        celltypes:
          Cells:
            gate: {type: rectangle, channels: [FSC-A, SSC-A], vertices: [[100, 100], [1000, 1000]]}
          Cells/T:
            parent: Cells
            gate: {type: threshold, channel: CD3, min: 500}
        celltypes_of_interest: [Cells/T]
        """;

    // rows 2, 3 and 5 are Cells; rows 3 and 5 are also T
    private static final String EVENTS = """
        FSC-A,SSC-A,CD3,Time
        50,50,900,1
        200,200,100,2
        300,300,800,3
        2000,500,900,4
        500,500,600,5
        """;

    @TempDir
    Path tempDir;

    private Path config;
    private Path out;

    @BeforeEach
    void writeConfig() throws IOException {
        config = Files.writeString(tempDir.resolve("config.yaml"), CONFIG);
        out = tempDir.resolve("out");
    }

    @Test
    void writesGatedEventsAndStatistics() throws IOException {
        Path events = Files.writeString(tempDir.resolve("tube_01.csv"), EVENTS);

        CommandRunner.Result result = CommandRunner.run("analyze", events.toString(),
            "-c", config.toString(), "-o", out.toString(), "--threads", "1");

        assertThat(result.exitCode()).as(result.err()).isZero();
        List<String> cells = Files.readAllLines(out.resolve("gated_Cells.csv"));
        assertThat(cells).containsExactly(
            "FSC-A,SSC-A,CD3",
            "200.0,200.0,100.0",
            "300.0,300.0,800.0",
            "500.0,500.0,600.0");
        assertThat(Files.readAllLines(out.resolve("gated_Cells__T.csv"))).hasSize(3);
        assertThat(Files.readString(out.resolve("populations.json")))
            .contains("\"totalEvents\": 5")
            .contains("\"path\": \"Cells/T\"");
        assertThat(result.out()).contains("tube_01: 5 events", "Cells/T");
    }

    @Test
    void transformedOutputUsesDisplayValues() throws IOException {
        Path events = Files.writeString(tempDir.resolve("tube_01.csv"), EVENTS);

        CommandRunner.Result result = CommandRunner.run("analyze", events.toString(),
            "-c", config.toString(), "-o", out.toString(), "--transformed", "-q");

        assertThat(result.exitCode()).as(result.err()).isZero();
        assertThat(result.out()).isEmpty();
        // linear channels display their raw values
        assertThat(Files.readAllLines(out.resolve("gated_Cells__T.csv")))
            .contains("300.0,300.0,800.0");
    }

    @Test
    @DisplayName("several samples get their own directories and merged tables")
    void severalSamples() throws IOException {
        Path first = Files.writeString(tempDir.resolve("tube_01.csv"), EVENTS);
        Path second = Files.writeString(tempDir.resolve("tube_02.csv"), """
            FSC-A,SSC-A,CD3,Time
            400,400,700,1
            """);

        CommandRunner.Result result = CommandRunner.run("analyze", first.toString(), second.toString(),
            "-c", config.toString(), "-o", out.toString());

        assertThat(result.exitCode()).as(result.err()).isZero();
        assertThat(out.resolve("tube_01").resolve("gated_Cells.csv")).exists();
        assertThat(out.resolve("tube_02").resolve("populations.json")).exists();
        assertThat(Files.readAllLines(out.resolve("merged").resolve("gated_Cells__T.csv"))).containsExactly(
            "sample_id,FSC-A,SSC-A,CD3",
            "tube_01,300.0,300.0,800.0",
            "tube_01,500.0,500.0,600.0",
            "tube_02,400.0,400.0,700.0");
    }

    @Test
    void missingGateChannelIsAnInputError() throws IOException {
        Path events = Files.writeString(tempDir.resolve("tube_01.csv"), "FSC-A,SSC-A\n1,2\n");

        CommandRunner.Result result = CommandRunner.run("analyze", events.toString(),
            "-c", config.toString(), "-o", out.toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("CD3");
    }

    @Test
    void invalidConfigurationIsAnInputError() throws IOException {
        Path events = Files.writeString(tempDir.resolve("tube_01.csv"), EVENTS);
        Files.writeString(config, "metadata: {}\n");

        CommandRunner.Result result = CommandRunner.run("analyze", events.toString(),
            "-c", config.toString(), "-o", out.toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("experiment_name");
    }

    @Test
    void verboseAndQuietTogetherAreAnInputError() throws IOException {
        Path events = Files.writeString(tempDir.resolve("tube_01.csv"), EVENTS);

        CommandRunner.Result result = CommandRunner.run("analyze", events.toString(),
            "-c", config.toString(), "-o", out.toString(), "-v", "-q");

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("--verbose and --quiet");
    }

    @Nested
    class WithIndexTable {

        private Path events;
        private Path index;

        @BeforeEach
        void writeInputs() throws IOException {
            events = Files.writeString(tempDir.resolve("sorted.csv"), EVENTS);
            index = Files.writeString(tempDir.resolve("index.csv"), """
                Plate: P1
                Well,FSC-A,SSC-A
                A1,300,300
                A2,201,200
                """);
        }

        @Test
        void writesOverlayAndRenderInput() throws IOException {
            CommandRunner.Result result = CommandRunner.run("analyze", events.toString(),
                "-c", config.toString(), "-o", out.toString(),
                "--index", index.toString(), "--overlay-population", "Cells");

            assertThat(result.exitCode()).as(result.err()).isZero();
            assertThat(Files.readString(out.resolve("overlay_Cells.json")))
                .contains("CHANNEL_NEAREST")
                .contains("\"A1\"")
                .contains("\"A2\"");
            assertThat(Files.readString(out.resolve("render_Cells.json")))
                .contains("\"population\": \"Cells\"")
                .contains("\"labels\"");
        }

        @Test
        void overlayNeedsATwoChannelGate() {
            CommandRunner.Result result = CommandRunner.run("analyze", events.toString(),
                "-c", config.toString(), "-o", out.toString(),
                "--index", index.toString());

            assertThat(result.exitCode()).isEqualTo(1);
            assertThat(result.err()).contains("no two-channel gate");
        }
    }

    @Test
    void sampleIdIsTheFileStem() {
        assertThat(CMD_analyze.sampleId(Path.of("data", "tube_01.csv"))).isEqualTo("tube_01");
        assertThat(CMD_analyze.sampleId(Path.of("tube.02.csv"))).isEqualTo("tube.02");
        assertThat(CMD_analyze.sampleId(Path.of("README"))).isEqualTo("README");
    }
}
