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

import com.google.gson.Gson;
import io.facsforge.command.CMD_facsforge;
import io.facsforge.command.common.VerbosityOption;
import io.facsforge.gating.engine.BatchGatingRunner;
import io.facsforge.gating.engine.GatingEngine;
import io.facsforge.gating.engine.GatingResult;
import io.facsforge.gating.engine.MembershipResult;
import io.facsforge.gating.engine.PopulationNames;
import io.facsforge.gating.engine.PopulationStatistics;
import io.facsforge.gating.events.Csv;
import io.facsforge.gating.events.EventMatrix;
import io.facsforge.gating.events.EventMatrixCsv;
import io.facsforge.gating.json.GatingGsonConfig;
import io.facsforge.gating.json.RenderInput;
import io.facsforge.gating.model.GateHierarchy;
import io.facsforge.gating.model.GateNode;
import io.facsforge.gating.overlay.IndexCsv;
import io.facsforge.gating.overlay.IndexOverlayMatcher;
import io.facsforge.gating.overlay.IndexTable;
import io.facsforge.gating.overlay.OverlayResult;
import io.facsforge.transforms.ChannelTransforms;
import io.facsforge.workspace.config.ExperimentConfig;
import io.facsforge.workspace.config.ExperimentConfigs;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 # Gate event tables

 Evaluates the configuration's gate hierarchy against one or more event tables and
 writes, per sample:

 - `gated_<population>.csv`: the member events of each population
 - `populations.json`: counts and frequencies
 - `overlay_<population>.json` and `render_<population>.json` when `--index` is given

 With several samples each gets its own subdirectory named after the file stem, and
 `merged/gated_<population>.csv` holds every sample's members behind a `sample_id`
 column.

 # Basic Usage
 ```
 analyze tube_01.csv tube_02.csv -c facsforge.yaml -o out --threads 4
 analyze sorted.csv -c facsforge.yaml --index index.csv --overlay-population Helper
 ```
 */
@CommandLine.Command(name = "analyze",
    header = "Gate event tables and write per-population outputs",
    description = "Evaluates the gate hierarchy of a configuration against CSV event tables.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "1: invalid input or configuration", "2: unexpected failure"})
public class CMD_analyze implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_analyze.class);

    static final String MERGED_DIR = "merged";
    static final String SAMPLE_ID_COLUMN = "sample_id";

    @CommandLine.Parameters(arity = "1..*", paramLabel = "<events.csv>", description = "Event tables to gate")
    private List<Path> inputs = new ArrayList<>();

    @CommandLine.Option(names = {"-c", "--config"}, required = true, description = "Experiment configuration")
    private Path configPath;

    @CommandLine.Option(names = {"-o", "--output-dir"}, defaultValue = "analysis_out",
        description = "Output directory (default: ${DEFAULT-VALUE})")
    private Path outputDir;

    @CommandLine.Option(names = {"--transformed"},
        description = "Write display-scale values instead of raw values")
    private boolean transformed = false;

    @CommandLine.Option(names = {"--index"}, description = "Index-sort table to overlay on a gate plot")
    private Path indexPath;

    @CommandLine.Option(names = {"--overlay-population"},
        description = "Celltype or population path whose plot gets the overlay "
            + "(default: the first celltype of interest)")
    private String overlayPopulation;

    @CommandLine.Option(names = {"-t", "--threads"},
        description = "Samples gated in parallel (default: available processors)")
    private int threads = Runtime.getRuntime().availableProcessors();

    @CommandLine.Option(names = {"--tolerance"}, defaultValue = "" + IndexOverlayMatcher.DEFAULT_TOLERANCE,
        description = "Relative tolerance for matching index rows to events (default: ${DEFAULT-VALUE})")
    private double tolerance = IndexOverlayMatcher.DEFAULT_TOLERANCE;

    @CommandLine.Mixin
    private VerbosityOption verbosity = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws IOException {
        verbosity.apply();
        ExperimentConfig config = ExperimentConfigs.load(configPath);
        GateHierarchy hierarchy = config.getHierarchy();
        ChannelTransforms transforms = config.getTransforms();

        Map<String, EventMatrix> samples = readSamples(config);
        String overlayPath = null;
        IndexTable index = null;
        if (indexPath != null) {
            overlayPath = resolveOverlayPopulation(config);
            index = IndexCsv.read(indexPath);
        }

        Map<String, GatingResult> results = new BatchGatingRunner(new GatingEngine(), threads)
            .run(hierarchy, transforms, samples);

        boolean several = samples.size() > 1;
        for (Map.Entry<String, GatingResult> entry : results.entrySet()) {
            String sampleId = entry.getKey();
            Path dir = several ? outputDir.resolve(sampleId) : outputDir;
            writeSample(dir, hierarchy, transforms, samples.get(sampleId), entry.getValue());
            if (index != null) {
                writeOverlay(dir, hierarchy, transforms, samples.get(sampleId), entry.getValue(), overlayPath, index);
            }
        }
        if (several) {
            writeMerged(hierarchy, transforms, samples, results);
        }
        if (verbosity.showNormalOutput()) {
            printSummary(spec.commandLine().getOut(), results);
        }
        return CMD_facsforge.EXIT_SUCCESS;
    }

    private Map<String, EventMatrix> readSamples(ExperimentConfig config) throws IOException {
        Map<String, EventMatrix> samples = new LinkedHashMap<>();
        for (Path input : inputs) {
            String sampleId = sampleId(input);
            if (samples.containsKey(sampleId)) {
                throw new IllegalArgumentException("Two inputs share the sample id '" + sampleId + "': " + inputs);
            }
            EventMatrix matrix = EventMatrixCsv.read(input).withoutChannels(config.getIgnoredMarkers());
            logger.info("Sample {}: {}", sampleId, matrix);
            samples.put(sampleId, matrix);
        }
        return samples;
    }

    /**
     * @param input an event table
     * @return the file name without its extension
     */
    static String sampleId(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private String resolveOverlayPopulation(ExperimentConfig config) {
        String requested = overlayPopulation;
        if (requested == null) {
            List<String> interesting = config.pathsOfInterest();
            if (interesting.isEmpty()) {
                throw new IllegalArgumentException(
                    "--index needs --overlay-population or a celltype in celltypes_of_interest");
            }
            requested = interesting.get(0);
        }
        String path = config.pathOf(requested).orElse(requested);
        GateNode node = config.getHierarchy().findByPath(path)
            .orElseThrow(() -> new IllegalArgumentException("No population '" + path + "' to overlay"));
        if (node.shape() == null || node.shape().channels().size() != 2) {
            throw new IllegalArgumentException("Population '" + path + "' has no two-channel gate to overlay on");
        }
        return path;
    }

    private void writeSample(Path dir, GateHierarchy hierarchy, ChannelTransforms transforms, EventMatrix matrix,
                             GatingResult result) throws IOException {
        Files.createDirectories(dir);
        for (MembershipResult population : result.getPopulations()) {
            if (!isWritten(hierarchy, population)) {
                continue;
            }
            Path file = dir.resolve("gated_" + PopulationNames.fileStem(population.path()) + ".csv");
            EventMatrixCsv.write(file, matrix, population.mask(), transforms, transformed);
        }
        writeJson(dir.resolve("populations.json"), PopulationStatistics.from(result));
    }

    private void writeOverlay(Path dir, GateHierarchy hierarchy, ChannelTransforms transforms, EventMatrix matrix,
                              GatingResult result, String path, IndexTable index) throws IOException {
        GateNode node = hierarchy.findByPath(path).orElseThrow();
        List<String> channels = node.shape().channels();
        MembershipResult population = result.byPath(path).orElseThrow();
        OverlayResult overlay = new IndexOverlayMatcher(tolerance)
            .match(matrix, population.mask(), channels.get(0), channels.get(1), transforms, index);
        if (!overlay.getUnmatched().isEmpty()) {
            logger.warn("{} index row(s) were not matched to events of {}", overlay.getUnmatched().size(), path);
        }
        String stem = PopulationNames.fileStem(path);
        writeJson(dir.resolve("overlay_" + stem + ".json"), overlay);
        writeJson(dir.resolve("render_" + stem + ".json"),
            RenderInput.forPopulation(hierarchy, result, path, matrix, transforms, overlay));
    }

    private void writeMerged(GateHierarchy hierarchy, ChannelTransforms transforms, Map<String, EventMatrix> samples,
                             Map<String, GatingResult> results) throws IOException {
        List<String> channels = null;
        for (Map.Entry<String, EventMatrix> sample : samples.entrySet()) {
            if (channels == null) {
                channels = sample.getValue().channels();
            } else if (!channels.equals(sample.getValue().channels())) {
                logger.warn("Not merging samples: {} has channels {}, expected {}", sample.getKey(),
                    sample.getValue().channels(), channels);
                return;
            }
        }
        Path dir = outputDir.resolve(MERGED_DIR);
        Files.createDirectories(dir);
        List<String> header = new ArrayList<>();
        header.add(SAMPLE_ID_COLUMN);
        header.addAll(channels);
        for (GateNode node : hierarchy.depthFirst()) {
            if (node.isRoot() && node.shape() == null) {
                continue;
            }
            Path file = dir.resolve("gated_" + PopulationNames.fileStem(node.path()) + ".csv");
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                writer.write(Csv.join(header));
                writer.newLine();
                for (Map.Entry<String, GatingResult> entry : results.entrySet()) {
                    EventMatrixCsv.writeRows(writer, entry.getKey(), samples.get(entry.getKey()),
                        entry.getValue().byId(node.id()).mask(), transforms, transformed);
                }
            }
        }
        logger.info("Wrote merged populations of {} samples to {}", samples.size(), dir);
    }

    private static boolean isWritten(GateHierarchy hierarchy, MembershipResult population) {
        GateNode node = hierarchy.node(population.id());
        return !(node.isRoot() && node.shape() == null);
    }

    private static void writeJson(Path file, Object value) throws IOException {
        Gson gson = GatingGsonConfig.gson();
        Files.writeString(file, gson.toJson(value), StandardCharsets.UTF_8);
        logger.debug("Wrote {}", file);
    }

    private static void printSummary(PrintWriter out, Map<String, GatingResult> results) {
        for (Map.Entry<String, GatingResult> entry : results.entrySet()) {
            PopulationStatistics statistics = PopulationStatistics.from(entry.getValue());
            out.printf("%s: %d events%n", entry.getKey(), statistics.getTotalEvents());
            for (PopulationStatistics.Row row : statistics.getRows()) {
                out.printf("  %-40s %8d  %6.2f%% of parent  %6.2f%% of total%n", row.path(), row.count(),
                    row.percentParent(), row.percentTotal());
            }
        }
        out.flush();
    }
}
