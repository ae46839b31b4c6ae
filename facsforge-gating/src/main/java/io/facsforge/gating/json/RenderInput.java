package io.facsforge.gating.json;

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

import com.google.gson.annotations.SerializedName;
import io.facsforge.gating.engine.GatingResult;
import io.facsforge.gating.events.EventMatrix;
import io.facsforge.gating.model.GateHierarchy;
import io.facsforge.gating.model.GateNode;
import io.facsforge.gating.model.InvalidHierarchyException;
import io.facsforge.gating.model.Vertex;
import io.facsforge.gating.overlay.OverlayPoint;
import io.facsforge.gating.overlay.OverlayResult;
import io.facsforge.transforms.ChannelTransform;
import io.facsforge.transforms.ChannelTransforms;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Everything a plot of one gate needs, in display units.
 *
 * <p>The plot shows the parent population's events with the gate outline drawn over
 * them, the way FlowJo lays out a gate. Overlay labels, when present, sit on the
 * matched events.
 */
public final class RenderInput {

    /** Label drawn at a matched event. */
    public static final class Label {
        @SerializedName("text")
        private final String text;
        @SerializedName("x")
        private final double x;
        @SerializedName("y")
        private final double y;

        Label(String text, double x, double y) {
            this.text = text;
            this.x = x;
            this.y = y;
        }

        public String getText() {
            return text;
        }

        public double getX() {
            return x;
        }

        public double getY() {
            return y;
        }
    }

    @SerializedName("population")
    private final String population;
    @SerializedName("channels")
    private final List<String> channels;
    @SerializedName("outline")
    private final List<Vertex> outline;
    @SerializedName("events")
    private final List<double[]> events;
    @SerializedName("match_mode")
    private final String matchMode;
    @SerializedName("fallback_report")
    private final String fallbackReport;
    @SerializedName("labels")
    private final List<Label> labels;

    private RenderInput(String population, List<String> channels, List<Vertex> outline, List<double[]> events,
                        String matchMode, String fallbackReport, List<Label> labels) {
        this.population = population;
        this.channels = channels;
        this.outline = outline;
        this.events = events;
        this.matchMode = matchMode;
        this.fallbackReport = fallbackReport;
        this.labels = labels;
    }

    /**
     * @param hierarchy  the evaluated hierarchy
     * @param result     its gating result
     * @param path       population whose gate is drawn
     * @param matrix     raw events
     * @param transforms display transforms
     * @param overlay    overlay for this population, or null
     * @return the rendering input
     * @throws InvalidHierarchyException if the population is unknown or has no gate
     */
    public static RenderInput forPopulation(GateHierarchy hierarchy, GatingResult result, String path,
                                            EventMatrix matrix, ChannelTransforms transforms,
                                            OverlayResult overlay) {
        GateNode node = hierarchy.findByPath(path)
            .orElseThrow(() -> new InvalidHierarchyException("No population '" + path + "'"));
        if (node.shape() == null) {
            throw new InvalidHierarchyException("Population '" + path + "' has no gate to draw");
        }
        List<String> channels = node.shape().channels();
        BitSet shown = node.isRoot() ? allEvents(matrix.rowCount()) : result.byId(node.parentId()).mask();

        double[][] display = new double[channels.size()][];
        for (int c = 0; c < channels.size(); c++) {
            ChannelTransform transform = transforms.forChannel(channels.get(c));
            display[c] = transform.toDisplay(matrix.column(channels.get(c)));
        }
        List<double[]> points = new ArrayList<>(shown.cardinality());
        for (int r = shown.nextSetBit(0); r >= 0; r = shown.nextSetBit(r + 1)) {
            double[] point = new double[channels.size()];
            for (int c = 0; c < point.length; c++) {
                point[c] = display[c][r];
            }
            points.add(point);
        }

        List<Label> labels = new ArrayList<>();
        String mode = null;
        String report = null;
        if (overlay != null) {
            mode = overlay.getMode().name();
            report = overlay.fallbackReport().orElse(null);
            for (OverlayPoint point : overlay.getPoints()) {
                if (point.well() != null) {
                    labels.add(new Label(point.well(), point.x(), point.y()));
                }
            }
        }
        return new RenderInput(node.path(), channels, node.shape().outline(), points, mode, report, labels);
    }

    private static BitSet allEvents(int count) {
        BitSet all = new BitSet(count);
        all.set(0, count);
        return all;
    }

    public String getPopulation() {
        return population;
    }

    public List<String> getChannels() {
        return channels;
    }

    public List<Vertex> getOutline() {
        return outline;
    }

    public List<double[]> getEvents() {
        return events;
    }

    public String getMatchMode() {
        return matchMode;
    }

    public String getFallbackReport() {
        return fallbackReport;
    }

    public List<Label> getLabels() {
        return labels;
    }
}
