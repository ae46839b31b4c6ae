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

import io.facsforge.gating.events.EventMatrix;
import io.facsforge.gating.model.GateHierarchy;
import io.facsforge.gating.model.GateNode;
import io.facsforge.gating.model.GateShape;
import io.facsforge.gating.model.MarkerRules;
import io.facsforge.transforms.ChannelTransforms;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates a {@link GateHierarchy} against raw events.
 *
 * <p>The tree is walked depth-first. The root's candidates are all events and each
 * child's candidates are its parent's members, so a child is always a subset of its
 * parent. A candidate is a member when its display-scale point lies inside or on the
 * boundary of the node's shape and it passes the node's marker rules.
 *
 * <p>Each channel is transformed to display scale at most once per call. The engine
 * holds no state between calls and is safe to share between threads.
 */
public final class GatingEngine {

    private static final Logger logger = LogManager.getLogger(GatingEngine.class);

    /**
     * Evaluates with marker thresholds estimated from the matrix itself.
     *
     * @throws ChannelNotFoundException if any referenced channel is missing; nothing is evaluated
     */
    public GatingResult evaluate(GateHierarchy hierarchy, ChannelTransforms transforms, EventMatrix events) {
        checkChannels(hierarchy, events);
        Set<String> markerChannels = hierarchy.markerChannels();
        Map<String, Double> thresholds = markerChannels.isEmpty()
            ? Map.of() : ThresholdEstimator.estimate(events, markerChannels);
        return evaluate(hierarchy, transforms, events, thresholds);
    }

    /**
     * Evaluates with caller-supplied marker thresholds, in raw units.
     *
     * @throws ChannelNotFoundException if any referenced channel is missing, or a marker
     *                                  channel has no threshold
     */
    public GatingResult evaluate(GateHierarchy hierarchy, ChannelTransforms transforms, EventMatrix events,
                                 Map<String, Double> thresholds) {
        checkChannels(hierarchy, events);
        List<String> unthresholded = new ArrayList<>();
        for (String channel : hierarchy.markerChannels()) {
            if (!thresholds.containsKey(channel)) {
                unthresholded.add(channel);
            }
        }
        if (!unthresholded.isEmpty()) {
            throw new ChannelNotFoundException("No threshold for marker channel(s): "
                + String.join(", ", unthresholded), unthresholded);
        }

        int total = events.rowCount();
        Map<String, double[]> displayColumns = new HashMap<>();
        BitSet[] masks = new BitSet[hierarchy.size()];
        List<MembershipResult> results = new ArrayList<>(hierarchy.size());

        for (GateNode node : hierarchy.depthFirst()) {
            BitSet candidates;
            if (node.isRoot()) {
                candidates = new BitSet(total);
                candidates.set(0, total);
            } else {
                candidates = masks[node.parentId()];
            }
            BitSet mask = (BitSet) candidates.clone();
            if (node.shape() != null) {
                applyShape(node.shape(), mask, events, transforms, displayColumns);
            }
            if (!node.markerRules().isEmpty()) {
                applyMarkers(node.markerRules(), mask, events, thresholds);
            }
            masks[node.id()] = mask;
            int count = mask.cardinality();
            results.add(new MembershipResult(node.id(), node.name(), node.path(), mask, count,
                candidates.cardinality(), total));
            logger.debug("{}: {} of {} events", node.path(), count, candidates.cardinality());
        }
        return new GatingResult(total, results);
    }

    private static void checkChannels(GateHierarchy hierarchy, EventMatrix events) {
        Set<String> missing = new LinkedHashSet<>();
        for (String channel : hierarchy.channels()) {
            if (!events.hasChannel(channel)) {
                missing.add(channel);
            }
        }
        if (!missing.isEmpty()) {
            throw new ChannelNotFoundException(missing);
        }
    }

    private static void applyShape(GateShape shape, BitSet mask, EventMatrix events, ChannelTransforms transforms,
                                   Map<String, double[]> displayColumns) {
        List<String> channels = shape.channels();
        double[][] columns = new double[channels.size()][];
        for (int i = 0; i < columns.length; i++) {
            String channel = channels.get(i);
            columns[i] = displayColumns.computeIfAbsent(channel,
                ch -> transforms.forChannel(ch).toDisplay(events.column(ch)));
        }
        double[] point = new double[columns.length];
        for (int r = mask.nextSetBit(0); r >= 0; r = mask.nextSetBit(r + 1)) {
            for (int i = 0; i < columns.length; i++) {
                point[i] = columns[i][r];
            }
            if (!shape.contains(point)) {
                mask.clear(r);
            }
        }
    }

    private static void applyMarkers(MarkerRules rules, BitSet mask, EventMatrix events,
                                     Map<String, Double> thresholds) {
        for (String channel : rules.positive()) {
            int column = events.indexOf(channel);
            double threshold = thresholds.get(channel);
            for (int r = mask.nextSetBit(0); r >= 0; r = mask.nextSetBit(r + 1)) {
                if (!(events.value(r, column) > threshold)) {
                    mask.clear(r);
                }
            }
        }
        for (String channel : rules.negative()) {
            int column = events.indexOf(channel);
            double threshold = thresholds.get(channel);
            for (int r = mask.nextSetBit(0); r >= 0; r = mask.nextSetBit(r + 1)) {
                if (!(events.value(r, column) <= threshold)) {
                    mask.clear(r);
                }
            }
        }
    }
}
