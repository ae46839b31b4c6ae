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

import io.facsforge.gating.events.EventMatrix;
import io.facsforge.transforms.ChannelTransform;
import io.facsforge.transforms.ChannelTransforms;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Pairs index-sort rows with gated events to place well labels on a plot.
 *
 * <p>When the index table carries both gating channels, each row goes to the gated
 * event nearest to it. The distance per channel is relative,
 * {@code |event - row| / max(|row|, 1)}, in raw units, and the larger of the two is
 * compared to the tolerance. Sorter software rounds recorded values, so exact equality
 * is never required.
 *
 * <p>Otherwise, when every row records an event id, each row goes to the event at that
 * 0-based row number, provided the event is in the population. Without event ids rows are
 * paired with gated events by position. Either fallback is reported in the result and logged.
 */
public final class IndexOverlayMatcher {

    private static final Logger logger = LogManager.getLogger(IndexOverlayMatcher.class);

    /** Default relative tolerance. */
    public static final double DEFAULT_TOLERANCE = 0.01;

    private final double tolerance;

    public IndexOverlayMatcher() {
        this(DEFAULT_TOLERANCE);
    }

    /**
     * @param tolerance largest accepted relative distance, non-negative
     */
    public IndexOverlayMatcher(double tolerance) {
        if (!(tolerance >= 0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("tolerance must be finite and non-negative, was " + tolerance);
        }
        this.tolerance = tolerance;
    }

    /**
     * @param events     source events, raw
     * @param population members of the population the plot shows
     * @param xChannel   plot x channel
     * @param yChannel   plot y channel
     * @param transforms transforms used for the plotted coordinates
     * @param index      index-sort rows
     * @return overlay points with the mode that produced them
     */
    public OverlayResult match(EventMatrix events, BitSet population, String xChannel, String yChannel,
                               ChannelTransforms transforms, IndexTable index) {
        int xColumn = events.indexOf(xChannel);
        int yColumn = events.indexOf(yChannel);
        ChannelTransform xTransform = transforms.forChannel(xChannel);
        ChannelTransform yTransform = transforms.forChannel(yChannel);

        if (index.hasColumn(xChannel) && index.hasColumn(yChannel)) {
            return matchByChannel(events, population, xChannel, yChannel, xColumn, yColumn, xTransform, yTransform,
                index);
        }
        if (index.hasOrdinals()) {
            return matchByEventId(events, population, xChannel, yChannel, xColumn, yColumn, xTransform, yTransform,
                index);
        }
        return matchByPosition(events, population, xChannel, yChannel, xColumn, yColumn, xTransform, yTransform,
            index);
    }

    private OverlayResult matchByChannel(EventMatrix events, BitSet population, String xChannel, String yChannel,
                                         int xColumn, int yColumn, ChannelTransform xTransform,
                                         ChannelTransform yTransform, IndexTable index) {
        List<OverlayPoint> points = new ArrayList<>();
        List<IndexRow> unmatched = new ArrayList<>();
        for (IndexRow row : index.getRows()) {
            if (!row.hasValue(xChannel) || !row.hasValue(yChannel)) {
                unmatched.add(row);
                continue;
            }
            double rowX = row.value(xChannel);
            double rowY = row.value(yChannel);
            int best = -1;
            double bestDistance = Double.POSITIVE_INFINITY;
            for (int e = population.nextSetBit(0); e >= 0; e = population.nextSetBit(e + 1)) {
                double distance = Math.max(
                    relative(events.value(e, xColumn), rowX),
                    relative(events.value(e, yColumn), rowY));
                if (distance < bestDistance) {
                    bestDistance = distance;
                    best = e;
                }
            }
            if (best < 0 || bestDistance > tolerance) {
                unmatched.add(row);
            } else {
                points.add(new OverlayPoint(row.well(), best,
                    xTransform.toDisplay(events.value(best, xColumn)),
                    yTransform.toDisplay(events.value(best, yColumn)),
                    bestDistance));
            }
        }
        logger.debug("Matched {} of {} index rows on {}/{}", points.size(), index.getRows().size(), xChannel,
            yChannel);
        return new OverlayResult(MatchMode.CHANNEL_NEAREST, null, points, unmatched);
    }

    private OverlayResult matchByEventId(EventMatrix events, BitSet population, String xChannel, String yChannel,
                                         int xColumn, int yColumn, ChannelTransform xTransform,
                                         ChannelTransform yTransform, IndexTable index) {
        List<OverlayPoint> points = new ArrayList<>();
        List<IndexRow> unmatched = new ArrayList<>();
        for (IndexRow row : index.getRows()) {
            long ordinal = row.ordinal();
            if (ordinal < 0 || ordinal >= events.rowCount() || !population.get((int) ordinal)) {
                unmatched.add(row);
                continue;
            }
            int e = (int) ordinal;
            points.add(new OverlayPoint(row.well(), e,
                xTransform.toDisplay(events.value(e, xColumn)),
                yTransform.toDisplay(events.value(e, yColumn)),
                Double.NaN));
        }
        String report = String.format(
            "Index table has no %s/%s columns; matched %d of %d row(s) to gated events by event id"
                + " (%d gated events, %d row(s) unmatched)",
            xChannel, yChannel, points.size(), index.getRows().size(), population.cardinality(), unmatched.size());
        logger.warn("{}", report);
        return new OverlayResult(MatchMode.EVENT_ID, report, points, unmatched);
    }

    private OverlayResult matchByPosition(EventMatrix events, BitSet population, String xChannel, String yChannel,
                                          int xColumn, int yColumn, ChannelTransform xTransform,
                                          ChannelTransform yTransform, IndexTable index) {
        List<IndexRow> rows = index.getRows();
        List<OverlayPoint> points = new ArrayList<>();
        List<IndexRow> unmatched = new ArrayList<>();
        int e = population.nextSetBit(0);
        for (IndexRow row : rows) {
            if (e < 0) {
                unmatched.add(row);
                continue;
            }
            points.add(new OverlayPoint(row.well(), e,
                xTransform.toDisplay(events.value(e, xColumn)),
                yTransform.toDisplay(events.value(e, yColumn)),
                Double.NaN));
            e = population.nextSetBit(e + 1);
        }
        String report = String.format(
            "Index table has no %s/%s columns; matched %d of %d row(s) to gated events by file order"
                + " (%d gated events, %d row(s) unmatched)",
            xChannel, yChannel, points.size(), rows.size(), population.cardinality(), unmatched.size());
        logger.warn("{}", report);
        return new OverlayResult(MatchMode.POSITIONAL, report, points, unmatched);
    }

    private static double relative(double event, double recorded) {
        return Math.abs(event - recorded) / Math.max(Math.abs(recorded), 1.0);
    }
}
