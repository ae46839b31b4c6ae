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

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds a positive/negative split for a marker channel by valley finding.
 *
 * <p>The raw values are binned into {@value #BINS} equal-width bins. Bins whose count
 * falls below the 20th percentile of all bin counts are valleys; the threshold is the
 * left edge of the first one. Without a valley the 95th percentile of the values is
 * used.
 */
public final class ThresholdEstimator {

    static final int BINS = 200;
    private static final double VALLEY_PERCENTILE = 20.0;
    private static final double FALLBACK_PERCENTILE = 95.0;

    private ThresholdEstimator() {
    }

    /**
     * @param matrix   raw events
     * @param channels marker channels
     * @return threshold per channel
     * @throws ChannelNotFoundException if any channel is missing
     */
    public static Map<String, Double> estimate(EventMatrix matrix, Collection<String> channels) {
        Map<String, Double> thresholds = new LinkedHashMap<>();
        for (String channel : channels) {
            if (!matrix.hasChannel(channel)) {
                throw new ChannelNotFoundException(List.of(channel));
            }
            thresholds.put(channel, threshold(matrix.column(channel)));
        }
        return thresholds;
    }

    /**
     * @param values raw values of one channel, not modified
     * @return the threshold, NaN for no values
     */
    public static double threshold(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (min == max) {
            min -= 0.5;
            max += 0.5;
        }
        double width = (max - min) / BINS;
        double[] counts = new double[BINS];
        for (double v : values) {
            int bin = (int) ((v - min) / (max - min) * BINS);
            counts[Math.min(Math.max(bin, 0), BINS - 1)]++;
        }
        double cutoff = percentile(counts.clone(), VALLEY_PERCENTILE);
        for (int i = 0; i < BINS; i++) {
            if (counts[i] < cutoff) {
                return min + i * width;
            }
        }
        return percentile(values.clone(), FALLBACK_PERCENTILE);
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param values values, sorted in place
     * @param q      percentile in [0, 100]
     * @return the interpolated value
     */
    static double percentile(double[] values, double q) {
        Arrays.sort(values);
        double rank = q / 100.0 * (values.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = Math.min(lo + 1, values.length - 1);
        double fraction = rank - lo;
        return values[lo] + (values[hi] - values[lo]) * fraction;
    }
}
