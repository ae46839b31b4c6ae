package io.facsforge.transforms;

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

import java.util.Objects;

/**
 * Identity transform for scatter and time channels.
 *
 * <p>The optional display range does not change the mapping; it is carried along so
 * plots can fix their axis limits the way the source workspace did.
 */
public final class LinearTransform implements ChannelTransform {

    public static final String KIND = "linear";

    private static final LinearTransform IDENTITY = new LinearTransform(Double.NaN, Double.NaN);

    private final double displayMin;
    private final double displayMax;

    private LinearTransform(double displayMin, double displayMax) {
        this.displayMin = displayMin;
        this.displayMax = displayMax;
    }

    /**
     * @return the shared identity transform without a display range
     */
    public static LinearTransform identity() {
        return IDENTITY;
    }

    /**
     * Creates an identity transform with a fixed display range.
     *
     * @param min lower axis limit
     * @param max upper axis limit
     * @return a linear transform carrying the range
     * @throws TransformParameterException if the range is not finite or not increasing
     */
    public static LinearTransform withRange(double min, double max) {
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw new TransformParameterException("Linear display range must be finite: [" + min + ", " + max + "]");
        }
        if (min >= max) {
            throw new TransformParameterException("Linear display range must be increasing: [" + min + ", " + max + "]");
        }
        return new LinearTransform(min, max);
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public double toDisplay(double raw) {
        return raw;
    }

    @Override
    public double toRaw(double display) {
        return display;
    }

    /**
     * @return true if a display range was declared
     */
    public boolean hasDisplayRange() {
        return !Double.isNaN(displayMin);
    }

    /**
     * @return the lower axis limit, or NaN when no range was declared
     */
    public double getDisplayMin() {
        return displayMin;
    }

    /**
     * @return the upper axis limit, or NaN when no range was declared
     */
    public double getDisplayMax() {
        return displayMax;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LinearTransform)) return false;
        LinearTransform that = (LinearTransform) o;
        return Double.compare(displayMin, that.displayMin) == 0
            && Double.compare(displayMax, that.displayMax) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(displayMin, displayMax);
    }

    @Override
    public String toString() {
        return hasDisplayRange() ? "linear[" + displayMin + ", " + displayMax + "]" : "linear";
    }
}
