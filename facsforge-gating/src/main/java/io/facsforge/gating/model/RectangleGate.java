package io.facsforge.gating.model;

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

import java.util.List;
import java.util.Objects;

/**
 * Axis-aligned rectangle over two channels, bounds inclusive.
 *
 * <p>An open side is given as an infinite bound, as FlowJo does for rectangles that
 * run off the edge of the plot.
 */
@GateType(RectangleGate.GATE_TYPE)
public final class RectangleGate implements GateShape {

    public static final String GATE_TYPE = "rectangle";

    @SerializedName("channels")
    private final List<String> channels;
    @SerializedName("x_min")
    private final double xMin;
    @SerializedName("x_max")
    private final double xMax;
    @SerializedName("y_min")
    private final double yMin;
    @SerializedName("y_max")
    private final double yMax;

    /**
     * @throws InvalidHierarchyException if a bound is NaN or a minimum exceeds its maximum
     */
    public RectangleGate(String xChannel, String yChannel, double xMin, double xMax, double yMin, double yMax) {
        Objects.requireNonNull(xChannel, "xChannel");
        Objects.requireNonNull(yChannel, "yChannel");
        checkBounds(xChannel, xMin, xMax);
        checkBounds(yChannel, yMin, yMax);
        this.channels = List.of(xChannel, yChannel);
        this.xMin = xMin;
        this.xMax = xMax;
        this.yMin = yMin;
        this.yMax = yMax;
    }

    static void checkBounds(String channel, double min, double max) {
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new InvalidHierarchyException("Bounds on " + channel + " must not be NaN");
        }
        if (min > max) {
            throw new InvalidHierarchyException("Bounds on " + channel + " are inverted: " + min + " > " + max);
        }
    }

    @Override
    public String getGateType() {
        return GATE_TYPE;
    }

    @Override
    public List<String> channels() {
        return channels;
    }

    @Override
    public boolean contains(double[] displayValues) {
        double x = displayValues[0];
        double y = displayValues[1];
        return x >= xMin && x <= xMax && y >= yMin && y <= yMax;
    }

    @Override
    public List<Vertex> outline() {
        return List.of(
            new Vertex(xMin, yMin),
            new Vertex(xMax, yMin),
            new Vertex(xMax, yMax),
            new Vertex(xMin, yMax));
    }

    public double getXMin() {
        return xMin;
    }

    public double getXMax() {
        return xMax;
    }

    public double getYMin() {
        return yMin;
    }

    public double getYMax() {
        return yMax;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RectangleGate)) return false;
        RectangleGate that = (RectangleGate) o;
        return Double.compare(xMin, that.xMin) == 0 && Double.compare(xMax, that.xMax) == 0
            && Double.compare(yMin, that.yMin) == 0 && Double.compare(yMax, that.yMax) == 0
            && channels.equals(that.channels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channels, xMin, xMax, yMin, yMax);
    }

    @Override
    public String toString() {
        return "rectangle" + channels + "[" + xMin + ".." + xMax + ", " + yMin + ".." + yMax + "]";
    }
}
