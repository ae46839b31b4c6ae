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
 * One-channel interval gate, bounds inclusive. Written as {@code threshold} in
 * experiment configuration files.
 */
@GateType(RangeGate.GATE_TYPE)
public final class RangeGate implements GateShape {

    public static final String GATE_TYPE = "range";

    @SerializedName("channel")
    private final String channel;
    @SerializedName("min")
    private final double min;
    @SerializedName("max")
    private final double max;

    /**
     * @param channel the gated channel
     * @param min     inclusive lower bound in display units, may be negative infinity
     * @param max     inclusive upper bound in display units, may be positive infinity
     */
    public RangeGate(String channel, double min, double max) {
        Objects.requireNonNull(channel, "channel");
        RectangleGate.checkBounds(channel, min, max);
        this.channel = channel;
        this.min = min;
        this.max = max;
    }

    @Override
    public String getGateType() {
        return GATE_TYPE;
    }

    @Override
    public List<String> channels() {
        return List.of(channel);
    }

    @Override
    public boolean contains(double[] displayValues) {
        double v = displayValues[0];
        return v >= min && v <= max;
    }

    /**
     * A range has no second axis; the outline spans y in [0, 1] so it can be drawn as a band.
     */
    @Override
    public List<Vertex> outline() {
        return List.of(new Vertex(min, 0), new Vertex(max, 0), new Vertex(max, 1), new Vertex(min, 1));
    }

    public String getChannel() {
        return channel;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RangeGate)) return false;
        RangeGate that = (RangeGate) o;
        return Double.compare(min, that.min) == 0 && Double.compare(max, that.max) == 0
            && channel.equals(that.channel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channel, min, max);
    }

    @Override
    public String toString() {
        return "range[" + channel + ": " + min + ".." + max + "]";
    }
}
