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
 * Closed polygon over two channels.
 *
 * <h2>Membership</h2>
 *
 * <p>Points on an edge, vertices included, are inside. An edge absorbs floating-point
 * rounding of about {@code 1e-12} relative to its extent. Other points use the
 * even-odd crossing rule with a horizontal ray towards +x, so self-intersecting
 * outlines behave the way FlowJo draws them.
 *
 * <p>Cost is {@code O(V)} per point for {@code V} vertices.
 */
@GateType(PolygonGate.GATE_TYPE)
public final class PolygonGate implements GateShape {

    public static final String GATE_TYPE = "polygon";

    private static final double EDGE_EPSILON = 1e-12;

    @SerializedName("channels")
    private final List<String> channels;

    @SerializedName("vertices")
    private final List<Vertex> vertices;

    private final transient double[] xs;
    private final transient double[] ys;

    /**
     * @param xChannel first channel
     * @param yChannel second channel
     * @param vertices outline in display units, implicitly closed
     * @throws InvalidHierarchyException if there are fewer than three vertices or a coordinate is not finite
     */
    public PolygonGate(String xChannel, String yChannel, List<Vertex> vertices) {
        Objects.requireNonNull(xChannel, "xChannel");
        Objects.requireNonNull(yChannel, "yChannel");
        Objects.requireNonNull(vertices, "vertices");
        if (vertices.size() < 3) {
            throw new InvalidHierarchyException(
                "Polygon gate on " + xChannel + "/" + yChannel + " needs at least 3 vertices, got " + vertices.size());
        }
        this.channels = List.of(xChannel, yChannel);
        this.vertices = List.copyOf(vertices);
        this.xs = new double[vertices.size()];
        this.ys = new double[vertices.size()];
        for (int i = 0; i < vertices.size(); i++) {
            Vertex v = vertices.get(i);
            if (!Double.isFinite(v.x()) || !Double.isFinite(v.y())) {
                throw new InvalidHierarchyException("Polygon vertex " + i + " is not finite: " + v);
            }
            xs[i] = v.x();
            ys[i] = v.y();
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

    /**
     * @return the vertices in display units
     */
    public List<Vertex> getVertices() {
        return vertices;
    }

    @Override
    public List<Vertex> outline() {
        return vertices;
    }

    @Override
    public boolean contains(double[] displayValues) {
        return contains(displayValues[0], displayValues[1]);
    }

    /**
     * @param x display value on the first channel
     * @param y display value on the second channel
     * @return true if inside or on an edge
     */
    public boolean contains(double x, double y) {
        return contains(xs, ys, x, y);
    }

    static boolean contains(double[] xs, double[] ys, double px, double py) {
        int n = xs.length;
        boolean inside = false;
        for (int i = 0, j = n - 1; i < n; j = i++) {
            double xi = xs[i];
            double yi = ys[i];
            double xj = xs[j];
            double yj = ys[j];
            if (onSegment(xi, yi, xj, yj, px, py)) {
                return true;
            }
            if ((yi > py) != (yj > py)) {
                double xCross = (xj - xi) * (py - yi) / (yj - yi) + xi;
                if (px < xCross) {
                    inside = !inside;
                }
            }
        }
        return inside;
    }

    private static boolean onSegment(double x1, double y1, double x2, double y2, double px, double py) {
        // cross is the edge length times the distance to the edge line
        double scale = Math.max(Math.max(Math.abs(x2 - x1), Math.abs(y2 - y1)), 1.0);
        double slack = EDGE_EPSILON * scale;
        double cross = (x2 - x1) * (py - y1) - (y2 - y1) * (px - x1);
        if (Math.abs(cross) > slack * scale) {
            return false;
        }
        return px >= Math.min(x1, x2) - slack && px <= Math.max(x1, x2) + slack
            && py >= Math.min(y1, y2) - slack && py <= Math.max(y1, y2) + slack;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PolygonGate)) return false;
        PolygonGate that = (PolygonGate) o;
        return channels.equals(that.channels) && vertices.equals(that.vertices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channels, vertices);
    }

    @Override
    public String toString() {
        return "polygon" + channels + vertices;
    }
}
