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

import java.util.List;

/**
 * A gate region in display coordinates.
 *
 * <p>Shapes form a closed set of variants, each tagged with {@link GateType}:
 * <ul>
 *   <li>{@link PolygonGate} - two channels, at least three vertices</li>
 *   <li>{@link RectangleGate} - two channels, inclusive bounds per axis</li>
 *   <li>{@link RangeGate} - one channel, inclusive bounds</li>
 * </ul>
 *
 * <p>The evaluation engine only calls {@link #channels()} and {@link #contains(double[])},
 * so new variants need no changes to tree traversal.
 *
 * <p>All coordinates are on display scale: vertices and bounds have already been
 * passed through the channel transforms.
 */
public interface GateShape {

    /**
     * @return the discriminator written as {@code type}
     */
    String getGateType();

    /**
     * @return the gated channels, in axis order
     */
    List<String> channels();

    /**
     * Tests a display-scale point. Points on the region's boundary are inside.
     *
     * @param displayValues one value per {@link #channels() channel}, in the same order
     * @return true if the point is inside or on the boundary
     */
    boolean contains(double[] displayValues);

    /**
     * @return the closed outline to draw, in display units
     */
    List<Vertex> outline();
}
