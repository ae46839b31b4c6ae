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

/// The four user-facing logicle parameters.
///
/// | Name | Meaning |
/// |------|---------|
/// | `T` | top of scale, the largest data value |
/// | `W` | width of the linearization region, in decades |
/// | `M` | number of decades the full scale spans |
/// | `A` | additional decades of negative data below zero |
///
/// `W <= M/2` is the usual recommendation but is not required here; parameter sets
/// that cannot produce a monotone scale are rejected when the transform is solved.
///
/// @param T top of scale
/// @param W linearization width in decades
/// @param M total decades
/// @param A additional negative decades
public record LogicleParameters(double T, double W, double M, double A) {

    /// Top of scale for an 18-bit digital cytometer.
    public static final double DEFAULT_T = 262144.0;
    public static final double DEFAULT_W = 0.5;
    public static final double DEFAULT_M = 4.5;
    public static final double DEFAULT_A = 0.0;

    public LogicleParameters {
        if (!Double.isFinite(T) || !Double.isFinite(W) || !Double.isFinite(M) || !Double.isFinite(A)) {
            throw new TransformParameterException(
                "Logicle parameters must be finite: T=" + T + " W=" + W + " M=" + M + " A=" + A);
        }
        if (T <= 0) {
            throw new TransformParameterException("Logicle T must be positive, was " + T);
        }
        if (W < 0) {
            throw new TransformParameterException("Logicle W must not be negative, was " + W);
        }
        if (M <= 0) {
            throw new TransformParameterException("Logicle M must be positive, was " + M);
        }
        if (A < 0) {
            throw new TransformParameterException("Logicle A must not be negative, was " + A);
        }
    }

    /// @return the parameters FlowJo uses for 18-bit data when nothing else is declared
    public static LogicleParameters defaults() {
        return new LogicleParameters(DEFAULT_T, DEFAULT_W, DEFAULT_M, DEFAULT_A);
    }
}
