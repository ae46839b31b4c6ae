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

/// Maps raw channel values to display scale and back.
///
/// Both directions are total over the finite reals. Implementations are immutable
/// value objects and may be shared between threads.
public interface ChannelTransform {

    /// @return the transform kind as written in configuration files (`linear`, `logicle`)
    String kind();

    /// @param raw a raw (possibly compensated, possibly negative) channel value
    /// @return the value on display scale
    double toDisplay(double raw);

    /// @param display a display-scale value
    /// @return the raw value that maps to it
    double toRaw(double display);

    /// Map a whole column to display scale.
    ///
    /// @param raw raw channel values
    /// @return a new array of display values
    default double[] toDisplay(double[] raw) {
        double[] out = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            out[i] = toDisplay(raw[i]);
        }
        return out;
    }
}
