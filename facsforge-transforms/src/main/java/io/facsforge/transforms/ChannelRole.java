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

import java.util.Locale;

/// The declared scaling role of a cytometer channel.
///
/// The wire name (`scatter-linear`, `time-linear`, `fluorescence-logicle`) is the
/// form used in experiment configuration files.
public enum ChannelRole {
    SCATTER_LINEAR("scatter-linear"),
    TIME_LINEAR("time-linear"),
    FLUORESCENCE_LOGICLE("fluorescence-logicle");

    private final String wireName;

    ChannelRole(String wireName) {
        this.wireName = wireName;
    }

    /// @return the configuration-file name of this role
    public String wireName() {
        return wireName;
    }

    /// @return true if channels with this role use a linear transform
    public boolean isLinear() {
        return this != FLUORESCENCE_LOGICLE;
    }

    /// Parse a role from its configuration-file name.
    ///
    /// @param name the wire name, case-insensitive
    /// @return the matching role
    /// @throws IllegalArgumentException if no role has this name
    public static ChannelRole fromWireName(String name) {
        if (name != null) {
            String lower = name.trim().toLowerCase(Locale.ROOT);
            for (ChannelRole role : values()) {
                if (role.wireName.equals(lower)) {
                    return role;
                }
            }
        }
        throw new IllegalArgumentException("Unknown channel role '" + name + "', expected one of "
            + "scatter-linear, time-linear, fluorescence-logicle");
    }

    @Override
    public String toString() {
        return wireName;
    }
}
