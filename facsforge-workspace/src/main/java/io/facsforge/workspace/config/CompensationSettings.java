package io.facsforge.workspace.config;

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

/// Where the spillover matrix for an experiment comes from.
///
/// Compensation itself is applied upstream; these settings are carried through so a
/// configuration round-trips without losing them.
///
/// @param source    matrix source
/// @param path      matrix file, required for {@link Source#FILE}, otherwise empty
/// @param reference opaque reference to a matrix named in an imported workspace, may be null
public record CompensationSettings(Source source, String path, String reference) {

    public enum Source {
        NONE, FCS, FILE;

        /// @return the configuration-file spelling
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        /// @param name a configuration-file value, case-insensitive
        /// @return the matching source
        /// @throws IllegalArgumentException for unknown names
        public static Source fromWireName(String name) {
            for (Source source : values()) {
                if (source.wireName().equalsIgnoreCase(name == null ? "" : name.trim())) {
                    return source;
                }
            }
            throw new IllegalArgumentException("Unknown compensation source '" + name
                + "', expected one of none, fcs, file");
        }
    }

    public CompensationSettings {
        path = path == null ? "" : path;
        if (source == Source.FILE && path.isBlank()) {
            throw new IllegalArgumentException("Compensation source 'file' requires a path");
        }
    }

    public static CompensationSettings none() {
        return new CompensationSettings(Source.NONE, "", null);
    }
}
