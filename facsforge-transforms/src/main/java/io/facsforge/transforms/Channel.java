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

/// A cytometer channel: its identifier as it appears in the event data plus its scaling role.
///
/// @param name the channel identifier, e.g. `FSC-A` or `FITC-A`
/// @param role the declared scaling role
public record Channel(String name, ChannelRole role) {

    public Channel {
        Objects.requireNonNull(name, "channel name");
        Objects.requireNonNull(role, "channel role");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Channel name must not be blank");
        }
    }

    /// Create a channel whose role is guessed from its name.
    ///
    /// @param name the channel identifier
    /// @return a channel with the {@link ChannelRoles#defaultRole(String) default role}
    public static Channel named(String name) {
        return new Channel(name, ChannelRoles.defaultRole(name));
    }
}
