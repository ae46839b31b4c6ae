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

import java.util.regex.Pattern;

/// Name-based channel classification.
///
/// Scatter (`FSC`, `SSC`) and `TIME` channels are displayed on a linear scale; every
/// other channel is treated as a fluorescence detector.
public final class ChannelRoles {

    private static final Pattern SCATTER = Pattern.compile("FSC|SSC", Pattern.CASE_INSENSITIVE);
    private static final Pattern TIME = Pattern.compile("TIME", Pattern.CASE_INSENSITIVE);

    private ChannelRoles() {
    }

    /// @param channelName a channel identifier
    /// @return the role a channel of this name gets when nothing else is declared
    public static ChannelRole defaultRole(String channelName) {
        if (TIME.matcher(channelName).find()) {
            return ChannelRole.TIME_LINEAR;
        }
        if (SCATTER.matcher(channelName).find()) {
            return ChannelRole.SCATTER_LINEAR;
        }
        return ChannelRole.FLUORESCENCE_LOGICLE;
    }

    /// Role for a channel whose transform is already known.
    ///
    /// A logicle transform always means fluorescence; a linear transform means
    /// time for time-named channels and scatter for everything else.
    ///
    /// @param channelName the channel identifier
    /// @param transform   the channel's transform
    /// @return the derived role
    public static ChannelRole roleFor(String channelName, ChannelTransform transform) {
        if (transform instanceof LogicleTransform) {
            return ChannelRole.FLUORESCENCE_LOGICLE;
        }
        return TIME.matcher(channelName).find() ? ChannelRole.TIME_LINEAR : ChannelRole.SCATTER_LINEAR;
    }
}
