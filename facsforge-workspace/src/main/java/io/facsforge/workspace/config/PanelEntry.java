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

import io.facsforge.transforms.ChannelRole;
import io.facsforge.transforms.ChannelTransform;

/// One channel of the `panel` section.
///
/// @param channel   channel identifier
/// @param fluor     fluorochrome or detector label, may be null
/// @param role      declared scaling role
/// @param ignore    true to drop the channel before gating
/// @param transform the channel's display transform
public record PanelEntry(String channel, String fluor, ChannelRole role, boolean ignore,
                         ChannelTransform transform) {
}
