package io.facsforge.workspace.flowjo;

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

import io.facsforge.gating.model.GateHierarchy;
import io.facsforge.transforms.ChannelTransforms;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Everything read from one sample of a workspace.
///
/// @param sampleName   the sample's name in the workspace
/// @param channels     declared channel names, in declaration order
/// @param panel        channel to fluorochrome or detector label; values may be null
/// @param transforms   per-channel display transforms
/// @param hierarchy    the sample's gate tree, coordinates in display units
/// @param compensation the compensation the sample names
public record WorkspaceImport(
    String sampleName,
    List<String> channels,
    Map<String, String> panel,
    ChannelTransforms transforms,
    GateHierarchy hierarchy,
    CompensationReference compensation
) {

    public WorkspaceImport {
        channels = List.copyOf(channels);
        panel = Collections.unmodifiableMap(new LinkedHashMap<>(panel));
    }
}
