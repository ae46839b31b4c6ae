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

import io.facsforge.gating.model.GateHierarchy;
import io.facsforge.transforms.Channel;
import io.facsforge.transforms.ChannelTransforms;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// A validated experiment configuration, ready for evaluation.
///
/// Built by {@link ExperimentConfigs}; every transform has already been solved and
/// the gate tree has passed hierarchy validation.
public final class ExperimentConfig {

    private final ExperimentMetadata metadata;
    private final Map<String, PanelEntry> panel;
    private final ChannelTransforms transforms;
    private final Set<String> ignoredMarkers;
    private final CompensationSettings compensation;
    private final GateHierarchy hierarchy;
    private final Map<String, String> celltypePaths;
    private final List<String> celltypesOfInterest;

    ExperimentConfig(ExperimentMetadata metadata, Map<String, PanelEntry> panel, ChannelTransforms transforms,
                     Set<String> ignoredMarkers, CompensationSettings compensation, GateHierarchy hierarchy,
                     Map<String, String> celltypePaths, List<String> celltypesOfInterest) {
        this.metadata = metadata;
        this.panel = Collections.unmodifiableMap(new LinkedHashMap<>(panel));
        this.transforms = transforms;
        this.ignoredMarkers = Collections.unmodifiableSet(new LinkedHashSet<>(ignoredMarkers));
        this.compensation = compensation;
        this.hierarchy = hierarchy;
        this.celltypePaths = Collections.unmodifiableMap(new LinkedHashMap<>(celltypePaths));
        this.celltypesOfInterest = List.copyOf(celltypesOfInterest);
    }

    public ExperimentMetadata getMetadata() {
        return metadata;
    }

    /// @return panel entries keyed by channel, in file order
    public Map<String, PanelEntry> getPanel() {
        return panel;
    }

    /// @return the channels kept for gating with their roles, in panel order
    public List<Channel> getChannels() {
        List<Channel> channels = new ArrayList<>();
        for (PanelEntry entry : panel.values()) {
            if (!ignoredMarkers.contains(entry.channel())) {
                channels.add(new Channel(entry.channel(), entry.role()));
            }
        }
        return channels;
    }

    public ChannelTransforms getTransforms() {
        return transforms;
    }

    /// @return channels dropped before gating, from `ignore_markers` and `ignore: true` panel entries
    public Set<String> getIgnoredMarkers() {
        return ignoredMarkers;
    }

    public CompensationSettings getCompensation() {
        return compensation;
    }

    public GateHierarchy getHierarchy() {
        return hierarchy;
    }

    /// @param celltype a key of the `celltypes` section
    /// @return the population path of that celltype in {@link #getHierarchy()}
    public Optional<String> pathOf(String celltype) {
        return Optional.ofNullable(celltypePaths.get(celltype));
    }

    /// @return celltype keys mapped to population paths, in file order
    public Map<String, String> getCelltypePaths() {
        return celltypePaths;
    }

    public List<String> getCelltypesOfInterest() {
        return celltypesOfInterest;
    }

    /// @return population paths of the celltypes of interest
    public List<String> pathsOfInterest() {
        List<String> paths = new ArrayList<>();
        for (String celltype : celltypesOfInterest) {
            paths.add(celltypePaths.get(celltype));
        }
        return paths;
    }
}
