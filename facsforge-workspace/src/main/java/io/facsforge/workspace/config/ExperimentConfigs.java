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
import io.facsforge.gating.model.GateNode;
import io.facsforge.gating.model.InvalidHierarchyException;
import io.facsforge.gating.model.MarkerRules;
import io.facsforge.transforms.ChannelRole;
import io.facsforge.transforms.ChannelRoles;
import io.facsforge.transforms.ChannelTransform;
import io.facsforge.transforms.ChannelTransforms;
import io.facsforge.workspace.flowjo.FlowJo9WorkspaceImporter;
import io.facsforge.workspace.flowjo.WorkspaceImport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Dump;
import org.snakeyaml.engine.v2.api.DumpSettings;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.common.FlowStyle;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Reading, building and writing experiment configuration files.
///
/// A configuration moves through three forms:
///
/// 1. YAML text, read and written with snakeyaml-engine;
/// 2. a plain `Map` tree, which is what {@link ConfigMerger} and
///    {@link ConfigSchemaValidator} work on;
/// 3. an {@link ExperimentConfig}, built only from a tree that validated.
public final class ExperimentConfigs {

    private static final Logger logger = LogManager.getLogger(ExperimentConfigs.class);

    private ExperimentConfigs() {
    }

    /// Reads, validates and builds a configuration file.
    ///
    /// @param file the YAML file
    /// @return the configuration
    /// @throws IOException              if the file cannot be read
    /// @throws SchemaValidationException if the file is not a valid configuration
    public static ExperimentConfig load(Path file) throws IOException {
        ExperimentConfig config = fromMap(read(file));
        logger.info("Loaded experiment '{}' from {}: {} channel(s), {} population(s)",
            config.getMetadata().experimentName(), file, config.getPanel().size(), config.getHierarchy().size());
        return config;
    }

    /// @param file a YAML file
    /// @return its content as a mapping tree, without validation
    /// @throws IOException              if the file cannot be read
    /// @throws SchemaValidationException if it is not YAML or not a mapping
    public static Map<String, Object> read(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8), file.toString());
    }

    /// @param yaml   YAML text
    /// @param source name used in messages
    /// @return the document as a mapping tree; an empty document gives an empty map
    /// @throws SchemaValidationException if it is not YAML or not a mapping
    public static Map<String, Object> parse(String yaml, String source) {
        Object document;
        try {
            Load load = new Load(LoadSettings.builder().setLabel(source).build());
            document = load.loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new SchemaValidationException(List.of(source + ": not valid YAML: " + e.getMessage()), e);
        }
        if (document == null) {
            return new LinkedHashMap<>();
        }
        if (!(document instanceof Map)) {
            throw new SchemaValidationException(List.of(source + ": configuration must be a mapping"));
        }
        return ConfigValues.map(document);
    }

    /// Validates a mapping tree and builds the configuration from it.
    ///
    /// @param map the parsed configuration
    /// @return the configuration
    /// @throws SchemaValidationException if the tree is not valid
    public static ExperimentConfig fromMap(Map<String, Object> map) {
        new ConfigSchemaValidator().validate(map);

        Map<String, Object> meta = ConfigValues.map(map.get("metadata"));
        ExperimentMetadata metadata = new ExperimentMetadata(string(meta.get("experiment_name")),
            string(meta.get("operator")), string(meta.get("date")), string(meta.get("notes")));

        Map<String, PanelEntry> panel = new LinkedHashMap<>();
        ChannelTransforms.Builder transforms = ChannelTransforms.builder();
        Set<String> ignored = new LinkedHashSet<>(ConfigValues.strings(map.get("ignore_markers")));
        for (Map.Entry<String, Object> entry : ConfigValues.map(map.get("panel")).entrySet()) {
            String channel = entry.getKey();
            Map<String, Object> spec = entry.getValue() == null ? Map.of() : ConfigValues.map(entry.getValue());
            ChannelTransform transform;
            ChannelRole role;
            if (spec.get("role") != null) {
                role = ChannelRole.fromWireName(String.valueOf(spec.get("role")));
                transform = ConfigValues.transform(transformSpec(spec), role);
            } else if (spec.get("transform") != null) {
                transform = ConfigValues.transform(transformSpec(spec), ChannelRole.SCATTER_LINEAR);
                role = ChannelRoles.roleFor(channel, transform);
            } else {
                role = ChannelRoles.defaultRole(channel);
                transform = ConfigValues.transform(null, role);
            }
            boolean ignore = Boolean.TRUE.equals(spec.get("ignore"));
            if (ignore) {
                ignored.add(channel);
            }
            panel.put(channel, new PanelEntry(channel, string(spec.get("fluor")), role, ignore, transform));
            transforms.put(channel, transform);
        }

        CompensationSettings compensation = CompensationSettings.none();
        if (map.get("compensation") instanceof Map<?, ?> comp) {
            Object source = comp.get("source");
            Object reference = comp.get("reference");
            compensation = new CompensationSettings(
                source == null ? CompensationSettings.Source.NONE
                    : CompensationSettings.Source.fromWireName(String.valueOf(source)),
                string(comp.get("path")), reference == null ? null : String.valueOf(reference));
        }

        Map<String, Object> celltypes = ConfigValues.map(map.get("celltypes"));
        Map<String, String> paths = new LinkedHashMap<>();
        GateHierarchy hierarchy = buildHierarchy(celltypes, paths);

        return new ExperimentConfig(metadata, panel, transforms.build(), ignored, compensation, hierarchy, paths,
            ConfigValues.strings(map.get("celltypes_of_interest")));
    }

    private static Map<String, Object> transformSpec(Map<String, Object> panelEntry) {
        Object transform = panelEntry.get("transform");
        return transform == null ? null : ConfigValues.map(transform);
    }

    /// Celltypes become nodes in file order. A single parentless celltype is the root;
    /// several share a synthetic ungated root.
    private static GateHierarchy buildHierarchy(Map<String, Object> celltypes, Map<String, String> paths) {
        List<String> keys = new ArrayList<>(celltypes.keySet());
        List<String> roots = new ArrayList<>();
        for (String key : keys) {
            if (ConfigValues.map(celltypes.get(key)).get("parent") == null) {
                roots.add(key);
            }
        }
        boolean synthetic = roots.size() != 1;
        int offset = synthetic ? 1 : 0;

        GateHierarchy.Builder builder = GateHierarchy.builder();
        if (synthetic) {
            builder.declare(0, GateNode.NO_PARENT, FlowJo9WorkspaceImporter.ROOT_NAME, null, null);
        }
        for (int i = 0; i < keys.size(); i++) {
            Map<String, Object> spec = ConfigValues.map(celltypes.get(keys.get(i)));
            Object parent = spec.get("parent");
            int parentId = parent == null
                ? (synthetic ? 0 : GateNode.NO_PARENT)
                : keys.indexOf(String.valueOf(parent)) + offset;
            MarkerRules rules = new MarkerRules(ConfigValues.strings(spec.get("positive")),
                ConfigValues.strings(spec.get("negative")));
            Object gate = spec.get("gate");
            builder.declare(i + offset, parentId, ConfigValues.nodeName(keys.get(i)),
                gate == null ? null : ConfigValues.gate(ConfigValues.map(gate)), rules);
        }

        GateHierarchy hierarchy;
        try {
            hierarchy = builder.build();
        } catch (InvalidHierarchyException e) {
            throw new SchemaValidationException(List.of("celltypes: " + e.getMessage()), e);
        }
        for (String key : keys) {
            paths.put(key, pathOf(key, celltypes, synthetic));
        }
        return hierarchy;
    }

    private static String pathOf(String key, Map<String, Object> celltypes, boolean synthetic) {
        List<String> names = new ArrayList<>();
        String current = key;
        while (current != null) {
            Map<String, Object> spec = ConfigValues.map(celltypes.get(current));
            Object parent = spec.get("parent");
            if (current.equals(key) || parent != null || synthetic || spec.get("gate") != null) {
                names.add(0, ConfigValues.nodeName(current));
            }
            current = parent == null ? null : String.valueOf(parent);
        }
        return String.join("/", names);
    }

    /// Converts an imported workspace into a configuration tree.
    ///
    /// Celltype keys are population paths, so the tree reloads into the same
    /// hierarchy. Gate coordinates are the importer's display units.
    ///
    /// @param workspace      the import
    /// @param experimentName value for `metadata.experiment_name`
    /// @return a configuration tree
    public static Map<String, Object> fromImport(WorkspaceImport workspace, String experimentName) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("metadata", new ExperimentMetadata(experimentName, "", "", "").toMap());

        Map<String, Object> panel = new LinkedHashMap<>();
        for (String channel : workspace.channels()) {
            ChannelTransform transform = workspace.transforms().forChannel(channel);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("fluor", workspace.panel().get(channel));
            entry.put("role", ChannelRoles.roleFor(channel, transform).wireName());
            entry.put("ignore", false);
            entry.put("transform", ConfigValues.transformToMap(transform));
            panel.put(channel, entry);
        }
        config.put("panel", panel);
        config.put("ignore_markers", new ArrayList<>());

        Map<String, Object> compensation = new LinkedHashMap<>();
        compensation.put("source", CompensationSettings.Source.NONE.wireName());
        compensation.put("path", "");
        if (!workspace.compensation().isNone()) {
            compensation.put("reference", workspace.compensation().label());
        }
        config.put("compensation", compensation);

        Map<String, Object> celltypes = new LinkedHashMap<>();
        GateHierarchy hierarchy = workspace.hierarchy();
        for (GateNode node : hierarchy.depthFirst()) {
            if (node.isRoot() && node.shape() == null) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            String parent = hierarchy.parent(node.id())
                .filter(p -> !(p.isRoot() && p.shape() == null))
                .map(GateNode::path)
                .orElse(null);
            entry.put("parent", parent);
            entry.put("gate", ConfigValues.gateToMap(node.shape()));
            entry.put("positive", new ArrayList<>(node.markerRules().positive()));
            entry.put("negative", new ArrayList<>(node.markerRules().negative()));
            celltypes.put(node.path(), entry);
        }
        config.put("celltypes", celltypes);
        config.put("celltypes_of_interest", new ArrayList<>());
        return config;
    }

    /// A starting configuration listing every channel with the default role and
    /// transform for its name, and no celltypes.
    ///
    /// @param channels       channel names from an event file
    /// @param experimentName value for `metadata.experiment_name`
    /// @return a configuration tree
    public static Map<String, Object> skeleton(List<String> channels, String experimentName) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("metadata", new ExperimentMetadata(experimentName, "", "", "").toMap());
        Map<String, Object> panel = new LinkedHashMap<>();
        for (String channel : channels) {
            ChannelRole role = ChannelRoles.defaultRole(channel);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("fluor", null);
            entry.put("role", role.wireName());
            entry.put("ignore", false);
            entry.put("transform", ConfigValues.transformToMap(ConfigValues.transform(null, role)));
            panel.put(channel, entry);
        }
        config.put("panel", panel);
        config.put("ignore_markers", new ArrayList<>());
        Map<String, Object> compensation = new LinkedHashMap<>();
        compensation.put("source", CompensationSettings.Source.NONE.wireName());
        compensation.put("path", "");
        config.put("compensation", compensation);
        config.put("celltypes", new LinkedHashMap<>());
        config.put("celltypes_of_interest", new ArrayList<>());
        return config;
    }

    /// @param config a configuration tree
    /// @return block-style YAML, keys in map order
    public static String toYaml(Map<String, Object> config) {
        DumpSettings settings = DumpSettings.builder().setDefaultFlowStyle(FlowStyle.BLOCK).build();
        return new Dump(settings).dumpToString(config);
    }

    /// @param file   target file, replaced if it exists
    /// @param config a configuration tree
    /// @throws IOException if the file cannot be written
    public static void write(Path file, Map<String, Object> config) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toYaml(config), StandardCharsets.UTF_8);
        logger.info("Wrote configuration to {}", file);
    }

    private static String string(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
