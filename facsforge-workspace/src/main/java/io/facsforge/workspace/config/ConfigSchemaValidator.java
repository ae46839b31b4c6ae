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

import io.facsforge.gating.model.InvalidHierarchyException;
import io.facsforge.transforms.ChannelRole;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Checks a loaded experiment configuration before anything is built from it.
///
/// Every violation is collected, so one run reports everything wrong with a file.
/// Each message starts with the location of the offending value, written as the
/// chain of keys leading to it:
///
/// ```
/// celltypes → CD3 → gate → vertices: a polygon needs at least 3 vertices, found 2
/// panel → CD4-PE → transform: Logicle T must be positive, was 0.0
/// ```
///
/// Transforms and gates are constructed while checking, so parameters that
/// cannot be solved are reported here and never reach evaluation.
public final class ConfigSchemaValidator {

    private static final Logger logger = LogManager.getLogger(ConfigSchemaValidator.class);

    static final String ARROW = " → ";
    private static final List<String> REQUIRED = List.of("metadata", "panel", "celltypes");

    /// @param config the parsed YAML document
    /// @throws SchemaValidationException listing every violation, if there is any
    public void validate(Object config) {
        List<String> errors = check(config);
        if (!errors.isEmpty()) {
            throw new SchemaValidationException(errors);
        }
    }

    /// @param config the parsed YAML document
    /// @return the violations found, empty if the configuration is valid
    public List<String> check(Object config) {
        Report report = new Report();
        if (!(config instanceof Map<?, ?> root)) {
            report.error("<root>", "configuration must be a mapping, found " + describe(config));
            return report.errors;
        }
        for (String section : REQUIRED) {
            if (!root.containsKey(section) || root.get(section) == null) {
                report.error(section, "required section is missing");
            } else if (!(root.get(section) instanceof Map)) {
                report.error(section, "must be a mapping, found " + describe(root.get(section)));
            }
        }

        if (root.get("metadata") instanceof Map<?, ?> metadata) {
            checkMetadata(metadata, report);
        }
        Map<String, Map<?, ?>> panel = new LinkedHashMap<>();
        Set<String> ignored = new HashSet<>();
        if (root.get("panel") instanceof Map<?, ?> panelMap) {
            checkPanel(panelMap, panel, ignored, report);
        }
        Object ignoreMarkers = root.get("ignore_markers");
        if (ignoreMarkers != null) {
            for (String channel : channelList(ignoreMarkers, "ignore_markers", report)) {
                checkDeclared(channel, panel, "ignore_markers", report);
                ignored.add(channel);
            }
        }
        Object compensation = root.get("compensation");
        if (compensation != null) {
            checkCompensation(compensation, report);
        }
        Set<String> celltypeKeys = new LinkedHashSet<>();
        if (root.get("celltypes") instanceof Map<?, ?> celltypes) {
            checkCelltypes(celltypes, panel, ignored, celltypeKeys, report);
        }
        Object interest = root.get("celltypes_of_interest");
        if (interest != null) {
            if (!(interest instanceof List<?> list)) {
                report.error("celltypes_of_interest", "must be a list, found " + describe(interest));
            } else {
                for (Object item : list) {
                    if (!celltypeKeys.contains(String.valueOf(item))) {
                        report.error("celltypes_of_interest", "'" + item + "' is not a key of celltypes");
                    }
                }
            }
        }
        if (!report.errors.isEmpty()) {
            logger.debug("Configuration has {} schema violation(s)", report.errors.size());
        }
        return report.errors;
    }

    private void checkMetadata(Map<?, ?> metadata, Report report) {
        Object name = metadata.get("experiment_name");
        if (name == null) {
            report.error("metadata" + ARROW + "experiment_name", "is required");
        } else if (!isScalar(name)) {
            report.error("metadata" + ARROW + "experiment_name", "must be a string, found " + describe(name));
        }
        for (Map.Entry<?, ?> entry : metadata.entrySet()) {
            if (entry.getValue() != null && !isScalar(entry.getValue())) {
                report.error("metadata" + ARROW + entry.getKey(), "must be a scalar, found " + describe(entry.getValue()));
            }
        }
    }

    private void checkPanel(Map<?, ?> panelMap, Map<String, Map<?, ?>> panel, Set<String> ignored, Report report) {
        Map<String, String> fluors = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : panelMap.entrySet()) {
            String channel = String.valueOf(entry.getKey());
            String where = "panel" + ARROW + channel;
            if (channel.isBlank()) {
                report.error("panel", "channel names must not be blank");
                continue;
            }
            Object value = entry.getValue();
            if (value == null) {
                panel.put(channel, Map.of());
                continue;
            }
            if (!(value instanceof Map<?, ?> spec)) {
                report.error(where, "must be a mapping, found " + describe(value));
                continue;
            }
            panel.put(channel, spec);

            Object fluor = spec.get("fluor");
            if (fluor != null) {
                if (!isScalar(fluor)) {
                    report.error(where + ARROW + "fluor", "must be a string, found " + describe(fluor));
                } else {
                    String previous = fluors.putIfAbsent(String.valueOf(fluor), channel);
                    if (previous != null) {
                        report.error(where + ARROW + "fluor", "fluorochrome '" + fluor + "' is already used by '"
                            + previous + "'");
                    }
                }
            }
            ChannelRole role = null;
            Object roleName = spec.get("role");
            if (roleName != null) {
                try {
                    role = ChannelRole.fromWireName(String.valueOf(roleName));
                } catch (IllegalArgumentException e) {
                    report.error(where + ARROW + "role", e.getMessage());
                }
            }
            Object ignore = spec.get("ignore");
            if (ignore != null && !(ignore instanceof Boolean)) {
                report.error(where + ARROW + "ignore", "must be true or false, found " + describe(ignore));
            } else if (Boolean.TRUE.equals(ignore)) {
                ignored.add(channel);
            }
            Object transform = spec.get("transform");
            if (transform != null) {
                checkTransform(transform, role, where + ARROW + "transform", report);
            }
        }
    }

    private void checkTransform(Object transform, ChannelRole role, String where, Report report) {
        if (!(transform instanceof Map<?, ?> spec)) {
            report.error(where, "must be a mapping, found " + describe(transform));
            return;
        }
        Object type = spec.get(ConfigValues.TYPE);
        if (!"linear".equals(type) && !"logicle".equals(type)) {
            report.error(where + ARROW + "type", "must be linear or logicle, found " + describe(type));
            return;
        }
        List<String> keys = "logicle".equals(type) ? List.of("T", "W", "M", "A") : List.of("min", "max");
        boolean numeric = true;
        for (String key : keys) {
            Object value = spec.get(key);
            if (value != null && !(value instanceof Number)) {
                report.error(where + ARROW + key, "must be a number, found " + describe(value));
                numeric = false;
            }
        }
        if ("linear".equals(type) && (spec.get("min") == null) != (spec.get("max") == null)) {
            report.error(where, "a linear display range needs both min and max");
            numeric = false;
        }
        if ("logicle".equals(type) && role != null && role.isLinear()) {
            report.error(where, "role " + role + " cannot use a logicle transform");
        }
        if (numeric) {
            try {
                ConfigValues.transform(ConfigValues.map(spec), ChannelRole.SCATTER_LINEAR);
            } catch (IllegalArgumentException e) {
                report.error(where, e.getMessage());
            }
        }
    }

    private void checkCompensation(Object compensation, Report report) {
        if (!(compensation instanceof Map<?, ?> spec)) {
            report.error("compensation", "must be a mapping, found " + describe(compensation));
            return;
        }
        CompensationSettings.Source source = CompensationSettings.Source.NONE;
        Object sourceName = spec.get("source");
        if (sourceName != null) {
            try {
                source = CompensationSettings.Source.fromWireName(String.valueOf(sourceName));
            } catch (IllegalArgumentException e) {
                report.error("compensation" + ARROW + "source", e.getMessage());
            }
        }
        Object path = spec.get("path");
        if (path != null && !(path instanceof String)) {
            report.error("compensation" + ARROW + "path", "must be a string, found " + describe(path));
        }
        if (source == CompensationSettings.Source.FILE && (path == null || String.valueOf(path).isBlank())) {
            report.error("compensation" + ARROW + "path", "source 'file' requires a path");
        }
    }

    private void checkCelltypes(Map<?, ?> celltypes, Map<String, Map<?, ?>> panel, Set<String> ignored,
                                Set<String> keys, Report report) {
        Map<String, String> parents = new LinkedHashMap<>();
        for (Object key : celltypes.keySet()) {
            keys.add(String.valueOf(key));
        }
        List<String> roots = new ArrayList<>();
        for (Map.Entry<?, ?> entry : celltypes.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (!(entry.getValue() instanceof Map<?, ?> spec)) {
                continue;
            }
            Object parent = spec.get("parent");
            if (parent == null) {
                roots.add(key);
            } else {
                parents.put(key, String.valueOf(parent));
            }
        }

        for (Map.Entry<?, ?> entry : celltypes.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String where = "celltypes" + ARROW + key;
            if (key.isBlank() || ConfigValues.nodeName(key).isBlank()) {
                report.error(where, "celltype names must not be blank or end with '/'");
            }
            if (!(entry.getValue() instanceof Map<?, ?> spec)) {
                report.error(where, "must be a mapping, found " + describe(entry.getValue()));
                continue;
            }
            String parent = parents.get(key);
            if (parent != null && !keys.contains(parent)) {
                report.error(where + ARROW + "parent", "'" + parent + "' is not a key of celltypes");
            } else if (key.equals(parent)) {
                report.error(where + ARROW + "parent", "a celltype cannot be its own parent");
            }

            Object gate = spec.get("gate");
            if (gate == null) {
                if (!(roots.size() == 1 && roots.get(0).equals(key))) {
                    report.error(where + ARROW + "gate", "is required");
                }
            } else {
                checkGate(gate, panel, ignored, where + ARROW + "gate", report);
            }
            for (String list : List.of("positive", "negative")) {
                Object markers = spec.get(list);
                if (markers != null) {
                    for (String channel : channelList(markers, where + ARROW + list, report)) {
                        checkDeclared(channel, panel, where + ARROW + list, report);
                    }
                }
            }
        }
        checkCycles(parents, report);
    }

    private void checkCycles(Map<String, String> parents, Report report) {
        Set<String> cleared = new HashSet<>();
        for (String start : parents.keySet()) {
            List<String> chain = new ArrayList<>();
            String current = start;
            while (current != null && !cleared.contains(current)) {
                int seen = chain.indexOf(current);
                if (seen >= 0) {
                    List<String> cycle = chain.subList(seen, chain.size());
                    report.error("celltypes" + ARROW + current + ARROW + "parent",
                        "parent chain forms a cycle through " + cycle);
                    break;
                }
                chain.add(current);
                current = parents.get(current);
            }
            cleared.addAll(chain);
        }
    }

    private void checkGate(Object gate, Map<String, Map<?, ?>> panel, Set<String> ignored, String where,
                           Report report) {
        if (!(gate instanceof Map<?, ?> spec)) {
            report.error(where, "must be a mapping, found " + describe(gate));
            return;
        }
        Object type = spec.get(ConfigValues.TYPE);
        List<String> channels = new ArrayList<>();
        int errorsBefore = report.errors.size();
        if (ConfigValues.THRESHOLD.equals(type)) {
            Object channel = spec.get("channel");
            if (!(channel instanceof String)) {
                report.error(where + ARROW + "channel", "must be a channel name, found " + describe(channel));
            } else {
                channels.add((String) channel);
            }
            for (String bound : List.of("min", "max")) {
                Object value = spec.get(bound);
                if (value != null && (!(value instanceof Number) || Double.isNaN(((Number) value).doubleValue()))) {
                    report.error(where + ARROW + bound, "must be a number, found " + describe(value));
                }
            }
        } else if (ConfigValues.POLYGON.equals(type) || ConfigValues.RECTANGLE.equals(type)) {
            boolean polygon = ConfigValues.POLYGON.equals(type);
            Object channelList = spec.get("channels");
            if (!(channelList instanceof List<?> list) || list.size() != 2
                || !(list.get(0) instanceof String) || !(list.get(1) instanceof String)) {
                report.error(where + ARROW + "channels", "must list exactly 2 channel names, found "
                    + describe(channelList));
            } else {
                channels.add((String) list.get(0));
                channels.add((String) list.get(1));
            }
            checkVertices(spec.get("vertices"), polygon ? 3 : 2, polygon, where + ARROW + "vertices", report);
        } else {
            report.error(where + ARROW + "type", "must be polygon, rectangle or threshold, found " + describe(type));
            return;
        }
        for (String channel : channels) {
            checkDeclared(channel, panel, where, report);
            if (ignored.contains(channel)) {
                report.error(where, "channel '" + channel + "' is ignored but used by this gate");
            }
        }
        if (report.errors.size() == errorsBefore) {
            try {
                ConfigValues.gate(ConfigValues.map(spec));
            } catch (InvalidHierarchyException e) {
                report.error(where, e.getMessage());
            }
        }
    }

    private void checkVertices(Object vertices, int minimum, boolean finite, String where, Report report) {
        if (!(vertices instanceof List<?> list)) {
            report.error(where, "must be a list of [x, y] pairs, found " + describe(vertices));
            return;
        }
        if (list.size() < minimum) {
            report.error(where, "needs at least " + minimum + " vertices, found " + list.size());
        }
        for (int i = 0; i < list.size(); i++) {
            Object item = list.get(i);
            if (!(item instanceof List<?> pair) || pair.size() != 2
                || !(pair.get(0) instanceof Number) || !(pair.get(1) instanceof Number)) {
                report.error(where + ARROW + i, "must be an [x, y] pair of numbers, found " + describe(item));
                continue;
            }
            double x = ((Number) pair.get(0)).doubleValue();
            double y = ((Number) pair.get(1)).doubleValue();
            if (Double.isNaN(x) || Double.isNaN(y) || (finite && (Double.isInfinite(x) || Double.isInfinite(y)))) {
                report.error(where + ARROW + i, "coordinates must be finite, found " + pair);
            }
        }
    }

    private List<String> channelList(Object value, String where, Report report) {
        List<String> channels = new ArrayList<>();
        if (!(value instanceof List<?> list)) {
            report.error(where, "must be a list of channel names, found " + describe(value));
            return channels;
        }
        for (Object item : list) {
            if (item instanceof String s) {
                channels.add(s);
            } else {
                report.error(where, "must contain channel names, found " + describe(item));
            }
        }
        return channels;
    }

    private void checkDeclared(String channel, Map<String, Map<?, ?>> panel, String where, Report report) {
        if (!panel.containsKey(channel)) {
            report.error(where, "channel '" + channel + "' is not declared in the panel");
        }
    }

    private static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    private static String describe(Object value) {
        if (value == null) {
            return "nothing";
        }
        if (value instanceof Map) {
            return "a mapping";
        }
        if (value instanceof List) {
            return "a list " + value;
        }
        return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }

    private static final class Report {
        private final List<String> errors = new ArrayList<>();

        void error(String location, String message) {
            errors.add(location + ": " + message);
        }
    }
}
