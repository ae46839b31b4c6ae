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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Merges a freshly generated configuration into one that already exists on disk.
///
/// - nested mappings merge key by key;
/// - a non-empty list from the incoming side replaces the existing one, an empty one is ignored;
/// - a non-null scalar from the incoming side replaces the existing value, null is ignored;
/// - the top-level `panel` keeps every existing channel entry untouched and only
///   gains channels it did not have.
///
/// Neither argument is modified.
public final class ConfigMerger {

    private ConfigMerger() {
    }

    /// @param base     the existing configuration, may be empty
    /// @param incoming the newly generated configuration
    /// @return a new merged mapping
    public static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> incoming) {
        Map<String, Object> result = mergeMaps(base, incoming, true);
        Map<String, Object> panel = new LinkedHashMap<>();
        if (base.get("panel") instanceof Map<?, ?> existing) {
            panel.putAll(ConfigValues.map(existing));
        }
        if (incoming.get("panel") instanceof Map<?, ?> added) {
            for (Map.Entry<String, Object> entry : ConfigValues.map(added).entrySet()) {
                panel.putIfAbsent(entry.getKey(), entry.getValue());
            }
        }
        if (base.containsKey("panel") || incoming.containsKey("panel")) {
            result.put("panel", panel);
        }
        return result;
    }

    private static Map<String, Object> mergeMaps(Map<String, Object> base, Map<String, Object> incoming,
                                                 boolean top) {
        Map<String, Object> result = new LinkedHashMap<>(base);
        for (Map.Entry<String, Object> entry : incoming.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (top && key.equals("panel")) {
                continue;
            }
            if (result.get(key) instanceof Map<?, ?> existing && value instanceof Map<?, ?> update) {
                result.put(key, mergeMaps(ConfigValues.map(existing), ConfigValues.map(update), false));
            } else if (value instanceof List<?> list) {
                if (!list.isEmpty()) {
                    result.put(key, value);
                }
            } else if (value != null) {
                result.put(key, value);
            }
        }
        return result;
    }
}
