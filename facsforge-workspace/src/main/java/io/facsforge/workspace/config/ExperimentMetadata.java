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
import java.util.Map;

/// Descriptive fields from the `metadata` section. None of them affect gating.
///
/// @param experimentName the experiment name
/// @param operator       who ran the acquisition, may be empty
/// @param date           acquisition date as written, may be empty
/// @param notes          free text
public record ExperimentMetadata(String experimentName, String operator, String date, String notes) {

    public ExperimentMetadata {
        operator = operator == null ? "" : operator;
        date = date == null ? "" : date;
        notes = notes == null ? "" : notes;
    }

    /// @return this metadata in configuration-file form
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("experiment_name", experimentName);
        map.put("operator", operator);
        map.put("date", date);
        map.put("notes", notes);
        return map;
    }
}
