package io.facsforge.gating.json;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Shared Gson configuration for gate shapes, statistics and rendering inputs.
///
/// | Feature | Setting |
/// |---------|---------|
/// | Pretty printing | Enabled |
/// | HTML escaping | Disabled |
/// | NaN / Infinity | Written as bare literals |
/// | [io.facsforge.gating.model.GateShape] | Polymorphic on `type` |
///
/// Open rectangle sides are infinite, so special floating point values must be
/// writable.
///
/// @see GateShapeTypeAdapterFactory
public final class GatingGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private GatingGsonConfig() {
    }

    /// @return the shared, thread-safe instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// @return a new builder with the gating defaults, for callers that need more adapters
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapterFactory(GateShapeTypeAdapterFactory.create());
    }
}
