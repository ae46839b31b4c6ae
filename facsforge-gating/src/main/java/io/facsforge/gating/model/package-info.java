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

/// The gate hierarchy: an immutable arena of {@link io.facsforge.gating.model.GateNode}s
/// and the gate shapes they carry.
///
/// Nothing here evaluates events; see {@link io.facsforge.gating.engine.GatingEngine}.
package io.facsforge.gating.model;
