package io.facsforge.gating.overlay;

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

/**
 * How index rows were paired with gated events.
 */
public enum MatchMode {
    /** Each row went to the gated event nearest in the two gating channels. */
    CHANNEL_NEAREST,
    /** Each row went to the event whose 0-based row number is its recorded event id. */
    EVENT_ID,
    /** The Nth row went to the Nth gated event. */
    POSITIONAL
}
