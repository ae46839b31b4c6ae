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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Overlay points for one population, and how they were found.
 */
public final class OverlayResult {

    private final MatchMode mode;
    private final String fallbackReport;
    private final List<OverlayPoint> points;
    private final List<IndexRow> unmatched;

    public OverlayResult(MatchMode mode, String fallbackReport, List<OverlayPoint> points, List<IndexRow> unmatched) {
        this.mode = Objects.requireNonNull(mode, "mode");
        if ((mode != MatchMode.CHANNEL_NEAREST) != (fallbackReport != null)) {
            throw new IllegalArgumentException("A fallback report is required for, and only for, matching without the gating channels");
        }
        this.fallbackReport = fallbackReport;
        this.points = List.copyOf(points);
        this.unmatched = List.copyOf(unmatched);
    }

    public MatchMode getMode() {
        return mode;
    }

    /**
     * @return true if rows were matched by event id or by position
     */
    public boolean isFallback() {
        return mode != MatchMode.CHANNEL_NEAREST;
    }

    /**
     * @return why channel matching was not used, present iff {@link #isFallback()}
     */
    public Optional<String> fallbackReport() {
        return Optional.ofNullable(fallbackReport);
    }

    public List<OverlayPoint> getPoints() {
        return points;
    }

    /**
     * @return rows with no event within tolerance, or beyond the population size
     */
    public List<IndexRow> getUnmatched() {
        return unmatched;
    }
}
