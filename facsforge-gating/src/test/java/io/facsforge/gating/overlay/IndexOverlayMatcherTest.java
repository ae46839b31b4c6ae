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

import io.facsforge.gating.events.EventMatrix;
import io.facsforge.transforms.ChannelTransforms;
import io.facsforge.transforms.LogicleParameters;
import io.facsforge.transforms.LogicleTransform;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class IndexOverlayMatcherTest {

    private static final EventMatrix EVENTS = EventMatrix.builder("FSC-A", "CD3")
        .addRow(100, 10)
        .addRow(2000, 500)
        .addRow(3000, 1500)
        .addRow(4000, 2500)
        .addRow(5000, 9000)
        .build();

    private static final ChannelTransforms TRANSFORMS = ChannelTransforms.builder()
        .logicle("CD3", LogicleParameters.defaults())
        .build();

    private static BitSet gated(int... rows) {
        BitSet mask = new BitSet();
        for (int row : rows) {
            mask.set(row);
        }
        return mask;
    }

    @Test
    @DisplayName("rows carrying the gating channels go to the nearest gated event")
    void nearestByChannel() {
        IndexTable index = IndexCsv.parse(List.of(
            "Well,FSC-A,CD3",
            "B2,2999.5,1501",
            "B1,2001,499",
            "B3,100,10",
            "B4,7000,7000"), "index");

        OverlayResult result = new IndexOverlayMatcher()
            .match(EVENTS, gated(1, 2, 3, 4), "FSC-A", "CD3", TRANSFORMS, index);

        LogicleTransform logicle = LogicleTransform.create(LogicleParameters.defaults());
        assertThat(result.getMode()).isEqualTo(MatchMode.CHANNEL_NEAREST);
        assertThat(result.isFallback()).isFalse();
        assertThat(result.fallbackReport()).isEmpty();
        assertThat(result.getPoints()).extracting(OverlayPoint::well).containsExactly("B2", "B1");
        assertThat(result.getPoints()).extracting(OverlayPoint::eventIndex).containsExactly(2, 1);
        OverlayPoint b2 = result.getPoints().get(0);
        assertThat(b2.x()).isEqualTo(3000.0);
        assertThat(b2.y()).isEqualTo(logicle.toDisplay(1500));
        assertThat(b2.distance()).isLessThanOrEqualTo(IndexOverlayMatcher.DEFAULT_TOLERANCE);
        // B3 matches an event outside the population; B4 is far from every event
        assertThat(result.getUnmatched()).extracting(IndexRow::well).containsExactly("B3", "B4");
    }

    @Test
    @DisplayName("without the gating channels rows recording an event id go to that event")
    void eventIdMatching() {
        EventMatrix.Builder builder = EventMatrix.builder("FSC-A", "CD3");
        for (int row = 0; row < 10; row++) {
            builder.addRow(1000 + row, 100 * row);
        }
        EventMatrix events = builder.build();
        IndexTable index = IndexCsv.parse(List.of(
            "Well,EventID,Side",
            "A1,5,1",
            "A2,7,2",
            "A3,2,3",
            "A4,40,4"), "index");

        OverlayResult result = new IndexOverlayMatcher()
            .match(events, gated(0, 1, 3, 4, 5, 6, 7, 8, 9), "FSC-A", "CD3", TRANSFORMS, index);

        assertThat(result.getMode()).isEqualTo(MatchMode.EVENT_ID);
        assertThat(result.isFallback()).isTrue();
        assertThat(result.fallbackReport()).hasValueSatisfying(report -> assertThat(report)
            .contains("FSC-A/CD3")
            .contains("by event id")
            .contains("matched 2 of 4"));
        assertThat(result.getPoints()).extracting(OverlayPoint::well).containsExactly("A1", "A2");
        assertThat(result.getPoints()).extracting(OverlayPoint::eventIndex).containsExactly(5, 7);
        assertThat(result.getPoints().get(0).x()).isEqualTo(1005.0);
        assertThat(result.getPoints().get(0).distance()).isNaN();
        // event 2 is not gated and event 40 does not exist
        assertThat(result.getUnmatched()).extracting(IndexRow::well).containsExactly("A3", "A4");
    }

    @Test
    @DisplayName("without the gating channels or event ids rows are matched by position")
    void positionalFallback() {
        IndexTable index = IndexCsv.parse(List.of(
            "Well,Side",
            "C1,5",
            "C2,6",
            "C3,7"), "index");

        OverlayResult result = new IndexOverlayMatcher()
            .match(EVENTS, gated(1, 3), "FSC-A", "CD3", TRANSFORMS, index);

        assertThat(result.getMode()).isEqualTo(MatchMode.POSITIONAL);
        assertThat(result.isFallback()).isTrue();
        assertThat(result.fallbackReport()).hasValueSatisfying(report -> assertThat(report)
            .contains("FSC-A/CD3")
            .contains("by file order"));
        assertThat(result.getPoints()).extracting(OverlayPoint::well).containsExactly("C1", "C2");
        assertThat(result.getPoints()).extracting(OverlayPoint::eventIndex).containsExactly(1, 3);
        assertThat(result.getPoints().get(0).distance()).isNaN();
        assertThat(result.getUnmatched()).extracting(IndexRow::well).containsExactly("C3");
    }

    @Test
    @DisplayName("positional matching without wells still yields points")
    void positionalWithoutWells() {
        IndexTable index = IndexCsv.parse(List.of("Other", "1", "2"), "index");

        OverlayResult result = new IndexOverlayMatcher()
            .match(EVENTS, gated(0, 4), "FSC-A", "CD3", TRANSFORMS, index);

        assertThat(result.getPoints()).hasSize(2);
        assertThat(result.getPoints()).extracting(OverlayPoint::well).containsOnlyNulls();
        assertThat(result.fallbackReport()).hasValueSatisfying(report -> assertThat(report).contains("file order"));
    }

    @Test
    void rejectsNegativeTolerance() {
        assertThatThrownBy(() -> new IndexOverlayMatcher(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
