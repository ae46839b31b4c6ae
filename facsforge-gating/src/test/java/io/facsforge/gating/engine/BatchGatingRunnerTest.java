package io.facsforge.gating.engine;

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
import io.facsforge.gating.model.GateHierarchy;
import io.facsforge.gating.model.GateNode;
import io.facsforge.gating.model.RangeGate;
import io.facsforge.transforms.ChannelTransforms;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class BatchGatingRunnerTest {

    private static GateHierarchy hierarchy() {
        GateHierarchy.Builder builder = GateHierarchy.builder();
        int root = builder.add(GateNode.NO_PARENT, "All", null);
        int mid = builder.add(root, "Mid", new RangeGate("A", 25, 75));
        builder.add(mid, "Upper", new RangeGate("A", 50, 75));
        return builder.build();
    }

    private static EventMatrix sample(long seed, int size) {
        Random random = new Random(seed);
        EventMatrix.Builder builder = EventMatrix.builder("A");
        for (int i = 0; i < size; i++) {
            builder.addRow(random.nextDouble() * 100);
        }
        return builder.build();
    }

    @Test
    void resultsComeBackInInputOrderAndMatchSerialRuns() {
        Map<String, EventMatrix> samples = new LinkedHashMap<>();
        for (int i = 9; i >= 0; i--) {
            samples.put("sample" + i, sample(i, 1000 + 250 * i));
        }
        GatingEngine engine = new GatingEngine();

        Map<String, GatingResult> results = new BatchGatingRunner(engine, 4)
            .run(hierarchy(), ChannelTransforms.linearOnly(), samples);

        assertThat(results.keySet()).containsExactlyElementsOf(samples.keySet());
        for (Map.Entry<String, EventMatrix> entry : samples.entrySet()) {
            GatingResult serial = engine.evaluate(hierarchy(), ChannelTransforms.linearOnly(), entry.getValue());
            assertThat(results.get(entry.getKey()).getPopulations()).isEqualTo(serial.getPopulations());
        }
    }

    @Test
    void failureOfOneSampleFailsTheBatch() {
        Map<String, EventMatrix> samples = new LinkedHashMap<>();
        samples.put("good", sample(1, 100));
        samples.put("bad", EventMatrix.builder("B").addRow(1).build());

        assertThatThrownBy(() -> new BatchGatingRunner(new GatingEngine(), 2)
            .run(hierarchy(), ChannelTransforms.linearOnly(), samples))
            .isInstanceOf(ChannelNotFoundException.class)
            .hasMessageContaining("A");
    }

    @Test
    void rejectsZeroThreads() {
        assertThatThrownBy(() -> new BatchGatingRunner(new GatingEngine(), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
