package io.facsforge.transforms;

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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class LinearTransformTest {

    @Test
    void identityIsExact() {
        LinearTransform linear = LinearTransform.identity();
        for (double x : new double[]{-1e9, -3.25, 0.0, 1.0, 262143.5}) {
            assertEquals(x, linear.toDisplay(x));
            assertEquals(x, linear.toRaw(linear.toDisplay(x)));
        }
        assertFalse(linear.hasDisplayRange());
        assertEquals("linear", linear.kind());
    }

    @Test
    void displayRangeIsCarriedButDoesNotScale() {
        LinearTransform ranged = LinearTransform.withRange(0, 262144);
        assertTrue(ranged.hasDisplayRange());
        assertEquals(0.0, ranged.getDisplayMin());
        assertEquals(262144.0, ranged.getDisplayMax());
        assertEquals(1234.5, ranged.toDisplay(1234.5));
    }

    @Test
    void invalidRangeRejected() {
        assertThrows(TransformParameterException.class, () -> LinearTransform.withRange(10, 10));
        assertThrows(TransformParameterException.class, () -> LinearTransform.withRange(0, Double.NaN));
    }
}
