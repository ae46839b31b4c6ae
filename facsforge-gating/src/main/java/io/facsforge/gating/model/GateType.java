package io.facsforge.gating.model;

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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the discriminator name of a {@link GateShape} implementation.
 *
 * <p>The name is the value of the {@code type} field wherever a shape is written
 * out, both in experiment configuration files and in JSON rendering input:
 *
 * <pre>{@code
 * {
 *   "type": "polygon",
 *   "channels": ["FSC-A", "SSC-A"],
 *   "vertices": [{"x": 0.0, "y": 0.0}, ...]
 * }
 * }</pre>
 *
 * @see GateShape
 * @see io.facsforge.gating.json.GateShapeTypeAdapterFactory
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface GateType {
    /**
     * The type name; lowercase and unique across all shapes.
     *
     * @return the discriminator value
     */
    String value();
}
