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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ConfigSchemaValidatorTest {

    private final ConfigSchemaValidator validator = new ConfigSchemaValidator();

    static Path fixture() throws URISyntaxException {
        return Path.of(ConfigSchemaValidatorTest.class.getResource("/configs/t_cells.yaml").toURI());
    }

    @Test
    void fixtureIsValid() throws IOException, URISyntaxException {
        assertThat(validator.check(ExperimentConfigs.read(fixture()))).isEmpty();
    }

    @Test
    void collectsEveryViolationWithItsLocation() {
        Map<String, Object> config = ExperimentConfigs.parse("""
            panel:
              FSC-A: {role: scatter-linear}
              SSC-A: {role: scatter-linear}
              CD3: {fluor: FITC, role: purple}
              CD4: {fluor: FITC, ignore: yes}
              CD8: {transform: {type: logicle, T: 0}}
            compensation: {source: file}
            celltypes:
              A:
                gate: {type: ellipse}
              B:
                gate: {type: polygon, channels: [FSC-A, SSC-A], vertices: [[0, 0], [1, 1]]}
              C:
                gate: {type: threshold, channel: APC-A, min: 1}
              D:
                parent: Nope
                gate: {type: threshold, channel: CD3}
              E:
                parent: F
                gate: {type: threshold, channel: CD3}
              F:
                parent: E
                gate: {type: threshold, channel: CD3}
            celltypes_of_interest: [Z]
            """, "inline");

        List<String> errors = validator.check(config);

        assertThat(errors).contains(
            "metadata: required section is missing",
            "panel → CD4 → ignore: must be true or false, found 'yes'",
            "panel → CD4 → fluor: fluorochrome 'FITC' is already used by 'CD3'",
            "panel → CD8 → transform: Logicle T must be positive, was 0.0",
            "compensation → path: source 'file' requires a path",
            "celltypes → A → gate → type: must be polygon, rectangle or threshold, found 'ellipse'",
            "celltypes → B → gate → vertices: needs at least 3 vertices, found 2",
            "celltypes → C → gate: channel 'APC-A' is not declared in the panel",
            "celltypes → D → parent: 'Nope' is not a key of celltypes",
            "celltypes → E → parent: parent chain forms a cycle through [E, F]",
            "celltypes_of_interest: 'Z' is not a key of celltypes");
        assertThat(errors).anySatisfy(e -> assertThat(e).startsWith("panel → CD3 → role: Unknown channel role 'purple'"));

        assertThatThrownBy(() -> validator.validate(config))
            .isInstanceOf(SchemaValidationException.class)
            .hasMessageContaining(errors.size() + " errors")
            .satisfies(e -> assertThat(((SchemaValidationException) e).getErrors()).isEqualTo(errors));
    }

    @Test
    void rejectsNonMappingDocument() {
        assertThat(validator.check(List.of("a", "b")))
            .containsExactly("<root>: configuration must be a mapping, found a list [a, b]");
    }

    @Test
    void sectionsMustBeMappings() {
        Map<String, Object> config = ExperimentConfigs.parse("""
            metadata: {experiment_name: X}
            panel: [FSC-A]
            celltypes: {}
            """, "inline");

        assertThat(validator.check(config)).containsExactly("panel: must be a mapping, found a list [FSC-A]");
    }

    @Test
    void gateMayNotUseIgnoredChannel() {
        Map<String, Object> config = ExperimentConfigs.parse("""
            metadata: {experiment_name: X}
            panel: {CD3: null, Time: null}
            ignore_markers: [Time]
            celltypes:
              Early:
                gate: {type: threshold, channel: Time, max: 10}
            """, "inline");

        assertThat(validator.check(config))
            .containsExactly("celltypes → Early → gate: channel 'Time' is ignored but used by this gate");
    }

    @Test
    void onlyASingleParentlessCelltypeMayOmitItsGate() {
        Map<String, Object> single = ExperimentConfigs.parse("""
            metadata: {experiment_name: X}
            panel: {CD3: null}
            celltypes:
              All: {parent: null}
              T: {parent: All, gate: {type: threshold, channel: CD3, min: 0.4}}
            """, "inline");
        Map<String, Object> two = ExperimentConfigs.parse("""
            metadata: {experiment_name: X}
            panel: {CD3: null}
            celltypes:
              All: {parent: null}
              T: {gate: {type: threshold, channel: CD3, min: 0.4}}
            """, "inline");

        assertThat(validator.check(single)).isEmpty();
        assertThat(validator.check(two)).containsExactly("celltypes → All → gate: is required");
    }

    @Test
    void invertedThresholdIsReported() {
        Map<String, Object> config = ExperimentConfigs.parse("""
            metadata: {experiment_name: X}
            panel: {CD3: null}
            celltypes:
              T: {gate: {type: threshold, channel: CD3, min: 0.8, max: 0.2}}
            """, "inline");

        assertThat(validator.check(config)).singleElement().asString()
            .startsWith("celltypes → T → gate: Bounds on CD3 are inverted");
    }
}
