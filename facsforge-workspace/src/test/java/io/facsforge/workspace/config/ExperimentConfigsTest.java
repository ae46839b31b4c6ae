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

import io.facsforge.gating.model.GateHierarchy;
import io.facsforge.gating.model.GateNode;
import io.facsforge.gating.model.RangeGate;
import io.facsforge.gating.model.RectangleGate;
import io.facsforge.transforms.Channel;
import io.facsforge.transforms.ChannelRole;
import io.facsforge.transforms.LinearTransform;
import io.facsforge.transforms.LogicleParameters;
import io.facsforge.transforms.LogicleTransform;
import io.facsforge.workspace.flowjo.FlowJo9WorkspaceImporter;
import io.facsforge.workspace.flowjo.WorkspaceImport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ExperimentConfigsTest {

    @Test
    void loadsFixture() throws IOException, URISyntaxException {
        ExperimentConfig config = ExperimentConfigs.load(ConfigSchemaValidatorTest.fixture());

        assertThat(config.getMetadata().experimentName()).isEqualTo("T cell panel");
        assertThat(config.getMetadata().date()).isEqualTo("2024-03-12");
        assertThat(config.getPanel().keySet()).containsExactly("FSC-A", "SSC-A", "CD3", "CD4", "Time");
        assertThat(config.getPanel().get("CD3").fluor()).isEqualTo("FITC");
        assertThat(config.getPanel().get("CD4").role()).isEqualTo(ChannelRole.FLUORESCENCE_LOGICLE);
        assertThat(config.getPanel().get("Time").role()).isEqualTo(ChannelRole.TIME_LINEAR);
        assertThat(config.getIgnoredMarkers()).containsExactly("Time");
        assertThat(config.getChannels()).extracting(Channel::name).containsExactly("FSC-A", "SSC-A", "CD3", "CD4");
        assertThat(config.getChannels().get(2)).isEqualTo(new Channel("CD3", ChannelRole.FLUORESCENCE_LOGICLE));
        assertThat(((LogicleTransform) config.getTransforms().forChannel("CD4")).getParameters())
            .isEqualTo(new LogicleParameters(262144, 1, 4.5, 0));
        assertThat(config.getTransforms().forChannel("SSC-A")).isSameAs(LinearTransform.identity());
        assertThat(config.getCompensation().source()).isEqualTo(CompensationSettings.Source.FILE);
        assertThat(config.getCompensation().path()).isEqualTo("spill.csv");
    }

    @Test
    @DisplayName("a single parentless celltype becomes the root")
    void singleParentlessCelltypeIsRoot() throws IOException, URISyntaxException {
        ExperimentConfig config = ExperimentConfigs.load(ConfigSchemaValidatorTest.fixture());
        GateHierarchy hierarchy = config.getHierarchy();

        assertThat(hierarchy.root().name()).isEqualTo("Lymphocytes");
        assertThat(hierarchy.depthFirst()).extracting(GateNode::path)
            .containsExactly("Lymphocytes", "Lymphocytes/T cells", "Lymphocytes/T cells/Helper");
        assertThat(config.pathOf("Helper")).contains("Lymphocytes/T cells/Helper");
        assertThat(config.pathsOfInterest()).containsExactly("Lymphocytes/T cells/Helper");

        GateNode helper = hierarchy.findByPath("Lymphocytes/T cells/Helper").orElseThrow();
        assertThat(helper.markerRules().positive()).containsExactly("CD4");
        RectangleGate rect = (RectangleGate) helper.shape();
        assertThat(rect.getXMin()).isEqualTo(0.45);
        assertThat(rect.getYMax()).isEqualTo(Double.POSITIVE_INFINITY);
        RangeGate tCells = (RangeGate) hierarchy.findByPath("Lymphocytes/T cells").orElseThrow().shape();
        assertThat(tCells.getMax()).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    void severalParentlessCelltypesShareASyntheticRoot() {
        ExperimentConfig config = ExperimentConfigs.fromMap(ExperimentConfigs.parse("""
            metadata: {experiment_name: X}
            panel: {CD3: null, CD19: null}
            celltypes:
              T: {gate: {type: threshold, channel: CD3, min: 0.4}}
              B: {gate: {type: threshold, channel: CD19, min: 0.4}}
            """, "inline"));

        assertThat(config.getHierarchy().root().name()).isEqualTo(FlowJo9WorkspaceImporter.ROOT_NAME);
        assertThat(config.getHierarchy().root().shape()).isNull();
        assertThat(config.getCelltypePaths()).containsExactly(Map.entry("T", "T"), Map.entry("B", "B"));
        assertThat(config.getPanel().get("CD19").transform()).isInstanceOf(LogicleTransform.class);
    }

    @Test
    void duplicateSiblingNamesAreASchemaError() {
        Map<String, Object> map = ExperimentConfigs.parse("""
            metadata: {experiment_name: X}
            panel: {CD3: null}
            celltypes:
              T: {gate: {type: threshold, channel: CD3, min: 0.4}}
              other/T: {gate: {type: threshold, channel: CD3, max: 0.4}}
            """, "inline");

        assertThatThrownBy(() -> ExperimentConfigs.fromMap(map))
            .isInstanceOf(SchemaValidationException.class)
            .hasMessageContaining("celltypes:")
            .hasMessageContaining("'T'");
    }

    @Test
    @DisplayName("an imported workspace written as YAML reloads into the same gates")
    void importRoundTrip(@TempDir Path dir) throws Exception {
        Path wsp = Path.of(getClass().getResource("/workspaces/two_level_v9.wsp").toURI());
        WorkspaceImport imported = new FlowJo9WorkspaceImporter().importWorkspace(wsp);

        Map<String, Object> tree = ExperimentConfigs.fromImport(imported, "round trip");
        Path yaml = dir.resolve("nested/out.yaml");
        ExperimentConfigs.write(yaml, tree);
        ExperimentConfig reloaded = ExperimentConfigs.load(yaml);

        assertThat(reloaded.getMetadata().experimentName()).isEqualTo("round trip");
        assertThat(reloaded.getCompensation().reference()).isEqualTo("Acquisition-defined");
        assertThat(reloaded.getPanel().get("FITC-A").fluor()).isEqualTo("CD3");
        assertThat(reloaded.getPanel().get("FITC-A").transform())
            .isEqualTo(imported.transforms().forChannel("FITC-A"));
        assertThat(reloaded.getPanel().get("SSC-A").role()).isEqualTo(ChannelRole.SCATTER_LINEAR);

        for (GateNode node : imported.hierarchy().depthFirst()) {
            if (node.isRoot()) {
                continue;
            }
            GateNode copy = reloaded.getHierarchy().findByPath(node.path()).orElseThrow();
            assertThat(copy.shape()).as(node.path()).isEqualTo(node.shape());
        }
        assertThat(reloaded.getCelltypePaths().keySet())
            .containsExactly("Lymphocytes", "Lymphocytes/CD3+", "Lymphocytes/CD3+/CD4+", "Lymphocytes/Population2");
    }

    @Test
    void skeletonIsAValidConfiguration() {
        Map<String, Object> skeleton = ExperimentConfigs.skeleton(List.of("FSC-A", "SSC-H", "FITC-A", "Time"), "run1");

        ExperimentConfig config = ExperimentConfigs.fromMap(ExperimentConfigs.parse(
            ExperimentConfigs.toYaml(skeleton), "skeleton"));

        assertThat(config.getMetadata().experimentName()).isEqualTo("run1");
        assertThat(config.getPanel().get("FITC-A").role()).isEqualTo(ChannelRole.FLUORESCENCE_LOGICLE);
        assertThat(config.getPanel().get("SSC-H").role()).isEqualTo(ChannelRole.SCATTER_LINEAR);
        assertThat(config.getPanel().get("Time").role()).isEqualTo(ChannelRole.TIME_LINEAR);
        assertThat(config.getHierarchy().size()).isEqualTo(1);
    }

    @Test
    void yamlIsWrittenInBlockStyleAndKeyOrder() {
        String yaml = ExperimentConfigs.toYaml(ExperimentConfigs.skeleton(List.of("FSC-A"), "run1"));

        assertThat(yaml).startsWith("metadata:\n  experiment_name: run1\n");
        assertThat(yaml.indexOf("panel:")).isLessThan(yaml.indexOf("celltypes:"));
        assertThat(yaml).doesNotContain("{fluor");
    }

    @Test
    void parseErrors() {
        assertThatThrownBy(() -> ExperimentConfigs.parse("panel: [unclosed", "bad.yaml"))
            .isInstanceOf(SchemaValidationException.class)
            .hasMessageContaining("bad.yaml: not valid YAML");
        assertThatThrownBy(() -> ExperimentConfigs.parse("- a\n- b\n", "list.yaml"))
            .isInstanceOf(SchemaValidationException.class)
            .hasMessageContaining("list.yaml: configuration must be a mapping");
        assertThat(ExperimentConfigs.parse("", "empty.yaml")).isEmpty();
    }
}
