package io.facsforge.workspace.flowjo;

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

import io.facsforge.gating.engine.ChannelNotFoundException;
import io.facsforge.gating.model.GateHierarchy;
import io.facsforge.gating.model.GateNode;
import io.facsforge.gating.model.PolygonGate;
import io.facsforge.gating.model.RangeGate;
import io.facsforge.gating.model.RectangleGate;
import io.facsforge.gating.model.Vertex;
import io.facsforge.transforms.LinearTransform;
import io.facsforge.transforms.LogicleParameters;
import io.facsforge.transforms.LogicleTransform;
import io.facsforge.transforms.TransformParameterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class FlowJo9WorkspaceImporterTest {

    private static final String PARAMETERS = """
        <Parameters>
          <Parameter name="FSC-A"/>
          <Parameter name="SSC-A"/>
          <Parameter name="FITC-A"/>
        </Parameters>
        """;

    private static final String SQUARE = """
        <gating:dimension><data-type:fcs-dimension data-type:name="FSC-A"/></gating:dimension>
        <gating:dimension><data-type:fcs-dimension data-type:name="SSC-A"/></gating:dimension>
        <gating:vertex><gating:coordinate data-type:value="0"/><gating:coordinate data-type:value="0"/></gating:vertex>
        <gating:vertex><gating:coordinate data-type:value="10"/><gating:coordinate data-type:value="0"/></gating:vertex>
        <gating:vertex><gating:coordinate data-type:value="10"/><gating:coordinate data-type:value="10"/></gating:vertex>
        <gating:vertex><gating:coordinate data-type:value="0"/><gating:coordinate data-type:value="10"/></gating:vertex>
        """;

    private final FlowJo9WorkspaceImporter importer = new FlowJo9WorkspaceImporter();

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(FlowJo9WorkspaceImporterTest.class.getResource("/workspaces/" + name).toURI());
    }

    private static String document(String sampleBody, String populations) {
        return """
            <?xml version="1.0" encoding="UTF-8"?>
            <Workspace xmlns:gating="http://www.isac-net.org/std/Gating-ML/v2.0/gating"
                       xmlns:data-type="http://www.isac-net.org/std/Gating-ML/v2.0/datatypes"
                       xmlns:transforms="http://www.isac-net.org/std/Gating-ML/v2.0/transformations">
              <SampleList>
                <Sample name="s1.fcs">
                  %s
                  <SampleNode name="s1.fcs">
                    <Subpopulations>
                      %s
                    </Subpopulations>
                  </SampleNode>
                </Sample>
              </SampleList>
            </Workspace>
            """.formatted(sampleBody, populations);
    }

    private static String population(String name, String gateAttributes, String gate, String children) {
        return """
            <Population name="%s">
              <Gate %s>
                %s
              </Gate>
              <Subpopulations>%s</Subpopulations>
            </Population>
            """.formatted(name, gateAttributes, gate, children);
    }

    private static String polygon(String attributes, String body) {
        return "<gating:PolygonGate " + attributes + ">" + body + "</gating:PolygonGate>";
    }

    private WorkspaceImport importString(String xml) throws IOException {
        return importer.importWorkspace(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "inline.wsp",
            null);
    }

    @Nested
    @DisplayName("two-level workspace fixture")
    class Fixture {

        @Test
        void readsChannelsPanelAndCompensation() throws Exception {
            WorkspaceImport result = importer.importWorkspace(resource("two_level_v9.wsp"));

            assertThat(result.sampleName()).isEqualTo("tube_01.fcs");
            assertThat(result.channels()).containsExactly("FSC-A", "SSC-A", "FITC-A", "PE-A", "Time");
            assertThat(result.panel()).containsEntry("FITC-A", "CD3").containsEntry("PE-A", "CD4")
                .containsEntry("FSC-A", null);
            assertThat(result.compensation().label()).isEqualTo("Acquisition-defined");
            assertThat(result.compensation().id()).isEqualTo("7");
        }

        @Test
        void readsTransformsWithPlainAndNamespacedAttributes() throws Exception {
            WorkspaceImport result = importer.importWorkspace(resource("two_level_v9.wsp"));

            assertThat(result.transforms().forChannel("FSC-A")).isInstanceOf(LinearTransform.class);
            assertThat(((LinearTransform) result.transforms().forChannel("FSC-A")).getDisplayMax())
                .isEqualTo(262144.0);
            assertThat(((LogicleTransform) result.transforms().forChannel("FITC-A")).getParameters())
                .isEqualTo(LogicleParameters.defaults());
            assertThat(((LogicleTransform) result.transforms().forChannel("PE-A")).getParameters())
                .isEqualTo(new LogicleParameters(262144, 1, 4.5, 0));
            assertThat(result.transforms().isDeclared("SSC-A")).isFalse();
        }

        @Test
        void buildsHierarchyInDocumentOrder() throws Exception {
            GateHierarchy hierarchy = importer.importWorkspace(resource("two_level_v9.wsp")).hierarchy();

            assertThat(hierarchy.root().name()).isEqualTo(FlowJo9WorkspaceImporter.ROOT_NAME);
            assertThat(hierarchy.root().shape()).isNull();
            assertThat(hierarchy.depthFirst()).extracting(GateNode::path)
                .containsExactly(FlowJo9WorkspaceImporter.ROOT_NAME, "Lymphocytes", "Lymphocytes/CD3+",
                    "Lymphocytes/CD3+/CD4+", "Lymphocytes/Population2");
        }

        @Test
        void convertsGateCoordinatesToDisplayUnits() throws Exception {
            GateHierarchy hierarchy = importer.importWorkspace(resource("two_level_v9.wsp")).hierarchy();
            LogicleTransform fitc = LogicleTransform.create(LogicleParameters.defaults());
            LogicleTransform pe = LogicleTransform.create(new LogicleParameters(262144, 1, 4.5, 0));

            PolygonGate lymphocytes = (PolygonGate) hierarchy.findByPath("Lymphocytes").orElseThrow().shape();
            assertThat(lymphocytes.getVertices()).containsExactly(
                Vertex.of(20000, 5000), Vertex.of(120000, 5000), Vertex.of(120000, 80000), Vertex.of(20000, 80000));

            RangeGate cd3 = (RangeGate) hierarchy.findByPath("Lymphocytes/CD3+").orElseThrow().shape();
            assertThat(cd3.getChannel()).isEqualTo("FITC-A");
            assertThat(cd3.getMin()).isCloseTo(fitc.toDisplay(1000), within(1e-12));
            assertThat(cd3.getMin()).isBetween(0.0, 1.0);
            assertThat(cd3.getMax()).isEqualTo(Double.POSITIVE_INFINITY);

            RectangleGate cd4 = (RectangleGate) hierarchy.findByPath("Lymphocytes/CD3+/CD4+").orElseThrow().shape();
            assertThat(cd4.getXMax()).isCloseTo(1.0, within(1e-6));
            assertThat(cd4.getYMin()).isCloseTo(pe.toDisplay(2000), within(1e-12));
            assertThat(cd4.getYMax()).isEqualTo(Double.POSITIVE_INFINITY);

            RangeGate time = (RangeGate) hierarchy.findByPath("Lymphocytes/Population2").orElseThrow().shape();
            assertThat(time.getMin()).isEqualTo(Double.NEGATIVE_INFINITY);
            assertThat(time.getMax()).isEqualTo(10.0);
        }

        @Test
        void selectsSampleByName() throws Exception {
            assertThat(importer.importWorkspace(resource("two_level_v9.wsp"), "tube_01.fcs").sampleName())
                .isEqualTo("tube_01.fcs");
            assertThatThrownBy(() -> importer.importWorkspace(resource("two_level_v9.wsp"), "tube_99.fcs"))
                .isInstanceOf(ImportException.class)
                .hasMessageContaining("no sample named 'tube_99.fcs'")
                .hasMessageContaining("tube_01.fcs");
        }
    }

    @Test
    @DisplayName("a gate on an undeclared channel fails the whole import")
    void undeclaredChannelFailsImport() {
        String gate = polygon("gating:id=\"G1\"", SQUARE.replace("SSC-A", "APC-A"));
        String xml = document(PARAMETERS, population("Bad", "", gate, ""));

        assertThatThrownBy(() -> importString(xml))
            .isInstanceOf(ImportException.class)
            .hasMessageContaining("APC-A")
            .satisfies(e -> {
                assertThat(e.getCause()).isInstanceOf(ChannelNotFoundException.class);
                assertThat(((ChannelNotFoundException) e.getCause()).getMissingChannels()).containsExactly("APC-A");
                Map<String, Object> structure = ((ImportException) e).getParsedStructure();
                assertThat(structure).containsEntry("sample", "s1.fcs");
                assertThat(structure.get("channels")).isEqualTo(List.of("FSC-A", "SSC-A", "FITC-A"));
            });
    }

    @Test
    void polygonNeedsThreeVertices() {
        String body = SQUARE.substring(0, SQUARE.indexOf("<gating:vertex><gating:coordinate data-type:value=\"10\"/>"
            + "<gating:coordinate data-type:value=\"10\"/>"));
        String xml = document(PARAMETERS, population("Tiny", "", polygon("", body), ""));

        assertThatThrownBy(() -> importString(xml))
            .isInstanceOf(ImportException.class)
            .hasMessageContaining("2 vertices");
    }

    @Test
    void parentIdMustMatchNesting() {
        String child = population("Child", "", polygon("gating:id=\"G2\" gating:parent_id=\"G3\"", SQUARE), "");
        String sibling = population("Other", "", polygon("gating:id=\"G3\"", SQUARE), "");
        String xml = document(PARAMETERS,
            population("Parent", "", polygon("gating:id=\"G1\"", SQUARE), child) + sibling);

        assertThatThrownBy(() -> importString(xml))
            .isInstanceOf(ImportException.class)
            .hasMessageContaining("declares parent gate 'G3'")
            .hasMessageContaining("'Parent'");
    }

    @Test
    void selfReferenceIsALinkageError() {
        String xml = document(PARAMETERS,
            population("Loop", "", polygon("gating:id=\"G1\" gating:parent_id=\"G1\"", SQUARE), ""));

        assertThatThrownBy(() -> importString(xml))
            .isInstanceOf(ImportException.class)
            .hasMessageContaining("declares parent gate 'G1'");
    }

    @Test
    void unknownParentId() {
        String child = population("Child", "", polygon("gating:id=\"G2\" gating:parent_id=\"G9\"", SQUARE), "");
        String xml = document(PARAMETERS, population("Parent", "", polygon("gating:id=\"G1\"", SQUARE), child));

        assertThatThrownBy(() -> importString(xml))
            .isInstanceOf(ImportException.class)
            .hasMessageContaining("'G9', which does not exist");
    }

    @Test
    void duplicateGateIds() {
        String xml = document(PARAMETERS,
            population("A", "", polygon("gating:id=\"G1\"", SQUARE), "")
                + population("B", "", polygon("gating:id=\"G1\"", SQUARE), ""));

        assertThatThrownBy(() -> importString(xml))
            .isInstanceOf(ImportException.class)
            .hasMessageContaining("gate id 'G1' is used by more than one population");
    }

    @Test
    void unsupportedGateKindIsNotDropped() {
        String ellipse = "<gating:EllipsoidGate gating:id=\"G1\">" + SQUARE + "</gating:EllipsoidGate>";
        String xml = document(PARAMETERS, population("Round", "", ellipse, ""));

        assertThatThrownBy(() -> importString(xml))
            .isInstanceOf(ImportException.class)
            .hasMessageContaining("unsupported gate type 'EllipsoidGate'");
    }

    @Test
    void populationWithoutGate() {
        String xml = document(PARAMETERS, "<Population name=\"Ungated\"/>");

        assertThatThrownBy(() -> importString(xml))
            .isInstanceOf(ImportException.class)
            .hasMessageContaining("'Ungated' has no Gate");
    }

    @Test
    void siblingsWithTheSameNameAreRejected() {
        String xml = document(PARAMETERS,
            population("Twin", "", polygon("", SQUARE), "") + population("Twin", "", polygon("", SQUARE), ""));

        assertThatThrownBy(() -> importString(xml))
            .isInstanceOf(ImportException.class)
            .hasMessageContaining("Twin");
    }

    @Test
    void slashInPopulationNameIsReplaced() throws IOException {
        String xml = document(PARAMETERS, population("CD4/CD8", "", polygon("", SQUARE), ""));

        assertThat(importString(xml).hierarchy().findByPath("CD4_CD8")).isPresent();
    }

    @Test
    void unsupportedTransformKind() {
        String transforms = """
            <Transformations>
              <transforms:fasinh transforms:T="262144" transforms:M="4.5" transforms:A="0">
                <data-type:parameter data-type:name="FITC-A"/>
              </transforms:fasinh>
            </Transformations>
            """;
        String xml = document(PARAMETERS + transforms, population("A", "", polygon("", SQUARE), ""));

        assertThatThrownBy(() -> importString(xml))
            .isInstanceOf(ImportException.class)
            .hasMessageContaining("unsupported transform 'fasinh'");
    }

    @Test
    void transformOnUndeclaredChannel() {
        String transforms = """
            <Transformations>
              <transforms:logicle><data-type:parameter data-type:name="BV421-A"/></transforms:logicle>
            </Transformations>
            """;
        String xml = document(PARAMETERS + transforms, population("A", "", polygon("", SQUARE), ""));

        assertThatThrownBy(() -> importString(xml))
            .isInstanceOf(ImportException.class)
            .hasCauseInstanceOf(ChannelNotFoundException.class);
    }

    @Test
    void invalidLogicleParametersFailAtImport() {
        String transforms = """
            <Transformations>
              <transforms:logicle transforms:T="0"><data-type:parameter data-type:name="FITC-A"/></transforms:logicle>
            </Transformations>
            """;
        String xml = document(PARAMETERS + transforms, population("A", "", polygon("", SQUARE), ""));

        assertThatThrownBy(() -> importString(xml))
            .isInstanceOf(ImportException.class)
            .hasMessageContaining("logicle transform on channel FITC-A")
            .hasCauseInstanceOf(TransformParameterException.class)
            .satisfies(e -> assertThat(((ImportException) e).getParsedStructure())
                .containsKey("sample")
                .containsKey("transforms"));
    }

    @Test
    void malformedXml() {
        assertThatThrownBy(() -> importString("<Workspace><SampleList></Workspace>"))
            .isInstanceOf(ImportException.class)
            .hasMessageContaining("Failed to parse");
    }

    @Test
    void documentWithoutSamples() {
        assertThatThrownBy(() -> importString("<Workspace/>"))
            .isInstanceOf(ImportException.class)
            .hasMessageContaining("no SampleNode");
    }

    @Test
    void emptySampleImportsAsBareRoot() throws IOException {
        WorkspaceImport result = importString(document(PARAMETERS, ""));

        assertThat(result.hierarchy().size()).isEqualTo(1);
        assertThat(result.compensation().isNone()).isTrue();
    }

    @Test
    @DisplayName("a ZIP archive is refused as FlowJo v10")
    void archiveIsUnsupported(@TempDir Path dir) throws IOException {
        Path wsp = dir.resolve("v10.wsp");
        Files.write(wsp, new byte[]{'P', 'K', 3, 4, 20, 0, 0, 0});

        assertThat(WorkspaceFormat.detect(wsp)).isEqualTo(WorkspaceFormat.FLOWJO_V10);
        assertThatThrownBy(() -> importer.importWorkspace(wsp))
            .isInstanceOf(UnsupportedFormatException.class)
            .satisfies(e -> assertThat(((UnsupportedFormatException) e).getFormat())
                .isEqualTo(WorkspaceFormat.FLOWJO_V10));
        assertThatThrownBy(() -> new FlowJo10WorkspaceImporter().importWorkspace(wsp))
            .isInstanceOf(UnsupportedFormatException.class)
            .hasMessageContaining("not supported");
        assertThat(WorkspaceImporter.forFormat(WorkspaceFormat.FLOWJO_V10))
            .isInstanceOf(FlowJo10WorkspaceImporter.class);
    }

    @Test
    void xmlFileIsDetectedAsVersionNine(@TempDir Path dir) throws IOException {
        Path wsp = dir.resolve("v9.wsp");
        Files.writeString(wsp, document(PARAMETERS, ""));

        assertThat(WorkspaceFormat.detect(wsp)).isEqualTo(WorkspaceFormat.FLOWJO_V9_XML);
        assertThat(WorkspaceImporter.forFormat(WorkspaceFormat.detect(wsp)).importWorkspace(wsp).sampleName())
            .isEqualTo("s1.fcs");
    }
}
