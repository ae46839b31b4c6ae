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
import io.facsforge.gating.engine.PopulationNames;
import io.facsforge.gating.model.GateHierarchy;
import io.facsforge.gating.model.GateNode;
import io.facsforge.gating.model.GateShape;
import io.facsforge.gating.model.InvalidHierarchyException;
import io.facsforge.gating.model.PolygonGate;
import io.facsforge.gating.model.RangeGate;
import io.facsforge.gating.model.RectangleGate;
import io.facsforge.gating.model.Vertex;
import io.facsforge.transforms.ChannelTransform;
import io.facsforge.transforms.ChannelTransforms;
import io.facsforge.transforms.LogicleParameters;
import io.facsforge.transforms.TransformParameterException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Imports one sample's gate tree from a FlowJo v9 XML workspace.
 *
 * <h2>Document layout</h2>
 *
 * <pre>{@code
 * Workspace
 *  └ SampleList/Sample            (compensation="id")
 *     ├ Parameter name=...        declared channels, optional <Detector>
 *     ├ Keywords/Keyword $PnN     declared channels
 *     ├ Transformations
 *     │   └ transforms:logicle | transforms:linear
 *     │        └ data-type:parameter data-type:name=...
 *     └ SampleNode name=...
 *         └ Subpopulations/Population name=...
 *              ├ Gate gating:id=... gating:parent_id=...
 *              │   └ gating:PolygonGate | gating:RectangleGate
 *              └ Subpopulations/Population ...
 * }</pre>
 *
 * <p>Gate coordinates in the document are raw channel values. They are passed through
 * the channel's transform so the resulting hierarchy holds display units.
 *
 * <p>The import is all or nothing: any population without a supported gate, any
 * reference to an undeclared channel, or any inconsistency between gate ids and
 * population nesting fails the whole import.
 */
public final class FlowJo9WorkspaceImporter implements WorkspaceImporter {

    private static final Logger logger = LogManager.getLogger(FlowJo9WorkspaceImporter.class);

    public static final String GATING_NS = "http://www.isac-net.org/std/Gating-ML/v2.0/gating";
    public static final String DATATYPE_NS = "http://www.isac-net.org/std/Gating-ML/v2.0/datatypes";
    public static final String TRANSFORMS_NS = "http://www.isac-net.org/std/Gating-ML/v2.0/transformations";

    /** Name of the ungated root placed above the sample's top-level populations. */
    public static final String ROOT_NAME = "All Events";

    private static final Pattern PARAMETER_KEYWORD = Pattern.compile("\\$P(\\d+)([NS])", Pattern.CASE_INSENSITIVE);

    @Override
    public WorkspaceImport importWorkspace(Path workspace, String sampleName) throws IOException {
        if (WorkspaceFormat.detect(workspace) == WorkspaceFormat.FLOWJO_V10) {
            throw new UnsupportedFormatException(WorkspaceFormat.FLOWJO_V10,
                workspace + " is a ZIP archive; " + FlowJo10WorkspaceImporter.MESSAGE);
        }
        try (InputStream in = Files.newInputStream(workspace)) {
            return importWorkspace(in, workspace.toString(), sampleName);
        }
    }

    /**
     * @param in         XML content
     * @param source     name used in messages
     * @param sampleName the sample to read, or null for the first one
     * @return the import
     * @throws IOException if the stream cannot be read
     */
    public WorkspaceImport importWorkspace(InputStream in, String source, String sampleName) throws IOException {
        Document document = parse(in, source);
        Session session = new Session(source);
        try {
            WorkspaceImport result = session.read(document, sampleName);
            logger.info("Imported sample '{}' from {}: {} channel(s), {} population(s)",
                result.sampleName(), source, result.channels().size(), result.hierarchy().size() - 1);
            return result;
        } catch (InvalidHierarchyException e) {
            throw session.fail(e.getMessage(), e);
        }
    }

    static Document parse(InputStream in, String source) throws IOException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setCoalescing(true);
            factory.setIgnoringComments(true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException e) {
                    logger.warn("{}:{}: {}", source, e.getLineNumber(), e.getMessage());
                }

                @Override
                public void error(SAXParseException e) throws SAXException {
                    throw e;
                }

                @Override
                public void fatalError(SAXParseException e) throws SAXException {
                    throw e;
                }
            });
            return builder.parse(in, source);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support the required features", e);
        } catch (SAXParseException e) {
            throw new ImportException("Failed to parse FlowJo v9 XML " + source + " at line " + e.getLineNumber()
                + ": " + e.getMessage(), e);
        } catch (SAXException e) {
            throw new ImportException("Failed to parse FlowJo v9 XML " + source + ": " + e.getMessage(), e);
        }
    }

    /** State of one import, including the structure read so far for diagnostics. */
    private static final class Session {

        private final String source;
        private final Map<String, Object> structure = new LinkedHashMap<>();
        private final List<Map<String, Object>> parsedPopulations = new ArrayList<>();

        private Session(String source) {
            this.source = source;
        }

        ImportException fail(String message) {
            return fail(message, null);
        }

        ImportException fail(String message, Throwable cause) {
            return new ImportException(source + ": " + message, cause, structure);
        }

        WorkspaceImport read(Document document, String sampleName) {
            Element sampleNode = selectSampleNode(document, sampleName);
            Element sample = ancestor(sampleNode, "Sample");
            Element context = sample != null ? sample : document.getDocumentElement();
            String name = sampleNodeName(sampleNode, sample);
            structure.put("sample", name);

            Map<String, String> panel = readPanel(document, context);
            Set<String> declared = panel.keySet();
            structure.put("channels", new ArrayList<>(declared));
            structure.put("panel", panel);

            ChannelTransforms transforms = readTransforms(document, context, declared);
            CompensationReference compensation = readCompensation(document, sample);
            if (!compensation.isNone()) {
                structure.put("compensation", compensation.label());
            }

            structure.put("populations", parsedPopulations);
            List<PopulationEntry> entries = new ArrayList<>();
            readPopulations(sampleNode, null, "", declared, transforms, entries);
            checkLinkage(entries);

            GateHierarchy.Builder builder = GateHierarchy.builder();
            builder.declare(0, GateNode.NO_PARENT, ROOT_NAME, null, null);
            for (PopulationEntry entry : entries) {
                int parent = entry.parent == null ? 0 : entry.parent.index + 1;
                builder.declare(entry.index + 1, parent, entry.name, entry.shape, null);
            }
            GateHierarchy hierarchy = builder.build();
            return new WorkspaceImport(name, new ArrayList<>(declared), panel, transforms, hierarchy, compensation);
        }

        private Element selectSampleNode(Document document, String sampleName) {
            List<Element> nodes = elements(document.getElementsByTagNameNS("*", "SampleNode"));
            if (nodes.isEmpty()) {
                throw fail("no SampleNode found; the document does not look like a FlowJo v9 workspace");
            }
            if (sampleName == null) {
                return nodes.get(0);
            }
            List<String> available = new ArrayList<>();
            for (Element node : nodes) {
                String name = sampleNodeName(node, ancestor(node, "Sample"));
                if (sampleName.equals(name)) {
                    return node;
                }
                available.add(name);
            }
            throw fail("no sample named '" + sampleName + "'; available: " + available);
        }

        private Map<String, String> readPanel(Document document, Element context) {
            List<Element> parameters = descendants(context, "Parameter");
            if (parameters.isEmpty()) {
                parameters = descendants(document.getDocumentElement(), "Parameter");
            }
            Map<String, String> panel = new LinkedHashMap<>();
            for (Element parameter : parameters) {
                String name = firstNonBlank(attr(parameter, "name"), attr(parameter, "shortName"),
                    attr(parameter, "longName"));
                if (name == null) {
                    continue;
                }
                String fluor = null;
                for (Element detector : children(parameter, "Detector")) {
                    fluor = blankToNull(detector.getTextContent());
                }
                if (fluor != null || !panel.containsKey(name)) {
                    panel.put(name, fluor);
                }
            }

            Map<String, String> names = new HashMap<>();
            Map<String, String> stains = new HashMap<>();
            for (Element keyword : descendants(context, "Keyword")) {
                String key = attr(keyword, "name");
                String value = blankToNull(attr(keyword, "value"));
                if (key == null || value == null) {
                    continue;
                }
                Matcher m = PARAMETER_KEYWORD.matcher(key.trim());
                if (m.matches()) {
                    (m.group(2).equalsIgnoreCase("N") ? names : stains).put(m.group(1), value);
                }
            }
            List<String> indices = new ArrayList<>(names.keySet());
            indices.sort((a, b) -> Integer.compare(Integer.parseInt(a), Integer.parseInt(b)));
            for (String index : indices) {
                String channel = names.get(index);
                String stain = stains.get(index);
                if (!panel.containsKey(channel) || (panel.get(channel) == null && stain != null)) {
                    panel.put(channel, stain);
                }
            }
            return panel;
        }

        private ChannelTransforms readTransforms(Document document, Element context, Set<String> declared) {
            List<Element> blocks = descendants(context, "Transformations");
            if (blocks.isEmpty()) {
                blocks = descendants(document.getDocumentElement(), "Transformations");
            }
            ChannelTransforms.Builder builder = ChannelTransforms.builder();
            Map<String, String> described = new LinkedHashMap<>();
            structure.put("transforms", described);
            for (Element block : blocks) {
                for (Element transform : children(block, null)) {
                    if (!TRANSFORMS_NS.equals(transform.getNamespaceURI())) {
                        logger.debug("Ignoring {} in Transformations of {}", transform.getTagName(), source);
                        continue;
                    }
                    String kind = localName(transform);
                    String channel = transformChannel(transform, kind);
                    requireDeclared(channel, declared, "transform '" + kind + "'");
                    try {
                        if (kind.equalsIgnoreCase("logicle")) {
                            LogicleParameters parameters = new LogicleParameters(
                                number(transform, "T", LogicleParameters.DEFAULT_T),
                                number(transform, "W", LogicleParameters.DEFAULT_W),
                                number(transform, "M", LogicleParameters.DEFAULT_M),
                                number(transform, "A", LogicleParameters.DEFAULT_A));
                            builder.logicle(channel, parameters);
                            described.put(channel, parameters.toString());
                        } else if (kind.equalsIgnoreCase("linear")) {
                            String min = attr(transform, "minRange");
                            String max = attr(transform, "maxRange");
                            if (min != null && max != null) {
                                builder.linear(channel, parse(min, "minRange"), parse(max, "maxRange"));
                            } else {
                                builder.linear(channel);
                            }
                            described.put(channel, "linear");
                        } else {
                            throw fail("unsupported transform '" + kind + "' on channel " + channel
                                + "; only logicle and linear are supported");
                        }
                    } catch (TransformParameterException e) {
                        described.put(channel, kind + " (invalid)");
                        throw fail(kind + " transform on channel " + channel + ": " + e.getMessage(), e);
                    }
                }
            }
            return builder.build();
        }

        private String transformChannel(Element transform, String kind) {
            for (Element parameter : children(transform, "parameter")) {
                String name = blankToNull(attr(parameter, "name"));
                if (name != null) {
                    return name;
                }
            }
            throw fail("transform '" + kind + "' names no parameter");
        }

        private CompensationReference readCompensation(Document document, Element sample) {
            String id = sample == null ? null : blankToNull(attr(sample, "compensation"));
            List<Element> matrices = descendants(document.getDocumentElement(), "CompensationMatrix");
            for (Element matrix : matrices) {
                String matrixId = blankToNull(attr(matrix, "id"));
                if (id == null || id.equals(matrixId)) {
                    return new CompensationReference(id != null ? id : matrixId, blankToNull(attr(matrix, "name")));
                }
            }
            return id == null ? CompensationReference.none() : new CompensationReference(id, null);
        }

        private void readPopulations(Element owner, PopulationEntry parent, String parentPath, Set<String> declared,
                                     ChannelTransforms transforms, List<PopulationEntry> entries) {
            int sibling = 0;
            for (Element subpopulations : children(owner, "Subpopulations")) {
                for (Element population : children(subpopulations, "Population")) {
                    sibling++;
                    String name = blankToNull(attr(population, "name"));
                    if (name == null) {
                        name = PopulationNames.unnamed(sibling);
                    } else if (name.contains("/")) {
                        String sanitized = name.replace('/', '_');
                        logger.warn("Population name '{}' contains '/', using '{}'", name, sanitized);
                        name = sanitized;
                    }
                    String path = parentPath.isEmpty() ? name : parentPath + "/" + name;

                    PopulationEntry entry = new PopulationEntry(entries.size(), name, path, parent);
                    Map<String, Object> parsed = new LinkedHashMap<>();
                    parsed.put("path", path);
                    parsedPopulations.add(parsed);

                    Element gate = first(children(population, "Gate"));
                    if (gate == null) {
                        throw fail("population '" + path + "' has no Gate");
                    }
                    Element shape = null;
                    for (Element child : children(gate, null)) {
                        if (GATING_NS.equals(child.getNamespaceURI())) {
                            shape = child;
                            break;
                        }
                    }
                    if (shape == null) {
                        throw fail("population '" + path + "' has a Gate without a Gating-ML gate");
                    }
                    entry.gateId = firstNonBlank(attr(shape, "id"), attr(gate, "id"));
                    entry.parentGateId = firstNonBlank(attr(shape, "parent_id"), attr(gate, "parent_id"));
                    parsed.put("gate", localName(shape));
                    if (entry.gateId != null) {
                        parsed.put("id", entry.gateId);
                    }
                    if (entry.parentGateId != null) {
                        parsed.put("parent_id", entry.parentGateId);
                    }
                    entry.shape = readShape(shape, path, declared, transforms);
                    entries.add(entry);

                    readPopulations(population, entry, path, declared, transforms, entries);
                }
            }
        }

        private GateShape readShape(Element shape, String path, Set<String> declared, ChannelTransforms transforms) {
            String kind = localName(shape);
            List<Element> dimensions = children(shape, "dimension");
            List<String> channels = new ArrayList<>();
            for (Element dimension : dimensions) {
                String channel = null;
                for (Element fcs : children(dimension, "fcs-dimension")) {
                    channel = blankToNull(attr(fcs, "name"));
                }
                if (channel == null) {
                    throw fail("gate of '" + path + "' has a dimension without an fcs-dimension name");
                }
                requireDeclared(channel, declared, "gate of '" + path + "'");
                channels.add(channel);
            }

            if (kind.equals("PolygonGate")) {
                if (channels.size() != 2) {
                    throw fail("polygon gate of '" + path + "' has " + channels.size() + " dimensions, expected 2");
                }
                ChannelTransform x = transforms.forChannel(channels.get(0));
                ChannelTransform y = transforms.forChannel(channels.get(1));
                List<Vertex> vertices = new ArrayList<>();
                for (Element vertex : children(shape, "vertex")) {
                    List<Element> coordinates = children(vertex, "coordinate");
                    if (coordinates.size() != 2) {
                        throw fail("polygon gate of '" + path + "' has a vertex with " + coordinates.size()
                            + " coordinates");
                    }
                    vertices.add(Vertex.of(
                        x.toDisplay(parse(attr(coordinates.get(0), "value"), "coordinate")),
                        y.toDisplay(parse(attr(coordinates.get(1), "value"), "coordinate"))));
                }
                if (vertices.size() < 3) {
                    throw fail("polygon gate of '" + path + "' has " + vertices.size()
                        + " vertices, at least 3 are required");
                }
                return new PolygonGate(channels.get(0), channels.get(1), vertices);
            }

            if (kind.equals("RectangleGate")) {
                List<Element> intervals = children(shape, "interval");
                double[] lows = new double[channels.size()];
                double[] highs = new double[channels.size()];
                for (int i = 0; i < channels.size(); i++) {
                    Element dimension = dimensions.get(i);
                    Element interval = i < intervals.size() ? intervals.get(i) : null;
                    String low = firstNonBlank(attr(dimension, "min"), interval == null ? null : attr(interval, "low"));
                    String high = firstNonBlank(attr(dimension, "max"),
                        interval == null ? null : attr(interval, "high"));
                    ChannelTransform transform = transforms.forChannel(channels.get(i));
                    lows[i] = low == null ? Double.NEGATIVE_INFINITY : transform.toDisplay(parse(low, "min"));
                    highs[i] = high == null ? Double.POSITIVE_INFINITY : transform.toDisplay(parse(high, "max"));
                }
                if (channels.size() == 2) {
                    return new RectangleGate(channels.get(0), channels.get(1), lows[0], highs[0], lows[1], highs[1]);
                }
                if (channels.size() == 1) {
                    return new RangeGate(channels.get(0), lows[0], highs[0]);
                }
                throw fail("rectangle gate of '" + path + "' has " + channels.size() + " dimensions, expected 1 or 2");
            }

            throw fail("population '" + path + "' uses an unsupported gate type '" + kind
                + "'; only PolygonGate and RectangleGate are supported");
        }

        private void checkLinkage(List<PopulationEntry> entries) {
            Map<String, PopulationEntry> byId = new HashMap<>();
            for (PopulationEntry entry : entries) {
                if (entry.gateId != null && byId.put(entry.gateId, entry) != null) {
                    throw fail("gate id '" + entry.gateId + "' is used by more than one population");
                }
            }
            for (PopulationEntry entry : entries) {
                if (entry.parentGateId == null) {
                    continue;
                }
                if (!byId.containsKey(entry.parentGateId)) {
                    throw fail("gate of '" + entry.path + "' references parent gate '" + entry.parentGateId
                        + "', which does not exist");
                }
                String enclosing = entry.parent == null ? null : entry.parent.gateId;
                if (!entry.parentGateId.equals(enclosing)) {
                    throw fail("gate of '" + entry.path + "' declares parent gate '" + entry.parentGateId
                        + "' but is nested under " + (entry.parent == null ? "the sample" : "'" + entry.parent.path
                        + "'" + (enclosing == null ? " (no gate id)" : " (gate '" + enclosing + "')")));
                }
            }
        }

        private void requireDeclared(String channel, Set<String> declared, String where) {
            if (!declared.contains(channel)) {
                ChannelNotFoundException cause = new ChannelNotFoundException(List.of(channel));
                throw fail(where + " references channel '" + channel + "', which the sample does not declare",
                    cause);
            }
        }

        private double number(Element element, String name, double missing) {
            String value = attr(element, name);
            return value == null ? missing : parse(value, name);
        }

        private double parse(String value, String what) {
            if (value == null) {
                throw fail("missing " + what + " value");
            }
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                throw fail("'" + value + "' is not a valid " + what, e);
            }
        }
    }

    private static final class PopulationEntry {
        final int index;
        final String name;
        final String path;
        final PopulationEntry parent;
        String gateId;
        String parentGateId;
        GateShape shape;

        PopulationEntry(int index, String name, String path, PopulationEntry parent) {
            this.index = index;
            this.name = name;
            this.path = path;
            this.parent = parent;
        }
    }

    private static String sampleNodeName(Element sampleNode, Element sample) {
        String name = blankToNull(attr(sampleNode, "name"));
        if (name == null && sample != null) {
            name = blankToNull(attr(sample, "name"));
        }
        return name == null ? "sample" : name;
    }

    /**
     * Finds an attribute by local name, ignoring case and namespace, so that
     * {@code transforms:T}, {@code t} and {@code T} all match {@code "T"}.
     */
    static String attr(Element element, String name) {
        String exact = element.getAttribute(name);
        if (!exact.isEmpty()) {
            return exact;
        }
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attribute = (Attr) attributes.item(i);
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attribute.getNamespaceURI())) {
                continue;
            }
            String local = attribute.getLocalName() != null ? attribute.getLocalName() : attribute.getName();
            if (local.equalsIgnoreCase(name)) {
                return attribute.getValue();
            }
        }
        return null;
    }

    private static String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }

    /** Child elements with the given local name in any namespace, or all child elements for null. */
    private static List<Element> children(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE && (localName == null || localName.equals(localName(child)))) {
                result.add((Element) child);
            }
        }
        return result;
    }

    private static List<Element> descendants(Element root, String localName) {
        return elements(root.getElementsByTagNameNS("*", localName));
    }

    private static List<Element> elements(NodeList nodes) {
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    private static Element ancestor(Element element, String localName) {
        for (Node node = element.getParentNode(); node != null; node = node.getParentNode()) {
            if (node.getNodeType() == Node.ELEMENT_NODE && localName.equals(localName(node))) {
                return (Element) node;
            }
        }
        return null;
    }

    private static Element first(List<Element> elements) {
        return elements.isEmpty() ? null : elements.get(0);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
