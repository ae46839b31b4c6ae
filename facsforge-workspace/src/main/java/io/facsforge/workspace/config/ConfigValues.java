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

import io.facsforge.gating.model.GateShape;
import io.facsforge.gating.model.PolygonGate;
import io.facsforge.gating.model.RangeGate;
import io.facsforge.gating.model.RectangleGate;
import io.facsforge.gating.model.Vertex;
import io.facsforge.transforms.ChannelRole;
import io.facsforge.transforms.ChannelTransform;
import io.facsforge.transforms.LinearTransform;
import io.facsforge.transforms.LogicleParameters;
import io.facsforge.transforms.LogicleTransform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Conversions between configuration-file values and model objects.
///
/// The methods here assume the value has already passed {@link ConfigSchemaValidator};
/// they still throw the model's own exceptions for values the validator feeds them
/// while checking.
final class ConfigValues {

    static final String TYPE = "type";
    static final String POLYGON = "polygon";
    static final String RECTANGLE = "rectangle";
    static final String THRESHOLD = "threshold";

    private ConfigValues() {
    }

    /// YAML integers load as Integer, Long or BigInteger, floats as Double.
    static Double number(Object value) {
        return value instanceof Number n ? n.doubleValue() : null;
    }

    static double numberOr(Object value, double missing) {
        Double d = number(value);
        return d == null ? missing : d;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> map(Object value) {
        return (Map<String, Object>) value;
    }

    static List<String> strings(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                out.add(String.valueOf(item));
            }
        }
        return out;
    }

    /// @return the population name for a celltype key, its last `/` segment
    static String nodeName(String key) {
        int slash = key.lastIndexOf('/');
        return slash < 0 ? key : key.substring(slash + 1);
    }

    /// Builds the transform for a panel entry.
    ///
    /// @param spec the `transform` mapping, may be null
    /// @param role the declared role, used when there is no mapping
    static ChannelTransform transform(Map<String, Object> spec, ChannelRole role) {
        if (spec == null) {
            return role.isLinear() ? LinearTransform.identity() : LogicleTransform.create(LogicleParameters.defaults());
        }
        String type = String.valueOf(spec.get(TYPE));
        if (type.equalsIgnoreCase(LogicleTransform.KIND)) {
            return LogicleTransform.create(new LogicleParameters(
                numberOr(spec.get("T"), LogicleParameters.DEFAULT_T),
                numberOr(spec.get("W"), LogicleParameters.DEFAULT_W),
                numberOr(spec.get("M"), LogicleParameters.DEFAULT_M),
                numberOr(spec.get("A"), LogicleParameters.DEFAULT_A)));
        }
        Double min = number(spec.get("min"));
        Double max = number(spec.get("max"));
        return min != null && max != null ? LinearTransform.withRange(min, max) : LinearTransform.identity();
    }

    static Map<String, Object> transformToMap(ChannelTransform transform) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(TYPE, transform.kind());
        if (transform instanceof LogicleTransform logicle) {
            LogicleParameters p = logicle.getParameters();
            map.put("T", p.T());
            map.put("W", p.W());
            map.put("M", p.M());
            map.put("A", p.A());
        } else if (transform instanceof LinearTransform linear && linear.hasDisplayRange()) {
            map.put("min", linear.getDisplayMin());
            map.put("max", linear.getDisplayMax());
        }
        return map;
    }

    /// Builds a gate shape from a `gate` mapping. Rectangles take the bounding box of
    /// their vertices; a threshold without `min` or `max` is open on that side.
    static GateShape gate(Map<String, Object> spec) {
        String type = String.valueOf(spec.get(TYPE));
        if (type.equals(THRESHOLD)) {
            return new RangeGate(String.valueOf(spec.get("channel")),
                numberOr(spec.get("min"), Double.NEGATIVE_INFINITY),
                numberOr(spec.get("max"), Double.POSITIVE_INFINITY));
        }
        List<String> channels = strings(spec.get("channels"));
        List<Vertex> vertices = new ArrayList<>();
        for (Object item : (List<?>) spec.get("vertices")) {
            List<?> pair = (List<?>) item;
            vertices.add(Vertex.of(number(pair.get(0)), number(pair.get(1))));
        }
        if (type.equals(POLYGON)) {
            return new PolygonGate(channels.get(0), channels.get(1), vertices);
        }
        double xMin = Double.POSITIVE_INFINITY, xMax = Double.NEGATIVE_INFINITY;
        double yMin = Double.POSITIVE_INFINITY, yMax = Double.NEGATIVE_INFINITY;
        for (Vertex v : vertices) {
            xMin = Math.min(xMin, v.x());
            xMax = Math.max(xMax, v.x());
            yMin = Math.min(yMin, v.y());
            yMax = Math.max(yMax, v.y());
        }
        return new RectangleGate(channels.get(0), channels.get(1), xMin, xMax, yMin, yMax);
    }

    static Map<String, Object> gateToMap(GateShape shape) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (shape instanceof RangeGate range) {
            map.put(TYPE, THRESHOLD);
            map.put("channel", range.getChannel());
            if (range.getMin() != Double.NEGATIVE_INFINITY) {
                map.put("min", range.getMin());
            }
            if (range.getMax() != Double.POSITIVE_INFINITY) {
                map.put("max", range.getMax());
            }
            return map;
        }
        List<List<Double>> vertices = new ArrayList<>();
        if (shape instanceof RectangleGate rect) {
            map.put(TYPE, RECTANGLE);
            vertices.add(List.of(rect.getXMin(), rect.getYMin()));
            vertices.add(List.of(rect.getXMax(), rect.getYMax()));
        } else if (shape instanceof PolygonGate polygon) {
            map.put(TYPE, POLYGON);
            for (Vertex v : polygon.getVertices()) {
                vertices.add(List.of(v.x(), v.y()));
            }
        } else {
            throw new IllegalArgumentException("No configuration form for gate type " + shape.getGateType());
        }
        map.put("channels", new ArrayList<>(shape.channels()));
        map.put("vertices", vertices);
        return map;
    }
}
