package io.facsforge.gating.json;

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

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.internal.Streams;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.facsforge.gating.model.GateShape;
import io.facsforge.gating.model.GateType;
import io.facsforge.gating.model.PolygonGate;
import io.facsforge.gating.model.RangeGate;
import io.facsforge.gating.model.RectangleGate;
import io.facsforge.gating.model.Vertex;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Gson {@link TypeAdapterFactory} for polymorphic {@link GateShape} serialization.
 *
 * <pre>{@code
 *  PolygonGate                  { "type": "polygon",
 *    @GateType("polygon")  <->    "channels": ["FSC-A", "SSC-A"],
 *                                 "vertices": [{"x": 1.0, "y": 2.0}, ...] }
 * }</pre>
 *
 * <p>Writing uses Gson's reflective adapter for the concrete class and puts the
 * {@code type} discriminator first. Reading dispatches on {@code type} and goes through
 * the shape's public constructor, so a shape read from JSON is validated exactly like
 * one built in code.
 *
 * @see GateType
 */
public final class GateShapeTypeAdapterFactory implements TypeAdapterFactory {

    private static final String TYPE_FIELD = "type";

    private final Map<String, Function<JsonObject, GateShape>> readers = new HashMap<>();
    private final Map<Class<? extends GateShape>, String> classToType = new HashMap<>();

    private GateShapeTypeAdapterFactory() {
    }

    /**
     * @return a factory with every built-in shape registered
     */
    public static GateShapeTypeAdapterFactory create() {
        GateShapeTypeAdapterFactory factory = new GateShapeTypeAdapterFactory();
        factory.registerType(PolygonGate.class, GateShapeTypeAdapterFactory::readPolygon);
        factory.registerType(RectangleGate.class, GateShapeTypeAdapterFactory::readRectangle);
        factory.registerType(RangeGate.class, GateShapeTypeAdapterFactory::readRange);
        return factory;
    }

    /**
     * @param shapeClass a shape annotated with {@link GateType}
     * @param reader     builds the shape from its JSON object
     * @throws IllegalArgumentException if the class is not annotated or its type is taken
     */
    public void registerType(Class<? extends GateShape> shapeClass, Function<JsonObject, GateShape> reader) {
        GateType annotation = shapeClass.getAnnotation(GateType.class);
        if (annotation == null) {
            throw new IllegalArgumentException("Class " + shapeClass.getName() + " has no @GateType annotation");
        }
        String typeName = annotation.value();
        if (readers.containsKey(typeName)) {
            throw new IllegalArgumentException("Gate type '" + typeName + "' is already registered");
        }
        readers.put(typeName, reader);
        classToType.put(shapeClass, typeName);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (!GateShape.class.isAssignableFrom(type.getRawType())) {
            return null;
        }
        return new TypeAdapter<T>() {
            @Override
            public void write(JsonWriter out, T value) throws IOException {
                if (value == null) {
                    out.nullValue();
                    return;
                }
                GateShape shape = (GateShape) value;
                String typeName = classToType.getOrDefault(shape.getClass(), shape.getGateType());
                TypeAdapter<T> concrete = (TypeAdapter<T>) gson.getDelegateAdapter(
                    GateShapeTypeAdapterFactory.this, TypeToken.get(value.getClass()));
                // lenient round trip keeps infinite bounds, which a tree writer rejects
                StringWriter buffer = new StringWriter();
                JsonWriter lenientWriter = new JsonWriter(buffer);
                lenientWriter.setLenient(true);
                concrete.write(lenientWriter, value);
                lenientWriter.close();
                JsonObject fields = JsonParser.parseString(buffer.toString()).getAsJsonObject();

                JsonObject result = new JsonObject();
                result.addProperty(TYPE_FIELD, typeName);
                for (Map.Entry<String, JsonElement> entry : fields.entrySet()) {
                    if (!TYPE_FIELD.equals(entry.getKey())) {
                        result.add(entry.getKey(), entry.getValue());
                    }
                }
                boolean wasLenient = out.isLenient();
                out.setLenient(true);
                try {
                    Streams.write(result, out);
                } finally {
                    out.setLenient(wasLenient);
                }
            }

            @Override
            public T read(JsonReader in) throws IOException {
                JsonElement element = JsonParser.parseReader(in);
                if (element.isJsonNull()) {
                    return null;
                }
                JsonObject obj = element.getAsJsonObject();
                if (!obj.has(TYPE_FIELD)) {
                    throw new JsonParseException("Missing '" + TYPE_FIELD + "' field in gate: " + obj);
                }
                String typeName = obj.get(TYPE_FIELD).getAsString();
                Function<JsonObject, GateShape> reader = readers.get(typeName);
                if (reader == null) {
                    throw new JsonParseException("Unknown gate type: '" + typeName + "'. Known types: "
                        + readers.keySet());
                }
                return (T) reader.apply(obj);
            }
        };
    }

    private static GateShape readPolygon(JsonObject obj) {
        List<String> channels = channels(obj, 2);
        List<Vertex> vertices = new ArrayList<>();
        for (JsonElement vertex : obj.getAsJsonArray("vertices")) {
            JsonObject v = vertex.getAsJsonObject();
            vertices.add(Vertex.of(v.get("x").getAsDouble(), v.get("y").getAsDouble()));
        }
        return new PolygonGate(channels.get(0), channels.get(1), vertices);
    }

    private static GateShape readRectangle(JsonObject obj) {
        List<String> channels = channels(obj, 2);
        return new RectangleGate(channels.get(0), channels.get(1),
            bound(obj, "x_min", Double.NEGATIVE_INFINITY), bound(obj, "x_max", Double.POSITIVE_INFINITY),
            bound(obj, "y_min", Double.NEGATIVE_INFINITY), bound(obj, "y_max", Double.POSITIVE_INFINITY));
    }

    private static GateShape readRange(JsonObject obj) {
        return new RangeGate(obj.get("channel").getAsString(),
            bound(obj, "min", Double.NEGATIVE_INFINITY), bound(obj, "max", Double.POSITIVE_INFINITY));
    }

    private static List<String> channels(JsonObject obj, int expected) {
        JsonArray array = obj.getAsJsonArray("channels");
        if (array == null || array.size() != expected) {
            throw new JsonParseException("Gate needs " + expected + " channels: " + obj);
        }
        List<String> channels = new ArrayList<>();
        for (JsonElement channel : array) {
            channels.add(channel.getAsString());
        }
        return channels;
    }

    private static double bound(JsonObject obj, String name, double missing) {
        JsonElement value = obj.get(name);
        return value == null || value.isJsonNull() ? missing : value.getAsDouble();
    }
}
