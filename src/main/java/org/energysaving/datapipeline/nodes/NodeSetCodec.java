package org.energysaving.datapipeline.nodes;

import java.util.ArrayList;
import java.util.List;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;
import org.energysaving.datapipeline.api.metadata.MeasurementType;
import org.energysaving.datapipeline.api.timeseries.SeriesKey;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Reads and writes the node-set file.
 * <p>
 * <strong>Format:</strong>
 * <pre>
 * {
 *   "input":  [ node, ... ],
 *   "output": [ node, ... ]
 * }
 * node = { "device_type", "measurement", "device", "unit", "type", "mean", "deviation",
 *          "differentiation_mean", "differentiation_deviation",
 *          "sub_nodes": [ node, ... ], "aggregator",               (composite)
 *          "original_node": node, "transformer", "detransformer" } (derived)
 * </pre>
 * Referenced nodes are embedded recursively. Decoding registers them children-first.
 */
public class NodeSetCodec {

    private static final String INPUT = "input";
    private static final String OUTPUT = "output";
    private static final String SUB_NODES = "sub_nodes";
    private static final String ORIGINAL_NODE = "original_node";

    private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    /**
     * Serializes a node set.
     *
     * @param nodeSet Node set
     * @return Pretty-printed JSON
     */
    public String encode(NodeSet nodeSet) {
        return gson.toJson(toJson(nodeSet));
    }

    public JsonObject toJson(NodeSet nodeSet) {
        JsonObject root = new JsonObject();
        root.add(INPUT, encodeAll(nodeSet.getArena(), nodeSet.getInputs()));
        root.add(OUTPUT, encodeAll(nodeSet.getArena(), nodeSet.getOutputs()));
        return root;
    }

    /**
     * Parses a node-set document into a fresh arena.
     *
     * @param json Document text
     * @return Node set
     * @throws InvalidParameterException if the document is malformed
     */
    public NodeSet decode(String json) {
        try {
            JsonElement root = JsonParser.parseString(json);
            if (!root.isJsonObject()) {
                throw new InvalidParameterException("node set must be a JSON object");
            }
            return fromJson(root.getAsJsonObject());
        } catch (JsonParseException e) {
            throw new InvalidParameterException("malformed node set: " + e.getMessage(), e);
        }
    }

    public NodeSet fromJson(JsonObject root) {
        NodeArena arena = new NodeArena();
        List<SeriesKey> inputs = decodeAll(arena, root.get(INPUT));
        List<SeriesKey> outputs = decodeAll(arena, root.get(OUTPUT));
        return new NodeSet(arena, inputs, outputs);
    }

    /**
     * Encodes one node with everything it references embedded.
     *
     * @param arena Arena holding the node
     * @param key   Node key
     * @return JSON object
     */
    public JsonObject encodeNode(NodeArena arena, SeriesKey key) {
        Node node = arena.get(key);
        NodeStatistics statistics = node.getStatistics();
        JsonObject json = new JsonObject();
        json.addProperty("device_type", key.deviceType());
        json.addProperty("measurement", key.measurement());
        json.addProperty("device", key.device());
        json.addProperty("unit", statistics.unit());
        json.addProperty("type", statistics.type().getWireName());
        json.addProperty("mean", statistics.mean());
        json.addProperty("deviation", statistics.deviation());
        json.addProperty("differentiation_mean", statistics.differentiationMean());
        json.addProperty("differentiation_deviation", statistics.differentiationDeviation());
        if (node instanceof CompositeNode) {
            CompositeNode composite = (CompositeNode) node;
            json.add(SUB_NODES, encodeAll(arena, composite.getChildren()));
            json.addProperty("aggregator", composite.getAggregator());
        } else if (node instanceof DerivedNode) {
            DerivedNode derived = (DerivedNode) node;
            json.add(ORIGINAL_NODE, encodeNode(arena, derived.getBase()));
            json.addProperty("transformer", derived.getTransformer());
            json.addProperty("detransformer", derived.getDetransformer());
        }
        return json;
    }

    /**
     * Decodes one node, registering embedded nodes first.
     *
     * @param arena Arena to register into
     * @param json  Node object
     * @return Key of the decoded node
     */
    public SeriesKey decodeNode(NodeArena arena, JsonObject json) {
        SeriesKey key = SeriesKey.of(requiredString(json, "device_type"), requiredString(json, "measurement"),
            requiredString(json, "device"));
        NodeStatistics statistics = new NodeStatistics(
            optionalString(json, "unit"),
            MeasurementType.fromWireName(optionalString(json, "type")),
            optionalDouble(json, "mean"),
            optionalDouble(json, "deviation"),
            optionalDouble(json, "differentiation_mean"),
            optionalDouble(json, "differentiation_deviation"));
        Node node;
        if (json.has(SUB_NODES) && !json.get(SUB_NODES).isJsonNull()) {
            List<SeriesKey> children = decodeAll(arena, json.get(SUB_NODES));
            node = new CompositeNode(key, statistics, children, optionalString(json, "aggregator"));
        } else if (json.has(ORIGINAL_NODE) && !json.get(ORIGINAL_NODE).isJsonNull()) {
            SeriesKey base = decodeNode(arena, asObject(json.get(ORIGINAL_NODE)));
            node = new DerivedNode(key, statistics, base, optionalString(json, "transformer"),
                optionalString(json, "detransformer"));
        } else {
            node = new SimpleNode(key, statistics);
        }
        arena.register(node);
        return key;
    }

    private JsonArray encodeAll(NodeArena arena, List<SeriesKey> keys) {
        JsonArray array = new JsonArray();
        for (SeriesKey key : keys) {
            array.add(encodeNode(arena, key));
        }
        return array;
    }

    private List<SeriesKey> decodeAll(NodeArena arena, JsonElement element) {
        List<SeriesKey> keys = new ArrayList<>();
        if (element == null || element.isJsonNull()) {
            return keys;
        }
        if (!element.isJsonArray()) {
            throw new InvalidParameterException("node list must be a JSON array, got " + element);
        }
        for (JsonElement item : element.getAsJsonArray()) {
            keys.add(decodeNode(arena, asObject(item)));
        }
        return keys;
    }

    private static JsonObject asObject(JsonElement element) {
        if (!element.isJsonObject()) {
            throw new InvalidParameterException("node must be a JSON object, got " + element);
        }
        return element.getAsJsonObject();
    }

    private static String requiredString(JsonObject json, String field) {
        String value = optionalString(json, field);
        if (value == null) {
            throw new InvalidParameterException("node field " + field + " is missing in " + json);
        }
        return value;
    }

    private static String optionalString(JsonObject json, String field) {
        JsonElement value = json.get(field);
        return value == null || value.isJsonNull() ? null : value.getAsString();
    }

    private static Double optionalDouble(JsonObject json, String field) {
        JsonElement value = json.get(field);
        if (value == null || value.isJsonNull()) {
            return null;
        }
        try {
            return value.getAsDouble();
        } catch (NumberFormatException | UnsupportedOperationException e) {
            throw new InvalidParameterException("node field " + field + " must be a number, got " + value, e);
        }
    }
}
