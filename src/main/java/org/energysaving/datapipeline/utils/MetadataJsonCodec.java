package org.energysaving.datapipeline.utils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;
import org.energysaving.datapipeline.api.metadata.DatacenterMetadata;
import org.energysaving.datapipeline.api.metadata.DeviceType;
import org.energysaving.datapipeline.api.metadata.DeviceTypeMetadata;
import org.energysaving.datapipeline.api.metadata.MeasurementAttribute;
import org.energysaving.datapipeline.api.metadata.MeasurementMetadata;
import org.energysaving.datapipeline.api.metadata.MeasurementType;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.reflect.TypeToken;

/**
 * JSON form of a datacenter's metadata, as imported and shown by the command line.
 * <pre>
 * {
 *   "name": "dc1",
 *   "time_interval": 60,
 *   "models": {"pue_prediction": "pue.json"},
 *   "properties": {...},
 *   "device_types": {
 *     "sensor_attribute": {
 *       "temperature": {"devices": ["s1"], "attribute": {"type": "continuous", "unit": "C", "mean": 20.0}}
 *     }
 *   }
 * }
 * </pre>
 */
public final class MetadataJsonCodec {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    private MetadataJsonCodec() {
    }

    /**
     * Encodes a snapshot.
     *
     * @param metadata Snapshot
     * @return Pretty-printed JSON
     */
    public static String encode(DatacenterMetadata metadata) {
        return GSON.toJson(toJson(metadata));
    }

    public static JsonObject toJson(DatacenterMetadata metadata) {
        JsonObject root = new JsonObject();
        root.addProperty("name", metadata.getName());
        root.addProperty("time_interval", metadata.getTimeInterval());
        root.add("models", GSON.toJsonTree(metadata.getModels()));
        root.add("properties", GSON.toJsonTree(metadata.getProperties()));
        JsonObject deviceTypes = new JsonObject();
        metadata.getDeviceTypes().forEach((deviceType, deviceTypeMetadata) -> {
            JsonObject measurements = new JsonObject();
            deviceTypeMetadata.getMeasurements().forEach((name, measurement) -> {
                JsonObject entry = new JsonObject();
                JsonArray devices = new JsonArray();
                measurement.getDevices().forEach(devices::add);
                entry.add("devices", devices);
                entry.add("attribute", encodeAttribute(measurement.getAttribute()));
                measurements.add(name, entry);
            });
            deviceTypes.add(deviceType, measurements);
        });
        root.add("device_types", deviceTypes);
        return root;
    }

    /**
     * Decodes a snapshot.
     *
     * @param json         JSON document
     * @param fallbackName Datacenter name to use when the document has none
     * @return Snapshot
     * @throws InvalidParameterException if the document is malformed or names an unknown device type
     */
    public static DatacenterMetadata decode(String json, String fallbackName) {
        try {
            JsonElement parsed = JsonParser.parseString(json);
            if (!parsed.isJsonObject()) {
                throw new InvalidParameterException("metadata document must be a JSON object");
            }
            return fromJson(parsed.getAsJsonObject(), fallbackName);
        } catch (JsonParseException | IllegalStateException e) {
            throw new InvalidParameterException("malformed metadata document: " + e.getMessage(), e);
        }
    }

    public static DatacenterMetadata fromJson(JsonObject root, String fallbackName) {
        String name = root.has("name") && !root.get("name").isJsonNull() ? root.get("name").getAsString() : fallbackName;
        if (name == null || name.isBlank()) {
            throw new InvalidParameterException("metadata document has no datacenter name");
        }
        DatacenterMetadata.Builder builder = DatacenterMetadata.builder(name);
        if (root.has("time_interval")) {
            builder.timeInterval(root.get("time_interval").getAsInt());
        }
        if (root.has("models") && root.get("models").isJsonObject()) {
            Map<String, String> models = GSON.fromJson(root.get("models"),
                new TypeToken<LinkedHashMap<String, String>>() { }.getType());
            builder.models(models);
        }
        if (root.has("properties") && root.get("properties").isJsonObject()) {
            Map<String, Object> properties = GSON.fromJson(root.get("properties"),
                new TypeToken<LinkedHashMap<String, Object>>() { }.getType());
            builder.properties(properties);
        }
        if (root.has("device_types")) {
            for (Map.Entry<String, JsonElement> entry : root.getAsJsonObject("device_types").entrySet()) {
                DeviceType type = DeviceType.fromWireName(entry.getKey())
                    .orElseThrow(() -> new InvalidParameterException("unknown device type " + entry.getKey()));
                Map<String, MeasurementMetadata> measurements = new LinkedHashMap<>();
                for (Map.Entry<String, JsonElement> measurement : entry.getValue().getAsJsonObject().entrySet()) {
                    measurements.put(measurement.getKey(), decodeMeasurement(measurement.getValue().getAsJsonObject()));
                }
                builder.deviceType(type, new DeviceTypeMetadata(measurements));
            }
        }
        return builder.build();
    }

    private static MeasurementMetadata decodeMeasurement(JsonObject json) {
        List<String> devices = new ArrayList<>();
        if (json.has("devices")) {
            json.getAsJsonArray("devices").forEach(device -> devices.add(device.getAsString()));
        }
        JsonObject attribute = json.has("attribute") ? json.getAsJsonObject("attribute") : new JsonObject();
        return new MeasurementMetadata(devices, MeasurementAttribute.builder()
            .type(MeasurementType.fromWireName(string(attribute, "type", MeasurementType.CONTINUOUS.getWireName())))
            .unit(string(attribute, "unit", null))
            .mean(number(attribute, "mean"))
            .deviation(number(attribute, "deviation"))
            .differentiationMean(number(attribute, "differentiation_mean"))
            .differentiationDeviation(number(attribute, "differentiation_deviation"))
            .max(number(attribute, "max"))
            .min(number(attribute, "min"))
            .differentiationMax(number(attribute, "differentiation_max"))
            .differentiationMin(number(attribute, "differentiation_min"))
            .pattern(string(attribute, "pattern", null))
            .build());
    }

    private static JsonObject encodeAttribute(MeasurementAttribute attribute) {
        JsonObject json = new JsonObject();
        json.addProperty("type", attribute.getType().getWireName());
        json.addProperty("unit", attribute.getUnit());
        json.addProperty("mean", attribute.getMean());
        json.addProperty("deviation", attribute.getDeviation());
        json.addProperty("differentiation_mean", attribute.getDifferentiationMean());
        json.addProperty("differentiation_deviation", attribute.getDifferentiationDeviation());
        json.addProperty("max", attribute.getMax());
        json.addProperty("min", attribute.getMin());
        json.addProperty("differentiation_max", attribute.getDifferentiationMax());
        json.addProperty("differentiation_min", attribute.getDifferentiationMin());
        json.addProperty("pattern", attribute.getPattern());
        return json;
    }

    private static String string(JsonObject json, String field, String defaultValue) {
        return json.has(field) && !json.get(field).isJsonNull() ? json.get(field).getAsString() : defaultValue;
    }

    private static Double number(JsonObject json, String field) {
        return json.has(field) && !json.get(field).isJsonNull() ? json.get(field).getAsDouble() : null;
    }
}
