package org.energysaving.cli.commands;

import java.time.Instant;
import java.util.Map;

import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.api.timeseries.SeriesTable;
import org.energysaving.datapipeline.api.timeseries.TimePrecision;
import org.energysaving.datapipeline.shaping.TimestampConverter;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

/**
 * Renders tables as {@code {device_type: {measurement: {device: {time: value}}}}}.
 */
final class SeriesTableJson {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    private SeriesTableJson() {
    }

    static String render(SeriesTable table, TimePrecision precision) {
        JsonObject root = new JsonObject();
        for (SeriesKey key : table.columns()) {
            JsonObject measurements = child(root, key.deviceType());
            JsonObject devices = child(measurements, key.measurement());
            JsonObject values = child(devices, key.device());
            for (Map.Entry<Instant, Object> cell : table.column(key).entrySet()) {
                values.add(String.valueOf(TimestampConverter.format(cell.getKey(), precision)),
                    GSON.toJsonTree(cell.getValue()));
            }
        }
        return GSON.toJson(root);
    }

    private static JsonObject child(JsonObject parent, String name) {
        if (!parent.has(name)) {
            parent.add(name, new JsonObject());
        }
        return parent.getAsJsonObject(name);
    }
}
