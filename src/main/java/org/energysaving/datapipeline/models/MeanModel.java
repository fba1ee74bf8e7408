package org.energysaving.datapipeline.models;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.api.timeseries.SeriesTable;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Baseline model predicting the training mean of every output column for each input row.
 */
public class MeanModel extends AbstractModel {

    private final Map<SeriesKey, Double> means = new LinkedHashMap<>();

    public MeanModel(JsonObject modelConfig) {
        // no parameters
    }

    @Override
    protected void fit(SeriesTable input, SeriesTable output) {
        means.clear();
        for (SeriesKey key : output.columns()) {
            double sum = 0.0;
            int count = 0;
            for (Double value : output.numericColumn(key).values()) {
                sum += value;
                count++;
            }
            means.put(key, count == 0 ? 0.0 : sum / count);
        }
    }

    @Override
    protected SeriesTable predict(SeriesTable input) {
        SeriesTable predictions = new SeriesTable();
        for (SeriesKey key : getOutputKeys()) {
            predictions.addColumn(key);
            for (Instant time : input.index()) {
                predictions.put(key, time, means.get(key));
            }
        }
        return predictions;
    }

    @Override
    protected boolean isFitted() {
        return !means.isEmpty();
    }

    public Map<SeriesKey, Double> getMeans() {
        return Map.copyOf(means);
    }

    @Override
    public JsonObject save() {
        JsonArray array = new JsonArray();
        means.forEach((key, mean) -> {
            JsonObject entry = keyToJson(key);
            entry.addProperty("mean", mean);
            array.add(entry);
        });
        JsonObject state = new JsonObject();
        state.add("means", array);
        return state;
    }

    @Override
    public void load(JsonObject state) {
        means.clear();
        JsonElement array = state.get("means");
        if (array != null && array.isJsonArray()) {
            for (JsonElement item : array.getAsJsonArray()) {
                means.put(keyFromJson(item), item.getAsJsonObject().get("mean").getAsDouble());
            }
        }
        setOutputKeys(List.copyOf(means.keySet()));
    }
}
