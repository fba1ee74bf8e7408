package org.energysaving.datapipeline.models;

import java.util.ArrayList;
import java.util.List;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;
import org.energysaving.datapipeline.api.models.IModel;
import org.energysaving.datapipeline.api.models.ModelResult;
import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.api.timeseries.SeriesTable;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Base class for the built-in models.
 * <p>
 * Subclasses implement fitting and prediction; result assembly and the statistics of train and
 * test are shared.
 */
public abstract class AbstractModel implements IModel {

    private List<SeriesKey> outputKeys = List.of();

    /**
     * Fits the model parameters.
     *
     * @param input  Normalized input matrix
     * @param output Normalized target matrix
     */
    protected abstract void fit(SeriesTable input, SeriesTable output);

    /**
     * Predicts one value per input row and output column.
     *
     * @param input Normalized input matrix
     * @return Predictions keyed by the trained output keys
     */
    protected abstract SeriesTable predict(SeriesTable input);

    protected abstract boolean isFitted();

    @Override
    public ModelResult train(SeriesTable input, SeriesTable output, boolean generatePredictions,
                             boolean generateExpectations) {
        requireRows(input, output);
        outputKeys = List.copyOf(output.columns());
        fit(input, output);
        return result(input, output, generatePredictions, generateExpectations);
    }

    @Override
    public ModelResult test(SeriesTable input, SeriesTable output, boolean generatePredictions,
                            boolean generateExpectations) {
        requireFitted();
        return result(input, output, generatePredictions, generateExpectations);
    }

    @Override
    public SeriesTable apply(SeriesTable input) {
        requireFitted();
        return predict(input);
    }

    protected List<SeriesKey> getOutputKeys() {
        return outputKeys;
    }

    protected void setOutputKeys(List<SeriesKey> keys) {
        this.outputKeys = List.copyOf(keys);
    }

    private ModelResult result(SeriesTable input, SeriesTable output, boolean generatePredictions,
                               boolean generateExpectations) {
        SeriesTable predictions = predict(input);
        return new ModelResult(
            generatePredictions ? predictions : null,
            generateExpectations ? output : null,
            ModelResult.computeStatistics(predictions, output));
    }

    private void requireFitted() {
        if (!isFitted()) {
            throw new IllegalStateException(getClass().getSimpleName() + " has not been trained");
        }
    }

    private static void requireRows(SeriesTable input, SeriesTable output) {
        if (output.isEmpty() || output.rowCount() == 0) {
            throw new IllegalStateException("Cannot train on an empty output table");
        }
        if (input.rowCount() == 0) {
            throw new IllegalStateException("Cannot train on an empty input table");
        }
    }

    static JsonObject keyToJson(SeriesKey key) {
        JsonObject json = new JsonObject();
        json.addProperty("device_type", key.deviceType());
        json.addProperty("measurement", key.measurement());
        json.addProperty("device", key.device());
        return json;
    }

    static SeriesKey keyFromJson(JsonElement element) {
        if (element == null || !element.isJsonObject()) {
            throw new InvalidParameterException("model state key must be a JSON object, got " + element);
        }
        JsonObject json = element.getAsJsonObject();
        if (!json.has("device_type") || !json.has("measurement") || !json.has("device")) {
            throw new InvalidParameterException("model state key is incomplete: " + json);
        }
        return SeriesKey.of(json.get("device_type").getAsString(), json.get("measurement").getAsString(),
            json.get("device").getAsString());
    }

    static JsonArray keysToJson(List<SeriesKey> keys) {
        JsonArray array = new JsonArray();
        keys.forEach(key -> array.add(keyToJson(key)));
        return array;
    }

    static List<SeriesKey> keysFromJson(JsonElement element) {
        List<SeriesKey> keys = new ArrayList<>();
        if (element == null || !element.isJsonArray()) {
            throw new InvalidParameterException("model state keys must be a JSON array, got " + element);
        }
        for (JsonElement item : element.getAsJsonArray()) {
            keys.add(keyFromJson(item));
        }
        return keys;
    }
}
