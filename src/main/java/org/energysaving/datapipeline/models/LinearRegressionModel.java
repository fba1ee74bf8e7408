package org.energysaving.datapipeline.models;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.api.timeseries.SeriesTable;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Ordinary least squares per output column with an optional ridge penalty.
 * <p>
 * Solves {@code (XᵀX + λI) w = Xᵀy} with an intercept column that is never penalized. Rows where
 * any input is missing are ignored during fitting and produce no prediction.
 * <p>
 * Configuration: {@code {"ridge": 1e-6}}.
 */
public class LinearRegressionModel extends AbstractModel {

    public static final double DEFAULT_RIDGE = 1e-6;

    private final double ridge;
    private List<SeriesKey> inputKeys = List.of();
    private final Map<SeriesKey, double[]> weights = new LinkedHashMap<>();

    public LinearRegressionModel(JsonObject modelConfig) {
        this.ridge = modelConfig.has("ridge") ? modelConfig.get("ridge").getAsDouble() : DEFAULT_RIDGE;
        if (ridge < 0.0) {
            throw new IllegalArgumentException("ridge must not be negative, got " + ridge);
        }
    }

    @Override
    protected void fit(SeriesTable input, SeriesTable output) {
        inputKeys = List.copyOf(input.columns());
        weights.clear();
        int width = inputKeys.size() + 1;
        for (SeriesKey outputKey : output.columns()) {
            double[][] gram = new double[width][width];
            double[] moment = new double[width];
            Map<Instant, Double> targets = output.numericColumn(outputKey);
            for (Map.Entry<Instant, Double> target : targets.entrySet()) {
                double[] row = row(input, target.getKey());
                if (row == null) {
                    continue;
                }
                for (int i = 0; i < width; i++) {
                    moment[i] += row[i] * target.getValue();
                    for (int j = 0; j < width; j++) {
                        gram[i][j] += row[i] * row[j];
                    }
                }
            }
            for (int i = 1; i < width; i++) {
                gram[i][i] += ridge;
            }
            weights.put(outputKey, solve(gram, moment));
        }
    }

    @Override
    protected SeriesTable predict(SeriesTable input) {
        SeriesTable predictions = new SeriesTable();
        for (SeriesKey outputKey : getOutputKeys()) {
            predictions.addColumn(outputKey);
            double[] w = weights.get(outputKey);
            for (Instant time : input.index()) {
                double[] row = row(input, time);
                if (row == null) {
                    continue;
                }
                double value = 0.0;
                for (int i = 0; i < row.length; i++) {
                    value += w[i] * row[i];
                }
                predictions.put(outputKey, time, value);
            }
        }
        return predictions;
    }

    @Override
    protected boolean isFitted() {
        return !weights.isEmpty();
    }

    /**
     * Returns intercept followed by one weight per input column.
     *
     * @param outputKey Output column
     * @return Copy of the weights, or null if the column is unknown
     */
    public double[] getWeights(SeriesKey outputKey) {
        double[] w = weights.get(outputKey);
        return w == null ? null : w.clone();
    }

    @Override
    public JsonObject save() {
        JsonObject state = new JsonObject();
        state.addProperty("ridge", ridge);
        state.add("inputs", keysToJson(inputKeys));
        JsonArray outputs = new JsonArray();
        weights.forEach((key, w) -> {
            JsonObject entry = keyToJson(key);
            JsonArray values = new JsonArray();
            for (double value : w) {
                values.add(value);
            }
            entry.add("weights", values);
            outputs.add(entry);
        });
        state.add("outputs", outputs);
        return state;
    }

    @Override
    public void load(JsonObject state) {
        inputKeys = keysFromJson(state.get("inputs"));
        weights.clear();
        List<SeriesKey> outputKeys = new ArrayList<>();
        JsonElement outputs = state.get("outputs");
        if (outputs != null && outputs.isJsonArray()) {
            for (JsonElement item : outputs.getAsJsonArray()) {
                SeriesKey key = keyFromJson(item);
                JsonArray values = item.getAsJsonObject().getAsJsonArray("weights");
                double[] w = new double[values.size()];
                for (int i = 0; i < w.length; i++) {
                    w[i] = values.get(i).getAsDouble();
                }
                if (w.length != inputKeys.size() + 1) {
                    throw new IllegalArgumentException("Model state of " + key + " has " + w.length
                        + " weights, expected " + (inputKeys.size() + 1));
                }
                weights.put(key, w);
                outputKeys.add(key);
            }
        }
        setOutputKeys(outputKeys);
    }

    private double[] row(SeriesTable input, Instant time) {
        double[] row = new double[inputKeys.size() + 1];
        row[0] = 1.0;
        for (int i = 0; i < inputKeys.size(); i++) {
            Double value = input.getDouble(inputKeys.get(i), time);
            if (value == null) {
                return null;
            }
            row[i + 1] = value;
        }
        return row;
    }

    /**
     * Gaussian elimination with partial pivoting. Singular pivots yield a zero weight.
     */
    static double[] solve(double[][] a, double[] b) {
        int n = b.length;
        double[][] m = new double[n][];
        double[] v = b.clone();
        for (int i = 0; i < n; i++) {
            m[i] = a[i].clone();
        }
        for (int col = 0; col < n; col++) {
            int pivot = col;
            for (int row = col + 1; row < n; row++) {
                if (Math.abs(m[row][col]) > Math.abs(m[pivot][col])) {
                    pivot = row;
                }
            }
            double[] tmpRow = m[col];
            m[col] = m[pivot];
            m[pivot] = tmpRow;
            double tmp = v[col];
            v[col] = v[pivot];
            v[pivot] = tmp;
            if (Math.abs(m[col][col]) < 1e-12) {
                continue;
            }
            for (int row = col + 1; row < n; row++) {
                double factor = m[row][col] / m[col][col];
                v[row] -= factor * v[col];
                for (int k = col; k < n; k++) {
                    m[row][k] -= factor * m[col][k];
                }
            }
        }
        double[] x = new double[n];
        for (int row = n - 1; row >= 0; row--) {
            if (Math.abs(m[row][row]) < 1e-12) {
                x[row] = 0.0;
                continue;
            }
            double sum = v[row];
            for (int k = row + 1; k < n; k++) {
                sum -= m[row][k] * x[k];
            }
            x[row] = sum / m[row][row];
        }
        return x;
    }
}
