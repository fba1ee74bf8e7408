package org.energysaving.datapipeline.api.models;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.api.timeseries.SeriesTable;

/**
 * Result of {@link IModel#train} or {@link IModel#test}.
 *
 * @param predictions  Predicted outputs, or null if not requested
 * @param expectations Expected outputs, or null if not requested
 * @param statistics   Per output column: statistic name ({@code MSE}, {@code rsquare}) to value
 */
public record ModelResult(
    SeriesTable predictions,
    SeriesTable expectations,
    Map<SeriesKey, Map<String, Double>> statistics
) {

    public static final String MSE = "MSE";
    public static final String RSQUARE = "rsquare";

    public ModelResult {
        Map<SeriesKey, Map<String, Double>> copy = new LinkedHashMap<>();
        if (statistics != null) {
            statistics.forEach((key, values) -> copy.put(key, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
        }
        statistics = Collections.unmodifiableMap(copy);
    }

    /**
     * Computes mean squared error and coefficient of determination for every output column.
     * <p>
     * Only timestamps present in both tables count. {@code rsquare} is 0 when the total sum
     * of squares is below 0.01.
     *
     * @param predictions  Predicted values
     * @param expectations Actual values
     * @return Statistics by column
     */
    public static Map<SeriesKey, Map<String, Double>> computeStatistics(SeriesTable predictions, SeriesTable expectations) {
        Map<SeriesKey, Map<String, Double>> result = new LinkedHashMap<>();
        for (SeriesKey key : expectations.columns()) {
            Map<Instant, Double> actual = expectations.numericColumn(key);
            Map<Instant, Double> predicted = predictions.numericColumn(key);
            double sum = 0.0;
            int count = 0;
            for (Map.Entry<Instant, Double> entry : actual.entrySet()) {
                if (predicted.containsKey(entry.getKey())) {
                    sum += entry.getValue();
                    count++;
                }
            }
            if (count == 0) {
                continue;
            }
            double mean = sum / count;
            double ssRes = 0.0;
            double ssTot = 0.0;
            for (Map.Entry<Instant, Double> entry : actual.entrySet()) {
                Double p = predicted.get(entry.getKey());
                if (p != null) {
                    ssRes += (entry.getValue() - p) * (entry.getValue() - p);
                    ssTot += (entry.getValue() - mean) * (entry.getValue() - mean);
                }
            }
            Map<String, Double> stats = new LinkedHashMap<>();
            stats.put(MSE, ssRes / count);
            stats.put(RSQUARE, ssTot < 0.01 ? 0.0 : 1.0 - ssRes / ssTot);
            result.put(key, stats);
        }
        return result;
    }
}
