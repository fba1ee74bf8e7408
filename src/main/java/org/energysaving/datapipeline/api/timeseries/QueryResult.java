package org.energysaving.datapipeline.api.timeseries;

import java.util.List;

/**
 * All series returned by one store query.
 *
 * @param series Series in store order
 */
public record QueryResult(List<RawSeries> series) {

    public QueryResult {
        series = List.copyOf(series);
    }

    public static QueryResult empty() {
        return new QueryResult(List.of());
    }

    public boolean isEmpty() {
        return series.isEmpty();
    }
}
