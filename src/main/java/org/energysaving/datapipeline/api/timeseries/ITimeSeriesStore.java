package org.energysaving.datapipeline.api.timeseries;

import java.util.List;

/**
 * Client of the time-series store.
 * <p>
 * A new client is obtained per call; implementations wrap every store-level failure in
 * {@link org.energysaving.datapipeline.api.exceptions.DatabaseException} and report payloads of
 * unexpected shape as {@link org.energysaving.datapipeline.api.exceptions.InvalidResponseException}.
 */
public interface ITimeSeriesStore {

    /**
     * Executes a compiled select statement.
     *
     * @param query     Complete query string
     * @param precision Epoch precision of returned times, {@link TimePrecision#NONE} for RFC3339 strings
     * @return Series grouped by the query's group-by tags
     */
    QueryResult query(String query, TimePrecision precision);

    /**
     * Writes a batch of points.
     *
     * @param points    Points to write
     * @param precision Precision to truncate timestamps to
     * @return true if the store accepted the batch
     */
    boolean writePoints(List<Point> points, TimePrecision precision);

    /**
     * Executes a statement without result rows (e.g. {@code drop series}).
     *
     * @param statement Complete statement
     */
    void execute(String statement);
}
