package org.energysaving.datapipeline.transform;

import org.energysaving.datapipeline.api.timeseries.SeriesTable;

/**
 * Input and output tables travelling through the pipeline together.
 *
 * @param input  Input table, null when not requested
 * @param output Output table, null when not requested (e.g. apply)
 */
public record PipelineTables(SeriesTable input, SeriesTable output) {
}
