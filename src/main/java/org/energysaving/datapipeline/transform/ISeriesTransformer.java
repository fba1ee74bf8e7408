package org.energysaving.datapipeline.transform;

import java.time.Duration;
import java.time.Instant;
import java.util.NavigableMap;

/**
 * Named per-node series mapping applied before (transform) or after (detransform) the model.
 */
@FunctionalInterface
public interface ISeriesTransformer {

    /**
     * Maps a series.
     *
     * @param series   Values by timestamp; absent timestamps are missing samples
     * @param interval Sampling interval of the datacenter
     * @return New series; the input is not modified
     */
    NavigableMap<Instant, Double> apply(NavigableMap<Instant, Double> series, Duration interval);
}
