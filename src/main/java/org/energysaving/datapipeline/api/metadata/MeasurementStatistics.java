package org.energysaving.datapipeline.api.metadata;

/**
 * Statistics of one measurement over a historical window, as computed by a statistics refresh.
 *
 * @param mean                     Mean of all samples
 * @param deviation                Sample standard deviation of all samples
 * @param differentiationMean      Mean of the per-interval differences
 * @param differentiationDeviation Sample standard deviation of the per-interval differences
 * @param min                      Smallest sample
 * @param max                      Largest sample
 * @param differentiationMin       Smallest per-interval difference
 * @param differentiationMax       Largest per-interval difference
 */
public record MeasurementStatistics(
    Double mean,
    Double deviation,
    Double differentiationMean,
    Double differentiationDeviation,
    Double min,
    Double max,
    Double differentiationMin,
    Double differentiationMax
) {
}
