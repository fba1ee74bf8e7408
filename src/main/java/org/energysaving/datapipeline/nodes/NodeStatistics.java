package org.energysaving.datapipeline.nodes;

import org.energysaving.datapipeline.api.metadata.MeasurementAttribute;
import org.energysaving.datapipeline.api.metadata.MeasurementType;

/**
 * Unit, type and normalization statistics carried by a node.
 *
 * @param unit                     Unit of the values, may be null
 * @param type                     Value type
 * @param mean                     Mean used by normalize, may be null
 * @param deviation                Deviation used by normalize, may be null
 * @param differentiationMean      Mean of per-interval differences, may be null
 * @param differentiationDeviation Deviation of per-interval differences, may be null
 */
public record NodeStatistics(
    String unit,
    MeasurementType type,
    Double mean,
    Double deviation,
    Double differentiationMean,
    Double differentiationDeviation
) {

    public NodeStatistics {
        if (type == null) {
            type = MeasurementType.CONTINUOUS;
        }
    }

    /**
     * Copies the relevant fields of a metadata attribute.
     *
     * @param attribute Measurement attribute
     * @return Node statistics
     */
    public static NodeStatistics from(MeasurementAttribute attribute) {
        return new NodeStatistics(attribute.getUnit(), attribute.getType(), attribute.getMean(),
            attribute.getDeviation(), attribute.getDifferentiationMean(), attribute.getDifferentiationDeviation());
    }

    public NodeStatistics withMeanAndDeviation(Double newMean, Double newDeviation) {
        return new NodeStatistics(unit, type, newMean, newDeviation, differentiationMean, differentiationDeviation);
    }

    /**
     * Returns true if normalize can use these statistics.
     *
     * @return true if mean and a positive deviation are present
     */
    public boolean isNormalizable() {
        return mean != null && deviation != null && deviation > 0.0;
    }
}
