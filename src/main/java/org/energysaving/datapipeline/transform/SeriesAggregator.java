package org.energysaving.datapipeline.transform;

import java.util.List;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;

/**
 * Aggregators combining the values of a composite node's children at one timestamp.
 */
public enum SeriesAggregator {

    SUM("sum") {
        @Override
        public double aggregate(List<Double> values) {
            double sum = 0.0;
            for (Double value : values) {
                sum += value;
            }
            return sum;
        }
    },

    MEAN("mean") {
        @Override
        public double aggregate(List<Double> values) {
            return SUM.aggregate(values) / values.size();
        }
    };

    private final String name;

    SeriesAggregator(String name) {
        this.name = name;
    }

    /**
     * Combines the children's values.
     *
     * @param values One value per child, never empty and without missing values
     * @return Aggregate value
     */
    public abstract double aggregate(List<Double> values);

    public String getName() {
        return name;
    }

    /**
     * Looks up an aggregator by name. Null means {@link #SUM}.
     *
     * @param name Aggregator name
     * @return The aggregator
     * @throws InvalidParameterException if the name is unknown
     */
    public static SeriesAggregator fromName(String name) {
        if (name == null) {
            return SUM;
        }
        for (SeriesAggregator aggregator : values()) {
            if (aggregator.name.equals(name)) {
                return aggregator;
            }
        }
        throw new InvalidParameterException("unknown aggregator " + name);
    }
}
