package org.energysaving.datapipeline.api.metadata;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Unit, type and statistical description of a measurement.
 * <p>
 * Statistical fields are {@code null} until a statistics refresh has run for the datacenter.
 * Parameter measurements (controller parameters) only carry {@code min}/{@code max}.
 * <p>
 * Instances are immutable; use {@link #builder()} or {@link #withStatistics(MeasurementStatistics)}.
 */
public final class MeasurementAttribute {

    private final MeasurementType type;
    private final String unit;
    private final Double mean;
    private final Double deviation;
    private final Double differentiationMean;
    private final Double differentiationDeviation;
    private final Double max;
    private final Double min;
    private final Double differentiationMax;
    private final Double differentiationMin;
    private final String pattern;

    private MeasurementAttribute(Builder builder) {
        this.type = builder.type != null ? builder.type : MeasurementType.CONTINUOUS;
        this.unit = builder.unit;
        this.mean = builder.mean;
        this.deviation = builder.deviation;
        this.differentiationMean = builder.differentiationMean;
        this.differentiationDeviation = builder.differentiationDeviation;
        this.max = builder.max;
        this.min = builder.min;
        this.differentiationMax = builder.differentiationMax;
        this.differentiationMin = builder.differentiationMin;
        this.pattern = builder.pattern;
        if (pattern != null) {
            // fail at load time rather than at query time
            Pattern.compile(pattern);
        }
    }

    public MeasurementType getType() {
        return type;
    }

    public String getUnit() {
        return unit;
    }

    public Double getMean() {
        return mean;
    }

    public Double getDeviation() {
        return deviation;
    }

    public Double getDifferentiationMean() {
        return differentiationMean;
    }

    public Double getDifferentiationDeviation() {
        return differentiationDeviation;
    }

    public Double getMax() {
        return max;
    }

    public Double getMin() {
        return min;
    }

    public Double getDifferentiationMax() {
        return differentiationMax;
    }

    public Double getDifferentiationMin() {
        return differentiationMin;
    }

    /**
     * Returns the regex matching alternative spellings of the measurement name, if any.
     *
     * @return Regex source or null
     */
    public String getPattern() {
        return pattern;
    }

    /**
     * Returns true once mean and deviation have been computed.
     *
     * @return true if the attribute can be used for normalization
     */
    public boolean hasStatistics() {
        return mean != null && deviation != null;
    }

    /**
     * Returns a copy carrying freshly computed statistics. Type, unit and pattern are kept.
     *
     * @param statistics Result of a statistics refresh
     * @return New attribute instance
     */
    public MeasurementAttribute withStatistics(MeasurementStatistics statistics) {
        return toBuilder()
            .mean(statistics.mean())
            .deviation(statistics.deviation())
            .differentiationMean(statistics.differentiationMean())
            .differentiationDeviation(statistics.differentiationDeviation())
            .min(statistics.min())
            .max(statistics.max())
            .differentiationMin(statistics.differentiationMin())
            .differentiationMax(statistics.differentiationMax())
            .build();
    }

    /**
     * Creates a builder pre-filled with this attribute's values.
     *
     * @return Builder
     */
    public Builder toBuilder() {
        return builder()
            .type(type)
            .unit(unit)
            .mean(mean)
            .deviation(deviation)
            .differentiationMean(differentiationMean)
            .differentiationDeviation(differentiationDeviation)
            .max(max)
            .min(min)
            .differentiationMax(differentiationMax)
            .differentiationMin(differentiationMin)
            .pattern(pattern);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MeasurementAttribute)) {
            return false;
        }
        MeasurementAttribute that = (MeasurementAttribute) o;
        return type == that.type
            && Objects.equals(unit, that.unit)
            && Objects.equals(mean, that.mean)
            && Objects.equals(deviation, that.deviation)
            && Objects.equals(differentiationMean, that.differentiationMean)
            && Objects.equals(differentiationDeviation, that.differentiationDeviation)
            && Objects.equals(max, that.max)
            && Objects.equals(min, that.min)
            && Objects.equals(differentiationMax, that.differentiationMax)
            && Objects.equals(differentiationMin, that.differentiationMin)
            && Objects.equals(pattern, that.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, unit, mean, deviation, differentiationMean, differentiationDeviation,
            max, min, differentiationMax, differentiationMin, pattern);
    }

    @Override
    public String toString() {
        return "MeasurementAttribute[type=" + type + ", unit=" + unit + ", mean=" + mean
            + ", deviation=" + deviation + ", pattern=" + pattern + "]";
    }

    /**
     * Builder for MeasurementAttribute.
     */
    public static class Builder {
        private MeasurementType type;
        private String unit;
        private Double mean;
        private Double deviation;
        private Double differentiationMean;
        private Double differentiationDeviation;
        private Double max;
        private Double min;
        private Double differentiationMax;
        private Double differentiationMin;
        private String pattern;

        public Builder type(MeasurementType type) {
            this.type = type;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder mean(Double mean) {
            this.mean = mean;
            return this;
        }

        public Builder deviation(Double deviation) {
            this.deviation = deviation;
            return this;
        }

        public Builder differentiationMean(Double differentiationMean) {
            this.differentiationMean = differentiationMean;
            return this;
        }

        public Builder differentiationDeviation(Double differentiationDeviation) {
            this.differentiationDeviation = differentiationDeviation;
            return this;
        }

        public Builder max(Double max) {
            this.max = max;
            return this;
        }

        public Builder min(Double min) {
            this.min = min;
            return this;
        }

        public Builder differentiationMax(Double differentiationMax) {
            this.differentiationMax = differentiationMax;
            return this;
        }

        public Builder differentiationMin(Double differentiationMin) {
            this.differentiationMin = differentiationMin;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public MeasurementAttribute build() {
            return new MeasurementAttribute(this);
        }
    }
}
