package org.energysaving.datapipeline.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative description of one time-series select.
 * <p>
 * The where map is ordered; {@code starttime} and {@code endtime} are time bounds, every other
 * entry is an equality predicate whose value is either a scalar or a list of alternatives.
 * <p>
 * <strong>Example:</strong>
 * <pre>{@code
 * QuerySpec spec = QuerySpec.builder("temperature")
 *     .where("starttime", "-1h")
 *     .where("endtime", "now()")
 *     .where("device", List.of("s1", "s2"))
 *     .groupBy("time(60s)")
 *     .aggregation("mean")
 *     .build();
 * }</pre>
 */
public class QuerySpec {

    public static final String STARTTIME = "starttime";
    public static final String ENDTIME = "endtime";

    private final String measurement;
    private final Map<String, Object> where;
    private final List<String> groupBy;
    private final List<String> orderBy;
    private final String fill;
    private final String aggregation;
    private final Integer limit;
    private final Integer offset;

    private QuerySpec(Builder builder) {
        this.measurement = Objects.requireNonNull(builder.measurement, "measurement");
        this.where = Collections.unmodifiableMap(new LinkedHashMap<>(builder.where));
        this.groupBy = Collections.unmodifiableList(new ArrayList<>(builder.groupBy));
        this.orderBy = Collections.unmodifiableList(new ArrayList<>(builder.orderBy));
        this.fill = builder.fill;
        this.aggregation = builder.aggregation;
        this.limit = builder.limit;
        this.offset = builder.offset;
    }

    /**
     * Returns the measurement expression: a literal name or {@code /regex/}.
     *
     * @return Measurement expression
     */
    public String getMeasurement() {
        return measurement;
    }

    public Map<String, Object> getWhere() {
        return where;
    }

    public List<String> getGroupBy() {
        return groupBy;
    }

    public List<String> getOrderBy() {
        return orderBy;
    }

    public String getFill() {
        return fill;
    }

    public String getAggregation() {
        return aggregation;
    }

    public Integer getLimit() {
        return limit;
    }

    public Integer getOffset() {
        return offset;
    }

    public static Builder builder(String measurement) {
        return new Builder().measurement(measurement);
    }

    /**
     * Builder for QuerySpec.
     */
    public static class Builder {
        private String measurement;
        private final Map<String, Object> where = new LinkedHashMap<>();
        private final List<String> groupBy = new ArrayList<>();
        private final List<String> orderBy = new ArrayList<>();
        private String fill;
        private String aggregation;
        private Integer limit;
        private Integer offset;

        /**
         * Sets a literal measurement name.
         *
         * @param measurement Measurement name
         * @return This builder
         */
        public Builder measurement(String measurement) {
            this.measurement = measurement;
            return this;
        }

        /**
         * Matches measurements by regex instead of by name.
         *
         * @param pattern Regular expression, without slashes
         * @return This builder
         */
        public Builder measurementPattern(String pattern) {
            this.measurement = "/" + pattern + "/";
            return this;
        }

        /**
         * Adds a predicate. Null values and empty lists are kept but compile to nothing.
         *
         * @param key   Tag name, {@code starttime} or {@code endtime}
         * @param value Scalar, or a list of alternatives
         * @return This builder
         */
        public Builder where(String key, Object value) {
            where.put(key, value);
            return this;
        }

        public Builder where(Map<String, ?> predicates) {
            if (predicates != null) {
                where.putAll(predicates);
            }
            return this;
        }

        public Builder groupBy(String... dimensions) {
            Collections.addAll(groupBy, dimensions);
            return this;
        }

        public Builder groupBy(List<String> dimensions) {
            if (dimensions != null) {
                groupBy.addAll(dimensions);
            }
            return this;
        }

        public Builder orderBy(String... dimensions) {
            Collections.addAll(orderBy, dimensions);
            return this;
        }

        public Builder orderBy(List<String> dimensions) {
            if (dimensions != null) {
                orderBy.addAll(dimensions);
            }
            return this;
        }

        public Builder fill(String fill) {
            this.fill = fill;
            return this;
        }

        public Builder aggregation(String aggregation) {
            this.aggregation = aggregation;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public QuerySpec build() {
            return new QuerySpec(this);
        }
    }
}
