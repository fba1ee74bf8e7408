package org.energysaving.datapipeline.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.energysaving.datapipeline.api.timeseries.TimePrecision;

/**
 * Caller options of a mapping-wide read.
 * <p>
 * Filter, grouping and aggregation options are applied to every compiled query. Unit requests
 * are keyed by measurement name; the base value offsets formatted numeric values.
 */
public class QueryOptions {

    private final Map<String, Object> where;
    private final List<String> groupBy;
    private final List<String> orderBy;
    private final String fill;
    private final String aggregation;
    private final Integer limit;
    private final Integer offset;
    private final TimePrecision timePrecision;
    private final Map<String, String> units;
    private final Number baseValue;

    private QueryOptions(Builder builder) {
        this.where = Collections.unmodifiableMap(new LinkedHashMap<>(builder.where));
        this.groupBy = Collections.unmodifiableList(new ArrayList<>(builder.groupBy));
        this.orderBy = Collections.unmodifiableList(new ArrayList<>(builder.orderBy));
        this.fill = builder.fill;
        this.aggregation = builder.aggregation;
        this.limit = builder.limit;
        this.offset = builder.offset;
        this.timePrecision = builder.timePrecision;
        this.units = Collections.unmodifiableMap(new LinkedHashMap<>(builder.units));
        this.baseValue = builder.baseValue;
    }

    public static QueryOptions defaults() {
        return builder().build();
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

    public TimePrecision getTimePrecision() {
        return timePrecision;
    }

    /**
     * Returns the unit requested for a measurement.
     *
     * @param measurement Measurement name
     * @return Requested unit, or null to keep the metadata unit
     */
    public String getUnit(String measurement) {
        return units.get(measurement);
    }

    public Number getBaseValue() {
        return baseValue;
    }

    /**
     * Applies the options to a query builder.
     *
     * @param builder Builder with the measurement already set
     * @return The same builder
     */
    public QuerySpec.Builder applyTo(QuerySpec.Builder builder) {
        return builder.where(where)
            .groupBy(groupBy)
            .orderBy(orderBy)
            .fill(fill)
            .aggregation(aggregation)
            .limit(limit)
            .offset(offset);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for QueryOptions.
     */
    public static class Builder {
        private final Map<String, Object> where = new LinkedHashMap<>();
        private final List<String> groupBy = new ArrayList<>();
        private final List<String> orderBy = new ArrayList<>();
        private String fill;
        private String aggregation;
        private Integer limit;
        private Integer offset;
        private TimePrecision timePrecision = TimePrecision.NONE;
        private final Map<String, String> units = new LinkedHashMap<>();
        private Number baseValue;

        public Builder starttime(String starttime) {
            return where(QuerySpec.STARTTIME, starttime);
        }

        public Builder endtime(String endtime) {
            return where(QuerySpec.ENDTIME, endtime);
        }

        public Builder where(String key, Object value) {
            where.put(key, value);
            return this;
        }

        public Builder groupBy(String... dimensions) {
            Collections.addAll(groupBy, dimensions);
            return this;
        }

        public Builder orderBy(String... dimensions) {
            Collections.addAll(orderBy, dimensions);
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

        public Builder timePrecision(TimePrecision timePrecision) {
            this.timePrecision = timePrecision == null ? TimePrecision.NONE : timePrecision;
            return this;
        }

        public Builder unit(String measurement, String unit) {
            units.put(measurement, unit);
            return this;
        }

        public Builder baseValue(Number baseValue) {
            this.baseValue = baseValue;
            return this;
        }

        public QueryOptions build() {
            return new QueryOptions(this);
        }
    }
}
