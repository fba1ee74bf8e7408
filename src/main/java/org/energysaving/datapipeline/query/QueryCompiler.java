package org.energysaving.datapipeline.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.energysaving.datapipeline.api.metadata.DatacenterMetadata;
import org.energysaving.datapipeline.api.metadata.DeviceTypeMapping;
import org.energysaving.datapipeline.api.metadata.MeasurementAttribute;
import org.energysaving.datapipeline.api.timeseries.TagNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles {@link QuerySpec}s into executable query strings.
 * <p>
 * <strong>Generated query structure:</strong>
 * <pre>
 * select &lt;value-expr&gt; from &lt;measurement&gt;
 *     [ where &lt;conjunction&gt;] [ group by &lt;dims&gt;, device] [ order by &lt;dims&gt;]
 *     [ fill(&lt;policy&gt;)] [ limit n] [ offset n]
 * </pre>
 * Values are quoted as {@code 'value'} without escaping. Callers must only pass identifiers
 * validated against metadata.
 */
public class QueryCompiler {

    private static final Logger log = LoggerFactory.getLogger(QueryCompiler.class);

    /**
     * Compiles one select.
     *
     * @param spec Query specification
     * @return Query string
     * @throws org.energysaving.datapipeline.api.exceptions.InvalidParameterException if a time bound is malformed
     */
    public String compile(QuerySpec spec) {
        StringBuilder query = new StringBuilder("select ");
        if (spec.getAggregation() != null && !spec.getAggregation().isBlank()) {
            query.append(spec.getAggregation()).append("(value) as value");
        } else {
            query.append("value");
        }
        query.append(" from ").append(spec.getMeasurement());

        String where = compileWhere(spec.getWhere());
        if (!where.isEmpty()) {
            query.append(" where ").append(where);
        }

        List<String> groupBy = new ArrayList<>(spec.getGroupBy());
        groupBy.remove(TagNames.DEVICE);
        groupBy.add(TagNames.DEVICE);
        query.append(" group by ").append(String.join(", ", groupBy));

        if (!spec.getOrderBy().isEmpty()) {
            query.append(" order by ").append(String.join(", ", spec.getOrderBy()));
        }
        if (spec.getFill() != null && !spec.getFill().isBlank()) {
            query.append(" fill(").append(spec.getFill()).append(")");
        }
        if (spec.getLimit() != null) {
            query.append(" limit ").append(spec.getLimit());
        }
        if (spec.getOffset() != null) {
            query.append(" offset ").append(spec.getOffset());
        }
        log.debug("Compiled query: {}", query);
        return query.toString();
    }

    /**
     * Compiles the where conjunction.
     * <p>
     * Time bounds come first ({@code time >= start}, then {@code time < end}), followed by the
     * remaining predicates in insertion order.
     *
     * @param where Predicates; may be null
     * @return Conjunction without the {@code where} keyword, empty if nothing applies
     */
    public String compileWhere(Map<String, Object> where) {
        if (where == null || where.isEmpty()) {
            return "";
        }
        List<String> clauses = new ArrayList<>();
        String start = TimeExpression.render(asString(where.get(QuerySpec.STARTTIME)));
        if (start != null) {
            clauses.add("time >= " + start);
        }
        String end = TimeExpression.render(asString(where.get(QuerySpec.ENDTIME)));
        if (end != null) {
            clauses.add("time < " + end);
        }
        for (Map.Entry<String, Object> entry : where.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (QuerySpec.STARTTIME.equals(key) || QuerySpec.ENDTIME.equals(key) || value == null) {
                continue;
            }
            if (value instanceof Collection) {
                Collection<?> alternatives = (Collection<?>) value;
                if (alternatives.isEmpty()) {
                    continue;
                }
                List<String> equalities = new ArrayList<>(alternatives.size());
                for (Object alternative : alternatives) {
                    equalities.add(equality(key, alternative));
                }
                clauses.add("(" + String.join(" or ", equalities) + ")");
            } else {
                clauses.add(equality(key, value));
            }
        }
        return String.join(" and ", clauses);
    }

    /**
     * Compiles one query per (device type, measurement) pair of a resolved mapping.
     * <p>
     * Each query is restricted to the datacenter, the device type and the mapped devices. A
     * measurement with a registered pattern is selected by that pattern. Points written by models
     * carry a {@code measurement_kind} tag and are left out unless the options filter on
     * {@code test_result}, {@code prediction} or {@code measurement_kind}.
     *
     * @param datacenter Datacenter name
     * @param mapping    Resolved mapping
     * @param metadata   Snapshot the mapping was resolved against
     * @param options    Caller options applied to every query
     * @return Queries in mapping order
     */
    public List<CompiledQuery> compileMapping(String datacenter, DeviceTypeMapping mapping,
                                              DatacenterMetadata metadata, QueryOptions options) {
        List<CompiledQuery> queries = new ArrayList<>();
        for (String deviceType : mapping.deviceTypes()) {
            for (String measurement : mapping.measurements(deviceType)) {
                List<String> devices = mapping.devices(deviceType, measurement);
                String pattern = metadata.getMeasurement(deviceType, measurement)
                    .map(m -> m.getAttribute())
                    .map(MeasurementAttribute::getPattern)
                    .orElse(null);
                QuerySpec.Builder builder = QuerySpec.builder(measurement);
                if (pattern != null) {
                    builder.measurementPattern(pattern);
                }
                options.applyTo(builder)
                    .where(TagNames.DATACENTER, datacenter)
                    .where(TagNames.DEVICE_TYPE, deviceType)
                    .where(TagNames.DEVICE, devices);
                if (!selectsModelResults(options.getWhere())) {
                    builder.where(TagNames.MEASUREMENT_KIND, "");
                }
                queries.add(new CompiledQuery(deviceType, measurement, devices, compile(builder.build())));
            }
        }
        return queries;
    }

    /**
     * Compiles a series deletion.
     *
     * @param measurement Measurement name
     * @param tags        Tag predicates, scalar or list valued
     * @return {@code drop series from <measurement>[ where <conjunction>]}
     */
    public String compileDropSeries(String measurement, Map<String, Object> tags) {
        String where = compileWhere(tags);
        String statement = "drop series from " + measurement + (where.isEmpty() ? "" : " where " + where);
        log.debug("Compiled statement: {}", statement);
        return statement;
    }

    private static boolean selectsModelResults(Map<String, Object> where) {
        return where.containsKey(TagNames.MEASUREMENT_KIND)
            || where.containsKey(TagNames.TEST_RESULT)
            || where.containsKey(TagNames.PREDICTION);
    }

    private static String equality(String key, Object value) {
        return key + " = '" + value + "'";
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
