package org.energysaving.datapipeline.resources.timeseries;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;
import org.energysaving.datapipeline.api.timeseries.ITimeSeriesStore;
import org.energysaving.datapipeline.api.timeseries.Point;
import org.energysaving.datapipeline.api.timeseries.QueryResult;
import org.energysaving.datapipeline.api.timeseries.RawSeries;
import org.energysaving.datapipeline.api.timeseries.TimePrecision;
import org.energysaving.datapipeline.query.TimeExpression;
import org.energysaving.datapipeline.resources.timeseries.InfluxQlParser.Condition;
import org.energysaving.datapipeline.resources.timeseries.InfluxQlParser.ParsedStatement;
import org.energysaving.datapipeline.shaping.TimestampConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Time-series store holding points in memory.
 * <p>
 * Evaluates the statements of {@link InfluxQlParser} with the store's semantics: series are
 * split by measurement and group-by tags, {@code group by time(...)} buckets are aligned to the
 * epoch and span the queried time range, and empty buckets follow the fill policy
 * ({@code null} when absent). A later point with the same measurement, tags and timestamp
 * replaces the earlier one.
 */
public class InMemoryTimeSeriesStore implements ITimeSeriesStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTimeSeriesStore.class);

    private final Clock clock;
    private final List<Point> points = new ArrayList<>();

    public InMemoryTimeSeriesStore() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a store that evaluates {@code now()} against the given clock.
     *
     * @param clock Clock for relative time bounds
     */
    public InMemoryTimeSeriesStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized QueryResult query(String query, TimePrecision precision) {
        ParsedStatement statement = InfluxQlParser.parse(query);
        if (statement.drop()) {
            throw new InvalidParameterException("not a select statement: " + query);
        }
        Instant now = clock.instant();
        Map<String, NavigableMap<Instant, Object>> groups = new LinkedHashMap<>();
        Map<String, RawSeriesHeader> headers = new LinkedHashMap<>();
        List<Point> matching = new ArrayList<>();
        for (Point point : points) {
            if (matches(statement, point, now)) {
                matching.add(point);
            }
        }
        matching.sort(Comparator.comparing(Point::time));
        for (Point point : matching) {
            Map<String, String> tags = new LinkedHashMap<>();
            for (String tag : statement.groupByTags()) {
                tags.put(tag, point.tags().getOrDefault(tag, ""));
            }
            String groupKey = point.measurement() + tags;
            headers.putIfAbsent(groupKey, new RawSeriesHeader(point.measurement(), tags));
            groups.computeIfAbsent(groupKey, k -> new TreeMap<>()).put(point.time(), point.value());
        }

        List<RawSeries> series = new ArrayList<>();
        for (Map.Entry<String, NavigableMap<Instant, Object>> group : groups.entrySet()) {
            List<RawSeries.Row> rows = rows(statement, group.getValue(), now, precision);
            if (statement.descending()) {
                Collections.reverse(rows);
            }
            rows = page(rows, statement.offset(), statement.limit());
            RawSeriesHeader header = headers.get(group.getKey());
            series.add(new RawSeries(header.measurement(), header.tags(), rows));
        }
        log.debug("In-memory query returned {} series: {}", series.size(), query);
        return new QueryResult(series);
    }

    @Override
    public synchronized boolean writePoints(List<Point> batch, TimePrecision precision) {
        for (Point point : batch) {
            Instant time = truncate(point.time(), precision);
            points.removeIf(existing -> existing.measurement().equals(point.measurement())
                && existing.time().equals(time) && existing.tags().equals(point.tags()));
            points.add(new Point(point.measurement(), time, point.tags(), point.value()));
        }
        log.debug("Stored {} points ({} total)", batch.size(), points.size());
        return true;
    }

    @Override
    public synchronized void execute(String statement) {
        ParsedStatement parsed = InfluxQlParser.parse(statement);
        if (!parsed.drop()) {
            throw new InvalidParameterException("not a drop statement: " + statement);
        }
        Instant now = clock.instant();
        int before = points.size();
        points.removeIf(point -> matches(parsed, point, now));
        log.debug("Dropped {} points: {}", before - points.size(), statement);
    }

    /**
     * Returns a snapshot of all stored points.
     *
     * @return Unmodifiable copy
     */
    public synchronized List<Point> points() {
        return List.copyOf(points);
    }

    private List<RawSeries.Row> rows(ParsedStatement statement, NavigableMap<Instant, Object> values, Instant now,
                                     TimePrecision precision) {
        List<RawSeries.Row> rows = new ArrayList<>();
        if (statement.aggregation() == null) {
            values.forEach((time, value) -> rows.add(new RawSeries.Row(TimestampConverter.format(time, precision), value)));
            return rows;
        }
        Instant lower = bound(statement, now, true);
        Instant upper = bound(statement, now, false);
        if (statement.groupInterval() == null) {
            Instant time = lower != null ? lower : Instant.EPOCH;
            rows.add(new RawSeries.Row(TimestampConverter.format(time, precision),
                aggregate(statement.aggregation(), new ArrayList<>(values.values()))));
            return rows;
        }
        long width = statement.groupInterval().toNanos();
        long first = floor(nanos(lower != null ? lower : values.firstKey()), width);
        long end = upper != null ? nanos(upper) : nanos(values.lastKey()) + 1;
        Object previous = null;
        for (long bucket = first; bucket < end; bucket += width) {
            Instant start = fromNanos(bucket);
            Instant stop = fromNanos(bucket + width);
            List<Object> bucketValues = new ArrayList<>(values.subMap(start, true, stop, false).values());
            Object value = bucketValues.isEmpty() ? null : aggregate(statement.aggregation(), bucketValues);
            if (value == null) {
                String fill = statement.fill() == null ? "null" : statement.fill();
                if ("none".equals(fill)) {
                    continue;
                } else if ("previous".equals(fill)) {
                    value = previous;
                } else if (!"null".equals(fill)) {
                    value = fillValue(fill);
                }
            }
            previous = value;
            rows.add(new RawSeries.Row(TimestampConverter.format(start, precision), value));
        }
        return rows;
    }

    private static Object aggregate(String aggregation, List<Object> values) {
        List<Double> numbers = new ArrayList<>();
        for (Object value : values) {
            if (value instanceof Number) {
                numbers.add(((Number) value).doubleValue());
            } else if (value instanceof Boolean) {
                numbers.add(((Boolean) value) ? 1.0 : 0.0);
            }
        }
        if (numbers.isEmpty()) {
            return "count".equals(aggregation) ? (Object) 0L : null;
        }
        return switch (aggregation) {
            case "mean" -> numbers.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
            case "sum" -> numbers.stream().mapToDouble(Double::doubleValue).sum();
            case "min" -> numbers.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
            case "max" -> numbers.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
            case "count" -> (long) numbers.size();
            case "first" -> numbers.get(0);
            case "last" -> numbers.get(numbers.size() - 1);
            default -> throw new InvalidParameterException("unsupported aggregation " + aggregation);
        };
    }

    private static Object fillValue(String fill) {
        try {
            return Double.parseDouble(fill);
        } catch (NumberFormatException e) {
            throw new InvalidParameterException("unsupported fill policy " + fill, e);
        }
    }

    private boolean matches(ParsedStatement statement, Point point, Instant now) {
        if (statement.measurement() != null && !statement.measurement().equals(point.measurement())) {
            return false;
        }
        if (statement.measurementRegex() != null && !statement.measurementRegex().matcher(point.measurement()).find()) {
            return false;
        }
        for (Condition condition : statement.conditions()) {
            if (condition.isTime()) {
                int comparison = point.time().compareTo(TimeExpression.evaluate(condition.values().get(0), now));
                boolean holds = switch (condition.operator()) {
                    case ">=" -> comparison >= 0;
                    case ">" -> comparison > 0;
                    case "<=" -> comparison <= 0;
                    case "<" -> comparison < 0;
                    default -> comparison == 0;
                };
                if (!holds) {
                    return false;
                }
            } else if (!condition.values().contains(point.tags().getOrDefault(condition.key(), ""))) {
                return false;
            }
        }
        return true;
    }

    private static Instant bound(ParsedStatement statement, Instant now, boolean lower) {
        Instant result = null;
        for (Condition condition : statement.conditions()) {
            if (!condition.isTime()) {
                continue;
            }
            Instant value = TimeExpression.evaluate(condition.values().get(0), now);
            String operator = condition.operator();
            if (lower && operator.startsWith(">")) {
                result = ">".equals(operator) ? value.plusNanos(1) : value;
            } else if (!lower && operator.startsWith("<")) {
                result = "<=".equals(operator) ? value.plusNanos(1) : value;
            }
        }
        return result;
    }

    private static Instant truncate(Instant time, TimePrecision precision) {
        return precision == TimePrecision.NONE ? time : time.truncatedTo(precision.getUnit());
    }

    private static long nanos(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano());
    }

    private static Instant fromNanos(long nanos) {
        return Instant.ofEpochSecond(Math.floorDiv(nanos, 1_000_000_000L), Math.floorMod(nanos, 1_000_000_000L));
    }

    private static long floor(long value, long width) {
        return Math.floorDiv(value, width) * width;
    }

    private static List<RawSeries.Row> page(List<RawSeries.Row> rows, Integer offset, Integer limit) {
        int from = offset == null ? 0 : Math.min(offset, rows.size());
        int to = limit == null ? rows.size() : Math.min(rows.size(), from + limit);
        return new ArrayList<>(rows.subList(from, to));
    }

    private record RawSeriesHeader(String measurement, Map<String, String> tags) {
    }
}
