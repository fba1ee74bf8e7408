package org.energysaving.datapipeline.resources.timeseries;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.energysaving.datapipeline.api.timeseries.Point;
import org.energysaving.datapipeline.api.timeseries.TimePrecision;

/**
 * Encodes points in the store's line protocol:
 * {@code measurement[,tag=value...] value=<field> <timestamp>}.
 * <p>
 * Integers carry the {@code i} suffix, strings are double-quoted. The timestamp is a count of
 * the write precision's unit, nanoseconds for {@link TimePrecision#NONE}.
 */
public final class LineProtocol {

    private LineProtocol() {
    }

    public static String encode(List<Point> points, TimePrecision precision) {
        StringBuilder body = new StringBuilder();
        for (Point point : points) {
            if (body.length() > 0) {
                body.append('\n');
            }
            body.append(encode(point, precision));
        }
        return body.toString();
    }

    /**
     * Encodes one point.
     *
     * @param point     Point
     * @param precision Timestamp precision
     * @return One line, without trailing newline
     */
    public static String encode(Point point, TimePrecision precision) {
        StringBuilder line = new StringBuilder(escapeMeasurement(point.measurement()));
        for (Map.Entry<String, String> tag : point.tags().entrySet()) {
            if (tag.getValue() == null || tag.getValue().isEmpty()) {
                continue;
            }
            line.append(',').append(escapeTag(tag.getKey())).append('=').append(escapeTag(tag.getValue()));
        }
        line.append(" value=").append(fieldValue(point.value()));
        line.append(' ').append(timestamp(point.time(), precision));
        return line.toString();
    }

    static long timestamp(Instant time, TimePrecision precision) {
        if (precision == TimePrecision.NONE) {
            return Math.addExact(Math.multiplyExact(time.getEpochSecond(), 1_000_000_000L), time.getNano());
        }
        return precision.getUnit().between(Instant.EPOCH, time);
    }

    private static String fieldValue(Object value) {
        if (value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Long || value instanceof Integer) {
            return value + "i";
        }
        if (value instanceof Number) {
            return value.toString();
        }
        return "\"" + value.toString().replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static String escapeMeasurement(String value) {
        return value.replace(",", "\\,").replace(" ", "\\ ");
    }

    private static String escapeTag(String value) {
        return value.replace(",", "\\,").replace("=", "\\=").replace(" ", "\\ ");
    }
}
