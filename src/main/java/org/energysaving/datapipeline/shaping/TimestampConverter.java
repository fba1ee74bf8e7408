package org.energysaving.datapipeline.shaping;

import java.time.Instant;
import java.time.format.DateTimeFormatter;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;
import org.energysaving.datapipeline.api.timeseries.TimePrecision;
import org.energysaving.datapipeline.query.TimeExpression;

/**
 * Conversion between store timestamps and {@link Instant}s.
 * <p>
 * Without precision timestamps are RFC3339 strings; with a precision they are integer counts
 * of that unit since the epoch.
 */
public final class TimestampConverter {

    private TimestampConverter() {
    }

    /**
     * Parses a store timestamp.
     *
     * @param raw       RFC3339 string, an {@link Instant}, or an integer epoch count
     * @param precision Unit of integer counts; for {@link TimePrecision#NONE} numbers are nanoseconds
     * @return The instant
     * @throws InvalidParameterException if the value cannot be interpreted
     */
    public static Instant toInstant(Object raw, TimePrecision precision) {
        if (raw instanceof Instant) {
            return (Instant) raw;
        }
        if (raw instanceof Number) {
            long count = ((Number) raw).longValue();
            if (precision == null || precision == TimePrecision.NONE) {
                return Instant.EPOCH.plusNanos(count);
            }
            return Instant.EPOCH.plus(count, precision.getUnit());
        }
        if (raw instanceof String) {
            String text = (String) raw;
            if (precision != null && precision != TimePrecision.NONE && text.matches("^-?\\d+$")) {
                return Instant.EPOCH.plus(Long.parseLong(text), precision.getUnit());
            }
            return TimeExpression.parseTimestamp(text);
        }
        throw new InvalidParameterException("unsupported timestamp " + raw);
    }

    /**
     * Formats an instant for output.
     *
     * @param instant   Instant to format
     * @param precision Target precision
     * @return RFC3339 string for {@link TimePrecision#NONE}, otherwise a Long count truncated to the unit
     */
    public static Object format(Instant instant, TimePrecision precision) {
        if (precision == null || precision == TimePrecision.NONE) {
            return DateTimeFormatter.ISO_INSTANT.format(instant);
        }
        return precision.getUnit().between(Instant.EPOCH, instant);
    }
}
