package org.energysaving.datapipeline.shaping;

import java.math.BigDecimal;
import java.math.RoundingMode;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;
import org.energysaving.datapipeline.api.metadata.MeasurementType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Type coercion and display formatting of measurement values.
 * <p>
 * Null is the missing sample and always stays null.
 */
public final class ValueConverter {

    private static final Logger log = LoggerFactory.getLogger(ValueConverter.class);

    private ValueConverter() {
    }

    /**
     * Converts a raw value to the Java type of a measurement type.
     *
     * @param raw    Raw value (JSON scalar or already typed), may be null
     * @param type   Declared measurement type
     * @param strict Whether a failed conversion throws instead of yielding null
     * @return Converted value, or null if missing or (non-strict) not convertible
     * @throws InvalidParameterException if strict and the value cannot be converted
     */
    public static Object convert(Object raw, MeasurementType type, boolean strict) {
        if (raw == null) {
            return null;
        }
        try {
            return switch (type) {
                case BINARY -> toBoolean(raw);
                case CONTINUOUS -> toDouble(raw);
                case INTEGER -> toLong(raw);
                case DISCRETE -> raw instanceof String ? raw : String.valueOf(raw);
            };
        } catch (NumberFormatException | InvalidParameterException e) {
            if (strict) {
                throw e instanceof InvalidParameterException
                    ? (InvalidParameterException) e
                    : new InvalidParameterException("failed to convert " + raw + " to " + type, e);
            }
            log.warn("Failed to convert {} to {}: {}", raw, type, e.getMessage());
            return null;
        }
    }

    /**
     * Applies the type-specific output format.
     * <p>
     * Continuous values are rounded half-up to 2 decimals, then offset by the base value. Integer
     * values are offset by the base value. Binary and discrete values are returned unchanged.
     *
     * @param value     Converted value, may be null
     * @param type      Declared measurement type
     * @param baseValue Offset for numeric values, may be null
     * @return Formatted value, or null if missing
     */
    public static Object format(Object value, MeasurementType type, Number baseValue) {
        if (value == null) {
            return null;
        }
        switch (type) {
            case CONTINUOUS: {
                if (!(value instanceof Number)) {
                    return value;
                }
                double rounded = BigDecimal.valueOf(((Number) value).doubleValue())
                    .setScale(2, RoundingMode.HALF_UP)
                    .doubleValue();
                return baseValue == null ? rounded : rounded + baseValue.doubleValue();
            }
            case INTEGER: {
                if (baseValue == null || !(value instanceof Number)) {
                    return value;
                }
                if (value instanceof Long && !(baseValue instanceof Double || baseValue instanceof Float)) {
                    return (Long) value + baseValue.longValue();
                }
                return ((Number) value).doubleValue() + baseValue.doubleValue();
            }
            default:
                return value;
        }
    }

    private static Boolean toBoolean(Object raw) {
        if (raw instanceof Boolean) {
            return (Boolean) raw;
        }
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue() != 0.0;
        }
        String text = raw.toString().trim();
        if ("true".equalsIgnoreCase(text)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(text)) {
            return Boolean.FALSE;
        }
        return Double.parseDouble(text) != 0.0;
    }

    private static Double toDouble(Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        if (raw instanceof Boolean) {
            return ((Boolean) raw) ? 1.0 : 0.0;
        }
        return Double.parseDouble(raw.toString().trim());
    }

    private static Long toLong(Object raw) {
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof Number) {
            double value = ((Number) raw).doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new InvalidParameterException("cannot convert " + raw + " to integer");
            }
            return (long) value;
        }
        if (raw instanceof Boolean) {
            return ((Boolean) raw) ? 1L : 0L;
        }
        String text = raw.toString().trim();
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            return (long) Double.parseDouble(text);
        }
    }
}
