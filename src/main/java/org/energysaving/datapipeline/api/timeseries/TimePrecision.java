package org.energysaving.datapipeline.api.timeseries;

import java.time.temporal.ChronoUnit;

/**
 * Time precision used when reading epochs from, or writing points to, the time-series store.
 * <p>
 * {@link #NONE} means full calendar instants (RFC3339 strings on the wire); every other value
 * means integer counts of that unit since the epoch.
 */
public enum TimePrecision {
    NONE(null, null),
    MICROSECONDS("u", ChronoUnit.MICROS),
    MILLISECONDS("ms", ChronoUnit.MILLIS),
    SECONDS("s", ChronoUnit.SECONDS),
    MINUTES("m", ChronoUnit.MINUTES),
    HOURS("h", ChronoUnit.HOURS);

    private final String code;
    private final ChronoUnit unit;

    TimePrecision(String code, ChronoUnit unit) {
        this.code = code;
        this.unit = unit;
    }

    /**
     * Returns the store's code for this precision ({@code u}, {@code ms}, ...).
     *
     * @return Code, or null for {@link #NONE}
     */
    public String getCode() {
        return code;
    }

    /**
     * Returns the unit counted by epoch values of this precision.
     *
     * @return Unit, or null for {@link #NONE}
     */
    public ChronoUnit getUnit() {
        return unit;
    }

    /**
     * Parses a precision code. Null or blank means {@link #NONE}.
     *
     * @param code Code such as "ms"
     * @return Matching precision
     * @throws IllegalArgumentException if the code is not part of the closed set
     */
    public static TimePrecision fromCode(String code) {
        if (code == null || code.isBlank()) {
            return NONE;
        }
        for (TimePrecision precision : values()) {
            if (code.equals(precision.code)) {
                return precision;
            }
        }
        throw new IllegalArgumentException("Unsupported time precision: " + code);
    }
}
