package org.energysaving.datapipeline.shaping;

/**
 * A requested unit change.
 *
 * @param from Unit the values are stored in (metadata unit), may be null
 * @param to   Unit the caller wants, null to keep values as stored
 */
public record UnitConversion(String from, String to) {

    public static UnitConversion none() {
        return new UnitConversion(null, null);
    }

    /**
     * Returns true if the units differ and both are known.
     *
     * @return true if values need converting
     */
    public boolean isRequired() {
        return from != null && to != null && !from.equalsIgnoreCase(to);
    }

    public UnitConversion inverse() {
        return new UnitConversion(to, from);
    }
}
