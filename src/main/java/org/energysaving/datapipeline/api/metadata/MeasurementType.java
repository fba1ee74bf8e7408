package org.energysaving.datapipeline.api.metadata;

/**
 * Value type of a measurement.
 * <p>
 * Determines which conversion and formatting functions are legal for the measurement's
 * values. Maps to the Java type cells of a series table carry.
 */
public enum MeasurementType {
    /**
     * On/off values. Stored as {@link Boolean}.
     */
    BINARY("binary", Boolean.class),

    /**
     * Real-valued readings. Stored as {@link Double}, formatted to 2 decimals.
     */
    CONTINUOUS("continuous", Double.class),

    /**
     * Counters and whole-number readings. Stored as {@link Long}.
     */
    INTEGER("integer", Long.class),

    /**
     * Categorical values. Stored as {@link String}, never converted.
     */
    DISCRETE("discrete", String.class);

    private final String wireName;
    private final Class<?> javaType;

    MeasurementType(String wireName, Class<?> javaType) {
        this.wireName = wireName;
        this.javaType = javaType;
    }

    /**
     * Returns the name stored in metadata.
     *
     * @return Wire name (e.g. "continuous")
     */
    public String getWireName() {
        return wireName;
    }

    /**
     * Returns the Java type of converted values.
     *
     * @return Value class
     */
    public Class<?> getJavaType() {
        return javaType;
    }

    /**
     * Returns true if values of this type can be used in arithmetic.
     *
     * @return true for binary, continuous and integer
     */
    public boolean isNumeric() {
        return this != DISCRETE;
    }

    /**
     * Parses a wire name. Unknown or null names map to {@link #DISCRETE}, which leaves values untouched.
     *
     * @param wireName Name from metadata
     * @return The matching type
     */
    public static MeasurementType fromWireName(String wireName) {
        if (wireName != null) {
            for (MeasurementType type : values()) {
                if (type.wireName.equalsIgnoreCase(wireName)) {
                    return type;
                }
            }
        }
        return DISCRETE;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
