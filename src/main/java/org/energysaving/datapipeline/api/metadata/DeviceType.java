package org.energysaving.datapipeline.api.metadata;

import java.util.Optional;

/**
 * The closed set of device-type kinds a datacenter can describe.
 * <p>
 * Each kind maps to one attribute (or parameter) table and one join table in the relational
 * metadata schema. The join table links an attribute name to the devices carrying it; the
 * device column names the table those devices live in.
 */
public enum DeviceType {

    /** Attributes measured by sensors (temperature, humidity). */
    SENSOR_ATTRIBUTE("sensor_attribute", "sensor"),

    /** Attributes reported by cooling controllers. */
    CONTROLLER_ATTRIBUTE("controller_attribute", "controller"),

    /** Set-points that can be written back to controllers. */
    CONTROLLER_PARAMETER("controller_parameter", "controller"),

    /** Attributes of IT power supplies. */
    POWER_SUPPLY_ATTRIBUTE("power_supply_attribute", "power_supply"),

    /** Attributes of controller power supplies. */
    CONTROLLER_POWER_SUPPLY_ATTRIBUTE("controller_power_supply_attribute", "controller_power_supply"),

    /** Attributes of outdoor environment sensors. */
    ENVIRONMENT_SENSOR_ATTRIBUTE("environment_sensor_attribute", "environment_sensor");

    private final String wireName;
    private final String deviceTable;

    DeviceType(String wireName, String deviceTable) {
        this.wireName = wireName;
        this.deviceTable = deviceTable;
    }

    /**
     * Returns the name used in metadata, selections, tags and node files.
     *
     * @return Wire name (e.g. "sensor_attribute")
     */
    public String getWireName() {
        return wireName;
    }

    /**
     * Returns the table holding the attribute or parameter definitions of this kind.
     *
     * @return Table name
     */
    public String getAttributeTable() {
        return wireName;
    }

    /**
     * Returns the join table linking attribute names to device names.
     *
     * @return Table name
     */
    public String getDataTable() {
        return wireName + "_data";
    }

    /**
     * Returns the table holding the devices of this kind.
     *
     * @return Table name
     */
    public String getDeviceTable() {
        return deviceTable;
    }

    /**
     * Returns the column of the join table that references the device.
     *
     * @return Column name (e.g. "sensor_name")
     */
    public String getDeviceColumn() {
        return deviceTable + "_name";
    }

    /**
     * Returns true for parameter kinds, which carry min/max bounds instead of statistics.
     *
     * @return true if this kind describes writable parameters
     */
    public boolean isParameter() {
        return this == CONTROLLER_PARAMETER;
    }

    /**
     * Looks up a kind by wire name.
     *
     * @param wireName Wire name, may be null
     * @return The kind, or empty if the name is not one of the six kinds
     */
    public static Optional<DeviceType> fromWireName(String wireName) {
        for (DeviceType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
