package org.energysaving.datapipeline.api.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of everything the core knows about one datacenter.
 * <p>
 * Read at the start of every query, transform or training session and never mutated
 * afterwards. A statistics refresh produces a new snapshot through the metadata repository.
 * <p>
 * Device-type keys are restricted to the wire names of {@link DeviceType}.
 */
public final class DatacenterMetadata {

    private final String name;
    private final int timeInterval;
    private final Map<String, String> models;
    private final Map<String, Object> properties;
    private final Map<String, DeviceTypeMetadata> deviceTypes;

    private DatacenterMetadata(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name");
        if (builder.timeInterval <= 0) {
            throw new IllegalArgumentException("timeInterval must be positive, got " + builder.timeInterval);
        }
        this.timeInterval = builder.timeInterval;
        this.models = Collections.unmodifiableMap(new LinkedHashMap<>(builder.models));
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
        this.deviceTypes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.deviceTypes));
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the sampling cadence.
     *
     * @return Interval in seconds
     */
    public int getTimeInterval() {
        return timeInterval;
    }

    /**
     * Returns the model-type name to configuration file mapping.
     *
     * @return Unmodifiable map
     */
    public Map<String, String> getModels() {
        return models;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }

    public Map<String, DeviceTypeMetadata> getDeviceTypes() {
        return deviceTypes;
    }

    public Optional<DeviceTypeMetadata> getDeviceType(String deviceType) {
        return Optional.ofNullable(deviceTypes.get(deviceType));
    }

    /**
     * Looks up a measurement under a device type.
     *
     * @param deviceType  Device-type wire name
     * @param measurement Measurement name
     * @return Measurement metadata, or empty if either level is unknown
     */
    public Optional<MeasurementMetadata> getMeasurement(String deviceType, String measurement) {
        return getDeviceType(deviceType).flatMap(d -> d.getMeasurement(measurement));
    }

    /**
     * Returns a copy with one measurement's attribute replaced.
     *
     * @param deviceType  Device-type wire name
     * @param measurement Measurement name
     * @param attribute   Replacement attribute
     * @return New snapshot
     * @throws IllegalArgumentException if the measurement is unknown
     */
    public DatacenterMetadata withAttribute(String deviceType, String measurement, MeasurementAttribute attribute) {
        MeasurementMetadata current = getMeasurement(deviceType, measurement)
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown measurement " + deviceType + "/" + measurement + " in datacenter " + name));
        Map<String, MeasurementMetadata> measurements = new LinkedHashMap<>(deviceTypes.get(deviceType).getMeasurements());
        measurements.put(measurement, current.withAttribute(attribute));
        Builder builder = toBuilder();
        builder.deviceTypes.put(deviceType, new DeviceTypeMetadata(measurements));
        return builder.build();
    }

    public Builder toBuilder() {
        Builder builder = builder(name).timeInterval(timeInterval);
        builder.models.putAll(models);
        builder.properties.putAll(properties);
        builder.deviceTypes.putAll(deviceTypes);
        return builder;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DatacenterMetadata)) {
            return false;
        }
        DatacenterMetadata that = (DatacenterMetadata) o;
        return timeInterval == that.timeInterval
            && name.equals(that.name)
            && models.equals(that.models)
            && properties.equals(that.properties)
            && deviceTypes.equals(that.deviceTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, timeInterval, models, properties, deviceTypes);
    }

    @Override
    public String toString() {
        return "DatacenterMetadata[name=" + name + ", timeInterval=" + timeInterval
            + ", deviceTypes=" + deviceTypes.keySet() + "]";
    }

    /**
     * Builder for DatacenterMetadata.
     */
    public static class Builder {
        private final String name;
        private int timeInterval = 60;
        private final Map<String, String> models = new LinkedHashMap<>();
        private final Map<String, Object> properties = new LinkedHashMap<>();
        private final Map<String, DeviceTypeMetadata> deviceTypes = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder timeInterval(int seconds) {
            this.timeInterval = seconds;
            return this;
        }

        public Builder model(String modelType, String configFile) {
            models.put(modelType, configFile);
            return this;
        }

        public Builder models(Map<String, String> models) {
            this.models.putAll(models);
            return this;
        }

        public Builder properties(Map<String, Object> properties) {
            this.properties.putAll(properties);
            return this;
        }

        /**
         * Adds a measurement under a device type, creating the device-type entry on first use.
         *
         * @param deviceType  One of the six kinds
         * @param measurement Measurement name
         * @param metadata    Devices and attribute
         * @return This builder
         */
        public Builder measurement(DeviceType deviceType, String measurement, MeasurementMetadata metadata) {
            DeviceTypeMetadata existing = deviceTypes.getOrDefault(deviceType.getWireName(), DeviceTypeMetadata.empty());
            Map<String, MeasurementMetadata> measurements = new LinkedHashMap<>(existing.getMeasurements());
            measurements.put(measurement, metadata);
            deviceTypes.put(deviceType.getWireName(), new DeviceTypeMetadata(measurements));
            return this;
        }

        public Builder deviceType(DeviceType deviceType, DeviceTypeMetadata metadata) {
            deviceTypes.put(deviceType.getWireName(), metadata);
            return this;
        }

        public DatacenterMetadata build() {
            return new DatacenterMetadata(this);
        }
    }
}
