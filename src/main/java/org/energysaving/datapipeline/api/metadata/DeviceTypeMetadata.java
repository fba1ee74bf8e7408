package org.energysaving.datapipeline.api.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Measurements known for one device type, in insertion order.
 */
public final class DeviceTypeMetadata {

    private final Map<String, MeasurementMetadata> measurements;

    public DeviceTypeMetadata(Map<String, MeasurementMetadata> measurements) {
        this.measurements = Collections.unmodifiableMap(new LinkedHashMap<>(measurements));
    }

    public static DeviceTypeMetadata empty() {
        return new DeviceTypeMetadata(Collections.emptyMap());
    }

    public Map<String, MeasurementMetadata> getMeasurements() {
        return measurements;
    }

    public Optional<MeasurementMetadata> getMeasurement(String measurement) {
        return Optional.ofNullable(measurements.get(measurement));
    }

    public boolean hasMeasurement(String measurement) {
        return measurements.containsKey(measurement);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof DeviceTypeMetadata && measurements.equals(((DeviceTypeMetadata) o).measurements));
    }

    @Override
    public int hashCode() {
        return measurements.hashCode();
    }

    @Override
    public String toString() {
        return measurements.toString();
    }
}
