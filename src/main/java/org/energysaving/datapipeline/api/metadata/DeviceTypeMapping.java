package org.energysaving.datapipeline.api.metadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolved {@code device_type -> measurement -> [device]} mapping.
 * <p>
 * This is the contract between the metadata resolver and the query compiler / result shaper.
 * Iteration order is insertion order at every level; device lists never contain duplicates.
 */
public final class DeviceTypeMapping {

    private final Map<String, Map<String, List<String>>> mapping = new LinkedHashMap<>();

    /**
     * Adds a device, creating intermediate levels as needed. Duplicate devices are ignored.
     *
     * @param deviceType  Device-type wire name
     * @param measurement Measurement name
     * @param device      Device identifier
     * @return This mapping
     */
    public DeviceTypeMapping add(String deviceType, String measurement, String device) {
        List<String> devices = mapping
            .computeIfAbsent(deviceType, k -> new LinkedHashMap<>())
            .computeIfAbsent(measurement, k -> new ArrayList<>());
        if (!devices.contains(device)) {
            devices.add(device);
        }
        return this;
    }

    /**
     * Adds several devices under one measurement.
     *
     * @param deviceType  Device-type wire name
     * @param measurement Measurement name
     * @param devices     Device identifiers
     * @return This mapping
     */
    public DeviceTypeMapping addAll(String deviceType, String measurement, List<String> devices) {
        for (String device : devices) {
            add(deviceType, measurement, device);
        }
        return this;
    }

    public Set<String> deviceTypes() {
        return Collections.unmodifiableSet(mapping.keySet());
    }

    public Set<String> measurements(String deviceType) {
        Map<String, List<String>> measurements = mapping.get(deviceType);
        return measurements == null ? Collections.emptySet() : Collections.unmodifiableSet(measurements.keySet());
    }

    public List<String> devices(String deviceType, String measurement) {
        Map<String, List<String>> measurements = mapping.get(deviceType);
        if (measurements == null) {
            return Collections.emptyList();
        }
        List<String> devices = measurements.get(measurement);
        return devices == null ? Collections.emptyList() : Collections.unmodifiableList(devices);
    }

    public boolean isEmpty() {
        return mapping.isEmpty();
    }

    /**
     * Returns the total number of (device type, measurement, device) triples.
     *
     * @return Triple count
     */
    public int size() {
        int size = 0;
        for (Map<String, List<String>> measurements : mapping.values()) {
            for (List<String> devices : measurements.values()) {
                size += devices.size();
            }
        }
        return size;
    }

    /**
     * Returns a deep, unmodifiable copy as plain maps, e.g. for JSON output.
     *
     * @return Nested map
     */
    public Map<String, Map<String, List<String>>> toMap() {
        Map<String, Map<String, List<String>>> copy = new LinkedHashMap<>();
        mapping.forEach((deviceType, measurements) -> {
            Map<String, List<String>> measurementCopy = new LinkedHashMap<>();
            measurements.forEach((m, devices) -> measurementCopy.put(m, List.copyOf(devices)));
            copy.put(deviceType, Collections.unmodifiableMap(measurementCopy));
        });
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof DeviceTypeMapping && mapping.equals(((DeviceTypeMapping) o).mapping));
    }

    @Override
    public int hashCode() {
        return mapping.hashCode();
    }

    @Override
    public String toString() {
        return mapping.toString();
    }
}
