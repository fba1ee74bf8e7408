package org.energysaving.datapipeline.api.metadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Devices carrying a measurement plus the measurement's attribute record.
 * <p>
 * The device list is ordered and free of duplicates.
 */
public final class MeasurementMetadata {

    private final List<String> devices;
    private final MeasurementAttribute attribute;

    public MeasurementMetadata(List<String> devices, MeasurementAttribute attribute) {
        this.devices = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(devices)));
        this.attribute = Objects.requireNonNull(attribute, "attribute");
    }

    public List<String> getDevices() {
        return devices;
    }

    public MeasurementAttribute getAttribute() {
        return attribute;
    }

    /**
     * Returns true if the device carries this measurement.
     *
     * @param device Device identifier
     * @return true if declared
     */
    public boolean hasDevice(String device) {
        return devices.contains(device);
    }

    /**
     * Returns a copy with a different attribute record and the same devices.
     *
     * @param attribute New attribute
     * @return New instance
     */
    public MeasurementMetadata withAttribute(MeasurementAttribute attribute) {
        return new MeasurementMetadata(devices, attribute);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MeasurementMetadata)) {
            return false;
        }
        MeasurementMetadata that = (MeasurementMetadata) o;
        return devices.equals(that.devices) && attribute.equals(that.attribute);
    }

    @Override
    public int hashCode() {
        return Objects.hash(devices, attribute);
    }

    @Override
    public String toString() {
        return "MeasurementMetadata[devices=" + devices + ", attribute=" + attribute + "]";
    }
}
