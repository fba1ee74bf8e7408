package org.energysaving.datapipeline.api.timeseries;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity triple {@code (device_type, measurement, device)} of one series.
 * <p>
 * Used as the column key of a {@link SeriesTable} and as the identity key of nodes.
 *
 * @param deviceType  Device-type wire name
 * @param measurement Measurement name
 * @param device      Device identifier
 */
public record SeriesKey(String deviceType, String measurement, String device) implements Comparable<SeriesKey> {

    private static final Comparator<SeriesKey> ORDER = Comparator
        .comparing(SeriesKey::deviceType)
        .thenComparing(SeriesKey::measurement)
        .thenComparing(SeriesKey::device);

    public SeriesKey {
        Objects.requireNonNull(deviceType, "deviceType");
        Objects.requireNonNull(measurement, "measurement");
        Objects.requireNonNull(device, "device");
    }

    public static SeriesKey of(String deviceType, String measurement, String device) {
        return new SeriesKey(deviceType, measurement, device);
    }

    /**
     * Returns a key for another device of the same measurement.
     *
     * @param otherDevice Device identifier
     * @return New key
     */
    public SeriesKey withDevice(String otherDevice) {
        return new SeriesKey(deviceType, measurement, otherDevice);
    }

    @Override
    public int compareTo(SeriesKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return deviceType + "." + measurement + "." + device;
    }
}
