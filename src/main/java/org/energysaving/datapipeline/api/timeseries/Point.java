package org.energysaving.datapipeline.api.timeseries;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One write-point: measurement, timestamp, tags and the single {@code value} field.
 *
 * @param measurement Measurement name
 * @param time        Timestamp
 * @param tags        Tags (datacenter, device_type, device, caller tags)
 * @param value       Field value: Boolean, Long, Double or String, never null
 */
public record Point(String measurement, Instant time, Map<String, String> tags, Object value) {

    public Point {
        Objects.requireNonNull(measurement, "measurement");
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(value, "value");
        tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }
}
