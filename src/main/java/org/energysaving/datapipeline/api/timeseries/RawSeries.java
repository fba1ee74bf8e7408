package org.energysaving.datapipeline.api.timeseries;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One series of a store response: measurement name, group-by tags and {@code (time, value)} rows.
 * <p>
 * Times are whatever the store returned (RFC3339 strings or integer epochs); values are raw
 * JSON scalars (null for missing samples).
 *
 * @param measurement Measurement name as stored
 * @param tags        Group-by tag values (always contains {@code device} for compiled queries)
 * @param rows        Rows in store order
 */
public record RawSeries(String measurement, Map<String, String> tags, List<Row> rows) {

    public RawSeries {
        tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        rows = List.copyOf(rows);
    }

    /**
     * Returns the value of a tag.
     *
     * @param tag Tag name
     * @return Tag value or null
     */
    public String tag(String tag) {
        return tags.get(tag);
    }

    /**
     * One raw row.
     *
     * @param time  Raw timestamp
     * @param value Raw value, may be null
     */
    public record Row(Object time, Object value) {
    }
}
