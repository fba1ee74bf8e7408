package org.energysaving.datapipeline.write;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.energysaving.datapipeline.api.metadata.DatacenterMetadata;
import org.energysaving.datapipeline.api.metadata.MeasurementMetadata;
import org.energysaving.datapipeline.api.metadata.MeasurementType;
import org.energysaving.datapipeline.api.timeseries.ITimeSeriesStore;
import org.energysaving.datapipeline.api.timeseries.Point;
import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.api.timeseries.SeriesTable;
import org.energysaving.datapipeline.api.timeseries.TagNames;
import org.energysaving.datapipeline.api.timeseries.TimePrecision;
import org.energysaving.datapipeline.shaping.ValueConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a series table back to the time-series store.
 * <p>
 * Each column becomes one batch of points for its measurement, tagged with datacenter, device
 * type and device plus the caller's tags. Values are coerced to the measurement's declared type;
 * missing values and values that fail conversion are left out. Columns whose measurement is not
 * (yet) in metadata are written unconverted. Empty batches are not sent.
 */
public class TimeSeriesWriter {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesWriter.class);

    private final ITimeSeriesStore store;

    public TimeSeriesWriter(ITimeSeriesStore store) {
        this.store = store;
    }

    /**
     * Writes every column of a table.
     *
     * @param metadata  Snapshot of the target datacenter
     * @param table     Values to write
     * @param tags      Extra tags for every point (e.g. {@code test_result}, {@code measurement_kind})
     * @param precision Timestamp precision of the write
     * @return true only if every batch was accepted
     */
    public boolean write(DatacenterMetadata metadata, SeriesTable table, Map<String, String> tags,
                         TimePrecision precision) {
        boolean status = true;
        for (SeriesKey key : table.columns()) {
            List<Point> points = toPoints(metadata, key, table, tags);
            if (points.isEmpty()) {
                log.debug("No values to write for {}", key);
                continue;
            }
            boolean written = store.writePoints(points, precision);
            if (!written) {
                log.warn("Store rejected {} points for {} in datacenter {}", points.size(), key, metadata.getName());
            }
            status &= written;
        }
        log.debug("Write status for datacenter {}: {}", metadata.getName(), status);
        return status;
    }

    private List<Point> toPoints(DatacenterMetadata metadata, SeriesKey key, SeriesTable table,
                                 Map<String, String> tags) {
        Optional<MeasurementType> type = metadata.getMeasurement(key.deviceType(), key.measurement())
            .map(MeasurementMetadata::getAttribute)
            .map(attribute -> attribute.getType());
        if (type.isEmpty()) {
            log.warn("Measurement {}/{} is unknown in datacenter {}, writing values unconverted",
                key.deviceType(), key.measurement(), metadata.getName());
        }
        Map<String, String> pointTags = new LinkedHashMap<>();
        if (tags != null) {
            pointTags.putAll(tags);
        }
        pointTags.put(TagNames.DATACENTER, metadata.getName());
        pointTags.put(TagNames.DEVICE_TYPE, key.deviceType());
        pointTags.put(TagNames.DEVICE, key.device());

        List<Point> points = new ArrayList<>();
        for (Map.Entry<Instant, Object> cell : table.column(key).entrySet()) {
            Object value = type.isPresent()
                ? ValueConverter.convert(cell.getValue(), type.get(), false)
                : cell.getValue();
            if (value != null) {
                points.add(new Point(key.measurement(), cell.getKey(), pointTags, value));
            }
        }
        return points;
    }
}
