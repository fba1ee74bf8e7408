package org.energysaving.datapipeline.services;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;

import org.energysaving.datapipeline.api.metadata.DatacenterMetadata;
import org.energysaving.datapipeline.api.metadata.DeviceType;
import org.energysaving.datapipeline.api.metadata.DeviceTypeMapping;
import org.energysaving.datapipeline.api.metadata.MeasurementAttribute;
import org.energysaving.datapipeline.api.metadata.MeasurementMetadata;
import org.energysaving.datapipeline.api.metadata.MeasurementStatistics;
import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.api.timeseries.SeriesTable;
import org.energysaving.datapipeline.query.QueryOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recomputes the statistics of every numeric measurement of a datacenter from a historical window.
 * <p>
 * Samples are the per-interval means of each device, pooled across devices. Differences are
 * taken between consecutive samples of one device that lie exactly one interval apart. Mean and
 * deviation must be defined (at least two samples); the differentiation fields stay null when the
 * window has too few consecutive samples. Parameter kinds keep their configured bounds.
 * <p>
 * All results are stored in one metadata session, so a failing measurement leaves the stored
 * statistics untouched.
 */
public class StatisticsRefresher {

    private static final Logger log = LoggerFactory.getLogger(StatisticsRefresher.class);

    private final MetadataService metadataService;
    private final TimeSeriesService timeSeriesService;

    public StatisticsRefresher(MetadataService metadataService, TimeSeriesService timeSeriesService) {
        this.metadataService = metadataService;
        this.timeSeriesService = timeSeriesService;
    }

    /**
     * Refreshes all numeric measurements.
     *
     * @param datacenter Datacenter name
     * @param starttime  Window start literal (relative or absolute)
     * @param endtime    Window end literal, may be null
     * @return The snapshot after the refresh
     * @throws IllegalStateException if a measurement has fewer than two samples in the window
     */
    public DatacenterMetadata refresh(String datacenter, String starttime, String endtime) {
        DatacenterMetadata metadata = metadataService.getMetadata(datacenter);
        Duration interval = Duration.ofSeconds(metadata.getTimeInterval());
        QueryOptions options = QueryOptions.builder()
            .starttime(starttime)
            .endtime(endtime)
            .groupBy("time(" + metadata.getTimeInterval() + "s)")
            .aggregation("mean")
            .build();

        Map<MeasurementRef, MeasurementStatistics> results = new LinkedHashMap<>();
        metadata.getDeviceTypes().forEach((deviceType, deviceTypeMetadata) -> {
            for (Map.Entry<String, MeasurementMetadata> entry : deviceTypeMetadata.getMeasurements().entrySet()) {
                MeasurementMetadata measurement = entry.getValue();
                if (!measurement.getAttribute().getType().isNumeric() || measurement.getDevices().isEmpty()) {
                    continue;
                }
                DeviceTypeMapping mapping = new DeviceTypeMapping()
                    .addAll(deviceType, entry.getKey(), measurement.getDevices());
                SeriesTable table = timeSeriesService.listTimeseries(metadata, mapping, options);
                MeasurementStatistics statistics = compute(table, interval);
                if (statistics.mean() == null || statistics.deviation() == null) {
                    throw new IllegalStateException("Not enough samples to compute statistics of "
                        + deviceType + "/" + entry.getKey() + " in datacenter " + datacenter);
                }
                if (DeviceType.fromWireName(deviceType).map(DeviceType::isParameter).orElse(false)) {
                    statistics = keepBounds(statistics, measurement.getAttribute());
                }
                results.put(new MeasurementRef(deviceType, entry.getKey()), statistics);
                log.debug("Statistics of {}/{}: {}", deviceType, entry.getKey(), statistics);
            }
        });

        metadataService.getDatabase().inSession(session -> {
            for (Map.Entry<MeasurementRef, MeasurementStatistics> result : results.entrySet()) {
                metadataService.getRepository().updateStatistics(session, datacenter,
                    result.getKey().deviceType(), result.getKey().measurement(), result.getValue());
            }
            return null;
        });
        log.info("Refreshed statistics of {} measurements in datacenter '{}'", results.size(), datacenter);
        return metadataService.getMetadata(datacenter);
    }

    /**
     * Computes the statistics of all columns of a table.
     *
     * @param table    Per-interval samples, one column per device
     * @param interval Sampling interval
     * @return Statistics; fields are null where undefined
     */
    public static MeasurementStatistics compute(SeriesTable table, Duration interval) {
        List<Double> samples = new ArrayList<>();
        List<Double> differences = new ArrayList<>();
        for (SeriesKey key : table.columns()) {
            NavigableMap<Instant, Double> column = table.numericColumn(key);
            samples.addAll(column.values());
            for (Map.Entry<Instant, Double> entry : column.entrySet()) {
                Double next = column.get(entry.getKey().plus(interval));
                if (next != null) {
                    differences.add(next - entry.getValue());
                }
            }
        }
        return new MeasurementStatistics(
            mean(samples), deviation(samples),
            mean(differences), deviation(differences),
            min(samples), max(samples),
            min(differences), max(differences));
    }

    private static MeasurementStatistics keepBounds(MeasurementStatistics statistics, MeasurementAttribute attribute) {
        return new MeasurementStatistics(
            statistics.mean(), statistics.deviation(),
            statistics.differentiationMean(), statistics.differentiationDeviation(),
            attribute.getMin() != null ? attribute.getMin() : statistics.min(),
            attribute.getMax() != null ? attribute.getMax() : statistics.max(),
            statistics.differentiationMin(), statistics.differentiationMax());
    }

    static Double mean(List<Double> values) {
        if (values.isEmpty()) {
            return null;
        }
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    /**
     * Sample standard deviation.
     */
    static Double deviation(List<Double> values) {
        if (values.size() < 2) {
            return null;
        }
        double mean = mean(values);
        double squares = 0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return Math.sqrt(squares / (values.size() - 1));
    }

    private static Double min(List<Double> values) {
        return values.stream().min(Double::compare).orElse(null);
    }

    private static Double max(List<Double> values) {
        return values.stream().max(Double::compare).orElse(null);
    }

    private record MeasurementRef(String deviceType, String measurement) {
    }
}
