package org.energysaving.datapipeline.shaping;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

import org.energysaving.datapipeline.api.metadata.MeasurementType;
import org.energysaving.datapipeline.api.timeseries.QueryResult;
import org.energysaving.datapipeline.api.timeseries.RawSeries;
import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.api.timeseries.SeriesTable;
import org.energysaving.datapipeline.api.timeseries.TagNames;
import org.energysaving.datapipeline.api.timeseries.TimePrecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pivots a store response for one (device type, measurement) pair into a {@link SeriesTable}.
 * <p>
 * Every expected device gets a column, possibly empty. Per value the pipeline is: type
 * conversion, unit conversion, output formatting. Missing values stay missing.
 */
public class ResultShaper {

    private static final Logger log = LoggerFactory.getLogger(ResultShaper.class);

    private final UnitConverter unitConverter;
    private final boolean strict;

    /**
     * Creates a shaper that drops values it cannot convert.
     *
     * @param unitConverter Unit conversions to apply
     */
    public ResultShaper(UnitConverter unitConverter) {
        this(unitConverter, false);
    }

    /**
     * Creates a shaper.
     *
     * @param unitConverter Unit conversions to apply
     * @param strict        Whether unconvertible values fail the whole shape
     */
    public ResultShaper(UnitConverter unitConverter, boolean strict) {
        this.unitConverter = unitConverter;
        this.strict = strict;
    }

    /**
     * Shapes a response whose times are RFC3339 strings.
     *
     * @see #shape(QueryResult, String, String, Collection, MeasurementType, String, UnitConversion, Number, TimePrecision)
     */
    public SeriesTable shape(QueryResult raw, String deviceType, String measurement, Collection<String> devices,
                             MeasurementType type, String pattern, UnitConversion conversion, Number baseValue) {
        return shape(raw, deviceType, measurement, devices, type, pattern, conversion, baseValue, TimePrecision.NONE);
    }

    /**
     * Shapes a store response.
     * <p>
     * Series are matched by measurement name, or by full match of {@code pattern} when given.
     * Series of devices outside {@code devices} are dropped. When several series carry the same
     * device (alternate spellings), the first value per timestamp wins.
     *
     * @param raw         Store response
     * @param deviceType  Device-type wire name for the column keys
     * @param measurement Measurement name for the column keys
     * @param devices     Expected devices
     * @param type        Declared value type
     * @param pattern     Registered alternate-spelling regex, may be null
     * @param conversion  Unit change to apply, may be null
     * @param baseValue   Offset for numeric formatting, may be null
     * @param precision   Precision the response times are expressed in
     * @return Table with one column per expected device
     */
    public SeriesTable shape(QueryResult raw, String deviceType, String measurement, Collection<String> devices,
                             MeasurementType type, String pattern, UnitConversion conversion, Number baseValue,
                             TimePrecision precision) {
        SeriesTable table = new SeriesTable();
        Set<String> expected = new LinkedHashSet<>(devices);
        for (String device : expected) {
            table.addColumn(SeriesKey.of(deviceType, measurement, device));
        }
        if (conversion != null && conversion.isRequired() && !unitConverter.supports(conversion.from(), conversion.to())) {
            log.warn("No conversion from {} to {} for {}/{}, keeping stored values",
                conversion.from(), conversion.to(), deviceType, measurement);
            conversion = UnitConversion.none();
        }
        Pattern measurementPattern = pattern == null ? null : Pattern.compile(pattern);
        for (RawSeries series : raw.series()) {
            if (!matches(series.measurement(), measurement, measurementPattern)) {
                log.debug("Ignoring series of measurement {} while shaping {}", series.measurement(), measurement);
                continue;
            }
            String device = series.tag(TagNames.DEVICE);
            if (device == null || !expected.contains(device)) {
                log.debug("Dropping series of unexpected device {} for {}/{}", device, deviceType, measurement);
                continue;
            }
            SeriesKey key = SeriesKey.of(deviceType, measurement, device);
            for (RawSeries.Row row : series.rows()) {
                Instant time = TimestampConverter.toInstant(row.time(), precision);
                Object value = ValueConverter.convert(row.value(), type, strict);
                value = unitConverter.convert(value, conversion);
                value = ValueConverter.format(value, type, baseValue);
                table.putIfAbsent(key, time, value);
            }
        }
        log.debug("Shaped {}/{}: {}", deviceType, measurement, table);
        return table;
    }

    private static boolean matches(String actual, String measurement, Pattern pattern) {
        if (measurement.equals(actual)) {
            return true;
        }
        return pattern != null && actual != null && pattern.matcher(actual).find();
    }
}
