package org.energysaving.datapipeline.services;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.energysaving.datapipeline.api.metadata.DatacenterMetadata;
import org.energysaving.datapipeline.api.metadata.DeviceTypeMapping;
import org.energysaving.datapipeline.api.metadata.MeasurementAttribute;
import org.energysaving.datapipeline.api.timeseries.ITimeSeriesStore;
import org.energysaving.datapipeline.api.timeseries.QueryResult;
import org.energysaving.datapipeline.api.timeseries.SeriesTable;
import org.energysaving.datapipeline.api.timeseries.TagNames;
import org.energysaving.datapipeline.api.timeseries.TimePrecision;
import org.energysaving.datapipeline.query.CompiledQuery;
import org.energysaving.datapipeline.query.QueryCompiler;
import org.energysaving.datapipeline.query.QueryOptions;
import org.energysaving.datapipeline.resolver.MetadataResolver;
import org.energysaving.datapipeline.resolver.Selection;
import org.energysaving.datapipeline.shaping.ResultShaper;
import org.energysaving.datapipeline.shaping.UnitConversion;
import org.energysaving.datapipeline.shaping.UnitConverter;
import org.energysaving.datapipeline.utils.SeriesCsv;
import org.energysaving.datapipeline.write.TimeSeriesWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read and write façade over metadata resolution, query compilation, the time-series store,
 * result shaping and the write path.
 * <p>
 * Metadata is re-read at the start of every datacenter-level call.
 */
public class TimeSeriesService {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesService.class);

    private final MetadataService metadataService;
    private final ITimeSeriesStore store;
    private final MetadataResolver resolver;
    private final QueryCompiler compiler;
    private final ResultShaper shaper;
    private final TimeSeriesWriter writer;

    public TimeSeriesService(MetadataService metadataService, ITimeSeriesStore store) {
        this(metadataService, store, new MetadataResolver(), new QueryCompiler(),
            new ResultShaper(new UnitConverter()), new TimeSeriesWriter(store));
    }

    public TimeSeriesService(MetadataService metadataService, ITimeSeriesStore store, MetadataResolver resolver,
                             QueryCompiler compiler, ResultShaper shaper, TimeSeriesWriter writer) {
        this.metadataService = metadataService;
        this.store = store;
        this.resolver = resolver;
        this.compiler = compiler;
        this.shaper = shaper;
        this.writer = writer;
    }

    /**
     * Compiles the queries a read would execute, without executing them.
     *
     * @param datacenter Datacenter name
     * @param selection  Device-type level selection
     * @param options    Query options
     * @return One query per resolved (device type, measurement)
     */
    public List<CompiledQuery> compileQueries(String datacenter, Selection selection, QueryOptions options) {
        DatacenterMetadata metadata = metadataService.getMetadata(datacenter);
        DeviceTypeMapping mapping = resolver.resolve(selection, metadata, true);
        return compiler.compileMapping(datacenter, mapping, metadata, options);
    }

    /**
     * Reads every series a selection resolves to.
     *
     * @param datacenter Datacenter name
     * @param selection  Device-type level selection, resolved strictly
     * @param options    Query options
     * @return One column per resolved (device type, measurement, device)
     */
    public SeriesTable listTimeseries(String datacenter, Selection selection, QueryOptions options) {
        DatacenterMetadata metadata = metadataService.getMetadata(datacenter);
        DeviceTypeMapping mapping = resolver.resolve(selection, metadata, true);
        return listTimeseries(metadata, mapping, options);
    }

    /**
     * Reads the series of an already resolved mapping.
     *
     * @param metadata Snapshot the mapping was resolved against
     * @param mapping  Resolved mapping
     * @param options  Query options
     * @return Merged table
     */
    public SeriesTable listTimeseries(DatacenterMetadata metadata, DeviceTypeMapping mapping, QueryOptions options) {
        SeriesTable result = new SeriesTable();
        TimePrecision precision = options.getTimePrecision();
        for (CompiledQuery query : compiler.compileMapping(metadata.getName(), mapping, metadata, options)) {
            MeasurementAttribute attribute = metadata.getMeasurement(query.deviceType(), query.measurement())
                .orElseThrow()
                .getAttribute();
            QueryResult raw = store.query(query.query(), precision);
            String requestedUnit = options.getUnit(query.measurement());
            UnitConversion conversion = requestedUnit == null
                ? UnitConversion.none()
                : new UnitConversion(attribute.getUnit(), requestedUnit);
            result.mergeFrom(shaper.shape(raw, query.deviceType(), query.measurement(), query.devices(),
                attribute.getType(), attribute.getPattern(), conversion, options.getBaseValue(), precision));
        }
        log.debug("Read {} from datacenter {}", result, metadata.getName());
        return result;
    }

    /**
     * Reads one measurement.
     *
     * @param datacenter  Datacenter name
     * @param deviceType  Device-type wire name
     * @param measurement Measurement name
     * @param devices     Devices to read, empty for all
     * @param options     Query options
     * @return One column per device
     */
    public SeriesTable listMeasurementTimeseries(String datacenter, String deviceType, String measurement,
                                                 List<String> devices, QueryOptions options) {
        Selection selection = Selection.mapping(Map.of(deviceType,
            Selection.mapping(Map.of(measurement, Selection.names(devices)))));
        return listTimeseries(datacenter, selection, options);
    }

    /**
     * Writes a table into the store.
     *
     * @param datacenter Datacenter name
     * @param table      Values to write
     * @param tags       Extra tags for every point
     * @param precision  Write precision
     * @return true if every batch was accepted
     */
    public boolean createTimeseries(String datacenter, SeriesTable table, Map<String, String> tags,
                                    TimePrecision precision) {
        return createTimeseries(metadataService.getMetadata(datacenter), table, tags, precision);
    }

    public boolean createTimeseries(DatacenterMetadata metadata, SeriesTable table, Map<String, String> tags,
                                    TimePrecision precision) {
        return writer.write(metadata, table, tags, precision);
    }

    /**
     * Deletes the series of a measurement that match the given tags.
     *
     * @param measurement Measurement name
     * @param tags        Tag predicates, scalar or list valued
     */
    public void deleteTimeseries(String measurement, Map<String, Object> tags) {
        store.execute(compiler.compileDropSeries(measurement, tags));
        log.info("Deleted series of {} matching {}", measurement, tags);
    }

    /**
     * Deletes the series of one measurement within a datacenter.
     *
     * @param datacenter  Datacenter name
     * @param deviceType  Device-type wire name
     * @param measurement Measurement name
     * @param devices     Devices to delete, empty for all
     */
    public void deleteTimeseries(String datacenter, String deviceType, String measurement, List<String> devices) {
        Map<String, Object> tags = new LinkedHashMap<>();
        tags.put(TagNames.DATACENTER, datacenter);
        tags.put(TagNames.DEVICE_TYPE, deviceType);
        if (devices != null && !devices.isEmpty()) {
            tags.put(TagNames.DEVICE, devices);
        }
        deleteTimeseries(measurement, tags);
    }

    /**
     * Exports one measurement as CSV.
     *
     * @param datacenter  Datacenter name
     * @param deviceType  Device-type wire name
     * @param measurement Measurement name
     * @param options     Query options; the time precision also formats the time column
     * @param out         Target
     * @throws IOException if writing fails
     */
    public void exportCsv(String datacenter, String deviceType, String measurement, QueryOptions options,
                          Writer out) throws IOException {
        SeriesTable table = listMeasurementTimeseries(datacenter, deviceType, measurement, List.of(), options);
        SeriesCsv.write(table, deviceType, measurement, options.getTimePrecision(), out);
    }

    /**
     * Imports one measurement from CSV.
     * <p>
     * Values are written unconverted when the measurement is unknown, and coerced to the
     * declared type otherwise.
     *
     * @param datacenter  Datacenter name
     * @param deviceType  Device-type wire name
     * @param measurement Measurement name
     * @param in          CSV document
     * @param precision   Format of the time column and write precision
     * @return true if every batch was accepted
     * @throws IOException if reading fails
     */
    public boolean importCsv(String datacenter, String deviceType, String measurement, Reader in,
                             TimePrecision precision) throws IOException {
        SeriesTable table = SeriesCsv.read(in, deviceType, measurement, precision);
        log.info("Importing {} into {}/{}/{}", table, datacenter, deviceType, measurement);
        return createTimeseries(datacenter, table, Map.of(), precision);
    }

    public MetadataService getMetadataService() {
        return metadataService;
    }
}
