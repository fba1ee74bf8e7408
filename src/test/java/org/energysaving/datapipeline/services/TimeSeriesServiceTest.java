package org.energysaving.datapipeline.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.StringReader;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.energysaving.datapipeline.TestMetadataHelper;
import org.energysaving.datapipeline.api.exceptions.UnknownDatacenterException;
import org.energysaving.datapipeline.api.exceptions.UnknownMeasurementException;
import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.api.timeseries.SeriesTable;
import org.energysaving.datapipeline.api.timeseries.TimePrecision;
import org.energysaving.datapipeline.query.CompiledQuery;
import org.energysaving.datapipeline.query.QueryOptions;
import org.energysaving.datapipeline.resolver.Selection;
import org.energysaving.datapipeline.resources.database.H2MetadataDatabase;
import org.energysaving.datapipeline.resources.database.MetadataRepository;
import org.energysaving.datapipeline.resources.timeseries.InMemoryTimeSeriesStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Reads and writes through the service against an in-memory store and metadata database.
 */
@Tag("unit")
class TimeSeriesServiceTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final SeriesKey S1 = SeriesKey.of("sensor_attribute", "temperature", "s1");
    private static final SeriesKey S2 = SeriesKey.of("sensor_attribute", "temperature", "s2");
    private static final SeriesKey P1 = SeriesKey.of("power_supply_attribute", "power", "p1");

    private H2MetadataDatabase database;
    private InMemoryTimeSeriesStore store;
    private TimeSeriesService service;

    @BeforeEach
    void setUp() {
        database = new H2MetadataDatabase("test-metadata", TestMetadataHelper.inMemoryDatabaseConfig());
        MetadataService metadataService = new MetadataService(database, new MetadataRepository());
        metadataService.saveDatacenter(TestMetadataHelper.datacenter());
        store = new InMemoryTimeSeriesStore(Clock.fixed(T0.plusSeconds(600), ZoneOffset.UTC));
        service = new TimeSeriesService(metadataService, store);

        SeriesTable table = new SeriesTable()
            .put(S1, T0, 20.0)
            .put(S1, T0.plusSeconds(60), 22.0)
            .put(S2, T0, 18.0)
            .put(P1, T0, 1.5);
        assertThat(service.createTimeseries(TestMetadataHelper.DATACENTER, table, Map.of(), TimePrecision.SECONDS))
            .isTrue();
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void createTimeseries_shouldTagEveryPoint() {
        assertThat(store.points()).hasSize(4)
            .allSatisfy(point -> assertThat(point.tags()).containsEntry("datacenter", "dc1"));
        assertThat(store.points()).filteredOn(point -> point.measurement().equals("power"))
            .singleElement()
            .satisfies(point -> assertThat(point.tags())
                .containsEntry("device_type", "power_supply_attribute")
                .containsEntry("device", "p1"));
    }

    @Test
    void listMeasurementTimeseries_shouldReturnOneColumnPerDevice() {
        // When
        SeriesTable table = service.listMeasurementTimeseries("dc1", "sensor_attribute", "temperature", List.of(),
            QueryOptions.builder().starttime("2024-01-01T00:00:00Z").build());

        // Then
        assertThat(table.columns()).containsExactly(S1, S2);
        assertThat(table.numericColumn(S1)).containsExactly(
            Map.entry(T0, 20.0), Map.entry(T0.plusSeconds(60), 22.0));
        assertThat(table.numericColumn(S2)).containsExactly(Map.entry(T0, 18.0));
    }

    @Test
    void listTimeseries_shouldAggregateAndConvertUnits() {
        // Given
        QueryOptions options = QueryOptions.builder()
            .starttime("2024-01-01T00:00:00Z")
            .endtime("2024-01-01T00:02:00Z")
            .groupBy("time(2m)")
            .aggregation("mean")
            .unit("power", "W")
            .timePrecision(TimePrecision.SECONDS)
            .build();
        Selection selection = Selection.mapping(Map.of(
            "sensor_attribute", Selection.mapping(Map.of("temperature", Selection.names("s1"))),
            "power_supply_attribute", Selection.all()));

        // When
        SeriesTable table = service.listTimeseries("dc1", selection, options);

        // Then
        assertThat(table.getDouble(S1, T0)).isEqualTo(21.0);
        assertThat(table.hasColumn(S2)).isFalse();
        assertThat(table.getDouble(P1, T0)).isEqualTo(1500.0);
        assertThat(table.column(SeriesKey.of("power_supply_attribute", "power", "p2"))).isEmpty();
    }

    @Test
    void compileQueries_shouldNotTouchTheStore() {
        List<CompiledQuery> queries = service.compileQueries("dc1",
            Selection.mapping(Map.of("controller_parameter", Selection.all())), QueryOptions.defaults());

        assertThat(queries).singleElement()
            .satisfies(query -> assertThat(query.query()).isEqualTo("select value from setpoint"
                + " where datacenter = 'dc1' and device_type = 'controller_parameter' and (device = 'c1')"
                + " and measurement_kind = '' group by device"));
    }

    @Test
    void unknownNames_shouldBeRejected() {
        assertThatThrownBy(() -> service.listMeasurementTimeseries("dc2", "sensor_attribute", "temperature",
            List.of(), QueryOptions.defaults()))
            .isInstanceOf(UnknownDatacenterException.class);
        assertThatThrownBy(() -> service.listMeasurementTimeseries("dc1", "sensor_attribute", "pressure",
            List.of(), QueryOptions.defaults()))
            .isInstanceOf(UnknownMeasurementException.class);
    }

    @Test
    void deleteTimeseries_shouldDropOnlySelectedDevices() {
        // When
        service.deleteTimeseries("dc1", "sensor_attribute", "temperature", List.of("s1"));

        // Then
        assertThat(store.points()).extracting(point -> point.tags().get("device"))
            .containsExactlyInAnyOrder("s2", "p1");
    }

    @Test
    void exportCsv_shouldWriteSortedDeviceColumns() throws Exception {
        // Given
        StringWriter out = new StringWriter();

        // When
        service.exportCsv("dc1", "sensor_attribute", "temperature",
            QueryOptions.builder().timePrecision(TimePrecision.SECONDS).build(), out);

        // Then
        assertThat(out.toString()).isEqualTo("time,s1,s2\n1704067200,20.0,18.0\n1704067260,22.0,\n");
    }

    @Test
    void importCsv_shouldWriteCoercedValues() throws Exception {
        // When
        boolean written = service.importCsv("dc1", "sensor_attribute", "humidity",
            new StringReader("time,s1\n1704067200,55\n1704067260,56.5\n"), TimePrecision.SECONDS);

        // Then
        assertThat(written).isTrue();
        SeriesTable table = service.listMeasurementTimeseries("dc1", "sensor_attribute", "humidity", List.of(),
            QueryOptions.defaults());
        SeriesKey humidity = SeriesKey.of("sensor_attribute", "humidity", "s1");
        assertThat(table.numericColumn(humidity)).containsExactly(
            Map.entry(T0, 55.0), Map.entry(T0.plusSeconds(60), 56.5));
    }
}
