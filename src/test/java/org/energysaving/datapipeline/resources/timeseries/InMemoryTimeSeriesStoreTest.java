package org.energysaving.datapipeline.resources.timeseries;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.groups.Tuple.tuple;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;
import org.energysaving.datapipeline.api.timeseries.Point;
import org.energysaving.datapipeline.api.timeseries.QueryResult;
import org.energysaving.datapipeline.api.timeseries.RawSeries;
import org.energysaving.datapipeline.api.timeseries.TimePrecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class InMemoryTimeSeriesStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private InMemoryTimeSeriesStore store;

    private static Point point(String measurement, String device, int minute, Object value) {
        return new Point(measurement, T0.plusSeconds(60L * minute),
            Map.of("datacenter", "dc1", "device_type", "sensor_attribute", "device", device), value);
    }

    private static List<Object> values(RawSeries series) {
        List<Object> values = new ArrayList<>();
        series.rows().forEach(row -> values.add(row.value()));
        return values;
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryTimeSeriesStore(Clock.fixed(T0.plusSeconds(600), ZoneOffset.UTC));
        store.writePoints(List.of(
            point("temperature", "s1", 0, 20.0),
            point("temperature", "s1", 1, 22.0),
            point("temperature", "s1", 3, 24.0),
            point("temperature", "s2", 0, 18.0),
            point("humidity", "s1", 0, 40.0)), TimePrecision.NONE);
    }

    @Test
    void testQuery_RawRowsGroupedByDevice() {
        QueryResult result = store.query("select value from temperature where datacenter = 'dc1' group by device",
            TimePrecision.NONE);

        assertThat(result.series()).hasSize(2);
        RawSeries s1 = result.series().get(0);
        assertThat(s1.measurement()).isEqualTo("temperature");
        assertThat(s1.tag("device")).isEqualTo("s1");
        assertThat(s1.rows().get(0).time()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(values(s1)).containsExactly(20.0, 22.0, 24.0);
        assertThat(values(result.series().get(1))).containsExactly(18.0);
    }

    @Test
    void testQuery_EpochAlignedBucketsWithNullFill() {
        // When
        QueryResult result = store.query("select mean(value) as value from temperature"
            + " where time >= '2024-01-01T00:00:00Z' and time < '2024-01-01T00:08:00Z' and (device = 's1')"
            + " group by time(2m), device", TimePrecision.SECONDS);

        // Then
        RawSeries series = result.series().get(0);
        assertThat(series.rows()).extracting(RawSeries.Row::time)
            .containsExactly(1704067200L, 1704067320L, 1704067440L, 1704067560L);
        assertThat(values(series)).containsExactly(21.0, 24.0, null, null);
    }

    @Test
    void testQuery_FillPolicies() {
        String base = "select max(value) as value from temperature where time >= '2024-01-01T00:00:00Z'"
            + " and time < '2024-01-01T00:04:00Z' and (device = 's1') group by time(1m), device";

        assertThat(values(store.query(base + " fill(previous)", TimePrecision.NONE).series().get(0)))
            .containsExactly(20.0, 22.0, 22.0, 24.0);
        assertThat(values(store.query(base + " fill(0)", TimePrecision.NONE).series().get(0)))
            .containsExactly(20.0, 22.0, 0.0, 24.0);
        assertThat(values(store.query(base + " fill(none)", TimePrecision.NONE).series().get(0)))
            .containsExactly(20.0, 22.0, 24.0);
    }

    @Test
    void testQuery_RelativeBoundsOrderAndPaging() {
        QueryResult result = store.query("select value from temperature where time >= now() - 9m"
            + " and (device = 's1') group by device order by time desc limit 1 offset 1", TimePrecision.NONE);

        assertThat(values(result.series().get(0))).containsExactly(22.0);
    }

    @Test
    void testQuery_RegexMeasurementAndCount() {
        QueryResult result = store.query("select count(value) as value from /temp/ group by device",
            TimePrecision.NONE);

        assertThat(result.series()).hasSize(2);
        assertThat(values(result.series().get(0))).containsExactly(3L);
    }

    @Test
    void testWritePoints_TruncatesAndReplaces() {
        store.writePoints(List.of(new Point("temperature", T0.plusMillis(1500),
            Map.of("datacenter", "dc1", "device_type", "sensor_attribute", "device", "s2"), 19.0)),
            TimePrecision.SECONDS);
        store.writePoints(List.of(point("temperature", "s2", 0, 17.0)), TimePrecision.SECONDS);

        assertThat(store.points()).filteredOn(p -> "s2".equals(p.tags().get("device")))
            .extracting(Point::time, Point::value)
            .containsExactlyInAnyOrder(
                tuple(T0, 17.0),
                tuple(T0.plusSeconds(1), 19.0));
    }

    @Test
    void testExecute_DropSeries() {
        store.execute("drop series from temperature where datacenter = 'dc1' and (device = 's1')");

        assertThat(store.points()).extracting(p -> p.measurement() + "/" + p.tags().get("device"))
            .containsExactlyInAnyOrder("temperature/s2", "humidity/s1");
        assertThatThrownBy(() -> store.execute("select value from temperature"))
            .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> store.query("drop series from temperature", TimePrecision.NONE))
            .isInstanceOf(InvalidParameterException.class);
    }
}
