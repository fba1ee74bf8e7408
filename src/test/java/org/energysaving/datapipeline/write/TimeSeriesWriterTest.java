package org.energysaving.datapipeline.write;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.energysaving.datapipeline.TestMetadataHelper;
import org.energysaving.datapipeline.api.metadata.DatacenterMetadata;
import org.energysaving.datapipeline.api.timeseries.ITimeSeriesStore;
import org.energysaving.datapipeline.api.timeseries.Point;
import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.api.timeseries.SeriesTable;
import org.energysaving.datapipeline.api.timeseries.TimePrecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for {@link TimeSeriesWriter}.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class TimeSeriesWriterTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant T1 = T0.plusSeconds(60);

    private static final SeriesKey S1 = SeriesKey.of("sensor_attribute", "temperature", "s1");
    private static final SeriesKey DOOR = SeriesKey.of("sensor_attribute", "door_open", "s1");
    private static final SeriesKey UNKNOWN = SeriesKey.of("sensor_attribute", "pressure", "s1");

    @Mock
    private ITimeSeriesStore store;

    @Captor
    private ArgumentCaptor<List<Point>> points;

    private TimeSeriesWriter writer;
    private DatacenterMetadata metadata;

    @BeforeEach
    void setUp() {
        writer = new TimeSeriesWriter(store);
        metadata = TestMetadataHelper.datacenter();
    }

    @Test
    void write_shouldTagAndConvertEveryPoint() {
        // Given
        SeriesTable table = SeriesTable.empty()
            .put(S1, T0, 21L)
            .put(S1, T1, "not a number");
        when(store.writePoints(anyList(), eq(TimePrecision.SECONDS))).thenReturn(true);

        // When
        boolean status = writer.write(metadata, table, Map.of("prediction", "run1"), TimePrecision.SECONDS);

        // Then
        assertThat(status).isTrue();
        verify(store).writePoints(points.capture(), eq(TimePrecision.SECONDS));
        assertThat(points.getValue()).hasSize(1);
        Point point = points.getValue().get(0);
        assertThat(point.measurement()).isEqualTo("temperature");
        assertThat(point.time()).isEqualTo(T0);
        assertThat(point.value()).isEqualTo(21.0);
        assertThat(point.tags()).containsEntry("datacenter", "dc1")
            .containsEntry("device_type", "sensor_attribute")
            .containsEntry("device", "s1")
            .containsEntry("prediction", "run1");
    }

    @Test
    void write_shouldReturnFalseIfAnyBatchIsRejected() {
        // Given
        SeriesTable table = SeriesTable.empty()
            .put(S1, T0, 21.0)
            .put(DOOR, T0, 1.0);
        when(store.writePoints(anyList(), any())).thenReturn(false, true);

        // When
        boolean status = writer.write(metadata, table, null, TimePrecision.NONE);

        // Then
        assertThat(status).isFalse();
        verify(store, times(2)).writePoints(points.capture(), eq(TimePrecision.NONE));
        assertThat(points.getAllValues().get(1).get(0).value()).isEqualTo(Boolean.TRUE);
    }

    @Test
    void write_shouldWriteUnknownMeasurementsUnconverted() {
        SeriesTable table = SeriesTable.empty().put(UNKNOWN, T0, "1013");
        when(store.writePoints(anyList(), any())).thenReturn(true);

        boolean status = writer.write(metadata, table, Map.of(), TimePrecision.SECONDS);

        assertThat(status).isTrue();
        verify(store).writePoints(points.capture(), any());
        assertThat(points.getValue().get(0).value()).isEqualTo("1013");
    }

    @Test
    void write_shouldSkipEmptyColumns() {
        SeriesTable table = SeriesTable.empty().addColumn(S1);

        boolean status = writer.write(metadata, table, Map.of(), TimePrecision.SECONDS);

        assertThat(status).isTrue();
        verify(store, never()).writePoints(anyList(), any());
    }
}
