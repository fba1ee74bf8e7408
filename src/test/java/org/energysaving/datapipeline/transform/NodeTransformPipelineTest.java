package org.energysaving.datapipeline.transform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.energysaving.datapipeline.api.metadata.MeasurementType;
import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.api.timeseries.SeriesTable;
import org.energysaving.datapipeline.nodes.CompositeNode;
import org.energysaving.datapipeline.nodes.DerivedNode;
import org.energysaving.datapipeline.nodes.NodeArena;
import org.energysaving.datapipeline.nodes.NodeSet;
import org.energysaving.datapipeline.nodes.NodeStatistics;
import org.energysaving.datapipeline.nodes.SimpleNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class NodeTransformPipelineTest {

    private static final Duration INTERVAL = Duration.ofSeconds(60);
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant T1 = T0.plus(INTERVAL);
    private static final Instant T2 = T1.plus(INTERVAL);

    private static final SeriesKey S1 = SeriesKey.of("sensor_attribute", "temperature", "s1");
    private static final SeriesKey S2 = SeriesKey.of("sensor_attribute", "temperature", "s2");
    private static final SeriesKey SHIFTED_S2 = S2.withDevice("shifted_s2");
    private static final SeriesKey DOOR = SeriesKey.of("sensor_attribute", "door_open", "s1");
    private static final SeriesKey C1 = SeriesKey.of("controller_attribute", "fan_speed", "c1");
    private static final SeriesKey SHIFTED_C1 = C1.withDevice("shifted_c1");
    private static final SeriesKey P1 = SeriesKey.of("power_supply_attribute", "power", "p1");
    private static final SeriesKey P2 = SeriesKey.of("power_supply_attribute", "power", "p2");
    private static final SeriesKey TOTAL = P1.withDevice("total_power");

    private static final NodeStatistics CELSIUS =
        new NodeStatistics("celsius", MeasurementType.CONTINUOUS, 20.0, 2.0, null, null);
    private static final NodeStatistics RPM =
        new NodeStatistics("rpm", MeasurementType.CONTINUOUS, 1000.0, 100.0, null, null);
    private static final NodeStatistics KW =
        new NodeStatistics("kW", MeasurementType.CONTINUOUS, 10.0, 1.0, null, null);

    private NodeArena arena;

    @BeforeEach
    void setUp() {
        arena = new NodeArena();
        arena.register(new SimpleNode(S1, CELSIUS));
        arena.register(new SimpleNode(S2, CELSIUS));
        arena.register(new DerivedNode(SHIFTED_S2, CELSIUS, S2, TransformerRegistry.SHIFT, TransformerRegistry.UNSHIFT));
        arena.register(new SimpleNode(DOOR, new NodeStatistics(null, MeasurementType.BINARY, null, null, null, null)));
        arena.register(new SimpleNode(C1, RPM));
        arena.register(new DerivedNode(SHIFTED_C1, RPM, C1, TransformerRegistry.SHIFT, TransformerRegistry.DEFAULT));
        arena.register(new SimpleNode(P1, KW));
        arena.register(new SimpleNode(P2, KW));
        arena.register(new CompositeNode(TOTAL, KW.withMeanAndDeviation(20.0, 2.0), List.of(P1, P2), "sum"));
    }

    private NodeTransformPipeline pipeline(List<SeriesKey> inputs, List<SeriesKey> outputs) {
        return new NodeTransformPipeline(new NodeSet(arena, inputs, outputs), INTERVAL, new TransformerRegistry());
    }

    @Test
    @DisplayName("Forward pipeline merges, transforms, normalizes and aligns both sides")
    void testForward_BothSides() {
        // Given
        NodeTransformPipeline pipeline = pipeline(List.of(S1, SHIFTED_C1), List.of(TOTAL));
        SeriesTable rawInput = SeriesTable.empty()
            .put(S1, T0, 21.0).put(S1, T1, 22.0).put(S1, T2, 23.0)
            .put(C1, T0, 1000.0).put(C1, T1, 1100.0).put(C1, T2, 1200.0)
            .put(DOOR, T0, true);
        SeriesTable rawOutput = SeriesTable.empty()
            .put(P1, T0, 10.0).put(P1, T1, 11.0).put(P1, T2, 12.0)
            .put(P2, T0, 10.0).put(P2, T1, 10.0);

        // When
        PipelineTables tables = pipeline.forward(rawInput, rawOutput);

        // Then
        SeriesTable input = tables.input();
        SeriesTable output = tables.output();
        assertThat(input.columns()).containsExactly(S1, SHIFTED_C1);
        assertThat(input.index()).containsExactly(T0, T1);
        assertThat(input.get(S1, T0)).isEqualTo(0.5);
        assertThat(input.get(S1, T1)).isEqualTo(1.0);
        assertThat(input.get(SHIFTED_C1, T0)).isEqualTo(1.0);
        assertThat(input.get(SHIFTED_C1, T1)).isEqualTo(2.0);
        assertThat(output.columns()).containsExactly(TOTAL);
        assertThat(output.get(TOTAL, T0)).isEqualTo(0.0);
        assertThat(output.get(TOTAL, T1)).isEqualTo(0.5);
    }

    @Test
    void testForward_InputOnly() {
        NodeTransformPipeline pipeline = pipeline(List.of(S1), List.of(TOTAL));
        SeriesTable rawInput = SeriesTable.empty().put(S1, T0, 21.0);

        PipelineTables tables = pipeline.forward(rawInput, null);

        assertThat(tables.output()).isNull();
        assertThat(tables.input().get(S1, T0)).isEqualTo(0.5);
    }

    @Test
    void testMerge_EmptyCompositeContributesNoColumn() {
        NodeTransformPipeline pipeline = pipeline(List.of(S1), List.of(TOTAL));
        SeriesTable raw = SeriesTable.empty().put(P1, T0, 10.0);

        SeriesTable merged = pipeline.merge(pipeline.filter(raw, List.of(TOTAL)), List.of(TOTAL));

        assertThat(merged.columns()).isEmpty();
    }

    @Test
    void testFilter_ProjectsToFetchKeys() {
        NodeTransformPipeline pipeline = pipeline(List.of(SHIFTED_C1), List.of(TOTAL));
        SeriesTable raw = SeriesTable.empty().put(C1, T0, 1.0).put(S1, T0, 2.0);

        SeriesTable filtered = pipeline.filter(raw, List.of(SHIFTED_C1, TOTAL));

        assertThat(filtered.columns()).containsExactly(C1, P1, P2);
        assertThat(filtered.column(P1)).isEmpty();
    }

    @Test
    void testNormalize_RequiresStatistics() {
        NodeTransformPipeline pipeline = pipeline(List.of(DOOR), List.of());
        SeriesTable raw = SeriesTable.empty().put(DOOR, T0, true);

        assertThatThrownBy(() -> pipeline.forward(raw, null))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("door_open");
    }

    @Test
    void testDenormalize_UsesDeviationGuard() {
        NodeTransformPipeline pipeline = pipeline(List.of(S1), List.of(S1));
        SeriesTable normalized = SeriesTable.empty().put(S1, T0, 0.5);

        SeriesTable result = pipeline.denormalize(normalized, List.of(S1));

        assertThat(result.getDouble(S1, T0)).isCloseTo(21.05, within(1e-9));
    }

    @Test
    @DisplayName("Inverse pipeline re-keys derived outputs to their original node")
    void testInverse_DetransformsDerivedOutputs() {
        // Given
        NodeTransformPipeline pipeline = pipeline(List.of(S1), List.of(SHIFTED_S2, TOTAL));
        SeriesTable predictions = SeriesTable.empty()
            .put(SHIFTED_S2, T0, 1.0)
            .put(SHIFTED_S2, T1, 0.0)
            .put(TOTAL, T1, 0.0)
            .put(TOTAL, T2, 1.0);

        // When
        SeriesTable result = pipeline.inverse(predictions);

        // Then
        assertThat(result.columns()).containsExactly(S2, TOTAL);
        assertThat(result.index()).containsExactly(T1, T2);
        assertThat(result.getDouble(S2, T1)).isCloseTo(22.1, within(1e-9));
        assertThat(result.getDouble(S2, T2)).isCloseTo(20.0, within(1e-9));
        assertThat(result.getDouble(TOTAL, T2)).isCloseTo(22.1, within(1e-9));
    }

    @Test
    void testClean_SingleSide() {
        NodeTransformPipeline pipeline = pipeline(List.of(S1, S2), List.of());
        SeriesTable input = SeriesTable.empty().put(S1, T0, 1.0).put(S1, T1, 1.0).put(S2, T1, 2.0);

        PipelineTables cleaned = pipeline.clean(input, null);

        assertThat(cleaned.input().index()).containsExactly(T1);
        assertThat(cleaned.output()).isNull();
    }
}
