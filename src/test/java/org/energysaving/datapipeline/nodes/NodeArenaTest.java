package org.energysaving.datapipeline.nodes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.energysaving.datapipeline.TestMetadataHelper;
import org.energysaving.datapipeline.api.metadata.DeviceTypeMapping;
import org.energysaving.datapipeline.api.metadata.MeasurementType;
import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class NodeArenaTest {

    private static final NodeStatistics CELSIUS =
        new NodeStatistics("celsius", MeasurementType.CONTINUOUS, 20.0, 2.0, null, null);

    private static final SeriesKey S1 = SeriesKey.of("sensor_attribute", "temperature", "s1");
    private static final SeriesKey S2 = SeriesKey.of("sensor_attribute", "temperature", "s2");

    @Test
    void testRegister_FirstRegistrationWins() {
        NodeArena arena = new NodeArena();
        SimpleNode first = new SimpleNode(S1, CELSIUS);

        arena.register(first);
        Node second = arena.register(new SimpleNode(S1, CELSIUS.withMeanAndDeviation(0.0, 1.0)));

        assertThat(second).isSameAs(first);
        assertThat(arena.size()).isEqualTo(1);
    }

    @Test
    void testRegister_ReferencesMustExist() {
        NodeArena arena = new NodeArena();
        SeriesKey total = SeriesKey.of("sensor_attribute", "temperature", "total");

        assertThatThrownBy(() -> arena.register(new CompositeNode(total, CELSIUS, List.of(S1, S2), null)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unregistered");
        assertThat(arena.contains(total)).isFalse();
    }

    @Test
    void testRegisterAll_CreatesSimpleNodesFromMetadata() {
        // Given
        NodeArena arena = new NodeArena();
        DeviceTypeMapping mapping = new DeviceTypeMapping()
            .addAll("sensor_attribute", "temperature", List.of("s1", "s2"))
            .add("sensor_attribute", "door_open", "s1");

        // When
        List<SeriesKey> keys = arena.registerAll(mapping, TestMetadataHelper.datacenter());

        // Then
        assertThat(keys).containsExactly(S1, S2, SeriesKey.of("sensor_attribute", "door_open", "s1"));
        assertThat(arena.get(S1).getStatistics()).isEqualTo(CELSIUS);
        assertThat(arena.get(keys.get(2)).getStatistics().type()).isEqualTo(MeasurementType.BINARY);
        assertThat(arena.find(SeriesKey.of("sensor_attribute", "humidity", "s1"))).isEmpty();
    }

    @Test
    void testNodeConstructors_RejectSelfReference() {
        assertThatThrownBy(() -> new DerivedNode(S1, CELSIUS, S1, "shift", "unshift"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CompositeNode(S1, CELSIUS, List.of(S1), null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CompositeNode(S1, CELSIUS, List.of(), null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testNodeDefaults() {
        SeriesKey total = SeriesKey.of("sensor_attribute", "temperature", "total");
        CompositeNode composite = new CompositeNode(total, CELSIUS, List.of(S1, S2, S1), null);
        DerivedNode derived = new DerivedNode(S1.withDevice("shifted_s1"), CELSIUS, S1, null, null);

        assertThat(composite.getChildren()).containsExactly(S1, S2);
        assertThat(composite.getAggregator()).isEqualTo(CompositeNode.DEFAULT_AGGREGATOR);
        assertThat(derived.getTransformer()).isEqualTo(DerivedNode.IDENTITY);
        assertThat(derived.references()).containsExactly(S1);
    }
}
