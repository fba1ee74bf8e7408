package org.energysaving.datapipeline.api.timeseries;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class SeriesTableTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant T1 = T0.plusSeconds(60);
    private static final Instant T2 = T0.plusSeconds(120);

    private static final SeriesKey S1 = SeriesKey.of("sensor_attribute", "temperature", "s1");
    private static final SeriesKey S2 = SeriesKey.of("sensor_attribute", "temperature", "s2");
    private static final SeriesKey DOOR = SeriesKey.of("sensor_attribute", "door_open", "s1");

    private SeriesTable table;

    @BeforeEach
    void setUp() {
        table = SeriesTable.empty()
            .put(S1, T0, 20.0)
            .put(S1, T1, 21.0)
            .put(S2, T1, 19.0)
            .put(S2, T2, 18.0);
    }

    @Test
    void testIndex_IsUnionOfTimestamps() {
        assertThat(table.index()).containsExactly(T0, T1, T2);
        assertThat(table.rowCount()).isEqualTo(3);
        assertThat(table.columnCount()).isEqualTo(2);
        assertThat(table.completeIndex()).containsExactly(T1);
    }

    @Test
    void testPut_NullRemovesCell() {
        table.put(S1, T0, null);

        assertThat(table.get(S1, T0)).isNull();
        assertThat(table.index()).containsExactly(T1, T2);
    }

    @Test
    void testPutIfAbsent_KeepsExistingValue() {
        assertThat(table.putIfAbsent(S1, T0, 99.0)).isFalse();
        assertThat(table.putIfAbsent(S1, T2, 22.0)).isTrue();
        assertThat(table.putIfAbsent(S1, T2.plusSeconds(60), null)).isFalse();

        assertThat(table.get(S1, T0)).isEqualTo(20.0);
        assertThat(table.get(S1, T2)).isEqualTo(22.0);
    }

    @Test
    void testDropMissing_KeepsOnlyCompleteRows() {
        SeriesTable complete = table.dropMissing();

        assertThat(complete.columns()).containsExactly(S1, S2);
        assertThat(complete.index()).containsExactly(T1);
        assertThat(complete.get(S2, T1)).isEqualTo(19.0);
    }

    @Test
    void testSelect_MissingColumnsAppearEmpty() {
        SeriesTable selected = table.select(List.of(S2, DOOR));

        assertThat(selected.columns()).containsExactly(S2, DOOR);
        assertThat(selected.column(DOOR)).isEmpty();
        assertThat(selected.column(S2)).containsOnlyKeys(T1, T2);
    }

    @Test
    void testMergeFrom_ExistingCellsWin() {
        SeriesTable other = SeriesTable.empty().put(S1, T0, 99.0).put(S1, T2, 22.0).put(DOOR, T0, true);

        table.mergeFrom(other);

        assertThat(table.columns()).containsExactly(S1, S2, DOOR);
        assertThat(table.get(S1, T0)).isEqualTo(20.0);
        assertThat(table.get(S1, T2)).isEqualTo(22.0);
        assertThat(table.getDouble(DOOR, T0)).isEqualTo(1.0);
    }

    @Test
    void testRestrictTo_KeepsColumnsAndDropsOtherTimes() {
        SeriesTable restricted = table.restrictTo(Set.of(T0));

        assertThat(restricted.columns()).containsExactly(S1, S2);
        assertThat(restricted.get(S1, T0)).isEqualTo(20.0);
        assertThat(restricted.column(S1)).containsOnlyKeys(T0);
        assertThat(restricted.column(S2)).isEmpty();
    }

    @Test
    void testNumericColumn_RejectsText() {
        table.put(DOOR, T0, "open");

        assertThat(table.numericColumn(S1)).containsEntry(T0, 20.0).containsEntry(T1, 21.0);
        assertThatThrownBy(() -> table.numericColumn(DOOR))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("open");
    }

    @Test
    void testIsEmpty_WithEmptyColumns() {
        SeriesTable empty = SeriesTable.empty().addColumn(S1);

        assertThat(empty.isEmpty()).isTrue();
        assertThat(empty.columns()).containsExactly(S1);
        assertThat(empty.completeIndex()).isEmpty();
    }
}
