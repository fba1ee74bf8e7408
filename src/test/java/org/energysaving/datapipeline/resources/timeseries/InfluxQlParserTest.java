package org.energysaving.datapipeline.resources.timeseries;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;
import org.energysaving.datapipeline.resources.timeseries.InfluxQlParser.Condition;
import org.energysaving.datapipeline.resources.timeseries.InfluxQlParser.ParsedStatement;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class InfluxQlParserTest {

    @Test
    void testParse_CompiledSelect() {
        // Given
        String query = "select mean(value) as value from temperature"
            + " where time >= now() - 1h and datacenter = 'dc1' and (device = 's1' or device = 's2')"
            + " group by time(60s), device order by time desc fill(previous) limit 10 offset 5";

        // When
        ParsedStatement statement = InfluxQlParser.parse(query);

        // Then
        assertThat(statement.drop()).isFalse();
        assertThat(statement.measurement()).isEqualTo("temperature");
        assertThat(statement.measurementRegex()).isNull();
        assertThat(statement.aggregation()).isEqualTo("mean");
        assertThat(statement.conditions()).containsExactly(
            new Condition("time", ">=", List.of("now() - 1h")),
            new Condition("datacenter", "=", List.of("dc1")),
            new Condition("device", "=", List.of("s1", "s2")));
        assertThat(statement.groupByTags()).containsExactly("device");
        assertThat(statement.groupInterval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(statement.descending()).isTrue();
        assertThat(statement.fill()).isEqualTo("previous");
        assertThat(statement.limit()).isEqualTo(10);
        assertThat(statement.offset()).isEqualTo(5);
    }

    @Test
    void testParse_RawSelectWithRegex() {
        ParsedStatement statement = InfluxQlParser.parse("select value from /inlet_.*/ group by device");

        assertThat(statement.measurement()).isNull();
        assertThat(statement.measurementRegex().pattern()).isEqualTo("inlet_.*");
        assertThat(statement.aggregation()).isNull();
        assertThat(statement.conditions()).isEmpty();
        assertThat(statement.groupInterval()).isNull();
    }

    @Test
    void testParse_DropSeries() {
        ParsedStatement statement = InfluxQlParser.parse(
            "drop series from temperature where datacenter = 'dc1' and (device = 's1')");

        assertThat(statement.drop()).isTrue();
        assertThat(statement.measurement()).isEqualTo("temperature");
        assertThat(statement.conditions()).extracting(Condition::key).containsExactly("datacenter", "device");
    }

    @Test
    void testParse_RejectsUnsupportedStatements() {
        assertThatThrownBy(() -> InfluxQlParser.parse("show measurements"))
            .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> InfluxQlParser.parse("select value * 2 from temperature"))
            .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> InfluxQlParser.parse("select value from temperature where (device = 's1' or rack = 'r1')"))
            .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void testSplitTopLevel_IgnoresQuotedAndNestedSeparators() {
        assertThat(InfluxQlParser.splitTopLevel("a = 'x and y' and (b = '1' and c = '2') and d = '3'", " and "))
            .containsExactly("a = 'x and y'", "(b = '1' and c = '2')", "d = '3'");
    }
}
