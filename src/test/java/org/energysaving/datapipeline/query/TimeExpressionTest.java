package org.energysaving.datapipeline.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class TimeExpressionTest {

    @Test
    void testRender_RelativeOffsetsAreAnchoredToNow() {
        assertThat(TimeExpression.render("-1h")).isEqualTo("now() - 1h");
        assertThat(TimeExpression.render("1h")).isEqualTo("now() + 1h");
        assertThat(TimeExpression.render("now() - 30m")).isEqualTo("now() - 30m");
        assertThat(TimeExpression.render("-1h+30m")).isEqualTo("now() - 1h + 30m");
        assertThat(TimeExpression.render("now()")).isEqualTo("now()");
    }

    @Test
    void testRender_TimestampsBecomeQuotedInstants() {
        assertThat(TimeExpression.render("2024-01-01T00:00:00Z")).isEqualTo("'2024-01-01T00:00:00Z'");
        assertThat(TimeExpression.render("2024-01-01T02:00:00+02:00")).isEqualTo("'2024-01-01T00:00:00Z'");
        assertThat(TimeExpression.render("2024-01-01 12:30:00")).isEqualTo("'2024-01-01T12:30:00Z'");
        assertThat(TimeExpression.render("2024-01-01")).isEqualTo("'2024-01-01T00:00:00Z'");
    }

    @Test
    void testRender_NullOrBlankRendersNothing() {
        assertThat(TimeExpression.render(null)).isNull();
        assertThat(TimeExpression.render("  ")).isNull();
    }

    @Test
    void testRender_RejectsUnparseableLiteral() {
        assertThatThrownBy(() -> TimeExpression.render("yesterday"))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("yesterday");
    }

    @Test
    void testEvaluate_AppliesOffsetsInOrder() {
        Instant now = Instant.parse("2024-03-01T12:00:00Z");

        assertThat(TimeExpression.evaluate("now() - 1h + 30m", now)).isEqualTo(Instant.parse("2024-03-01T11:30:00Z"));
        assertThat(TimeExpression.evaluate("now() - 1d", now)).isEqualTo(Instant.parse("2024-02-29T12:00:00Z"));
        assertThat(TimeExpression.evaluate("'2024-01-01T00:00:00Z'", now)).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void testEvaluate_RejectsGarbage() {
        assertThatThrownBy(() -> TimeExpression.evaluate("now() - 1x", Instant.EPOCH))
            .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> TimeExpression.evaluate("tomorrow", Instant.EPOCH))
            .isInstanceOf(InvalidParameterException.class);
    }
}
