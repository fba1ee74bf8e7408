package org.energysaving.datapipeline.shaping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;
import org.energysaving.datapipeline.api.metadata.MeasurementType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ValueConverterTest {

    @Test
    void testConvert_ToDeclaredJavaType() {
        assertThat(ValueConverter.convert("21.5", MeasurementType.CONTINUOUS, true)).isEqualTo(21.5);
        assertThat(ValueConverter.convert(3, MeasurementType.CONTINUOUS, true)).isEqualTo(3.0);
        assertThat(ValueConverter.convert(7.9, MeasurementType.INTEGER, true)).isEqualTo(7L);
        assertThat(ValueConverter.convert("12", MeasurementType.INTEGER, true)).isEqualTo(12L);
        assertThat(ValueConverter.convert("true", MeasurementType.BINARY, true)).isEqualTo(Boolean.TRUE);
        assertThat(ValueConverter.convert(0, MeasurementType.BINARY, true)).isEqualTo(Boolean.FALSE);
        assertThat(ValueConverter.convert(4, MeasurementType.DISCRETE, true)).isEqualTo("4");
    }

    @Test
    @DisplayName("Missing samples stay missing for every type")
    void testConvert_NullStaysNull() {
        for (MeasurementType type : MeasurementType.values()) {
            assertThat(ValueConverter.convert(null, type, true)).isNull();
        }
    }

    @Test
    void testConvert_UnconvertibleValue() {
        assertThat(ValueConverter.convert("warm", MeasurementType.CONTINUOUS, false)).isNull();
        assertThatThrownBy(() -> ValueConverter.convert("warm", MeasurementType.CONTINUOUS, true))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("warm");
        assertThatThrownBy(() -> ValueConverter.convert(Double.NaN, MeasurementType.INTEGER, true))
            .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void testFormat_ContinuousRoundsThenOffsets() {
        assertThat(ValueConverter.format(21.455, MeasurementType.CONTINUOUS, null)).isEqualTo(21.46);
        assertThat((Double) ValueConverter.format(21.456, MeasurementType.CONTINUOUS, 10))
            .isCloseTo(31.46, within(1e-9));
    }

    @Test
    void testFormat_IntegerAndOthers() {
        assertThat(ValueConverter.format(5L, MeasurementType.INTEGER, 2)).isEqualTo(7L);
        assertThat(ValueConverter.format(5L, MeasurementType.INTEGER, 0.5)).isEqualTo(5.5);
        assertThat(ValueConverter.format(5L, MeasurementType.INTEGER, null)).isEqualTo(5L);
        assertThat(ValueConverter.format(Boolean.TRUE, MeasurementType.BINARY, 3)).isEqualTo(Boolean.TRUE);
        assertThat(ValueConverter.format("open", MeasurementType.DISCRETE, 3)).isEqualTo("open");
        assertThat(ValueConverter.format(null, MeasurementType.CONTINUOUS, 3)).isNull();
    }
}
