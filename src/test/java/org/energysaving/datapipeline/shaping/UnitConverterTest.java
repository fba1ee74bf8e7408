package org.energysaving.datapipeline.shaping;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class UnitConverterTest {

    private final UnitConverter converter = new UnitConverter();

    @Test
    void testConvert_PowerUnitsThroughAliases() {
        assertThat(converter.convert(1500.0, new UnitConversion("watt", "kW"))).isEqualTo(1.5);
        assertThat(converter.convert(2, new UnitConversion("KW", "W"))).isEqualTo(2000.0);
        assertThat(converter.convert(1.5, "kilowatts", "w")).isEqualTo(1500.0);
    }

    @Test
    void testConvert_NothingToDo() {
        assertThat(converter.convert(21.0, new UnitConversion("celsius", "Celsius"))).isEqualTo(21.0);
        assertThat(converter.convert(21.0, UnitConversion.none())).isEqualTo(21.0);
        assertThat(converter.convert(null, new UnitConversion("W", "kW"))).isNull();
        assertThat(converter.convert("on", new UnitConversion("W", "kW"))).isEqualTo("on");
    }

    @Test
    void testConvert_UnknownPairPassesThrough() {
        assertThat(converter.supports("celsius", "fahrenheit")).isFalse();
        assertThat(converter.convert(21.0, new UnitConversion("celsius", "fahrenheit"))).isEqualTo(21.0);
    }

    @Test
    void testRegister_CustomConversion() {
        // Given
        converter.alias("c", "celsius");
        converter.alias("f", "fahrenheit");
        converter.register("c", "f", v -> v * 9.0 / 5.0 + 32.0);

        // When / Then
        assertThat(converter.supports("celsius", "fahrenheit")).isTrue();
        assertThat(converter.convert(100.0, "celsius", "fahrenheit")).isEqualTo(212.0);
        assertThat(converter.supports("fahrenheit", "celsius")).isFalse();
    }

    @Test
    void testUnitConversion_Inverse() {
        UnitConversion conversion = new UnitConversion("W", "kW");

        assertThat(conversion.isRequired()).isTrue();
        assertThat(conversion.inverse()).isEqualTo(new UnitConversion("kW", "W"));
        assertThat(new UnitConversion("W", null).isRequired()).isFalse();
    }
}
