package org.energysaving.datapipeline.shaping;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts numeric values between units.
 * <p>
 * Unit names are matched case-insensitively and through aliases ({@code W}/{@code watt},
 * {@code kW}/{@code kilowatt}). Pairs without a registered conversion are logged and passed
 * through unchanged; conversion never fails.
 */
public class UnitConverter {

    private static final Logger log = LoggerFactory.getLogger(UnitConverter.class);

    private final Map<String, String> aliases = new HashMap<>();
    private final Map<String, DoubleUnaryOperator> conversions = new HashMap<>();

    /**
     * Creates a converter with the built-in power units registered.
     */
    public UnitConverter() {
        alias("w", "W", "watt", "watts");
        alias("kw", "kW", "kilowatt", "kilowatts");
        register("w", "kw", v -> v / 1000.0);
        register("kw", "w", v -> v * 1000.0);
    }

    /**
     * Declares alternative spellings of a unit.
     *
     * @param canonical Canonical unit name
     * @param names     Alternative names
     */
    public final void alias(String canonical, String... names) {
        String key = canonical.toLowerCase(Locale.ROOT);
        aliases.put(key, key);
        for (String name : names) {
            aliases.put(name.toLowerCase(Locale.ROOT), key);
        }
    }

    /**
     * Registers a one-way conversion.
     *
     * @param from       Source unit
     * @param to         Target unit
     * @param conversion Conversion function
     */
    public final void register(String from, String to, DoubleUnaryOperator conversion) {
        conversions.put(key(canonical(from), canonical(to)), conversion);
    }

    /**
     * Returns true if a conversion between the units is registered (or none is needed).
     *
     * @param from Source unit
     * @param to   Target unit
     * @return true if {@link #convert} changes or legitimately keeps the value
     */
    public boolean supports(String from, String to) {
        String source = canonical(from);
        String target = canonical(to);
        return source.equals(target) || conversions.containsKey(key(source, target));
    }

    /**
     * Converts a value.
     *
     * @param value      Value; non-numeric values are returned unchanged
     * @param conversion Requested unit change
     * @return Converted value as a Double, or the input value if nothing applies
     */
    public Object convert(Object value, UnitConversion conversion) {
        if (value == null || conversion == null || !conversion.isRequired() || !(value instanceof Number)) {
            return value;
        }
        String source = canonical(conversion.from());
        String target = canonical(conversion.to());
        if (source.equals(target)) {
            return value;
        }
        DoubleUnaryOperator operator = conversions.get(key(source, target));
        if (operator == null) {
            log.warn("No conversion from {} to {}, keeping value {}", conversion.from(), conversion.to(), value);
            return value;
        }
        return operator.applyAsDouble(((Number) value).doubleValue());
    }

    public double convert(double value, String from, String to) {
        Object converted = convert(value, new UnitConversion(from, to));
        return ((Number) converted).doubleValue();
    }

    private String canonical(String unit) {
        String lower = unit.trim().toLowerCase(Locale.ROOT);
        return aliases.getOrDefault(lower, lower);
    }

    private static String key(String from, String to) {
        return from + "->" + to;
    }
}
