package org.energysaving.datapipeline.transform;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;

/**
 * Name to transformer lookup.
 * <p>
 * Built-in transformers, with {@code Δ} the sampling interval:
 * <ul>
 *   <li>{@code default}: identity</li>
 *   <li>{@code shift}: {@code s'(t) = s(t+Δ)} for every {@code t} of the series whose successor
 *       {@code t+Δ} is present; the last row is dropped</li>
 *   <li>{@code unshift}: {@code u(t) = s(t-Δ)}, i.e. every sample moves one interval later; no
 *       value exists for the first original timestamp</li>
 *   <li>{@code differentiate}: {@code d(t) = s(t+Δ) - s(t)}; the last row is dropped</li>
 * </ul>
 * {@code unshift} inverts {@code shift} on every row but the first.
 */
public class TransformerRegistry {

    public static final String DEFAULT = "default";
    public static final String SHIFT = "shift";
    public static final String UNSHIFT = "unshift";
    public static final String DIFFERENTIATE = "differentiate";

    private final Map<String, ISeriesTransformer> transformers = new LinkedHashMap<>();

    /**
     * Creates a registry holding the built-in transformers.
     */
    public TransformerRegistry() {
        register(DEFAULT, (series, interval) -> new TreeMap<>(series));
        register(SHIFT, TransformerRegistry::shift);
        register(UNSHIFT, TransformerRegistry::unshift);
        register(DIFFERENTIATE, TransformerRegistry::differentiate);
    }

    /**
     * Adds or replaces a transformer.
     *
     * @param name        Name used in node files
     * @param transformer Implementation
     */
    public final void register(String name, ISeriesTransformer transformer) {
        transformers.put(name, transformer);
    }

    /**
     * Looks up a transformer. Null means identity.
     *
     * @param name Transformer name
     * @return The transformer
     * @throws InvalidParameterException if the name is not registered
     */
    public ISeriesTransformer get(String name) {
        ISeriesTransformer transformer = transformers.get(name == null ? DEFAULT : name);
        if (transformer == null) {
            throw new InvalidParameterException("unknown transformer " + name + ", known: " + transformers.keySet());
        }
        return transformer;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(transformers.keySet());
    }

    static NavigableMap<Instant, Double> shift(NavigableMap<Instant, Double> series, Duration interval) {
        NavigableMap<Instant, Double> result = new TreeMap<>();
        for (Instant time : series.keySet()) {
            Double next = series.get(time.plus(interval));
            if (next != null) {
                result.put(time, next);
            }
        }
        return result;
    }

    static NavigableMap<Instant, Double> unshift(NavigableMap<Instant, Double> series, Duration interval) {
        NavigableMap<Instant, Double> result = new TreeMap<>();
        series.forEach((time, value) -> result.put(time.plus(interval), value));
        return result;
    }

    static NavigableMap<Instant, Double> differentiate(NavigableMap<Instant, Double> series, Duration interval) {
        NavigableMap<Instant, Double> result = new TreeMap<>();
        series.forEach((time, value) -> {
            Double next = series.get(time.plus(interval));
            if (next != null) {
                result.put(time, next - value);
            }
        });
        return result;
    }
}
