package org.energysaving.datapipeline.nodes;

import java.util.List;
import java.util.Objects;

import org.energysaving.datapipeline.api.timeseries.SeriesKey;

/**
 * Node whose series is computed from a base node by a named transformer, and mapped back to the
 * base node's terms by a named detransformer.
 */
public final class DerivedNode extends Node {

    public static final String IDENTITY = "default";

    private final SeriesKey base;
    private final String transformer;
    private final String detransformer;

    /**
     * Creates a derived node.
     *
     * @param key           Identity, must differ from the base
     * @param statistics    Statistics of the derived series
     * @param base          Key of the base node
     * @param transformer   Forward transformer name, null for identity
     * @param detransformer Inverse transformer name, null for identity
     */
    public DerivedNode(SeriesKey key, NodeStatistics statistics, SeriesKey base, String transformer,
                       String detransformer) {
        super(key, statistics);
        this.base = Objects.requireNonNull(base, "base");
        if (base.equals(key)) {
            throw new IllegalArgumentException("Derived node " + key + " cannot derive from itself");
        }
        this.transformer = transformer == null ? IDENTITY : transformer;
        this.detransformer = detransformer == null ? IDENTITY : detransformer;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.DERIVED;
    }

    @Override
    public List<SeriesKey> references() {
        return List.of(base);
    }

    public SeriesKey getBase() {
        return base;
    }

    public String getTransformer() {
        return transformer;
    }

    public String getDetransformer() {
        return detransformer;
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o)
            && transformer.equals(((DerivedNode) o).transformer)
            && detransformer.equals(((DerivedNode) o).detransformer);
    }

    @Override
    public int hashCode() {
        return super.hashCode();
    }
}
