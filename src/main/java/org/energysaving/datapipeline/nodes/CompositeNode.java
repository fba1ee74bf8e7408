package org.energysaving.datapipeline.nodes;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import org.energysaving.datapipeline.api.timeseries.SeriesKey;

/**
 * Node whose series aggregates the series of its children.
 */
public final class CompositeNode extends Node {

    public static final String DEFAULT_AGGREGATOR = "sum";

    private final List<SeriesKey> children;
    private final String aggregator;

    /**
     * Creates a composite node.
     *
     * @param key        Identity
     * @param statistics Statistics of the aggregate
     * @param children   Child keys, deduplicated in order; must not be empty
     * @param aggregator Aggregator name, null for {@value #DEFAULT_AGGREGATOR}
     */
    public CompositeNode(SeriesKey key, NodeStatistics statistics, List<SeriesKey> children, String aggregator) {
        super(key, statistics);
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException("Composite node " + key + " needs at least one child");
        }
        if (children.contains(key)) {
            throw new IllegalArgumentException("Composite node " + key + " cannot contain itself");
        }
        this.children = List.copyOf(new ArrayList<>(new LinkedHashSet<>(children)));
        this.aggregator = aggregator == null ? DEFAULT_AGGREGATOR : aggregator;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.COMPOSITE;
    }

    @Override
    public List<SeriesKey> references() {
        return children;
    }

    public List<SeriesKey> getChildren() {
        return children;
    }

    public String getAggregator() {
        return aggregator;
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o)
            && aggregator.equals(((CompositeNode) o).aggregator);
    }

    @Override
    public int hashCode() {
        return super.hashCode();
    }
}
