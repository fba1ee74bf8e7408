package org.energysaving.datapipeline.nodes;

import java.util.List;

import org.energysaving.datapipeline.api.timeseries.SeriesKey;

/**
 * Node backed by exactly one raw series.
 */
public final class SimpleNode extends Node {

    public SimpleNode(SeriesKey key, NodeStatistics statistics) {
        super(key, statistics);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SIMPLE;
    }

    @Override
    public List<SeriesKey> references() {
        return List.of();
    }
}
