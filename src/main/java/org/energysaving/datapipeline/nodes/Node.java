package org.energysaving.datapipeline.nodes;

import java.util.List;
import java.util.Objects;

import org.energysaving.datapipeline.api.timeseries.SeriesKey;

/**
 * Model-facing handle of one (possibly composite or derived) series.
 * <p>
 * Identity is the {@link SeriesKey}. Nodes refer to other nodes only by key; the referenced
 * nodes live in the same {@link NodeArena}.
 */
public abstract class Node {

    private final SeriesKey key;
    private final NodeStatistics statistics;

    protected Node(SeriesKey key, NodeStatistics statistics) {
        this.key = Objects.requireNonNull(key, "key");
        this.statistics = Objects.requireNonNull(statistics, "statistics");
    }

    public abstract NodeKind getKind();

    /**
     * Returns the keys this node is computed from.
     *
     * @return Children for composites, the base for derived nodes, empty for simple nodes
     */
    public abstract List<SeriesKey> references();

    public SeriesKey getKey() {
        return key;
    }

    public NodeStatistics getStatistics() {
        return statistics;
    }

    public String getDeviceType() {
        return key.deviceType();
    }

    public String getMeasurement() {
        return key.measurement();
    }

    public String getDevice() {
        return key.device();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Node that = (Node) o;
        return key.equals(that.key) && statistics.equals(that.statistics) && references().equals(that.references());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKind(), key);
    }

    @Override
    public String toString() {
        return getKind() + "[" + key + "]";
    }
}
