package org.energysaving.datapipeline.nodes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.energysaving.datapipeline.api.metadata.DeviceTypeMapping;
import org.energysaving.datapipeline.api.metadata.MeasurementType;
import org.energysaving.datapipeline.api.timeseries.SeriesKey;

/**
 * Input and output nodes of one model build, with the views derived from them.
 * <p>
 * <ul>
 *   <li><strong>processed</strong>: the input and output keys, deduplicated (first occurrence wins)</li>
 *   <li><strong>unmerged</strong>: composites expanded recursively to their constituents</li>
 *   <li><strong>original</strong>: derived nodes unwound to their base</li>
 *   <li><strong>fetch</strong>: unwound, then expanded; exactly the raw series a read needs</li>
 * </ul>
 * Immutable once built.
 */
public class NodeSet {

    private final NodeArena arena;
    private final List<SeriesKey> inputs;
    private final List<SeriesKey> outputs;

    /**
     * Creates a node set.
     *
     * @param arena   Arena holding every referenced node
     * @param inputs  Input keys
     * @param outputs Output keys
     * @throws IllegalArgumentException if a key is not registered in the arena
     */
    public NodeSet(NodeArena arena, List<SeriesKey> inputs, List<SeriesKey> outputs) {
        this.arena = arena;
        this.inputs = List.copyOf(new LinkedHashSet<>(inputs));
        this.outputs = List.copyOf(new LinkedHashSet<>(outputs));
        for (SeriesKey key : this.inputs) {
            arena.get(key);
        }
        for (SeriesKey key : this.outputs) {
            arena.get(key);
        }
    }

    public NodeArena getArena() {
        return arena;
    }

    public List<SeriesKey> getInputs() {
        return inputs;
    }

    public List<SeriesKey> getOutputs() {
        return outputs;
    }

    public List<Node> inputNodes() {
        return nodesOf(inputs);
    }

    public List<Node> outputNodes() {
        return nodesOf(outputs);
    }

    public Node node(SeriesKey key) {
        return arena.get(key);
    }

    /**
     * Expands composites recursively. Derived nodes are kept.
     *
     * @param keys Processed keys
     * @return Unique keys in expansion order
     */
    public List<SeriesKey> unmerged(Collection<SeriesKey> keys) {
        Set<SeriesKey> result = new LinkedHashSet<>();
        for (SeriesKey key : keys) {
            expand(key, result);
        }
        return new ArrayList<>(result);
    }

    /**
     * Unwinds a derived node to the key it is ultimately derived from.
     *
     * @param key Any registered key
     * @return The base key, or the key itself if it is not derived
     */
    public SeriesKey original(SeriesKey key) {
        Node node = arena.get(key);
        while (node instanceof DerivedNode) {
            node = arena.get(((DerivedNode) node).getBase());
        }
        return node.getKey();
    }

    /**
     * Returns the raw series needed to compute the given nodes.
     *
     * @param keys Processed keys
     * @return Unique simple-node keys, in first-use order
     */
    public List<SeriesKey> fetchKeys(Collection<SeriesKey> keys) {
        Set<SeriesKey> result = new LinkedHashSet<>();
        for (SeriesKey key : keys) {
            collectRaw(key, result);
        }
        return new ArrayList<>(result);
    }

    /**
     * Builds the query-side mapping for the raw series of the given nodes.
     *
     * @param keys Processed keys
     * @return Mapping of the fetch keys
     */
    public DeviceTypeMapping deviceTypeMapping(Collection<SeriesKey> keys) {
        DeviceTypeMapping mapping = new DeviceTypeMapping();
        for (SeriesKey key : fetchKeys(keys)) {
            mapping.add(key.deviceType(), key.measurement(), key.device());
        }
        return mapping;
    }

    /**
     * Returns the value type of every fetched (device type, measurement) pair.
     *
     * @param keys Processed keys
     * @return {@code device_type -> measurement -> type}; the first node seen decides
     */
    public Map<String, Map<String, MeasurementType>> deviceTypeTypes(Collection<SeriesKey> keys) {
        Map<String, Map<String, MeasurementType>> types = new LinkedHashMap<>();
        for (SeriesKey key : fetchKeys(keys)) {
            types.computeIfAbsent(key.deviceType(), k -> new LinkedHashMap<>())
                .putIfAbsent(key.measurement(), arena.get(key).getStatistics().type());
        }
        return types;
    }

    private List<Node> nodesOf(List<SeriesKey> keys) {
        List<Node> result = new ArrayList<>(keys.size());
        for (SeriesKey key : keys) {
            result.add(arena.get(key));
        }
        return result;
    }

    private void expand(SeriesKey key, Set<SeriesKey> result) {
        Node node = arena.get(key);
        if (node instanceof CompositeNode) {
            for (SeriesKey child : ((CompositeNode) node).getChildren()) {
                expand(child, result);
            }
        } else {
            result.add(key);
        }
    }

    private void collectRaw(SeriesKey key, Set<SeriesKey> result) {
        Node node = arena.get(key);
        switch (node.getKind()) {
            case SIMPLE -> result.add(key);
            case DERIVED -> collectRaw(((DerivedNode) node).getBase(), result);
            case COMPOSITE -> {
                for (SeriesKey child : node.references()) {
                    collectRaw(child, result);
                }
            }
        }
    }

    @Override
    public String toString() {
        return "NodeSet[inputs=" + inputs + ", outputs=" + outputs + "]";
    }
}
