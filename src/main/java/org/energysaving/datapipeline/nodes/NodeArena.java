package org.energysaving.datapipeline.nodes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.energysaving.datapipeline.api.metadata.DatacenterMetadata;
import org.energysaving.datapipeline.api.metadata.DeviceTypeMapping;
import org.energysaving.datapipeline.api.metadata.MeasurementMetadata;
import org.energysaving.datapipeline.api.timeseries.SeriesKey;

/**
 * Registry of nodes indexed by identity key.
 * <p>
 * A node can only be registered after every node it references, so the reference graph is
 * acyclic by construction. Registration is idempotent: the first node registered under a key
 * wins and later registrations under the same key are ignored.
 */
public class NodeArena {

    private final Map<SeriesKey, Node> nodes = new LinkedHashMap<>();

    /**
     * Registers a node.
     *
     * @param node Node to register
     * @return The node now registered under the key (the earlier one if the key was taken)
     * @throws IllegalArgumentException if a referenced key is not registered
     */
    public Node register(Node node) {
        Node existing = nodes.get(node.getKey());
        if (existing != null) {
            return existing;
        }
        for (SeriesKey reference : node.references()) {
            if (!nodes.containsKey(reference)) {
                throw new IllegalArgumentException(
                    "Node " + node.getKey() + " references unregistered node " + reference);
            }
        }
        nodes.put(node.getKey(), node);
        return node;
    }

    /**
     * Creates and registers one simple node per device of a resolved mapping.
     *
     * @param mapping  Resolved mapping
     * @param metadata Snapshot providing unit, type and statistics
     * @return Keys of the nodes, in mapping order
     */
    public List<SeriesKey> registerAll(DeviceTypeMapping mapping, DatacenterMetadata metadata) {
        List<SeriesKey> keys = new ArrayList<>();
        for (String deviceType : mapping.deviceTypes()) {
            for (String measurement : mapping.measurements(deviceType)) {
                MeasurementMetadata measurementMetadata = metadata.getMeasurement(deviceType, measurement)
                    .orElseThrow(() -> new IllegalArgumentException(
                        "Mapping refers to unknown measurement " + deviceType + "/" + measurement));
                NodeStatistics statistics = NodeStatistics.from(measurementMetadata.getAttribute());
                for (String device : mapping.devices(deviceType, measurement)) {
                    SeriesKey key = SeriesKey.of(deviceType, measurement, device);
                    register(new SimpleNode(key, statistics));
                    keys.add(key);
                }
            }
        }
        return keys;
    }

    /**
     * Returns a registered node.
     *
     * @param key Identity key
     * @return The node
     * @throws IllegalArgumentException if the key is not registered
     */
    public Node get(SeriesKey key) {
        Node node = nodes.get(key);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node " + key);
        }
        return node;
    }

    public Optional<Node> find(SeriesKey key) {
        return Optional.ofNullable(nodes.get(key));
    }

    public boolean contains(SeriesKey key) {
        return nodes.containsKey(key);
    }

    /**
     * Returns all nodes in registration order (references before referrers).
     *
     * @return Unmodifiable view
     */
    public Collection<Node> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int size() {
        return nodes.size();
    }
}
