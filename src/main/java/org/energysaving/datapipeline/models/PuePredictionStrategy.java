package org.energysaving.datapipeline.models;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.energysaving.datapipeline.api.metadata.MeasurementType;
import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.nodes.CompositeNode;
import org.energysaving.datapipeline.nodes.NodeArena;
import org.energysaving.datapipeline.nodes.NodeStatistics;
import org.energysaving.datapipeline.nodes.NodeSet;

/**
 * Predicts the datacenter totals of the output measurements (power consumption per supply kind).
 * <p>
 * The devices of every output measurement are summed into one composite node named
 * {@code total_<measurement>}. Its mean is the sum of the device means and its deviation the root
 * of the summed squared deviations; either is null when a device lacks it.
 */
public class PuePredictionStrategy implements IModelTypeStrategy {

    public static final String TOTAL_PREFIX = "total_";

    @Override
    public NodeSet buildNodes(ModelBuildContext context) {
        NodeArena arena = context.arena();
        Map<List<String>, List<SeriesKey>> groups = new LinkedHashMap<>();
        for (SeriesKey key : context.outputs()) {
            groups.computeIfAbsent(List.of(key.deviceType(), key.measurement()), k -> new ArrayList<>()).add(key);
        }
        List<SeriesKey> outputs = new ArrayList<>();
        for (List<SeriesKey> children : groups.values()) {
            SeriesKey first = children.get(0);
            SeriesKey total = first.withDevice(TOTAL_PREFIX + first.measurement());
            arena.register(new CompositeNode(total, totalStatistics(arena, children), children,
                CompositeNode.DEFAULT_AGGREGATOR));
            outputs.add(total);
        }
        return new NodeSet(arena, context.inputs(), outputs);
    }

    static NodeStatistics totalStatistics(NodeArena arena, List<SeriesKey> children) {
        Double mean = 0.0;
        Double variance = 0.0;
        String unit = null;
        for (SeriesKey child : children) {
            NodeStatistics statistics = arena.get(child).getStatistics();
            if (unit == null) {
                unit = statistics.unit();
            }
            mean = mean == null || statistics.mean() == null ? null : mean + statistics.mean();
            variance = variance == null || statistics.deviation() == null
                ? null
                : variance + statistics.deviation() * statistics.deviation();
        }
        return new NodeStatistics(unit, MeasurementType.CONTINUOUS, mean,
            variance == null ? null : Math.sqrt(variance), null, null);
    }
}
