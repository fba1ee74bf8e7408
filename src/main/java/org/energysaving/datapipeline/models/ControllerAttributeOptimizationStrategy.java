package org.energysaving.datapipeline.models;

import java.util.ArrayList;
import java.util.List;

import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.nodes.Node;
import org.energysaving.datapipeline.nodes.NodeArena;
import org.energysaving.datapipeline.nodes.NodeSet;

/**
 * Combines PUE prediction and sensor attribute prediction to search controller attributes.
 * <p>
 * The node set is the union of both component node sets, first occurrence winning. There is no
 * model of its own; the components are trained separately.
 */
public class ControllerAttributeOptimizationStrategy implements IModelTypeStrategy {

    @Override
    public NodeSet buildNodes(ModelBuildContext context) {
        NodeArena arena = new NodeArena();
        List<SeriesKey> inputs = new ArrayList<>();
        List<SeriesKey> outputs = new ArrayList<>();
        for (ModelTypeKind component : List.of(ModelTypeKind.PUE_PREDICTION, ModelTypeKind.SENSOR_ATTRIBUTE_PREDICTION)) {
            NodeSet nodes = context.componentNodes().apply(component);
            for (Node node : nodes.getArena().nodes()) {
                arena.register(node);
            }
            inputs.addAll(nodes.getInputs());
            outputs.addAll(nodes.getOutputs());
        }
        return new NodeSet(arena, inputs, outputs);
    }

    @Override
    public boolean hasModel() {
        return false;
    }
}
