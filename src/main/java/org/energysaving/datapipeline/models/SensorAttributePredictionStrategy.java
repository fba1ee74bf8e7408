package org.energysaving.datapipeline.models;

import java.util.ArrayList;
import java.util.List;

import org.energysaving.datapipeline.api.metadata.DeviceType;
import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.nodes.DerivedNode;
import org.energysaving.datapipeline.nodes.Node;
import org.energysaving.datapipeline.nodes.NodeArena;
import org.energysaving.datapipeline.nodes.NodeSet;
import org.energysaving.datapipeline.transform.TransformerRegistry;

/**
 * Predicts the next interval of sensor attributes from the current state and the next controller
 * attributes.
 * <p>
 * Controller attribute inputs and sensor attribute outputs are replaced by derived nodes named
 * {@code shifted_<device>} that read one interval ahead. Outputs are shifted back on the inverse
 * path so predictions land on the timestamp they predict.
 */
public class SensorAttributePredictionStrategy implements IModelTypeStrategy {

    public static final String SHIFTED_PREFIX = "shifted_";

    @Override
    public NodeSet buildNodes(ModelBuildContext context) {
        NodeArena arena = context.arena();
        List<SeriesKey> inputs = new ArrayList<>();
        for (SeriesKey key : context.inputs()) {
            if (DeviceType.CONTROLLER_ATTRIBUTE.getWireName().equals(key.deviceType())) {
                inputs.add(shifted(arena, key, TransformerRegistry.DEFAULT));
            } else {
                inputs.add(key);
            }
        }
        List<SeriesKey> outputs = new ArrayList<>();
        for (SeriesKey key : context.outputs()) {
            if (DeviceType.SENSOR_ATTRIBUTE.getWireName().equals(key.deviceType())) {
                outputs.add(shifted(arena, key, TransformerRegistry.UNSHIFT));
            } else {
                outputs.add(key);
            }
        }
        return new NodeSet(arena, inputs, outputs);
    }

    private static SeriesKey shifted(NodeArena arena, SeriesKey key, String detransformer) {
        Node base = arena.get(key);
        SeriesKey shiftedKey = key.withDevice(SHIFTED_PREFIX + key.device());
        arena.register(new DerivedNode(shiftedKey, base.getStatistics(), key, TransformerRegistry.SHIFT, detransformer));
        return shiftedKey;
    }
}
