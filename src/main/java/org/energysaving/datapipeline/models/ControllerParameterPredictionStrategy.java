package org.energysaving.datapipeline.models;

import org.energysaving.datapipeline.nodes.NodeSet;

/**
 * Uses the resolved series as model nodes without further processing.
 */
public class ControllerParameterPredictionStrategy implements IModelTypeStrategy {

    @Override
    public NodeSet buildNodes(ModelBuildContext context) {
        return new NodeSet(context.arena(), context.inputs(), context.outputs());
    }
}
