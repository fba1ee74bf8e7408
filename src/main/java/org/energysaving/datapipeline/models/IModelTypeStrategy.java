package org.energysaving.datapipeline.models;

import org.energysaving.datapipeline.nodes.NodeSet;

/**
 * What distinguishes one model type from another: how it turns resolved series into model nodes.
 * <p>
 * Fetching, the transform pipeline, training and result writing are shared by {@link ModelDriver}.
 */
public interface IModelTypeStrategy {

    /**
     * Builds the node set of the model type.
     *
     * @param context Build inputs
     * @return Node set whose arena contains every referenced node
     */
    NodeSet buildNodes(ModelBuildContext context);

    /**
     * Returns whether the model type trains a model of its own.
     *
     * @return false for model types composed of other model types
     */
    default boolean hasModel() {
        return true;
    }
}
