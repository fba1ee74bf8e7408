package org.energysaving.datapipeline.api.models;

import com.google.gson.JsonObject;

/**
 * Creates untrained models of one algorithm.
 */
@FunctionalInterface
public interface IModelBuilder {

    /**
     * Creates a model.
     *
     * @param modelConfig Algorithm configuration (the {@code model_config} of a model type), never null
     * @return New untrained model
     */
    IModel create(JsonObject modelConfig);
}
