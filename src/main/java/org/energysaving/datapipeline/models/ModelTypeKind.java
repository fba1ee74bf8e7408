package org.energysaving.datapipeline.models;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;

/**
 * Registry of the model types a datacenter can configure.
 */
public enum ModelTypeKind {

    SENSOR_ATTRIBUTE_PREDICTION("sensor_attribute_prediction", new SensorAttributePredictionStrategy()),

    CONTROLLER_PARAMETER_PREDICTION("controller_parameter_prediction", new ControllerParameterPredictionStrategy()),

    PUE_PREDICTION("pue_prediction", new PuePredictionStrategy()),

    CONTROLLER_ATTRIBUTE_OPTIMIZATION("controller_attribute_optimization", new ControllerAttributeOptimizationStrategy());

    private final String name;
    private final IModelTypeStrategy strategy;

    ModelTypeKind(String name, IModelTypeStrategy strategy) {
        this.name = name;
        this.strategy = strategy;
    }

    public String getName() {
        return name;
    }

    public IModelTypeStrategy getStrategy() {
        return strategy;
    }

    /**
     * Looks up a model type by name.
     *
     * @param name Model type name
     * @return The kind
     * @throws InvalidParameterException if no model type has that name
     */
    public static ModelTypeKind fromName(String name) {
        for (ModelTypeKind kind : values()) {
            if (kind.name.equals(name)) {
                return kind;
            }
        }
        throw new InvalidParameterException("unknown model type " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
