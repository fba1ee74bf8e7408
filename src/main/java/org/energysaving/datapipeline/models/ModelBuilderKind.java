package org.energysaving.datapipeline.models;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;
import org.energysaving.datapipeline.api.models.IModelBuilder;

/**
 * Registry of the model algorithms a model type config can name in its {@code model} field.
 */
public enum ModelBuilderKind {

    MEAN("mean", MeanModel::new),

    LINEAR_REGRESSION("linear_regression", LinearRegressionModel::new);

    private final String name;
    private final IModelBuilder builder;

    ModelBuilderKind(String name, IModelBuilder builder) {
        this.name = name;
        this.builder = builder;
    }

    public String getName() {
        return name;
    }

    public IModelBuilder getBuilder() {
        return builder;
    }

    /**
     * Looks up a builder by its config name.
     *
     * @param name Name as written in the model type config
     * @return The kind
     * @throws InvalidParameterException if no builder has that name
     */
    public static ModelBuilderKind fromName(String name) {
        for (ModelBuilderKind kind : values()) {
            if (kind.name.equals(name)) {
                return kind;
            }
        }
        throw new InvalidParameterException("unknown model " + name);
    }
}
