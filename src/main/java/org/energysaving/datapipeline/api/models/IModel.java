package org.energysaving.datapipeline.api.models;

import org.energysaving.datapipeline.api.timeseries.SeriesTable;

import com.google.gson.JsonObject;

/**
 * Contract of a learning model.
 * <p>
 * Tables passed in are already normalized and cleaned; tables returned are in the same
 * normalized space and are denormalized by the caller. Output columns must use the keys of
 * the output table passed to {@link #train}.
 */
public interface IModel {

    /**
     * Fits the model.
     *
     * @param input                Input matrix
     * @param output               Target matrix
     * @param generatePredictions  Whether to return predictions for the input rows
     * @param generateExpectations Whether to echo the targets as expectations
     * @return Predictions, expectations and fit statistics
     */
    ModelResult train(SeriesTable input, SeriesTable output, boolean generatePredictions, boolean generateExpectations);

    /**
     * Evaluates the model without changing it.
     *
     * @param input                Input matrix
     * @param output               Target matrix
     * @param generatePredictions  Whether to return predictions
     * @param generateExpectations Whether to echo the targets as expectations
     * @return Predictions, expectations and test statistics
     */
    ModelResult test(SeriesTable input, SeriesTable output, boolean generatePredictions, boolean generateExpectations);

    /**
     * Predicts outputs for new inputs.
     *
     * @param input Input matrix
     * @return Predictions keyed by output column
     * @throws IllegalStateException if the model has not been trained
     */
    SeriesTable apply(SeriesTable input);

    /**
     * Serializes the fitted state.
     *
     * @return JSON state
     */
    JsonObject save();

    /**
     * Restores state produced by {@link #save()}.
     *
     * @param state JSON state
     */
    void load(JsonObject state);
}
