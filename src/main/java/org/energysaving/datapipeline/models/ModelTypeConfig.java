package org.energysaving.datapipeline.models;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;
import org.energysaving.datapipeline.resolver.Selection;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

/**
 * Configuration file of one model type of one datacenter.
 * <p>
 * <pre>
 * {
 *   "model": "linear_regression",
 *   "inputs": { "controller_attribute": {} },
 *   "outputs": { "sensor_attribute": { "temperature": {} } },
 *   "nodes": "sensor_attribute_prediction.nodes.json",
 *   "model_path": "sensor_attribute_prediction.model.json",
 *   "model_config": { "ridge": 0.001 }
 * }
 * </pre>
 * File names are relative to the model directory.
 */
public class ModelTypeConfig {

    private static final Gson GSON = new Gson();

    private String model;
    private JsonElement inputs;
    private JsonElement outputs;
    private String nodes;
    @SerializedName("model_path")
    private String modelPath;
    @SerializedName("model_config")
    private JsonObject modelConfig;

    /**
     * Reads a config file and fills in defaults derived from the model type.
     *
     * @param file Config file
     * @param type Model type the file configures
     * @return Config
     * @throws InvalidParameterException if the file is missing or malformed
     */
    public static ModelTypeConfig load(Path file, ModelTypeKind type) {
        if (!Files.isRegularFile(file)) {
            throw new InvalidParameterException("model type config " + file + " not found");
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            ModelTypeConfig config = GSON.fromJson(reader, ModelTypeConfig.class);
            if (config == null) {
                throw new InvalidParameterException("model type config " + file + " is empty");
            }
            return config.withDefaults(type);
        } catch (JsonParseException e) {
            throw new InvalidParameterException("malformed model type config " + file + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new InvalidParameterException("cannot read model type config " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses a config document.
     *
     * @param json Document text
     * @param type Model type the document configures
     * @return Config
     */
    public static ModelTypeConfig parse(String json, ModelTypeKind type) {
        try {
            ModelTypeConfig config = GSON.fromJson(json, ModelTypeConfig.class);
            if (config == null) {
                throw new InvalidParameterException("model type config is empty");
            }
            return config.withDefaults(type);
        } catch (JsonParseException e) {
            throw new InvalidParameterException("malformed model type config: " + e.getMessage(), e);
        }
    }

    private ModelTypeConfig withDefaults(ModelTypeKind type) {
        if (model == null) {
            model = ModelBuilderKind.MEAN.getName();
        }
        if (nodes == null) {
            nodes = type.getName() + ".nodes.json";
        }
        if (modelPath == null) {
            modelPath = type.getName() + ".model.json";
        }
        if (modelConfig == null) {
            modelConfig = new JsonObject();
        }
        return this;
    }

    public String getModel() {
        return model;
    }

    public Selection getInputs() {
        return Selection.fromJson(inputs);
    }

    public Selection getOutputs() {
        return Selection.fromJson(outputs);
    }

    public String getNodes() {
        return nodes;
    }

    public String getModelPath() {
        return modelPath;
    }

    public JsonObject getModelConfig() {
        return modelConfig.deepCopy();
    }
}
