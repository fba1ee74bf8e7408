package org.energysaving.datapipeline.models;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;
import org.energysaving.datapipeline.resolver.Selection;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonObject;

@Tag("unit")
class ModelTypeConfigTest {

    @TempDir
    Path modelDirectory;

    @Test
    void parse_shouldFillDefaultsFromModelType() {
        // When
        ModelTypeConfig config = ModelTypeConfig.parse("{}", ModelTypeKind.PUE_PREDICTION);

        // Then
        assertThat(config.getModel()).isEqualTo("mean");
        assertThat(config.getNodes()).isEqualTo("pue_prediction.nodes.json");
        assertThat(config.getModelPath()).isEqualTo("pue_prediction.model.json");
        assertThat(config.getModelConfig().size()).isZero();
        assertThat(config.getInputs().isAll()).isTrue();
    }

    @Test
    void load_shouldReadSelectionsAndModelSettings() throws IOException {
        // Given
        Path file = modelDirectory.resolve("sensor.json");
        Files.writeString(file, "{\"model\": \"linear_regression\","
            + " \"inputs\": {\"controller_attribute\": {}, \"sensor_attribute\": {\"temperature\": [\"s1\"]}},"
            + " \"outputs\": \"sensor_attribute\","
            + " \"model_path\": \"custom.model.json\","
            + " \"model_config\": {\"ridge\": 0.5}}");

        // When
        ModelTypeConfig config = ModelTypeConfig.load(file, ModelTypeKind.SENSOR_ATTRIBUTE_PREDICTION);

        // Then
        assertThat(config.getModel()).isEqualTo("linear_regression");
        assertThat(config.getInputs().getNames()).containsExactly("controller_attribute", "sensor_attribute");
        assertThat(config.getInputs().child("sensor_attribute").child("temperature"))
            .isEqualTo(Selection.names("s1"));
        assertThat(config.getOutputs()).isEqualTo(Selection.names("sensor_attribute"));
        assertThat(config.getNodes()).isEqualTo("sensor_attribute_prediction.nodes.json");
        assertThat(config.getModelPath()).isEqualTo("custom.model.json");
        assertThat(config.getModelConfig().get("ridge").getAsDouble()).isEqualTo(0.5);
    }

    @Test
    void getModelConfig_shouldReturnACopy() {
        ModelTypeConfig config = ModelTypeConfig.parse("{\"model_config\": {\"ridge\": 1}}", ModelTypeKind.PUE_PREDICTION);

        config.getModelConfig().addProperty("ridge", 2);

        assertThat(config.getModelConfig().get("ridge").getAsInt()).isEqualTo(1);
    }

    @Test
    void invalidDocuments_shouldBeRejected() {
        assertThatThrownBy(() -> ModelTypeConfig.load(modelDirectory.resolve("missing.json"),
            ModelTypeKind.PUE_PREDICTION))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("not found");
        assertThatThrownBy(() -> ModelTypeConfig.parse("[1, 2]", ModelTypeKind.PUE_PREDICTION))
            .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> ModelTypeConfig.parse("", ModelTypeKind.PUE_PREDICTION))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("empty");
    }

    @Test
    void registries_shouldResolveNames() {
        assertThat(ModelTypeKind.fromName("controller_attribute_optimization"))
            .isEqualTo(ModelTypeKind.CONTROLLER_ATTRIBUTE_OPTIMIZATION);
        assertThat(ModelBuilderKind.fromName("linear_regression").getBuilder().create(new JsonObject()))
            .isInstanceOf(LinearRegressionModel.class);
        assertThat(ModelBuilderKind.fromName("mean").getBuilder().create(new JsonObject()))
            .isInstanceOf(MeanModel.class);
        assertThatThrownBy(() -> ModelTypeKind.fromName("weather_prediction"))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessage("unknown model type weather_prediction");
        assertThatThrownBy(() -> ModelBuilderKind.fromName("neural_network"))
            .isInstanceOf(InvalidParameterException.class);
    }
}
