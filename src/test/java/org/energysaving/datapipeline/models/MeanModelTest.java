package org.energysaving.datapipeline.models;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import java.time.Instant;

import org.energysaving.datapipeline.api.models.ModelResult;
import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.api.timeseries.SeriesTable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;

@Tag("unit")
class MeanModelTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant T1 = T0.plusSeconds(60);
    private static final SeriesKey IN = SeriesKey.of("controller_attribute", "fan_speed", "c1");
    private static final SeriesKey OUT = SeriesKey.of("sensor_attribute", "temperature", "s1");

    @Test
    void train_shouldPredictTheTrainingMean() {
        // Given
        MeanModel model = new MeanModel(new JsonObject());
        SeriesTable input = new SeriesTable().put(IN, T0, 0.0).put(IN, T1, 1.0);
        SeriesTable output = new SeriesTable().put(OUT, T0, 1.0).put(OUT, T1, 3.0);

        // When
        ModelResult result = model.train(input, output, true, false);

        // Then
        assertThat(result.predictions().numericColumn(OUT)).containsExactly(entry(T0, 2.0), entry(T1, 2.0));
        assertThat(result.expectations()).isNull();
        assertThat(result.statistics().get(OUT))
            .containsEntry(ModelResult.MSE, 1.0)
            .containsEntry(ModelResult.RSQUARE, 0.0);
    }

    @Test
    void saveAndLoad_shouldRestorePredictions() {
        // Given
        MeanModel trained = new MeanModel(new JsonObject());
        trained.train(new SeriesTable().put(IN, T0, 0.0), new SeriesTable().put(OUT, T0, 4.0), false, false);

        // When
        MeanModel restored = new MeanModel(new JsonObject());
        restored.load(trained.save());

        // Then
        assertThat(restored.getMeans()).containsExactly(entry(OUT, 4.0));
        assertThat(restored.apply(new SeriesTable().put(IN, T1, 7.0)).getDouble(OUT, T1)).isEqualTo(4.0);
    }

    @Test
    void untrainedModel_shouldRefuseToPredict() {
        MeanModel model = new MeanModel(new JsonObject());

        assertThatThrownBy(() -> model.apply(new SeriesTable().put(IN, T0, 0.0)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("MeanModel has not been trained");
        assertThatThrownBy(() -> model.train(new SeriesTable().put(IN, T0, 0.0), new SeriesTable(), false, false))
            .isInstanceOf(IllegalStateException.class);
    }
}
