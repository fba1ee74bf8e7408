package org.energysaving.datapipeline.resources.database;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.energysaving.datapipeline.TestMetadataHelper;
import org.energysaving.datapipeline.api.exceptions.UnknownDatacenterException;
import org.energysaving.datapipeline.api.exceptions.UnknownMeasurementException;
import org.energysaving.datapipeline.api.metadata.DatacenterMetadata;
import org.energysaving.datapipeline.api.metadata.DeviceType;
import org.energysaving.datapipeline.api.metadata.MeasurementAttribute;
import org.energysaving.datapipeline.api.metadata.MeasurementMetadata;
import org.energysaving.datapipeline.api.metadata.MeasurementStatistics;
import org.energysaving.datapipeline.api.metadata.MeasurementType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link MetadataRepository} against an in-memory H2 database.
 */
@Tag("unit")
class MetadataRepositoryTest {

    private H2MetadataDatabase database;
    private final MetadataRepository repository = new MetadataRepository();

    @BeforeEach
    void setUp() {
        database = new H2MetadataDatabase("test-metadata", H2MetadataDatabaseTest.inMemoryConfig());
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    private void save(DatacenterMetadata metadata) {
        database.inSession(session -> {
            repository.saveDatacenter(session, metadata);
            return null;
        });
    }

    private DatacenterMetadata load(String name) {
        return database.inSession(session -> repository.getDatacenterMetadata(session, name));
    }

    @Test
    void saveDatacenter_shouldRoundTripSnapshot() {
        // Given
        DatacenterMetadata metadata = TestMetadataHelper.builder()
            .model("pue_prediction", "pue.json")
            .properties(Map.of("location", "berlin"))
            .measurement(DeviceType.SENSOR_ATTRIBUTE, "inlet", new MeasurementMetadata(List.of("s3"),
                MeasurementAttribute.builder().type(MeasurementType.INTEGER).pattern("inlet_.*").build()))
            .build();

        // When
        save(metadata);
        DatacenterMetadata loaded = load(TestMetadataHelper.DATACENTER);

        // Then
        assertThat(loaded).isEqualTo(metadata);
        assertThat(loaded.getMeasurement("sensor_attribute", "temperature").orElseThrow().getDevices())
            .containsExactly("s1", "s2");
        assertThat(loaded.getModels()).containsEntry("pue_prediction", "pue.json");
    }

    @Test
    void saveDatacenter_shouldReplaceExistingDatacenter() {
        // Given
        save(TestMetadataHelper.datacenter());
        DatacenterMetadata replacement = DatacenterMetadata.builder(TestMetadataHelper.DATACENTER)
            .timeInterval(300)
            .measurement(DeviceType.SENSOR_ATTRIBUTE, "temperature",
                TestMetadataHelper.continuous(List.of("s7"), "celsius", 19.0, 1.0))
            .build();

        // When
        save(replacement);

        // Then
        DatacenterMetadata loaded = load(TestMetadataHelper.DATACENTER);
        assertThat(loaded.getTimeInterval()).isEqualTo(300);
        assertThat(loaded.getDeviceTypes()).containsOnlyKeys("sensor_attribute");
        assertThat(loaded.getMeasurement("sensor_attribute", "temperature").orElseThrow().getDevices())
            .containsExactly("s7");
    }

    @Test
    void listAndDelete_shouldCascade() {
        // Given
        save(TestMetadataHelper.datacenter());
        save(DatacenterMetadata.builder("dc0").build());

        // When
        boolean deleted = database.inSession(session -> repository.deleteDatacenter(session, "dc1"));
        boolean deletedAgain = database.inSession(session -> repository.deleteDatacenter(session, "dc1"));

        // Then
        assertThat(deleted).isTrue();
        assertThat(deletedAgain).isFalse();
        List<String> remaining = database.inSession(repository::listDatacenters);
        Map<String, DatacenterMetadata> remainingMetadata = database.inSession(repository::getMetadata);
        assertThat(remaining).containsExactly("dc0");
        assertThat(remainingMetadata).containsOnlyKeys("dc0");
        save(TestMetadataHelper.datacenter());
        assertThat(load("dc1")).isEqualTo(TestMetadataHelper.datacenter());
    }

    @Test
    void getDatacenterMetadata_shouldRejectUnknownDatacenter() {
        assertThatThrownBy(() -> load("nowhere"))
            .isInstanceOf(UnknownDatacenterException.class)
            .hasMessageContaining("nowhere");
    }

    @Test
    void updateStatistics_shouldStoreAllFields() {
        // Given
        save(TestMetadataHelper.datacenter());
        MeasurementStatistics statistics = new MeasurementStatistics(21.0, 1.5, 0.1, 0.2, 18.0, 25.0, -1.0, 1.0);

        // When
        database.inSession(session -> {
            repository.updateStatistics(session, "dc1", "sensor_attribute", "temperature", statistics);
            return null;
        });

        // Then
        MeasurementAttribute attribute = load("dc1").getMeasurement("sensor_attribute", "temperature")
            .orElseThrow().getAttribute();
        assertThat(attribute.getMean()).isEqualTo(21.0);
        assertThat(attribute.getDeviation()).isEqualTo(1.5);
        assertThat(attribute.getDifferentiationDeviation()).isEqualTo(0.2);
        assertThat(attribute.getMin()).isEqualTo(18.0);
        assertThat(attribute.getDifferentiationMax()).isEqualTo(1.0);
        assertThat(attribute.getUnit()).isEqualTo("celsius");
    }

    @Test
    void updateStatistics_shouldRejectUnknownMeasurement() {
        save(TestMetadataHelper.datacenter());
        MeasurementStatistics statistics = new MeasurementStatistics(1.0, 1.0, null, null, null, null, null, null);

        assertThatThrownBy(() -> database.inSession(session -> {
            repository.updateStatistics(session, "dc1", "sensor_attribute", "pressure", statistics);
            return null;
        })).isInstanceOf(UnknownMeasurementException.class);
        assertThatThrownBy(() -> database.inSession(session -> {
            repository.updateStatistics(session, "dc1", "rack_attribute", "temperature", statistics);
            return null;
        })).isInstanceOf(UnknownMeasurementException.class);
    }
}
