package org.energysaving.datapipeline;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.energysaving.datapipeline.api.metadata.DatacenterMetadata;
import org.energysaving.datapipeline.api.metadata.DeviceType;
import org.energysaving.datapipeline.api.metadata.MeasurementAttribute;
import org.energysaving.datapipeline.api.metadata.MeasurementMetadata;
import org.energysaving.datapipeline.api.metadata.MeasurementType;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Builds the datacenter snapshot shared by the tests.
 * <p>
 * {@code dc1}, 60 s interval:
 * <ul>
 *   <li>sensor_attribute/temperature: s1, s2 (celsius, mean 20, deviation 2)</li>
 *   <li>sensor_attribute/humidity: s1 (percent, mean 50, deviation 5)</li>
 *   <li>sensor_attribute/door_open: s1 (binary)</li>
 *   <li>controller_attribute/fan_speed: c1 (rpm, mean 1000, deviation 100)</li>
 *   <li>controller_parameter/setpoint: c1 (celsius, mean 22, deviation 1, range 18..26)</li>
 *   <li>power_supply_attribute/power: p1, p2 (kW, mean 10, deviation 1)</li>
 *   <li>environment_sensor_attribute/state: e1 (discrete)</li>
 * </ul>
 */
public final class TestMetadataHelper {

    public static final String DATACENTER = "dc1";

    private TestMetadataHelper() {
    }

    public static DatacenterMetadata datacenter() {
        return builder().build();
    }

    public static DatacenterMetadata.Builder builder() {
        return DatacenterMetadata.builder(DATACENTER)
            .timeInterval(60)
            .measurement(DeviceType.SENSOR_ATTRIBUTE, "temperature", continuous(List.of("s1", "s2"), "celsius", 20.0, 2.0))
            .measurement(DeviceType.SENSOR_ATTRIBUTE, "humidity", continuous(List.of("s1"), "percent", 50.0, 5.0))
            .measurement(DeviceType.SENSOR_ATTRIBUTE, "door_open", new MeasurementMetadata(List.of("s1"),
                MeasurementAttribute.builder().type(MeasurementType.BINARY).build()))
            .measurement(DeviceType.CONTROLLER_ATTRIBUTE, "fan_speed", continuous(List.of("c1"), "rpm", 1000.0, 100.0))
            .measurement(DeviceType.CONTROLLER_PARAMETER, "setpoint", new MeasurementMetadata(List.of("c1"),
                MeasurementAttribute.builder().type(MeasurementType.CONTINUOUS).unit("celsius")
                    .mean(22.0).deviation(1.0).min(18.0).max(26.0).build()))
            .measurement(DeviceType.POWER_SUPPLY_ATTRIBUTE, "power", continuous(List.of("p1", "p2"), "kW", 10.0, 1.0))
            .measurement(DeviceType.ENVIRONMENT_SENSOR_ATTRIBUTE, "state", new MeasurementMetadata(List.of("e1"),
                MeasurementAttribute.builder().type(MeasurementType.DISCRETE).build()));
    }

    public static MeasurementMetadata continuous(List<String> devices, String unit, Double mean, Double deviation) {
        return new MeasurementMetadata(devices, MeasurementAttribute.builder()
            .type(MeasurementType.CONTINUOUS)
            .unit(unit)
            .mean(mean)
            .deviation(deviation)
            .build());
    }

    /**
     * Returns the options of a private in-memory metadata database.
     */
    public static Config inMemoryDatabaseConfig() {
        return ConfigFactory.parseMap(Map.of(
            "jdbcUrl", "jdbc:h2:mem:metadata-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
            "maxPoolSize", 2));
    }
}
