package org.energysaving.datapipeline.resources.database;

import java.lang.reflect.Type;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.energysaving.datapipeline.api.exceptions.UnknownDatacenterException;
import org.energysaving.datapipeline.api.exceptions.UnknownMeasurementException;
import org.energysaving.datapipeline.api.metadata.DatacenterMetadata;
import org.energysaving.datapipeline.api.metadata.DeviceType;
import org.energysaving.datapipeline.api.metadata.DeviceTypeMetadata;
import org.energysaving.datapipeline.api.metadata.MeasurementAttribute;
import org.energysaving.datapipeline.api.metadata.MeasurementMetadata;
import org.energysaving.datapipeline.api.metadata.MeasurementStatistics;
import org.energysaving.datapipeline.api.metadata.MeasurementType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;

/**
 * Reads and writes datacenter metadata through a {@link MetadataSession}.
 * <p>
 * Every method takes the session explicitly; none opens its own transaction.
 */
public class MetadataRepository {

    private static final Logger log = LoggerFactory.getLogger(MetadataRepository.class);

    private static final Type STRING_MAP = new TypeToken<LinkedHashMap<String, String>>() { }.getType();
    private static final Type OBJECT_MAP = new TypeToken<LinkedHashMap<String, Object>>() { }.getType();

    private final Gson gson = new Gson();

    /**
     * Lists datacenter names.
     *
     * @param session Open session
     * @return Names in alphabetical order
     * @throws SQLException on database failure
     */
    public List<String> listDatacenters(MetadataSession session) throws SQLException {
        List<String> names = new ArrayList<>();
        try (PreparedStatement stmt = session.connection().prepareStatement(
                "SELECT name FROM " + MetadataSchema.DATACENTER_TABLE + " ORDER BY name");
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                names.add(rs.getString(1));
            }
        }
        return names;
    }

    /**
     * Reads the metadata snapshot of all datacenters.
     *
     * @param session Open session
     * @return Datacenter name to snapshot
     * @throws SQLException on database failure
     */
    public Map<String, DatacenterMetadata> getMetadata(MetadataSession session) throws SQLException {
        Map<String, DatacenterMetadata> result = new LinkedHashMap<>();
        for (String name : listDatacenters(session)) {
            result.put(name, getDatacenterMetadata(session, name));
        }
        return result;
    }

    /**
     * Reads the metadata snapshot of one datacenter.
     *
     * @param session    Open session
     * @param datacenter Datacenter name
     * @return Snapshot
     * @throws UnknownDatacenterException if the datacenter does not exist
     * @throws SQLException on database failure
     */
    public DatacenterMetadata getDatacenterMetadata(MetadataSession session, String datacenter) throws SQLException {
        Connection conn = session.connection();
        DatacenterMetadata.Builder builder;
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT time_interval, properties, models FROM " + MetadataSchema.DATACENTER_TABLE + " WHERE name = ?")) {
            stmt.setString(1, datacenter);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new UnknownDatacenterException(datacenter);
                }
                builder = DatacenterMetadata.builder(datacenter)
                    .timeInterval(rs.getInt("time_interval"));
                Map<String, Object> properties = parseJson(rs.getString("properties"), OBJECT_MAP);
                Map<String, String> models = parseJson(rs.getString("models"), STRING_MAP);
                builder.properties(properties).models(models);
            }
        }
        for (DeviceType type : DeviceType.values()) {
            DeviceTypeMetadata deviceTypeMetadata = readDeviceType(conn, datacenter, type);
            if (!deviceTypeMetadata.getMeasurements().isEmpty()) {
                builder.deviceType(type, deviceTypeMetadata);
            }
        }
        return builder.build();
    }

    /**
     * Creates or replaces a datacenter with all its devices, attributes and links.
     *
     * @param session  Open session
     * @param metadata Complete snapshot to store
     * @throws SQLException on database failure
     */
    public void saveDatacenter(MetadataSession session, DatacenterMetadata metadata) throws SQLException {
        Connection conn = session.connection();
        deleteDatacenter(session, metadata.getName());
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO " + MetadataSchema.DATACENTER_TABLE
                    + " (name, time_interval, properties, models) VALUES (?, ?, ?, ?)")) {
            stmt.setString(1, metadata.getName());
            stmt.setInt(2, metadata.getTimeInterval());
            stmt.setString(3, gson.toJson(metadata.getProperties()));
            stmt.setString(4, gson.toJson(metadata.getModels()));
            stmt.executeUpdate();
        }
        Map<String, List<String>> devicesByTable = new LinkedHashMap<>();
        metadata.getDeviceTypes().forEach((deviceType, deviceTypeMetadata) -> {
            DeviceType type = DeviceType.fromWireName(deviceType).orElseThrow();
            List<String> devices = devicesByTable.computeIfAbsent(type.getDeviceTable(), k -> new ArrayList<>());
            deviceTypeMetadata.getMeasurements().values().forEach(m -> m.getDevices().forEach(device -> {
                if (!devices.contains(device)) {
                    devices.add(device);
                }
            }));
        });
        for (Map.Entry<String, List<String>> entry : devicesByTable.entrySet()) {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "INSERT INTO " + entry.getKey() + " (datacenter_name, name) VALUES (?, ?)")) {
                for (String device : entry.getValue()) {
                    stmt.setString(1, metadata.getName());
                    stmt.setString(2, device);
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
        }
        for (Map.Entry<String, DeviceTypeMetadata> entry : metadata.getDeviceTypes().entrySet()) {
            DeviceType type = DeviceType.fromWireName(entry.getKey()).orElseThrow();
            for (Map.Entry<String, MeasurementMetadata> measurement : entry.getValue().getMeasurements().entrySet()) {
                insertAttribute(conn, metadata.getName(), type, measurement.getKey(), measurement.getValue());
            }
        }
        log.debug("Saved metadata of datacenter {}", metadata.getName());
    }

    /**
     * Deletes a datacenter and, by cascade, everything scoped to it.
     *
     * @param session    Open session
     * @param datacenter Datacenter name
     * @return true if the datacenter existed
     * @throws SQLException on database failure
     */
    public boolean deleteDatacenter(MetadataSession session, String datacenter) throws SQLException {
        try (PreparedStatement stmt = session.connection().prepareStatement(
                "DELETE FROM " + MetadataSchema.DATACENTER_TABLE + " WHERE name = ?")) {
            stmt.setString(1, datacenter);
            return stmt.executeUpdate() > 0;
        }
    }

    /**
     * Stores refreshed statistics of one measurement.
     *
     * @param session     Open session
     * @param datacenter  Datacenter name
     * @param deviceType  Device-type wire name
     * @param measurement Measurement name
     * @param statistics  New statistics
     * @throws UnknownMeasurementException if the measurement does not exist
     * @throws SQLException on database failure
     */
    public void updateStatistics(MetadataSession session, String datacenter, String deviceType, String measurement,
                                 MeasurementStatistics statistics) throws SQLException {
        DeviceType type = DeviceType.fromWireName(deviceType)
            .orElseThrow(() -> new UnknownMeasurementException(datacenter, deviceType, measurement));
        try (PreparedStatement stmt = session.connection().prepareStatement(
                "UPDATE " + type.getAttributeTable() + " SET mean = ?, deviation = ?, differentiation_mean = ?, "
                    + "differentiation_deviation = ?, min_value = ?, max_value = ?, differentiation_min = ?, "
                    + "differentiation_max = ? WHERE datacenter_name = ? AND name = ?")) {
            setDouble(stmt, 1, statistics.mean());
            setDouble(stmt, 2, statistics.deviation());
            setDouble(stmt, 3, statistics.differentiationMean());
            setDouble(stmt, 4, statistics.differentiationDeviation());
            setDouble(stmt, 5, statistics.min());
            setDouble(stmt, 6, statistics.max());
            setDouble(stmt, 7, statistics.differentiationMin());
            setDouble(stmt, 8, statistics.differentiationMax());
            stmt.setString(9, datacenter);
            stmt.setString(10, measurement);
            if (stmt.executeUpdate() == 0) {
                throw new UnknownMeasurementException(datacenter, deviceType, measurement);
            }
        }
    }

    private DeviceTypeMetadata readDeviceType(Connection conn, String datacenter, DeviceType type) throws SQLException {
        Map<String, MeasurementAttribute> attributes = new LinkedHashMap<>();
        Map<String, List<String>> devices = new LinkedHashMap<>();
        String sql = "SELECT a.name, a.type, a.unit, a.mean, a.deviation, a.differentiation_mean, "
            + "a.differentiation_deviation, a.max_value, a.min_value, a.differentiation_max, a.differentiation_min, "
            + "a.pattern, d." + type.getDeviceColumn() + " AS device "
            + "FROM " + type.getAttributeTable() + " a "
            + "LEFT JOIN " + type.getDataTable() + " d "
            + "ON d.datacenter_name = a.datacenter_name AND d." + MetadataSchema.ATTRIBUTE_COLUMN + " = a.name "
            + "WHERE a.datacenter_name = ? ORDER BY a.id, d.id";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, datacenter);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String name = rs.getString("name");
                    if (!attributes.containsKey(name)) {
                        attributes.put(name, MeasurementAttribute.builder()
                            .type(MeasurementType.fromWireName(rs.getString("type")))
                            .unit(rs.getString("unit"))
                            .mean(getDouble(rs, "mean"))
                            .deviation(getDouble(rs, "deviation"))
                            .differentiationMean(getDouble(rs, "differentiation_mean"))
                            .differentiationDeviation(getDouble(rs, "differentiation_deviation"))
                            .max(getDouble(rs, "max_value"))
                            .min(getDouble(rs, "min_value"))
                            .differentiationMax(getDouble(rs, "differentiation_max"))
                            .differentiationMin(getDouble(rs, "differentiation_min"))
                            .pattern(rs.getString("pattern"))
                            .build());
                        devices.put(name, new ArrayList<>());
                    }
                    String device = rs.getString("device");
                    if (device != null) {
                        devices.get(name).add(device);
                    }
                }
            }
        }
        Map<String, MeasurementMetadata> measurements = new LinkedHashMap<>();
        attributes.forEach((name, attribute) -> measurements.put(name, new MeasurementMetadata(devices.get(name), attribute)));
        return new DeviceTypeMetadata(measurements);
    }

    private void insertAttribute(Connection conn, String datacenter, DeviceType type, String name,
                                 MeasurementMetadata metadata) throws SQLException {
        MeasurementAttribute attribute = metadata.getAttribute();
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO " + type.getAttributeTable() + " (datacenter_name, name, type, unit, mean, deviation, "
                    + "differentiation_mean, differentiation_deviation, max_value, min_value, differentiation_max, "
                    + "differentiation_min, pattern) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            stmt.setString(1, datacenter);
            stmt.setString(2, name);
            stmt.setString(3, attribute.getType().getWireName());
            stmt.setString(4, attribute.getUnit());
            setDouble(stmt, 5, attribute.getMean());
            setDouble(stmt, 6, attribute.getDeviation());
            setDouble(stmt, 7, attribute.getDifferentiationMean());
            setDouble(stmt, 8, attribute.getDifferentiationDeviation());
            setDouble(stmt, 9, attribute.getMax());
            setDouble(stmt, 10, attribute.getMin());
            setDouble(stmt, 11, attribute.getDifferentiationMax());
            setDouble(stmt, 12, attribute.getDifferentiationMin());
            stmt.setString(13, attribute.getPattern());
            stmt.executeUpdate();
        }
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO " + type.getDataTable() + " (datacenter_name, " + MetadataSchema.ATTRIBUTE_COLUMN + ", "
                    + type.getDeviceColumn() + ") VALUES (?, ?, ?)")) {
            for (String device : metadata.getDevices()) {
                stmt.setString(1, datacenter);
                stmt.setString(2, name);
                stmt.setString(3, device);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private <T> T parseJson(String json, Type type) {
        if (json == null || json.isBlank()) {
            return gson.fromJson("{}", type);
        }
        return gson.fromJson(json, type);
    }

    private static Double getDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static void setDouble(PreparedStatement stmt, int index, Double value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.DOUBLE);
        } else {
            stmt.setDouble(index, value);
        }
    }
}
