package org.energysaving.datapipeline.resources.database;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.energysaving.datapipeline.api.metadata.DeviceType;

/**
 * DDL of the relational metadata store.
 * <p>
 * One {@code datacenter} table; one device table per device kind; per device-type kind one
 * attribute table and one {@code <kind>_data} join table linking attribute names to device
 * names. Every child row is scoped by {@code datacenter_name} and deleted with its datacenter.
 * The {@code id} columns only preserve insertion order.
 */
public final class MetadataSchema {

    public static final String DATACENTER_TABLE = "datacenter";
    public static final String ATTRIBUTE_COLUMN = "attribute_name";

    private MetadataSchema() {
    }

    /**
     * Returns the device tables, each listed once.
     *
     * @return Table names in device-type order
     */
    public static Set<String> deviceTables() {
        Set<String> tables = new LinkedHashSet<>();
        for (DeviceType type : DeviceType.values()) {
            tables.add(type.getDeviceTable());
        }
        return tables;
    }

    /**
     * Returns every CREATE statement, parents before children.
     *
     * @return DDL statements
     */
    public static List<String> statements() {
        List<String> statements = new ArrayList<>();
        statements.add("CREATE TABLE IF NOT EXISTS " + DATACENTER_TABLE + " ("
            + "name VARCHAR(255) PRIMARY KEY, "
            + "time_interval INT DEFAULT 60 NOT NULL, "
            + "properties CLOB, "
            + "models CLOB, "
            + "location CLOB)");
        for (String table : deviceTables()) {
            statements.add("CREATE TABLE IF NOT EXISTS " + table + " ("
                + "id BIGINT GENERATED BY DEFAULT AS IDENTITY, "
                + "datacenter_name VARCHAR(255) NOT NULL, "
                + "name VARCHAR(255) NOT NULL, "
                + "properties CLOB, "
                + "PRIMARY KEY (datacenter_name, name), "
                + "FOREIGN KEY (datacenter_name) REFERENCES " + DATACENTER_TABLE + "(name) ON DELETE CASCADE)");
        }
        for (DeviceType type : DeviceType.values()) {
            statements.add("CREATE TABLE IF NOT EXISTS " + type.getAttributeTable() + " ("
                + "id BIGINT GENERATED BY DEFAULT AS IDENTITY, "
                + "datacenter_name VARCHAR(255) NOT NULL, "
                + "name VARCHAR(255) NOT NULL, "
                + "type VARCHAR(32) DEFAULT 'continuous' NOT NULL, "
                + "unit VARCHAR(64), "
                + "mean DOUBLE PRECISION, "
                + "deviation DOUBLE PRECISION, "
                + "differentiation_mean DOUBLE PRECISION, "
                + "differentiation_deviation DOUBLE PRECISION, "
                + "max_value DOUBLE PRECISION, "
                + "min_value DOUBLE PRECISION, "
                + "differentiation_max DOUBLE PRECISION, "
                + "differentiation_min DOUBLE PRECISION, "
                + "pattern VARCHAR(255), "
                + "PRIMARY KEY (datacenter_name, name), "
                + "FOREIGN KEY (datacenter_name) REFERENCES " + DATACENTER_TABLE + "(name) ON DELETE CASCADE)");
            statements.add("CREATE TABLE IF NOT EXISTS " + type.getDataTable() + " ("
                + "id BIGINT GENERATED BY DEFAULT AS IDENTITY, "
                + "datacenter_name VARCHAR(255) NOT NULL, "
                + ATTRIBUTE_COLUMN + " VARCHAR(255) NOT NULL, "
                + type.getDeviceColumn() + " VARCHAR(255) NOT NULL, "
                + "PRIMARY KEY (datacenter_name, " + ATTRIBUTE_COLUMN + ", " + type.getDeviceColumn() + "), "
                + "FOREIGN KEY (datacenter_name, " + ATTRIBUTE_COLUMN + ") REFERENCES "
                + type.getAttributeTable() + "(datacenter_name, name) ON DELETE CASCADE, "
                + "FOREIGN KEY (datacenter_name, " + type.getDeviceColumn() + ") REFERENCES "
                + type.getDeviceTable() + "(datacenter_name, name) ON DELETE CASCADE)");
        }
        return statements;
    }

    /**
     * Creates all tables that do not exist yet.
     *
     * @param connection Open connection
     * @throws SQLException if a statement fails
     */
    public static void create(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            for (String ddl : statements()) {
                statement.execute(ddl);
            }
        }
    }
}
