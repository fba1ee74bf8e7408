package org.energysaving.datapipeline.resources.database;

import java.sql.Connection;
import java.sql.SQLException;

import org.energysaving.datapipeline.api.exceptions.DatabaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * H2 metadata store using HikariCP for connection pooling.
 * <p>
 * Transactions are explicit: {@link #inSession(SessionWork)} opens a connection, runs the work,
 * commits on success, rolls back on failure and closes. Failures are re-raised as
 * {@link DatabaseException} unless they already are one.
 * <p>
 * <strong>Configuration:</strong>
 * <ul>
 *   <li>{@code jdbcUrl} (required)</li>
 *   <li>{@code username} (default {@code sa}), {@code password} (default empty)</li>
 *   <li>{@code maxPoolSize} (default 10), {@code minIdle} (default 1)</li>
 * </ul>
 */
public class H2MetadataDatabase implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(H2MetadataDatabase.class);

    private final String name;
    private final HikariDataSource dataSource;

    /**
     * Opens the pool and creates missing tables.
     *
     * @param name    Pool name for logging
     * @param options Database configuration
     * @throws DatabaseException if the database cannot be opened or the schema cannot be created
     */
    public H2MetadataDatabase(String name, Config options) {
        this.name = name;
        if (!options.hasPath("jdbcUrl")) {
            throw new IllegalArgumentException("'jdbcUrl' must be configured for the metadata database.");
        }
        final String jdbcUrl = options.getString("jdbcUrl");

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 10);
        hikariConfig.setMinimumIdle(options.hasPath("minIdle") ? options.getInt("minIdle") : 1);
        hikariConfig.setUsername(options.hasPath("username") ? options.getString("username") : "sa");
        hikariConfig.setPassword(options.hasPath("password") ? options.getString("password") : "");
        hikariConfig.setAutoCommit(false);
        hikariConfig.setPoolName(name);

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
        } catch (RuntimeException e) {
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            String errorMsg = String.format("Failed to initialize metadata database '%s': %s. Database: %s",
                name, cause.getMessage(), jdbcUrl);
            log.error(errorMsg);
            throw new DatabaseException(errorMsg, e);
        }
        log.debug("Metadata database '{}' connection pool started (max={})", name, hikariConfig.getMaximumPoolSize());

        inSession(session -> {
            MetadataSchema.create(session.connection());
            return null;
        });
    }

    /**
     * Runs work in a new top-level transaction.
     *
     * @param work Work to run
     * @param <T>  Result type
     * @return The work's result
     * @throws DatabaseException if the work or the transaction fails
     */
    public <T> T inSession(SessionWork<T> work) {
        Connection connection;
        try {
            connection = dataSource.getConnection();
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            throw new DatabaseException("Failed to open session on '" + name + "': " + e.getMessage(), e);
        }
        MetadataSession session = new MetadataSession(connection);
        try {
            T result = work.execute(session);
            connection.commit();
            return result;
        } catch (Exception e) {
            rollback(connection);
            throw wrap(e);
        } finally {
            session.close();
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("Failed to close metadata connection on '{}': {}", name, e.getMessage());
            }
        }
    }

    /**
     * Runs work inside an existing session or a new one.
     * <p>
     * Without a parent this is {@link #inSession(SessionWork)}. With a parent, the work joins the
     * parent's transaction if {@code allowNested} is set; only the outermost scope commits or
     * rolls back.
     *
     * @param parent      Enclosing session, or null
     * @param allowNested Whether joining an enclosing session is permitted
     * @param work        Work to run
     * @param <T>         Result type
     * @return The work's result
     * @throws DatabaseException if nesting is not allowed, or the work fails
     */
    public <T> T inSession(MetadataSession parent, boolean allowNested, SessionWork<T> work) {
        if (parent == null || parent.isClosed()) {
            return inSession(work);
        }
        if (!allowNested) {
            throw new DatabaseException("session already exists");
        }
        try {
            return work.execute(parent.nested());
        } catch (Exception e) {
            throw wrap(e);
        }
    }

    public String getName() {
        return name;
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.debug("Metadata database '{}' connection pool closed", name);
        }
    }

    private void rollback(Connection connection) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed on '{}': {}", name, e.getMessage());
        }
    }

    private static DatabaseException wrap(Exception e) {
        if (e instanceof DatabaseException) {
            return (DatabaseException) e;
        }
        return new DatabaseException(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
    }
}
