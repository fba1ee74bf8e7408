package org.energysaving.datapipeline.resources.database;

import java.sql.Connection;

import org.energysaving.datapipeline.api.exceptions.DatabaseException;

/**
 * Transactional scope on the metadata store.
 * <p>
 * Obtained from {@link H2MetadataDatabase#inSession}; valid only inside the work block that
 * received it. A nested scope shares its parent's connection and transaction and never commits.
 */
public final class MetadataSession {

    private final Connection connection;
    private final int depth;
    private boolean closed;

    MetadataSession(Connection connection) {
        this(connection, 0);
    }

    private MetadataSession(Connection connection, int depth) {
        this.connection = connection;
        this.depth = depth;
    }

    /**
     * Returns the connection of the enclosing transaction.
     *
     * @return Open connection with auto-commit disabled
     * @throws DatabaseException if the session's scope has ended
     */
    public Connection connection() {
        if (closed) {
            throw new DatabaseException("session is already closed");
        }
        return connection;
    }

    /**
     * Returns true for the outermost scope, the only one that commits or rolls back.
     *
     * @return true if not nested
     */
    public boolean isOutermost() {
        return depth == 0;
    }

    public int getDepth() {
        return depth;
    }

    public boolean isClosed() {
        return closed;
    }

    MetadataSession nested() {
        connection();
        return new MetadataSession(connection, depth + 1);
    }

    void close() {
        closed = true;
    }
}
