package org.energysaving.datapipeline.resources.database;

import java.sql.SQLException;

/**
 * Work executed inside a metadata session.
 *
 * @param <T> Result type
 */
@FunctionalInterface
public interface SessionWork<T> {

    T execute(MetadataSession session) throws SQLException;
}
