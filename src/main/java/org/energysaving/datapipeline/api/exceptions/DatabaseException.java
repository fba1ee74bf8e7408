package org.energysaving.datapipeline.api.exceptions;

/**
 * Base class of the core's error taxonomy.
 * <p>
 * Also used directly to wrap failures of the underlying stores (relational metadata store,
 * time-series store) with the original message attached, so callers never see
 * store-specific exceptions.
 * <p>
 * Each subclass carries the status code a request/response layer reports for it.
 */
public class DatabaseException extends RuntimeException {

    private final int statusCode;

    /**
     * Creates a DatabaseException with the specified message.
     *
     * @param message Description of the failure
     */
    public DatabaseException(String message) {
        this(message, null, 400);
    }

    /**
     * Creates a DatabaseException wrapping an underlying store failure.
     *
     * @param message Description of the failure
     * @param cause   The store exception
     */
    public DatabaseException(String message, Throwable cause) {
        this(message, cause, 400);
    }

    protected DatabaseException(String message, Throwable cause, int statusCode) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * Returns the status code to report for this error.
     *
     * @return HTTP-style status code
     */
    public int getStatusCode() {
        return statusCode;
    }
}
