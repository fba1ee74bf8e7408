package org.energysaving.datapipeline.api.exceptions;

/**
 * Thrown when the time-series store answers with a payload of unexpected shape.
 */
public class InvalidResponseException extends DatabaseException {

    public InvalidResponseException(String message) {
        super(message, null, 400);
    }

    public InvalidResponseException(String message, Throwable cause) {
        super(message, cause, 400);
    }
}
