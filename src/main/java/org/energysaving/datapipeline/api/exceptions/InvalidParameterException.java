package org.energysaving.datapipeline.api.exceptions;

/**
 * Thrown when input has the wrong shape: a value of the wrong type for a column, an
 * unparseable time literal, a selection nested too deeply.
 */
public class InvalidParameterException extends DatabaseException {

    public InvalidParameterException(String message) {
        super(message, null, 400);
    }

    public InvalidParameterException(String message, Throwable cause) {
        super(message, cause, 400);
    }
}
