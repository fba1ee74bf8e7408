package org.energysaving.datapipeline.api.exceptions;

/**
 * Thrown when a datacenter, device type, measurement or device is referenced that the
 * metadata does not know, and strict resolution was requested.
 */
public class RecordNotExistsException extends DatabaseException {

    public RecordNotExistsException(String message) {
        super(message, null, 404);
    }
}
