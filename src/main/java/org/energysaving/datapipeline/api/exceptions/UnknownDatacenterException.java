package org.energysaving.datapipeline.api.exceptions;

/**
 * Thrown when no metadata record exists for a datacenter name.
 */
public class UnknownDatacenterException extends RecordNotExistsException {

    private final String datacenter;

    public UnknownDatacenterException(String datacenter) {
        super("datacenter " + datacenter + " does not exist");
        this.datacenter = datacenter;
    }

    public String getDatacenter() {
        return datacenter;
    }
}
