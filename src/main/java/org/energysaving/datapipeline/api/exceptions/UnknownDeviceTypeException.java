package org.energysaving.datapipeline.api.exceptions;

/**
 * Thrown by strict resolution when a selected device type is absent from the datacenter metadata.
 */
public class UnknownDeviceTypeException extends RecordNotExistsException {

    private final String deviceType;

    public UnknownDeviceTypeException(String datacenter, String deviceType) {
        super("device type " + deviceType + " does not exist in datacenter " + datacenter);
        this.deviceType = deviceType;
    }

    public String getDeviceType() {
        return deviceType;
    }
}
