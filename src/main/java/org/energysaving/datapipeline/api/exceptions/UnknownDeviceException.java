package org.energysaving.datapipeline.api.exceptions;

/**
 * Thrown by strict resolution when a selected device does not carry its (known) measurement.
 */
public class UnknownDeviceException extends RecordNotExistsException {

    private final String device;

    public UnknownDeviceException(String datacenter, String deviceType, String measurement, String device) {
        super("device " + device + " does not exist in " + deviceType + "/" + measurement
            + " of datacenter " + datacenter);
        this.device = device;
    }

    public String getDevice() {
        return device;
    }
}
