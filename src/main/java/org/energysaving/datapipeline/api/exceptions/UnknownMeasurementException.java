package org.energysaving.datapipeline.api.exceptions;

/**
 * Thrown by strict resolution when a selected measurement is absent from its (known) device type.
 */
public class UnknownMeasurementException extends RecordNotExistsException {

    private final String deviceType;
    private final String measurement;

    public UnknownMeasurementException(String datacenter, String deviceType, String measurement) {
        super("measurement " + measurement + " does not exist in device type " + deviceType
            + " of datacenter " + datacenter);
        this.deviceType = deviceType;
        this.measurement = measurement;
    }

    public String getDeviceType() {
        return deviceType;
    }

    public String getMeasurement() {
        return measurement;
    }
}
