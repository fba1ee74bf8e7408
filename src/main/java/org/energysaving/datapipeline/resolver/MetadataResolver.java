package org.energysaving.datapipeline.resolver;

import java.util.List;
import java.util.Map;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;
import org.energysaving.datapipeline.api.exceptions.UnknownDeviceException;
import org.energysaving.datapipeline.api.exceptions.UnknownDeviceTypeException;
import org.energysaving.datapipeline.api.exceptions.UnknownMeasurementException;
import org.energysaving.datapipeline.api.metadata.DatacenterMetadata;
import org.energysaving.datapipeline.api.metadata.DeviceTypeMapping;
import org.energysaving.datapipeline.api.metadata.DeviceTypeMetadata;
import org.energysaving.datapipeline.api.metadata.MeasurementMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands a {@link Selection} against datacenter metadata into a concrete {@link DeviceTypeMapping}.
 * <p>
 * In strict mode every selected name must exist at its level; otherwise unknown names are
 * logged and skipped. Devices always come from the metadata's device lists. Device types without
 * resolved measurements and measurements without resolved devices are left out of the result.
 * <p>
 * Stateless and thread-safe.
 */
public class MetadataResolver {

    private static final Logger log = LoggerFactory.getLogger(MetadataResolver.class);

    /**
     * Resolves a selection in strict mode.
     *
     * @param selection Device-type level selection
     * @param metadata  Datacenter snapshot
     * @return Resolved mapping
     * @throws org.energysaving.datapipeline.api.exceptions.RecordNotExistsException if a selected name is unknown
     */
    public DeviceTypeMapping resolve(Selection selection, DatacenterMetadata metadata) {
        return resolve(selection, metadata, true);
    }

    /**
     * Resolves a selection.
     *
     * @param selection Device-type level selection
     * @param metadata  Datacenter snapshot
     * @param strict    Whether unknown names fail instead of being skipped
     * @return Resolved mapping
     * @throws org.energysaving.datapipeline.api.exceptions.RecordNotExistsException if strict and a selected name is unknown
     * @throws InvalidParameterException if the selection nests below the device level
     */
    public DeviceTypeMapping resolve(Selection selection, DatacenterMetadata metadata, boolean strict) {
        DeviceTypeMapping mapping = new DeviceTypeMapping();
        Map<String, DeviceTypeMetadata> deviceTypes = metadata.getDeviceTypes();
        List<String> selected = selection.isAll() ? List.copyOf(deviceTypes.keySet()) : selection.getNames();
        for (String deviceType : selected) {
            DeviceTypeMetadata deviceTypeMetadata = deviceTypes.get(deviceType);
            if (deviceTypeMetadata == null) {
                if (strict) {
                    throw new UnknownDeviceTypeException(metadata.getName(), deviceType);
                }
                log.warn("Skipping unknown device type {} in datacenter {}", deviceType, metadata.getName());
                continue;
            }
            resolveMeasurements(mapping, metadata.getName(), deviceType, deviceTypeMetadata,
                selection.child(deviceType), strict);
        }
        log.debug("Resolved selection {} in datacenter {} to {}", selection, metadata.getName(), mapping);
        return mapping;
    }

    private void resolveMeasurements(DeviceTypeMapping mapping, String datacenter, String deviceType,
                                     DeviceTypeMetadata deviceTypeMetadata, Selection selection, boolean strict) {
        Map<String, MeasurementMetadata> measurements = deviceTypeMetadata.getMeasurements();
        List<String> selected = selection.isAll() ? List.copyOf(measurements.keySet()) : selection.getNames();
        for (String measurement : selected) {
            MeasurementMetadata measurementMetadata = measurements.get(measurement);
            if (measurementMetadata == null) {
                if (strict) {
                    throw new UnknownMeasurementException(datacenter, deviceType, measurement);
                }
                log.warn("Skipping unknown measurement {}/{} in datacenter {}", deviceType, measurement, datacenter);
                continue;
            }
            resolveDevices(mapping, datacenter, deviceType, measurement, measurementMetadata,
                selection.child(measurement), strict);
        }
    }

    private void resolveDevices(DeviceTypeMapping mapping, String datacenter, String deviceType, String measurement,
                                MeasurementMetadata measurementMetadata, Selection selection, boolean strict) {
        if (selection.getKind() == Selection.Kind.MAPPING) {
            throw new InvalidParameterException("device selection for " + deviceType + "/" + measurement
                + " must be a name or a list of names, got " + selection);
        }
        if (selection.isAll()) {
            mapping.addAll(deviceType, measurement, measurementMetadata.getDevices());
            return;
        }
        for (String device : selection.getNames()) {
            if (!measurementMetadata.hasDevice(device)) {
                if (strict) {
                    throw new UnknownDeviceException(datacenter, deviceType, measurement, device);
                }
                log.warn("Skipping unknown device {} of {}/{} in datacenter {}", device, deviceType, measurement, datacenter);
                continue;
            }
            mapping.add(deviceType, measurement, device);
        }
    }
}
