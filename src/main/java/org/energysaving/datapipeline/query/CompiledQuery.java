package org.energysaving.datapipeline.query;

import java.util.List;

/**
 * Query compiled for one (device type, measurement) pair of a resolved mapping.
 *
 * @param deviceType  Device-type wire name
 * @param measurement Measurement name as declared in metadata
 * @param devices     Devices the query is expected to return
 * @param query       Executable query string
 */
public record CompiledQuery(String deviceType, String measurement, List<String> devices, String query) {

    public CompiledQuery {
        devices = List.copyOf(devices);
    }
}
