package org.energysaving.datapipeline.models;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import org.energysaving.datapipeline.services.MetadataService;
import org.energysaving.datapipeline.services.TimeSeriesService;

/**
 * Hands out one {@link ModelDriver} per model type and datacenter.
 * <p>
 * Drivers of composed model types obtain their components from the same manager.
 */
public class ModelManager {

    private final MetadataService metadataService;
    private final TimeSeriesService timeSeriesService;
    private final Path modelDirectory;
    private final Map<String, ModelDriver> drivers = new HashMap<>();

    public ModelManager(MetadataService metadataService, TimeSeriesService timeSeriesService, Path modelDirectory) {
        this.metadataService = metadataService;
        this.timeSeriesService = timeSeriesService;
        this.modelDirectory = modelDirectory;
    }

    public ModelDriver getDriver(String modelType, String datacenter) {
        return getDriver(ModelTypeKind.fromName(modelType), datacenter);
    }

    public ModelDriver getDriver(ModelTypeKind type, String datacenter) {
        return drivers.computeIfAbsent(type.getName() + "/" + datacenter, key -> new ModelDriver(type, datacenter,
            metadataService, timeSeriesService, modelDirectory, component -> getDriver(component, datacenter)));
    }

    public Path getModelDirectory() {
        return modelDirectory;
    }
}
