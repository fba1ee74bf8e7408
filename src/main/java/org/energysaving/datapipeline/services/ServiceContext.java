package org.energysaving.datapipeline.services;

import java.nio.file.Path;

import org.energysaving.datapipeline.api.timeseries.ITimeSeriesStore;
import org.energysaving.datapipeline.api.timeseries.TimePrecision;
import org.energysaving.datapipeline.models.ModelManager;
import org.energysaving.datapipeline.resources.database.H2MetadataDatabase;
import org.energysaving.datapipeline.resources.database.MetadataRepository;
import org.energysaving.datapipeline.resources.timeseries.TimeSeriesStoreFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Wires the services from the {@code energysaving} configuration block.
 * <p>
 * One context per CLI invocation; closing it shuts down the metadata connection pool.
 */
public final class ServiceContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServiceContext.class);

    public static final String ROOT_PATH = "energysaving";

    private final H2MetadataDatabase database;
    private final ITimeSeriesStore store;
    private final MetadataService metadataService;
    private final TimeSeriesService timeSeriesService;
    private final StatisticsRefresher statisticsRefresher;
    private final ModelManager modelManager;
    private final TimePrecision defaultPrecision;
    private final boolean debug;

    private ServiceContext(H2MetadataDatabase database, ITimeSeriesStore store, Path modelDirectory,
                           TimePrecision defaultPrecision, boolean debug) {
        this.database = database;
        this.store = store;
        this.metadataService = new MetadataService(database, new MetadataRepository());
        this.timeSeriesService = new TimeSeriesService(metadataService, store);
        this.statisticsRefresher = new StatisticsRefresher(metadataService, timeSeriesService);
        this.modelManager = new ModelManager(metadataService, timeSeriesService, modelDirectory);
        this.defaultPrecision = defaultPrecision;
        this.debug = debug;
    }

    /**
     * Creates the services.
     *
     * @param config Application configuration containing the {@code energysaving} block
     * @return Context owning the metadata database
     * @throws IllegalArgumentException if a required setting is missing
     */
    public static ServiceContext create(Config config) {
        if (!config.hasPath(ROOT_PATH)) {
            throw new IllegalArgumentException("Configuration has no '" + ROOT_PATH + "' block");
        }
        Config root = config.getConfig(ROOT_PATH);
        Config timeseries = root.getConfig("timeseries");
        ITimeSeriesStore store = TimeSeriesStoreFactory.create(timeseries);
        Path modelDirectory = Path.of(root.hasPath("models.directory") ? root.getString("models.directory") : "models");
        TimePrecision precision = TimePrecision.fromCode(
            timeseries.hasPath("precision") ? timeseries.getString("precision") : "s");
        boolean debug = root.hasPath("debug") && root.getBoolean("debug");
        H2MetadataDatabase database = new H2MetadataDatabase("metadata", root.getConfig("database"));
        log.debug("Service context created (models: {}, precision: {}, debug: {})", modelDirectory, precision, debug);
        return new ServiceContext(database, store, modelDirectory, precision, debug);
    }

    public ITimeSeriesStore getStore() {
        return store;
    }

    public MetadataService getMetadataService() {
        return metadataService;
    }

    public TimeSeriesService getTimeSeriesService() {
        return timeSeriesService;
    }

    public StatisticsRefresher getStatisticsRefresher() {
        return statisticsRefresher;
    }

    public ModelManager getModelManager() {
        return modelManager;
    }

    public TimePrecision getDefaultPrecision() {
        return defaultPrecision;
    }

    public boolean isDebug() {
        return debug;
    }

    @Override
    public void close() {
        database.close();
    }
}
