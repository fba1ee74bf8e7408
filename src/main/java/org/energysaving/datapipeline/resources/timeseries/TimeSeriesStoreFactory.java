package org.energysaving.datapipeline.resources.timeseries;

import org.energysaving.datapipeline.api.timeseries.ITimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Creates the configured time-series store.
 * <p>
 * {@code backend = influx} (default) creates an {@link InfluxTimeSeriesStore} from the same
 * options; {@code backend = memory} an empty {@link InMemoryTimeSeriesStore}.
 */
public final class TimeSeriesStoreFactory {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesStoreFactory.class);

    private TimeSeriesStoreFactory() {
    }

    /**
     * Creates a store.
     *
     * @param options The {@code energysaving.timeseries} block
     * @return New store
     * @throws IllegalArgumentException if the backend is unknown
     */
    public static ITimeSeriesStore create(Config options) {
        String backend = options.hasPath("backend") ? options.getString("backend") : "influx";
        log.debug("Creating time-series store with backend '{}'", backend);
        return switch (backend) {
            case "influx" -> new InfluxTimeSeriesStore(options);
            case "memory" -> new InMemoryTimeSeriesStore();
            default -> throw new IllegalArgumentException("Unknown time-series backend: " + backend);
        };
    }
}
