package org.energysaving.datapipeline.services;

import java.util.List;

import org.energysaving.datapipeline.api.exceptions.UnknownDatacenterException;
import org.energysaving.datapipeline.api.metadata.DatacenterMetadata;
import org.energysaving.datapipeline.resources.database.H2MetadataDatabase;
import org.energysaving.datapipeline.resources.database.MetadataRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session-scoped access to datacenter metadata. Every call reads or writes in its own transaction.
 */
public class MetadataService {

    private static final Logger log = LoggerFactory.getLogger(MetadataService.class);

    private final H2MetadataDatabase database;
    private final MetadataRepository repository;

    public MetadataService(H2MetadataDatabase database, MetadataRepository repository) {
        this.database = database;
        this.repository = repository;
    }

    /**
     * Reads a fresh snapshot of one datacenter.
     *
     * @param datacenter Datacenter name
     * @return Snapshot
     * @throws UnknownDatacenterException if the datacenter does not exist
     */
    public DatacenterMetadata getMetadata(String datacenter) {
        return database.inSession(session -> repository.getDatacenterMetadata(session, datacenter));
    }

    public List<String> listDatacenters() {
        return database.inSession(repository::listDatacenters);
    }

    /**
     * Creates or replaces a datacenter.
     *
     * @param metadata Complete snapshot
     */
    public void saveDatacenter(DatacenterMetadata metadata) {
        database.inSession(session -> {
            repository.saveDatacenter(session, metadata);
            return null;
        });
        log.info("Saved metadata of datacenter '{}'", metadata.getName());
    }

    /**
     * Deletes a datacenter with everything scoped to it.
     *
     * @param datacenter Datacenter name
     * @throws UnknownDatacenterException if the datacenter does not exist
     */
    public void deleteDatacenter(String datacenter) {
        boolean deleted = database.inSession(session -> repository.deleteDatacenter(session, datacenter));
        if (!deleted) {
            throw new UnknownDatacenterException(datacenter);
        }
        log.info("Deleted datacenter '{}'", datacenter);
    }

    public H2MetadataDatabase getDatabase() {
        return database;
    }

    public MetadataRepository getRepository() {
        return repository;
    }
}
