package org.energysaving.datapipeline.models;

import java.util.List;
import java.util.function.Function;

import org.energysaving.datapipeline.api.metadata.DatacenterMetadata;
import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.nodes.NodeArena;
import org.energysaving.datapipeline.nodes.NodeSet;

/**
 * Everything a model type strategy sees while building its node set.
 *
 * @param metadata       Datacenter snapshot
 * @param arena          Arena holding the simple nodes of the raw inputs and outputs
 * @param inputs         Raw input keys, registered in {@code arena}
 * @param outputs        Raw output keys, registered in {@code arena}
 * @param componentNodes Node set of another model type of the same datacenter, built on demand
 */
public record ModelBuildContext(
    DatacenterMetadata metadata,
    NodeArena arena,
    List<SeriesKey> inputs,
    List<SeriesKey> outputs,
    Function<ModelTypeKind, NodeSet> componentNodes
) {
}
