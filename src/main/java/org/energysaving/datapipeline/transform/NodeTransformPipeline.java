package org.energysaving.datapipeline.transform;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.TreeMap;

import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.api.timeseries.SeriesTable;
import org.energysaving.datapipeline.nodes.CompositeNode;
import org.energysaving.datapipeline.nodes.DerivedNode;
import org.energysaving.datapipeline.nodes.Node;
import org.energysaving.datapipeline.nodes.NodeSet;
import org.energysaving.datapipeline.nodes.NodeStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw series into model matrices and model output back into series.
 * <p>
 * Forward, per side: filter (project to the raw series needed) → merge (aggregate composites) →
 * transform (derive nodes from their base) → normalize (z-score) → clean (keep timestamps defined
 * in every column of both sides).
 * <p>
 * Inverse, on model output: denormalize ({@code v * (deviation + 0.1) + mean}) → detransform
 * (re-keyed to the original node) → clean.
 * <p>
 * Stateless apart from the node set; one instance per model build.
 */
public class NodeTransformPipeline {

    private static final Logger log = LoggerFactory.getLogger(NodeTransformPipeline.class);

    /** Added to the deviation on denormalize so near-zero deviations do not collapse the inverse. */
    public static final double DEVIATION_GUARD = 0.1;

    private final NodeSet nodeSet;
    private final Duration interval;
    private final TransformerRegistry transformers;

    /**
     * Creates a pipeline.
     *
     * @param nodeSet      Nodes of the model build
     * @param interval     Sampling interval of the datacenter
     * @param transformers Transformer lookup
     */
    public NodeTransformPipeline(NodeSet nodeSet, Duration interval, TransformerRegistry transformers) {
        this.nodeSet = nodeSet;
        this.interval = interval;
        this.transformers = transformers;
    }

    public NodeSet getNodeSet() {
        return nodeSet;
    }

    /**
     * Runs the forward pipeline on both sides.
     *
     * @param rawInput  Raw series for the inputs, null to skip the input side
     * @param rawOutput Raw series for the outputs, null to skip the output side
     * @return Normalized, cleaned tables keyed by the processed node keys
     * @throws IllegalStateException if a node lacks usable mean/deviation
     */
    public PipelineTables forward(SeriesTable rawInput, SeriesTable rawOutput) {
        SeriesTable input = rawInput == null ? null : forwardSide(rawInput, nodeSet.getInputs());
        SeriesTable output = rawOutput == null ? null : forwardSide(rawOutput, nodeSet.getOutputs());
        PipelineTables cleaned = clean(input, output);
        log.debug("Forward pipeline produced input {} and output {}", cleaned.input(), cleaned.output());
        return cleaned;
    }

    /**
     * Runs the inverse pipeline on model output.
     *
     * @param predictions Normalized model output keyed by output node keys
     * @return Denormalized series keyed by original node keys, without missing rows
     */
    public SeriesTable inverse(SeriesTable predictions) {
        List<SeriesKey> keys = presentKeys(predictions, nodeSet.getOutputs());
        SeriesTable denormalized = denormalize(predictions, keys);
        SeriesTable detransformed = detransform(denormalized, keys);
        SeriesTable result = detransformed.dropMissing();
        log.debug("Inverse pipeline produced {}", result);
        return result;
    }

    /**
     * Projects a raw table to exactly the series needed for the given nodes, in fetch order.
     *
     * @param raw  Raw table
     * @param keys Processed keys
     * @return Projected table; series absent from {@code raw} appear as empty columns
     */
    public SeriesTable filter(SeriesTable raw, List<SeriesKey> keys) {
        return raw.select(nodeSet.fetchKeys(keys));
    }

    /**
     * Computes the pre-transform series of the given nodes.
     * <p>
     * For derived nodes the series of their original node is computed. A composite whose
     * aggregate is empty contributes no column.
     *
     * @param filtered Output of {@link #filter}
     * @param keys     Processed keys
     * @return Table keyed by the non-derived (original) keys
     */
    public SeriesTable merge(SeriesTable filtered, List<SeriesKey> keys) {
        SeriesTable merged = new SeriesTable();
        for (SeriesKey key : keys) {
            SeriesKey original = nodeSet.original(key);
            if (merged.hasColumn(original)) {
                continue;
            }
            NavigableMap<Instant, Double> series = evaluate(original, filtered);
            if (series.isEmpty() && nodeSet.node(original) instanceof CompositeNode) {
                log.debug("Composite node {} has no data, skipping", original);
                continue;
            }
            merged.putColumn(original, series);
        }
        return merged;
    }

    /**
     * Derives the series of derived nodes from their base; other nodes pass through.
     *
     * @param merged Output of {@link #merge}
     * @param keys   Processed keys
     * @return Table keyed by the processed keys
     */
    public SeriesTable transform(SeriesTable merged, List<SeriesKey> keys) {
        SeriesTable transformed = new SeriesTable();
        for (SeriesKey key : keys) {
            if (!merged.hasColumn(nodeSet.original(key))) {
                continue;
            }
            transformed.putColumn(key, evaluate(key, merged));
        }
        return transformed;
    }

    /**
     * Applies {@code (v - mean) / deviation} per column.
     *
     * @param table Table keyed by node keys
     * @param keys  Columns to normalize
     * @return Normalized table
     * @throws IllegalStateException if a node has no mean or a non-positive deviation
     */
    public SeriesTable normalize(SeriesTable table, List<SeriesKey> keys) {
        SeriesTable result = new SeriesTable();
        for (SeriesKey key : keys) {
            if (!table.hasColumn(key)) {
                continue;
            }
            NodeStatistics statistics = nodeSet.node(key).getStatistics();
            if (!statistics.isNormalizable()) {
                throw new IllegalStateException("Node " + key + " cannot be normalized: mean="
                    + statistics.mean() + ", deviation=" + statistics.deviation());
            }
            NavigableMap<Instant, Double> column = new TreeMap<>();
            table.numericColumn(key).forEach((time, value) ->
                column.put(time, (value - statistics.mean()) / statistics.deviation()));
            result.putColumn(key, column);
        }
        return result;
    }

    /**
     * Applies {@code v * (deviation + 0.1) + mean} per column.
     *
     * @param table Normalized table keyed by node keys
     * @param keys  Columns to denormalize
     * @return Denormalized table
     * @throws IllegalStateException if a node has no mean or deviation
     */
    public SeriesTable denormalize(SeriesTable table, List<SeriesKey> keys) {
        SeriesTable result = new SeriesTable();
        for (SeriesKey key : keys) {
            if (!table.hasColumn(key)) {
                continue;
            }
            NodeStatistics statistics = nodeSet.node(key).getStatistics();
            if (statistics.mean() == null || statistics.deviation() == null) {
                throw new IllegalStateException("Node " + key + " cannot be denormalized: mean="
                    + statistics.mean() + ", deviation=" + statistics.deviation());
            }
            NavigableMap<Instant, Double> column = new TreeMap<>();
            table.numericColumn(key).forEach((time, value) ->
                column.put(time, value * (statistics.deviation() + DEVIATION_GUARD) + statistics.mean()));
            result.putColumn(key, column);
        }
        return result;
    }

    /**
     * Applies detransformers and re-keys derived columns to their original node.
     *
     * @param table Table keyed by processed keys
     * @param keys  Columns to detransform
     * @return Table keyed by original keys
     */
    public SeriesTable detransform(SeriesTable table, List<SeriesKey> keys) {
        SeriesTable result = new SeriesTable();
        for (SeriesKey key : keys) {
            if (!table.hasColumn(key)) {
                continue;
            }
            NavigableMap<Instant, Double> series = table.numericColumn(key);
            Node node = nodeSet.node(key);
            while (node instanceof DerivedNode) {
                DerivedNode derived = (DerivedNode) node;
                series = transformers.get(derived.getDetransformer()).apply(series, interval);
                node = nodeSet.node(derived.getBase());
            }
            result.putColumn(node.getKey(), series);
        }
        return result;
    }

    /**
     * Keeps only timestamps where every column of both tables has a value.
     * <p>
     * With one side null the other side is cleaned on its own.
     *
     * @param input  Input table or null
     * @param output Output table or null
     * @return Cleaned tables
     */
    public PipelineTables clean(SeriesTable input, SeriesTable output) {
        if (input != null && output != null) {
            NavigableSet<Instant> common = input.completeIndex();
            common.retainAll(output.completeIndex());
            return new PipelineTables(input.restrictTo(common), output.restrictTo(common));
        }
        return new PipelineTables(input == null ? null : input.dropMissing(),
            output == null ? null : output.dropMissing());
    }

    private SeriesTable forwardSide(SeriesTable raw, List<SeriesKey> keys) {
        SeriesTable filtered = filter(raw, keys);
        SeriesTable merged = merge(filtered, keys);
        SeriesTable transformed = transform(merged, keys);
        return normalize(transformed, keys);
    }

    private NavigableMap<Instant, Double> evaluate(SeriesKey key, SeriesTable table) {
        Node node = nodeSet.node(key);
        if (table.hasColumn(key)) {
            return table.numericColumn(key);
        }
        if (node instanceof DerivedNode) {
            DerivedNode derived = (DerivedNode) node;
            return transformers.get(derived.getTransformer()).apply(evaluate(derived.getBase(), table), interval);
        }
        if (node instanceof CompositeNode) {
            return aggregate((CompositeNode) node, table);
        }
        return new TreeMap<>();
    }

    private NavigableMap<Instant, Double> aggregate(CompositeNode node, SeriesTable table) {
        List<NavigableMap<Instant, Double>> children = new ArrayList<>();
        for (SeriesKey child : node.getChildren()) {
            children.add(evaluate(child, table));
        }
        SeriesAggregator aggregator = SeriesAggregator.fromName(node.getAggregator());
        NavigableMap<Instant, Double> result = new TreeMap<>();
        for (Map.Entry<Instant, Double> entry : children.get(0).entrySet()) {
            List<Double> values = new ArrayList<>(children.size());
            for (NavigableMap<Instant, Double> child : children) {
                Double value = child.get(entry.getKey());
                if (value == null) {
                    break;
                }
                values.add(value);
            }
            if (values.size() == children.size()) {
                result.put(entry.getKey(), aggregator.aggregate(values));
            }
        }
        return result;
    }

    private static List<SeriesKey> presentKeys(SeriesTable table, List<SeriesKey> keys) {
        List<SeriesKey> present = new ArrayList<>();
        for (SeriesKey key : keys) {
            if (table.hasColumn(key)) {
                present.add(key);
            }
        }
        return present;
    }
}
