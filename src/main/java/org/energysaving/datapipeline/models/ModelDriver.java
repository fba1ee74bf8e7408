package org.energysaving.datapipeline.models;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.energysaving.datapipeline.api.exceptions.DatabaseException;
import org.energysaving.datapipeline.api.exceptions.UnknownMeasurementException;
import org.energysaving.datapipeline.api.metadata.DatacenterMetadata;
import org.energysaving.datapipeline.api.metadata.DeviceTypeMapping;
import org.energysaving.datapipeline.api.metadata.MeasurementMetadata;
import org.energysaving.datapipeline.api.models.IModel;
import org.energysaving.datapipeline.api.models.ModelResult;
import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.api.timeseries.SeriesTable;
import org.energysaving.datapipeline.api.timeseries.TagNames;
import org.energysaving.datapipeline.api.timeseries.TimePrecision;
import org.energysaving.datapipeline.nodes.NodeArena;
import org.energysaving.datapipeline.nodes.NodeSet;
import org.energysaving.datapipeline.nodes.NodeSetCodec;
import org.energysaving.datapipeline.nodes.NodeStatistics;
import org.energysaving.datapipeline.nodes.SimpleNode;
import org.energysaving.datapipeline.query.QueryOptions;
import org.energysaving.datapipeline.resolver.MetadataResolver;
import org.energysaving.datapipeline.services.MetadataService;
import org.energysaving.datapipeline.services.TimeSeriesService;
import org.energysaving.datapipeline.transform.NodeTransformPipeline;
import org.energysaving.datapipeline.transform.PipelineTables;
import org.energysaving.datapipeline.transform.TransformerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Runs the life cycle of one model type of one datacenter: build, train, test, apply.
 * <p>
 * <strong>Build</strong> resolves the configured selections (or takes explicit series), lets the
 * model type strategy turn them into nodes and stores the node set file. A rebuild discards any
 * trained state.
 * <p>
 * <strong>Train</strong> fetches the window at the datacenter interval, runs the forward pipeline,
 * fits the model and stores its state. <strong>Test</strong> and <strong>apply</strong> run the
 * trained model and write the denormalized results back with the tags {@code test_result} or
 * {@code prediction} plus {@code measurement_kind}.
 * <p>
 * State lives in the model directory, so a driver created later (another CLI invocation) picks up
 * where an earlier one stopped. Not thread-safe.
 */
public class ModelDriver {

    private static final Logger log = LoggerFactory.getLogger(ModelDriver.class);

    public static final String KIND_PREDICTION = "prediction";
    public static final String KIND_EXPECTATION = "expectation";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final ModelTypeKind type;
    private final String datacenter;
    private final MetadataService metadataService;
    private final TimeSeriesService timeSeriesService;
    private final Path modelDirectory;
    private final Function<ModelTypeKind, ModelDriver> components;
    private final MetadataResolver resolver = new MetadataResolver();
    private final TransformerRegistry transformers = new TransformerRegistry();
    private final NodeSetCodec codec = new NodeSetCodec();

    private NodeSet nodeSet;
    private IModel model;
    private boolean trained;

    /**
     * Creates a driver.
     *
     * @param type              Model type
     * @param datacenter        Datacenter name
     * @param metadataService   Metadata access
     * @param timeSeriesService Series access
     * @param modelDirectory    Directory of config, node set and model state files
     * @param components        Drivers of other model types of the same datacenter
     */
    public ModelDriver(ModelTypeKind type, String datacenter, MetadataService metadataService,
                       TimeSeriesService timeSeriesService, Path modelDirectory,
                       Function<ModelTypeKind, ModelDriver> components) {
        this.type = type;
        this.datacenter = datacenter;
        this.metadataService = metadataService;
        this.timeSeriesService = timeSeriesService;
        this.modelDirectory = modelDirectory;
        this.components = components;
    }

    public ModelTypeKind getType() {
        return type;
    }

    public String getDatacenter() {
        return datacenter;
    }

    /**
     * Builds from the selections of the model type config.
     *
     * @return The new node set
     */
    public NodeSet build() {
        DatacenterMetadata metadata = metadataService.getMetadata(datacenter);
        ModelTypeConfig config = config(metadata);
        NodeArena arena = new NodeArena();
        List<SeriesKey> inputs = List.of();
        List<SeriesKey> outputs = List.of();
        if (type.getStrategy().hasModel()) {
            DeviceTypeMapping inputMapping = resolver.resolve(config.getInputs(), metadata, true);
            DeviceTypeMapping outputMapping = resolver.resolve(config.getOutputs(), metadata, true);
            inputs = arena.registerAll(inputMapping, metadata);
            outputs = arena.registerAll(outputMapping, metadata);
        }
        return build(metadata, config, arena, inputs, outputs);
    }

    /**
     * Builds from explicit raw series instead of the configured selections.
     *
     * @param inputs  Raw input series
     * @param outputs Raw output series
     * @return The new node set
     * @throws UnknownMeasurementException if a series names an unknown measurement
     */
    public NodeSet build(List<SeriesKey> inputs, List<SeriesKey> outputs) {
        DatacenterMetadata metadata = metadataService.getMetadata(datacenter);
        NodeArena arena = new NodeArena();
        registerExplicit(arena, metadata, inputs);
        registerExplicit(arena, metadata, outputs);
        return build(metadata, config(metadata), arena, inputs, outputs);
    }

    /**
     * Trains on a historical window.
     *
     * @param starttime Window start literal
     * @param endtime   Window end literal, may be null
     * @return Denormalized predictions and expectations with fit statistics
     */
    public ModelResult train(String starttime, String endtime) {
        loadBuilt();
        DatacenterMetadata metadata = metadataService.getMetadata(datacenter);
        return train(fetch(metadata, starttime, endtime, nodeSet.getInputs()),
            fetch(metadata, starttime, endtime, nodeSet.getOutputs()));
    }

    /**
     * Trains on supplied raw series.
     *
     * @param rawInput  Raw input series
     * @param rawOutput Raw output series
     * @return Denormalized predictions and expectations with fit statistics
     * @throws IllegalStateException if the model type is not built or has no model
     */
    public ModelResult train(SeriesTable rawInput, SeriesTable rawOutput) {
        loadBuilt();
        requireModel("train");
        NodeTransformPipeline pipeline = pipeline(metadataService.getMetadata(datacenter));
        PipelineTables tables = pipeline.forward(rawInput, rawOutput);
        log.info("Training {} of datacenter {} on {} rows", type, datacenter, tables.input().rowCount());
        ModelResult result = model.train(tables.input(), tables.output(), true, true);
        saveModel();
        trained = true;
        return denormalize(pipeline, result);
    }

    /**
     * Tests on a historical window and writes the results.
     *
     * @param starttime  Window start literal
     * @param endtime    Window end literal, may be null
     * @param testResult Value of the {@code test_result} tag
     * @return Denormalized predictions and expectations with test statistics
     */
    public ModelResult test(String starttime, String endtime, String testResult) {
        loadBuilt();
        DatacenterMetadata metadata = metadataService.getMetadata(datacenter);
        return test(fetch(metadata, starttime, endtime, nodeSet.getInputs()),
            fetch(metadata, starttime, endtime, nodeSet.getOutputs()), testResult);
    }

    /**
     * Tests on supplied raw series and writes the results.
     *
     * @param rawInput   Raw input series
     * @param rawOutput  Raw output series
     * @param testResult Value of the {@code test_result} tag
     * @return Denormalized predictions and expectations with test statistics
     * @throws IllegalStateException if the model type is not trained
     */
    public ModelResult test(SeriesTable rawInput, SeriesTable rawOutput, String testResult) {
        loadTrained();
        DatacenterMetadata metadata = metadataService.getMetadata(datacenter);
        NodeTransformPipeline pipeline = pipeline(metadata);
        PipelineTables tables = pipeline.forward(rawInput, rawOutput);
        ModelResult result = denormalize(pipeline, model.test(tables.input(), tables.output(), true, true));
        write(metadata, result.predictions(), TagNames.TEST_RESULT, testResult, KIND_PREDICTION);
        write(metadata, result.expectations(), TagNames.TEST_RESULT, testResult, KIND_EXPECTATION);
        log.info("Tested {} of datacenter {} as {}: {}", type, datacenter, testResult, result.statistics());
        return result;
    }

    /**
     * Predicts from a historical window and writes the predictions.
     *
     * @param starttime  Window start literal
     * @param endtime    Window end literal, may be null
     * @param prediction Value of the {@code prediction} tag
     * @return Denormalized predictions
     */
    public SeriesTable apply(String starttime, String endtime, String prediction) {
        loadBuilt();
        DatacenterMetadata metadata = metadataService.getMetadata(datacenter);
        return apply(fetch(metadata, starttime, endtime, nodeSet.getInputs()), prediction);
    }

    /**
     * Predicts from supplied raw input series and writes the predictions.
     *
     * @param rawInput   Raw input series
     * @param prediction Value of the {@code prediction} tag
     * @return Denormalized predictions
     * @throws IllegalStateException if the model type is not trained
     */
    public SeriesTable apply(SeriesTable rawInput, String prediction) {
        loadTrained();
        DatacenterMetadata metadata = metadataService.getMetadata(datacenter);
        NodeTransformPipeline pipeline = pipeline(metadata);
        SeriesTable input = pipeline.forward(rawInput, null).input();
        SeriesTable predictions = pipeline.inverse(model.apply(input));
        write(metadata, predictions, TagNames.PREDICTION, prediction, KIND_PREDICTION);
        log.info("Applied {} of datacenter {} as {}: {}", type, datacenter, prediction, predictions);
        return predictions;
    }

    public boolean isBuilt() {
        return Files.isRegularFile(nodesFile(metadataService.getMetadata(datacenter)));
    }

    /**
     * Returns whether trained state exists; for composed model types, whether every component is trained.
     *
     * @return true if trained
     */
    public boolean isTrained() {
        if (!type.getStrategy().hasModel()) {
            return components.apply(ModelTypeKind.PUE_PREDICTION).isTrained()
                && components.apply(ModelTypeKind.SENSOR_ATTRIBUTE_PREDICTION).isTrained();
        }
        return Files.isRegularFile(modelFile(metadataService.getMetadata(datacenter)));
    }

    /**
     * Returns the node set, loading it from the node set file if needed.
     *
     * @return Node set
     * @throws IllegalStateException if the model type is not built
     */
    public NodeSet getNodeSet() {
        loadBuilt();
        return nodeSet;
    }

    NodeSet builtNodeSet() {
        if (nodeSet == null && !isBuilt()) {
            log.info("Building component {} of datacenter {}", type, datacenter);
            return build();
        }
        return getNodeSet();
    }

    private NodeSet build(DatacenterMetadata metadata, ModelTypeConfig config, NodeArena arena,
                          List<SeriesKey> inputs, List<SeriesKey> outputs) {
        ModelBuildContext context = new ModelBuildContext(metadata, arena, inputs, outputs,
            component -> components.apply(component).builtNodeSet());
        NodeSet built = type.getStrategy().buildNodes(context);
        writeFile(nodesFile(metadata), codec.encode(built));
        nodeSet = built;
        trained = false;
        model = null;
        if (type.getStrategy().hasModel()) {
            model = createModel(config);
            deleteFile(modelFile(metadata));
        }
        log.info("Built {} of datacenter {}: {}", type, datacenter, built);
        return built;
    }

    private void loadBuilt() {
        if (nodeSet != null) {
            return;
        }
        DatacenterMetadata metadata = metadataService.getMetadata(datacenter);
        Path file = nodesFile(metadata);
        if (!Files.isRegularFile(file)) {
            throw new IllegalStateException("Model type " + type + " of datacenter " + datacenter + " is not built");
        }
        nodeSet = codec.decode(readFile(file));
        if (type.getStrategy().hasModel()) {
            model = createModel(config(metadata));
        }
        log.debug("Loaded node set of {} from {}", type, file);
    }

    private void loadTrained() {
        loadBuilt();
        requireModel("run");
        if (trained) {
            return;
        }
        Path file = modelFile(metadataService.getMetadata(datacenter));
        if (!Files.isRegularFile(file)) {
            throw new IllegalStateException("Model type " + type + " of datacenter " + datacenter + " is not trained");
        }
        try {
            JsonElement state = JsonParser.parseString(readFile(file));
            if (!state.isJsonObject()) {
                throw new IllegalStateException("Model state " + file + " is not a JSON object");
            }
            model.load(state.getAsJsonObject());
        } catch (JsonParseException e) {
            throw new IllegalStateException("Model state " + file + " is malformed: " + e.getMessage(), e);
        }
        trained = true;
        log.debug("Loaded model state of {} from {}", type, file);
    }

    private void requireModel(String operation) {
        if (!type.getStrategy().hasModel()) {
            throw new IllegalStateException("Model type " + type + " has no model of its own to " + operation
                + "; use its component model types");
        }
    }

    private void saveModel() {
        writeFile(modelFile(metadataService.getMetadata(datacenter)), GSON.toJson(model.save()));
    }

    private IModel createModel(ModelTypeConfig config) {
        return ModelBuilderKind.fromName(config.getModel()).getBuilder().create(config.getModelConfig());
    }

    private ModelTypeConfig config(DatacenterMetadata metadata) {
        String fileName = metadata.getModels().getOrDefault(type.getName(), type.getName() + ".json");
        Path file = modelDirectory.resolve(fileName);
        if (!type.getStrategy().hasModel() && !Files.isRegularFile(file)) {
            return ModelTypeConfig.parse("{}", type);
        }
        return ModelTypeConfig.load(file, type);
    }

    private Path nodesFile(DatacenterMetadata metadata) {
        return modelDirectory.resolve(datacenter).resolve(config(metadata).getNodes());
    }

    private Path modelFile(DatacenterMetadata metadata) {
        return modelDirectory.resolve(datacenter).resolve(config(metadata).getModelPath());
    }

    private NodeTransformPipeline pipeline(DatacenterMetadata metadata) {
        return new NodeTransformPipeline(nodeSet, Duration.ofSeconds(metadata.getTimeInterval()), transformers);
    }

    private SeriesTable fetch(DatacenterMetadata metadata, String starttime, String endtime,
                              Collection<SeriesKey> keys) {
        QueryOptions options = QueryOptions.builder()
            .starttime(starttime)
            .endtime(endtime)
            .groupBy("time(" + metadata.getTimeInterval() + "s)")
            .aggregation("mean")
            .build();
        return timeSeriesService.listTimeseries(metadata, nodeSet.deviceTypeMapping(keys), options);
    }

    private void write(DatacenterMetadata metadata, SeriesTable table, String tag, String tagValue, String kind) {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put(tag, tagValue);
        tags.put(TagNames.MEASUREMENT_KIND, kind);
        if (!timeSeriesService.createTimeseries(metadata, table, tags, TimePrecision.SECONDS)) {
            throw new DatabaseException("failed to write " + kind + " of " + type + " for " + tag + "=" + tagValue);
        }
    }

    private static ModelResult denormalize(NodeTransformPipeline pipeline, ModelResult result) {
        return new ModelResult(
            result.predictions() == null ? null : pipeline.inverse(result.predictions()),
            result.expectations() == null ? null : pipeline.inverse(result.expectations()),
            result.statistics());
    }

    private static void registerExplicit(NodeArena arena, DatacenterMetadata metadata, List<SeriesKey> keys) {
        List<SeriesKey> missing = new ArrayList<>();
        for (SeriesKey key : keys) {
            MeasurementMetadata measurement = metadata.getMeasurement(key.deviceType(), key.measurement())
                .orElse(null);
            if (measurement == null) {
                missing.add(key);
                continue;
            }
            arena.register(new SimpleNode(key, NodeStatistics.from(measurement.getAttribute())));
        }
        if (!missing.isEmpty()) {
            SeriesKey first = missing.get(0);
            throw new UnknownMeasurementException(metadata.getName(), first.deviceType(), first.measurement());
        }
    }

    private static String readFile(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private static void writeFile(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    private static void deleteFile(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + file, e);
        }
    }
}
