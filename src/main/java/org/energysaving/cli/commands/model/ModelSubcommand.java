package org.energysaving.cli.commands.model;

import java.util.Map;

import org.energysaving.cli.CommandLineInterface;
import org.energysaving.cli.commands.ServiceCommand;
import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.models.ModelDriver;
import org.energysaving.datapipeline.services.ServiceContext;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

/**
 * Common arguments of the model subcommands: model type and datacenter.
 */
abstract class ModelSubcommand extends ServiceCommand {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    @Parameters(index = "0", description = "Model type: sensor_attribute_prediction, controller_parameter_prediction, "
        + "pue_prediction or controller_attribute_optimization")
    protected String modelType;

    @Parameters(index = "1", description = "Datacenter name")
    protected String datacenter;

    @ParentCommand
    private ModelCommand parent;

    @Override
    protected CommandLineInterface root() {
        return parent.getParent();
    }

    protected ModelDriver driver(ServiceContext context) {
        return context.getModelManager().getDriver(modelType, datacenter);
    }

    protected static String renderStatistics(Map<SeriesKey, Map<String, Double>> statistics) {
        JsonObject root = new JsonObject();
        statistics.forEach((key, values) -> {
            JsonObject entry = new JsonObject();
            values.forEach(entry::addProperty);
            root.add(key.toString(), entry);
        });
        return GSON.toJson(root);
    }
}
