package org.energysaving.cli.commands.model;

import java.io.PrintWriter;

import org.energysaving.datapipeline.api.models.ModelResult;
import org.energysaving.datapipeline.services.ServiceContext;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "train",
    description = "Train a built model type on a historical window"
)
public class ModelTrainCommand extends ModelSubcommand {

    @Option(names = {"-s", "--start"}, required = true, description = "Window start, absolute or relative")
    private String starttime;

    @Option(names = {"-e", "--end"}, description = "Window end (default: open)")
    private String endtime;

    @Override
    protected int execute(ServiceContext context, PrintWriter out) {
        ModelResult result = driver(context).train(starttime, endtime);
        out.println(renderStatistics(result.statistics()));
        return 0;
    }
}
