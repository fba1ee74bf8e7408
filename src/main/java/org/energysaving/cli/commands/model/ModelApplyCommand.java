package org.energysaving.cli.commands.model;

import java.io.PrintWriter;

import org.energysaving.datapipeline.api.timeseries.SeriesTable;
import org.energysaving.datapipeline.services.ServiceContext;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "apply",
    description = "Predict with a trained model type and write the predictions"
)
public class ModelApplyCommand extends ModelSubcommand {

    @Option(names = {"-s", "--start"}, required = true, description = "Input window start, absolute or relative")
    private String starttime;

    @Option(names = {"-e", "--end"}, description = "Input window end (default: open)")
    private String endtime;

    @Option(names = {"--prediction"}, required = true, description = "Value of the prediction tag of the written predictions")
    private String prediction;

    @Override
    protected int execute(ServiceContext context, PrintWriter out) {
        SeriesTable predictions = driver(context).apply(starttime, endtime, prediction);
        out.printf("Wrote %d predicted series with %d rows as prediction %s%n", predictions.columnCount(),
            predictions.rowCount(), prediction);
        return 0;
    }
}
