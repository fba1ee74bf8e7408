package org.energysaving.cli.commands.model;

import java.io.PrintWriter;

import org.energysaving.datapipeline.api.models.ModelResult;
import org.energysaving.datapipeline.services.ServiceContext;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Tests a trained model type; predictions and expectations are written tagged with the test result id.
 */
@Command(
    name = "test",
    description = "Test a trained model type on a historical window"
)
public class ModelTestCommand extends ModelSubcommand {

    @Option(names = {"-s", "--start"}, required = true, description = "Window start, absolute or relative")
    private String starttime;

    @Option(names = {"-e", "--end"}, description = "Window end (default: open)")
    private String endtime;

    @Option(names = {"--test-result"}, required = true, description = "Value of the test_result tag of the written results")
    private String testResult;

    @Override
    protected int execute(ServiceContext context, PrintWriter out) {
        ModelResult result = driver(context).test(starttime, endtime, testResult);
        out.println(renderStatistics(result.statistics()));
        return 0;
    }
}
