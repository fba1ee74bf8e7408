package org.energysaving.cli.commands.csv;

import java.io.File;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.energysaving.cli.CommandLineInterface;
import org.energysaving.cli.commands.ServiceCommand;
import org.energysaving.datapipeline.api.timeseries.TimePrecision;
import org.energysaving.datapipeline.query.QueryOptions;
import org.energysaving.datapipeline.services.ServiceContext;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "export",
    description = "Export one measurement as CSV"
)
public class CsvExportCommand extends ServiceCommand {

    @Parameters(index = "0", description = "Datacenter name")
    private String datacenter;

    @Parameters(index = "1", description = "Device type")
    private String deviceType;

    @Parameters(index = "2", description = "Measurement name")
    private String measurement;

    @Option(names = {"-o", "--output"}, description = "Target file (default: standard output)")
    private File output;

    @Option(names = {"-s", "--start"}, description = "Start time, absolute or relative")
    private String starttime;

    @Option(names = {"-e", "--end"}, description = "End time, absolute or relative")
    private String endtime;

    @Option(names = {"--precision"}, description = "Epoch precision of the time column (default: ISO strings)")
    private String precision;

    @ParentCommand
    private CsvCommand parent;

    @Override
    protected CommandLineInterface root() {
        return parent.getParent();
    }

    @Override
    protected int execute(ServiceContext context, PrintWriter out) throws Exception {
        QueryOptions options = QueryOptions.builder()
            .starttime(starttime)
            .endtime(endtime)
            .timePrecision(TimePrecision.fromCode(precision))
            .build();
        if (output == null) {
            context.getTimeSeriesService().exportCsv(datacenter, deviceType, measurement, options, out);
            return 0;
        }
        try (Writer writer = Files.newBufferedWriter(output.toPath(), StandardCharsets.UTF_8)) {
            context.getTimeSeriesService().exportCsv(datacenter, deviceType, measurement, options, writer);
        }
        out.println("Exported " + deviceType + "/" + measurement + " to " + output);
        return 0;
    }
}
