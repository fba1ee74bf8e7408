package org.energysaving.cli.commands.csv;

import java.io.File;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.energysaving.cli.CommandLineInterface;
import org.energysaving.cli.commands.ServiceCommand;
import org.energysaving.datapipeline.api.timeseries.TimePrecision;
import org.energysaving.datapipeline.services.ServiceContext;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

/**
 * Writes a CSV file (a {@code time} column and one column per device) into the store.
 */
@Command(
    name = "import",
    description = "Import a CSV file into one measurement"
)
public class CsvImportCommand extends ServiceCommand {

    @Parameters(index = "0", description = "Datacenter name")
    private String datacenter;

    @Parameters(index = "1", description = "Device type")
    private String deviceType;

    @Parameters(index = "2", description = "Measurement name")
    private String measurement;

    @Parameters(index = "3", description = "CSV file")
    private File file;

    @Option(names = {"--precision"}, description = "Epoch precision of the time column: u, ms, s, m, h (default: from configuration)")
    private String precision;

    @ParentCommand
    private CsvCommand parent;

    @Override
    protected CommandLineInterface root() {
        return parent.getParent();
    }

    @Override
    protected int execute(ServiceContext context, PrintWriter out) throws Exception {
        TimePrecision timePrecision = precision == null ? context.getDefaultPrecision() : TimePrecision.fromCode(precision);
        boolean written;
        try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            written = context.getTimeSeriesService().importCsv(datacenter, deviceType, measurement, reader, timePrecision);
        }
        if (!written) {
            spec.commandLine().getErr().println("Store rejected some of the values of " + file);
            return 1;
        }
        out.println("Imported " + file + " into " + deviceType + "/" + measurement);
        return 0;
    }
}
