package org.energysaving.cli.commands;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

import org.energysaving.cli.CommandLineInterface;
import org.energysaving.datapipeline.services.ServiceContext;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "delete-series",
    description = "Drop the stored series of a measurement"
)
public class DeleteSeriesCommand extends ServiceCommand {

    @Parameters(index = "0", description = "Datacenter name")
    private String datacenter;

    @Parameters(index = "1", description = "Device type, e.g. sensor_attribute")
    private String deviceType;

    @Parameters(index = "2", description = "Measurement name")
    private String measurement;

    @Parameters(index = "3..*", description = "Devices to drop (default: all devices of the measurement)")
    private List<String> devices = new ArrayList<>();

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    protected CommandLineInterface root() {
        return parent;
    }

    @Override
    protected int execute(ServiceContext context, PrintWriter out) {
        context.getTimeSeriesService().deleteTimeseries(datacenter, deviceType, measurement, devices);
        out.println("Dropped series of " + deviceType + "/" + measurement + " in datacenter " + datacenter);
        return 0;
    }
}
