package org.energysaving.cli.commands;

import java.io.PrintWriter;

import org.energysaving.cli.CommandLineInterface;
import org.energysaving.datapipeline.api.metadata.DatacenterMetadata;
import org.energysaving.datapipeline.services.ServiceContext;
import org.energysaving.datapipeline.utils.MetadataJsonCodec;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

/**
 * Recomputes mean, deviation and their differentiation counterparts from stored series.
 */
@Command(
    name = "refresh-statistics",
    description = "Recompute measurement statistics of a datacenter from a time window"
)
public class RefreshStatisticsCommand extends ServiceCommand {

    @Parameters(index = "0", description = "Datacenter name")
    private String datacenter;

    @Option(names = {"-s", "--start"}, required = true, description = "Window start, absolute or relative (e.g. -7d)")
    private String starttime;

    @Option(names = {"-e", "--end"}, description = "Window end (default: open)")
    private String endtime;

    @Option(names = {"--print"}, description = "Print the refreshed metadata")
    private boolean print;

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    protected CommandLineInterface root() {
        return parent;
    }

    @Override
    protected int execute(ServiceContext context, PrintWriter out) {
        DatacenterMetadata refreshed = context.getStatisticsRefresher().refresh(datacenter, starttime, endtime);
        out.println("Refreshed statistics of datacenter " + datacenter);
        if (print) {
            out.println(MetadataJsonCodec.encode(refreshed));
        }
        return 0;
    }
}
