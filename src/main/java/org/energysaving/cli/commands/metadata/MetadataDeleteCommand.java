package org.energysaving.cli.commands.metadata;

import java.io.PrintWriter;

import org.energysaving.cli.CommandLineInterface;
import org.energysaving.cli.commands.ServiceCommand;
import org.energysaving.datapipeline.services.ServiceContext;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

/**
 * Deletes a datacenter with its devices and measurements. Stored series are left alone.
 */
@Command(
    name = "delete",
    description = "Delete the metadata of a datacenter"
)
public class MetadataDeleteCommand extends ServiceCommand {

    @Parameters(index = "0", description = "Datacenter name")
    private String datacenter;

    @ParentCommand
    private MetadataCommand parent;

    @Override
    protected CommandLineInterface root() {
        return parent.getParent();
    }

    @Override
    protected int execute(ServiceContext context, PrintWriter out) {
        context.getMetadataService().deleteDatacenter(datacenter);
        out.println("Deleted datacenter " + datacenter);
        return 0;
    }
}
