package org.energysaving.cli.commands.metadata;

import java.io.PrintWriter;

import org.energysaving.cli.CommandLineInterface;
import org.energysaving.cli.commands.ServiceCommand;
import org.energysaving.datapipeline.services.ServiceContext;

import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "list",
    description = "List the stored datacenters"
)
public class MetadataListCommand extends ServiceCommand {

    @ParentCommand
    private MetadataCommand parent;

    @Override
    protected CommandLineInterface root() {
        return parent.getParent();
    }

    @Override
    protected int execute(ServiceContext context, PrintWriter out) {
        context.getMetadataService().listDatacenters().forEach(out::println);
        return 0;
    }
}
