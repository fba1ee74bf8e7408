package org.energysaving.cli.commands.metadata;

import java.io.PrintWriter;

import org.energysaving.cli.CommandLineInterface;
import org.energysaving.cli.commands.ServiceCommand;
import org.energysaving.datapipeline.services.ServiceContext;
import org.energysaving.datapipeline.utils.MetadataJsonCodec;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "show",
    description = "Print the metadata of a datacenter as JSON"
)
public class MetadataShowCommand extends ServiceCommand {

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
        out.println(MetadataJsonCodec.encode(context.getMetadataService().getMetadata(datacenter)));
        return 0;
    }
}
