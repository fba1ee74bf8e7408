package org.energysaving.cli.commands.model;

import java.io.PrintWriter;

import org.energysaving.datapipeline.nodes.NodeSet;
import org.energysaving.datapipeline.services.ServiceContext;

import picocli.CommandLine.Command;

@Command(
    name = "build",
    description = "Resolve the model nodes from the model type configuration"
)
public class ModelBuildCommand extends ModelSubcommand {

    @Override
    protected int execute(ServiceContext context, PrintWriter out) {
        NodeSet nodeSet = driver(context).build();
        out.printf("Built %s of datacenter %s: %d inputs, %d outputs%n", modelType, datacenter,
            nodeSet.getInputs().size(), nodeSet.getOutputs().size());
        return 0;
    }
}
