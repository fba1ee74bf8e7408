package org.energysaving.cli.commands.metadata;

import java.util.concurrent.Callable;

import org.energysaving.cli.CommandLineInterface;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "metadata",
    description = "Manage datacenter metadata",
    subcommands = {
        MetadataImportCommand.class,
        MetadataShowCommand.class,
        MetadataListCommand.class,
        MetadataDeleteCommand.class
    }
)
public class MetadataCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public CommandLineInterface getParent() {
        return parent;
    }
}
