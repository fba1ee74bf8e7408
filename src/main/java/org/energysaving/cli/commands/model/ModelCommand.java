package org.energysaving.cli.commands.model;

import java.util.concurrent.Callable;

import org.energysaving.cli.CommandLineInterface;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "model",
    description = "Build, train, test and apply the models of a datacenter",
    subcommands = {
        ModelBuildCommand.class,
        ModelTrainCommand.class,
        ModelTestCommand.class,
        ModelApplyCommand.class
    }
)
public class ModelCommand implements Callable<Integer> {

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
