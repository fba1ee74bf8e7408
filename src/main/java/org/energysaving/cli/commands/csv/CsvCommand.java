package org.energysaving.cli.commands.csv;

import java.util.concurrent.Callable;

import org.energysaving.cli.CommandLineInterface;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "csv",
    description = "Import or export one measurement as CSV",
    subcommands = {
        CsvImportCommand.class,
        CsvExportCommand.class
    }
)
public class CsvCommand implements Callable<Integer> {

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
