package org.energysaving.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.energysaving.cli.commands.DeleteSeriesCommand;
import org.energysaving.cli.commands.QueryCommand;
import org.energysaving.cli.commands.RefreshStatisticsCommand;
import org.energysaving.cli.commands.csv.CsvCommand;
import org.energysaving.cli.commands.metadata.MetadataCommand;
import org.energysaving.cli.commands.model.ModelCommand;
import org.energysaving.cli.config.ConfigLoader;
import org.energysaving.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "energysaving",
    mixinStandardHelpOptions = true,
    version = "Energy Saving 1.0",
    description = "Energy Saving - datacenter time-series and model pipeline",
    subcommands = {
        MetadataCommand.class,
        QueryCommand.class,
        DeleteSeriesCommand.class,
        CsvCommand.class,
        RefreshStatisticsCommand.class,
        ModelCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/energysaving.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("energysaving");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.info(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (IllegalArgumentException e) {
            logger.error(e.getMessage());
            throw e;
        } catch (com.typesafe.config.ConfigException e) {
            logger.error("Failed to load or parse configuration: {}", e.getMessage());
            throw e;
        }

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
