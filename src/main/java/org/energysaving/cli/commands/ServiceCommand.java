package org.energysaving.cli.commands;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.energysaving.cli.CommandLineInterface;
import org.energysaving.datapipeline.api.exceptions.ErrorResponse;
import org.energysaving.datapipeline.services.ServiceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Base of the commands that work on the services.
 * <p>
 * Opens a {@link ServiceContext} for the duration of the command. Failures are printed to the
 * error stream as an error response document and yield exit code 1.
 */
public abstract class ServiceCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ServiceCommand.class);

    @Spec
    protected CommandSpec spec;

    /**
     * Returns the root command holding the configuration.
     *
     * @return Root command
     */
    protected abstract CommandLineInterface root();

    /**
     * Runs the command.
     *
     * @param context Services
     * @param out     Standard output of the command line
     * @return Exit code
     * @throws Exception on any failure
     */
    protected abstract int execute(ServiceContext context, PrintWriter out) throws Exception;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        boolean debug = false;
        try {
            Config config = root().getConfig();
            debug = config.hasPath("energysaving.debug") && config.getBoolean("energysaving.debug");
            try (ServiceContext context = ServiceContext.create(config)) {
                int exitCode = execute(context, out);
                out.flush();
                return exitCode;
            }
        } catch (Exception e) {
            log.error("Command '{}' failed: {}", spec.qualifiedName(), e.getMessage());
            err.println(ErrorResponse.from(e, debug).toJson());
            err.flush();
            return 1;
        }
    }
}
