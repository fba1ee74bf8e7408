package org.energysaving.cli.commands;

import org.energysaving.cli.CommandLineInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the command tree, run against an in-memory metadata database and time-series store.
 */
@Tag("unit")
public class CommandLineInterfaceTest {

    @TempDir
    Path workDir;

    private Path configFile;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        configFile = workDir.resolve("energysaving.conf");
        Files.writeString(configFile, "energysaving {\n"
            + "  database.jdbcUrl = \"jdbc:h2:mem:cli-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1\"\n"
            + "  timeseries.backend = \"memory\"\n"
            + "  models.directory = \"" + workDir.resolve("models").toString().replace("\\", "/") + "\"\n"
            + "  logging.default = \"WARN\"\n"
            + "}\n");
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        String[] withConfig = new String[args.length + 2];
        withConfig[0] = "--config";
        withConfig[1] = configFile.toString();
        System.arraycopy(args, 0, withConfig, 2, args.length);
        return cmdLine.execute(withConfig);
    }

    private void importHallA() throws IOException {
        Path document = workDir.resolve("hall-a.json");
        Files.writeString(document, "{\"time_interval\": 300, \"device_types\": {\"controller_parameter\":"
            + " {\"setpoint\": {\"devices\": [\"c1\"], \"attribute\": {\"unit\": \"celsius\", \"min\": 18, \"max\": 26}}}}}");
        assertThat(run("metadata", "import", document.toString())).isZero();
    }

    @Test
    void testSubcommandsRegistered() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getSubcommands())
            .containsKeys("metadata", "query", "delete-series", "csv", "refresh-statistics", "model");
        assertThat(cmdLine.getSubcommands().get("model").getSubcommands())
            .containsKeys("build", "train", "test", "apply");
        assertThat(cmdLine.getSubcommands().get("csv").getSubcommands()).containsKeys("import", "export");
    }

    @Test
    void testQueryHelpOutput() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));

        cmdLine.execute("query", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("--select").contains("--start").contains("--group-by").contains("--compile-only");
    }

    @Test
    void testMetadataImportListAndShow() throws IOException {
        importHallA();
        assertThat(out.toString()).contains("Imported datacenter hall-a");

        assertThat(run("metadata", "list")).isZero();
        assertThat(out.toString()).contains("hall-a");

        assertThat(run("metadata", "show", "hall-a")).isZero();
        assertThat(out.toString()).contains("\"time_interval\": 300").contains("\"setpoint\"");
    }

    @Test
    void testQueryCompileOnly() throws IOException {
        importHallA();

        int exitCode = run("query", "hall-a", "--compile-only", "--start=-1h",
            "--group-by", "time(5m)", "--aggregation", "mean");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("select mean(value) as value from setpoint"
            + " where time >= now() - 1h and datacenter = 'hall-a' and device_type = 'controller_parameter'"
            + " and (device = 'c1') and measurement_kind = '' group by time(5m), device");
    }

    @Test
    void testUnknownDatacenterReportsErrorDocument() {
        int exitCode = run("metadata", "show", "nowhere");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString())
            .contains("\"message\": \"datacenter nowhere does not exist\"")
            .contains("\"status\": 404")
            .doesNotContain("traceback");
    }
}
