package org.energysaving.cli.commands;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.energysaving.cli.CommandLineInterface;
import org.energysaving.datapipeline.api.timeseries.SeriesTable;
import org.energysaving.datapipeline.api.timeseries.TimePrecision;
import org.energysaving.datapipeline.query.CompiledQuery;
import org.energysaving.datapipeline.query.QueryOptions;
import org.energysaving.datapipeline.resolver.Selection;
import org.energysaving.datapipeline.services.ServiceContext;

import com.google.gson.JsonParser;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

/**
 * Reads the series a selection resolves to and prints them as JSON.
 */
@Command(
    name = "query",
    description = "Query the time series of a datacenter"
)
public class QueryCommand extends ServiceCommand {

    @Parameters(index = "0", description = "Datacenter name")
    private String datacenter;

    @Option(names = {"--select"}, description = "Selection as JSON, e.g. {\"sensor_attribute\": {\"temperature\": [\"s1\"]}} (default: everything)")
    private String select;

    @Option(names = {"-s", "--start"}, description = "Start time, absolute or relative (e.g. -1h)")
    private String starttime;

    @Option(names = {"-e", "--end"}, description = "End time, absolute or relative")
    private String endtime;

    @Option(names = {"--where"}, description = "Extra tag predicate key=value")
    private Map<String, String> where = new LinkedHashMap<>();

    @Option(names = {"--group-by"}, split = ",", description = "Group-by dimensions, e.g. time(60s)")
    private List<String> groupBy = new ArrayList<>();

    @Option(names = {"--order-by"}, split = ",", description = "Order-by dimensions, e.g. time desc")
    private List<String> orderBy = new ArrayList<>();

    @Option(names = {"--fill"}, description = "Fill for empty time buckets: null, none, previous or a number")
    private String fill;

    @Option(names = {"--aggregation"}, description = "Aggregation function, e.g. mean")
    private String aggregation;

    @Option(names = {"--limit"}, description = "Maximum rows per series")
    private Integer limit;

    @Option(names = {"--offset"}, description = "Rows to skip per series")
    private Integer offset;

    @Option(names = {"--precision"}, description = "Epoch precision of timestamps: u, ms, s, m, h (default: ISO strings)")
    private String precision;

    @Option(names = {"--unit"}, description = "Unit to convert a measurement to, measurement=unit")
    private Map<String, String> units = new LinkedHashMap<>();

    @Option(names = {"--base-value"}, description = "Value added to every numeric result")
    private Double baseValue;

    @Option(names = {"--compile-only"}, description = "Print the compiled queries instead of running them")
    private boolean compileOnly;

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    protected CommandLineInterface root() {
        return parent;
    }

    @Override
    protected int execute(ServiceContext context, PrintWriter out) {
        Selection selection = select == null ? Selection.all() : Selection.fromJson(JsonParser.parseString(select));
        QueryOptions options = options();
        if (compileOnly) {
            for (CompiledQuery query : context.getTimeSeriesService().compileQueries(datacenter, selection, options)) {
                out.println(query.query());
            }
            return 0;
        }
        SeriesTable table = context.getTimeSeriesService().listTimeseries(datacenter, selection, options);
        out.println(SeriesTableJson.render(table, options.getTimePrecision()));
        return 0;
    }

    QueryOptions options() {
        QueryOptions.Builder builder = QueryOptions.builder()
            .starttime(starttime)
            .endtime(endtime)
            .groupBy(groupBy.toArray(new String[0]))
            .orderBy(orderBy.toArray(new String[0]))
            .fill(fill)
            .aggregation(aggregation)
            .limit(limit)
            .offset(offset)
            .timePrecision(TimePrecision.fromCode(precision))
            .baseValue(baseValue);
        where.forEach(builder::where);
        units.forEach(builder::unit);
        return builder.build();
    }
}
