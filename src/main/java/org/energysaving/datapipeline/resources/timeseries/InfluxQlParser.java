package org.energysaving.datapipeline.resources.timeseries;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;

/**
 * Parses the statements the query compiler produces.
 * <p>
 * Supported forms:
 * <pre>
 * select value|&lt;agg&gt;(value) as value from &lt;name&gt;|/&lt;regex&gt;/
 *     [ where &lt;cond&gt; and ...] [ group by [time(&lt;n&gt;&lt;unit&gt;), ]&lt;tag&gt;, ...]
 *     [ order by time [asc|desc]] [ fill(&lt;policy&gt;)] [ limit n] [ offset n]
 * drop series from &lt;name&gt; [ where &lt;cond&gt; and ...]
 * </pre>
 * A condition is {@code time <op> <expr>}, {@code tag = 'v'} or {@code (tag = 'a' or tag = 'b')}.
 */
public final class InfluxQlParser {

    private static final Pattern SELECT = Pattern.compile(
        "^select\\s+(.+?)\\s+from\\s+(/.*?/|\\S+)"
            + "(?:\\s+where\\s+(.+?))?"
            + "(?:\\s+group by\\s+(.+?))?"
            + "(?:\\s+order by\\s+(.+?))?"
            + "(?:\\s+fill\\((.*?)\\))?"
            + "(?:\\s+limit\\s+(\\d+))?"
            + "(?:\\s+offset\\s+(\\d+))?\\s*$",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern DROP = Pattern.compile(
        "^drop series from\\s+(/.*?/|\\S+)(?:\\s+where\\s+(.+?))?\\s*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern AGGREGATE = Pattern.compile("^(\\w+)\\(value\\)(?:\\s+as\\s+value)?$");

    private static final Pattern TIME_GROUP = Pattern.compile("^time\\((\\d+)(u|ms|s|m|h|d|w)\\)$");

    private static final Pattern TIME_CONDITION = Pattern.compile("^time\\s*(>=|<=|>|<|=)\\s*(.+)$");

    private static final Pattern TAG_CONDITION = Pattern.compile("^(\\w+)\\s*=\\s*'(.*)'$");

    private InfluxQlParser() {
    }

    /**
     * A parsed select or drop statement.
     *
     * @param drop          true for {@code drop series}
     * @param measurement   Literal measurement name, null if a regex is used
     * @param measurementRegex Measurement regex, null if a literal is used
     * @param aggregation   Aggregation function, null for raw values
     * @param conditions    Where conditions, all of which must hold
     * @param groupByTags   Tags to group series by
     * @param groupInterval Bucket width of {@code group by time(...)}, null if absent
     * @param descending    Whether rows are ordered newest first
     * @param fill          Fill policy, null if absent
     * @param limit         Row limit per series, null if absent
     * @param offset        Row offset per series, null if absent
     */
    public record ParsedStatement(
        boolean drop,
        String measurement,
        Pattern measurementRegex,
        String aggregation,
        List<Condition> conditions,
        List<String> groupByTags,
        Duration groupInterval,
        boolean descending,
        String fill,
        Integer limit,
        Integer offset
    ) {
    }

    /**
     * One where condition.
     *
     * @param key      {@code time} or a tag name
     * @param operator Comparison operator; always {@code =} for tags
     * @param values   Time expression for time conditions, alternatives for tag conditions
     */
    public record Condition(String key, String operator, List<String> values) {

        public boolean isTime() {
            return "time".equals(key);
        }
    }

    /**
     * Parses a statement.
     *
     * @param statement Statement text
     * @return Parsed form
     * @throws InvalidParameterException if the statement is outside the supported subset
     */
    public static ParsedStatement parse(String statement) {
        String text = statement.trim();
        Matcher drop = DROP.matcher(text);
        if (drop.matches()) {
            return new ParsedStatement(true, literal(drop.group(1)), regex(drop.group(1)), null,
                conditions(drop.group(2)), List.of(), null, false, null, null, null);
        }
        Matcher select = SELECT.matcher(text);
        if (!select.matches()) {
            throw new InvalidParameterException("unsupported statement: " + statement);
        }
        String aggregation = null;
        String valueExpr = select.group(1).trim();
        if (!"value".equals(valueExpr)) {
            Matcher aggregate = AGGREGATE.matcher(valueExpr);
            if (!aggregate.matches()) {
                throw new InvalidParameterException("unsupported select expression: " + valueExpr);
            }
            aggregation = aggregate.group(1).toLowerCase();
        }
        List<String> groupByTags = new ArrayList<>();
        Duration groupInterval = null;
        if (select.group(4) != null) {
            for (String dimension : select.group(4).split(",")) {
                String trimmed = dimension.trim();
                Matcher time = TIME_GROUP.matcher(trimmed);
                if (time.matches()) {
                    groupInterval = unit(time.group(2)).multipliedBy(Long.parseLong(time.group(1)));
                } else if (!trimmed.isEmpty()) {
                    groupByTags.add(trimmed);
                }
            }
        }
        boolean descending = select.group(5) != null && select.group(5).trim().toLowerCase().endsWith("desc");
        return new ParsedStatement(false, literal(select.group(2)), regex(select.group(2)), aggregation,
            conditions(select.group(3)), groupByTags, groupInterval, descending,
            select.group(6) == null ? null : select.group(6).trim(),
            select.group(7) == null ? null : Integer.valueOf(select.group(7)),
            select.group(8) == null ? null : Integer.valueOf(select.group(8)));
    }

    private static List<Condition> conditions(String where) {
        List<Condition> conditions = new ArrayList<>();
        if (where == null) {
            return conditions;
        }
        for (String term : splitTopLevel(where, " and ")) {
            String trimmed = term.trim();
            if (trimmed.startsWith("(") && trimmed.endsWith(")")) {
                trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
            }
            Matcher time = TIME_CONDITION.matcher(trimmed);
            if (time.matches()) {
                conditions.add(new Condition("time", time.group(1), List.of(time.group(2).trim())));
                continue;
            }
            String key = null;
            List<String> values = new ArrayList<>();
            for (String alternative : splitTopLevel(trimmed, " or ")) {
                Matcher tag = TAG_CONDITION.matcher(alternative.trim());
                if (!tag.matches() || (key != null && !key.equals(tag.group(1)))) {
                    throw new InvalidParameterException("unsupported condition: " + term);
                }
                key = tag.group(1);
                values.add(tag.group(2));
            }
            conditions.add(new Condition(key, "=", values));
        }
        return conditions;
    }

    /**
     * Splits at a separator that is neither quoted nor inside parentheses.
     */
    static List<String> splitTopLevel(String text, String separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        boolean quoted = false;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
            } else if (!quoted && depth == 0 && text.startsWith(separator, i)) {
                parts.add(text.substring(start, i));
                start = i + separator.length();
                i = start - 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    private static String literal(String measurement) {
        return isRegex(measurement) ? null : measurement;
    }

    private static Pattern regex(String measurement) {
        return isRegex(measurement) ? Pattern.compile(measurement.substring(1, measurement.length() - 1)) : null;
    }

    private static boolean isRegex(String measurement) {
        return measurement.length() >= 2 && measurement.startsWith("/") && measurement.endsWith("/");
    }

    private static Duration unit(String unit) {
        return switch (unit) {
            case "u" -> Duration.ofNanos(1000);
            case "ms" -> Duration.ofMillis(1);
            case "s" -> Duration.ofSeconds(1);
            case "m" -> Duration.ofMinutes(1);
            case "h" -> Duration.ofHours(1);
            case "d" -> Duration.ofDays(1);
            default -> Duration.ofDays(7);
        };
    }
}
