package org.energysaving.datapipeline.query;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;

/**
 * Time-bound literals of the query language.
 * <p>
 * Two grammars are accepted. The relative grammar is {@code [now()] [+-]N<unit> ([+-] N<unit>)*}
 * with units {@code u, ms, s, m, h, d, w}; it is matched first and rendered anchored to
 * {@code now()} with single spaces around each sign ({@code -1h} becomes {@code now() - 1h}).
 * Anything else must be a calendar timestamp and is rendered as a quoted RFC3339 instant.
 * Timestamps without offset are taken as UTC.
 */
public final class TimeExpression {

    public static final String NOW = "now()";

    private static final String OFFSET = "\\d+(?:u|ms|s|m|h|d|w)";

    private static final Pattern RELATIVE = Pattern.compile(
        "^(now\\(\\))?\\s*[+-]?\\s*" + OFFSET + "(\\s*[+-]\\s*" + OFFSET + ")*$");

    private static final Pattern SIGN = Pattern.compile("\\s*([+-])\\s*");

    private static final Pattern TERM = Pattern.compile("([+-])\\s*(\\d+)(u|ms|s|m|h|d|w)");

    private static final Pattern QUOTED = Pattern.compile("^'(.*)'$");

    private static final Pattern DATE_ONLY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private TimeExpression() {
    }

    /**
     * Renders a caller literal as a query-language time expression.
     *
     * @param literal Time literal, e.g. {@code -1h}, {@code now() - 30m}, {@code 2024-01-01T00:00:00Z}
     * @return Rendered expression, or null if the literal is null or blank
     * @throws InvalidParameterException if the literal is neither relative nor a parseable timestamp
     */
    public static String render(String literal) {
        if (literal == null || literal.isBlank()) {
            return null;
        }
        String trimmed = literal.trim();
        if (NOW.equals(trimmed)) {
            return NOW;
        }
        String anchored = anchor(trimmed);
        if (RELATIVE.matcher(anchored).matches()) {
            String body = anchored.substring(NOW.length()).trim();
            if (!body.startsWith("+") && !body.startsWith("-")) {
                body = "+" + body;
            }
            return NOW + SIGN.matcher(body).replaceAll(" $1 ");
        }
        return "'" + DateTimeFormatter.ISO_INSTANT.format(parseTimestamp(trimmed)) + "'";
    }

    /**
     * Evaluates a rendered expression against a reference instant.
     *
     * @param rendered Output of {@link #render(String)}
     * @param now      Value of {@code now()}
     * @return The instant denoted
     * @throws InvalidParameterException if the expression cannot be evaluated
     */
    public static Instant evaluate(String rendered, Instant now) {
        String trimmed = rendered.trim();
        Matcher quoted = QUOTED.matcher(trimmed);
        if (quoted.matches()) {
            return parseTimestamp(quoted.group(1));
        }
        if (!trimmed.startsWith(NOW)) {
            throw new InvalidParameterException("cannot evaluate time expression " + rendered);
        }
        String body = trimmed.substring(NOW.length()).replace(" ", "");
        Instant result = now;
        Matcher term = TERM.matcher(body);
        int consumed = 0;
        while (term.find()) {
            if (term.start() != consumed) {
                throw new InvalidParameterException("cannot evaluate time expression " + rendered);
            }
            Duration offset = unitDuration(term.group(3)).multipliedBy(Long.parseLong(term.group(2)));
            result = "+".equals(term.group(1)) ? result.plus(offset) : result.minus(offset);
            consumed = term.end();
        }
        if (consumed != body.length()) {
            throw new InvalidParameterException("cannot evaluate time expression " + rendered);
        }
        return result;
    }

    /**
     * Parses a calendar timestamp.
     *
     * @param text ISO-8601 instant, offset date-time, local date-time ({@code T} or space) or date
     * @return The instant, local values interpreted as UTC
     * @throws InvalidParameterException if no format matches
     */
    public static Instant parseTimestamp(String text) {
        String value = text.trim();
        try {
            if (DATE_ONLY.matcher(value).matches()) {
                return LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
            String isoValue = value.replaceFirst("^(\\d{4}-\\d{2}-\\d{2}) ", "$1T");
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                isoValue, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidParameterException("time " + text + " is neither a relative offset nor a timestamp", e);
        }
    }

    private static String anchor(String literal) {
        if (literal.startsWith("+") || literal.startsWith("-")) {
            return NOW + literal;
        }
        if (!literal.startsWith(NOW) && !literal.isEmpty() && Character.isDigit(literal.charAt(0))
                && RELATIVE.matcher(literal).matches()) {
            return NOW + "+" + literal;
        }
        return literal;
    }

    private static Duration unitDuration(String unit) {
        return switch (unit) {
            case "u" -> ChronoUnit.MICROS.getDuration();
            case "ms" -> ChronoUnit.MILLIS.getDuration();
            case "s" -> ChronoUnit.SECONDS.getDuration();
            case "m" -> ChronoUnit.MINUTES.getDuration();
            case "h" -> ChronoUnit.HOURS.getDuration();
            case "d" -> ChronoUnit.DAYS.getDuration();
            case "w" -> ChronoUnit.WEEKS.getDuration();
            default -> throw new InvalidParameterException("unknown time unit " + unit);
        };
    }
}
