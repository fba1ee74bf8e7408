package org.energysaving.datapipeline.utils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;
import org.energysaving.datapipeline.api.timeseries.SeriesKey;
import org.energysaving.datapipeline.api.timeseries.SeriesTable;
import org.energysaving.datapipeline.api.timeseries.TimePrecision;
import org.energysaving.datapipeline.shaping.TimestampConverter;

/**
 * CSV exchange format of one measurement: a {@code time} column followed by one column per
 * device, devices sorted by name, missing samples as empty cells.
 * <p>
 * Imported cells are typed by shape: {@code true}/{@code false} become booleans, whole numbers
 * longs, decimal numbers doubles, anything else stays a string.
 */
public final class SeriesCsv {

    private static final Pattern BOOLEAN = Pattern.compile("^(true|false|True|False)$");
    private static final Pattern LONG = Pattern.compile("^[+-]?\\d+$");
    private static final Pattern DOUBLE = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");

    private SeriesCsv() {
    }

    /**
     * Writes the columns of one measurement.
     *
     * @param table       Table holding the measurement's columns
     * @param deviceType  Device-type wire name
     * @param measurement Measurement name
     * @param precision   Format of the time column
     * @param out         Target
     * @throws IOException if writing fails
     */
    public static void write(SeriesTable table, String deviceType, String measurement, TimePrecision precision,
                             Writer out) throws IOException {
        List<SeriesKey> keys = new ArrayList<>();
        TreeSet<String> devices = new TreeSet<>();
        for (SeriesKey key : table.columns()) {
            if (key.deviceType().equals(deviceType) && key.measurement().equals(measurement)) {
                devices.add(key.device());
            }
        }
        devices.forEach(device -> keys.add(SeriesKey.of(deviceType, measurement, device)));
        SeriesTable selected = table.select(keys);

        StringBuilder header = new StringBuilder("time");
        devices.forEach(device -> header.append(',').append(quote(device)));
        out.write(header.append('\n').toString());
        for (Instant time : selected.index()) {
            StringBuilder line = new StringBuilder(String.valueOf(TimestampConverter.format(time, precision)));
            for (SeriesKey key : keys) {
                Object value = selected.get(key, time);
                line.append(',').append(value == null ? "" : quote(value.toString()));
            }
            out.write(line.append('\n').toString());
        }
        out.flush();
    }

    /**
     * Reads a CSV document into columns of one measurement.
     *
     * @param in          Source
     * @param deviceType  Device-type wire name for the column keys
     * @param measurement Measurement name for the column keys
     * @param precision   Format of the time column
     * @return Table with one column per device
     * @throws IOException if reading fails
     * @throws InvalidParameterException if the document has no header or a row is wider than the header
     */
    public static SeriesTable read(Reader in, String deviceType, String measurement, TimePrecision precision)
            throws IOException {
        SeriesTable table = new SeriesTable();
        BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        List<SeriesKey> keys = null;
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            List<String> cells = split(line);
            if (keys == null) {
                keys = new ArrayList<>();
                for (String device : cells.subList(1, cells.size())) {
                    SeriesKey key = SeriesKey.of(deviceType, measurement, device);
                    keys.add(key);
                    table.addColumn(key);
                }
                continue;
            }
            if (cells.size() - 1 > keys.size()) {
                throw new InvalidParameterException("line " + lineNumber + " has more cells than the header");
            }
            Instant time = TimestampConverter.toInstant(cells.get(0), precision);
            for (int i = 1; i < cells.size(); i++) {
                String cell = cells.get(i);
                if (!cell.isEmpty()) {
                    table.put(keys.get(i - 1), time, convert(cell));
                }
            }
        }
        if (keys == null) {
            throw new InvalidParameterException("CSV document has no header");
        }
        return table;
    }

    /**
     * Types a cell by its shape.
     *
     * @param cell Non-empty cell text
     * @return Boolean, Long, Double or the text itself
     */
    public static Object convert(String cell) {
        if (BOOLEAN.matcher(cell).matches()) {
            return Boolean.parseBoolean(cell);
        }
        if (LONG.matcher(cell).matches()) {
            return Long.parseLong(cell);
        }
        if (DOUBLE.matcher(cell).matches()) {
            return Double.parseDouble(cell);
        }
        return cell;
    }

    static List<String> split(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    cell.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    cell.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(cell.toString());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        cells.add(cell.toString());
        return cells;
    }

    private static String quote(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
