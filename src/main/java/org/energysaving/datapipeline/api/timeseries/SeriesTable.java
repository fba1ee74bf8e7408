package org.energysaving.datapipeline.api.timeseries;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;

/**
 * Time-indexed table of typed values.
 * <p>
 * Columns are keyed by {@link SeriesKey} and kept in insertion order. A cell holds a
 * {@link Boolean}, {@link Double}, {@link Long} or {@link String}, or is absent (missing sample).
 * Missing cells are never stored as null or zero; the row index is the union of all
 * timestamps that have at least one value.
 * <p>
 * Tables are ephemeral: produced and consumed within one pipeline invocation, not thread-safe.
 */
public final class SeriesTable {

    private final Map<SeriesKey, NavigableMap<Instant, Object>> columns = new LinkedHashMap<>();

    public static SeriesTable empty() {
        return new SeriesTable();
    }

    /**
     * Ensures a column exists, even if it stays empty.
     *
     * @param key Column key
     * @return This table
     */
    public SeriesTable addColumn(SeriesKey key) {
        columns.computeIfAbsent(key, k -> new TreeMap<>());
        return this;
    }

    /**
     * Sets a cell. A null value removes the cell (marks the sample missing).
     *
     * @param key   Column key
     * @param time  Timestamp
     * @param value Cell value or null
     * @return This table
     */
    public SeriesTable put(SeriesKey key, Instant time, Object value) {
        NavigableMap<Instant, Object> column = columns.computeIfAbsent(key, k -> new TreeMap<>());
        if (value == null) {
            column.remove(time);
        } else {
            column.put(time, value);
        }
        return this;
    }

    /**
     * Sets a cell only if it is not set yet.
     *
     * @param key   Column key
     * @param time  Timestamp
     * @param value Cell value, ignored if null
     * @return true if the cell was written
     */
    public boolean putIfAbsent(SeriesKey key, Instant time, Object value) {
        NavigableMap<Instant, Object> column = columns.computeIfAbsent(key, k -> new TreeMap<>());
        if (value == null || column.containsKey(time)) {
            return false;
        }
        column.put(time, value);
        return true;
    }

    /**
     * Replaces a whole column.
     *
     * @param key    Column key
     * @param values Values by timestamp; null values are skipped
     * @return This table
     */
    public SeriesTable putColumn(SeriesKey key, Map<Instant, ?> values) {
        NavigableMap<Instant, Object> column = new TreeMap<>();
        values.forEach((time, value) -> {
            if (value != null) {
                column.put(time, value);
            }
        });
        columns.put(key, column);
        return this;
    }

    public Object get(SeriesKey key, Instant time) {
        NavigableMap<Instant, Object> column = columns.get(key);
        return column == null ? null : column.get(time);
    }

    /**
     * Returns a cell as a double. Booleans count as 1/0.
     *
     * @param key  Column key
     * @param time Timestamp
     * @return Value, or null if missing
     * @throws InvalidParameterException if the cell holds a non-numeric value
     */
    public Double getDouble(SeriesKey key, Instant time) {
        return toDouble(key, get(key, time));
    }

    public boolean hasColumn(SeriesKey key) {
        return columns.containsKey(key);
    }

    /**
     * Returns the column keys in insertion order.
     *
     * @return Unmodifiable list
     */
    public List<SeriesKey> columns() {
        return List.copyOf(columns.keySet());
    }

    /**
     * Returns one column as an unmodifiable view.
     *
     * @param key Column key
     * @return Values by timestamp, empty if the column does not exist
     */
    public NavigableMap<Instant, Object> column(SeriesKey key) {
        NavigableMap<Instant, Object> column = columns.get(key);
        return column == null ? Collections.emptyNavigableMap() : Collections.unmodifiableNavigableMap(column);
    }

    /**
     * Returns one column converted to doubles.
     *
     * @param key Column key
     * @return New sorted map
     * @throws InvalidParameterException if the column holds non-numeric values
     */
    public NavigableMap<Instant, Double> numericColumn(SeriesKey key) {
        NavigableMap<Instant, Double> result = new TreeMap<>();
        column(key).forEach((time, value) -> result.put(time, toDouble(key, value)));
        return result;
    }

    /**
     * Returns the sorted union of all timestamps.
     *
     * @return New sorted set
     */
    public NavigableSet<Instant> index() {
        NavigableSet<Instant> index = new TreeSet<>();
        for (NavigableMap<Instant, Object> column : columns.values()) {
            index.addAll(column.keySet());
        }
        return index;
    }

    public int columnCount() {
        return columns.size();
    }

    public int rowCount() {
        return index().size();
    }

    public boolean isEmpty() {
        for (NavigableMap<Instant, Object> column : columns.values()) {
            if (!column.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Projects the table onto the given columns, in the given order. Columns absent from this
     * table appear empty.
     *
     * @param keys Columns to keep
     * @return New table
     */
    public SeriesTable select(Collection<SeriesKey> keys) {
        SeriesTable result = new SeriesTable();
        for (SeriesKey key : keys) {
            result.putColumn(key, column(key));
        }
        return result;
    }

    /**
     * Copies all columns of another table into this one. Cells already set here win.
     *
     * @param other Table to merge in
     * @return This table
     */
    public SeriesTable mergeFrom(SeriesTable other) {
        for (SeriesKey key : other.columns()) {
            addColumn(key);
            other.column(key).forEach((time, value) -> putIfAbsent(key, time, value));
        }
        return this;
    }

    /**
     * Keeps only the given timestamps.
     *
     * @param index Timestamps to keep
     * @return New table with the same columns
     */
    public SeriesTable restrictTo(Set<Instant> index) {
        SeriesTable result = new SeriesTable();
        columns.forEach((key, column) -> {
            result.addColumn(key);
            column.forEach((time, value) -> {
                if (index.contains(time)) {
                    result.put(key, time, value);
                }
            });
        });
        return result;
    }

    /**
     * Returns the timestamps at which every column has a value. A table without columns has none.
     *
     * @return New sorted set
     */
    public NavigableSet<Instant> completeIndex() {
        NavigableSet<Instant> complete = new TreeSet<>();
        if (columns.isEmpty()) {
            return complete;
        }
        complete.addAll(index());
        for (NavigableMap<Instant, Object> column : columns.values()) {
            complete.retainAll(column.keySet());
        }
        return complete;
    }

    /**
     * Drops every timestamp that has a missing value in any column.
     *
     * @return New table
     */
    public SeriesTable dropMissing() {
        return restrictTo(completeIndex());
    }

    /**
     * Converts a cell value to a double.
     *
     * @param key   Column, used for the error message
     * @param value Cell value or null
     * @return Double or null
     * @throws InvalidParameterException for non-numeric values
     */
    public static Double toDouble(SeriesKey key, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1.0 : 0.0;
        }
        throw new InvalidParameterException("column " + key + " holds non-numeric value " + value);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof SeriesTable && columns.equals(((SeriesTable) o).columns));
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        List<String> names = new ArrayList<>();
        columns.keySet().forEach(key -> names.add(key.toString()));
        return "SeriesTable[columns=" + names + ", rows=" + rowCount() + "]";
    }
}
