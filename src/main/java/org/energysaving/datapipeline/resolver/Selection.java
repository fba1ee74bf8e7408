package org.energysaving.datapipeline.resolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.energysaving.datapipeline.api.exceptions.InvalidParameterException;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Caller-supplied selection over one level of the {@code device_type -> measurement -> device}
 * hierarchy.
 * <p>
 * A selection is either {@link Kind#ALL} (everything known at this level), a list of names, or a
 * mapping from names to the selection of the next level. A single name is a one-element list.
 * <p>
 * Examples as JSON: {@code null} or {@code {}} selects everything,
 * {@code "sensor_attribute"} selects one device type, and
 * {@code {"sensor_attribute": {"temperature": ["s1"]}}} selects one device.
 */
public final class Selection {

    /**
     * Shape of a selection.
     */
    public enum Kind {
        ALL,
        NAMES,
        MAPPING
    }

    private static final Selection ALL = new Selection(Kind.ALL, List.of(), Map.of());

    private final Kind kind;
    private final List<String> names;
    private final Map<String, Selection> children;

    private Selection(Kind kind, List<String> names, Map<String, Selection> children) {
        this.kind = kind;
        this.names = names;
        this.children = children;
    }

    public static Selection all() {
        return ALL;
    }

    /**
     * Selects the given names. An empty list means everything.
     *
     * @param names Names at this level
     * @return Selection
     */
    public static Selection names(List<String> names) {
        if (names == null || names.isEmpty()) {
            return ALL;
        }
        return new Selection(Kind.NAMES, List.copyOf(names), Map.of());
    }

    public static Selection names(String... names) {
        return names(List.of(names));
    }

    /**
     * Selects names with a nested selection for each. An empty mapping means everything.
     *
     * @param children Name to next-level selection; null values mean everything below
     * @return Selection
     */
    public static Selection mapping(Map<String, Selection> children) {
        if (children == null || children.isEmpty()) {
            return ALL;
        }
        Map<String, Selection> copy = new LinkedHashMap<>();
        children.forEach((name, child) -> copy.put(name, child == null ? ALL : child));
        return new Selection(Kind.MAPPING, List.copyOf(copy.keySet()), Collections.unmodifiableMap(copy));
    }

    /**
     * Parses the JSON form used by model-type configuration files and requests.
     *
     * @param json null, a string, an array of strings, or an object of nested selections
     * @return Selection
     * @throws InvalidParameterException for any other shape
     */
    public static Selection fromJson(JsonElement json) {
        if (json == null || json.isJsonNull()) {
            return ALL;
        }
        if (json.isJsonPrimitive()) {
            return names(json.getAsString());
        }
        if (json.isJsonArray()) {
            JsonArray array = json.getAsJsonArray();
            List<String> names = new ArrayList<>(array.size());
            for (JsonElement element : array) {
                if (!element.isJsonPrimitive()) {
                    throw new InvalidParameterException("selection list must contain names, got " + element);
                }
                names.add(element.getAsString());
            }
            return names(names);
        }
        JsonObject object = json.getAsJsonObject();
        Map<String, Selection> children = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            children.put(entry.getKey(), fromJson(entry.getValue()));
        }
        return mapping(children);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isAll() {
        return kind == Kind.ALL;
    }

    /**
     * Returns the selected names, in selection order.
     *
     * @return Names, empty for {@link Kind#ALL}
     */
    public List<String> getNames() {
        return names;
    }

    /**
     * Returns the next-level selection for a name.
     *
     * @param name A selected name
     * @return Nested selection, or {@link #all()} if this is not a mapping
     */
    public Selection child(String name) {
        return children.getOrDefault(name, ALL);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Selection)) {
            return false;
        }
        Selection that = (Selection) o;
        return kind == that.kind && names.equals(that.names) && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, names, children);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ALL -> "*";
            case NAMES -> names.toString();
            case MAPPING -> children.toString();
        };
    }
}
