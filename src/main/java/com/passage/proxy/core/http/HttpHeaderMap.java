package com.passage.proxy.core.http;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Ordered, case-insensitive, multi-valued HTTP header collection.
 * <p>
 * Each logical header is stored once, keyed by its lower-cased name, together
 * with the spelling it was last written under. Writing a name in a different
 * case therefore replaces the existing entry instead of creating a duplicate,
 * so {@code location} and {@code Location} can never coexist.
 * <p>
 * Not thread-safe. Instances are owned by a single request.
 */
public final class HttpHeaderMap {

    private final LinkedHashMap<String, Field> fields;

    public HttpHeaderMap() {
        this.fields = new LinkedHashMap<>();
    }

    private HttpHeaderMap(LinkedHashMap<String, Field> fields) {
        this.fields = fields;
    }

    /**
     * Creates a header map from a multi-value map, keeping iteration order.
     * Names differing only in case are merged under the first spelling seen.
     *
     * @param source header name to values
     * @return a new map
     */
    public static HttpHeaderMap of(Map<String, List<String>> source) {
        HttpHeaderMap headers = new HttpHeaderMap();
        if (source != null) {
            source.forEach((name, values) -> values.forEach(v -> headers.add(name, v)));
        }
        return headers;
    }

    /**
     * Returns a deep copy whose mutations do not affect this map.
     *
     * @return an independent copy
     */
    public HttpHeaderMap copy() {
        LinkedHashMap<String, Field> copied = new LinkedHashMap<>();
        fields.forEach((key, field) -> copied.put(key, new Field(field.name, new ArrayList<>(field.values))));
        return new HttpHeaderMap(copied);
    }

    /**
     * First value for a header name (case-insensitive).
     *
     * @param name header name
     * @return the first value, or {@code null} if the header is absent
     */
    public String first(String name) {
        Field field = fields.get(key(name));
        return field != null && !field.values.isEmpty() ? field.values.get(0) : null;
    }

    /**
     * All values for a header name (case-insensitive).
     *
     * @param name header name
     * @return an unmodifiable list of values, empty if absent
     */
    public List<String> all(String name) {
        Field field = fields.get(key(name));
        return field != null ? Collections.unmodifiableList(field.values) : List.of();
    }

    /**
     * True if the header exists (case-insensitive).
     *
     * @param name header name
     * @return {@code true} if present
     */
    public boolean contains(String name) {
        return fields.containsKey(key(name));
    }

    /**
     * The spelling under which a header is currently stored.
     *
     * @param name header name in any case
     * @return the stored spelling, or {@code null} if absent
     */
    public String storedName(String name) {
        Field field = fields.get(key(name));
        return field != null ? field.name : null;
    }

    /**
     * Appends a value, keeping the stored spelling if the header already exists.
     *
     * @param name  header name
     * @param value header value
     * @return this map
     */
    public HttpHeaderMap add(String name, String value) {
        fields.computeIfAbsent(key(name), k -> new Field(name, new ArrayList<>())).values.add(value);
        return this;
    }

    /**
     * Replaces every case variant of a header with a single value stored under
     * exactly the given spelling.
     *
     * @param name  canonical header name
     * @param value header value
     * @return this map
     */
    public HttpHeaderMap set(String name, String value) {
        List<String> values = new ArrayList<>(1);
        values.add(value);
        fields.put(key(name), new Field(name, values));
        return this;
    }

    /**
     * Replaces the values of a header while keeping the spelling it is stored
     * under; behaves like {@link #set} when the header is absent.
     *
     * @param name  header name in any case
     * @param value header value
     * @return this map
     */
    public HttpHeaderMap replaceValue(String name, String value) {
        String stored = storedName(name);
        return set(stored != null ? stored : name, value);
    }

    /**
     * Removes a header in every case variant.
     *
     * @param name header name
     * @return {@code true} if something was removed
     */
    public boolean remove(String name) {
        return fields.remove(key(name)) != null;
    }

    /**
     * Visits every (name, value) pair in insertion order, one call per value.
     *
     * @param action receives the stored spelling and a value
     */
    public void forEach(BiConsumer<String, String> action) {
        fields.values().forEach(field -> field.values.forEach(v -> action.accept(field.name, v)));
    }

    /**
     * Stored header names in insertion order.
     *
     * @return an unmodifiable list of names
     */
    public List<String> names() {
        List<String> names = new ArrayList<>(fields.size());
        fields.values().forEach(field -> names.add(field.name));
        return Collections.unmodifiableList(names);
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "HttpHeaderMap" + names();
    }

    private static final class Field {
        private final String name;
        private final List<String> values;

        private Field(String name, List<String> values) {
            this.name = name;
            this.values = values;
        }
    }
}
