package com.kiln.component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Loosely typed, immutable configuration: string keys, values limited to {@link String},
 * {@link Boolean}, {@link Long}, {@link Double}, {@link List} of such values and nested bundles.
 * This is the only configuration type that crosses the plugin boundary, so plugins built against
 * another version of the host can still read what they understand.
 */
public final class ConfigBundle {

    private static final ConfigBundle EMPTY = new ConfigBundle(Map.of());

    private final Map<String, Object> values;

    private ConfigBundle(Map<String, Object> values) {
        this.values = values;
    }

    public static ConfigBundle empty() {
        return EMPTY;
    }

    /**
     * Creates a bundle from a plain map, normalizing numbers ({@code Integer} → {@code Long},
     * {@code Float} → {@code Double}) and nested maps (→ {@code ConfigBundle}). Null values are dropped.
     *
     * @throws IllegalArgumentException if a key is blank or a value has an unsupported type
     */
    public static ConfigBundle of(Map<String, ?> map) {
        if (map == null || map.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : map.entrySet()) {
            String key = e.getKey();
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Configuration key must be non-blank");
            }
            if (e.getValue() != null) {
                out.put(key, normalize(key, e.getValue()));
            }
        }
        return new ConfigBundle(Collections.unmodifiableMap(out));
    }

    /**
     * Overlays bundles left to right: a key in a later bundle replaces the same key in an earlier one.
     */
    public static ConfigBundle merge(List<ConfigBundle> bundles) {
        if (bundles == null || bundles.isEmpty()) {
            return EMPTY;
        }
        if (bundles.size() == 1) {
            return bundles.get(0) != null ? bundles.get(0) : EMPTY;
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (ConfigBundle b : bundles) {
            if (b != null) {
                out.putAll(b.values);
            }
        }
        return new ConfigBundle(Collections.unmodifiableMap(out));
    }

    /** Returns a copy with {@code key} set to {@code value} (or removed when value is null). */
    public ConfigBundle with(String key, Object value) {
        Map<String, Object> out = new LinkedHashMap<>(values);
        if (value == null) {
            out.remove(key);
        } else {
            out.put(key, value);
        }
        return of(out);
    }

    /** Raw value (one of the supported types), or null. */
    public Object get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    /** Immutable view; nested bundles stay bundles. */
    public Map<String, Object> asMap() {
        return values;
    }

    /** Plain nested maps and lists (for serialization). */
    public Map<String, Object> toPlainMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : values.entrySet()) {
            out.put(e.getKey(), toPlain(e.getValue()));
        }
        return out;
    }

    private static Object toPlain(Object value) {
        if (value instanceof ConfigBundle) {
            return ((ConfigBundle) value).toPlainMap();
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(toPlain(item));
            }
            return out;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Object normalize(String key, Object value) {
        if (value instanceof String || value instanceof Boolean || value instanceof Long
                || value instanceof Double || value instanceof ConfigBundle) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof BigInteger big) {
            return big.longValueExact();
        }
        if (value instanceof BigDecimal dec) {
            return dec.doubleValue();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (!(e.getKey() instanceof String)) {
                    throw new IllegalArgumentException("Configuration key under '" + key + "' must be a string");
                }
                nested.put((String) e.getKey(), e.getValue());
            }
            return of(nested);
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item == null) {
                    throw new IllegalArgumentException("Configuration list '" + key + "' contains a null element");
                }
                out.add(normalize(key, item));
            }
            return Collections.unmodifiableList(out);
        }
        if (value instanceof Object[] array) {
            return normalize(key, List.of(array));
        }
        throw new IllegalArgumentException("Unsupported configuration value type for '" + key + "': "
                + value.getClass().getName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConfigBundle)) return false;
        return values.equals(((ConfigBundle) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
