package com.kiln.config;

import com.kiln.component.ConfigBundle;
import com.kiln.component.error.ConfigException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Typed reads from a {@link ConfigBundle} that collect problems instead of failing on the first
 * one. Components read every field they need, then call {@link #validate()} so the user gets a
 * single {@link ConfigException} listing every mistake.
 * <pre>
 * ConfigDecoder d = ConfigDecoder.of(raws);
 * String id = d.requireString("artifact_id");
 * List&lt;String&gt; files = d.optionalStringList("files", List.of());
 * d.rejectUnknownKeys();
 * d.validate();
 * </pre>
 */
public final class ConfigDecoder {

    private final ConfigBundle bundle;
    private final Set<String> readKeys = new LinkedHashSet<>();
    private final List<String> errors = new ArrayList<>();

    private ConfigDecoder(ConfigBundle bundle) {
        this.bundle = bundle != null ? bundle : ConfigBundle.empty();
    }

    /** Decoder over the merge of {@code raws} (later bundles override earlier ones). */
    public static ConfigDecoder of(List<ConfigBundle> raws) {
        return new ConfigDecoder(ConfigBundle.merge(raws));
    }

    public static ConfigDecoder of(ConfigBundle bundle) {
        return new ConfigDecoder(bundle);
    }

    public ConfigBundle bundle() {
        return bundle;
    }

    public boolean has(String key) {
        readKeys.add(key);
        return bundle.containsKey(key);
    }

    /** Reads a required non-empty string; records an error when missing, empty or not a string. */
    public String requireString(String key) {
        readKeys.add(key);
        Object v = bundle.get(key);
        if (v == null) {
            errors.add(key + " must be specified");
            return null;
        }
        if (!(v instanceof String s)) {
            errors.add(key + ": expected string, got " + typeName(v));
            return null;
        }
        if (s.isEmpty()) {
            errors.add(key + " must not be empty");
            return null;
        }
        return s;
    }

    public String optionalString(String key, String defaultValue) {
        readKeys.add(key);
        Object v = bundle.get(key);
        if (v == null) {
            return defaultValue;
        }
        if (!(v instanceof String)) {
            errors.add(key + ": expected string, got " + typeName(v));
            return defaultValue;
        }
        return (String) v;
    }

    public boolean optionalBoolean(String key, boolean defaultValue) {
        readKeys.add(key);
        Object v = bundle.get(key);
        if (v == null) {
            return defaultValue;
        }
        if (v instanceof Boolean b) {
            return b;
        }
        if (v instanceof String s && ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s))) {
            return Boolean.parseBoolean(s);
        }
        errors.add(key + ": expected boolean, got " + typeName(v));
        return defaultValue;
    }

    public long optionalLong(String key, long defaultValue) {
        readKeys.add(key);
        Object v = bundle.get(key);
        if (v == null) {
            return defaultValue;
        }
        if (v instanceof Long l) {
            return l;
        }
        if (v instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                errors.add(key + ": expected integer, got '" + s + "'");
                return defaultValue;
            }
        }
        errors.add(key + ": expected integer, got " + typeName(v));
        return defaultValue;
    }

    /** Reads a list of strings; a single string is accepted as a one-element list. */
    public List<String> optionalStringList(String key, List<String> defaultValue) {
        readKeys.add(key);
        Object v = bundle.get(key);
        if (v == null) {
            return defaultValue;
        }
        if (v instanceof String s) {
            return List.of(s);
        }
        if (!(v instanceof List<?> list)) {
            errors.add(key + ": expected list of strings, got " + typeName(v));
            return defaultValue;
        }
        List<String> out = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            Object item = list.get(i);
            if (!(item instanceof String)) {
                errors.add(key + "[" + i + "]: expected string, got " + typeName(item));
                return defaultValue;
            }
            out.add((String) item);
        }
        return List.copyOf(out);
    }

    public ConfigBundle optionalBundle(String key) {
        readKeys.add(key);
        Object v = bundle.get(key);
        if (v == null) {
            return ConfigBundle.empty();
        }
        if (!(v instanceof ConfigBundle)) {
            errors.add(key + ": expected object, got " + typeName(v));
            return ConfigBundle.empty();
        }
        return (ConfigBundle) v;
    }

    /** Marks keys as known without reading them (e.g. keys consumed by the host, like {@code type}). */
    public ConfigDecoder ignore(String... keys) {
        readKeys.addAll(Arrays.asList(keys));
        return this;
    }

    /** Records an error for every key in the bundle that was never read, ignored or checked. */
    public ConfigDecoder rejectUnknownKeys() {
        for (String key : bundle.keys()) {
            if (!readKeys.contains(key)) {
                errors.add("unknown configuration key: '" + key + "'");
            }
        }
        return this;
    }

    /** Records a component-specific problem. */
    public ConfigDecoder error(String message) {
        errors.add(message);
        return this;
    }

    public List<String> errors() {
        return List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @throws ConfigException listing every recorded problem, if there is at least one
     */
    public void validate() {
        if (!errors.isEmpty()) {
            throw new ConfigException(errors);
        }
    }

    private static String typeName(Object v) {
        if (v instanceof String) return "string";
        if (v instanceof Boolean) return "boolean";
        if (v instanceof Long) return "integer";
        if (v instanceof Double) return "number";
        if (v instanceof List) return "list";
        if (v instanceof ConfigBundle) return "object";
        return v.getClass().getSimpleName();
    }
}
