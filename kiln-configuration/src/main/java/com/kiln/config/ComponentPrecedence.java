package com.kiln.config;

import java.util.Locale;

/**
 * Which source wins when a component name exists both as a built-in and as a discovered plugin
 * executable.
 */
public enum ComponentPrecedence {

    /** Built-in implementation is used; the plugin executable is ignored. */
    BUILTIN_FIRST,

    /** Plugin executable is used; lets a user override a built-in without rebuilding the host. */
    PLUGIN_FIRST;

    /**
     * Parses {@code builtin-first} / {@code plugin-first} (case-insensitive, {@code _} accepted for {@code -}).
     *
     * @return parsed value, or {@code defaultValue} when blank or unrecognized
     */
    public static ComponentPrecedence parse(String value, ComponentPrecedence defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String v = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ComponentPrecedence p : values()) {
            if (p.name().equals(v)) {
                return p;
            }
        }
        return defaultValue;
    }
}
