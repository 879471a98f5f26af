package com.kiln.plugin;

import com.kiln.component.ComponentKind;

import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Where a component comes from: a built-in factory or a plugin executable. Exactly one of
 * {@code factory} and {@code executable} is set.
 */
public record ComponentDescriptor(ComponentKind kind, String name, Supplier<?> factory, Path executable) {

    public ComponentDescriptor {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        if ((factory == null) == (executable == null)) {
            throw new IllegalArgumentException("exactly one of factory and executable must be set");
        }
    }

    public static ComponentDescriptor builtin(ComponentKind kind, String name, Supplier<?> factory) {
        return new ComponentDescriptor(kind, name, Objects.requireNonNull(factory, "factory"), null);
    }

    public static ComponentDescriptor plugin(ComponentKind kind, String name, Path executable) {
        return new ComponentDescriptor(kind, name, null, Objects.requireNonNull(executable, "executable"));
    }

    public boolean isBuiltin() {
        return factory != null;
    }

    /** "builtin" or the executable path. */
    public String source() {
        return isBuiltin() ? "builtin" : executable.toString();
    }
}
