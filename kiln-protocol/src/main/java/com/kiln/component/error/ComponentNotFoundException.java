package com.kiln.component.error;

import com.kiln.component.ComponentKind;

/**
 * No built-in implementation and no plugin executable exist for the requested name.
 */
public final class ComponentNotFoundException extends KilnException {

    private final ComponentKind kind;
    private final String name;

    public ComponentNotFoundException(ComponentKind kind, String name) {
        super("Unknown " + kind.wireName() + " type: " + name);
        this.kind = kind;
        this.name = name;
    }

    public ComponentKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }
}
