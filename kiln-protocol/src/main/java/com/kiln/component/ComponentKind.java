package com.kiln.component;

import java.util.Locale;

/**
 * Capability kinds a component may implement. Each kind has its own interface, its own
 * plugin executable naming segment ({@code kiln-<kind>-<name>}) and its own registration table.
 */
public enum ComponentKind {

    BUILDER("builder", Builder.class),
    PROVISIONER("provisioner", Provisioner.class),
    POST_PROCESSOR("post-processor", PostProcessor.class),
    HOOK("hook", Hook.class),
    COMMAND("command", Command.class);

    private final String wireName;
    private final Class<?> capabilityType;

    ComponentKind(String wireName, Class<?> capabilityType) {
        this.wireName = wireName;
        this.capabilityType = capabilityType;
    }

    /** Name used in plugin executable names and in error messages (e.g. {@code post-processor}). */
    public String wireName() {
        return wireName;
    }

    /** Interface every implementation of this kind satisfies. */
    public Class<?> capabilityType() {
        return capabilityType;
    }

    /**
     * Resolves a kind from its wire name, case-insensitively.
     *
     * @throws IllegalArgumentException if no kind has that name
     */
    public static ComponentKind fromWireName(String name) {
        if (name != null) {
            String n = name.trim().toLowerCase(Locale.ROOT);
            for (ComponentKind kind : values()) {
                if (kind.wireName.equals(n)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown component kind: " + name);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
