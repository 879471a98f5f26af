package com.kiln.internal.components;

import com.kiln.component.ComponentKind;
import com.kiln.internal.components.builder.FileBuilder;
import com.kiln.internal.components.builder.NullBuilder;
import com.kiln.internal.components.command.BuildCommand;
import com.kiln.internal.components.command.PluginCommand;
import com.kiln.internal.components.command.PluginsCommand;
import com.kiln.internal.components.command.ValidateCommand;
import com.kiln.internal.components.command.VersionCommand;
import com.kiln.internal.components.hook.EchoHook;
import com.kiln.internal.components.postprocessor.ChecksumPostProcessor;
import com.kiln.internal.components.provisioner.ShellLocalProvisioner;
import com.kiln.plugin.ComponentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Components compiled into Kiln. Registered explicitly (no classpath scanning) so the set is
 * visible in one place; the same table backs the hidden {@code plugin} command that serves a
 * built-in over the plugin protocol.
 */
public final class InternalComponents {

    private static final Logger log = LoggerFactory.getLogger(InternalComponents.class);

    private static final Map<ComponentKind, Map<String, Supplier<?>>> TABLE = createTable();

    private InternalComponents() {
    }

    private static Map<ComponentKind, Map<String, Supplier<?>>> createTable() {
        Map<ComponentKind, Map<String, Supplier<?>>> table = new EnumMap<>(ComponentKind.class);
        register(table, ComponentKind.BUILDER, "null", NullBuilder::new);
        register(table, ComponentKind.BUILDER, "file", FileBuilder::new);
        register(table, ComponentKind.PROVISIONER, "shell-local", ShellLocalProvisioner::new);
        register(table, ComponentKind.POST_PROCESSOR, "checksum", ChecksumPostProcessor::new);
        register(table, ComponentKind.HOOK, "echo", EchoHook::new);
        register(table, ComponentKind.COMMAND, "build", BuildCommand::new);
        register(table, ComponentKind.COMMAND, "validate", ValidateCommand::new);
        register(table, ComponentKind.COMMAND, "version", VersionCommand::new);
        register(table, ComponentKind.COMMAND, "plugins", PluginsCommand::new);
        register(table, ComponentKind.COMMAND, "plugin", PluginCommand::new);
        table.replaceAll((kind, byName) -> Collections.unmodifiableMap(byName));
        return Collections.unmodifiableMap(table);
    }

    private static void register(Map<ComponentKind, Map<String, Supplier<?>>> table,
                                 ComponentKind kind, String name, Supplier<?> factory) {
        table.computeIfAbsent(kind, k -> new LinkedHashMap<>()).put(name, factory);
    }

    /** Adds every built-in component to the registry being built. */
    public static ComponentRegistry.Builder registerAll(ComponentRegistry.Builder builder) {
        int count = 0;
        for (Map.Entry<ComponentKind, Map<String, Supplier<?>>> byKind : TABLE.entrySet()) {
            for (Map.Entry<String, Supplier<?>> e : byKind.getValue().entrySet()) {
                builder.builtin(byKind.getKey(), e.getKey(), e.getValue());
                count++;
            }
        }
        log.debug("Registered {} built-in components", count);
        return builder;
    }

    public static Optional<Supplier<?>> lookup(ComponentKind kind, String name) {
        return Optional.ofNullable(components(kind).get(name));
    }

    /** Built-in names of one kind, in registration order. */
    public static Map<String, Supplier<?>> components(ComponentKind kind) {
        return TABLE.getOrDefault(kind, Map.of());
    }
}
