package com.kiln.plugin;

import com.kiln.component.ComponentKind;
import com.kiln.component.error.ComponentNotFoundException;
import com.kiln.config.ComponentPrecedence;
import com.kiln.config.KilnConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Resolves component names to built-in factories or plugin executables and loads them.
 * Built-ins are fixed at construction; plugins are looked up on the search path on each call.
 * When both exist for a name, {@link ComponentPrecedence} decides.
 */
public final class ComponentRegistry {

    private static final Logger log = LoggerFactory.getLogger(ComponentRegistry.class);

    private final Map<ComponentKind, Map<String, Supplier<?>>> builtins;
    private final PluginDiscovery discovery;
    private final KilnConfig config;

    private ComponentRegistry(Map<ComponentKind, Map<String, Supplier<?>>> builtins, PluginDiscovery discovery,
                              KilnConfig config) {
        Map<ComponentKind, Map<String, Supplier<?>>> copy = new EnumMap<>(ComponentKind.class);
        builtins.forEach((k, v) -> copy.put(k, Collections.unmodifiableMap(new LinkedHashMap<>(v))));
        this.builtins = Collections.unmodifiableMap(copy);
        this.discovery = discovery;
        this.config = config;
    }

    public KilnConfig getConfig() {
        return config;
    }

    public PluginDiscovery getDiscovery() {
        return discovery;
    }

    /** Descriptor for {@code name}, honoring the configured precedence. */
    public Optional<ComponentDescriptor> resolve(ComponentKind kind, String name) {
        Supplier<?> factory = builtins.getOrDefault(kind, Map.of()).get(name);
        ComponentDescriptor builtin = factory != null ? ComponentDescriptor.builtin(kind, name, factory) : null;
        if (builtin != null && config.getPrecedence() == ComponentPrecedence.BUILTIN_FIRST) {
            return Optional.of(builtin);
        }
        Optional<ComponentDescriptor> plugin = discovery.find(kind, name)
                .map(path -> ComponentDescriptor.plugin(kind, name, path));
        return plugin.isPresent() ? plugin : Optional.ofNullable(builtin);
    }

    /** Every resolvable component of {@code kind}, sorted by name. */
    public List<ComponentDescriptor> descriptors(ComponentKind kind) {
        Map<String, ComponentDescriptor> byName = new TreeMap<>();
        boolean pluginFirst = config.getPrecedence() == ComponentPrecedence.PLUGIN_FIRST;
        for (Map.Entry<String, Path> e : discovery.discover(kind).entrySet()) {
            byName.put(e.getKey(), ComponentDescriptor.plugin(kind, e.getKey(), e.getValue()));
        }
        builtins.getOrDefault(kind, Map.of()).forEach((name, factory) -> {
            if (!pluginFirst || !byName.containsKey(name)) {
                byName.put(name, ComponentDescriptor.builtin(kind, name, factory));
            }
        });
        return new ArrayList<>(byName.values());
    }

    /**
     * Instantiates a component. A built-in is created in-process; a plugin is launched through
     * a new client registered with {@code tracker} before it starts.
     *
     * @return an instance of {@link ComponentKind#capabilityType()}
     * @throws ComponentNotFoundException when nothing provides {@code name}; no process is started
     */
    public Object load(ComponentKind kind, String name, ClientTracker tracker) {
        ComponentDescriptor descriptor = resolve(kind, name)
                .orElseThrow(() -> new ComponentNotFoundException(kind, name));
        if (descriptor.isBuiltin()) {
            Object component = descriptor.factory().get();
            if (!kind.capabilityType().isInstance(component)) {
                throw new IllegalStateException("Built-in " + kind + " '" + name + "' is a "
                        + component.getClass().getName());
            }
            return component;
        }
        log.debug("Loading {} '{}' from plugin {}", kind, name, descriptor.executable());
        PluginClient client = new PluginClient(PluginClientConfig.forExecutable(descriptor.executable(), config));
        tracker.track(client);
        client.start();
        return client.component(kind);
    }

    public <T> T load(Class<T> type, ComponentKind kind, String name, ClientTracker tracker) {
        return type.cast(load(kind, name, tracker));
    }

    public static Builder builder(KilnConfig config) {
        return new Builder(config);
    }

    public static final class Builder {
        private final KilnConfig config;
        private final Map<ComponentKind, Map<String, Supplier<?>>> builtins = new EnumMap<>(ComponentKind.class);
        private PluginDiscovery discovery;

        private Builder(KilnConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        /**
         * @throws IllegalArgumentException when {@code name} is blank or already registered for {@code kind}
         */
        public Builder builtin(ComponentKind kind, String name, Supplier<?> factory) {
            Objects.requireNonNull(factory, "factory");
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Component name must be non-blank");
            }
            Map<String, Supplier<?>> byName = builtins.computeIfAbsent(kind, k -> new LinkedHashMap<>());
            if (byName.putIfAbsent(name, factory) != null) {
                throw new IllegalArgumentException("Built-in " + kind + " already registered: " + name);
            }
            return this;
        }

        /** Overrides discovery on the configured search path. */
        public Builder discovery(PluginDiscovery discovery) {
            this.discovery = discovery;
            return this;
        }

        public ComponentRegistry build() {
            PluginDiscovery d = discovery != null ? discovery : new PluginDiscovery(config.getPluginSearchPath());
            return new ComponentRegistry(builtins, d, config);
        }
    }
}
