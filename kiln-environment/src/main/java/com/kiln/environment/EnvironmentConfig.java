package com.kiln.environment;

import com.kiln.cache.Cache;
import com.kiln.plugin.ComponentRegistry;
import com.kiln.ui.Ui;

import java.util.Objects;

/**
 * What an {@link Environment} runs with: the UI, the cache and the component registry.
 */
public final class EnvironmentConfig {

    private final Ui ui;
    private final Cache cache;
    private final ComponentRegistry registry;

    private EnvironmentConfig(Builder b) {
        this.ui = Objects.requireNonNull(b.ui, "ui");
        this.cache = Objects.requireNonNull(b.cache, "cache");
        this.registry = Objects.requireNonNull(b.registry, "registry");
    }

    public Ui getUi() {
        return ui;
    }

    public Cache getCache() {
        return cache;
    }

    public ComponentRegistry getRegistry() {
        return registry;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Ui ui;
        private Cache cache;
        private ComponentRegistry registry;

        private Builder() {
        }

        public Builder ui(Ui ui) {
            this.ui = ui;
            return this;
        }

        public Builder cache(Cache cache) {
            this.cache = cache;
            return this;
        }

        public Builder registry(ComponentRegistry registry) {
            this.registry = registry;
            return this;
        }

        public EnvironmentConfig build() {
            return new EnvironmentConfig(this);
        }
    }
}
