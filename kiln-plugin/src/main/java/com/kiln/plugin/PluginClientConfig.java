package com.kiln.plugin;

import com.kiln.config.KilnConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * How to launch one plugin process: executable, arguments, extra environment and timeouts.
 */
public final class PluginClientConfig {

    private final String name;
    private final Path executable;
    private final List<String> arguments;
    private final Map<String, String> environment;
    private final Duration handshakeTimeout;
    private final Duration killGracePeriod;
    private final int minPort;
    private final int maxPort;

    private PluginClientConfig(Builder b) {
        this.executable = Objects.requireNonNull(b.executable, "executable");
        this.name = b.name != null ? b.name : String.valueOf(executable.getFileName());
        this.arguments = List.copyOf(b.arguments);
        this.environment = Map.copyOf(b.environment);
        this.handshakeTimeout = b.handshakeTimeout;
        this.killGracePeriod = b.killGracePeriod;
        this.minPort = b.minPort;
        this.maxPort = b.maxPort;
    }

    public String getName() {
        return name;
    }

    public Path getExecutable() {
        return executable;
    }

    public List<String> getArguments() {
        return arguments;
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    public Duration getHandshakeTimeout() {
        return handshakeTimeout;
    }

    public Duration getKillGracePeriod() {
        return killGracePeriod;
    }

    public int getMinPort() {
        return minPort;
    }

    public int getMaxPort() {
        return maxPort;
    }

    /** Launch settings for a discovered executable, with timeouts and ports from {@code config}. */
    public static PluginClientConfig forExecutable(Path executable, KilnConfig config) {
        return builder(executable)
                .handshakeTimeout(config.getHandshakeTimeout())
                .killGracePeriod(config.getKillGracePeriod())
                .portRange(config.getPluginMinPort(), config.getPluginMaxPort())
                .build();
    }

    public static Builder builder(Path executable) {
        return new Builder(executable);
    }

    public static final class Builder {
        private final Path executable;
        private String name;
        private final List<String> arguments = new ArrayList<>();
        private final Map<String, String> environment = new LinkedHashMap<>();
        private Duration handshakeTimeout = Duration.ofSeconds(60);
        private Duration killGracePeriod = Duration.ofMillis(2000);
        private int minPort;
        private int maxPort;

        private Builder(Path executable) {
            this.executable = executable;
        }

        /** Name used in logs and errors; defaults to the executable's file name. */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder arguments(List<String> arguments) {
            this.arguments.addAll(arguments);
            return this;
        }

        public Builder environment(String key, String value) {
            this.environment.put(key, value);
            return this;
        }

        public Builder handshakeTimeout(Duration handshakeTimeout) {
            if (handshakeTimeout.isNegative() || handshakeTimeout.isZero()) {
                throw new IllegalArgumentException("handshakeTimeout must be positive");
            }
            this.handshakeTimeout = handshakeTimeout;
            return this;
        }

        public Builder killGracePeriod(Duration killGracePeriod) {
            if (killGracePeriod.isNegative()) {
                throw new IllegalArgumentException("killGracePeriod must not be negative");
            }
            this.killGracePeriod = killGracePeriod;
            return this;
        }

        public Builder portRange(int minPort, int maxPort) {
            this.minPort = minPort;
            this.maxPort = maxPort;
            return this;
        }

        public PluginClientConfig build() {
            return new PluginClientConfig(this);
        }
    }
}
