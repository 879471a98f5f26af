package com.kiln.config;

import java.io.File;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Host settings loaded from environment variables.
 * <p>
 * Plugin search: KILN_PLUGIN_PATH (path-separator list), then KILN_HOME/plugins, then PATH.
 * Plugin lifecycle: KILN_PLUGIN_HANDSHAKE_TIMEOUT_SECONDS, KILN_PLUGIN_KILL_GRACE_MILLIS.
 * Plugin side: KILN_PLUGIN_MIN_PORT, KILN_PLUGIN_MAX_PORT. Cache: KILN_CACHE_DIR.
 */
public final class KilnConfig {

    public static final String ENV_PLUGIN_PATH = "KILN_PLUGIN_PATH";
    public static final String ENV_HOME = "KILN_HOME";
    public static final String ENV_CACHE_DIR = "KILN_CACHE_DIR";
    public static final String ENV_HANDSHAKE_TIMEOUT_SECONDS = "KILN_PLUGIN_HANDSHAKE_TIMEOUT_SECONDS";
    public static final String ENV_KILL_GRACE_MILLIS = "KILN_PLUGIN_KILL_GRACE_MILLIS";
    public static final String ENV_PLUGIN_MIN_PORT = "KILN_PLUGIN_MIN_PORT";
    public static final String ENV_PLUGIN_MAX_PORT = "KILN_PLUGIN_MAX_PORT";
    public static final String ENV_COMPONENT_PRECEDENCE = "KILN_COMPONENT_PRECEDENCE";
    public static final String ENV_BUILD_PARALLELISM = "KILN_BUILD_PARALLELISM";
    private static final String ENV_PATH = "PATH";

    private static final String DEFAULT_CACHE_DIR = "kiln_cache";
    private static final int DEFAULT_HANDSHAKE_TIMEOUT_SECONDS = 60;
    private static final int DEFAULT_KILL_GRACE_MILLIS = 2000;

    private final List<Path> pluginDirectories;
    private final Path home;
    private final List<Path> systemPath;
    private final Path cacheDir;
    private final Duration handshakeTimeout;
    private final Duration killGracePeriod;
    private final int pluginMinPort;
    private final int pluginMaxPort;
    private final ComponentPrecedence precedence;
    private final int buildParallelism;

    private KilnConfig(Builder b) {
        this.pluginDirectories = Collections.unmodifiableList(new ArrayList<>(b.pluginDirectories));
        this.home = b.home;
        this.systemPath = Collections.unmodifiableList(new ArrayList<>(b.systemPath));
        this.cacheDir = b.cacheDir;
        this.handshakeTimeout = b.handshakeTimeout;
        this.killGracePeriod = b.killGracePeriod;
        this.pluginMinPort = b.pluginMinPort;
        this.pluginMaxPort = b.pluginMaxPort;
        this.precedence = b.precedence;
        this.buildParallelism = b.buildParallelism;
    }

    /** Directories named by KILN_PLUGIN_PATH, searched first, in order. */
    public List<Path> getPluginDirectories() {
        return pluginDirectories;
    }

    /** Installation directory (KILN_HOME); null when unset. */
    public Path getHome() {
        return home;
    }

    /** Entries of PATH, searched last. */
    public List<Path> getSystemPath() {
        return systemPath;
    }

    /**
     * Full plugin search order: plugin directories, then {@code <home>/plugins}, then PATH.
     * First match in this order wins.
     */
    public List<Path> getPluginSearchPath() {
        List<Path> out = new ArrayList<>(pluginDirectories);
        if (home != null) {
            out.add(home.resolve("plugins"));
        }
        out.addAll(systemPath);
        return out;
    }

    /** Cache directory (KILN_CACHE_DIR). Default {@code kiln_cache}. */
    public Path getCacheDir() {
        return cacheDir;
    }

    /** How long the host waits for a plugin's handshake line. Default 60 s. */
    public Duration getHandshakeTimeout() {
        return handshakeTimeout;
    }

    /** How long a plugin gets to exit after a termination request before it is killed. Default 2 s. */
    public Duration getKillGracePeriod() {
        return killGracePeriod;
    }

    /** Lowest port a plugin may listen on; 0 = any ephemeral port. */
    public int getPluginMinPort() {
        return pluginMinPort;
    }

    /** Highest port a plugin may listen on; 0 = any ephemeral port. */
    public int getPluginMaxPort() {
        return pluginMaxPort;
    }

    public ComponentPrecedence getPrecedence() {
        return precedence;
    }

    /** Maximum builds run at once; 0 = no limit. */
    public int getBuildParallelism() {
        return buildParallelism;
    }

    public static KilnConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Same as {@link #fromEnvironment()} but reading from the given map (used in tests). */
    public static KilnConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        String home = getEnv(env, ENV_HOME, null);
        return builder()
                .pluginDirectories(parsePathList(env.get(ENV_PLUGIN_PATH)))
                .home(home != null ? Path.of(home) : null)
                .systemPath(parsePathList(env.get(ENV_PATH)))
                .cacheDir(Path.of(getEnv(env, ENV_CACHE_DIR, DEFAULT_CACHE_DIR)))
                .handshakeTimeout(Duration.ofSeconds(
                        parseInt(env.get(ENV_HANDSHAKE_TIMEOUT_SECONDS), DEFAULT_HANDSHAKE_TIMEOUT_SECONDS)))
                .killGracePeriod(Duration.ofMillis(
                        parseInt(env.get(ENV_KILL_GRACE_MILLIS), DEFAULT_KILL_GRACE_MILLIS)))
                .pluginPortRange(parseInt(env.get(ENV_PLUGIN_MIN_PORT), 0),
                        parseInt(env.get(ENV_PLUGIN_MAX_PORT), 0))
                .precedence(ComponentPrecedence.parse(env.get(ENV_COMPONENT_PRECEDENCE),
                        ComponentPrecedence.BUILTIN_FIRST))
                .buildParallelism(parseInt(env.get(ENV_BUILD_PARALLELISM), 0))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<Path> parsePathList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(File.pathSeparator))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Path::of)
                .collect(Collectors.toList());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private List<Path> pluginDirectories = List.of();
        private Path home;
        private List<Path> systemPath = List.of();
        private Path cacheDir = Path.of(DEFAULT_CACHE_DIR);
        private Duration handshakeTimeout = Duration.ofSeconds(DEFAULT_HANDSHAKE_TIMEOUT_SECONDS);
        private Duration killGracePeriod = Duration.ofMillis(DEFAULT_KILL_GRACE_MILLIS);
        private int pluginMinPort;
        private int pluginMaxPort;
        private ComponentPrecedence precedence = ComponentPrecedence.BUILTIN_FIRST;
        private int buildParallelism;

        public Builder pluginDirectories(List<Path> pluginDirectories) {
            this.pluginDirectories = Objects.requireNonNull(pluginDirectories, "pluginDirectories");
            return this;
        }

        public Builder home(Path home) {
            this.home = home;
            return this;
        }

        public Builder systemPath(List<Path> systemPath) {
            this.systemPath = Objects.requireNonNull(systemPath, "systemPath");
            return this;
        }

        public Builder cacheDir(Path cacheDir) {
            this.cacheDir = Objects.requireNonNull(cacheDir, "cacheDir");
            return this;
        }

        public Builder handshakeTimeout(Duration handshakeTimeout) {
            if (handshakeTimeout == null || handshakeTimeout.isNegative() || handshakeTimeout.isZero()) {
                throw new IllegalArgumentException("handshakeTimeout must be positive");
            }
            this.handshakeTimeout = handshakeTimeout;
            return this;
        }

        public Builder killGracePeriod(Duration killGracePeriod) {
            this.killGracePeriod = killGracePeriod != null && !killGracePeriod.isNegative()
                    ? killGracePeriod : Duration.ZERO;
            return this;
        }

        public Builder pluginPortRange(int minPort, int maxPort) {
            if (minPort < 0 || maxPort < 0 || maxPort > 65535 || (maxPort > 0 && minPort > maxPort)) {
                throw new IllegalArgumentException("Invalid plugin port range: " + minPort + "-" + maxPort);
            }
            this.pluginMinPort = minPort;
            this.pluginMaxPort = maxPort;
            return this;
        }

        public Builder precedence(ComponentPrecedence precedence) {
            this.precedence = Objects.requireNonNull(precedence, "precedence");
            return this;
        }

        public Builder buildParallelism(int buildParallelism) {
            this.buildParallelism = Math.max(0, buildParallelism);
            return this;
        }

        public KilnConfig build() {
            return new KilnConfig(this);
        }
    }
}
