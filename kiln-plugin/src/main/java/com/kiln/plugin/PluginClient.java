package com.kiln.plugin;

import com.kiln.component.Builder;
import com.kiln.component.Command;
import com.kiln.component.ComponentKind;
import com.kiln.component.Hook;
import com.kiln.component.PostProcessor;
import com.kiln.component.Provisioner;
import com.kiln.component.error.PluginCommunicationException;
import com.kiln.component.error.PluginLaunchException;
import com.kiln.config.KilnConfig;
import com.kiln.rpc.Handshake;
import com.kiln.rpc.RpcConnection;
import com.kiln.rpc.remote.Remotes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Host-side handle on one plugin subprocess: launches it, performs the handshake, connects and
 * hands out capability proxies over the connection.
 * <p>
 * Every failure to launch leaves no process behind. {@link #kill()} and {@link #close()} may be
 * called any number of times from any thread; each wait they make is bounded.
 */
public final class PluginClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PluginClient.class);

    /** How long a transport failure waits for the process to exit so its status can be reported. */
    static final Duration EXIT_STATUS_WAIT = Duration.ofSeconds(2);

    private final PluginClientConfig config;
    private final Object lock = new Object();
    private final CompletableFuture<String> handshakeLine = new CompletableFuture<>();

    private PluginState state = PluginState.CREATED;
    private Process process;
    private RpcConnection connection;
    private Handshake handshake;
    private volatile Integer exitStatus;

    public PluginClient(PluginClientConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public String getName() {
        return config.getName();
    }

    public PluginState getState() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Launches the plugin and connects to it. Does nothing when already connected.
     *
     * @throws PluginLaunchException when the executable is missing, the handshake is late or
     *                               malformed, the dial fails, or the client was killed meanwhile
     * @throws IllegalStateException when the client already exited or is being started by another thread
     */
    public void start() {
        synchronized (lock) {
            if (state.isConnected()) {
                return;
            }
            if (state != PluginState.CREATED) {
                throw new IllegalStateException("Plugin " + getName() + " cannot be started in state " + state);
            }
            state = PluginState.STARTING;
        }
        try {
            launch();
        } catch (RuntimeException e) {
            kill();
            throw e;
        }
    }

    private void launch() {
        Path executable = config.getExecutable();
        if (!Files.isRegularFile(executable) || !Files.isExecutable(executable)) {
            throw new PluginLaunchException(PluginLaunchException.Reason.NOT_FOUND, getName(),
                    "not an executable file: " + executable);
        }
        List<String> command = new ArrayList<>();
        command.add(executable.toString());
        command.addAll(config.getArguments());
        ProcessBuilder pb = new ProcessBuilder(command);
        Map<String, String> env = pb.environment();
        env.put(Handshake.MAGIC_COOKIE_KEY, Handshake.MAGIC_COOKIE_VALUE);
        env.put(KilnConfig.ENV_PLUGIN_MIN_PORT, Integer.toString(config.getMinPort()));
        env.put(KilnConfig.ENV_PLUGIN_MAX_PORT, Integer.toString(config.getMaxPort()));
        env.putAll(config.getEnvironment());

        Process p;
        try {
            p = pb.start();
        } catch (IOException e) {
            throw new PluginLaunchException(PluginLaunchException.Reason.NOT_FOUND, getName(),
                    "could not start " + executable + ": " + e.getMessage(), e);
        }
        synchronized (lock) {
            process = p;
            if (state != PluginState.STARTING) {
                throw cancelled();
            }
        }
        log.debug("Started plugin {} (pid {})", getName(), p.pid());
        p.onExit().thenAccept(this::onProcessExit);
        readLines(p.getInputStream(), "stdout", true);
        readLines(p.getErrorStream(), "stderr", false);

        Handshake h = awaitHandshake(p);
        RpcConnection c;
        try {
            c = RpcConnection.dial(getName(), h.socketAddress(), config.getHandshakeTimeout());
        } catch (IOException e) {
            throw new PluginLaunchException(PluginLaunchException.Reason.CONNECT, getName(),
                    "could not connect to " + h.address() + ": " + e.getMessage(), e);
        }
        c.setFailureDecorator(e -> e.withContext(null, null, awaitExitStatus(EXIT_STATUS_WAIT)));
        synchronized (lock) {
            if (state != PluginState.STARTING) {
                c.close();
                throw cancelled();
            }
            connection = c;
            handshake = h;
            state = PluginState.CONNECTED;
        }
        log.debug("Connected to plugin {} at {}", getName(), h.address());
        if (!p.isAlive()) {
            onProcessExit(p);
        }
    }

    private Handshake awaitHandshake(Process p) {
        Duration timeout = config.getHandshakeTimeout();
        String line;
        try {
            line = handshakeLine.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new PluginLaunchException(PluginLaunchException.Reason.TIMEOUT, getName(),
                    "no handshake within " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled();
        } catch (ExecutionException e) {
            synchronized (lock) {
                if (state != PluginState.STARTING) {
                    throw cancelled();
                }
            }
            Integer status = awaitExitStatus(EXIT_STATUS_WAIT);
            throw new PluginLaunchException(PluginLaunchException.Reason.PROTOCOL, getName(),
                    "plugin exited before completing the handshake"
                            + (status != null ? " (exit status " + status + ")" : ""));
        }
        try {
            return Handshake.parse(line);
        } catch (IllegalArgumentException e) {
            throw new PluginLaunchException(PluginLaunchException.Reason.PROTOCOL, getName(), e.getMessage(), e);
        }
    }

    private PluginLaunchException cancelled() {
        return new PluginLaunchException(PluginLaunchException.Reason.CANCELLED, getName(),
                "plugin was killed while starting");
    }

    private void readLines(InputStream in, String stream, boolean handshakeStream) {
        Thread t = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (handshakeStream && !handshakeLine.isDone()) {
                        handshakeLine.complete(line);
                    } else if (handshakeStream) {
                        log.info("{}: {}", getName(), line);
                    } else {
                        log.debug("{} {}: {}", getName(), stream, line);
                    }
                }
            } catch (IOException e) {
                log.debug("Reading {} of plugin {} stopped: {}", stream, getName(), e.getMessage());
            } finally {
                if (handshakeStream) {
                    handshakeLine.completeExceptionally(new IOException("stdout closed"));
                }
            }
        }, "kiln-plugin-" + getName() + "-" + stream);
        t.setDaemon(true);
        t.start();
    }

    private void onProcessExit(Process p) {
        exitStatus = p.exitValue();
        RpcConnection c;
        synchronized (lock) {
            if (!state.isConnected()) {
                return;
            }
            state = PluginState.EXITED;
            c = connection;
        }
        log.debug("Plugin {} exited with status {}", getName(), exitStatus);
        if (c != null) {
            c.close();
        }
    }

    /** Waits up to {@code timeout} for the process to exit; null when it is still running. */
    Integer awaitExitStatus(Duration timeout) {
        Process p;
        synchronized (lock) {
            p = process;
        }
        if (p == null) {
            return null;
        }
        try {
            if (p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                exitStatus = p.exitValue();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return exitStatus;
    }

    public Builder builder() {
        return (Builder) component(ComponentKind.BUILDER);
    }

    public Provisioner provisioner() {
        return (Provisioner) component(ComponentKind.PROVISIONER);
    }

    public PostProcessor postProcessor() {
        return (PostProcessor) component(ComponentKind.POST_PROCESSOR);
    }

    public Hook hook() {
        return (Hook) component(ComponentKind.HOOK);
    }

    public Command command() {
        return (Command) component(ComponentKind.COMMAND);
    }

    /**
     * Proxy for the plugin's component as {@code kind}.
     *
     * @throws PluginCommunicationException with reason CLOSED when the client is not connected
     */
    public Object component(ComponentKind kind) {
        RpcConnection c;
        synchronized (lock) {
            if (!state.isConnected()) {
                throw new PluginCommunicationException(PluginCommunicationException.Reason.CLOSED,
                        kind.wireName(), null, exitStatus, "plugin " + getName() + " is " + state, null);
            }
            state = PluginState.IN_USE;
            c = connection;
        }
        return Remotes.component(kind, c, Remotes.COMPONENT_ENDPOINT);
    }

    /**
     * Closes the connection and terminates the process: polite termination first, forced after
     * the grace period.
     */
    public void kill() {
        Process p;
        RpcConnection c;
        synchronized (lock) {
            if (state != PluginState.EXITED) {
                state = PluginState.CLOSING;
            }
            p = process;
            c = connection;
        }
        try {
            if (c != null) {
                c.close();
            }
            if (p != null) {
                terminate(p);
            }
        } finally {
            synchronized (lock) {
                state = PluginState.EXITED;
            }
        }
    }

    @Override
    public void close() {
        kill();
    }

    private void terminate(Process p) {
        if (!p.isAlive()) {
            exitStatus = p.exitValue();
            return;
        }
        long grace = config.getKillGracePeriod().toMillis();
        p.descendants().forEach(ProcessHandle::destroy);
        p.destroy();
        try {
            if (!p.waitFor(grace, TimeUnit.MILLISECONDS)) {
                log.warn("Plugin {} did not exit within {} ms, forcing", getName(), grace);
                p.descendants().forEach(ProcessHandle::destroyForcibly);
                p.destroyForcibly();
                if (!p.waitFor(Math.max(grace, 1000), TimeUnit.MILLISECONDS)) {
                    log.warn("Plugin {} (pid {}) is still running after forced kill", getName(), p.pid());
                    return;
                }
            }
            exitStatus = p.exitValue();
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    public OptionalInt exitStatus() {
        Integer s = exitStatus;
        return s != null ? OptionalInt.of(s) : OptionalInt.empty();
    }

    public OptionalLong pid() {
        synchronized (lock) {
            return process != null ? OptionalLong.of(process.pid()) : OptionalLong.empty();
        }
    }

    public boolean isAlive() {
        synchronized (lock) {
            return process != null && process.isAlive();
        }
    }

    /** Address from the handshake, or null before connecting. */
    public InetSocketAddress getAddress() {
        synchronized (lock) {
            return handshake != null ? handshake.socketAddress() : null;
        }
    }

    @Override
    public String toString() {
        return "PluginClient[" + getName() + ", " + getState() + "]";
    }
}
