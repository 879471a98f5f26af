package com.kiln.plugin;

import com.kiln.component.ComponentKind;
import com.kiln.config.KilnConfig;
import com.kiln.rpc.Handshake;
import com.kiln.rpc.RpcConnection;
import com.kiln.rpc.endpoint.Exports;
import com.kiln.rpc.remote.Remotes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Plugin side of the handshake: checks the magic cookie, listens on loopback, announces the
 * address on stdout and serves one component over the host's connection until it closes.
 */
public final class PluginServer {

    private static final Logger log = LoggerFactory.getLogger(PluginServer.class);

    static final String NOT_A_PROGRAM = """
            This executable is a Kiln plugin. It is not meant to be run directly;
            Kiln launches it when a build needs it.""";

    private PluginServer() {
    }

    /** Serves using the process environment and standard streams; returns the exit code. */
    public static int serve(ComponentKind kind, Supplier<?> factory) {
        return serve(kind, factory, System.getenv(), System.out, System.err);
    }

    static int serve(ComponentKind kind, Supplier<?> factory, Map<String, String> env,
                     PrintStream out, PrintStream err) {
        if (!Handshake.MAGIC_COOKIE_VALUE.equals(env.get(Handshake.MAGIC_COOKIE_KEY))) {
            err.println(NOT_A_PROGRAM);
            return 1;
        }
        KilnConfig config;
        Object component;
        try {
            config = KilnConfig.fromEnvironment(env);
            component = factory.get();
        } catch (RuntimeException e) {
            err.println("Plugin failed to initialize: " + e.getMessage());
            return 1;
        }
        if (!kind.capabilityType().isInstance(component)) {
            err.println("Plugin component is not a " + kind);
            return 1;
        }
        try (ServerSocket server = listen(config.getPluginMinPort(), config.getPluginMaxPort())) {
            server.setSoTimeout((int) Math.min(Integer.MAX_VALUE, config.getHandshakeTimeout().toMillis()));
            out.println(Handshake.tcp((InetSocketAddress) server.getLocalSocketAddress()).toLine());
            out.flush();
            Socket socket = server.accept();
            Object served = component;
            RpcConnection connection = RpcConnection.over("plugin-" + kind.wireName(), socket,
                    c -> c.export(Remotes.COMPONENT_ENDPOINT, Exports.forComponent(kind, served, c)));
            log.debug("Serving {} to {}", kind, socket.getRemoteSocketAddress());
            connection.closedFuture().join();
            return 0;
        } catch (SocketTimeoutException e) {
            err.println("Host did not connect within " + config.getHandshakeTimeout().toSeconds() + "s");
            return 1;
        } catch (IOException e) {
            err.println("Plugin server failed: " + e.getMessage());
            return 1;
        }
    }

    /** Binds loopback on an ephemeral port, or the first free port in {@code [min, max]}. */
    static ServerSocket listen(int minPort, int maxPort) throws IOException {
        InetAddress loopback = InetAddress.getLoopbackAddress();
        if (minPort <= 0 || maxPort <= 0) {
            return new ServerSocket(0, 1, loopback);
        }
        for (int port = minPort; port <= maxPort; port++) {
            try {
                return new ServerSocket(port, 1, loopback);
            } catch (IOException e) {
                log.debug("Port {} unavailable: {}", port, e.getMessage());
            }
        }
        throw new IOException("no free port between " + minPort + " and " + maxPort);
    }
}
