package com.kiln.rpc;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * The single line a plugin writes to stdout once it listens: {@code <version>|<network>|<address>}.
 * The host only starts plugins with {@link #MAGIC_COOKIE_KEY} set to {@link #MAGIC_COOKIE_VALUE};
 * a plugin started without it refuses to serve.
 *
 * @param version protocol version, must equal {@link #PROTOCOL_VERSION}
 * @param network transport type; only {@link #NETWORK_TCP} is supported
 * @param address {@code host:port}
 */
public record Handshake(int version, String network, String address) {

    public static final int PROTOCOL_VERSION = 1;
    public static final String NETWORK_TCP = "tcp";
    public static final String MAGIC_COOKIE_KEY = "KILN_PLUGIN_MAGIC_COOKIE";
    public static final String MAGIC_COOKIE_VALUE = "9f0c3b1e6a7d4c25b8e2f4a6d1c7e9b3a5f8d2c4e6b1a7f3";

    public Handshake {
        Objects.requireNonNull(network, "network");
        Objects.requireNonNull(address, "address");
    }

    public static Handshake tcp(InetSocketAddress address) {
        return new Handshake(PROTOCOL_VERSION, NETWORK_TCP,
                address.getAddress().getHostAddress() + ":" + address.getPort());
    }

    /** The line without its terminating newline. */
    public String toLine() {
        return version + "|" + network + "|" + address;
    }

    /**
     * Parses and checks a handshake line.
     *
     * @throws IllegalArgumentException when the line is malformed, the version differs from
     *                                  {@link #PROTOCOL_VERSION} or the network is unsupported
     */
    public static Handshake parse(String line) {
        if (line == null) {
            throw new IllegalArgumentException("No handshake line");
        }
        String[] parts = line.trim().split("\\|", -1);
        if (parts.length != 3) {
            throw new IllegalArgumentException("Malformed handshake line: '" + line + "'");
        }
        int version;
        try {
            version = Integer.parseInt(parts[0].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed protocol version in handshake line: '" + line + "'");
        }
        if (version != PROTOCOL_VERSION) {
            throw new IllegalArgumentException("Incompatible plugin protocol version " + version
                    + " (host speaks " + PROTOCOL_VERSION + ")");
        }
        String network = parts[1].trim();
        if (!NETWORK_TCP.equals(network)) {
            throw new IllegalArgumentException("Unsupported plugin network type: '" + network + "'");
        }
        Handshake h = new Handshake(version, network, parts[2].trim());
        h.socketAddress();
        return h;
    }

    /**
     * @throws IllegalArgumentException when the address is not {@code host:port}
     */
    public InetSocketAddress socketAddress() {
        int idx = address.lastIndexOf(':');
        if (idx <= 0 || idx == address.length() - 1) {
            throw new IllegalArgumentException("Malformed plugin address: '" + address + "'");
        }
        String host = address.substring(0, idx);
        int port;
        try {
            port = Integer.parseInt(address.substring(idx + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed plugin port: '" + address + "'");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Plugin port out of range: '" + address + "'");
        }
        return new InetSocketAddress(host, port);
    }
}
