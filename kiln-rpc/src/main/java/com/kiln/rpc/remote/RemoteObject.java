package com.kiln.rpc.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kiln.component.error.PluginCommunicationException;
import com.kiln.rpc.RpcConnection;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Client-side proxy for an endpoint on the other side of a connection. Calls through one proxy
 * are serialized; {@link #callConcurrently} bypasses that for cancellation.
 */
public abstract class RemoteObject {

    private final RpcConnection connection;
    private final String endpoint;
    private final String capability;
    private final ReentrantLock callLock = new ReentrantLock();

    protected RemoteObject(RpcConnection connection, String endpoint, String capability) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.capability = Objects.requireNonNull(capability, "capability");
    }

    public RpcConnection connection() {
        return connection;
    }

    public String endpoint() {
        return endpoint;
    }

    protected JsonNode call(String method, ObjectNode args) {
        callLock.lock();
        try {
            return connection.call(capability, endpoint, method, args);
        } finally {
            callLock.unlock();
        }
    }

    protected JsonNode callConcurrently(String method, ObjectNode args) {
        return connection.call(capability, endpoint, method, args);
    }

    /** Decodes a reply, reporting malformed content as a protocol failure. */
    protected <T> T decode(String method, JsonNode result, Function<JsonNode, T> decoder) {
        try {
            return decoder.apply(result);
        } catch (IllegalArgumentException e) {
            throw new PluginCommunicationException(PluginCommunicationException.Reason.PROTOCOL,
                    capability, method, null, "malformed reply: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + connection.getName() + "/" + endpoint + "]";
    }
}
