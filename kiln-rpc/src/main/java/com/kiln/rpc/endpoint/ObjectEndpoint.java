package com.kiln.rpc.endpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.kiln.rpc.Endpoint;
import com.kiln.rpc.RpcConnection;

import java.util.Objects;

/**
 * Base for endpoints serving one local object. Subclasses switch on the method name and throw
 * {@link UnsupportedOperationException} for names they do not know.
 */
public abstract class ObjectEndpoint<T> implements Endpoint {

    protected final T target;
    protected final RpcConnection connection;

    protected ObjectEndpoint(T target, RpcConnection connection) {
        this.target = Objects.requireNonNull(target, "target");
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    @Override
    public T target() {
        return target;
    }

    protected static JsonNode none() {
        return NullNode.getInstance();
    }

    protected UnsupportedOperationException unknownMethod(String method) {
        return new UnsupportedOperationException("Unknown method '" + method + "' on "
                + getClass().getSimpleName().replace("Endpoint", "").toLowerCase());
    }
}
