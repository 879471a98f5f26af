package com.kiln.rpc;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Server-side handler for calls addressed to one endpoint name on a connection.
 * Thrown exceptions are sent back to the caller as an {@link ErrorDescriptor}.
 */
public interface Endpoint {

    JsonNode invoke(String method, JsonNode args) throws Exception;

    /** Local object served by this endpoint, or null. */
    default Object target() {
        return null;
    }

    /** Called once when the endpoint is removed from its connection. */
    default void unexported() {
    }
}
