package com.kiln.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One frame on the wire. A {@code call} names an endpoint and method and carries arguments;
 * a {@code reply} echoes the call id and carries either a result or an error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RpcMessage(
        String type,
        long id,
        String endpoint,
        String method,
        JsonNode args,
        JsonNode result,
        ErrorDescriptor error
) {
    public static final String TYPE_CALL = "call";
    public static final String TYPE_REPLY = "reply";

    public static RpcMessage call(long id, String endpoint, String method, JsonNode args) {
        return new RpcMessage(TYPE_CALL, id, endpoint, method, args, null, null);
    }

    public static RpcMessage success(long id, JsonNode result) {
        return new RpcMessage(TYPE_REPLY, id, null, null, null, result, null);
    }

    public static RpcMessage failure(long id, ErrorDescriptor error) {
        return new RpcMessage(TYPE_REPLY, id, null, null, null, null, error);
    }
}
