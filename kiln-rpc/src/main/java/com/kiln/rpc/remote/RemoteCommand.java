package com.kiln.rpc.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kiln.component.Command;
import com.kiln.component.CommandContext;
import com.kiln.rpc.CallScope;
import com.kiln.rpc.RpcCodec;
import com.kiln.rpc.RpcConnection;
import com.kiln.rpc.endpoint.Exports;

import java.util.List;

public final class RemoteCommand extends RemoteObject implements Command {

    public RemoteCommand(RpcConnection connection, String endpoint) {
        super(connection, endpoint, "command");
    }

    @Override
    public int run(CommandContext context, List<String> args) {
        try (CallScope scope = connection().openScope()) {
            ObjectNode params = RpcCodec.object();
            params.put("ui", Exports.ui(scope, context.ui()));
            params.put("cache", Exports.cache(scope, context.cache()));
            params.put("components", Exports.components(scope, context.components()));
            params.set("args", RpcCodec.strings(args));
            JsonNode result = call("run", params);
            return decode("run", result, r -> {
                if (!r.canConvertToInt()) {
                    throw new IllegalArgumentException("expected exit code, got " + r.getNodeType());
                }
                return r.intValue();
            });
        }
    }

    @Override
    public String help() {
        return call("help", RpcCodec.object()).asText("");
    }

    @Override
    public String synopsis() {
        return call("synopsis", RpcCodec.object()).asText("");
    }
}
