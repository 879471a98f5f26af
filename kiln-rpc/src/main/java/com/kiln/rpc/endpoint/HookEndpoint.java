package com.kiln.rpc.endpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.kiln.component.Hook;
import com.kiln.rpc.RpcCodec;
import com.kiln.rpc.RpcConnection;
import com.kiln.rpc.remote.Remotes;

public final class HookEndpoint extends ObjectEndpoint<Hook> {

    public HookEndpoint(Hook hook, RpcConnection connection) {
        super(hook, connection);
    }

    @Override
    public JsonNode invoke(String method, JsonNode args) {
        switch (method) {
            case "run":
                target.run(RpcCodec.requireText(args, "name"),
                        Remotes.ui(connection, RpcCodec.text(args, "ui")),
                        RpcCodec.bundle(args.get("data")));
                return none();
            case "cancel":
                target.cancel();
                return none();
            default:
                throw unknownMethod(method);
        }
    }
}
