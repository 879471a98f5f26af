package com.kiln.rpc.endpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.kiln.component.Artifact;
import com.kiln.component.Builder;
import com.kiln.rpc.RpcCodec;
import com.kiln.rpc.RpcConnection;
import com.kiln.rpc.remote.Remotes;

public final class BuilderEndpoint extends ObjectEndpoint<Builder> {

    public BuilderEndpoint(Builder builder, RpcConnection connection) {
        super(builder, connection);
    }

    @Override
    public JsonNode invoke(String method, JsonNode args) {
        switch (method) {
            case "prepare":
                return RpcCodec.strings(target.prepare(RpcCodec.bundles(args.get("configs"))));
            case "run":
                Artifact artifact = target.run(
                        Remotes.ui(connection, RpcCodec.text(args, "ui")),
                        Remotes.hook(connection, RpcCodec.text(args, "hook")),
                        Remotes.cache(connection, RpcCodec.text(args, "cache")));
                return RpcCodec.artifact(artifact);
            case "cancel":
                target.cancel();
                return none();
            default:
                throw unknownMethod(method);
        }
    }
}
