package com.kiln.rpc.endpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kiln.component.PostProcessResult;
import com.kiln.component.PostProcessor;
import com.kiln.rpc.RpcCodec;
import com.kiln.rpc.RpcConnection;
import com.kiln.rpc.remote.Remotes;

public final class PostProcessorEndpoint extends ObjectEndpoint<PostProcessor> {

    public PostProcessorEndpoint(PostProcessor postProcessor, RpcConnection connection) {
        super(postProcessor, connection);
    }

    @Override
    public JsonNode invoke(String method, JsonNode args) {
        switch (method) {
            case "configure":
                target.configure(RpcCodec.bundles(args.get("configs")));
                return none();
            case "postProcess":
                PostProcessResult result = target.postProcess(
                        Remotes.ui(connection, RpcCodec.text(args, "ui")),
                        RpcCodec.artifact(args.get("artifact")));
                ObjectNode out = RpcCodec.object();
                out.set("artifact", RpcCodec.artifact(result.artifact()));
                out.put("keepOriginal", result.keepOriginal());
                return out;
            default:
                throw unknownMethod(method);
        }
    }
}
