package com.kiln.rpc.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kiln.component.Artifact;
import com.kiln.component.ConfigBundle;
import com.kiln.component.PostProcessResult;
import com.kiln.component.PostProcessor;
import com.kiln.rpc.CallScope;
import com.kiln.rpc.RpcCodec;
import com.kiln.rpc.RpcConnection;
import com.kiln.rpc.endpoint.Exports;
import com.kiln.ui.Ui;

import java.util.List;

public final class RemotePostProcessor extends RemoteObject implements PostProcessor {

    public RemotePostProcessor(RpcConnection connection, String endpoint) {
        super(connection, endpoint, "post-processor");
    }

    @Override
    public void configure(List<ConfigBundle> raws) {
        ObjectNode args = RpcCodec.object();
        args.set("configs", RpcCodec.bundles(raws));
        call("configure", args);
    }

    @Override
    public PostProcessResult postProcess(Ui ui, Artifact artifact) {
        try (CallScope scope = connection().openScope()) {
            ObjectNode args = RpcCodec.object().put("ui", Exports.ui(scope, ui));
            args.set("artifact", RpcCodec.artifact(artifact));
            JsonNode result = call("postProcess", args);
            return decode("postProcess", result, r -> {
                Artifact out = RpcCodec.artifact(r.get("artifact"));
                if (out == null) {
                    throw new IllegalArgumentException("post-processor returned no artifact");
                }
                return new PostProcessResult(out, r.path("keepOriginal").asBoolean(false));
            });
        }
    }
}
