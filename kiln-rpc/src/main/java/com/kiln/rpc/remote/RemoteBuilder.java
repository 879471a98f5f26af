package com.kiln.rpc.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kiln.cache.Cache;
import com.kiln.component.Artifact;
import com.kiln.component.Builder;
import com.kiln.component.ConfigBundle;
import com.kiln.component.Hook;
import com.kiln.rpc.CallScope;
import com.kiln.rpc.RpcCodec;
import com.kiln.rpc.RpcConnection;
import com.kiln.rpc.endpoint.Exports;
import com.kiln.ui.Ui;

import java.util.List;

public final class RemoteBuilder extends RemoteObject implements Builder {

    public RemoteBuilder(RpcConnection connection, String endpoint) {
        super(connection, endpoint, "builder");
    }

    @Override
    public List<String> prepare(List<ConfigBundle> raws) {
        ObjectNode args = RpcCodec.object();
        args.set("configs", RpcCodec.bundles(raws));
        JsonNode result = call("prepare", args);
        return decode("prepare", result, RpcCodec::strings);
    }

    @Override
    public Artifact run(Ui ui, Hook hook, Cache cache) {
        try (CallScope scope = connection().openScope()) {
            ObjectNode args = RpcCodec.object();
            args.put("ui", Exports.ui(scope, ui));
            args.put("hook", Exports.hook(scope, hook));
            args.put("cache", Exports.cache(scope, cache));
            JsonNode result = call("run", args);
            return decode("run", result, RpcCodec::artifact);
        }
    }

    @Override
    public void cancel() {
        callConcurrently("cancel", RpcCodec.object());
    }
}
