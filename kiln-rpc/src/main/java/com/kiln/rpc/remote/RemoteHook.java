package com.kiln.rpc.remote;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kiln.component.ConfigBundle;
import com.kiln.component.Hook;
import com.kiln.rpc.CallScope;
import com.kiln.rpc.RpcCodec;
import com.kiln.rpc.RpcConnection;
import com.kiln.rpc.endpoint.Exports;
import com.kiln.ui.Ui;

public final class RemoteHook extends RemoteObject implements Hook {

    public RemoteHook(RpcConnection connection, String endpoint) {
        super(connection, endpoint, "hook");
    }

    @Override
    public void run(String name, Ui ui, ConfigBundle data) {
        try (CallScope scope = connection().openScope()) {
            ObjectNode args = RpcCodec.object().put("name", name);
            args.put("ui", Exports.ui(scope, ui));
            args.set("data", RpcCodec.bundle(data));
            call("run", args);
        }
    }

    @Override
    public void cancel() {
        callConcurrently("cancel", RpcCodec.object());
    }
}
