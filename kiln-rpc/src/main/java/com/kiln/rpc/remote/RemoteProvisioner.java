package com.kiln.rpc.remote;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kiln.component.ConfigBundle;
import com.kiln.component.Provisioner;
import com.kiln.rpc.CallScope;
import com.kiln.rpc.RpcCodec;
import com.kiln.rpc.RpcConnection;
import com.kiln.rpc.endpoint.Exports;
import com.kiln.ui.Ui;

import java.util.List;

public final class RemoteProvisioner extends RemoteObject implements Provisioner {

    public RemoteProvisioner(RpcConnection connection, String endpoint) {
        super(connection, endpoint, "provisioner");
    }

    @Override
    public void prepare(List<ConfigBundle> raws) {
        ObjectNode args = RpcCodec.object();
        args.set("configs", RpcCodec.bundles(raws));
        call("prepare", args);
    }

    @Override
    public void provision(Ui ui) {
        try (CallScope scope = connection().openScope()) {
            call("provision", RpcCodec.object().put("ui", Exports.ui(scope, ui)));
        }
    }

    @Override
    public void cancel() {
        callConcurrently("cancel", RpcCodec.object());
    }
}
