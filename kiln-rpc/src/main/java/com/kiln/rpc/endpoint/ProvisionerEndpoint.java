package com.kiln.rpc.endpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.kiln.component.Provisioner;
import com.kiln.rpc.RpcCodec;
import com.kiln.rpc.RpcConnection;
import com.kiln.rpc.remote.Remotes;

public final class ProvisionerEndpoint extends ObjectEndpoint<Provisioner> {

    public ProvisionerEndpoint(Provisioner provisioner, RpcConnection connection) {
        super(provisioner, connection);
    }

    @Override
    public JsonNode invoke(String method, JsonNode args) {
        switch (method) {
            case "prepare":
                target.prepare(RpcCodec.bundles(args.get("configs")));
                return none();
            case "provision":
                target.provision(Remotes.ui(connection, RpcCodec.text(args, "ui")));
                return none();
            case "cancel":
                target.cancel();
                return none();
            default:
                throw unknownMethod(method);
        }
    }
}
