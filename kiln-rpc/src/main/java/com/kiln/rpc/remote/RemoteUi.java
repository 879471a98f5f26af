package com.kiln.rpc.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kiln.rpc.RpcCodec;
import com.kiln.rpc.RpcConnection;
import com.kiln.ui.Ui;

import java.util.Arrays;

public final class RemoteUi extends RemoteObject implements Ui {

    public RemoteUi(RpcConnection connection, String endpoint) {
        super(connection, endpoint, "ui");
    }

    @Override
    public String ask(String query) {
        ObjectNode args = RpcCodec.object().put("query", query);
        JsonNode result = call("ask", args);
        return result.isNull() ? "" : result.asText();
    }

    @Override
    public void say(String message) {
        call("say", RpcCodec.object().put("message", message));
    }

    @Override
    public void message(String message) {
        call("message", RpcCodec.object().put("message", message));
    }

    @Override
    public void error(String message) {
        call("error", RpcCodec.object().put("message", message));
    }

    @Override
    public void machine(String type, String... data) {
        ObjectNode args = RpcCodec.object().put("type", type);
        args.set("data", RpcCodec.strings(data != null ? Arrays.asList(data) : null));
        call("machine", args);
    }
}
