package com.kiln.rpc.endpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.kiln.rpc.RpcCodec;
import com.kiln.rpc.RpcConnection;
import com.kiln.ui.Ui;

import java.util.List;

public final class UiEndpoint extends ObjectEndpoint<Ui> {

    public UiEndpoint(Ui ui, RpcConnection connection) {
        super(ui, connection);
    }

    @Override
    public JsonNode invoke(String method, JsonNode args) {
        switch (method) {
            case "ask":
                return TextNode.valueOf(target.ask(RpcCodec.requireText(args, "query")));
            case "say":
                target.say(RpcCodec.requireText(args, "message"));
                return none();
            case "message":
                target.message(RpcCodec.requireText(args, "message"));
                return none();
            case "error":
                target.error(RpcCodec.requireText(args, "message"));
                return none();
            case "machine":
                List<String> data = RpcCodec.strings(args.get("data"));
                target.machine(RpcCodec.requireText(args, "type"), data.toArray(new String[0]));
                return none();
            default:
                throw unknownMethod(method);
        }
    }
}
