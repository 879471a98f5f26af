package com.kiln.rpc.endpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.kiln.component.Command;
import com.kiln.rpc.RpcCodec;
import com.kiln.rpc.RpcConnection;
import com.kiln.rpc.remote.RemoteCommandContext;
import com.kiln.rpc.remote.Remotes;

public final class CommandEndpoint extends ObjectEndpoint<Command> {

    public CommandEndpoint(Command command, RpcConnection connection) {
        super(command, connection);
    }

    @Override
    public JsonNode invoke(String method, JsonNode args) {
        switch (method) {
            case "run":
                RemoteCommandContext context = new RemoteCommandContext(
                        Remotes.ui(connection, RpcCodec.text(args, "ui")),
                        Remotes.cache(connection, RpcCodec.text(args, "cache")),
                        Remotes.components(connection, RpcCodec.text(args, "components")));
                return IntNode.valueOf(target.run(context, RpcCodec.strings(args.get("args"))));
            case "help":
                return TextNode.valueOf(target.help());
            case "synopsis":
                return TextNode.valueOf(target.synopsis());
            default:
                throw unknownMethod(method);
        }
    }
}
