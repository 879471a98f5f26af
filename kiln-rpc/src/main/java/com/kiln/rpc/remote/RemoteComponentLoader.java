package com.kiln.rpc.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.kiln.component.Builder;
import com.kiln.component.Command;
import com.kiln.component.ComponentKind;
import com.kiln.component.ComponentLoader;
import com.kiln.component.Hook;
import com.kiln.component.PostProcessor;
import com.kiln.component.Provisioner;
import com.kiln.rpc.RpcCodec;
import com.kiln.rpc.RpcConnection;

/** Loads components through the host that invoked a remote command. */
public final class RemoteComponentLoader extends RemoteObject implements ComponentLoader {

    public RemoteComponentLoader(RpcConnection connection, String endpoint) {
        super(connection, endpoint, "components");
    }

    @Override
    public Builder builder(String name) {
        return (Builder) load(ComponentKind.BUILDER, name);
    }

    @Override
    public Provisioner provisioner(String name) {
        return (Provisioner) load(ComponentKind.PROVISIONER, name);
    }

    @Override
    public PostProcessor postProcessor(String name) {
        return (PostProcessor) load(ComponentKind.POST_PROCESSOR, name);
    }

    @Override
    public Hook hook(String name) {
        return (Hook) load(ComponentKind.HOOK, name);
    }

    @Override
    public Command command(String name) {
        return (Command) load(ComponentKind.COMMAND, name);
    }

    private Object load(ComponentKind kind, String name) {
        JsonNode ref = callConcurrently(kind.wireName(), RpcCodec.object().put("name", name));
        return decode(kind.wireName(), ref, r -> {
            if (!r.isTextual()) {
                throw new IllegalArgumentException("expected component reference");
            }
            return Remotes.component(kind, connection(), r.asText());
        });
    }
}
