package com.kiln.rpc.endpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.kiln.component.ComponentKind;
import com.kiln.component.ComponentLoader;
import com.kiln.rpc.CallScope;
import com.kiln.rpc.RpcCodec;

/**
 * Lets a remote command load components through the host. Loaded components are exported into
 * the command's call scope and returned by reference.
 */
public final class ComponentLoaderEndpoint extends ObjectEndpoint<ComponentLoader> {

    private final CallScope scope;

    public ComponentLoaderEndpoint(ComponentLoader loader, CallScope scope) {
        super(loader, scope.connection());
        this.scope = scope;
    }

    @Override
    public JsonNode invoke(String method, JsonNode args) {
        ComponentKind kind;
        try {
            kind = ComponentKind.fromWireName(method);
        } catch (IllegalArgumentException e) {
            throw unknownMethod(method);
        }
        String name = RpcCodec.requireText(args, "name");
        Object component = switch (kind) {
            case BUILDER -> target.builder(name);
            case PROVISIONER -> target.provisioner(name);
            case POST_PROCESSOR -> target.postProcessor(name);
            case HOOK -> target.hook(name);
            case COMMAND -> target.command(name);
        };
        return TextNode.valueOf(Exports.component(scope, kind, component));
    }
}
