package com.kiln.rpc.endpoint;

import com.kiln.cache.Cache;
import com.kiln.cache.CacheLease;
import com.kiln.component.Builder;
import com.kiln.component.Command;
import com.kiln.component.ComponentKind;
import com.kiln.component.ComponentLoader;
import com.kiln.component.Hook;
import com.kiln.component.PostProcessor;
import com.kiln.component.Provisioner;
import com.kiln.rpc.CallScope;
import com.kiln.rpc.Endpoint;
import com.kiln.rpc.RpcConnection;
import com.kiln.ui.Ui;

/**
 * Exports local objects into a call scope and returns the references to send as arguments.
 */
public final class Exports {

    private Exports() {
    }

    public static String ui(CallScope scope, Ui ui) {
        return scope.export("ui", ui, () -> new UiEndpoint(ui, scope.connection()));
    }

    public static String hook(CallScope scope, Hook hook) {
        return scope.export("hook", hook, () -> new HookEndpoint(hook, scope.connection()));
    }

    public static String cache(CallScope scope, Cache cache) {
        return scope.export("cache", cache, () -> new CacheEndpoint(cache, scope));
    }

    public static String lease(CallScope scope, CacheLease lease) {
        return scope.export("lease", lease, () -> new CacheLeaseEndpoint(lease, scope.connection()));
    }

    public static String components(CallScope scope, ComponentLoader loader) {
        return scope.export("components", loader, () -> new ComponentLoaderEndpoint(loader, scope));
    }

    public static String component(CallScope scope, ComponentKind kind, Object component) {
        return scope.export(kind.wireName(), component, () -> forComponent(kind, component, scope.connection()));
    }

    /** Endpoint serving {@code component} as the given kind. */
    public static Endpoint forComponent(ComponentKind kind, Object component, RpcConnection connection) {
        return switch (kind) {
            case BUILDER -> new BuilderEndpoint((Builder) component, connection);
            case PROVISIONER -> new ProvisionerEndpoint((Provisioner) component, connection);
            case POST_PROCESSOR -> new PostProcessorEndpoint((PostProcessor) component, connection);
            case HOOK -> new HookEndpoint((Hook) component, connection);
            case COMMAND -> new CommandEndpoint((Command) component, connection);
        };
    }
}
