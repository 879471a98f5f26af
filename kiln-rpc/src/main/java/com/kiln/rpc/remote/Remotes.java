package com.kiln.rpc.remote;

import com.kiln.cache.Cache;
import com.kiln.component.Builder;
import com.kiln.component.Command;
import com.kiln.component.ComponentKind;
import com.kiln.component.ComponentLoader;
import com.kiln.component.Hook;
import com.kiln.component.PostProcessor;
import com.kiln.component.Provisioner;
import com.kiln.component.error.PluginCommunicationException;
import com.kiln.rpc.RpcConnection;
import com.kiln.ui.Ui;

import java.util.function.Function;

/**
 * Turns references received in call arguments into usable objects: a local reference yields the
 * object this side exported, anything else a proxy over the connection.
 */
public final class Remotes {

    /** Endpoint name under which a plugin serves its component. */
    public static final String COMPONENT_ENDPOINT = "component";

    private Remotes() {
    }

    public static Ui ui(RpcConnection c, String ref) {
        return resolve(c, ref, Ui.class, r -> new RemoteUi(c, r));
    }

    public static Hook hook(RpcConnection c, String ref) {
        return resolve(c, ref, Hook.class, r -> new RemoteHook(c, r));
    }

    public static Cache cache(RpcConnection c, String ref) {
        return resolve(c, ref, Cache.class, r -> new RemoteCache(c, r));
    }

    public static ComponentLoader components(RpcConnection c, String ref) {
        return resolve(c, ref, ComponentLoader.class, r -> new RemoteComponentLoader(c, r));
    }

    /** Proxy of the given kind; the result implements {@link ComponentKind#capabilityType()}. */
    public static Object component(ComponentKind kind, RpcConnection c, String ref) {
        return switch (kind) {
            case BUILDER -> resolve(c, ref, Builder.class, r -> new RemoteBuilder(c, r));
            case PROVISIONER -> resolve(c, ref, Provisioner.class, r -> new RemoteProvisioner(c, r));
            case POST_PROCESSOR -> resolve(c, ref, PostProcessor.class, r -> new RemotePostProcessor(c, r));
            case HOOK -> resolve(c, ref, Hook.class, r -> new RemoteHook(c, r));
            case COMMAND -> resolve(c, ref, Command.class, r -> new RemoteCommand(c, r));
        };
    }

    private static <T> T resolve(RpcConnection c, String ref, Class<T> type, Function<String, T> proxy) {
        if (ref == null) {
            return null;
        }
        Object local = c.resolveLocal(ref);
        if (local == null) {
            return proxy.apply(ref);
        }
        if (!type.isInstance(local)) {
            throw new PluginCommunicationException(PluginCommunicationException.Reason.PROTOCOL, null, null,
                    "reference '" + ref + "' is not a " + type.getSimpleName());
        }
        return type.cast(local);
    }
}
