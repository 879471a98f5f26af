package com.kiln.rpc;

import com.kiln.rpc.remote.RemoteObject;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Endpoints exported for the duration of one outgoing call, such as the UI and hook handed to a
 * remote builder's run. Closing the scope unexports them all.
 */
public final class CallScope implements AutoCloseable {

    private final RpcConnection connection;
    private final String id;
    private final List<String> exported = new ArrayList<>();
    private int counter;
    private boolean closed;

    CallScope(RpcConnection connection, String id) {
        this.connection = connection;
        this.id = id;
    }

    public RpcConnection connection() {
        return connection;
    }

    /**
     * Exports {@code target} under a fresh name and returns the reference to pass in call
     * arguments. Null maps to null; a proxy for an endpoint on the other side of this same
     * connection is passed back as a local reference instead of being wrapped again.
     */
    public synchronized String export(String role, Object target, Supplier<Endpoint> endpoint) {
        if (target == null) {
            return null;
        }
        if (target instanceof RemoteObject remote && remote.connection() == connection) {
            return RpcConnection.LOCAL_REF_PREFIX + remote.endpoint();
        }
        if (closed) {
            throw new IllegalStateException("Call scope " + id + " is closed");
        }
        String name = id + "/" + role + "-" + (++counter);
        connection.export(name, endpoint.get());
        exported.add(name);
        return name;
    }

    @Override
    public void close() {
        List<String> names;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            names = new ArrayList<>(exported);
            exported.clear();
        }
        for (String name : names) {
            connection.unexport(name);
        }
    }
}
