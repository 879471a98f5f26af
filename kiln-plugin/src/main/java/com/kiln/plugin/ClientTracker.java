package com.kiln.plugin;

import com.kiln.component.error.PluginLaunchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Every plugin client launched on behalf of one environment. {@link #cleanup()} terminates them
 * all; a client leaves the set only once its process is confirmed gone.
 */
public final class ClientTracker {

    private static final Logger log = LoggerFactory.getLogger(ClientTracker.class);

    private final Set<PluginClient> clients = new LinkedHashSet<>();
    private boolean cancelled;

    /**
     * Adds a client before it is started.
     *
     * @throws PluginLaunchException with reason CANCELLED after {@link #cancel()}
     */
    public synchronized void track(PluginClient client) {
        if (cancelled) {
            throw new PluginLaunchException(PluginLaunchException.Reason.CANCELLED, client.getName(),
                    "no new plugins are launched after cancellation");
        }
        clients.add(client);
    }

    /** Refuses further launches and kills every tracked client. */
    public void cancel() {
        synchronized (this) {
            cancelled = true;
        }
        cleanup();
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    /**
     * Kills every tracked client. Failures are logged per client and never thrown; safe to call
     * repeatedly and concurrently.
     */
    public void cleanup() {
        List<PluginClient> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(clients);
        }
        for (PluginClient client : snapshot) {
            try {
                client.kill();
            } catch (RuntimeException e) {
                log.warn("Error killing plugin {}: {}", client.getName(), e.getMessage(), e);
            }
            if (client.isAlive()) {
                log.warn("Plugin {} is still running after cleanup", client.getName());
            } else {
                synchronized (this) {
                    clients.remove(client);
                }
            }
        }
    }

    public synchronized int size() {
        return clients.size();
    }

    public synchronized List<PluginClient> clients() {
        return List.copyOf(clients);
    }
}
