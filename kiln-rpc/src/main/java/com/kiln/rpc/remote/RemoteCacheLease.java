package com.kiln.rpc.remote;

import com.kiln.cache.CacheLease;
import com.kiln.component.error.PluginCommunicationException;
import com.kiln.rpc.RpcCodec;
import com.kiln.rpc.RpcConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lease held on the other side. If the connection is gone the lease was already released there
 * when its call ended, so a failed release is only logged.
 */
public final class RemoteCacheLease extends RemoteObject implements CacheLease {

    private static final Logger log = LoggerFactory.getLogger(RemoteCacheLease.class);

    private final String key;
    private final Path path;
    private final AtomicBoolean released = new AtomicBoolean();

    RemoteCacheLease(RpcConnection connection, String endpoint, String key, Path path) {
        super(connection, endpoint, "cache-lease");
        this.key = key;
        this.path = path;
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        try {
            call("release", RpcCodec.object());
        } catch (PluginCommunicationException e) {
            log.warn("Could not release cache lease {} remotely: {}", key, e.getMessage());
        }
    }
}
