package com.kiln.rpc.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.kiln.cache.Cache;
import com.kiln.cache.CacheLease;
import com.kiln.rpc.RpcCodec;
import com.kiln.rpc.RpcConnection;

import java.nio.file.Path;

public final class RemoteCache extends RemoteObject implements Cache {

    public RemoteCache(RpcConnection connection, String endpoint) {
        super(connection, endpoint, "cache");
    }

    /** Blocks until the key is free; acquisitions from different threads are not serialized. */
    @Override
    public CacheLease acquire(String key) {
        JsonNode result = callConcurrently("acquire", RpcCodec.object().put("key", key));
        return decode("acquire", result, r -> new RemoteCacheLease(connection(),
                RpcCodec.requireText(r, "lease"),
                RpcCodec.requireText(r, "key"),
                Path.of(RpcCodec.requireText(r, "path"))));
    }
}
