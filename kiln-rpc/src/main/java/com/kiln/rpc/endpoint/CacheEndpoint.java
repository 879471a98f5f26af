package com.kiln.rpc.endpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kiln.cache.Cache;
import com.kiln.cache.CacheLease;
import com.kiln.rpc.CallScope;
import com.kiln.rpc.RpcCodec;

/**
 * Serves a cache for one call. Each acquired lease is exported into the same scope, so a lease the
 * remote side never releases is released when the call ends.
 */
public final class CacheEndpoint extends ObjectEndpoint<Cache> {

    private final CallScope scope;

    public CacheEndpoint(Cache cache, CallScope scope) {
        super(cache, scope.connection());
        this.scope = scope;
    }

    @Override
    public JsonNode invoke(String method, JsonNode args) {
        if (!"acquire".equals(method)) {
            throw unknownMethod(method);
        }
        CacheLease lease = target.acquire(RpcCodec.requireText(args, "key"));
        String ref;
        try {
            ref = Exports.lease(scope, lease);
        } catch (RuntimeException e) {
            lease.release();
            throw e;
        }
        ObjectNode out = RpcCodec.object();
        out.put("key", lease.key());
        out.put("path", lease.path().toString());
        out.put("lease", ref);
        return out;
    }
}
