package com.kiln.rpc.endpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.kiln.cache.CacheLease;
import com.kiln.rpc.RpcConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CacheLeaseEndpoint extends ObjectEndpoint<CacheLease> {

    private static final Logger log = LoggerFactory.getLogger(CacheLeaseEndpoint.class);

    public CacheLeaseEndpoint(CacheLease lease, RpcConnection connection) {
        super(lease, connection);
    }

    @Override
    public JsonNode invoke(String method, JsonNode args) {
        switch (method) {
            case "release":
                target.release();
                return none();
            case "key":
                return TextNode.valueOf(target.key());
            default:
                throw unknownMethod(method);
        }
    }

    @Override
    public void unexported() {
        log.debug("Releasing cache lease {} at end of call", target.key());
        target.release();
    }
}
