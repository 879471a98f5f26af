/**
 * Host/plugin RPC over one TCP connection per plugin.
 * <p>
 * Frames are single JSON lines. Either side may call endpoints the other has exported: the plugin
 * exports its component as {@code component}; the host exports the UI, hook, cache and component
 * loader it passes into a call for as long as that call runs ({@link com.kiln.rpc.CallScope}).
 * {@link com.kiln.rpc.endpoint} holds the serving adapters, {@link com.kiln.rpc.remote} the proxies.
 */
package com.kiln.rpc;
