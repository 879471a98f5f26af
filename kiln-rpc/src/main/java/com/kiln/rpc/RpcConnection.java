package com.kiln.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kiln.component.error.PluginCommunicationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * One duplex connection between host and plugin carrying newline-delimited JSON frames.
 * Both sides can call and serve: outgoing calls wait for the reply with the same id, incoming
 * calls are dispatched to exported {@link Endpoint}s on a worker pool so that a callback never
 * waits on the thread blocked in the call that triggered it.
 * <p>
 * When the transport drops, every pending and later call fails with
 * {@link PluginCommunicationException}; it never hangs.
 */
public final class RpcConnection implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RpcConnection.class);

    /** Prefix of a reference to an endpoint exported by the receiving side itself. */
    public static final String LOCAL_REF_PREFIX = "^";

    private final String name;
    private final Socket socket;
    private final BufferedReader reader;
    private final Writer writer;
    private final Object writeLock = new Object();
    private final Map<Long, CompletableFuture<RpcMessage>> pending = new ConcurrentHashMap<>();
    private final Map<String, Endpoint> endpoints = new ConcurrentHashMap<>();
    private final AtomicLong nextCallId = new AtomicLong();
    private final AtomicLong nextScopeId = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final CompletableFuture<Void> closedFuture = new CompletableFuture<>();
    private final ExecutorService handlers;
    private final Thread readerThread;
    private volatile PluginCommunicationException failure;
    private volatile UnaryOperator<PluginCommunicationException> failureDecorator = UnaryOperator.identity();

    private RpcConnection(String name, Socket socket) throws IOException {
        this.name = Objects.requireNonNull(name, "name");
        this.socket = socket;
        socket.setTcpNoDelay(true);
        this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
        AtomicInteger counter = new AtomicInteger();
        this.handlers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "kiln-rpc-" + name + "-handler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.readerThread = new Thread(this::readLoop, "kiln-rpc-" + name + "-reader");
        this.readerThread.setDaemon(true);
    }

    /** Wraps an accepted socket and starts reading. */
    public static RpcConnection over(String name, Socket socket) throws IOException {
        return over(name, socket, c -> { });
    }

    /**
     * Wraps an accepted socket, lets {@code exports} register endpoints, then starts reading. A
     * call the peer sends right after connecting always finds those endpoints.
     */
    public static RpcConnection over(String name, Socket socket, Consumer<RpcConnection> exports) throws IOException {
        RpcConnection c = new RpcConnection(name, socket);
        try {
            exports.accept(c);
        } catch (RuntimeException e) {
            c.close();
            throw e;
        }
        c.readerThread.start();
        return c;
    }

    /** Dials the address and starts reading. */
    public static RpcConnection dial(String name, InetSocketAddress address, Duration timeout) throws IOException {
        Socket socket = new Socket();
        try {
            socket.connect(address, (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()));
            return over(name, socket);
        } catch (IOException e) {
            try {
                socket.close();
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
    }

    public String getName() {
        return name;
    }

    /**
     * Adds context (typically the plugin's exit status) to communication failures before they
     * are thrown to callers.
     */
    public void setFailureDecorator(UnaryOperator<PluginCommunicationException> decorator) {
        this.failureDecorator = decorator != null ? decorator : UnaryOperator.identity();
    }

    public void export(String endpointName, Endpoint endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");
        if (endpointName == null || endpointName.isBlank() || endpointName.startsWith(LOCAL_REF_PREFIX)) {
            throw new IllegalArgumentException("Invalid endpoint name: '" + endpointName + "'");
        }
        if (endpoints.putIfAbsent(endpointName, endpoint) != null) {
            throw new IllegalStateException("Endpoint already exported: " + endpointName);
        }
    }

    public void unexport(String endpointName) {
        Endpoint removed = endpoints.remove(endpointName);
        if (removed != null) {
            try {
                removed.unexported();
            } catch (RuntimeException e) {
                log.warn("Releasing endpoint {} on {} failed: {}", endpointName, name, e.getMessage(), e);
            }
        }
    }

    /** Opens a scope for endpoints that live as long as one outgoing call. */
    public CallScope openScope() {
        return new CallScope(this, "s" + nextScopeId.incrementAndGet());
    }

    /**
     * Returns the local object behind a {@link #LOCAL_REF_PREFIX} reference, or null when the
     * reference names an endpoint on the other side.
     */
    public Object resolveLocal(String ref) {
        if (ref == null || !ref.startsWith(LOCAL_REF_PREFIX)) {
            return null;
        }
        Endpoint e = endpoints.get(ref.substring(LOCAL_REF_PREFIX.length()));
        if (e == null || e.target() == null) {
            throw new PluginCommunicationException(PluginCommunicationException.Reason.PROTOCOL, null, null,
                    "reference to unknown local endpoint '" + ref + "'");
        }
        return e.target();
    }

    /**
     * Calls {@code method} on the remote endpoint and waits for its reply.
     *
     * @param capability capability name used in error messages
     * @return the result, {@link NullNode} for void methods
     * @throws PluginCommunicationException on transport or framing failure
     * @throws RuntimeException             the error the remote side reported
     */
    public JsonNode call(String capability, String endpoint, String method, ObjectNode args) {
        if (closed.get()) {
            throw decorate(closedFailure(), capability, method);
        }
        long id = nextCallId.incrementAndGet();
        CompletableFuture<RpcMessage> reply = new CompletableFuture<>();
        pending.put(id, reply);
        try {
            send(RpcMessage.call(id, endpoint, method, args != null ? args : RpcCodec.object()));
        } catch (IOException e) {
            pending.remove(id);
            shutdown(new PluginCommunicationException(PluginCommunicationException.Reason.TRANSPORT,
                    null, null, null, "write failed: " + e.getMessage(), e));
            throw decorate(closedFailure(), capability, method);
        }
        // The connection may have dropped between the check above and registering the call.
        if (closed.get()) {
            reply.completeExceptionally(closedFailure());
        }
        RpcMessage message;
        try {
            message = reply.get();
        } catch (InterruptedException e) {
            pending.remove(id);
            Thread.currentThread().interrupt();
            throw new PluginCommunicationException(PluginCommunicationException.Reason.TRANSPORT,
                    capability, method, null, "interrupted while waiting for reply", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PluginCommunicationException pce) {
                throw decorate(pce, capability, method);
            }
            throw decorate(new PluginCommunicationException(PluginCommunicationException.Reason.TRANSPORT,
                    null, null, null, String.valueOf(cause), cause), capability, method);
        }
        if (message.error() != null) {
            throw message.error().toException(capability, method);
        }
        return message.result() != null ? message.result() : NullNode.getInstance();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Completes when the connection is closed from either side. */
    public CompletableFuture<Void> closedFuture() {
        return closedFuture;
    }

    @Override
    public void close() {
        shutdown(new PluginCommunicationException(PluginCommunicationException.Reason.CLOSED,
                null, null, "connection closed"));
    }

    private PluginCommunicationException decorate(PluginCommunicationException e, String capability, String method) {
        return failureDecorator.apply(e.withContext(capability, method, null));
    }

    private PluginCommunicationException closedFailure() {
        PluginCommunicationException f = failure;
        return f != null ? f : new PluginCommunicationException(PluginCommunicationException.Reason.CLOSED,
                null, null, "connection closed");
    }

    private void send(RpcMessage message) throws IOException {
        String line = RpcCodec.write(message);
        synchronized (writeLock) {
            writer.write(line);
            writer.write('\n');
            writer.flush();
        }
    }

    private void readLoop() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                RpcMessage message;
                try {
                    message = RpcCodec.read(line);
                } catch (JsonProcessingException e) {
                    shutdown(new PluginCommunicationException(PluginCommunicationException.Reason.PROTOCOL,
                            null, null, null, "malformed frame: " + e.getOriginalMessage(), e));
                    return;
                }
                dispatch(message);
            }
            shutdown(new PluginCommunicationException(PluginCommunicationException.Reason.TRANSPORT,
                    null, null, "connection closed by peer"));
        } catch (IOException e) {
            shutdown(new PluginCommunicationException(PluginCommunicationException.Reason.TRANSPORT,
                    null, null, null, e.getMessage(), e));
        }
    }

    private void dispatch(RpcMessage message) {
        if (RpcMessage.TYPE_REPLY.equals(message.type())) {
            CompletableFuture<RpcMessage> f = pending.remove(message.id());
            if (f == null) {
                log.warn("Discarding reply {} on {} with no pending call", message.id(), name);
                return;
            }
            f.complete(message);
        } else if (RpcMessage.TYPE_CALL.equals(message.type())) {
            try {
                handlers.execute(() -> handle(message));
            } catch (RejectedExecutionException e) {
                log.debug("Dropping call {} on closed connection {}", message.id(), name);
            }
        } else {
            log.warn("Discarding frame of unknown type '{}' on {}", message.type(), name);
        }
    }

    private void handle(RpcMessage call) {
        Endpoint endpoint = call.endpoint() != null ? endpoints.get(call.endpoint()) : null;
        RpcMessage reply;
        if (endpoint == null) {
            reply = RpcMessage.failure(call.id(), new ErrorDescriptor(ErrorDescriptor.KIND_PROTOCOL,
                    "unknown endpoint '" + call.endpoint() + "'", null));
        } else {
            try {
                JsonNode result = endpoint.invoke(call.method(), call.args() != null ? call.args() : RpcCodec.object());
                reply = RpcMessage.success(call.id(), result != null ? result : NullNode.getInstance());
            } catch (IllegalArgumentException e) {
                log.debug("Rejected arguments for {}.{} on {}: {}", call.endpoint(), call.method(), name, e.getMessage());
                reply = RpcMessage.failure(call.id(), new ErrorDescriptor(ErrorDescriptor.KIND_PROTOCOL,
                        call.method() + ": " + e.getMessage(), null));
            } catch (Exception e) {
                log.debug("Call {}.{} on {} failed: {}", call.endpoint(), call.method(), name, e.toString());
                reply = RpcMessage.failure(call.id(), ErrorDescriptor.from(e));
            }
        }
        try {
            send(reply);
        } catch (IOException e) {
            log.debug("Could not send reply {} on {}: {}", call.id(), name, e.getMessage());
        }
    }

    private void shutdown(PluginCommunicationException cause) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        failure = cause;
        log.debug("Connection {} closing: {}", name, cause.getMessage());
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Closing socket of {} failed: {}", name, e.getMessage());
        }
        for (Map.Entry<Long, CompletableFuture<RpcMessage>> e : pending.entrySet()) {
            e.getValue().completeExceptionally(cause);
        }
        pending.clear();
        for (String endpointName : endpoints.keySet()) {
            unexport(endpointName);
        }
        handlers.shutdown();
        closedFuture.complete(null);
    }
}
