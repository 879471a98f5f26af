package com.kiln.rpc;

import com.kiln.cache.Cache;
import com.kiln.cache.CacheLease;
import com.kiln.component.Artifact;
import com.kiln.component.Builder;
import com.kiln.component.ConfigBundle;
import com.kiln.component.Hook;
import com.kiln.component.error.ConfigException;
import com.kiln.component.error.PluginCommunicationException;
import com.kiln.rpc.endpoint.BuilderEndpoint;
import com.kiln.rpc.endpoint.Exports;
import com.kiln.rpc.remote.RemoteBuilder;
import com.kiln.rpc.remote.Remotes;
import com.kiln.ui.Ui;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(30)
class RpcConnectionTest {

    @Test
    void builderRunCallsBackIntoHostUiHookAndCache() throws Exception {
        RecordingUi ui = new RecordingUi();
        List<String> hooks = Collections.synchronizedList(new ArrayList<>());
        Hook hook = new Hook() {
            @Override
            public void run(String name, Ui hookUi, ConfigBundle data) {
                hookUi.say("hook " + name + " " + data.get("step"));
                hooks.add(name);
            }

            @Override
            public void cancel() {
            }
        };
        CountingCache cache = new CountingCache();

        try (LoopbackPair pair = LoopbackPair.open()) {
            pair.plugin.export(Remotes.COMPONENT_ENDPOINT, new BuilderEndpoint(new TalkingBuilder(), pair.plugin));
            Builder builder = new RemoteBuilder(pair.host, Remotes.COMPONENT_ENDPOINT);

            assertEquals(List.of("warned"), builder.prepare(List.of(ConfigBundle.of(Map.of("artifact_id", "a1")))));
            Artifact artifact = builder.run(ui, hook, cache);

            assertEquals("talking", artifact.builderId());
            assertEquals("a1", artifact.id());
            assertEquals(List.of("/cache/iso"), artifact.files());
            assertEquals(List.of("say:building", "say:hook kiln_provision 1", "message:done"), ui.lines);
            assertEquals(List.of(Hook.PROVISION), hooks);
            assertEquals(1, cache.acquired.get());
            assertEquals(1, cache.released.get());
        }
    }

    @Test
    void callSentBeforePluginSideStartsReadingFindsInitialExports() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            RpcConnection host = RpcConnection.dial("host",
                    new InetSocketAddress(InetAddress.getLoopbackAddress(), server.getLocalPort()), Duration.ofSeconds(5));
            Socket accepted = server.accept();
            RpcConnection plugin = null;
            try {
                Builder builder = new RemoteBuilder(host, Remotes.COMPONENT_ENDPOINT);
                CompletableFuture<List<String>> warnings = CompletableFuture.supplyAsync(
                        () -> builder.prepare(List.of(ConfigBundle.of(Map.of("artifact_id", "a1")))));
                // let the call reach the plugin's socket buffer first
                Thread.sleep(200);
                plugin = RpcConnection.over("plugin", accepted,
                        c -> c.export(Remotes.COMPONENT_ENDPOINT, new BuilderEndpoint(new TalkingBuilder(), c)));

                assertEquals(List.of("warned"), warnings.get(10, TimeUnit.SECONDS));
            } finally {
                host.close();
                if (plugin != null) {
                    plugin.close();
                } else {
                    accepted.close();
                }
            }
        }
    }

    @Test
    void failingInitialExportClosesTheConnection() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            RpcConnection host = RpcConnection.dial("host",
                    new InetSocketAddress(InetAddress.getLoopbackAddress(), server.getLocalPort()), Duration.ofSeconds(5));
            Socket accepted = server.accept();
            try {
                assertThrows(IllegalArgumentException.class, () -> RpcConnection.over("plugin", accepted,
                        c -> c.export(RpcConnection.LOCAL_REF_PREFIX + "bad", new BuilderEndpoint(new TalkingBuilder(), c))));
                assertTrue(accepted.isClosed());
            } finally {
                host.close();
            }
        }
    }

    @Test
    void configErrorsArriveAsConfigExceptions() throws Exception {
        try (LoopbackPair pair = LoopbackPair.open()) {
            pair.plugin.export(Remotes.COMPONENT_ENDPOINT, new BuilderEndpoint(new TalkingBuilder(), pair.plugin));
            Builder builder = new RemoteBuilder(pair.host, Remotes.COMPONENT_ENDPOINT);

            ConfigException e = assertThrows(ConfigException.class, () -> builder.prepare(List.of()));
            assertEquals(List.of("artifact_id must be specified"), e.getErrors());
        }
    }

    @Test
    void unknownEndpointIsAProtocolFailure() throws Exception {
        try (LoopbackPair pair = LoopbackPair.open()) {
            Builder builder = new RemoteBuilder(pair.host, "nobody");

            PluginCommunicationException e = assertThrows(PluginCommunicationException.class, builder::cancel);
            assertEquals(PluginCommunicationException.Reason.PROTOCOL, e.getReason());
        }
    }

    @Test
    void peerDisappearingFailsBlockedCallInsteadOfHanging() throws Exception {
        CountDownLatch running = new CountDownLatch(1);
        try (LoopbackPair pair = LoopbackPair.open()) {
            pair.plugin.export(Remotes.COMPONENT_ENDPOINT, new BuilderEndpoint(new TalkingBuilder() {
                @Override
                public Artifact run(Ui ui, Hook hook, Cache cache) {
                    running.countDown();
                    try {
                        Thread.sleep(60_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return null;
                }
            }, pair.plugin));
            Builder builder = new RemoteBuilder(pair.host, Remotes.COMPONENT_ENDPOINT);
            pair.host.setFailureDecorator(e -> e.withContext(null, null, 3));

            Thread closer = new Thread(() -> {
                try {
                    running.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                pair.plugin.close();
            });
            closer.start();

            PluginCommunicationException e = assertThrows(PluginCommunicationException.class,
                    () -> builder.run(new RecordingUi(), null, null));
            assertEquals(PluginCommunicationException.Reason.PROCESS_EXITED, e.getReason());
            assertEquals(3, e.getExitStatus().getAsInt());
            assertEquals("builder", e.getCapability());
            assertEquals("run", e.getMethod());
            pair.host.closedFuture().get(5, TimeUnit.SECONDS);
            assertTrue(pair.host.isClosed());

            PluginCommunicationException later = assertThrows(PluginCommunicationException.class,
                    () -> builder.prepare(List.of()));
            assertEquals("prepare", later.getMethod());
        }
    }

    @Test
    void cancelIsDeliveredWhileRunIsInProgress() throws Exception {
        CountDownLatch running = new CountDownLatch(1);
        AtomicBoolean cancelled = new AtomicBoolean();
        try (LoopbackPair pair = LoopbackPair.open()) {
            pair.plugin.export(Remotes.COMPONENT_ENDPOINT, new BuilderEndpoint(new TalkingBuilder() {
                private final CountDownLatch stop = new CountDownLatch(1);

                @Override
                public Artifact run(Ui ui, Hook hook, Cache cache) {
                    running.countDown();
                    try {
                        stop.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return new Artifact("talking", cancelled.get() ? "cancelled" : "finished", null, null);
                }

                @Override
                public void cancel() {
                    cancelled.set(true);
                    stop.countDown();
                }
            }, pair.plugin));
            Builder builder = new RemoteBuilder(pair.host, Remotes.COMPONENT_ENDPOINT);

            Thread canceller = new Thread(() -> {
                try {
                    running.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                builder.cancel();
            });
            canceller.start();

            assertEquals("cancelled", builder.run(new RecordingUi(), null, null).id());
            canceller.join(5_000);
        }
    }

    @Test
    void scopeEndpointsAreGoneAfterTheCall() throws Exception {
        try (LoopbackPair pair = LoopbackPair.open()) {
            CallScope scope = pair.host.openScope();
            RecordingUi ui = new RecordingUi();
            String ref = Exports.ui(scope, ui);
            Ui remote = Remotes.ui(pair.plugin, ref);
            remote.say("hello");
            assertEquals(List.of("say:hello"), ui.lines);
            scope.close();

            PluginCommunicationException e = assertThrows(PluginCommunicationException.class, () -> remote.say("late"));
            assertEquals(PluginCommunicationException.Reason.PROTOCOL, e.getReason());
            assertFalse(pair.host.isClosed());
        }
    }

    static class TalkingBuilder implements Builder {
        private volatile String artifactId;

        @Override
        public List<String> prepare(List<ConfigBundle> raws) {
            Object id = ConfigBundle.merge(raws).get("artifact_id");
            if (id == null) {
                throw new ConfigException("artifact_id must be specified");
            }
            artifactId = id.toString();
            return List.of("warned");
        }

        @Override
        public Artifact run(Ui ui, Hook hook, Cache cache) {
            ui.say("building");
            hook.run(Hook.PROVISION, ui, ConfigBundle.of(Map.of("step", 1)));
            try (CacheLease lease = cache.acquire("iso")) {
                ui.message("done");
                return new Artifact("talking", artifactId, List.of(lease.path().toString()), null);
            }
        }

        @Override
        public void cancel() {
        }
    }

    static final class RecordingUi implements Ui {
        final List<String> lines = Collections.synchronizedList(new ArrayList<>());

        @Override
        public String ask(String query) {
            return "answer";
        }

        @Override
        public void say(String message) {
            lines.add("say:" + message);
        }

        @Override
        public void message(String message) {
            lines.add("message:" + message);
        }

        @Override
        public void error(String message) {
            lines.add("error:" + message);
        }

        @Override
        public void machine(String type, String... data) {
            lines.add("machine:" + type);
        }
    }

    static final class CountingCache implements Cache {
        final AtomicInteger acquired = new AtomicInteger();
        final AtomicInteger released = new AtomicInteger();

        @Override
        public CacheLease acquire(String key) {
            acquired.incrementAndGet();
            AtomicBoolean done = new AtomicBoolean();
            return new CacheLease() {
                @Override
                public String key() {
                    return key;
                }

                @Override
                public Path path() {
                    return Path.of("/cache", key);
                }

                @Override
                public void release() {
                    if (done.compareAndSet(false, true)) {
                        released.incrementAndGet();
                    }
                }
            };
        }
    }
}
