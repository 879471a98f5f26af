package com.kiln.plugin;

import com.kiln.component.error.PluginCommunicationException;
import com.kiln.component.error.PluginLaunchException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnabledOnOs({OS.LINUX, OS.MAC})
@Timeout(60)
class PluginClientTest {

    @TempDir
    Path tmp;

    private ServerSocket fakePlugin;
    private final List<Socket> accepted = new ArrayList<>();
    private volatile boolean closeOnAccept;

    @BeforeEach
    void listen() throws IOException {
        fakePlugin = new ServerSocket(0, 10, InetAddress.getLoopbackAddress());
        Thread acceptor = new Thread(() -> {
            try {
                while (true) {
                    Socket s = fakePlugin.accept();
                    if (closeOnAccept) {
                        s.close();
                    } else {
                        synchronized (accepted) {
                            accepted.add(s);
                        }
                    }
                }
            } catch (IOException ignored) {
                // listener closed
            }
        });
        acceptor.setDaemon(true);
        acceptor.start();
    }

    @AfterEach
    void stop() throws IOException {
        fakePlugin.close();
        synchronized (accepted) {
            for (Socket s : accepted) {
                s.close();
            }
        }
    }

    private String handshakeLine() {
        return "1|tcp|127.0.0.1:" + fakePlugin.getLocalPort();
    }

    private PluginClient client(Path script, Duration handshakeTimeout) {
        return new PluginClient(PluginClientConfig.builder(script)
                .handshakeTimeout(handshakeTimeout)
                .killGracePeriod(Duration.ofMillis(500))
                .build());
    }

    @Test
    void missingExecutableIsNotFound() {
        PluginClient client = client(tmp.resolve("kiln-builder-nope"), Duration.ofSeconds(5));

        PluginLaunchException e = assertThrows(PluginLaunchException.class, client::start);

        assertEquals(PluginLaunchException.Reason.NOT_FOUND, e.getReason());
        assertEquals(PluginState.EXITED, client.getState());
    }

    @Test
    void silentPluginTimesOutAndIsKilled() throws Exception {
        PluginClient client = client(Scripts.write(tmp, "kiln-builder-silent", "exec sleep 30"), Duration.ofMillis(500));

        PluginLaunchException e = assertThrows(PluginLaunchException.class, client::start);

        assertEquals(PluginLaunchException.Reason.TIMEOUT, e.getReason());
        assertFalse(client.isAlive());
        assertEquals(PluginState.EXITED, client.getState());
    }

    @Test
    void exitBeforeHandshakeReportsExitStatus() throws Exception {
        PluginClient client = client(Scripts.write(tmp, "kiln-builder-crash", "echo boom >&2\nexit 3"),
                Duration.ofSeconds(10));

        PluginLaunchException e = assertThrows(PluginLaunchException.class, client::start);

        assertEquals(PluginLaunchException.Reason.PROTOCOL, e.getReason());
        assertTrue(e.getMessage().contains("exit status 3"), e.getMessage());
        assertEquals(3, client.exitStatus().getAsInt());
    }

    @Test
    void wrongProtocolVersionIsRejectedAndProcessKilled() throws Exception {
        PluginClient client = client(Scripts.write(tmp, "kiln-builder-future",
                "echo '2|tcp|127.0.0.1:" + fakePlugin.getLocalPort() + "'\nexec sleep 30"), Duration.ofSeconds(10));

        PluginLaunchException e = assertThrows(PluginLaunchException.class, client::start);

        assertEquals(PluginLaunchException.Reason.PROTOCOL, e.getReason());
        assertFalse(client.isAlive());
    }

    @Test
    void pluginDyingAfterHandshakeFailsCallsInsteadOfHanging() throws Exception {
        closeOnAccept = true;
        PluginClient client = client(Scripts.write(tmp, "kiln-builder-flaky",
                "echo '" + handshakeLine() + "'\nexit 1"), Duration.ofSeconds(10));
        try {
            client.start();

            PluginCommunicationException e = assertThrows(PluginCommunicationException.class,
                    () -> client.builder().prepare(List.of()));

            assertEquals(1, e.getExitStatus().getAsInt());
        } finally {
            client.kill();
        }
    }

    @Test
    void killIsIdempotentAndLeavesNoProcess() throws Exception {
        PluginClient client = client(Scripts.write(tmp, "kiln-builder-ok",
                "echo '" + handshakeLine() + "'\nexec sleep 30"), Duration.ofSeconds(10));

        client.start();
        client.start();
        assertEquals(PluginState.CONNECTED, client.getState());
        assertTrue(client.isAlive());
        assertNotNull(client.getAddress());
        assertTrue(client.pid().isPresent());

        client.kill();
        client.close();
        client.kill();

        assertFalse(client.isAlive());
        assertEquals(PluginState.EXITED, client.getState());
        assertTrue(client.exitStatus().isPresent());
        PluginCommunicationException e = assertThrows(PluginCommunicationException.class, client::builder);
        assertEquals(PluginCommunicationException.Reason.CLOSED, e.getReason());
    }

    @Test
    void trackerCleanupTwiceLeavesNothingRunning() throws Exception {
        ClientTracker tracker = new ClientTracker();
        List<PluginClient> clients = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            PluginClient c = client(Scripts.write(tmp, "kiln-hook-h" + i,
                    "echo '" + handshakeLine() + "'\nexec sleep 30"), Duration.ofSeconds(10));
            tracker.track(c);
            c.start();
            clients.add(c);
        }
        assertEquals(3, tracker.size());

        tracker.cleanup();
        tracker.cleanup();

        assertEquals(0, tracker.size());
        for (PluginClient c : clients) {
            assertFalse(c.isAlive());
        }
    }

    @Test
    void cancelledTrackerRefusesNewLaunches() throws Exception {
        ClientTracker tracker = new ClientTracker();
        tracker.cancel();

        PluginLaunchException e = assertThrows(PluginLaunchException.class,
                () -> tracker.track(client(tmp.resolve("kiln-builder-x"), Duration.ofSeconds(1))));

        assertEquals(PluginLaunchException.Reason.CANCELLED, e.getReason());
        assertTrue(tracker.isCancelled());
    }
}
