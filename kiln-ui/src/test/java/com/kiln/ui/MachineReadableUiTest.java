package com.kiln.ui;

import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MachineReadableUiTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(42), ZoneOffset.UTC);

    @Test
    void uiCallsBecomeUiEvents() {
        StringWriter out = new StringWriter();
        MachineReadableUi ui = new MachineReadableUi(out, CLOCK);

        ui.say("hello");
        ui.withTarget("web").error("bad, really");
        ui.machine("artifact-count", "1");

        assertEquals("42,,ui,say,hello\n"
                + "42,web,ui,error,bad\\, really\n"
                + "42,,artifact-count,1\n", out.toString());
    }

    @Test
    void nullTextIsWrittenAsEmptyField() {
        StringWriter out = new StringWriter();
        MachineReadableUi ui = new MachineReadableUi(out, CLOCK);

        ui.say(null);
        ui.error(null);
        ui.machine("artifact", "0", (String) null);

        assertEquals("42,,ui,say,\n"
                + "42,,ui,error,\n"
                + "42,,artifact,0,\n", out.toString());
    }

    @Test
    void askIsUnsupported() {
        MachineReadableUi ui = new MachineReadableUi(new StringWriter(), CLOCK);

        assertThrows(UnsupportedOperationException.class, () -> ui.ask("continue?"));
    }

    @Test
    void concurrentWritersNeverInterleaveWithinALine() throws Exception {
        StringWriter out = new StringWriter();
        MachineReadableUi root = new MachineReadableUi(out, CLOCK);
        int threads = 8;
        int perThread = 200;
        CountDownLatch start = new CountDownLatch(1);
        List<Thread> workers = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            Ui ui = TargetedUi.of(root, "build-" + t);
            Thread w = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < perThread; i++) {
                    ui.message("line " + i + " with, comma");
                }
            });
            workers.add(w);
            w.start();
        }
        start.countDown();
        for (Thread w : workers) {
            w.join();
        }

        String[] lines = out.toString().split("\n");
        assertEquals(threads * perThread, lines.length);
        for (String line : lines) {
            UiEvent e = MachineReadableCodec.decode(line);
            assertEquals("ui", e.type());
            assertEquals("message", e.data().get(0));
        }
    }
}
