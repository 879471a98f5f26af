package com.kiln.ui;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * UI for scripted use: every call becomes one {@link MachineReadableCodec} line. Views created with
 * {@link #withTarget(String)} share the writer and its lock, so concurrent builds never interleave
 * within a line.
 */
public final class MachineReadableUi implements Ui {

    private final Sink sink;
    private final String target;

    public MachineReadableUi(OutputStream out) {
        this(new OutputStreamWriter(out, StandardCharsets.UTF_8), Clock.systemUTC());
    }

    public MachineReadableUi(Writer writer, Clock clock) {
        this(new Sink(writer, clock), "");
    }

    private MachineReadableUi(Sink sink, String target) {
        this.sink = sink;
        this.target = target;
    }

    /** View of this UI whose events carry {@code target}. */
    public MachineReadableUi withTarget(String target) {
        return new MachineReadableUi(sink, target != null ? target : "");
    }

    public String getTarget() {
        return target;
    }

    /** Questions cannot be answered by a script. */
    @Override
    public String ask(String query) {
        throw new UnsupportedOperationException("Machine-readable UI cannot ask questions: " + query);
    }

    @Override
    public void say(String message) {
        machine(UiEvent.TYPE_UI, "say", message);
    }

    @Override
    public void message(String message) {
        machine(UiEvent.TYPE_UI, "message", message);
    }

    @Override
    public void error(String message) {
        machine(UiEvent.TYPE_UI, "error", message);
    }

    @Override
    public void machine(String type, String... data) {
        List<String> fields = data != null ? Arrays.asList(data) : List.of();
        sink.write(new UiEvent(sink.clock.instant().getEpochSecond(), target, type, fields));
    }

    private static final class Sink {
        private final Writer writer;
        private final Clock clock;

        Sink(Writer writer, Clock clock) {
            this.writer = Objects.requireNonNull(writer, "writer");
            this.clock = Objects.requireNonNull(clock, "clock");
        }

        synchronized void write(UiEvent event) {
            try {
                writer.write(MachineReadableCodec.encode(event));
                writer.write('\n');
                writer.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write machine-readable output", e);
            }
        }
    }
}
