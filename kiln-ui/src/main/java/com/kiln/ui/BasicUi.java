package com.kiln.ui;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Human-oriented UI over plain streams. Messages go to {@code out}, errors to {@code err}; machine
 * events are only logged. All output is serialized on one lock.
 */
public final class BasicUi implements Ui {

    private static final Logger log = LoggerFactory.getLogger(BasicUi.class);

    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;
    private final Object lock = new Object();

    public BasicUi(InputStream in, OutputStream out, OutputStream err) {
        this.in = in != null ? new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)) : null;
        this.out = toPrintStream(out);
        this.err = toPrintStream(err);
    }

    /** UI over the process's standard streams. */
    public static BasicUi standard() {
        return new BasicUi(System.in, System.out, System.err);
    }

    private static PrintStream toPrintStream(OutputStream os) {
        if (os instanceof PrintStream) {
            return (PrintStream) os;
        }
        return new PrintStream(os, true, StandardCharsets.UTF_8);
    }

    /** Prints the query and reads one line; returns an empty string at end of input. */
    @Override
    public String ask(String query) {
        synchronized (lock) {
            out.println(query);
            out.flush();
            if (in == null) {
                return "";
            }
            try {
                String line = in.readLine();
                return line != null ? line.trim() : "";
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read answer", e);
            }
        }
    }

    @Override
    public void say(String message) {
        synchronized (lock) {
            out.println(message);
            out.flush();
        }
    }

    @Override
    public void message(String message) {
        say(message);
    }

    @Override
    public void error(String message) {
        synchronized (lock) {
            err.println(message);
            err.flush();
        }
    }

    @Override
    public void machine(String type, String... data) {
        log.debug("machine readable: {} {}", type, data != null ? Arrays.asList(data) : "[]");
    }
}
