package com.kiln.ui;

/**
 * Progress and output reporting. Host code and plugins (through the RPC bridge) write to the same
 * {@code Ui}; implementations serialize writes so two messages never interleave.
 */
public interface Ui {

    /**
     * Asks the user a question and returns the answer.
     *
     * @throws UnsupportedOperationException when the UI cannot ask (e.g. machine-readable mode)
     */
    String ask(String query);

    /** Prominent progress message. */
    void say(String message);

    /** Secondary informational message. */
    void message(String message);

    /** Error message. */
    void error(String message);

    /**
     * Machine-readable event. Human-oriented UIs may ignore it.
     *
     * @param type event type (e.g. {@code artifact})
     * @param data event fields, in order
     */
    void machine(String type, String... data);
}
