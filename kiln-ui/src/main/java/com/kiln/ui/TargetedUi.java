package com.kiln.ui;

import java.util.Objects;

/**
 * Attributes every message to one build. For human output the build name is prefixed to each
 * line; for machine-readable output the events carry the name as their target.
 */
public final class TargetedUi implements Ui {

    private final Ui delegate;
    private final String target;

    private TargetedUi(Ui delegate, String target) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.target = Objects.requireNonNull(target, "target");
    }

    /** UI for build {@code target} on top of {@code ui}. */
    public static Ui of(Ui ui, String target) {
        if (ui instanceof MachineReadableUi) {
            return ((MachineReadableUi) ui).withTarget(target);
        }
        return new TargetedUi(ui, target);
    }

    public String getTarget() {
        return target;
    }

    @Override
    public String ask(String query) {
        return delegate.ask(prefixLines("==> ", query));
    }

    @Override
    public void say(String message) {
        delegate.say(prefixLines("==> ", message));
    }

    @Override
    public void message(String message) {
        delegate.message(prefixLines("    ", message));
    }

    @Override
    public void error(String message) {
        delegate.error(prefixLines("==> ", message));
    }

    @Override
    public void machine(String type, String... data) {
        delegate.machine(type, data);
    }

    private String prefixLines(String marker, String message) {
        String prefix = marker + target + ": ";
        String m = message != null ? message : "";
        return prefix + m.replace("\n", "\n" + prefix);
    }
}
