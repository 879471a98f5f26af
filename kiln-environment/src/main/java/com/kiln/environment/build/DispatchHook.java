package com.kiln.environment.build;

import com.kiln.component.ConfigBundle;
import com.kiln.component.Hook;
import com.kiln.component.Provisioner;
import com.kiln.component.error.BuildException;
import com.kiln.ui.Ui;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The hook a builder receives. {@link Hook#PROVISION} runs the build's provisioners in order;
 * any other name runs the hooks configured for it. Cancelling stops the one running and
 * every one after it.
 */
public final class DispatchHook implements Hook {

    private final List<Build.Named<Provisioner>> provisioners;
    private final Map<String, List<Hook>> hooks;
    private final AtomicReference<Runnable> running = new AtomicReference<>();
    private volatile boolean cancelled;

    public DispatchHook(List<Build.Named<Provisioner>> provisioners, Map<String, List<Hook>> hooks) {
        this.provisioners = List.copyOf(provisioners);
        this.hooks = Map.copyOf(hooks);
    }

    @Override
    public void run(String name, Ui ui, ConfigBundle data) {
        if (PROVISION.equals(name)) {
            for (Build.Named<Provisioner> p : provisioners) {
                checkCancelled();
                ui.say("Provisioning with " + p.name() + "...");
                Provisioner provisioner = p.component();
                runCancellable(provisioner::cancel, () -> provisioner.provision(ui));
            }
            return;
        }
        for (Hook hook : hooks.getOrDefault(name, List.of())) {
            checkCancelled();
            runCancellable(hook::cancel, () -> hook.run(name, ui, data));
        }
    }

    private void runCancellable(Runnable cancel, Runnable body) {
        running.set(cancel);
        try {
            if (cancelled) {
                cancel.run();
            }
            body.run();
        } finally {
            running.set(null);
        }
    }

    private void checkCancelled() {
        if (cancelled) {
            throw new BuildException("Build was cancelled");
        }
    }

    @Override
    public void cancel() {
        cancelled = true;
        Runnable current = running.get();
        if (current != null) {
            current.run();
        }
    }
}
