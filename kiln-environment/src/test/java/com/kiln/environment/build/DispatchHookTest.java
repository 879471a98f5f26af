package com.kiln.environment.build;

import com.kiln.component.ConfigBundle;
import com.kiln.component.Hook;
import com.kiln.component.Provisioner;
import com.kiln.component.error.BuildException;
import com.kiln.environment.RecordingUi;
import com.kiln.ui.Ui;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DispatchHookTest {

    private final List<String> calls = new ArrayList<>();

    private Provisioner provisioner(String label) {
        return new Provisioner() {
            @Override
            public void prepare(List<ConfigBundle> raws) {
            }

            @Override
            public void provision(Ui ui) {
                calls.add("provision " + label);
            }

            @Override
            public void cancel() {
                calls.add("cancel " + label);
            }
        };
    }

    private Hook hook(String label) {
        return new Hook() {
            @Override
            public void run(String name, Ui ui, ConfigBundle data) {
                calls.add(label + " " + name + " " + data.get("k"));
            }

            @Override
            public void cancel() {
            }
        };
    }

    @Test
    void provisionHookRunsProvisionersInOrder() {
        DispatchHook hook = new DispatchHook(List.of(
                new Build.Named<>("first", provisioner("a"), null),
                new Build.Named<>("second", provisioner("b"), null)), Map.of());
        RecordingUi ui = new RecordingUi();

        hook.run(Hook.PROVISION, ui, ConfigBundle.empty());

        assertEquals(List.of("provision a", "provision b"), calls);
        assertEquals(List.of("Provisioning with first...", "Provisioning with second..."), ui.said);
    }

    @Test
    void otherNamesRunConfiguredHooks() {
        DispatchHook hook = new DispatchHook(List.of(), Map.of("after", List.of(hook("h1"), hook("h2"))));

        hook.run("after", new RecordingUi(), ConfigBundle.of(Map.of("k", "v")));
        hook.run("unconfigured", new RecordingUi(), ConfigBundle.empty());

        assertEquals(List.of("h1 after v", "h2 after v"), calls);
    }

    @Test
    void cancelledHookRefusesToContinue() {
        DispatchHook hook = new DispatchHook(List.of(new Build.Named<>("p", provisioner("a"), null)), Map.of());
        hook.cancel();

        assertThrows(BuildException.class, () -> hook.run(Hook.PROVISION, new RecordingUi(), ConfigBundle.empty()));
        assertEquals(List.of(), calls);
    }
}
