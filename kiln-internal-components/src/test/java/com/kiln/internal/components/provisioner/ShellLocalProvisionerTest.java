package com.kiln.internal.components.provisioner;

import com.kiln.component.ConfigBundle;
import com.kiln.component.error.BuildException;
import com.kiln.component.error.ConfigException;
import com.kiln.internal.components.RecordingUi;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ShellLocalProvisionerTest {

    private static ShellLocalProvisioner prepared(Map<String, Object> config) {
        ShellLocalProvisioner provisioner = new ShellLocalProvisioner();
        provisioner.prepare(List.of(ConfigBundle.of(config)));
        return provisioner;
    }

    @Test
    void streamsOutputOfEachInlineCommand() {
        RecordingUi ui = new RecordingUi();

        prepared(Map.of("inline", List.of("echo one", "echo two >&2"))).provision(ui);

        assertTrue(ui.said.contains("one"));
        assertTrue(ui.said.contains("two"));
        assertTrue(ui.said.contains("Executing local command: echo one"));
    }

    @Test
    void passesEnvironmentVariables() {
        RecordingUi ui = new RecordingUi();

        prepared(Map.of("command", "echo $GREETING", "environment_vars", List.of("GREETING=hi there")))
                .provision(ui);

        assertTrue(ui.said.contains("hi there"));
    }

    @Test
    void nonZeroExitFailsAndStopsLaterCommands() {
        RecordingUi ui = new RecordingUi();
        ShellLocalProvisioner provisioner = prepared(Map.of("inline", List.of("exit 3", "echo never")));

        BuildException e = assertThrows(BuildException.class, () -> provisioner.provision(ui));

        assertTrue(e.getMessage().contains("non-zero exit status 3"));
        assertFalse(ui.said.contains("never"));
    }

    @Test
    void cancelStopsRunningCommand() throws Exception {
        ShellLocalProvisioner provisioner = prepared(Map.of("command", "sleep 30"));
        CompletableFuture<Void> run = CompletableFuture.runAsync(() -> provisioner.provision(new RecordingUi()));
        Thread.sleep(500);

        provisioner.cancel();

        Exception e = assertThrows(Exception.class, () -> run.get(10, TimeUnit.SECONDS));
        assertTrue(e.getCause() instanceof BuildException);
    }

    @Test
    void requiresExactlyOneOfInlineOrCommand() {
        ConfigException none = assertThrows(ConfigException.class, () -> prepared(Map.of()));
        ConfigException both = assertThrows(ConfigException.class,
                () -> prepared(Map.of("inline", List.of("a"), "command", "b")));
        ConfigException badVar = assertThrows(ConfigException.class,
                () -> prepared(Map.of("command", "b", "environment_vars", List.of("NOVALUE"))));

        assertEquals(List.of("one of inline or command must be specified"), none.getErrors());
        assertEquals(List.of("only one of inline or command may be specified"), both.getErrors());
        assertEquals(1, badVar.getErrors().size());
    }
}
