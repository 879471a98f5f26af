package com.kiln.internal.components.provisioner;

import com.kiln.component.ConfigBundle;
import com.kiln.component.Provisioner;
import com.kiln.component.error.BuildException;
import com.kiln.config.ConfigDecoder;
import com.kiln.ui.Ui;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs shell commands on the machine running Kiln, through {@code /bin/sh -c}. Output lines are
 * streamed to the UI; a non-zero exit status fails the build.
 */
public final class ShellLocalProvisioner implements Provisioner {

    private static final Logger log = LoggerFactory.getLogger(ShellLocalProvisioner.class);

    private List<String> commands = List.of();
    private List<String> environmentVars = List.of();
    private final AtomicReference<Process> running = new AtomicReference<>();
    private volatile boolean cancelled;

    @Override
    public void prepare(List<ConfigBundle> raws) {
        ConfigDecoder d = ConfigDecoder.of(raws);
        List<String> inline = d.optionalStringList("inline", null);
        String command = d.optionalString("command", null);
        environmentVars = d.optionalStringList("environment_vars", List.of());
        if (inline != null && command != null) {
            d.error("only one of inline or command may be specified");
        } else if (inline == null && command == null) {
            d.error("one of inline or command must be specified");
        } else if (inline != null && inline.isEmpty()) {
            d.error("inline must contain at least one command");
        }
        for (String var : environmentVars) {
            int eq = var.indexOf('=');
            if (eq <= 0) {
                d.error("environment_vars: '" + var + "' is not of the form KEY=value");
            }
        }
        d.rejectUnknownKeys();
        d.validate();
        commands = inline != null ? inline : List.of(command);
    }

    @Override
    public void provision(Ui ui) {
        for (String command : commands) {
            if (cancelled) {
                throw new BuildException("Provisioning was cancelled");
            }
            ui.say("Executing local command: " + command);
            int status = execute(command, ui);
            if (cancelled) {
                throw new BuildException("Provisioning was cancelled");
            }
            if (status != 0) {
                throw new BuildException("Command '" + command + "' exited with non-zero exit status " + status);
            }
        }
    }

    private int execute(String command, Ui ui) {
        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", command).redirectErrorStream(true);
        for (String var : environmentVars) {
            int eq = var.indexOf('=');
            pb.environment().put(var.substring(0, eq), var.substring(eq + 1));
        }
        Process p;
        try {
            p = pb.start();
        } catch (IOException e) {
            throw new BuildException("Failed to run '" + command + "': " + e.getMessage(), e);
        }
        running.set(p);
        try (BufferedReader out = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = out.readLine()) != null) {
                ui.message(line);
            }
            return p.waitFor();
        } catch (IOException e) {
            throw new BuildException("Failed reading output of '" + command + "': " + e.getMessage(), e);
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new BuildException("Interrupted while running '" + command + "'", e);
        } finally {
            running.set(null);
        }
    }

    @Override
    public void cancel() {
        cancelled = true;
        Process p = running.get();
        if (p != null) {
            log.debug("Cancelling local command (pid {})", p.pid());
            p.descendants().forEach(ProcessHandle::destroy);
            p.destroy();
        }
    }
}
