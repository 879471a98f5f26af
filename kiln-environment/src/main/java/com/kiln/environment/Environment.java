package com.kiln.environment;

import com.kiln.cache.Cache;
import com.kiln.component.Builder;
import com.kiln.component.Command;
import com.kiln.component.CommandContext;
import com.kiln.component.ComponentKind;
import com.kiln.component.ComponentLoader;
import com.kiln.component.Hook;
import com.kiln.component.PostProcessor;
import com.kiln.component.Provisioner;
import com.kiln.plugin.ClientTracker;
import com.kiln.plugin.ComponentDescriptor;
import com.kiln.plugin.ComponentRegistry;
import com.kiln.ui.Ui;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Dispatches a command line to a command and owns every plugin launched while it runs.
 * Also the {@link CommandContext} handed to commands: components loaded through it are tracked
 * and killed when {@link #cli} returns.
 */
public final class Environment implements CommandContext, ComponentLoader, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Environment.class);

    static final String VERSION_COMMAND = "version";

    private final Ui ui;
    private final Cache cache;
    private final ComponentRegistry registry;
    private final ClientTracker tracker = new ClientTracker();
    private volatile CancellationToken cancellation = new CancellationToken();

    public Environment(EnvironmentConfig config) {
        this.ui = config.getUi();
        this.cache = config.getCache();
        this.registry = config.getRegistry();
    }

    /**
     * Runs the command named by the first non-flag argument.
     *
     * @return the command's exit code; 1 for usage errors or when the command throws
     */
    public int cli(List<String> args, CancellationToken token) {
        this.cancellation = token;
        CancellationToken.Registration registration = token.onCancel(tracker::cancel);
        try {
            return dispatch(args);
        } catch (RuntimeException e) {
            log.debug("Command failed", e);
            ui.error(e.getMessage() != null ? e.getMessage() : e.toString());
            return 1;
        } finally {
            registration.close();
            tracker.cleanup();
        }
    }

    private int dispatch(List<String> args) {
        boolean help = false;
        boolean version = false;
        int i = 0;
        for (; i < args.size() && args.get(i).startsWith("-"); i++) {
            switch (args.get(i)) {
                case "-h", "--help" -> help = true;
                case "-v", "--version" -> version = true;
                default -> {
                    ui.error("Unknown flag: " + args.get(i) + "\n\n" + usage());
                    return 1;
                }
            }
        }
        if (version) {
            return command(VERSION_COMMAND).run(this, List.of());
        }
        if (i == args.size()) {
            if (help) {
                ui.say(usage());
                return 0;
            }
            ui.error(usage());
            return 1;
        }
        String name = args.get(i);
        if (registry.resolve(ComponentKind.COMMAND, name).isEmpty()) {
            ui.error("Unknown command: " + name + "\n\n" + usage());
            return 1;
        }
        Command command = command(name);
        if (help) {
            ui.say(command.help());
            return 0;
        }
        log.debug("Running command {} with args {}", name, args.subList(i + 1, args.size()));
        return command.run(this, List.copyOf(args.subList(i + 1, args.size())));
    }

    /** Usage text listing commands; never starts a plugin. */
    public String usage() {
        StringBuilder sb = new StringBuilder("Usage: kiln [--version] [--help] <command> [<args>]\n\n");
        sb.append("Available commands are:\n");
        List<ComponentDescriptor> commands = registry.descriptors(ComponentKind.COMMAND);
        int width = commands.stream().mapToInt(d -> d.name().length()).max().orElse(0);
        for (ComponentDescriptor d : commands) {
            String synopsis;
            if (d.isBuiltin()) {
                synopsis = ((Command) d.factory().get()).synopsis();
                if (synopsis == null || synopsis.isBlank()) {
                    continue;
                }
            } else {
                synopsis = "(plugin)";
            }
            sb.append("    ").append(String.format("%-" + width + "s", d.name())).append("    ")
                    .append(synopsis).append('\n');
        }
        return sb.toString();
    }

    @Override
    public Ui ui() {
        return ui;
    }

    @Override
    public Cache cache() {
        return cache;
    }

    @Override
    public ComponentLoader components() {
        return this;
    }

    public ComponentRegistry registry() {
        return registry;
    }

    /** Token of the command line being run. */
    public CancellationToken cancellation() {
        return cancellation;
    }

    public ClientTracker tracker() {
        return tracker;
    }

    @Override
    public Builder builder(String name) {
        return registry.load(Builder.class, ComponentKind.BUILDER, name, tracker);
    }

    @Override
    public Provisioner provisioner(String name) {
        return registry.load(Provisioner.class, ComponentKind.PROVISIONER, name, tracker);
    }

    @Override
    public PostProcessor postProcessor(String name) {
        return registry.load(PostProcessor.class, ComponentKind.POST_PROCESSOR, name, tracker);
    }

    @Override
    public Hook hook(String name) {
        return registry.load(Hook.class, ComponentKind.HOOK, name, tracker);
    }

    @Override
    public Command command(String name) {
        return registry.load(Command.class, ComponentKind.COMMAND, name, tracker);
    }

    /** Kills every plugin still running. */
    @Override
    public void close() {
        tracker.cleanup();
    }
}
