package com.kiln.internal.components.command;

import com.kiln.component.Command;
import com.kiln.component.CommandContext;
import com.kiln.component.ComponentKind;
import com.kiln.internal.components.InternalComponents;
import com.kiln.plugin.PluginDiscovery;
import com.kiln.plugin.PluginServer;

import java.io.PrintStream;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Hidden command serving a built-in component over the plugin protocol. Not listed in the
 * usage text; it only works when launched by a Kiln host.
 */
public final class PluginCommand implements Command {

    private static final String USAGE = "Usage: kiln plugin <kind> <name>\n       kiln plugin kiln-<kind>-<name>";

    @Override
    public int run(CommandContext context, List<String> args) {
        return serve(args, System.err);
    }

    /**
     * Parses {@code <kind> <name>} or an executable name ({@code kiln-builder-null}) and serves
     * the matching built-in; returns the exit code.
     */
    public static int serve(List<String> args, PrintStream err) {
        String kindName;
        String name;
        if (args.size() == 2) {
            kindName = args.get(0);
            name = args.get(1);
        } else if (args.size() == 1 && args.get(0).startsWith(PluginDiscovery.EXECUTABLE_PREFIX)) {
            String rest = args.get(0).substring(PluginDiscovery.EXECUTABLE_PREFIX.length());
            Optional<ComponentKind> matched = kindPrefix(rest);
            if (matched.isEmpty()) {
                err.println("Not a plugin executable name: " + args.get(0));
                return 1;
            }
            kindName = matched.get().wireName();
            name = rest.substring(kindName.length() + 1);
        } else {
            err.println(USAGE);
            return 1;
        }
        ComponentKind kind;
        try {
            kind = ComponentKind.fromWireName(kindName);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return 1;
        }
        Optional<Supplier<?>> factory = InternalComponents.lookup(kind, name);
        if (factory.isEmpty()) {
            err.println("No built-in " + kind + " named '" + name + "'");
            return 1;
        }
        return PluginServer.serve(kind, factory.get());
    }

    static Optional<ComponentKind> kindPrefix(String kindAndName) {
        for (ComponentKind kind : ComponentKind.values()) {
            String prefix = kind.wireName() + "-";
            if (kindAndName.startsWith(prefix) && kindAndName.length() > prefix.length()) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @Override
    public String help() {
        return USAGE + "\n\n  Serves a built-in component as a plugin.";
    }

    @Override
    public String synopsis() {
        return "";
    }
}
