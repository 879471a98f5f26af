package com.kiln.internal.components.command;

import com.kiln.component.Command;
import com.kiln.component.CommandContext;
import com.kiln.component.ComponentKind;
import com.kiln.environment.Environment;
import com.kiln.plugin.ComponentDescriptor;
import com.kiln.plugin.ComponentRegistry;
import com.kiln.ui.Ui;

import java.util.List;

/**
 * Lists resolvable components per kind, with where each comes from. Optionally limited to
 * one kind: {@code kiln plugins builder}.
 */
public final class PluginsCommand implements Command {

    @Override
    public int run(CommandContext context, List<String> args) {
        Ui ui = context.ui();
        if (!(context instanceof Environment env)) {
            ui.error("The plugins command needs a Kiln environment");
            return 1;
        }
        List<ComponentKind> kinds;
        if (args.isEmpty()) {
            kinds = List.of(ComponentKind.values());
        } else if (args.size() == 1) {
            try {
                kinds = List.of(ComponentKind.fromWireName(args.get(0)));
            } catch (IllegalArgumentException e) {
                ui.error(e.getMessage());
                return 1;
            }
        } else {
            ui.error(help());
            return 1;
        }
        ComponentRegistry registry = env.registry();
        for (ComponentKind kind : kinds) {
            List<ComponentDescriptor> descriptors = registry.descriptors(kind);
            ui.say(kind + "s:");
            if (descriptors.isEmpty()) {
                ui.message("(none)");
            }
            for (ComponentDescriptor d : descriptors) {
                ui.message(d.name() + "  " + d.source());
                ui.machine("plugin", kind.wireName(), d.name(), d.source());
            }
        }
        return 0;
    }

    @Override
    public String help() {
        return "Usage: kiln plugins [<kind>]\n\n"
                + "  Lists the builders, provisioners, post-processors, hooks and commands Kiln can load,\n"
                + "  and whether each is built in or a plugin executable.";
    }

    @Override
    public String synopsis() {
        return "Lists available components";
    }
}
