package com.kiln.internal.components.command;

import com.kiln.component.Command;
import com.kiln.component.CommandContext;
import com.kiln.component.error.ConfigException;
import com.kiln.component.error.ValidationException;
import com.kiln.environment.build.BuildRunner;
import com.kiln.environment.build.BuildTemplate;
import com.kiln.ui.Ui;

import java.nio.file.Path;
import java.util.List;

/**
 * {@code kiln validate <file>}: parses a build description and prepares every component
 * without running anything.
 */
public final class ValidateCommand implements Command {

    @Override
    public int run(CommandContext context, List<String> args) {
        Ui ui = context.ui();
        if (args.size() != 1 || args.get(0).startsWith("-")) {
            ui.error(help());
            return 1;
        }
        BuildRunner.Prepared prepared;
        try {
            BuildTemplate template = BuildTemplate.read(Path.of(args.get(0)));
            prepared = new BuildRunner(context.components(), 1).prepare(template);
        } catch (ConfigException | ValidationException e) {
            ui.error("Build description failed validation:\n" + e.getMessage());
            return 1;
        }
        for (String warning : prepared.warnings()) {
            ui.message("Warning: " + warning);
        }
        ui.say("Build description validated successfully.");
        return 0;
    }

    @Override
    public String help() {
        return "Usage: kiln validate <file>\n\n"
                + "  Checks that a build description is well formed and that every component\n"
                + "  accepts its configuration.";
    }

    @Override
    public String synopsis() {
        return "Checks a build description";
    }
}
