package com.kiln.internal.components.command;

import com.kiln.component.Command;
import com.kiln.component.CommandContext;
import com.kiln.environment.KilnVersion;

import java.util.List;

public final class VersionCommand implements Command {

    @Override
    public int run(CommandContext context, List<String> args) {
        context.ui().machine("version", KilnVersion.VERSION);
        context.ui().machine("version-prerelease", KilnVersion.PRERELEASE);
        context.ui().say("Kiln v" + KilnVersion.formatted());
        return 0;
    }

    @Override
    public String help() {
        return "Usage: kiln version\n\n  Prints the Kiln version.";
    }

    @Override
    public String synopsis() {
        return "Prints the Kiln version";
    }
}
