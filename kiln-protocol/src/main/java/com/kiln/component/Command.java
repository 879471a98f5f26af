package com.kiln.component;

import java.util.List;

/**
 * A CLI sub-command (e.g. {@code build}, {@code version}).
 */
public interface Command {

    /**
     * Runs the command.
     *
     * @param context UI, cache and component loading for this run
     * @param args    arguments after the command name
     * @return process exit code
     */
    int run(CommandContext context, List<String> args);

    /** Long help text. */
    String help();

    /** One-line description shown in the command list. */
    String synopsis();
}
