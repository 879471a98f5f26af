package com.kiln.internal.components;

import com.kiln.internal.components.command.PluginCommand;

import java.util.Arrays;

/**
 * Serves one built-in component as a plugin: {@code PluginMain <kind> <name>}. Lets a plugin
 * executable be a thin wrapper around the Kiln jar.
 */
public final class PluginMain {

    private PluginMain() {
    }

    public static void main(String[] args) {
        System.exit(PluginCommand.serve(Arrays.asList(args), System.err));
    }
}
