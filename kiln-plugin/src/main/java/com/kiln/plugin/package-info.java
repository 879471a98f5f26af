/**
 * Plugin processes: discovery of {@code kiln-<kind>-<name>} executables, the host-side
 * {@link com.kiln.plugin.PluginClient} and {@link com.kiln.plugin.ClientTracker}, the
 * {@link com.kiln.plugin.ComponentRegistry} that chooses between built-ins and plugins, and the
 * plugin-side {@link com.kiln.plugin.PluginServer}.
 */
package com.kiln.plugin;
