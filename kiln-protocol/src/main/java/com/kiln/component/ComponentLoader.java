package com.kiln.component;

/**
 * Resolves component names to live implementations. Each call returns a fresh instance; an
 * implementation may be in-process or backed by a plugin subprocess.
 * <p>
 * Every method throws {@link com.kiln.component.error.ComponentNotFoundException} for an unknown
 * name and {@link com.kiln.component.error.PluginLaunchException} when a plugin cannot be started.
 */
public interface ComponentLoader {

    Builder builder(String name);

    Provisioner provisioner(String name);

    PostProcessor postProcessor(String name);

    Hook hook(String name);

    Command command(String name);
}
