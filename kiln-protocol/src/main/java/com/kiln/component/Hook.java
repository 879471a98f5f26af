package com.kiln.component;

import com.kiln.ui.Ui;

/**
 * Named extension point a builder calls during its run. The host answers hook calls made by
 * builders, including builders running in plugin subprocesses.
 */
public interface Hook {

    /** Hook run by builders once the machine is ready to be provisioned. */
    String PROVISION = "kiln_provision";

    /**
     * Runs the hook.
     *
     * @param name hook name (e.g. {@link #PROVISION})
     * @param ui   UI of the calling build
     * @param data hook-specific data; may be empty, never null
     */
    void run(String name, Ui ui, ConfigBundle data);

    /** Cancels a running {@link #run}. */
    void cancel();
}
