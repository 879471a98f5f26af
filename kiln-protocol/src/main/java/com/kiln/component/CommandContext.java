package com.kiln.component;

import com.kiln.cache.Cache;
import com.kiln.ui.Ui;

/**
 * What a {@link Command} gets from the environment that runs it.
 */
public interface CommandContext {

    Ui ui();

    Cache cache();

    /** Loader for builders, provisioners and the other component kinds. */
    ComponentLoader components();
}
