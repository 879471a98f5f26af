package com.kiln.rpc.remote;

import com.kiln.cache.Cache;
import com.kiln.component.CommandContext;
import com.kiln.component.ComponentLoader;
import com.kiln.ui.Ui;

/** Command context seen by a command served from a plugin. */
public record RemoteCommandContext(Ui ui, Cache cache, ComponentLoader components) implements CommandContext {
}
