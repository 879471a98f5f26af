package com.kiln.plugin;

/**
 * Lifecycle of a {@link PluginClient}. Transitions only move forward; {@link #EXITED} is final.
 */
public enum PluginState {
    CREATED,
    STARTING,
    CONNECTED,
    /** At least one capability proxy has been handed out. */
    IN_USE,
    CLOSING,
    EXITED;

    public boolean isConnected() {
        return this == CONNECTED || this == IN_USE;
    }
}
