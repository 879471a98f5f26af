package com.kiln.component.error;

/**
 * A plugin subprocess could not be started or the handshake with it failed. No subprocess is left
 * running when this is thrown.
 */
public final class PluginLaunchException extends KilnException {

    /** Why the launch failed. */
    public enum Reason {
        /** Executable missing, not executable, or the OS refused to spawn it. */
        NOT_FOUND,
        /** No handshake line within the timeout. */
        TIMEOUT,
        /** Handshake line malformed, version mismatch, or the process exited before handshaking. */
        PROTOCOL,
        /** Announced address could not be dialed. */
        CONNECT,
        /** Launches are no longer accepted because the run is being cancelled. */
        CANCELLED
    }

    private final Reason reason;
    private final String plugin;

    public PluginLaunchException(Reason reason, String plugin, String message) {
        this(reason, plugin, message, null);
    }

    public PluginLaunchException(Reason reason, String plugin, String message, Throwable cause) {
        super("Plugin " + plugin + " failed to launch (" + reason + "): " + message, cause);
        this.reason = reason;
        this.plugin = plugin;
    }

    public Reason getReason() {
        return reason;
    }

    /** Plugin executable path or name. */
    public String getPlugin() {
        return plugin;
    }
}
