package com.kiln.component.error;

import java.util.OptionalInt;

/**
 * A call to (or from) a plugin failed in transport, not in business logic: the connection dropped,
 * a frame could not be decoded, or the subprocess died. Business failures reported by the remote
 * component arrive as {@link BuildException}, {@link ConfigException} and so on instead.
 */
public final class PluginCommunicationException extends KilnException {

    /** Category of transport failure. */
    public enum Reason {
        /** Connection dropped or I/O failed mid-call. */
        TRANSPORT,
        /** Malformed or unexpected frame. */
        PROTOCOL,
        /** The plugin subprocess is gone; see {@link #getExitStatus()}. */
        PROCESS_EXITED,
        /** The client was closed or never connected. */
        CLOSED
    }

    private final Reason reason;
    private final String capability;
    private final String method;
    private final Integer exitStatus;
    private final String detail;

    public PluginCommunicationException(Reason reason, String capability, String method,
                                        Integer exitStatus, String message, Throwable cause) {
        super(describe(reason, capability, method, exitStatus, message), cause);
        this.reason = reason;
        this.capability = capability;
        this.method = method;
        this.exitStatus = exitStatus;
        this.detail = message;
    }

    public PluginCommunicationException(Reason reason, String capability, String method, String message) {
        this(reason, capability, method, null, message, null);
    }

    private static String describe(Reason reason, String capability, String method,
                                   Integer exitStatus, String message) {
        StringBuilder sb = new StringBuilder("Plugin communication failed (").append(reason).append(')');
        if (capability != null) {
            sb.append(" calling ").append(capability);
            if (method != null) {
                sb.append('.').append(method);
            }
        }
        if (exitStatus != null) {
            sb.append(", plugin exit status ").append(exitStatus);
        }
        if (message != null && !message.isBlank()) {
            sb.append(": ").append(message);
        }
        return sb.toString();
    }

    public Reason getReason() {
        return reason;
    }

    /** Capability being called (e.g. {@code Builder}); may be null. */
    public String getCapability() {
        return capability;
    }

    /** Method being called (e.g. {@code run}); may be null. */
    public String getMethod() {
        return method;
    }

    /** Exit status of the plugin subprocess, when it is known to have exited. */
    public OptionalInt getExitStatus() {
        return exitStatus != null ? OptionalInt.of(exitStatus) : OptionalInt.empty();
    }

    /** Copy of this exception with capability/method/exit status filled in where missing. */
    public PluginCommunicationException withContext(String capability, String method, Integer exitStatus) {
        Reason r = exitStatus != null && this.exitStatus == null ? Reason.PROCESS_EXITED : reason;
        return new PluginCommunicationException(r,
                this.capability != null ? this.capability : capability,
                this.method != null ? this.method : method,
                this.exitStatus != null ? this.exitStatus : exitStatus,
                detail, getCause());
    }
}
