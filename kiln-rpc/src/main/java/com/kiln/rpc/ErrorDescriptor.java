package com.kiln.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kiln.component.ComponentKind;
import com.kiln.component.error.BuildException;
import com.kiln.component.error.ComponentNotFoundException;
import com.kiln.component.error.ConfigException;
import com.kiln.component.error.PluginCommunicationException;
import com.kiln.component.error.ValidationException;

import java.util.List;

/**
 * Error reported by the remote side of a call, as data. Lets the caller rebuild the same exception
 * type the remote component threw, and keeps such business errors apart from transport failures.
 *
 * @param kind    one of the {@code KIND_*} constants
 * @param message human-readable message
 * @param details sub-errors for CONFIG and VALIDATION; kind and name for NOT_FOUND
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorDescriptor(String kind, String message, List<String> details) {

    public static final String KIND_CONFIG = "CONFIG";
    public static final String KIND_VALIDATION = "VALIDATION";
    public static final String KIND_BUILD = "BUILD";
    public static final String KIND_NOT_FOUND = "NOT_FOUND";
    public static final String KIND_UNSUPPORTED = "UNSUPPORTED";
    public static final String KIND_PROTOCOL = "PROTOCOL";
    public static final String KIND_INTERNAL = "INTERNAL";

    public ErrorDescriptor {
        kind = kind != null ? kind : KIND_INTERNAL;
        message = message != null ? message : "";
        details = details != null ? List.copyOf(details) : List.of();
    }

    public static ErrorDescriptor from(Throwable t) {
        if (t instanceof ConfigException ce) {
            return new ErrorDescriptor(KIND_CONFIG, ce.getMessage(), ce.getErrors());
        }
        if (t instanceof ValidationException ve) {
            return new ErrorDescriptor(KIND_VALIDATION, ve.getMessage(), ve.getErrors());
        }
        if (t instanceof BuildException) {
            return new ErrorDescriptor(KIND_BUILD, t.getMessage(), null);
        }
        if (t instanceof ComponentNotFoundException nf) {
            return new ErrorDescriptor(KIND_NOT_FOUND, nf.getMessage(),
                    List.of(nf.getKind().wireName(), nf.getName()));
        }
        if (t instanceof UnsupportedOperationException) {
            return new ErrorDescriptor(KIND_UNSUPPORTED, t.getMessage(), null);
        }
        String msg = t.getMessage() != null ? t.getMessage() : t.getClass().getName();
        return new ErrorDescriptor(KIND_INTERNAL, msg, null);
    }

    /** Exception matching {@link #kind()}; unknown kinds become {@link BuildException}. */
    public RuntimeException toException(String capability, String method) {
        switch (kind) {
            case KIND_CONFIG:
                return details.isEmpty() ? new ConfigException(message) : new ConfigException(details);
            case KIND_VALIDATION:
                return details.isEmpty() ? new ValidationException(message) : new ValidationException(details);
            case KIND_NOT_FOUND:
                if (details.size() == 2) {
                    try {
                        return new ComponentNotFoundException(ComponentKind.fromWireName(details.get(0)), details.get(1));
                    } catch (IllegalArgumentException ignored) {
                        return new BuildException(message);
                    }
                }
                return new BuildException(message);
            case KIND_UNSUPPORTED:
                return new UnsupportedOperationException(message);
            case KIND_PROTOCOL:
                return new PluginCommunicationException(PluginCommunicationException.Reason.PROTOCOL,
                        capability, method, message);
            default:
                return new BuildException(message);
        }
    }
}
