package com.kiln.component.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Error that carries several independent problems, so the user sees all of them in one report.
 */
public abstract class MultiErrorException extends KilnException {

    private final List<String> errors;

    protected MultiErrorException(List<String> errors) {
        super(format(errors));
        this.errors = errors != null ? Collections.unmodifiableList(new ArrayList<>(errors)) : List.of();
    }

    /** Individual problems, in the order they were found; never null. */
    public List<String> getErrors() {
        return errors;
    }

    static String format(List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            return "0 errors occurred";
        }
        if (errors.size() == 1) {
            return errors.get(0);
        }
        StringBuilder sb = new StringBuilder();
        sb.append(errors.size()).append(" errors occurred:");
        for (String e : errors) {
            sb.append("\n* ").append(e);
        }
        return sb.toString();
    }
}
