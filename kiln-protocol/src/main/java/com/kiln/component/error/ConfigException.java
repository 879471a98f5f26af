package com.kiln.component.error;

import java.util.List;
import java.util.Objects;

/**
 * Malformed or missing configuration, found while preparing a component. Holds one entry per
 * problem.
 */
public final class ConfigException extends MultiErrorException {

    public ConfigException(List<String> errors) {
        super(errors);
    }

    public ConfigException(String singleError) {
        super(List.of(Objects.requireNonNull(singleError, "singleError")));
    }
}
