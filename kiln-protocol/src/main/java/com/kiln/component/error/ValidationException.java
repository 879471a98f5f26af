package com.kiln.component.error;

import java.util.List;
import java.util.Objects;

/**
 * Structural problems not specific to one component (e.g. a build description listing the same
 * build name twice), or the combined configuration problems of several components.
 */
public final class ValidationException extends MultiErrorException {

    public ValidationException(List<String> errors) {
        super(errors);
    }

    public ValidationException(String singleError) {
        super(List.of(Objects.requireNonNull(singleError, "singleError")));
    }
}
