package com.kiln.component.error;

/**
 * Base of every error the core reports. Unchecked; callers that care about a specific failure
 * catch the subclass.
 */
public class KilnException extends RuntimeException {

    public KilnException(String message) {
        super(message);
    }

    public KilnException(String message, Throwable cause) {
        super(message, cause);
    }
}
