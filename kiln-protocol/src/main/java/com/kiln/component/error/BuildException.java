package com.kiln.component.error;

/**
 * A component deliberately reports that its own work failed (a provisioning script exited non-zero,
 * an image could not be created...).
 */
public final class BuildException extends KilnException {

    public BuildException(String message) {
        super(message);
    }

    public BuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
