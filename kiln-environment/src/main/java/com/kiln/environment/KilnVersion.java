package com.kiln.environment;

public final class KilnVersion {

    public static final String VERSION = "0.1.0";

    /** Empty for releases. */
    public static final String PRERELEASE = "dev";

    private KilnVersion() {
    }

    public static String formatted() {
        return PRERELEASE.isEmpty() ? VERSION : VERSION + "." + PRERELEASE;
    }
}
