package com.kiln.component;

import java.util.Objects;

/**
 * Output of a {@link PostProcessor}.
 *
 * @param artifact     the new artifact
 * @param keepOriginal whether the input artifact should be kept
 */
public record PostProcessResult(Artifact artifact, boolean keepOriginal) {

    public PostProcessResult {
        Objects.requireNonNull(artifact, "artifact");
    }
}
