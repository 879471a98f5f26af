package com.kiln.component;

import java.util.List;
import java.util.Objects;

/**
 * Result of a build: which builder made it, an id (e.g. image id) and the files that make it up.
 * Artifacts are values and cross the plugin boundary by copy.
 *
 * @param builderId   id of the builder that produced the artifact (e.g. {@code kiln.null})
 * @param id          artifact id; may be empty
 * @param files       files that make up the artifact
 * @param description human-readable description
 */
public record Artifact(String builderId, String id, List<String> files, String description) {

    public Artifact {
        Objects.requireNonNull(builderId, "builderId");
        id = id != null ? id : "";
        files = files != null ? List.copyOf(files) : List.of();
        description = description != null ? description : "";
    }

    @Override
    public String toString() {
        return description.isEmpty() ? builderId + ":" + id : description;
    }
}
