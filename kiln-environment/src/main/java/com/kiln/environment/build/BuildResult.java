package com.kiln.environment.build;

import com.kiln.component.Artifact;

import java.util.List;

/**
 * @param error failure message, null when the build succeeded
 */
public record BuildResult(String name, List<Artifact> artifacts, String error) {

    public BuildResult {
        artifacts = artifacts != null ? List.copyOf(artifacts) : List.of();
    }

    public boolean succeeded() {
        return error == null;
    }
}
