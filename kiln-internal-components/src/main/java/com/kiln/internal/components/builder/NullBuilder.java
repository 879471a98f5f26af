package com.kiln.internal.components.builder;

import com.kiln.cache.Cache;
import com.kiln.component.Artifact;
import com.kiln.component.Builder;
import com.kiln.component.ConfigBundle;
import com.kiln.component.Hook;
import com.kiln.component.error.BuildException;
import com.kiln.config.ConfigDecoder;
import com.kiln.ui.Ui;

import java.util.List;

/**
 * Builds nothing: runs the provision hook and returns an artifact made from its configuration.
 * Useful for exercising provisioners and post-processors.
 */
public final class NullBuilder implements Builder {

    public static final String BUILDER_ID = "kiln.null";

    private String artifactId;
    private List<String> files = List.of();
    private volatile boolean cancelled;

    @Override
    public List<String> prepare(List<ConfigBundle> raws) {
        ConfigDecoder d = ConfigDecoder.of(raws);
        artifactId = d.requireString("artifact_id");
        files = d.optionalStringList("files", List.of());
        d.rejectUnknownKeys();
        d.validate();
        return List.of();
    }

    @Override
    public Artifact run(Ui ui, Hook hook, Cache cache) {
        ui.say("Running null builder for " + artifactId);
        hook.run(Hook.PROVISION, ui, ConfigBundle.empty());
        if (cancelled) {
            throw new BuildException("Build was cancelled");
        }
        return new Artifact(BUILDER_ID, artifactId, files, "Null artifact " + artifactId);
    }

    @Override
    public void cancel() {
        cancelled = true;
    }
}
