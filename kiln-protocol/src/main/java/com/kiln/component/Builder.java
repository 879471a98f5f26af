package com.kiln.component;

import com.kiln.cache.Cache;
import com.kiln.ui.Ui;

import java.util.List;

/**
 * Produces an {@link Artifact} (typically a machine image). A builder is prepared once with its
 * raw configuration, then run once. Implementations may live in-process or in a plugin subprocess;
 * callers cannot tell the difference.
 */
public interface Builder {

    /**
     * Validates and stores configuration. Several raw bundles may be given; later ones override
     * earlier ones key by key.
     *
     * @param raws raw configuration bundles, never null
     * @return warnings to show the user; never null
     * @throws com.kiln.component.error.ConfigException with every problem found, not just the first
     */
    List<String> prepare(List<ConfigBundle> raws);

    /**
     * Runs the build. The builder calls {@code hook} with {@link Hook#PROVISION} once the machine is
     * ready for provisioning.
     *
     * @return the artifact, or null if the build produced nothing
     * @throws com.kiln.component.error.BuildException when the build fails
     */
    Artifact run(Ui ui, Hook hook, Cache cache);

    /** Cancels a running build. Safe to call from another thread while {@link #run} is in progress. */
    void cancel();
}
