package com.kiln.component;

import com.kiln.ui.Ui;

import java.util.List;

/**
 * Takes the artifact of a build and turns it into another artifact (compress, upload, checksum...).
 */
public interface PostProcessor {

    /**
     * Validates and stores configuration.
     *
     * @throws com.kiln.component.error.ConfigException with every problem found
     */
    void configure(List<ConfigBundle> raws);

    /**
     * Processes the artifact.
     *
     * @throws com.kiln.component.error.BuildException when processing fails
     */
    PostProcessResult postProcess(Ui ui, Artifact artifact);
}
