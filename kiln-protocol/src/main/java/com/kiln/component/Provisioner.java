package com.kiln.component;

import com.kiln.ui.Ui;

import java.util.List;

/**
 * Installs and configures software on a machine a builder has brought up.
 */
public interface Provisioner {

    /**
     * Validates and stores configuration.
     *
     * @throws com.kiln.component.error.ConfigException with every problem found
     */
    void prepare(List<ConfigBundle> raws);

    /**
     * Runs the provisioning step.
     *
     * @throws com.kiln.component.error.BuildException when provisioning fails
     */
    void provision(Ui ui);

    /** Cancels a running {@link #provision}. */
    void cancel();
}
