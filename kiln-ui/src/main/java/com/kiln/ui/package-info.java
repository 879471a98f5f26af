/**
 * UI sinks: {@link com.kiln.ui.BasicUi} for people, {@link com.kiln.ui.MachineReadableUi} for
 * scripts (one {@link com.kiln.ui.MachineReadableCodec} line per {@link com.kiln.ui.UiEvent}), and
 * {@link com.kiln.ui.TargetedUi} to attribute output to a build.
 */
package com.kiln.ui;
