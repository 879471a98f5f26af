/**
 * Capability contracts shared by the host and by plugins.
 * <ul>
 *   <li>{@link com.kiln.component.ComponentKind} – BUILDER, PROVISIONER, POST_PROCESSOR, HOOK, COMMAND</li>
 *   <li>{@link com.kiln.component.Builder}, {@link com.kiln.component.Provisioner},
 *       {@link com.kiln.component.PostProcessor}, {@link com.kiln.component.Hook},
 *       {@link com.kiln.component.Command} – one interface per kind</li>
 *   <li>{@link com.kiln.component.ConfigBundle} – loosely typed configuration exchanged with plugins</li>
 *   <li>{@link com.kiln.component.ComponentLoader} – name → implementation, in-process or plugin-backed</li>
 * </ul>
 */
package com.kiln.component;
