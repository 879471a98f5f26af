/**
 * The {@code kiln} executable.
 */
package com.kiln.cli;
