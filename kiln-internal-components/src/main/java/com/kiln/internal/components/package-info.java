/**
 * Builders, provisioners, post-processors, hooks and commands that ship with Kiln.
 */
package com.kiln.internal.components;
