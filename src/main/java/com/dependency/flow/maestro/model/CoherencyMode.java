package com.dependency.flow.maestro.model;

/**
 * How unresolved coherent-parent requirements are handled.
 * STRICT reports them as coherency errors, LEGACY leaves the dependency untouched silently.
 */
public enum CoherencyMode {
    STRICT,
    LEGACY
}
