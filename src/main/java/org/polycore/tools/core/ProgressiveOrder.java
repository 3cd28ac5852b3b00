package org.polycore.tools.core;

/**
 * Order in which voting samples are admitted by the progressive core tracker.
 * An included reference is always admitted first.
 */
public enum ProgressiveOrder {
    /** Samples in input order. */
    INPUT,
    /** Most complete samples first (descending genome-wide genome fraction), input order on ties. */
    MISSINGNESS
}
