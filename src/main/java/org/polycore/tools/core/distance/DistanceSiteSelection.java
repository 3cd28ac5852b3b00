package org.polycore.tools.core.distance;

/**
 * Which classified sites the pairwise distances are computed over.
 */
public enum DistanceSiteSelection {
    /** Core invariant and core variant sites. */
    CORE,
    /** Core variant sites only. */
    VARIANT
}
