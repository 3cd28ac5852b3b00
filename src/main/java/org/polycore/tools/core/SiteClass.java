package org.polycore.tools.core;

/**
 * Classification of an alignment column.
 */
public enum SiteClass {
    /** Core site at which every called copy carries the REF allele, or whose alternate fails min-pf / min-pn. */
    CORE_INVARIANT,
    /** Core site with an alternate allele passing min-pf and min-pn. */
    CORE_VARIANT,
    /** Not core: too few called samples, or an ambiguous reference symbol. */
    EXCLUDED;

    public boolean isCore() {
        return this != EXCLUDED;
    }
}
