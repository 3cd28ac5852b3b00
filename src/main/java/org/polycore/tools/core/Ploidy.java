package org.polycore.tools.core;

import org.polycore.utils.param.ParamUtils;

/**
 * Number of allele copies carried by a sample, together with where that number came from.
 */
public final class Ploidy {

    /**
     * Provenance of a ploidy value.
     */
    public enum Source {
        /** Inferred from the copy count or the largest ambiguity code of the input. */
        DETECTED,
        /** Given explicitly on the command line and validated against the input. */
        OVERRIDE,
        /** Fixed by construction, as for the haploid reference. */
        FIXED
    }

    /** Allele counts per sample are kept in a byte during the distance computation. */
    public static final int MAX_PLOIDY = Byte.MAX_VALUE;

    private final int value;
    private final Source source;

    private Ploidy(final int value, final Source source) {
        this.value = ParamUtils.inRange(value, 1, MAX_PLOIDY, "ploidy must be between 1 and " + MAX_PLOIDY + " but was " + value);
        this.source = source;
    }

    public static Ploidy detected(final int value) {
        return new Ploidy(value, Source.DETECTED);
    }

    public static Ploidy override(final int value) {
        return new Ploidy(value, Source.OVERRIDE);
    }

    public static Ploidy fixed(final int value) {
        return new Ploidy(value, Source.FIXED);
    }

    public int getValue() {
        return value;
    }

    public Source getSource() {
        return source;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Ploidy other = (Ploidy) o;
        return value == other.value && source == other.source;
    }

    @Override
    public int hashCode() {
        return 31 * value + source.hashCode();
    }

    @Override
    public String toString() {
        return value + " (" + source + ")";
    }
}
