package org.polycore.tools.core;

/**
 * Per-sample outcome of a core genome run, one for every loaded genome including the reference.
 */
public final class SampleSummary {

    public enum Status {
        /** The sample voted on core sites. */
        PASS,
        /** The genome-wide genome fraction is below min-gf; the sample was left out of every site. */
        LOW_GENOME_FRACTION,
        /** The reference, when it does not vote. */
        REFERENCE
    }

    private final String id;
    private final Ploidy ploidy;
    private final int length;
    private final long missing;
    private final double genomeFraction;
    private final double coreFraction;
    private final int calledSites;
    private final int variantSites;
    private final Status status;
    private final int[] groupIds;

    public SampleSummary(final String id, final Ploidy ploidy, final int length, final long missing,
                         final double genomeFraction, final double coreFraction, final int calledSites,
                         final int variantSites, final Status status, final int[] groupIds) {
        this.id = id;
        this.ploidy = ploidy;
        this.length = length;
        this.missing = missing;
        this.genomeFraction = genomeFraction;
        this.coreFraction = coreFraction;
        this.calledSites = calledSites;
        this.variantSites = variantSites;
        this.status = status;
        this.groupIds = groupIds.clone();
    }

    public String getId() {
        return id;
    }

    public Ploidy getPloidy() {
        return ploidy;
    }

    public int getLength() {
        return length;
    }

    /**
     * Number of (copy, column) cells without a callable base.
     */
    public long getMissing() {
        return missing;
    }

    public double getGenomeFraction() {
        return genomeFraction;
    }

    /**
     * Core fraction when the sample was admitted to the trajectory in progressive mode, the final core fraction
     * otherwise; {@code NaN} for a sample that does not vote.
     */
    public double getCoreFraction() {
        return coreFraction;
    }

    /**
     * Core sites at which the sample is called.
     */
    public int getCalledSites() {
        return calledSites;
    }

    /**
     * Variant sites at which the sample is called and carries a non-REF allele.
     */
    public int getVariantSites() {
        return variantSites;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * Sequence group of each allele copy, in copy order.
     */
    public int[] getGroupIds() {
        return groupIds.clone();
    }

    @Override
    public String toString() {
        return String.format("SampleSummary{%s, ploidy=%s, gf=%.4f, status=%s}", id, ploidy, genomeFraction, status);
    }
}
