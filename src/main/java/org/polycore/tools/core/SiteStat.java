package org.polycore.tools.core;

import org.polycore.utils.Nucleotide;

import java.util.Collections;
import java.util.List;

/**
 * Statistics and classification of one alignment column. Immutable.
 */
public final class SiteStat {
    private final int column;
    private final byte referenceSymbol;
    private final Nucleotide ref;
    private final double genomeFraction;
    private final int calledSamples;
    private final int votingSamples;
    private final double coreFraction;
    private final Nucleotide alternate;
    private final int alternateCopies;
    private final double alternateFraction;
    private final int alternateSamples;
    private final List<Nucleotide> alternates;
    private final int[] alleleCopies;
    private final long calledCopies;
    private final SiteClass siteClass;

    SiteStat(final int column, final byte referenceSymbol, final Nucleotide ref, final double genomeFraction,
             final int calledSamples, final int votingSamples, final double coreFraction,
             final Nucleotide alternate, final int alternateCopies, final double alternateFraction,
             final int alternateSamples, final List<Nucleotide> alternates, final int[] alleleCopies,
             final long calledCopies, final SiteClass siteClass) {
        this.column = column;
        this.referenceSymbol = referenceSymbol;
        this.ref = ref;
        this.genomeFraction = genomeFraction;
        this.calledSamples = calledSamples;
        this.votingSamples = votingSamples;
        this.coreFraction = coreFraction;
        this.alternate = alternate;
        this.alternateCopies = alternateCopies;
        this.alternateFraction = alternateFraction;
        this.alternateSamples = alternateSamples;
        this.alternates = Collections.unmodifiableList(alternates);
        this.alleleCopies = alleleCopies;
        this.calledCopies = calledCopies;
        this.siteClass = siteClass;
    }

    /**
     * 0-based alignment column.
     */
    public int getColumn() {
        return column;
    }

    /**
     * Symbol of the reference at this column, as loaded.
     */
    public byte getReferenceSymbol() {
        return referenceSymbol;
    }

    /**
     * The REF allele: the reference base when it is a standard base, otherwise the most frequent called allele
     * (lowest rank on ties), or {@link Nucleotide#N} when nothing is called.
     */
    public Nucleotide getRef() {
        return ref;
    }

    public double getGenomeFraction() {
        return genomeFraction;
    }

    public int getCalledSamples() {
        return calledSamples;
    }

    public int getVotingSamples() {
        return votingSamples;
    }

    public double getCoreFraction() {
        return coreFraction;
    }

    /**
     * The most frequent alternate allele, lowest rank on ties, or {@code null} if there is none.
     */
    public Nucleotide getAlternate() {
        return alternate;
    }

    public int getAlternateCopies() {
        return alternateCopies;
    }

    public double getAlternateFraction() {
        return alternateFraction;
    }

    public int getAlternateSamples() {
        return alternateSamples;
    }

    /**
     * Every called allele other than REF, in rank order.
     */
    public List<Nucleotide> getAlternates() {
        return alternates;
    }

    public int getAlleleCopies(final Nucleotide allele) {
        return alleleCopies[Nucleotide.STANDARD_BASES.indexOf(allele)];
    }

    /**
     * Non-missing copies of the called samples.
     */
    public long getCalledCopies() {
        return calledCopies;
    }

    public SiteClass getSiteClass() {
        return siteClass;
    }

    public boolean isCore() {
        return siteClass.isCore();
    }

    public boolean isVariant() {
        return siteClass == SiteClass.CORE_VARIANT;
    }

    @Override
    public String toString() {
        return String.format("SiteStat{column=%d, ref=%s, alt=%s, cf=%.4f, class=%s}",
                column, ref, alternate, coreFraction, siteClass);
    }
}
