package org.polycore.tools.core;

import org.polycore.utils.Nucleotide;

/**
 * What one sample contributes to one column: its ploidy, how many of its copies carry each allele and whether
 * it is called there.
 */
public final class SiteObservation {
    private final int ploidy;
    private final int[] alleleCopies;
    private final int nonMissingCopies;
    private final boolean called;

    private SiteObservation(final int ploidy, final int[] alleleCopies, final int nonMissingCopies, final boolean called) {
        this.ploidy = ploidy;
        this.alleleCopies = alleleCopies;
        this.nonMissingCopies = nonMissingCopies;
        this.called = called;
    }

    /**
     * @param copyRanks allele rank of each copy of the sample at the column, -1 for a missing copy
     * @param ploidy number of entries of {@code copyRanks} to read
     */
    public static SiteObservation fromCopyRanks(final int[] copyRanks, final int ploidy, final CoreThresholds thresholds) {
        final int[] counts = new int[Nucleotide.NUMBER_OF_ALLELES];
        int nonMissing = 0;
        for (int copy = 0; copy < ploidy; copy++) {
            final int rank = copyRanks[copy];
            if (rank >= 0) {
                counts[rank]++;
                nonMissing++;
            }
        }
        return new SiteObservation(ploidy, counts, nonMissing, thresholds.isCalled(nonMissing, ploidy));
    }

    /**
     * Observation of a sample taken from per-group ranks, as filled by {@link CollapsedAlignment#fillGroupRanks}.
     */
    public static SiteObservation fromGroupRanks(final int[] copyGroups, final int[] groupRanks, final CoreThresholds thresholds) {
        final int[] counts = new int[Nucleotide.NUMBER_OF_ALLELES];
        int nonMissing = 0;
        for (final int group : copyGroups) {
            final int rank = groupRanks[group];
            if (rank >= 0) {
                counts[rank]++;
                nonMissing++;
            }
        }
        return new SiteObservation(copyGroups.length, counts, nonMissing, thresholds.isCalled(nonMissing, copyGroups.length));
    }

    public int getPloidy() {
        return ploidy;
    }

    public int getAlleleCopies(final int rank) {
        return alleleCopies[rank];
    }

    public int getNonMissingCopies() {
        return nonMissingCopies;
    }

    public boolean isCalled() {
        return called;
    }
}
