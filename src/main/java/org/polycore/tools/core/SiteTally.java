package org.polycore.tools.core;

import org.polycore.utils.Nucleotide;
import org.polycore.utils.Utils;

import java.util.Arrays;

/**
 * Running per-column counts over the samples seen so far. Immutable: {@link #update} returns a new tally, so the
 * same transition serves the from-scratch classification of a column and the incremental progressive tracking.
 *
 * <p>Allele counts only include called samples; missing copies only count toward the expected copies.</p>
 */
public final class SiteTally {

    public static final SiteTally EMPTY = new SiteTally(0, 0, 0, 0, 0,
            new int[Nucleotide.NUMBER_OF_ALLELES], new int[Nucleotide.NUMBER_OF_ALLELES]);

    private final int samples;
    private final int calledSamples;
    private final long expectedCopies;
    private final long nonMissingCopies;
    private final long calledCopies;
    private final int[] alleleCopies;
    private final int[] alleleSamples;

    private SiteTally(final int samples, final int calledSamples, final long expectedCopies, final long nonMissingCopies,
                      final long calledCopies, final int[] alleleCopies, final int[] alleleSamples) {
        this.samples = samples;
        this.calledSamples = calledSamples;
        this.expectedCopies = expectedCopies;
        this.nonMissingCopies = nonMissingCopies;
        this.calledCopies = calledCopies;
        this.alleleCopies = alleleCopies;
        this.alleleSamples = alleleSamples;
    }

    /**
     * The tally after one more sample has been observed at the column.
     */
    public static SiteTally update(final SiteTally tally, final SiteObservation observation) {
        Utils.nonNull(tally);
        Utils.nonNull(observation);
        final int[] copies = tally.alleleCopies.clone();
        final int[] carriers = tally.alleleSamples.clone();
        long called = tally.calledCopies;
        if (observation.isCalled()) {
            for (int rank = 0; rank < Nucleotide.NUMBER_OF_ALLELES; rank++) {
                final int count = observation.getAlleleCopies(rank);
                copies[rank] += count;
                if (count > 0) {
                    carriers[rank]++;
                }
            }
            called += observation.getNonMissingCopies();
        }
        return new SiteTally(tally.samples + 1,
                tally.calledSamples + (observation.isCalled() ? 1 : 0),
                tally.expectedCopies + observation.getPloidy(),
                tally.nonMissingCopies + observation.getNonMissingCopies(),
                called, copies, carriers);
    }

    public int getSamples() {
        return samples;
    }

    public int getCalledSamples() {
        return calledSamples;
    }

    public int getUncalledSamples() {
        return samples - calledSamples;
    }

    public long getExpectedCopies() {
        return expectedCopies;
    }

    public long getNonMissingCopies() {
        return nonMissingCopies;
    }

    /**
     * Non-missing copies of the called samples.
     */
    public long getCalledCopies() {
        return calledCopies;
    }

    public int getAlleleCopies(final int rank) {
        return alleleCopies[rank];
    }

    /**
     * Called samples carrying at least one copy of the allele.
     */
    public int getAlleleSamples(final int rank) {
        return alleleSamples[rank];
    }

    public int[] getAlleleCopyCounts() {
        return alleleCopies.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final SiteTally other = (SiteTally) o;
        return samples == other.samples && calledSamples == other.calledSamples
                && expectedCopies == other.expectedCopies && nonMissingCopies == other.nonMissingCopies
                && calledCopies == other.calledCopies
                && Arrays.equals(alleleCopies, other.alleleCopies) && Arrays.equals(alleleSamples, other.alleleSamples);
    }

    @Override
    public int hashCode() {
        int result = 31 * samples + calledSamples;
        result = 31 * result + Long.hashCode(nonMissingCopies);
        result = 31 * result + Arrays.hashCode(alleleCopies);
        return result;
    }

    @Override
    public String toString() {
        return String.format("SiteTally{samples=%d, called=%d, copies=%s}", samples, calledSamples, Arrays.toString(alleleCopies));
    }
}
