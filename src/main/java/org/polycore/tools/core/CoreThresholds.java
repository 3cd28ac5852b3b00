package org.polycore.tools.core;

import org.polycore.exceptions.UserException;

/**
 * The four thresholds of core site classification, validated on construction.
 *
 * <ul>
 *     <li>min-gf: fraction of a sample's copies that must be non-missing for the sample to be called,
 *     genome wide to take part in voting and per site to be counted as called there</li>
 *     <li>min-cf: fraction of voting samples that must be called at a site for it to be core</li>
 *     <li>min-pf: fraction of called copies that must carry the alternate allele for a variant site</li>
 *     <li>min-pn: number of called samples that must carry the alternate allele for a variant site</li>
 * </ul>
 *
 * Fractional comparisons are turned into integer ones here, so every component applies the same rule.
 */
public final class CoreThresholds {
    private static final double EPSILON = 1e-9;

    private final double minGenomeFraction;
    private final double minCoreFraction;
    private final double minAlleleFraction;
    private final int minAlleleSamples;

    public CoreThresholds(final double minGenomeFraction, final double minCoreFraction,
                          final double minAlleleFraction, final int minAlleleSamples) {
        this.minGenomeFraction = checkFraction("min-gf", minGenomeFraction);
        this.minCoreFraction = checkFraction("min-cf", minCoreFraction);
        this.minAlleleFraction = checkFraction("min-pf", minAlleleFraction);
        if (minAlleleSamples < 0) {
            throw new UserException.ThresholdRange("min-pn", minAlleleSamples, "a non-negative integer");
        }
        this.minAlleleSamples = minAlleleSamples;
    }

    private static double checkFraction(final String name, final double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new UserException.ThresholdRange(name, value, "between 0 and 1");
        }
        return value;
    }

    public double getMinGenomeFraction() {
        return minGenomeFraction;
    }

    public double getMinCoreFraction() {
        return minCoreFraction;
    }

    public double getMinAlleleFraction() {
        return minAlleleFraction;
    }

    public int getMinAlleleSamples() {
        return minAlleleSamples;
    }

    /**
     * Whether a sample with the given number of non-missing copies at a site is called there.
     */
    public boolean isCalled(final int nonMissingCopies, final int ploidy) {
        return nonMissingCopies >= Math.ceil(minGenomeFraction * ploidy - EPSILON);
    }

    /**
     * Whether a sample with the given genome-wide genome fraction may vote.
     */
    public boolean passesGenomeFraction(final double genomeFraction) {
        return genomeFraction >= minGenomeFraction - EPSILON;
    }

    /**
     * Smallest number of called samples, out of {@code votingSamples}, that makes a site core.
     */
    public int minCalledSamples(final int votingSamples) {
        return (int) Math.ceil(minCoreFraction * votingSamples - EPSILON);
    }

    /**
     * Number of voting samples that may be uncalled at a core site.
     */
    public int missingBudget(final int votingSamples) {
        return votingSamples - minCalledSamples(votingSamples);
    }

    /**
     * Whether a site whose complete tally over {@code votingSamples} samples is given meets min-cf.
     * A site without voting samples is never core.
     */
    public boolean isCore(final SiteTally tally, final int votingSamples) {
        return votingSamples > 0 && tally.getCalledSamples() >= minCalledSamples(votingSamples);
    }

    /**
     * Whether a partial tally already has more uncalled samples than a core site over {@code votingSamples}
     * samples may have; such a site can never become core again as samples are added.
     */
    public boolean exceedsMissingBudget(final SiteTally tally, final int votingSamples) {
        return tally.getUncalledSamples() > missingBudget(votingSamples);
    }

    /**
     * Whether an alternate allele with the given frequency statistics makes a core site a variant site.
     */
    public boolean isVariant(final int alternateCopies, final double alternateFraction, final int alternateSamples) {
        return alternateCopies > 0
                && alternateFraction >= minAlleleFraction - EPSILON
                && alternateSamples >= minAlleleSamples;
    }

    @Override
    public String toString() {
        return String.format("min-gf=%s min-cf=%s min-pf=%s min-pn=%d",
                minGenomeFraction, minCoreFraction, minAlleleFraction, minAlleleSamples);
    }
}
