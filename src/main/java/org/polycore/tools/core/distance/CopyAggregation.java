package org.polycore.tools.core.distance;

/**
 * How the allele copies of two polyploid samples are compared at one site.
 *
 * <p>Both rules work on allele shares: with {@code lcm} a common multiple of both ploidies, a sample with
 * {@code n} non-missing copies of which {@code c_a} carry allele a has share {@code u_a = c_a * lcm / n}, so
 * {@code u_a / lcm} is the fraction f(a) of its copies carrying a. Differences are returned in units of
 * {@code 1 / lcm^2} so that sums over sites stay exact.</p>
 */
public enum CopyAggregation {
    /**
     * Best assignment of copies: 1 - sum over alleles of min(f_i(a), f_j(a)). Does not depend on copy order.
     */
    DOSAGE {
        @Override
        long scaledDifference(final long[] sharesI, final long[] sharesJ, final long lcm) {
            long shared = 0;
            for (int a = 0; a < sharesI.length; a++) {
                shared += Math.min(sharesI[a], sharesJ[a]);
            }
            return lcm * (lcm - shared);
        }
    },

    /**
     * Mean mismatch over all pairs of copies: 1 - sum over alleles of f_i(a) * f_j(a).
     */
    MEAN_COPY_PAIRS {
        @Override
        long scaledDifference(final long[] sharesI, final long[] sharesJ, final long lcm) {
            long matches = 0;
            for (int a = 0; a < sharesI.length; a++) {
                matches += sharesI[a] * sharesJ[a];
            }
            return lcm * lcm - matches;
        }
    };

    /**
     * Difference between two samples at a site, in units of {@code 1 / lcm^2}.
     *
     * @param sharesI allele shares of the first sample, summing to {@code lcm}
     * @param sharesJ allele shares of the second sample, summing to {@code lcm}
     */
    abstract long scaledDifference(long[] sharesI, long[] sharesJ, long lcm);
}
