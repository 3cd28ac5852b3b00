package org.polycore.tools.core.distance;

import org.polycore.utils.Utils;

/**
 * Exact difference sums and comparable-site counts for every pair i &lt; j of a chunk, or of several merged chunks.
 */
final class PairwiseAccumulator {
    /** Largest pair count an array can hold. */
    static final long MAX_PAIRS = Integer.MAX_VALUE - 8;

    private final int samples;
    private final long[] differences;
    private final int[] comparable;

    PairwiseAccumulator(final int samples) {
        this.samples = samples;
        Utils.validateArg(pairCount(samples) <= MAX_PAIRS, () -> "too many samples for a pairwise matrix: " + samples);
        final int pairs = (int) pairCount(samples);
        this.differences = new long[pairs];
        this.comparable = new int[pairs];
    }

    static long pairCount(final int samples) {
        return (long) samples * (samples - 1) / 2;
    }

    /**
     * Position of pair (i, j), i &lt; j, in the upper triangle stored row by row.
     */
    static int pairIndex(final int i, final int j, final int samples) {
        return (int) ((long) i * (2L * samples - i - 1) / 2 + (j - i - 1));
    }

    void add(final int i, final int j, final long scaledDifference) {
        final int pair = pairIndex(i, j, samples);
        differences[pair] += scaledDifference;
        comparable[pair]++;
    }

    void merge(final PairwiseAccumulator other) {
        for (int p = 0; p < differences.length; p++) {
            differences[p] += other.differences[p];
            comparable[p] += other.comparable[p];
        }
    }

    long[] getDifferences() {
        return differences;
    }

    int[] getComparable() {
        return comparable;
    }
}
