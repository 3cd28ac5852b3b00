package org.polycore.tools.core;

import org.polycore.utils.Nucleotide;
import org.polycore.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Projects classified sites and group membership back onto per-sample, per-copy identity.
 *
 * <p>Every lookup goes through the representative of the copy's sequence group, which is byte-identical to the
 * copy, so expansion is lossless and never imputes anything.</p>
 */
public final class ExpandedAlignment {
    private final CollapsedAlignment alignment;
    private final List<SiteStat> siteStats;
    private final CoreThresholds thresholds;
    private final int[] coreSites;
    private final int[] variantSites;

    public ExpandedAlignment(final CollapsedAlignment alignment, final List<SiteStat> siteStats, final CoreThresholds thresholds) {
        this.alignment = Utils.nonNull(alignment);
        this.siteStats = Utils.nonNull(siteStats);
        this.thresholds = Utils.nonNull(thresholds);
        Utils.validateArg(siteStats.size() == alignment.length(), "one site statistic per alignment column is required");
        this.coreSites = siteStats.stream().filter(SiteStat::isCore).mapToInt(SiteStat::getColumn).toArray();
        this.variantSites = siteStats.stream().filter(SiteStat::isVariant).mapToInt(SiteStat::getColumn).toArray();
    }

    public CollapsedAlignment getCollapsedAlignment() {
        return alignment;
    }

    public List<SiteStat> getSiteStats() {
        return siteStats;
    }

    public SiteStat getSiteStat(final int column) {
        return siteStats.get(column);
    }

    /**
     * Columns classified CORE_INVARIANT or CORE_VARIANT, ascending.
     */
    public int[] getCoreSites() {
        return coreSites.clone();
    }

    /**
     * Columns classified CORE_VARIANT, ascending.
     */
    public int[] getVariantSites() {
        return variantSites.clone();
    }

    public byte symbol(final int sampleIndex, final int copyIndex, final int column) {
        return alignment.symbol(sampleIndex, copyIndex, column);
    }

    public byte[] copyRow(final int sampleIndex, final int copyIndex, final int[] columns) {
        final byte[] representative = alignment.getGroup(alignment.groupOf(sampleIndex, copyIndex)).getRepresentative();
        final byte[] row = new byte[columns.length];
        for (int i = 0; i < columns.length; i++) {
            row[i] = representative[columns[i]];
        }
        return row;
    }

    /**
     * One symbol per column for the whole sample: the smallest IUPAC code covering the called bases of its copies,
     * or the first copy's symbol when every copy is missing. Unphased input is reproduced exactly.
     */
    public byte[] sampleRow(final int sampleIndex, final int[] columns) {
        final int ploidy = alignment.getSample(sampleIndex).getPloidyValue();
        final byte[][] representatives = new byte[ploidy][];
        for (int copy = 0; copy < ploidy; copy++) {
            representatives[copy] = alignment.getGroup(alignment.groupOf(sampleIndex, copy)).getRepresentative();
        }
        final byte[] row = new byte[columns.length];
        for (int i = 0; i < columns.length; i++) {
            final int column = columns[i];
            int mask = 0;
            for (int copy = 0; copy < ploidy; copy++) {
                final int rank = Nucleotide.rank(representatives[copy][column]);
                if (rank >= 0) {
                    mask |= 1 << rank;
                }
            }
            row[i] = mask == 0 ? representatives[0][column] : Nucleotide.fromMask(mask).encodeAsByte();
        }
        return row;
    }

    /**
     * Allele called at each copy of the sample at a column: the copy's base, or {@code null} for a missing copy
     * and for every copy of a sample that is not called at the column.
     */
    public Nucleotide[] genotype(final int sampleIndex, final int column) {
        final int ploidy = alignment.getSample(sampleIndex).getPloidyValue();
        final int[] ranks = new int[ploidy];
        alignment.fillCopyRanks(sampleIndex, column, ranks);
        final Nucleotide[] calls = new Nucleotide[ploidy];
        if (!thresholds.isCalled(nonMissing(ranks), ploidy)) {
            return calls;
        }
        for (int copy = 0; copy < ploidy; copy++) {
            calls[copy] = ranks[copy] >= 0 ? Nucleotide.fromRank(ranks[copy]) : null;
        }
        return calls;
    }

    /**
     * Whether enough copies of the sample are non-missing at the column for it to be called there.
     */
    public boolean isCalled(final int sampleIndex, final int column) {
        final int ploidy = alignment.getSample(sampleIndex).getPloidyValue();
        final int[] ranks = new int[ploidy];
        alignment.fillCopyRanks(sampleIndex, column, ranks);
        return thresholds.isCalled(nonMissing(ranks), ploidy);
    }

    private static int nonMissing(final int[] ranks) {
        int count = 0;
        for (final int rank : ranks) {
            if (rank >= 0) {
                count++;
            }
        }
        return count;
    }

    /**
     * Fills the working buffers of one column chunk for the given samples.
     *
     * <p>{@code symbols} receives the expanded copy symbols, copy-major: the copies of {@code samples[0]} first,
     * each as {@code width} consecutive bytes. {@code alleleCounts} receives, for sample i and chunk column w,
     * the number of copies carrying each allele at {@code 4 * (i * width + w)}; a sample that is not called at a
     * column gets all-zero counts there.</p>
     *
     * @param columns alignment columns of the chunk
     * @param from first index into {@code columns}, inclusive
     * @param to last index into {@code columns}, exclusive
     */
    public void fillChunk(final int[] samples, final int[] columns, final int from, final int to,
                          final byte[] symbols, final byte[] alleleCounts) {
        final int width = to - from;
        Utils.validateArg(width >= 0, "negative chunk width");
        Utils.validateArg(alleleCounts.length >= samples.length * width * Nucleotide.NUMBER_OF_ALLELES, "allele count buffer too small");
        int copyRow = 0;
        for (int i = 0; i < samples.length; i++) {
            final int ploidy = alignment.getSample(samples[i]).getPloidyValue();
            final int firstRow = copyRow;
            for (int copy = 0; copy < ploidy; copy++, copyRow++) {
                final byte[] representative = alignment.getGroup(alignment.groupOf(samples[i], copy)).getRepresentative();
                for (int w = 0; w < width; w++) {
                    symbols[copyRow * width + w] = representative[columns[from + w]];
                }
            }
            for (int w = 0; w < width; w++) {
                final int offset = (i * width + w) * Nucleotide.NUMBER_OF_ALLELES;
                int nonMissing = 0;
                for (int r = 0; r < Nucleotide.NUMBER_OF_ALLELES; r++) {
                    alleleCounts[offset + r] = 0;
                }
                for (int row = firstRow; row < copyRow; row++) {
                    final int rank = Nucleotide.rank(symbols[row * width + w]);
                    if (rank >= 0) {
                        alleleCounts[offset + rank]++;
                        nonMissing++;
                    }
                }
                if (!thresholds.isCalled(nonMissing, ploidy)) {
                    for (int r = 0; r < Nucleotide.NUMBER_OF_ALLELES; r++) {
                        alleleCounts[offset + r] = 0;
                    }
                }
            }
        }
    }

    /**
     * Reports a per-group value for every copy of every sample: element [s][c] is the value of the group of
     * copy c of sample s.
     */
    public <T> List<List<T>> expandGroupValues(final IntFunction<T> groupValue) {
        Utils.nonNull(groupValue);
        final List<List<T>> result = new ArrayList<>(alignment.getNumberOfSamples());
        for (int s = 0; s < alignment.getNumberOfSamples(); s++) {
            final int[] groups = alignment.groupIdsOf(s);
            final List<T> values = new ArrayList<>(groups.length);
            for (final int group : groups) {
                values.add(groupValue.apply(group));
            }
            result.add(Collections.unmodifiableList(values));
        }
        return Collections.unmodifiableList(result);
    }
}
