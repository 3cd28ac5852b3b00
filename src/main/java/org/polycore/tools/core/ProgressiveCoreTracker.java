package org.polycore.tools.core;

import com.google.common.annotations.VisibleForTesting;
import org.polycore.utils.Utils;

import java.util.BitSet;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily computes how the core shrinks as voting samples are admitted one at a time.
 *
 * <p>With N voting samples, a column stays core at prefix k while the number of uncalled samples among the first
 * k does not exceed the missing budget of a core site over all N samples. The live set therefore only shrinks,
 * and at k = N it is exactly the set of core columns of the {@link SiteClassifier}. Each admitted sample updates the
 * {@link SiteTally} of every live column; a column that runs out of budget leaves the live set for good.</p>
 *
 * <p>This is not the ratio of called samples to k within the prefix: with a budget of one uncalled sample, a
 * column missing in the first admitted sample is still counted at k = 1, so early points can be higher than the
 * prefix alone would give.</p>
 *
 * <p>Every call to {@link #iterator()} starts over; points are computed on demand.</p>
 */
public final class ProgressiveCoreTracker implements Iterable<CoreTrajectoryPoint> {
    private final CollapsedAlignment alignment;
    private final int[] order;
    private final CoreThresholds thresholds;
    private final BitSet eligibleColumns;

    /**
     * @param order sample indexes of the voting samples in admission order
     * @param eligibleColumns columns that are not ruled out by the reference symbol
     */
    public ProgressiveCoreTracker(final CollapsedAlignment alignment, final int[] order, final CoreThresholds thresholds,
                                  final BitSet eligibleColumns) {
        this.alignment = Utils.nonNull(alignment);
        this.order = Utils.nonNull(order).clone();
        this.thresholds = Utils.nonNull(thresholds);
        this.eligibleColumns = (BitSet) Utils.nonNull(eligibleColumns).clone();
    }

    @Override
    public Iterator<CoreTrajectoryPoint> iterator() {
        return new TrajectoryIterator();
    }

    private final class TrajectoryIterator implements Iterator<CoreTrajectoryPoint> {
        private final BitSet live = (BitSet) eligibleColumns.clone();
        private final SiteTally[] tallies = new SiteTally[alignment.length()];
        private final int[] copyRanks = new int[maxPloidy()];
        private final int budgetSamples = order.length;
        private int k = 0;

        @Override
        public boolean hasNext() {
            return k < order.length;
        }

        @Override
        public CoreTrajectoryPoint next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            final int sampleIndex = order[k];
            final int ploidy = alignment.getSample(sampleIndex).getPloidyValue();
            for (int column = live.nextSetBit(0); column >= 0; column = live.nextSetBit(column + 1)) {
                alignment.fillCopyRanks(sampleIndex, column, copyRanks);
                final SiteTally previous = tallies[column] == null ? SiteTally.EMPTY : tallies[column];
                final SiteTally updated = SiteTally.update(previous, SiteObservation.fromCopyRanks(copyRanks, ploidy, thresholds));
                if (thresholds.exceedsMissingBudget(updated, budgetSamples)) {
                    live.clear(column);
                    tallies[column] = null;
                } else {
                    tallies[column] = updated;
                }
            }
            k++;
            final int coreSites = live.cardinality();
            final double fraction = alignment.length() == 0 ? 0.0 : coreSites / (double) alignment.length();
            return new CoreTrajectoryPoint(k, alignment.getSample(sampleIndex).getId(), fraction, coreSites);
        }
    }

    private int maxPloidy() {
        int max = 1;
        for (final int sampleIndex : order) {
            max = Math.max(max, alignment.getSample(sampleIndex).getPloidyValue());
        }
        return max;
    }

    /**
     * Columns still core after every voting sample has been admitted.
     */
    @VisibleForTesting
    BitSet finalLiveColumns() {
        final TrajectoryIterator iterator = new TrajectoryIterator();
        while (iterator.hasNext()) {
            iterator.next();
        }
        return (BitSet) iterator.live.clone();
    }
}
