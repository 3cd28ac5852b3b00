package org.polycore.tools.core.distance;

/**
 * Distance between two samples. Immutable.
 */
public final class DistanceCell {
    private final String sample1;
    private final String sample2;
    private final double distance;
    private final double differences;
    private final int comparableSites;

    public DistanceCell(final String sample1, final String sample2, final double distance, final double differences,
                        final int comparableSites) {
        this.sample1 = sample1;
        this.sample2 = sample2;
        this.distance = distance;
        this.differences = differences;
        this.comparableSites = comparableSites;
    }

    public String getSample1() {
        return sample1;
    }

    public String getSample2() {
        return sample2;
    }

    /**
     * Mean per-site difference over the comparable sites, {@code NaN} when there is none.
     */
    public double getDistance() {
        return distance;
    }

    /**
     * Sum of the per-site differences.
     */
    public double getDifferences() {
        return differences;
    }

    /**
     * Sites where both samples are called with at least one non-missing copy.
     */
    public int getComparableSites() {
        return comparableSites;
    }

    public boolean isComparable() {
        return comparableSites > 0;
    }

    @Override
    public String toString() {
        return String.format("%s-%s: %s (%s / %d)", sample1, sample2, distance, differences, comparableSites);
    }
}
