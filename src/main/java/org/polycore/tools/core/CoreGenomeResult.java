package org.polycore.tools.core;

import org.polycore.tools.core.distance.DistanceMatrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything computed by one run of the {@link CoreGenomeEngine}.
 */
public final class CoreGenomeResult {
    private final ExpandedAlignment alignment;
    private final int[] votingSamples;
    private final List<CoreTrajectoryPoint> trajectory;
    private final boolean progressive;
    private final List<SampleSummary> summaries;
    private final List<String> warnings;
    private final DistanceMatrix distanceMatrix;
    private final long[] constantSiteComposition;

    CoreGenomeResult(final ExpandedAlignment alignment, final int[] votingSamples,
                     final List<CoreTrajectoryPoint> trajectory, final boolean progressive,
                     final List<SampleSummary> summaries, final List<String> warnings,
                     final DistanceMatrix distanceMatrix, final long[] constantSiteComposition) {
        this.alignment = alignment;
        this.votingSamples = votingSamples.clone();
        this.trajectory = Collections.unmodifiableList(new ArrayList<>(trajectory));
        this.progressive = progressive;
        this.summaries = Collections.unmodifiableList(new ArrayList<>(summaries));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        this.distanceMatrix = distanceMatrix;
        this.constantSiteComposition = constantSiteComposition.clone();
    }

    public ExpandedAlignment getExpandedAlignment() {
        return alignment;
    }

    /**
     * The reference, at index 0, followed by the samples in input order.
     */
    public List<Sample> getSamples() {
        return alignment.getCollapsedAlignment().getSamples();
    }

    public Sample getReference() {
        return alignment.getCollapsedAlignment().getSample(0);
    }

    /**
     * Sample indexes of the voting samples, in input order (the reference first when it votes).
     */
    public int[] getVotingSamples() {
        return votingSamples.clone();
    }

    public List<String> getVotingSampleIds() {
        final List<String> ids = new ArrayList<>(votingSamples.length);
        for (final int sample : votingSamples) {
            ids.add(alignment.getCollapsedAlignment().getSample(sample).getId());
        }
        return ids;
    }

    public List<SiteStat> getSiteStats() {
        return alignment.getSiteStats();
    }

    public int getNumberOfCoreSites() {
        return alignment.getCoreSites().length;
    }

    public int getNumberOfVariantSites() {
        return alignment.getVariantSites().length;
    }

    public boolean isProgressive() {
        return progressive;
    }

    /**
     * Points of the core fraction trajectory; empty unless the run was progressive.
     */
    public List<CoreTrajectoryPoint> getTrajectory() {
        return trajectory;
    }

    public List<SampleSummary> getSummaries() {
        return summaries;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public DistanceMatrix getDistanceMatrix() {
        return distanceMatrix;
    }

    /**
     * Counts of A, C, G and T as REF allele over the core invariant sites, each site counted once per copy of the
     * largest voting ploidy.
     */
    public long[] getConstantSiteComposition() {
        return constantSiteComposition.clone();
    }

    @Override
    public String toString() {
        return String.format("CoreGenomeResult{columns=%d, coreSites=%d, variantSites=%d, votingSamples=%d, warnings=%d}",
                alignment.getCollapsedAlignment().length(), getNumberOfCoreSites(), getNumberOfVariantSites(),
                votingSamples.length, warnings.size());
    }
}
