package org.polycore.tools.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.polycore.exceptions.UserException;
import org.polycore.utils.Nucleotide;
import org.polycore.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Classifies every column of a collapsed alignment as core invariant, core variant or excluded.
 *
 * <p>Only the voting samples count. The representative of each sequence group is read once per column and its
 * allele applies to every member of the group. Classification, first match wins:</p>
 * <ol>
 *     <li>the reference symbol is not a standard base (unless ambiguous reference sites are kept): excluded</li>
 *     <li>fewer than min-cf of the voting samples are called: excluded</li>
 *     <li>an alternate allele passes min-pf and min-pn: core variant</li>
 *     <li>otherwise: core invariant</li>
 * </ol>
 */
public final class SiteClassifier {
    private static final Logger logger = LogManager.getLogger(SiteClassifier.class);

    private final CollapsedAlignment alignment;
    private final int referenceIndex;
    private final int[] votingSamples;
    private final int[][] votingCopyGroups;
    private final CoreThresholds thresholds;
    private final boolean keepAmbiguousReferenceSites;

    /**
     * @param alignment the collapsed alignment
     * @param referenceIndex sample index of the reference in the alignment
     * @param votingSamples sample indexes of the voting samples
     */
    public SiteClassifier(final CollapsedAlignment alignment, final int referenceIndex, final int[] votingSamples,
                          final CoreThresholds thresholds, final boolean keepAmbiguousReferenceSites) {
        this.alignment = Utils.nonNull(alignment);
        this.referenceIndex = Utils.validIndex(referenceIndex, alignment.getNumberOfSamples());
        this.votingSamples = Utils.nonNull(votingSamples).clone();
        this.thresholds = Utils.nonNull(thresholds);
        this.keepAmbiguousReferenceSites = keepAmbiguousReferenceSites;
        this.votingCopyGroups = new int[votingSamples.length][];
        for (int i = 0; i < votingSamples.length; i++) {
            votingCopyGroups[i] = alignment.groupIdsOf(votingSamples[i]);
        }
    }

    /**
     * @return one {@link SiteStat} per alignment column, in column order
     * @throws UserException.EmptyAlignment if the alignment has no columns
     */
    public List<SiteStat> classify() {
        final int length = alignment.length();
        if (length == 0) {
            throw new UserException.EmptyAlignment("no column to classify");
        }
        final int[] groupRanks = new int[alignment.getNumberOfGroups()];
        final List<SiteStat> stats = new ArrayList<>(length);
        int core = 0;
        int variant = 0;
        for (int column = 0; column < length; column++) {
            alignment.fillGroupRanks(column, groupRanks);
            final SiteStat stat = toSiteStat(column, tally(groupRanks));
            if (stat.isCore()) {
                core++;
            }
            if (stat.isVariant()) {
                variant++;
            }
            stats.add(stat);
        }
        logger.info(String.format("Classified %d columns over %d voting samples: %d core sites, %d variant sites, %d excluded",
                length, votingSamples.length, core, variant, length - core));
        return Collections.unmodifiableList(stats);
    }

    /**
     * The from-scratch tally of one column over all voting samples.
     */
    public SiteTally tallyColumn(final int column) {
        final int[] groupRanks = new int[alignment.getNumberOfGroups()];
        alignment.fillGroupRanks(Utils.validIndex(column, alignment.length()), groupRanks);
        return tally(groupRanks);
    }

    public SiteStat classifyColumn(final int column) {
        return toSiteStat(column, tallyColumn(column));
    }

    /**
     * Whether the reference symbol at the column rules the column out before any vote.
     */
    public boolean isExcludedByReference(final int column) {
        return !keepAmbiguousReferenceSites && !Nucleotide.isCallable(referenceSymbol(column));
    }

    private byte referenceSymbol(final int column) {
        return alignment.symbol(referenceIndex, 0, column);
    }

    private SiteTally tally(final int[] groupRanks) {
        SiteTally tally = SiteTally.EMPTY;
        for (final int[] copyGroups : votingCopyGroups) {
            tally = SiteTally.update(tally, SiteObservation.fromGroupRanks(copyGroups, groupRanks, thresholds));
        }
        return tally;
    }

    private SiteStat toSiteStat(final int column, final SiteTally tally) {
        final byte referenceSymbol = referenceSymbol(column);
        final int voting = votingSamples.length;

        final int referenceRank = Nucleotide.rank(referenceSymbol);
        final int refRank = referenceRank >= 0 ? referenceRank : majorityRank(tally);
        final Nucleotide ref = refRank >= 0 ? Nucleotide.fromRank(refRank) : Nucleotide.N;

        final List<Nucleotide> alternates = new ArrayList<>(Nucleotide.NUMBER_OF_ALLELES - 1);
        int altRank = -1;
        for (int rank = 0; rank < Nucleotide.NUMBER_OF_ALLELES; rank++) {
            if (rank == refRank || tally.getAlleleCopies(rank) == 0) {
                continue;
            }
            alternates.add(Nucleotide.fromRank(rank));
            // strictly greater keeps the lowest rank on ties
            if (altRank < 0 || tally.getAlleleCopies(rank) > tally.getAlleleCopies(altRank)) {
                altRank = rank;
            }
        }
        final int altCopies = altRank >= 0 ? tally.getAlleleCopies(altRank) : 0;
        final int altSamples = altRank >= 0 ? tally.getAlleleSamples(altRank) : 0;
        final double altFraction = tally.getCalledCopies() == 0 ? 0.0 : altCopies / (double) tally.getCalledCopies();
        final double genomeFraction = tally.getExpectedCopies() == 0 ? 0.0
                : tally.getNonMissingCopies() / (double) tally.getExpectedCopies();
        final double coreFraction = voting == 0 ? 0.0 : tally.getCalledSamples() / (double) voting;

        final SiteClass siteClass;
        if (isExcludedByReference(column) || !thresholds.isCore(tally, voting)) {
            siteClass = SiteClass.EXCLUDED;
        } else if (thresholds.isVariant(altCopies, altFraction, altSamples)) {
            siteClass = SiteClass.CORE_VARIANT;
        } else {
            siteClass = SiteClass.CORE_INVARIANT;
        }

        return new SiteStat(column, referenceSymbol, ref, genomeFraction, tally.getCalledSamples(), voting, coreFraction,
                altRank >= 0 ? Nucleotide.fromRank(altRank) : null, altCopies, altFraction, altSamples,
                alternates, tally.getAlleleCopyCounts(), tally.getCalledCopies(), siteClass);
    }

    /**
     * Most frequent called allele, lowest rank on ties, or -1 if no copy is called.
     */
    private static int majorityRank(final SiteTally tally) {
        int best = -1;
        for (int rank = 0; rank < Nucleotide.NUMBER_OF_ALLELES; rank++) {
            if (tally.getAlleleCopies(rank) > 0 && (best < 0 || tally.getAlleleCopies(rank) > tally.getAlleleCopies(best))) {
                best = rank;
            }
        }
        return best;
    }
}
