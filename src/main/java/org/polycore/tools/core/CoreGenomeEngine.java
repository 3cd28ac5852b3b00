package org.polycore.tools.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.polycore.cmdline.argumentcollections.CoreGenomeArgumentCollection;
import org.polycore.exceptions.UserException;
import org.polycore.tools.core.distance.ChunkSizer;
import org.polycore.tools.core.distance.DistanceEngine;
import org.polycore.tools.core.distance.DistanceMatrix;
import org.polycore.tools.core.distance.DistanceSiteSelection;
import org.polycore.tools.core.distance.MemoryBudgetProvider;
import org.polycore.utils.Nucleotide;
import org.polycore.utils.Utils;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Runs a complete core genome analysis over a reference and a set of aligned samples.
 *
 * <p>The reference always takes sample index 0 and the samples follow in input order. A sample votes on core
 * sites when its genome-wide genome fraction meets min-gf; the reference votes only when asked to.</p>
 */
public final class CoreGenomeEngine {
    private static final Logger logger = LogManager.getLogger(CoreGenomeEngine.class);

    private final CoreGenomeArgumentCollection arguments;
    private final MemoryBudgetProvider memoryBudgetProvider;
    private final int defaultChunkWidth;
    private final int minViableChunkWidth;

    public CoreGenomeEngine(final CoreGenomeArgumentCollection arguments, final MemoryBudgetProvider memoryBudgetProvider,
                            final int defaultChunkWidth, final int minViableChunkWidth) {
        this.arguments = Utils.nonNull(arguments);
        this.memoryBudgetProvider = Utils.nonNull(memoryBudgetProvider);
        this.defaultChunkWidth = defaultChunkWidth;
        this.minViableChunkWidth = minViableChunkWidth;
    }

    /**
     * @param reference the reference, resolved with {@link PloidyResolver#resolveReference}
     * @param samples the samples in input order
     * @throws UserException if the inputs or the thresholds are invalid; nothing is computed in that case
     */
    public CoreGenomeResult run(final Sample reference, final List<Sample> samples) {
        Utils.nonNull(reference);
        Utils.nonNull(samples);
        final CoreThresholds thresholds = arguments.getThresholds();
        if (arguments.threads < 1) {
            throw new UserException.BadInput("the number of threads must be at least 1 but " + arguments.threads + " was given");
        }
        validateInputs(reference, samples);
        logger.info(String.format("Core genome analysis of %d samples over %,d columns with %s",
                samples.size(), reference.length(), thresholds));

        final List<Sample> all = new ArrayList<>(samples.size() + 1);
        all.add(reference);
        all.addAll(samples);
        final CollapsedAlignment collapsed = SequenceCollapser.collapse(all);
        final int length = collapsed.length();

        final List<String> warnings = new ArrayList<>();
        final double[] genomeFractions = new double[all.size()];
        final List<Integer> voting = new ArrayList<>();
        if (arguments.includeReference) {
            voting.add(0);
        }
        for (int s = 0; s < all.size(); s++) {
            genomeFractions[s] = genomeFraction(collapsed, s);
            if (s == 0) {
                continue;
            }
            if (thresholds.passesGenomeFraction(genomeFractions[s])) {
                voting.add(s);
            } else {
                warn(warnings, String.format(Locale.US, "Sample %s has a genome fraction of %.4f, below the minimum of %s, and is excluded from every site",
                        all.get(s).getId(), genomeFractions[s], thresholds.getMinGenomeFraction()));
            }
        }
        final int[] votingSamples = voting.stream().mapToInt(Integer::intValue).toArray();
        if (votingSamples.length == 0) {
            warn(warnings, "No sample passes the genome fraction threshold, no site can be core");
        }

        final SiteClassifier classifier = new SiteClassifier(collapsed, 0, votingSamples, thresholds,
                arguments.keepAmbiguousReferenceSites);
        final List<SiteStat> stats = classifier.classify();
        final ExpandedAlignment expanded = new ExpandedAlignment(collapsed, stats, thresholds);
        if (expanded.getCoreSites().length == 0) {
            warn(warnings, "No core site was found, try lowering --" + CoreGenomeArgumentCollection.MIN_CORE_FRACTION_LONG_NAME);
        }

        final List<CoreTrajectoryPoint> trajectory = new ArrayList<>();
        if (arguments.progressive) {
            final BitSet eligible = new BitSet(length);
            for (int column = 0; column < length; column++) {
                if (!classifier.isExcludedByReference(column)) {
                    eligible.set(column);
                }
            }
            final int[] order = admissionOrder(votingSamples, genomeFractions);
            for (final CoreTrajectoryPoint point : new ProgressiveCoreTracker(collapsed, order, thresholds, eligible)) {
                logger.debug(point.toString());
                trajectory.add(point);
            }
        }

        final DistanceMatrix distances = computeDistances(expanded, votingSamples, warnings);
        final List<SampleSummary> summaries = summarize(expanded, votingSamples, genomeFractions, trajectory);
        final long[] composition = constantSiteComposition(expanded, votingSamples);

        return new CoreGenomeResult(expanded, votingSamples, trajectory, arguments.progressive, summaries, warnings,
                distances, composition);
    }

    private static void validateInputs(final Sample reference, final List<Sample> samples) {
        if (reference.length() == 0) {
            throw new UserException.EmptyAlignment("the reference " + reference.getId() + " is empty");
        }
        final Set<String> ids = new HashSet<>();
        ids.add(reference.getId());
        for (final Sample sample : samples) {
            if (sample.length() != reference.length()) {
                throw new UserException.AlignmentLengthMismatch(sample.getId(), sample.length(), reference.length());
            }
            if (!ids.add(sample.getId())) {
                throw new UserException.BadInput("duplicate sample id " + sample.getId());
            }
        }
    }

    private static void warn(final List<String> warnings, final String message) {
        logger.warn(message);
        warnings.add(message);
    }

    /**
     * Non-missing (copy, column) cells over all the cells of the sample, counted on the collapsed groups.
     */
    private static double genomeFraction(final CollapsedAlignment collapsed, final int sampleIndex) {
        final long cells = (long) collapsed.getSample(sampleIndex).getPloidyValue() * collapsed.length();
        if (cells == 0) {
            return 0.0;
        }
        long missing = 0;
        for (final int group : collapsed.groupIdsOf(sampleIndex)) {
            missing += collapsed.getGroup(group).getMissingCount();
        }
        return (cells - missing) / (double) cells;
    }

    /**
     * The voting samples in the order they join the trajectory. The reference, when it votes, always comes first;
     * ties keep the input order.
     */
    private int[] admissionOrder(final int[] votingSamples, final double[] genomeFractions) {
        final List<Integer> order = IntStream.of(votingSamples).boxed().collect(Collectors.toList());
        if (arguments.progressiveOrder == ProgressiveOrder.MISSINGNESS) {
            order.sort(Comparator.comparing((Integer s) -> s != 0)
                    .thenComparing(s -> -genomeFractions[s]));
        }
        return order.stream().mapToInt(Integer::intValue).toArray();
    }

    private DistanceMatrix computeDistances(final ExpandedAlignment expanded, final int[] votingSamples,
                                            final List<String> warnings) {
        if (votingSamples.length == 0) {
            return DistanceMatrix.empty();
        }
        final int[] columns = arguments.distanceSites == DistanceSiteSelection.VARIANT
                ? expanded.getVariantSites() : expanded.getCoreSites();
        long totalCopies = 0;
        for (final int sample : votingSamples) {
            totalCopies += expanded.getCollapsedAlignment().getSample(sample).getPloidyValue();
        }
        final ChunkSizer sizer = new ChunkSizer(memoryBudgetProvider, defaultChunkWidth, minViableChunkWidth, arguments.chunkSize);
        final int width = sizer.chunkWidth(votingSamples.length, totalCopies, columns.length, arguments.threads);
        final DistanceMatrix matrix = new DistanceEngine(arguments.copyAggregation, arguments.threads)
                .compute(expanded, votingSamples, columns, width);
        final long incomparable = matrix.toLong().stream().filter(cell -> !cell.isComparable()).count();
        if (incomparable > 0) {
            warn(warnings, String.format("%d sample pair(s) share no comparable site, their distance is undefined", incomparable));
        }
        return matrix;
    }

    private List<SampleSummary> summarize(final ExpandedAlignment expanded, final int[] votingSamples,
                                          final double[] genomeFractions, final List<CoreTrajectoryPoint> trajectory) {
        final CollapsedAlignment collapsed = expanded.getCollapsedAlignment();
        final Set<Integer> voting = IntStream.of(votingSamples).boxed().collect(Collectors.toSet());
        final Map<String, Double> admittedAt = new HashMap<>();
        for (final CoreTrajectoryPoint point : trajectory) {
            admittedAt.put(point.getSampleId(), point.getCoreFraction());
        }
        final int[] coreSites = expanded.getCoreSites();
        final int[] variantSites = expanded.getVariantSites();
        final double finalCoreFraction = collapsed.length() == 0 ? 0.0 : coreSites.length / (double) collapsed.length();
        final List<List<Integer>> missingPerCopy = expanded.expandGroupValues(g -> collapsed.getGroup(g).getMissingCount());

        final List<SampleSummary> summaries = new ArrayList<>(collapsed.getNumberOfSamples());
        for (int s = 0; s < collapsed.getNumberOfSamples(); s++) {
            final Sample sample = collapsed.getSample(s);
            final long missing = missingPerCopy.get(s).stream().mapToLong(Integer::longValue).sum();
            final SampleSummary.Status status;
            if (voting.contains(s)) {
                status = SampleSummary.Status.PASS;
            } else if (sample.isReference()) {
                status = SampleSummary.Status.REFERENCE;
            } else {
                status = SampleSummary.Status.LOW_GENOME_FRACTION;
            }

            double coreFraction = Double.NaN;
            int called = 0;
            int variant = 0;
            if (status == SampleSummary.Status.PASS) {
                coreFraction = admittedAt.getOrDefault(sample.getId(), finalCoreFraction);
                for (final int column : coreSites) {
                    if (expanded.isCalled(s, column)) {
                        called++;
                    }
                }
                for (final int column : variantSites) {
                    if (carriesAlternate(expanded, s, column)) {
                        variant++;
                    }
                }
            }
            summaries.add(new SampleSummary(sample.getId(), sample.getPloidy(), sample.length(), missing,
                    genomeFractions[s], coreFraction, called, variant, status, collapsed.groupIdsOf(s)));
        }
        return summaries;
    }

    private static boolean carriesAlternate(final ExpandedAlignment expanded, final int sampleIndex, final int column) {
        final Nucleotide ref = expanded.getSiteStat(column).getRef();
        for (final Nucleotide call : expanded.genotype(sampleIndex, column)) {
            if (call != null && call != ref) {
                return true;
            }
        }
        return false;
    }

    private static long[] constantSiteComposition(final ExpandedAlignment expanded, final int[] votingSamples) {
        int maxPloidy = 1;
        for (final int sample : votingSamples) {
            maxPloidy = Math.max(maxPloidy, expanded.getCollapsedAlignment().getSample(sample).getPloidyValue());
        }
        final long[] composition = new long[Nucleotide.NUMBER_OF_ALLELES];
        for (final SiteStat stat : expanded.getSiteStats()) {
            if (stat.getSiteClass() == SiteClass.CORE_INVARIANT && stat.getRef().isStandard()) {
                composition[Nucleotide.STANDARD_BASES.indexOf(stat.getRef())] += maxPloidy;
            }
        }
        return composition;
    }
}
