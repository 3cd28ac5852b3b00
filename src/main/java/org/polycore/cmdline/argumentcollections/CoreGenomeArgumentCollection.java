package org.polycore.cmdline.argumentcollections;

import org.broadinstitute.barclay.argparser.Argument;
import org.polycore.tools.core.CoreThresholds;
import org.polycore.tools.core.ProgressiveOrder;
import org.polycore.tools.core.distance.CopyAggregation;
import org.polycore.tools.core.distance.DistanceSiteSelection;

import java.io.Serializable;

/**
 * The collection of all arguments that control core genome classification and the distance computation.
 *
 * Thresholds are range checked by {@link CoreThresholds} rather than by the parser, so an out of range value is
 * reported like any other invalid input.
 */
public class CoreGenomeArgumentCollection implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String MIN_GENOME_FRACTION_LONG_NAME = "min-gf";
    public static final String MIN_CORE_FRACTION_LONG_NAME = "min-cf";
    public static final String MIN_ALLELE_FRACTION_LONG_NAME = "min-pf";
    public static final String MIN_ALLELE_SAMPLES_LONG_NAME = "min-pn";
    public static final String PROGRESSIVE_LONG_NAME = "progressive";
    public static final String PROGRESSIVE_ORDER_LONG_NAME = "progressive-order";
    public static final String PLOIDY_LONG_NAME = "ploidy";
    public static final String PHASED_COPIES_LONG_NAME = "phased-copies";
    public static final String INCLUDE_REFERENCE_LONG_NAME = "include-reference";
    public static final String KEEP_AMBIGUOUS_REFERENCE_SITES_LONG_NAME = "keep-ambiguous-reference-sites";
    public static final String DISTANCE_SITES_LONG_NAME = "distance-sites";
    public static final String COPY_AGGREGATION_LONG_NAME = "copy-aggregation";
    public static final String CHUNK_SIZE_LONG_NAME = "chunk-size";
    public static final String MEMORY_BUDGET_LONG_NAME = "memory-budget";
    public static final String THREADS_LONG_NAME = "threads";

    public static final double DEFAULT_MIN_GENOME_FRACTION = 0.9;
    public static final double DEFAULT_MIN_CORE_FRACTION = 0.95;

    /**
     * A sample is called at a site when at least this fraction of its allele copies is not missing there. Samples
     * below this fraction genome wide do not vote at all and are reported as LOW_GENOME_FRACTION.
     */
    @Argument(fullName = MIN_GENOME_FRACTION_LONG_NAME, doc = "Minimum fraction of non-missing allele copies for a sample to be called", optional = true)
    public double minGenomeFraction = DEFAULT_MIN_GENOME_FRACTION;

    @Argument(fullName = MIN_CORE_FRACTION_LONG_NAME, doc = "Minimum fraction of voting samples called at a site for the site to be core", optional = true)
    public double minCoreFraction = DEFAULT_MIN_CORE_FRACTION;

    @Argument(fullName = MIN_ALLELE_FRACTION_LONG_NAME, doc = "Minimum fraction of called allele copies carrying the alternate allele for a variant site", optional = true)
    public double minAlleleFraction = 0.0;

    @Argument(fullName = MIN_ALLELE_SAMPLES_LONG_NAME, doc = "Minimum number of called samples carrying the alternate allele for a variant site", optional = true)
    public int minAlleleSamples = 0;

    @Argument(fullName = PROGRESSIVE_LONG_NAME, doc = "Compute the core fraction trajectory as samples are added one at a time", optional = true)
    public boolean progressive = false;

    @Argument(fullName = PROGRESSIVE_ORDER_LONG_NAME, doc = "Order in which samples are added to the core fraction trajectory", optional = true)
    public ProgressiveOrder progressiveOrder = ProgressiveOrder.MISSINGNESS;

    /**
     * Without this argument the ploidy of each sample is detected from its input: the number of records in phased
     * mode, the size of the largest IUPAC ambiguity code otherwise.
     */
    @Argument(fullName = PLOIDY_LONG_NAME, doc = "Ploidy of every sample, overriding detection", optional = true)
    public Integer ploidy = null;

    @Argument(fullName = PHASED_COPIES_LONG_NAME, doc = "Read each record of a sample file as one allele copy instead of concatenating the records", optional = true)
    public boolean phasedCopies = false;

    @Argument(fullName = INCLUDE_REFERENCE_LONG_NAME, doc = "Let the reference vote on core sites like a sample", optional = true)
    public boolean includeReference = false;

    @Argument(fullName = KEEP_AMBIGUOUS_REFERENCE_SITES_LONG_NAME, doc = "Keep sites where the reference symbol is not a standard base", optional = true)
    public boolean keepAmbiguousReferenceSites = false;

    @Argument(fullName = DISTANCE_SITES_LONG_NAME, doc = "Sites to compute pairwise distances over", optional = true)
    public DistanceSiteSelection distanceSites = DistanceSiteSelection.CORE;

    @Argument(fullName = COPY_AGGREGATION_LONG_NAME, doc = "How allele copies of polyploid samples are compared", optional = true)
    public CopyAggregation copyAggregation = CopyAggregation.DOSAGE;

    @Argument(fullName = CHUNK_SIZE_LONG_NAME, doc = "Number of sites per distance chunk, overriding the memory based sizing", optional = true)
    public Integer chunkSize = null;

    @Argument(fullName = MEMORY_BUDGET_LONG_NAME, doc = "Bytes available to the distance computation, instead of the free JVM heap", optional = true)
    public Long memoryBudget = null;

    @Argument(fullName = THREADS_LONG_NAME, doc = "Number of threads computing distance chunks", optional = true)
    public int threads = 1;

    public CoreThresholds getThresholds() {
        return new CoreThresholds(minGenomeFraction, minCoreFraction, minAlleleFraction, minAlleleSamples);
    }
}
