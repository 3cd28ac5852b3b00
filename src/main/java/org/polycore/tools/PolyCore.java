package org.polycore.tools;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.polycore.cmdline.CommandLineProgram;
import org.polycore.cmdline.StandardArgumentDefinitions;
import org.polycore.cmdline.argumentcollections.CoreGenomeArgumentCollection;
import org.polycore.cmdline.programgroups.CoreGenomeProgramGroup;
import org.polycore.tools.core.CoreGenomeEngine;
import org.polycore.tools.core.CoreGenomeResult;
import org.polycore.tools.core.Sample;
import org.polycore.tools.core.distance.FixedMemoryBudgetProvider;
import org.polycore.tools.core.distance.MemoryBudgetProvider;
import org.polycore.tools.core.distance.RuntimeMemoryBudgetProvider;
import org.polycore.tools.core.formats.CoreGenomeResultWriter;
import org.polycore.tools.core.formats.FastaSampleLoader;
import org.polycore.utils.config.ConfigFactory;
import org.polycore.utils.config.PolyCoreConfig;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Finds the core genome of a set of samples aligned to a reference and measures the variation inside it.
 *
 * <p>Every sample may have its own ploidy, detected from IUPAC ambiguity codes or from the number of records in
 * phased mode. Identical allele copies are collapsed before any computation and expanded back for the outputs.</p>
 *
 * <h3>Outputs</h3>
 * <ul>
 *     <li>core.full.aln: the reference and the voting samples over all core sites</li>
 *     <li>core.aln: the same over the core variant sites</li>
 *     <li>core.vcf: genotypes of the voting samples at the core variant sites</li>
 *     <li>dist_wide.csv and dist_long.csv: pairwise distances between the voting samples</li>
 *     <li>summary.csv: one line per input genome</li>
 *     <li>core_trajectory.csv: the core fraction as samples are added (with --progressive)</li>
 *     <li>fconst.txt: base composition of the constant core sites</li>
 * </ul>
 *
 * <h3>Usage example</h3>
 * <pre>
 * polycore PolyCore \
 *   -R reference.fasta \
 *   -S sample1.fasta -S sample2.fasta -S sample3.fasta \
 *   --min-gf 0.9 --min-cf 0.95 --progressive \
 *   -O results
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Classifies the core sites of samples of any ploidy aligned to a reference, " +
                "computes the soft-core trajectory and the pairwise distances over the core",
        oneLineSummary = "Core genome analysis of polyploid samples",
        programGroup = CoreGenomeProgramGroup.class
)
public final class PolyCore extends CommandLineProgram {

    @Argument(fullName = StandardArgumentDefinitions.REFERENCE_LONG_NAME, shortName = StandardArgumentDefinitions.REFERENCE_SHORT_NAME,
            doc = "Reference FASTA file")
    public File reference;

    @Argument(fullName = StandardArgumentDefinitions.SAMPLE_LONG_NAME, shortName = StandardArgumentDefinitions.SAMPLE_SHORT_NAME,
            doc = "Sample FASTA file, aligned to the reference. May be specified multiple times")
    public List<File> samples = new ArrayList<>();

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME, shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Directory to write the outputs to", optional = true)
    public File outputDirectory = new File(".");

    @ArgumentCollection
    public CoreGenomeArgumentCollection coreArguments = new CoreGenomeArgumentCollection();

    @Override
    protected String[] customCommandLineValidation() {
        final List<String> errors = new ArrayList<>();
        if (samples.isEmpty()) {
            errors.add("At least one sample must be given with --" + StandardArgumentDefinitions.SAMPLE_LONG_NAME);
        }
        if (coreArguments.threads < 1) {
            errors.add("--" + CoreGenomeArgumentCollection.THREADS_LONG_NAME + " must be at least 1");
        }
        if (coreArguments.chunkSize != null && coreArguments.chunkSize < 1) {
            errors.add("--" + CoreGenomeArgumentCollection.CHUNK_SIZE_LONG_NAME + " must be at least 1");
        }
        if (coreArguments.memoryBudget != null && coreArguments.memoryBudget < 0) {
            errors.add("--" + CoreGenomeArgumentCollection.MEMORY_BUDGET_LONG_NAME + " must not be negative");
        }
        return errors.isEmpty() ? null : errors.toArray(new String[0]);
    }

    @Override
    protected Object doWork() {
        final PolyCoreConfig config = ConfigFactory.getInstance().getPolyCoreConfig();
        // thresholds are checked before any input is read
        coreArguments.getThresholds();

        final FastaSampleLoader loader = new FastaSampleLoader(coreArguments.phasedCopies, coreArguments.ploidy);
        final Sample referenceSample = loader.loadReference(reference.toPath());
        final List<Sample> loaded = loader.loadSamples(
                samples.stream().map(File::toPath).collect(Collectors.toList()), referenceSample.length());

        final MemoryBudgetProvider budget = coreArguments.memoryBudget != null
                ? new FixedMemoryBudgetProvider(coreArguments.memoryBudget)
                : new RuntimeMemoryBudgetProvider(config.memory_safety_fraction());
        final CoreGenomeResult result = new CoreGenomeEngine(coreArguments, budget,
                config.default_chunk_width(), config.min_viable_chunk_width()).run(referenceSample, loaded);

        new CoreGenomeResultWriter(outputDirectory.toPath(), config.fasta_bases_per_line()).write(result);
        logger.info(String.format("%d core sites, %d variant sites, %d voting samples",
                result.getNumberOfCoreSites(), result.getNumberOfVariantSites(), result.getVotingSamples().length));
        return result;
    }
}
