package org.polycore.tools.core.formats;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.polycore.exceptions.UserException;
import org.polycore.tools.core.CoreGenomeResult;
import org.polycore.utils.Utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Writes every output file of a core genome run into one directory.
 */
public final class CoreGenomeResultWriter {
    private static final Logger logger = LogManager.getLogger(CoreGenomeResultWriter.class);

    public static final String CORE_FULL_ALIGNMENT = "core.full.aln";
    public static final String CORE_ALIGNMENT = "core.aln";
    public static final String CORE_VCF = "core.vcf";
    public static final String DISTANCE_WIDE = "dist_wide.csv";
    public static final String DISTANCE_LONG = "dist_long.csv";
    public static final String SUMMARY = "summary.csv";
    public static final String TRAJECTORY = "core_trajectory.csv";
    public static final String CONSTANT_SITES = "fconst.txt";

    private final Path outputDirectory;
    private final int fastaBasesPerLine;

    public CoreGenomeResultWriter(final Path outputDirectory, final int fastaBasesPerLine) {
        this.outputDirectory = Utils.nonNull(outputDirectory);
        this.fastaBasesPerLine = fastaBasesPerLine;
    }

    public void write(final CoreGenomeResult result) {
        Utils.nonNull(result);
        try {
            FileUtils.forceMkdir(outputDirectory.toFile());
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(outputDirectory, "the output directory can not be created", e);
        }

        // alignments hold the reference first, then the voting samples
        final int[] voting = result.getVotingSamples();
        final int[] rows = IntStream.concat(IntStream.of(0), IntStream.of(voting).filter(s -> s != 0)).toArray();
        final CoreAlignmentFastaWriter fastaWriter = new CoreAlignmentFastaWriter(fastaBasesPerLine);
        fastaWriter.write(resolve(CORE_FULL_ALIGNMENT), result.getExpandedAlignment(), rows, result.getExpandedAlignment().getCoreSites());
        fastaWriter.write(resolve(CORE_ALIGNMENT), result.getExpandedAlignment(), rows, result.getExpandedAlignment().getVariantSites());
        new CoreVariantVcfWriter().write(resolve(CORE_VCF), result.getExpandedAlignment(), voting);

        DistanceMatrixWriter.writeWide(resolve(DISTANCE_WIDE), result.getDistanceMatrix());
        DistanceMatrixWriter.writeLong(resolve(DISTANCE_LONG), result.getDistanceMatrix());
        SampleSummaryWriter.write(resolve(SUMMARY), result.getSummaries());
        if (result.isProgressive()) {
            CoreTrajectoryWriter.write(resolve(TRAJECTORY), result.getTrajectory());
        }
        writeConstantSites(resolve(CONSTANT_SITES), result.getConstantSiteComposition());
    }

    /**
     * A single line {@code A,C,G,T} of constant site counts.
     */
    static void writeConstantSites(final Path output, final long[] composition) {
        final String line = Arrays.stream(composition).mapToObj(Long::toString).collect(Collectors.joining(","));
        try {
            Files.write(output, Arrays.asList(line), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(output, e);
        }
        logger.info("Saved file -> " + output.getFileName() + ": " + StringUtils.join(Arrays.asList("A", "C", "G", "T"), ',') + " = " + line);
    }

    private Path resolve(final String name) {
        return outputDirectory.resolve(name);
    }
}
