package org.polycore.tools.core.formats;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.reference.FastaSequenceFile;
import htsjdk.samtools.reference.ReferenceSequence;
import htsjdk.samtools.reference.ReferenceSequenceFileFactory;
import htsjdk.samtools.util.CloserUtil;
import org.apache.commons.io.FilenameUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.polycore.exceptions.UserException;
import org.polycore.tools.core.PloidyResolver;
import org.polycore.tools.core.Sample;
import org.polycore.utils.Utils;

import java.io.ByteArrayOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the reference and the samples from FASTA files, one file per genome.
 *
 * <p>Unphased (default): the records of a file are concatenated into one sequence, so multi-contig assemblies
 * load as a single genome. Phased: every record of a sample file is one allele copy. The reference is always read
 * as one concatenated haploid sequence. Sample ids are the file names without their last extension.</p>
 */
public final class FastaSampleLoader {
    private static final Logger logger = LogManager.getLogger(FastaSampleLoader.class);

    public static final String REFERENCE_ID = "Reference";

    private final boolean phased;
    private final Integer ploidy;

    /**
     * @param phased whether each record of a sample file is an allele copy
     * @param ploidy ploidy of every sample, or {@code null} to detect it
     */
    public FastaSampleLoader(final boolean phased, final Integer ploidy) {
        this.phased = phased;
        this.ploidy = ploidy;
    }

    public Sample loadReference(final Path path) {
        final List<ReferenceSequence> records = readRecords(path);
        final Sample reference = PloidyResolver.resolveReference(REFERENCE_ID, concatenate(records), records.get(0).getName());
        logger.info(String.format("Loaded reference %s: %d record(s), %,d bp", path.getFileName(), records.size(), reference.length()));
        return reference;
    }

    /**
     * Loads every sample, checking that each has the alignment length.
     *
     * @param expectedLength length of the reference
     * @throws UserException.AlignmentLengthMismatch if a sample differs in length from the reference
     */
    public List<Sample> loadSamples(final List<Path> paths, final int expectedLength) {
        Utils.nonNull(paths);
        final List<Sample> samples = new ArrayList<>(paths.size());
        for (int i = 0; i < paths.size(); i++) {
            final Sample sample = loadSample(paths.get(i));
            if (sample.length() != expectedLength) {
                throw new UserException.AlignmentLengthMismatch(sample.getId(), sample.length(), expectedLength);
            }
            logger.info(String.format("  %d/%d: %s (ploidy %s, %,d bp)", i + 1, paths.size(), sample.getId(),
                    sample.getPloidy(), sample.length()));
            samples.add(sample);
        }
        logger.info("Loaded " + samples.size() + " samples");
        return samples;
    }

    public Sample loadSample(final Path path) {
        final List<ReferenceSequence> records = readRecords(path);
        final String id = sampleId(path);
        final List<byte[]> strands = new ArrayList<>(records.size());
        if (phased) {
            for (final ReferenceSequence record : records) {
                strands.add(record.getBases());
            }
        } else {
            strands.add(concatenate(records));
        }
        return PloidyResolver.resolve(id, strands, ploidy, records.get(0).getName());
    }

    public static String sampleId(final Path path) {
        return FilenameUtils.getBaseName(path.getFileName().toString());
    }

    /**
     * @throws UserException.CouldNotReadInputFile if the file is missing, is not FASTA or lacks a FASTA extension
     * @throws UserException.BadInput if the file holds no record
     */
    static List<ReferenceSequence> readRecords(final Path path) {
        Utils.nonNull(path);
        if (!Files.isReadable(path)) {
            throw new UserException.CouldNotReadInputFile(path, "the file does not exist or is not readable");
        }
        final List<ReferenceSequence> records = new ArrayList<>();
        FastaSequenceFile fasta = null;
        try {
            fasta = new FastaSequenceFile(path, true);
            for (ReferenceSequence record = fasta.nextSequence(); record != null; record = fasta.nextSequence()) {
                records.add(record);
            }
        } catch (final SAMException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        } catch (final IllegalArgumentException e) {
            // htsjdk only opens files with a known FASTA extension
            throw new UserException.CouldNotReadInputFile(path, "not a FASTA file name, expected one of " + ReferenceSequenceFileFactory.FASTA_EXTENSIONS, e);
        } finally {
            CloserUtil.close(fasta);
        }
        if (records.isEmpty()) {
            throw new UserException.BadInput("no FASTA record in " + path);
        }
        return records;
    }

    private static byte[] concatenate(final List<ReferenceSequence> records) {
        if (records.size() == 1) {
            return records.get(0).getBases();
        }
        final ByteArrayOutputStream bases = new ByteArrayOutputStream();
        for (final ReferenceSequence record : records) {
            bases.write(record.getBases(), 0, record.getBases().length);
        }
        return bases.toByteArray();
    }
}
