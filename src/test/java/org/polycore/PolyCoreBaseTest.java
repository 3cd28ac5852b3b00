package org.polycore;

import org.polycore.cmdline.argumentcollections.CoreGenomeArgumentCollection;
import org.polycore.testutils.BaseTest;
import org.polycore.tools.core.PloidyResolver;
import org.polycore.tools.core.Sample;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Base class for PolyCore tests: in-memory samples and temporary FASTA fixtures.
 */
public abstract class PolyCoreBaseTest extends BaseTest {

    public static final String TEST_CONTIG = "chr1";

    private static final String[][] GENOTYPE_CODES = {
            {"A", "C", "G", "T"},
            {"R", "Y", "S", "W", "K", "M"},
            {"B", "D", "H", "V"}
    };

    public static Sample reference(final String sequence) {
        return PloidyResolver.resolveReference("Reference", bytes(sequence), TEST_CONTIG);
    }

    /**
     * A sample read from a single IUPAC encoded sequence.
     */
    public static Sample unphased(final String id, final String sequence) {
        return PloidyResolver.resolve(id, Collections.singletonList(bytes(sequence)), null, id);
    }

    /**
     * A sample read from one sequence per allele copy.
     */
    public static Sample phased(final String id, final String... copies) {
        final List<byte[]> strands = new ArrayList<>(copies.length);
        for (final String copy : copies) {
            strands.add(bytes(copy));
        }
        return PloidyResolver.resolve(id, strands, null, id);
    }

    public static byte[] bytes(final String sequence) {
        return sequence.getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Writes a FASTA file with one record per sequence, named rec1, rec2, ...
     */
    public static Path writeFasta(final Path directory, final String fileName, final String... sequences) {
        final List<String> lines = new ArrayList<>(2 * sequences.length);
        for (int i = 0; i < sequences.length; i++) {
            lines.add(">rec" + (i + 1) + " test record");
            lines.add(sequences[i]);
        }
        try {
            return Files.write(directory.resolve(fileName), lines, StandardCharsets.US_ASCII);
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static CoreGenomeArgumentCollection arguments(final double minGf, final double minCf, final double minPf, final int minPn) {
        final CoreGenomeArgumentCollection arguments = new CoreGenomeArgumentCollection();
        arguments.minGenomeFraction = minGf;
        arguments.minCoreFraction = minCf;
        arguments.minAlleleFraction = minPf;
        arguments.minAlleleSamples = minPn;
        return arguments;
    }

    /**
     * A random unphased sequence of the given ploidy: standard bases, genotype codes of exactly that ploidy, and N
     * with probability {@code missingRate}. The first symbol is always a genotype code so the ploidy is detected.
     */
    public static String randomSequence(final Random random, final int length, final int ploidy, final double missingRate) {
        final StringBuilder sequence = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            if (i == 0 && ploidy > 1) {
                sequence.append(pick(random, GENOTYPE_CODES[ploidy - 1]));
            } else if (random.nextDouble() < missingRate) {
                sequence.append('N');
            } else if (ploidy > 1 && random.nextBoolean()) {
                sequence.append(pick(random, GENOTYPE_CODES[ploidy - 1]));
            } else {
                sequence.append(pick(random, GENOTYPE_CODES[0]));
            }
        }
        return sequence.toString();
    }

    /**
     * Random samples of ploidy 1 to 3, named s0, s1, ...; every third sample is a copy of the previous one so
     * that some sequences collapse.
     */
    public static List<Sample> randomSamples(final Random random, final int count, final int length, final double missingRate) {
        final List<Sample> samples = new ArrayList<>(count);
        String previous = null;
        for (int i = 0; i < count; i++) {
            final String sequence = previous != null && i % 3 == 2
                    ? previous
                    : randomSequence(random, length, 1 + random.nextInt(3), missingRate);
            samples.add(unphased("s" + i, sequence));
            previous = sequence;
        }
        return samples;
    }

    public static List<Sample> withReference(final Sample reference, final List<Sample> samples) {
        final List<Sample> all = new ArrayList<>(samples.size() + 1);
        all.add(reference);
        all.addAll(samples);
        return all;
    }

    public static List<Sample> withReference(final Sample reference, final Sample... samples) {
        return withReference(reference, Arrays.asList(samples));
    }

    private static String pick(final Random random, final String[] choices) {
        return choices[random.nextInt(choices.length)];
    }
}
