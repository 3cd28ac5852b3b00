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
 * Infers or validates the ploidy of a sample from its raw sequences and turns them into allele copies.
 *
 * <p>A sample given as several strands is phased: each strand is one allele copy, the ploidy is the strand count
 * and every symbol must be a standard base or a missing symbol. A sample given as a single strand is unphased:
 * the ploidy is the size of the largest IUPAC ambiguity code found (1 if there is none) and each code of that size
 * is split into one base per copy in A, C, G, T order. An ambiguity code with fewer bases than the ploidy does not
 * say which base is carried by the extra copies, so it is rejected.</p>
 *
 * <p>Symbols are upper-cased and U is read as T. Everything other than standard bases and two or three base
 * ambiguity codes is a missing symbol and is kept byte for byte in every copy.</p>
 */
public final class PloidyResolver {
    private static final Logger logger = LogManager.getLogger(PloidyResolver.class);

    private PloidyResolver() {}

    /**
     * @param sampleId identifier used in error messages
     * @param strands  raw sequences of the sample, one per input record in phased mode or a single one otherwise
     * @param override explicit ploidy, or {@code null} to detect it
     * @param contig   name of the first input record
     * @return the sample with its resolved ploidy and decoded allele copies
     * @throws UserException.InvalidPloidy if the copies can not be reconciled with a single ploidy
     * @throws UserException.AlignmentLengthMismatch if phased strands differ in length
     */
    public static Sample resolve(final String sampleId, final List<byte[]> strands, final Integer override, final String contig) {
        Utils.nonNull(sampleId);
        Utils.nonEmpty(strands, "no sequence for sample " + sampleId);
        if (override != null && (override < 1 || override > Ploidy.MAX_PLOIDY)) {
            throw new UserException.InvalidPloidy(sampleId, String.format(
                    "the ploidy must be between 1 and %d but %d was given", Ploidy.MAX_PLOIDY, override));
        }
        final Sample sample = strands.size() > 1
                ? resolvePhased(sampleId, strands, override, contig)
                : resolveUnphased(sampleId, strands.get(0), override, contig);
        logger.debug(String.format("Sample %s resolved to ploidy %s", sampleId, sample.getPloidy()));
        return sample;
    }

    /**
     * The reference is haploid by definition; its symbols are normalized but never decoded, so an ambiguous
     * reference column stays visible to the classifier.
     */
    public static Sample resolveReference(final String referenceId, final byte[] strand, final String contig) {
        Utils.nonNull(strand);
        return new Sample(referenceId, contig, Ploidy.fixed(1), Collections.singletonList(normalize(strand)), false, true);
    }

    private static Sample resolvePhased(final String sampleId, final List<byte[]> strands, final Integer override, final String contig) {
        final int count = strands.size();
        if (count > Ploidy.MAX_PLOIDY) {
            throw new UserException.InvalidPloidy(sampleId, String.format(
                    "%d phased copies found in the input but at most %d are supported", count, Ploidy.MAX_PLOIDY));
        }
        if (override != null && override != count) {
            throw new UserException.InvalidPloidy(sampleId, String.format(
                    "the explicit ploidy %d conflicts with the %d phased copies found in the input", override, count));
        }
        final int length = strands.get(0).length;
        final List<byte[]> copies = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            final byte[] copy = normalize(strands.get(i));
            if (copy.length != length) {
                throw new UserException.AlignmentLengthMismatch(sampleId + " copy " + (i + 1), copy.length, length);
            }
            for (int position = 0; position < copy.length; position++) {
                if (Nucleotide.decode(copy[position]).isGenotypeCode()) {
                    throw new UserException.InvalidPloidy(sampleId, position + 1, String.format(
                            "ambiguity code %s in phased copy %d, each phased copy must carry a single allele",
                            (char) copy[position], i + 1));
                }
            }
            copies.add(copy);
        }
        final Ploidy ploidy = override != null ? Ploidy.override(count) : Ploidy.detected(count);
        return new Sample(sampleId, contig, ploidy, copies, true, false);
    }

    private static Sample resolveUnphased(final String sampleId, final byte[] strand, final Integer override, final String contig) {
        final byte[] symbols = normalize(strand);
        final int detected = largestAmbiguitySize(symbols);
        if (override != null && override < detected) {
            throw new UserException.InvalidPloidy(sampleId, String.format(
                    "the explicit ploidy %d conflicts with the detected copy count %d", override, detected));
        }
        final int ploidy = override != null ? override : detected;

        final byte[][] copies = new byte[ploidy][symbols.length];
        for (int position = 0; position < symbols.length; position++) {
            final byte symbol = symbols[position];
            final Nucleotide code = Nucleotide.decode(symbol);
            if (code.isGenotypeCode()) {
                if (code.size() != ploidy) {
                    throw new UserException.InvalidPloidy(sampleId, position + 1, String.format(
                            "ambiguity code %s stands for %d alleles but the ploidy is %d, the allele dosage can not be determined",
                            (char) symbol, code.size(), ploidy));
                }
                final List<Nucleotide> bases = code.standardBases();
                for (int copy = 0; copy < ploidy; copy++) {
                    copies[copy][position] = bases.get(copy).encodeAsByte();
                }
            } else {
                for (int copy = 0; copy < ploidy; copy++) {
                    copies[copy][position] = symbol;
                }
            }
        }
        final List<byte[]> copyList = new ArrayList<>(ploidy);
        Collections.addAll(copyList, copies);
        return new Sample(sampleId, contig, override != null ? Ploidy.override(ploidy) : Ploidy.detected(ploidy),
                copyList, false, false);
    }

    /**
     * Size of the largest two or three base ambiguity code in the sequence, 1 if there is none.
     */
    static int largestAmbiguitySize(final byte[] symbols) {
        int largest = 1;
        for (final byte symbol : symbols) {
            final Nucleotide code = Nucleotide.decode(symbol);
            if (code.isGenotypeCode() && code.size() > largest) {
                largest = code.size();
            }
        }
        return largest;
    }

    /**
     * Upper-cases letters and reads U as T; other bytes are kept as they are.
     */
    static byte[] normalize(final byte[] strand) {
        final byte[] result = new byte[strand.length];
        for (int i = 0; i < strand.length; i++) {
            byte b = strand[i];
            if (b >= 'a' && b <= 'z') {
                b = (byte) (b - ('a' - 'A'));
            }
            result[i] = b == 'U' ? (byte) 'T' : b;
        }
        return result;
    }
}
