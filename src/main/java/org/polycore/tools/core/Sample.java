package org.polycore.tools.core;

import org.polycore.utils.Nucleotide;
import org.polycore.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An aligned input genome: its identifier, its ploidy and one sequence per allele copy.
 *
 * <p>Copy sequences of a regular sample hold upper-case standard bases or missing symbols only; the reference copy
 * keeps its symbols as loaded, ambiguity codes included. All copies share the alignment length.
 * Instances are read-only after construction; the copy arrays are shared and must not be modified.</p>
 */
public final class Sample {
    private final String id;
    private final String contig;
    private final Ploidy ploidy;
    private final List<byte[]> copies;
    private final boolean phased;
    private final boolean reference;
    private final int length;

    public Sample(final String id, final String contig, final Ploidy ploidy, final List<byte[]> copies,
                  final boolean phased, final boolean reference) {
        this.id = Utils.nonEmpty(id, "sample id");
        this.contig = contig == null ? id : contig;
        this.ploidy = Utils.nonNull(ploidy);
        Utils.nonEmpty(copies, "sample " + id + " has no allele copies");
        Utils.validateArg(copies.size() == ploidy.getValue(),
                () -> String.format("sample %s has %d copies but ploidy %s", id, copies.size(), ploidy));
        this.length = copies.get(0).length;
        for (final byte[] copy : copies) {
            Utils.validateArg(copy.length == length, () -> "allele copies of sample " + id + " differ in length");
        }
        this.copies = Collections.unmodifiableList(new ArrayList<>(copies));
        this.phased = phased;
        this.reference = reference;
    }

    public String getId() {
        return id;
    }

    /**
     * Name of the first input record, used as the contig name when this sample is the reference.
     */
    public String getContig() {
        return contig;
    }

    public Ploidy getPloidy() {
        return ploidy;
    }

    public int getPloidyValue() {
        return ploidy.getValue();
    }

    public List<byte[]> getCopies() {
        return copies;
    }

    public byte[] getCopy(final int copyIndex) {
        return copies.get(Utils.validIndex(copyIndex, copies.size()));
    }

    /**
     * Whether each copy came from its own input record, as opposed to being decoded from IUPAC genotypes.
     */
    public boolean isPhased() {
        return phased;
    }

    public boolean isReference() {
        return reference;
    }

    public int length() {
        return length;
    }

    /**
     * Number of (copy, column) cells that do not hold a callable base.
     */
    public long countMissing() {
        long missing = 0;
        for (final byte[] copy : copies) {
            for (final byte b : copy) {
                if (!Nucleotide.isCallable(b)) {
                    missing++;
                }
            }
        }
        return missing;
    }

    @Override
    public String toString() {
        return id + " (ploidy " + ploidy + ", " + length + " columns)";
    }
}
