package org.polycore.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Represents the nucleotide alphabet with support for IUPAC ambiguity codes.
 *
 * <p>
 *    Only the standard bases {@link #A}, {@link #C}, {@link #G} and {@link #T} are callable alleles.
 *    Two and three base ambiguity codes ({@link #R}, {@link #Y}, {@link #S}, {@link #W}, {@link #K},
 *    {@link #M}, {@link #B}, {@link #D}, {@link #H}, {@link #V}) describe an unphased genotype of a
 *    polyploid sample. {@link #N}, {@link #X} and anything that is not a nucleotide code (gaps such as
 *    {@code '-'} or {@code '?'}) are missing calls.
 * </p>
 *
 * <p>
 *     The allele rank of a standard base is its position in {@link #STANDARD_BASES}; ties between alleles
 *     are always broken towards the lowest rank.
 * </p>
 * <p>
 *     Uracil and Thymine are considered equivalent in this enum with {@link #T} as the canonical name.
 * </p>
 */
public enum Nucleotide {

    // Standard nucleotide codes,
    // and their one-bit-encoding masks CODE(0bTGCA):
    A(0b0001),
    C(0b0010),
    G(0b0100),
    T(0b1000),

    // Extended codes:
    // CODE(included nucs)
    R(A, G), // Purines.
    Y(C, T), // Pyrimidines.
    S(C, G), // Strong nucleotides.
    W(A, T), // Weak nucleotides.
    K(G, T), // Keto nucleotides.
    M(A, C), // Amino nucleotides.
    // "all-except-one" codes:
    B(C, G, T), // Not-A
    D(A, G, T), // Not-C
    H(A, C, T), // Not-G
    V(A, C, G), // Not-T
    // Any
    N(A, C, G, T),

    // And X/invalid-call:
    X();

    public static final Nucleotide U = T;

    public static final Nucleotide INVALID = X;

    /**
     * Number of callable alleles.
     */
    public static final int NUMBER_OF_ALLELES = 4;

    /**
     * List of the standard (non-redundant) nucleotide values in their allele rank order.
     */
    public static final List<Nucleotide> STANDARD_BASES = Collections.unmodifiableList(Arrays.asList(A, C, G, T));

    /**
     * Values indexed by their unsigned byte encodings. Non-valid encodings point to {@link #INVALID}.
     */
    private static final Nucleotide[] baseToValue;

    /**
     * Values indexed by their mask.
     */
    private static final Nucleotide[] maskToValue;

    /**
     * Allele rank indexed by unsigned byte encoding, -1 for anything but an upper-case standard base.
     */
    private static final int[] baseToRank;

    static {
        baseToValue = new Nucleotide[1 << Byte.SIZE];
        maskToValue = new Nucleotide[1 << NUMBER_OF_ALLELES];
        baseToRank = new int[1 << Byte.SIZE];
        Arrays.fill(baseToValue, INVALID);
        Arrays.fill(baseToRank, -1);
        for (final Nucleotide nucleotide : values()) {
            final int lowerCaseIndex = Character.toLowerCase(nucleotide.upperCaseByteEncoding) & 0xFF;
            final int upperCaseIndex = nucleotide.upperCaseByteEncoding & 0xFF;
            maskToValue[nucleotide.mask] = nucleotide;
            baseToValue[lowerCaseIndex] = baseToValue[upperCaseIndex] = nucleotide;
        }
        baseToValue['u' & 0xFF] = baseToValue['U' & 0xFF] = U;
        for (int rank = 0; rank < NUMBER_OF_ALLELES; rank++) {
            baseToRank[STANDARD_BASES.get(rank).upperCaseByteEncoding & 0xFF] = rank;
        }
    }

    private final int mask;
    private final int size;
    private final byte upperCaseByteEncoding;

    Nucleotide(final int mask) {
        this.mask = mask;
        this.size = Integer.bitCount(mask);
        upperCaseByteEncoding = (byte) Character.toUpperCase(name().charAt(0));
    }

    Nucleotide(final Nucleotide ... nucs) {
        this(Arrays.stream(nucs).mapToInt(nuc -> nuc.mask).reduce((a, b) -> a | b).orElse(0));
    }

    /**
     * Returns this nucleotide's exclusive upper-case {@code byte} encoding.
     */
    public byte encodeAsByte() {
        return upperCaseByteEncoding;
    }

    public char encodeAsChar() {
        return (char) upperCaseByteEncoding;
    }

    /**
     * Returns the nucleotide that corresponds to a particular {@code byte} typed base code.
     * @param base the query base code.
     * @return never {@code null}, but {@link #INVALID} if the base code does not
     * correspond to a valid nucleotide specification.
     */
    public static Nucleotide decode(final byte base) {
        return baseToValue[base & 0xFF];
    }

    public static Nucleotide decode(final char ch) {
        if ((ch & 0xFF00) != 0) {
            return INVALID;
        } else {
            return baseToValue[ch & 0xFF];
        }
    }

    /**
     * Returns the code that includes exactly the standard bases in the given mask (bit i is the base of rank i).
     */
    public static Nucleotide fromMask(final int mask) {
        Utils.validateArg(mask >= 0 && mask < maskToValue.length, () -> "invalid nucleotide mask " + mask);
        return maskToValue[mask];
    }

    public static Nucleotide fromRank(final int rank) {
        return STANDARD_BASES.get(Utils.validIndex(rank, NUMBER_OF_ALLELES));
    }

    /**
     * Allele rank of an upper-case standard base (A=0, C=1, G=2, T=3) or -1 if the byte is not callable.
     */
    public static int rank(final byte base) {
        return baseToRank[base & 0xFF];
    }

    /**
     * Whether the byte is a callable allele, i.e. an upper-case standard base.
     */
    public static boolean isCallable(final byte base) {
        return baseToRank[base & 0xFF] >= 0;
    }

    /**
     * @return {@code true} iff this is a concrete nucleotide.
     */
    public boolean isStandard() {
        return size == 1;
    }

    /**
     * Whether this code stands for an unphased genotype of two or three distinct bases.
     * {@link #N} carries no genotype information and is not a genotype code.
     */
    public boolean isGenotypeCode() {
        return size == 2 || size == 3;
    }

    /**
     * Whether this code is a missing call at an allele copy: neither a standard base nor a genotype code.
     */
    public boolean isMissing() {
        return !isStandard() && !isGenotypeCode();
    }

    /**
     * Number of distinct standard bases this code stands for (0 for {@link #X}).
     */
    public int size() {
        return size;
    }

    public int mask() {
        return mask;
    }

    /**
     * The standard bases included in this code, in allele rank order.
     */
    public List<Nucleotide> standardBases() {
        final List<Nucleotide> result = new ArrayList<>(size);
        for (final Nucleotide base : STANDARD_BASES) {
            if ((mask & base.mask) != 0) {
                result.add(base);
            }
        }
        return result;
    }
}
