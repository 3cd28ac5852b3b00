package org.polycore.tools.core.distance;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.polycore.exceptions.UserException;
import org.polycore.utils.Nucleotide;
import org.polycore.utils.Utils;
import org.polycore.utils.param.ParamUtils;

import java.util.OptionalLong;

/**
 * Decides how many alignment columns the distance computation loads at a time.
 *
 * <p>A column costs one byte per allele copy for the expanded symbols plus {@link Nucleotide#NUMBER_OF_ALLELES}
 * allele count bytes per sample. The pairwise accumulators of every chunk in flight ({@value #BYTES_PER_PAIR}
 * bytes per cell of the sample x sample grid) are reserved first; the rest of the budget is shared by the chunks in
 * flight and divided into columns.</p>
 */
public final class ChunkSizer {
    private static final Logger logger = LogManager.getLogger(ChunkSizer.class);

    /** A long difference sum and an int comparable count. */
    static final int BYTES_PER_PAIR = Long.BYTES + Integer.BYTES;

    private final MemoryBudgetProvider budgetProvider;
    private final int defaultWidth;
    private final int minViableWidth;
    private final Integer explicitWidth;

    /**
     * @param defaultWidth width used when the provider has no budget signal
     * @param minViableWidth smallest width worth computing with
     * @param explicitWidth width forced by the user, or {@code null} to size from the budget
     */
    public ChunkSizer(final MemoryBudgetProvider budgetProvider, final int defaultWidth, final int minViableWidth,
                      final Integer explicitWidth) {
        this.budgetProvider = Utils.nonNull(budgetProvider);
        this.defaultWidth = ParamUtils.isPositive(defaultWidth, "default chunk width must be positive");
        this.minViableWidth = ParamUtils.isPositive(minViableWidth, "minimum viable chunk width must be positive");
        if (explicitWidth != null) {
            ParamUtils.isPositive(explicitWidth, "chunk size must be positive");
        }
        this.explicitWidth = explicitWidth;
    }

    public static long bytesPerColumn(final int samples, final long totalCopies) {
        return totalCopies + (long) Nucleotide.NUMBER_OF_ALLELES * samples;
    }

    public static long reservedBytes(final int samples, final int threads) {
        return (long) samples * samples * BYTES_PER_PAIR * threads;
    }

    /**
     * @param samples number of samples in the matrix
     * @param totalCopies allele copies of those samples
     * @param sites number of columns to compute over
     * @param threads chunks processed concurrently
     * @return a width between 1 and {@code max(sites, 1)}
     * @throws UserException.InsufficientMemory if the budget does not reach the minimum viable width
     */
    public int chunkWidth(final int samples, final long totalCopies, final int sites, final int threads) {
        ParamUtils.isPositive(threads, "threads must be positive");
        final int cap = Math.max(sites, 1);
        if (explicitWidth != null) {
            return Math.min(explicitWidth, cap);
        }
        final OptionalLong available = budgetProvider.getAvailableBytes();
        if (!available.isPresent()) {
            logger.debug("No memory budget signal, using the default chunk width " + defaultWidth);
            return Math.min(defaultWidth, cap);
        }
        final long perColumn = Math.max(1L, bytesPerColumn(samples, totalCopies));
        final long reserved = reservedBytes(samples, threads);
        final long width = Math.max(0L, available.getAsLong() - reserved) / (perColumn * threads);
        if (width < minViableWidth) {
            throw new UserException.InsufficientMemory(available.getAsLong(), reserved + minViableWidth * perColumn * threads,
                    (int) width, minViableWidth);
        }
        final int chosen = (int) Math.min(width, cap);
        logger.debug(String.format("Memory budget %,d bytes, %,d reserved, %,d bytes per column: chunk width %d",
                available.getAsLong(), reserved, perColumn, chosen));
        return chosen;
    }
}
