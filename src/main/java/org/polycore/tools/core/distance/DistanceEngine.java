package org.polycore.tools.core.distance;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.math3.util.ArithmeticUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.polycore.exceptions.PolyCoreException;
import org.polycore.exceptions.UserException;
import org.polycore.tools.core.ExpandedAlignment;
import org.polycore.utils.Nucleotide;
import org.polycore.utils.Utils;
import org.polycore.utils.param.ParamUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Computes the pairwise distance matrix of a set of samples over a set of alignment columns.
 *
 * <p>A pair is compared at a column when both samples are called there with at least one non-missing copy. The
 * per-site differences of {@link CopyAggregation} are summed as integers in units of {@code 1 / lcm(1..p)^2},
 * p being the largest ploidy, so the result does not depend on how the columns are chunked or on the number of
 * threads. Columns are processed in chunks of whole columns; chunk results are merged in chunk order.</p>
 */
public final class DistanceEngine {
    private static final Logger logger = LogManager.getLogger(DistanceEngine.class);

    private final CopyAggregation aggregation;
    private final int threads;

    public DistanceEngine(final CopyAggregation aggregation, final int threads) {
        this.aggregation = Utils.nonNull(aggregation);
        this.threads = ParamUtils.isPositive(threads, "number of threads must be positive");
    }

    /**
     * @param alignment expanded alignment holding the samples
     * @param samples sample indexes of the matrix rows, in row order
     * @param columns alignment columns to compare over, ascending
     * @param chunkWidth number of columns per chunk
     * @throws UserException.BadInput if the exact sums could overflow or there are too many sample pairs
     */
    public DistanceMatrix compute(final ExpandedAlignment alignment, final int[] samples, final int[] columns,
                                  final int chunkWidth) {
        Utils.nonNull(alignment);
        Utils.nonNull(samples);
        Utils.nonNull(columns);
        ParamUtils.isPositive(chunkWidth, "chunk width must be positive");
        if (samples.length == 0) {
            return DistanceMatrix.empty();
        }
        if (PairwiseAccumulator.pairCount(samples.length) > PairwiseAccumulator.MAX_PAIRS) {
            throw new UserException.BadInput(String.format(
                    "%d samples give more sample pairs than a distance matrix can hold", samples.length));
        }

        final List<String> ids = new ArrayList<>(samples.length);
        int maxPloidy = 1;
        long totalCopies = 0;
        for (int i = 0; i < samples.length; i++) {
            ids.add(alignment.getCollapsedAlignment().getSample(samples[i]).getId());
            final int ploidy = alignment.getCollapsedAlignment().getSample(samples[i]).getPloidyValue();
            maxPloidy = Math.max(maxPloidy, ploidy);
            totalCopies += ploidy;
        }
        final long lcm = shareScale(maxPloidy, columns.length);

        final int chunks = (columns.length + chunkWidth - 1) / chunkWidth;
        logger.info(String.format("Computing %s distances between %d samples over %d sites in %d chunk(s) of up to %d sites",
                aggregation, samples.length, columns.length, chunks, chunkWidth));

        final PairwiseAccumulator total = new PairwiseAccumulator(samples.length);
        final ChunkContext context = new ChunkContext(alignment, samples, columns, (int) totalCopies, lcm);
        if (threads == 1 || chunks <= 1) {
            for (int chunk = 0; chunk < chunks; chunk++) {
                total.merge(context.process(chunk * chunkWidth, Math.min(columns.length, (chunk + 1) * chunkWidth)));
            }
        } else {
            computeInParallel(context, chunks, chunkWidth, total);
        }
        return new DistanceMatrix(ids, total.getDifferences(), total.getComparable(), lcm * lcm);
    }

    /**
     * Runs the chunks in waves of {@code threads}, so no more accumulators than that are alive at once.
     */
    private void computeInParallel(final ChunkContext context, final int chunks, final int chunkWidth,
                                   final PairwiseAccumulator total) {
        final ExecutorService executorService = Executors.newFixedThreadPool(threads, new ThreadFactoryBuilder()
                .setNameFormat("polycore-distance-%d")
                .setDaemon(true).build());
        try {
            for (int first = 0; first < chunks; first += threads) {
                final List<Future<PairwiseAccumulator>> futures = new ArrayList<>(threads);
                for (int chunk = first; chunk < Math.min(chunks, first + threads); chunk++) {
                    final int from = chunk * chunkWidth;
                    final int to = Math.min(context.columns.length, from + chunkWidth);
                    futures.add(executorService.submit(() -> context.process(from, to)));
                }
                for (final Future<PairwiseAccumulator> future : futures) {
                    total.merge(future.get());
                }
            }
        } catch (final ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new PolyCoreException("Distance computation failed", e.getCause());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PolyCoreException("Interrupted while computing distances", e);
        } finally {
            executorService.shutdownNow();
        }
    }

    /**
     * lcm(1..maxPloidy), after checking that a sum of {@code sites} differences scaled by its square fits a long.
     */
    static long shareScale(final int maxPloidy, final int sites) {
        try {
            long lcm = 1;
            for (int n = 2; n <= maxPloidy; n++) {
                lcm = ArithmeticUtils.lcm(lcm, n);
            }
            final long scale = Math.multiplyExact(lcm, lcm);
            Math.multiplyExact(scale, Math.max(1L, sites));
            return lcm;
        } catch (final ArithmeticException e) {
            // commons-math reports lcm overflow with a subclass of ArithmeticException
            throw new UserException.BadInput(String.format(
                    "exact distances over %d sites with ploidies up to %d do not fit in 64 bits", sites, maxPloidy));
        }
    }

    private final class ChunkContext {
        private final ExpandedAlignment alignment;
        private final int[] samples;
        private final int[] columns;
        private final int totalCopies;
        private final long lcm;

        private ChunkContext(final ExpandedAlignment alignment, final int[] samples, final int[] columns, final int totalCopies, final long lcm) {
            this.alignment = alignment;
            this.samples = samples;
            this.columns = columns;
            this.totalCopies = totalCopies;
            this.lcm = lcm;
        }

        private PairwiseAccumulator process(final int from, final int to) {
            logger.info(String.format("Processing sites %d-%d of %d", from + 1, to, columns.length));
            final int width = to - from;
            final int n = samples.length;
            final byte[] symbols = new byte[totalCopies * width];
            final byte[] counts = new byte[Nucleotide.NUMBER_OF_ALLELES * n * width];
            alignment.fillChunk(samples, columns, from, to, symbols, counts);

            final PairwiseAccumulator accumulator = new PairwiseAccumulator(n);
            final long[][] shares = new long[n][Nucleotide.NUMBER_OF_ALLELES];
            final boolean[] present = new boolean[n];
            for (int w = 0; w < width; w++) {
                for (int i = 0; i < n; i++) {
                    final int offset = (i * width + w) * Nucleotide.NUMBER_OF_ALLELES;
                    int copies = 0;
                    for (int a = 0; a < Nucleotide.NUMBER_OF_ALLELES; a++) {
                        copies += counts[offset + a];
                    }
                    present[i] = copies > 0;
                    if (present[i]) {
                        final long unit = lcm / copies;
                        for (int a = 0; a < Nucleotide.NUMBER_OF_ALLELES; a++) {
                            shares[i][a] = counts[offset + a] * unit;
                        }
                    }
                }
                for (int i = 0; i < n; i++) {
                    if (!present[i]) {
                        continue;
                    }
                    for (int j = i + 1; j < n; j++) {
                        if (present[j]) {
                            accumulator.add(i, j, aggregation.scaledDifference(shares[i], shares[j], lcm));
                        }
                    }
                }
            }
            return accumulator;
        }
    }
}
