package org.polycore.tools.core.distance;

import org.polycore.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Symmetric sample x sample distances with a zero diagonal.
 */
public final class DistanceMatrix {
    private final List<String> sampleIds;
    private final DistanceCell[][] cells;

    DistanceMatrix(final List<String> sampleIds, final long[] differences, final int[] comparable, final long scale) {
        this.sampleIds = Collections.unmodifiableList(new ArrayList<>(sampleIds));
        final int n = sampleIds.size();
        this.cells = new DistanceCell[n][n];
        for (int i = 0; i < n; i++) {
            cells[i][i] = new DistanceCell(sampleIds.get(i), sampleIds.get(i), 0.0, 0.0, 0);
            for (int j = i + 1; j < n; j++) {
                final int pair = PairwiseAccumulator.pairIndex(i, j, n);
                final double diff = differences[pair] / (double) scale;
                final double distance = comparable[pair] == 0 ? Double.NaN : diff / comparable[pair];
                cells[i][j] = new DistanceCell(sampleIds.get(i), sampleIds.get(j), distance, diff, comparable[pair]);
                cells[j][i] = new DistanceCell(sampleIds.get(j), sampleIds.get(i), distance, diff, comparable[pair]);
            }
        }
    }

    /**
     * An empty matrix, for runs without voting samples.
     */
    public static DistanceMatrix empty() {
        return new DistanceMatrix(Collections.emptyList(), new long[0], new int[0], 1L);
    }

    public List<String> getSampleIds() {
        return sampleIds;
    }

    public int size() {
        return sampleIds.size();
    }

    public DistanceCell getCell(final int i, final int j) {
        return cells[Utils.validIndex(i, cells.length)][Utils.validIndex(j, cells.length)];
    }

    public double getDistance(final int i, final int j) {
        return getCell(i, j).getDistance();
    }

    /**
     * One row per sample, one distance per column, in sample order.
     */
    public List<double[]> toWide() {
        final List<double[]> rows = new ArrayList<>(cells.length);
        for (final DistanceCell[] row : cells) {
            final double[] values = new double[row.length];
            for (int j = 0; j < row.length; j++) {
                values[j] = row[j].getDistance();
            }
            rows.add(values);
        }
        return rows;
    }

    /**
     * The cells above the diagonal, row by row.
     */
    public List<DistanceCell> toLong() {
        final List<DistanceCell> pairs = new ArrayList<>();
        for (int i = 0; i < cells.length; i++) {
            for (int j = i + 1; j < cells.length; j++) {
                pairs.add(cells[i][j]);
            }
        }
        return pairs;
    }
}
