package org.polycore.tools.core.formats;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.polycore.exceptions.UserException;
import org.polycore.tools.core.distance.DistanceCell;
import org.polycore.tools.core.distance.DistanceMatrix;
import org.polycore.utils.tsv.SimpleXSVWriter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Writes a {@link DistanceMatrix} as CSV, either as a sample x sample grid or as one line per pair.
 * Undefined distances are written as empty cells.
 */
public final class DistanceMatrixWriter {
    private static final Logger logger = LogManager.getLogger(DistanceMatrixWriter.class);

    public static final String NAME_COLUMN = "name";
    public static final List<String> LONG_COLUMNS = Arrays.asList("sample1", "sample2", "distance", "differences", "comparable_sites");

    private DistanceMatrixWriter() {}

    public static void writeWide(final Path output, final DistanceMatrix matrix) {
        final List<String> header = new ArrayList<>(matrix.size() + 1);
        header.add(NAME_COLUMN);
        header.addAll(matrix.getSampleIds());
        try (final SimpleXSVWriter writer = new SimpleXSVWriter(output, ',')) {
            writer.setHeaderLine(header);
            final List<double[]> rows = matrix.toWide();
            for (int i = 0; i < rows.size(); i++) {
                final SimpleXSVWriter.LineBuilder line = writer.getNewLineBuilder().setColumn(0, matrix.getSampleIds().get(i));
                for (int j = 0; j < rows.get(i).length; j++) {
                    line.setColumn(j + 1, SimpleXSVWriter.formatDouble(rows.get(i)[j]));
                }
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(output, e);
        }
        logger.info("Saved file -> " + output.getFileName());
    }

    public static void writeLong(final Path output, final DistanceMatrix matrix) {
        final List<DistanceCell> pairs = matrix.toLong();
        try (final SimpleXSVWriter writer = new SimpleXSVWriter(output, ',')) {
            writer.setHeaderLine(LONG_COLUMNS);
            for (final DistanceCell cell : pairs) {
                writer.getNewLineBuilder()
                        .setColumn("sample1", cell.getSample1())
                        .setColumn("sample2", cell.getSample2())
                        .setColumn("distance", cell.getDistance())
                        .setColumn("differences", cell.getDifferences())
                        .setColumn("comparable_sites", cell.getComparableSites());
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(output, e);
        }
        logger.info(String.format("Saved file -> %s (%d pairwise comparisons)", output.getFileName(), pairs.size()));
    }
}
