package org.polycore.utils.tsv;

import com.opencsv.CSVWriter;
import org.polycore.exceptions.PolyCoreException;
import org.polycore.utils.Utils;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A simple CSV/TSV writer with a configurable delimiter, used for every tabular PolyCore output.
 *
 * First call {@link #setHeaderLine} with the column names, which fixes the number of columns per line and indexes
 * the header. Then call {@link #getNewLineBuilder} for each line and fill its columns by index or heading. A line
 * is validated and written when {@link LineBuilder#write()} is called, when the next line is requested, or when
 * the writer is closed.
 *
 * Fields are never quoted; none of the values PolyCore writes contain the separator.
 */
public class SimpleXSVWriter implements Closeable {
    private int expectedNumColumns;
    private Map<String, Integer> headerMap = null;
    private final CSVWriter outputWriter;

    // The current incomplete line in the writer.
    private LineBuilder currentLineBuilder = null;

    /**
     * @param path         the destination path
     * @param separator    separator to use for the XSV file
     * @throws IOException if one was raised when opening the destination file for writing.
     */
    public SimpleXSVWriter(final Path path, final char separator) throws IOException {
        this(Files.newBufferedWriter(Utils.nonNull(path, "The path cannot be null."), StandardCharsets.UTF_8), separator);
    }

    public SimpleXSVWriter(final Writer writer, final char separator) {
        Utils.validate(separator!='\n', "Column separator cannot be a newline character");
        outputWriter = new CSVWriter(Utils.nonNull(writer), separator, CSVWriter.NO_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER, CSVWriter.DEFAULT_LINE_END);
    }

    /**
     * Provides the single header line of the output. Column names must be unique.
     *
     * @param columns Ordered list of header lines to be built into the XSV
     */
    public void setHeaderLine(final List<String> columns) {
        if (headerMap != null) {
            throw new PolyCoreException("Cannot modify header line once set");
        }
        Utils.nonEmpty(columns, "header columns");
        outputWriter.writeNext(columns.toArray(new String[0]), false);
        expectedNumColumns = columns.size();

        headerMap = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            Utils.nonNull(columns.get(i), "Provided header had null column at position: " + i);
            if (headerMap.putIfAbsent(columns.get(i), i) != null) {
                throw new PolyCoreException("Column names must be unique, but found a duplicate name: " + columns.get(i));
            }
        }
    }

    private void writeLine(final String[] line) {
        outputWriter.writeNext(line, false);
        currentLineBuilder = null;
    }

    /**
     * Builds a new LineBuilder and writes out the previous line if it exists.
     *
     * @return a blank LineBuilder to allow for defining the next line
     */
    public LineBuilder getNewLineBuilder() {
        if (headerMap == null) {
            throw new PolyCoreException("Cannot construct line without first setting the header line");
        }
        if (currentLineBuilder != null) {
            currentLineBuilder.write();
        }
        currentLineBuilder = new LineBuilder(expectedNumColumns);
        return currentLineBuilder;
    }

    /**
     * @param column header line to get index for
     * @return zero based index corresponding to that header string, throws an exception if the headerline doesn't exist
     */
    public int getIndexForColumn(final String column) {
        Utils.nonNull(headerMap, "Cannot request column index if the header has not been specified");
        final Integer index = headerMap.get(column);
        Utils.nonNull(index, "Requested column " + column + " does not exist in the provided header");
        return index;
    }

    @Override
    public void close() throws IOException {
        if (currentLineBuilder != null) {
            currentLineBuilder.write();
        }
        outputWriter.close();
    }

    /**
     * Incremental construction of a body line using either indexes or column headings.
     * Writing validates that every column has been set; {@link #fill} provides a default for the rest.
     */
    public class LineBuilder {
        private final String[] lineToBuild;
        private boolean hasBuilt = false;

        LineBuilder(final int lineLength) {
            lineToBuild = new String[lineLength];
        }

        public LineBuilder setRow(final List<String> row) {
            checkAlterationAfterWrite();
            Utils.validate(row.size() == lineToBuild.length, "Provided line must have the correct number of columns");
            for (int i = 0; i < row.size(); i++) {
                lineToBuild[i] = row.get(i);
            }
            return this;
        }

        public LineBuilder setColumn(final int index, final String value) {
            checkAlterationAfterWrite();
            lineToBuild[index] = value;
            return this;
        }

        public LineBuilder setColumn(final String heading, final String value) {
            return setColumn(getIndexForColumn(heading), value);
        }

        public LineBuilder setColumn(final String heading, final long value) {
            return setColumn(heading, Long.toString(value));
        }

        /**
         * Sets a fractional column; {@code NaN} is written as an empty cell.
         */
        public LineBuilder setColumn(final String heading, final double value) {
            return setColumn(heading, formatDouble(value));
        }

        /**
         * Fills in every empty column of the pending line with the provided value
         */
        public LineBuilder fill(final String filling) {
            checkAlterationAfterWrite();
            for (int i = 0; i < lineToBuild.length; i++) {
                if (lineToBuild[i] == null) {
                    lineToBuild[i] = filling;
                }
            }
            return this;
        }

        /**
         * Constructs the line and writes it out to the output
         */
        public void write() {
            Utils.validate(Arrays.stream(lineToBuild).noneMatch(Objects::isNull), () -> "Attempted to construct an incomplete line, make sure all columns are filled: " + Arrays.toString(lineToBuild));
            writeLine(lineToBuild);
            hasBuilt = true;
        }

        private void checkAlterationAfterWrite() {
            Utils.validate(!hasBuilt, "Cannot make alterations to an already written out CSV line");
        }
    }

    /**
     * Formats a fraction with up to six decimals, trailing zeros removed; {@code NaN} becomes the empty string.
     */
    public static String formatDouble(final double value) {
        if (Double.isNaN(value)) {
            return "";
        }
        final String formatted = String.format(Locale.US, "%.6f", value);
        int end = formatted.length();
        while (formatted.charAt(end - 1) == '0') {
            end--;
        }
        if (formatted.charAt(end - 1) == '.') {
            end--;
        }
        return formatted.substring(0, end);
    }
}
