package org.polycore.exceptions;

import java.io.File;
import java.nio.file.Path;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as non-existent or malformed files,
 * inconsistent ploidy or threshold values out of range.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException() {
        super();
    }

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(Path file) {
            super(String.format("Couldn't read file %s", file.toAbsolutePath().toUri()));
        }

        public CouldNotReadInputFile(Path file, String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message));
        }

        public CouldNotReadInputFile(Path file, String message, Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message), cause);
        }

        public CouldNotReadInputFile(Path path, Exception e) {
            this(path, getMessage(e), e);
        }
    }

    /**
     * <p/>
     * Class UserException.CouldNotCreateOutputFile
     * <p/>
     * For generic errors writing to output files
     */
    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(File file, String message) {
            super(String.format("Couldn't write file %s because %s", file.getAbsolutePath(), message));
        }

        public CouldNotCreateOutputFile(final Path file, final String message, final Exception e) {
            super(String.format("Couldn't write file %s because %s with exception %s", file.toAbsolutePath().toUri(), message, getMessage(e)), e);
        }

        public CouldNotCreateOutputFile(final Path file, final Exception e) {
            this(file, "an I/O error occurred", e);
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(String message) {
            super(String.format("Bad input: %s", message));
        }
    }

    /**
     * A sample whose allele copies can not be reconciled with a single ploidy, or an explicit ploidy that
     * contradicts the copy count found in the data.
     */
    public static class InvalidPloidy extends UserException {
        private static final long serialVersionUID = 0L;

        public InvalidPloidy(final String sampleId, final String message) {
            super(String.format("Invalid ploidy for sample %s: %s", sampleId, message));
        }

        public InvalidPloidy(final String sampleId, final int position, final String message) {
            super(String.format("Invalid ploidy for sample %s at position %d: %s", sampleId, position, message));
        }
    }

    public static class AlignmentLengthMismatch extends UserException {
        private static final long serialVersionUID = 0L;

        public AlignmentLengthMismatch(final String sampleId, final long length, final long expectedLength) {
            super(String.format("Sample length (%,d) of %s differs from the alignment length (%,d). " +
                    "Inputs must be aligned to the reference and have identical lengths.", length, sampleId, expectedLength));
        }
    }

    public static class EmptyAlignment extends UserException {
        private static final long serialVersionUID = 0L;

        public EmptyAlignment(final String message) {
            super(String.format("The alignment has no columns: %s", message));
        }
    }

    public static class ThresholdRange extends UserException {
        private static final long serialVersionUID = 0L;

        public ThresholdRange(final String thresholdName, final double value, final String expected) {
            super(String.format("Threshold %s has value %s but must be %s", thresholdName, value, expected));
        }
    }

    /**
     * Thrown when the pairwise distance computation can not fit a single useful chunk of columns into the
     * memory budget.
     */
    public static class InsufficientMemory extends UserException {
        private static final long serialVersionUID = 0L;

        public InsufficientMemory(final long availableBytes, final long requiredBytes, final int chunkWidth, final int minimumChunkWidth) {
            super(String.format("The memory budget of %,d bytes allows a chunk width of %d columns, below the minimum of %d " +
                            "(at least %,d bytes are needed). Reduce the number of samples or sites, " +
                            "or raise the budget with --memory-budget or the JVM -Xmx option.",
                    availableBytes, chunkWidth, minimumChunkWidth, requiredBytes));
        }
    }
}
