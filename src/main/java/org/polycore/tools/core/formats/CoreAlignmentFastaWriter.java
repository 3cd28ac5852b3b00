package org.polycore.tools.core.formats;

import htsjdk.samtools.reference.FastaReferenceWriter;
import htsjdk.samtools.reference.FastaReferenceWriterBuilder;
import htsjdk.samtools.reference.ReferenceSequence;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.polycore.exceptions.UserException;
import org.polycore.tools.core.ExpandedAlignment;
import org.polycore.utils.Nucleotide;
import org.polycore.utils.Utils;
import org.polycore.utils.param.ParamUtils;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes the expanded alignment restricted to a set of columns as FASTA, one record per genome, each sample
 * re-encoded as one IUPAC symbol per column.
 *
 * Symbols outside the IUPAC alphabet (gaps, '?') are written as N.
 */
public final class CoreAlignmentFastaWriter {
    private static final Logger logger = LogManager.getLogger(CoreAlignmentFastaWriter.class);

    private final int basesPerLine;

    public CoreAlignmentFastaWriter(final int basesPerLine) {
        this.basesPerLine = ParamUtils.isPositive(basesPerLine, "bases per line must be positive");
    }

    /**
     * @param samples sample indexes of the records, in output order
     * @param columns alignment columns to write
     * @return whether the file was written; nothing is written when there is no column
     */
    public boolean write(final Path output, final ExpandedAlignment alignment, final int[] samples, final int[] columns) {
        Utils.nonNull(output);
        Utils.nonNull(alignment);
        if (columns.length == 0) {
            logger.warn("No site to write, skipping " + output.getFileName());
            return false;
        }
        try (final FastaReferenceWriter writer = new FastaReferenceWriterBuilder()
                .setFastaFile(output)
                .setMakeFaiOutput(false)
                .setMakeDictOutput(false)
                .setBasesPerLine(basesPerLine)
                .build()) {
            for (int i = 0; i < samples.length; i++) {
                final String id = alignment.getCollapsedAlignment().getSample(samples[i]).getId();
                writer.addSequence(new ReferenceSequence(id, i, toFastaBases(alignment.sampleRow(samples[i], columns))));
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(output, e);
        }
        logger.info(String.format("Saved file -> %s (%d records, %,d sites)", output.getFileName(), samples.length, columns.length));
        return true;
    }

    static byte[] toFastaBases(final byte[] row) {
        for (int i = 0; i < row.length; i++) {
            if (Nucleotide.decode(row[i]) == Nucleotide.INVALID) {
                row[i] = Nucleotide.N.encodeAsByte();
            }
        }
        return row;
    }
}
