package org.polycore.tools.core.formats;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.polycore.exceptions.UserException;
import org.polycore.tools.core.SampleSummary;
import org.polycore.utils.tsv.SimpleXSVWriter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Writes one CSV line per loaded genome, the reference and low genome fraction samples included.
 */
public final class SampleSummaryWriter {
    private static final Logger logger = LogManager.getLogger(SampleSummaryWriter.class);

    public static final List<String> COLUMNS = Arrays.asList("name", "ploidy", "ploidy_source", "length", "missing",
            "genome_fraction", "core_fraction", "called_sites", "variant_sites", "status");

    private SampleSummaryWriter() {}

    public static void write(final Path output, final List<SampleSummary> summaries) {
        try (final SimpleXSVWriter writer = new SimpleXSVWriter(output, ',')) {
            writer.setHeaderLine(COLUMNS);
            for (final SampleSummary summary : summaries) {
                writer.getNewLineBuilder()
                        .setColumn("name", summary.getId())
                        .setColumn("ploidy", summary.getPloidy().getValue())
                        .setColumn("ploidy_source", summary.getPloidy().getSource().name())
                        .setColumn("length", summary.getLength())
                        .setColumn("missing", summary.getMissing())
                        .setColumn("genome_fraction", summary.getGenomeFraction())
                        .setColumn("core_fraction", summary.getCoreFraction())
                        .setColumn("called_sites", summary.getCalledSites())
                        .setColumn("variant_sites", summary.getVariantSites())
                        .setColumn("status", summary.getStatus().name());
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(output, e);
        }
        logger.info("Saved file -> " + output.getFileName());
    }
}
