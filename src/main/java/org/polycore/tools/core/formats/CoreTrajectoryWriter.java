package org.polycore.tools.core.formats;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.polycore.exceptions.UserException;
import org.polycore.tools.core.CoreTrajectoryPoint;
import org.polycore.utils.tsv.SimpleXSVWriter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Writes the core fraction trajectory, the data behind a soft-core curve.
 */
public final class CoreTrajectoryWriter {
    private static final Logger logger = LogManager.getLogger(CoreTrajectoryWriter.class);

    public static final List<String> COLUMNS = Arrays.asList("k", "sample", "core_fraction", "core_sites");

    private CoreTrajectoryWriter() {}

    public static void write(final Path output, final List<CoreTrajectoryPoint> trajectory) {
        try (final SimpleXSVWriter writer = new SimpleXSVWriter(output, ',')) {
            writer.setHeaderLine(COLUMNS);
            for (final CoreTrajectoryPoint point : trajectory) {
                writer.getNewLineBuilder()
                        .setColumn("k", point.getK())
                        .setColumn("sample", point.getSampleId())
                        .setColumn("core_fraction", point.getCoreFraction())
                        .setColumn("core_sites", point.getCoreSites());
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(output, e);
        }
        if (!trajectory.isEmpty()) {
            logger.info(String.format("Saved file -> %s: core fraction from %s to %s",
                    output.getFileName(),
                    SimpleXSVWriter.formatDouble(trajectory.get(0).getCoreFraction()),
                    SimpleXSVWriter.formatDouble(trajectory.get(trajectory.size() - 1).getCoreFraction())));
        }
    }
}
